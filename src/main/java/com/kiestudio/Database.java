package com.kiestudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.math.BigDecimal;
import java.sql.*;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Balance ledger on SQLite. Every public operation is synchronized and runs in its own transaction,
 * so read-modify-write sequences on a user's balance or admin limit cannot interleave.
 * Amounts are stored as exact decimal text.
 */
public class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final String dbPath;
    private final long primaryAdminId;
    private final BigDecimal defaultAdminLimit;
    // Not persisted: a restart puts the primary admin back in admin mode.
    private final Set<Long> userMode = ConcurrentHashMap.newKeySet();

    public Database(String dbPath, long primaryAdminId, BigDecimal defaultAdminLimit) {
        this.dbPath = dbPath;
        this.primaryAdminId = primaryAdminId;
        this.defaultAdminLimit = defaultAdminLimit;
    }

    public void init() {
        File file = new File(dbPath);
        File parent = file.getParentFile();
        if (parent != null && !parent.exists()) {
            parent.mkdirs();
        }
        try (Connection conn = connect(); Statement st = conn.createStatement()) {

            st.execute("""
                CREATE TABLE IF NOT EXISTS balances (
                    user_id INTEGER PRIMARY KEY,
                    amount TEXT NOT NULL,
                    updated_at TEXT NOT NULL
                )
            """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS admin_limits (
                    user_id INTEGER PRIMARY KEY,
                    limit_amount TEXT NOT NULL,
                    spent TEXT NOT NULL,
                    added_by INTEGER,
                    added_at TEXT NOT NULL
                )
            """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS blocked_users (
                    user_id INTEGER PRIMARY KEY,
                    blocked_at TEXT NOT NULL
                )
            """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS payments (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    user_id INTEGER NOT NULL,
                    amount TEXT NOT NULL,
                    screenshot_ref TEXT,
                    status TEXT NOT NULL,
                    created_at TEXT NOT NULL
                )
            """);
        } catch (SQLException e) {
            throw new StorageException("Failed to init DB", e);
        }
        log.info("Ledger ready at {}", dbPath);
    }

    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    private static String now() {
        return OffsetDateTime.now().toString();
    }

    // Balances

    public synchronized BigDecimal getBalance(long userId) {
        return inTransaction(conn -> readBalance(conn, userId), "Failed to read balance");
    }

    public synchronized BigDecimal credit(long userId, BigDecimal amount) {
        requireNonNegative(amount);
        return inTransaction(conn -> {
            BigDecimal updated = readBalance(conn, userId).add(amount);
            writeBalance(conn, userId, updated);
            return updated;
        }, "Failed to credit balance");
    }

    /**
     * Withdraws {@code amount} only when the balance covers it. Returns false and leaves the balance untouched otherwise.
     */
    public synchronized boolean debit(long userId, BigDecimal amount) {
        requireNonNegative(amount);
        return inTransaction(conn -> {
            BigDecimal current = readBalance(conn, userId);
            if (current.compareTo(amount) < 0) {
                return false;
            }
            writeBalance(conn, userId, current.subtract(amount));
            return true;
        }, "Failed to debit balance");
    }

    private BigDecimal readBalance(Connection conn, long userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT amount FROM balances WHERE user_id = ?")) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? new BigDecimal(rs.getString("amount")) : BigDecimal.ZERO;
            }
        }
    }

    private void writeBalance(Connection conn, long userId, BigDecimal amount) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO balances (user_id, amount, updated_at) VALUES (?, ?, ?) " +
                        "ON CONFLICT(user_id) DO UPDATE SET amount = excluded.amount, updated_at = excluded.updated_at")) {
            ps.setLong(1, userId);
            ps.setString(2, store(amount));
            ps.setString(3, now());
            ps.executeUpdate();
        }
    }

    // Blocked users

    public synchronized boolean isBlocked(long userId) {
        return inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM blocked_users WHERE user_id = ?")) {
                ps.setLong(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        }, "Failed to read blocked flag");
    }

    public synchronized void block(long userId) {
        inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR IGNORE INTO blocked_users (user_id, blocked_at) VALUES (?, ?)")) {
                ps.setLong(1, userId);
                ps.setString(2, now());
                ps.executeUpdate();
            }
            return null;
        }, "Failed to block user");
    }

    public synchronized void unblock(long userId) {
        inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM blocked_users WHERE user_id = ?")) {
                ps.setLong(1, userId);
                ps.executeUpdate();
            }
            return null;
        }, "Failed to unblock user");
    }

    // Admin limits

    /** Effective role. The primary admin in user mode is priced and charged as a regular user. */
    public Role roleOf(long userId) {
        if (userId == primaryAdminId) {
            return userMode.contains(userId) ? Role.USER : Role.PRIMARY_ADMIN;
        }
        return isLimitedAdmin(userId) ? Role.LIMITED_ADMIN : Role.USER;
    }

    public boolean isInUserMode(long userId) {
        return userMode.contains(userId);
    }

    /** Flips user mode for the primary admin and returns the new state. Anyone else is never in user mode. */
    public boolean toggleUserMode(long userId) {
        if (userId != primaryAdminId) {
            return false;
        }
        if (userMode.remove(userId)) {
            return false;
        }
        userMode.add(userId);
        return true;
    }

    public synchronized boolean isLimitedAdmin(long userId) {
        return inTransaction(conn -> readLimit(conn, userId) != null, "Failed to read admin limit");
    }

    /** Registers (or re-registers with a new limit) a limited admin. Spent so far is kept. */
    public synchronized void addLimitedAdmin(long userId, BigDecimal limit, long addedBy) {
        requireNonNegative(limit);
        inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO admin_limits (user_id, limit_amount, spent, added_by, added_at) VALUES (?, ?, '0', ?, ?) " +
                            "ON CONFLICT(user_id) DO UPDATE SET limit_amount = excluded.limit_amount")) {
                ps.setLong(1, userId);
                ps.setString(2, store(limit));
                ps.setLong(3, addedBy);
                ps.setString(4, now());
                ps.executeUpdate();
            }
            return null;
        }, "Failed to add admin");
        log.info("Limited admin {} registered by {} with limit {}", userId, addedBy, limit);
    }

    /** Empty for the primary admin, who has no cap. */
    public synchronized Optional<BigDecimal> limitFor(long userId) {
        if (userId == primaryAdminId) {
            return Optional.empty();
        }
        return inTransaction(conn -> {
            AdminLimit limit = readLimit(conn, userId);
            return Optional.of(limit != null ? limit.limit : defaultAdminLimit);
        }, "Failed to read admin limit");
    }

    public synchronized BigDecimal spentFor(long userId) {
        return inTransaction(conn -> {
            AdminLimit limit = readLimit(conn, userId);
            return limit != null ? limit.spent : BigDecimal.ZERO;
        }, "Failed to read admin spent");
    }

    public synchronized Optional<BigDecimal> remainingFor(long userId) {
        return limitFor(userId).map(limit -> limit.subtract(spentFor(userId)).max(BigDecimal.ZERO));
    }

    /**
     * Adds to a limited admin's spent total when it stays within the limit. A no-op that returns true for the
     * primary admin; returns false without mutation for anyone else who is not a limited admin or would exceed the limit.
     */
    public synchronized boolean addSpent(long userId, BigDecimal amount) {
        requireNonNegative(amount);
        if (userId == primaryAdminId) {
            return true;
        }
        return inTransaction(conn -> {
            AdminLimit limit = readLimit(conn, userId);
            if (limit == null) {
                log.warn("addSpent for {} ignored: not a limited admin", userId);
                return false;
            }
            BigDecimal updated = limit.spent.add(amount);
            if (updated.compareTo(limit.limit) > 0) {
                return false;
            }
            try (PreparedStatement ps = conn.prepareStatement("UPDATE admin_limits SET spent = ? WHERE user_id = ?")) {
                ps.setString(1, store(updated));
                ps.setLong(2, userId);
                ps.executeUpdate();
            }
            return true;
        }, "Failed to update admin spent");
    }

    private AdminLimit readLimit(Connection conn, long userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT user_id, limit_amount, spent, added_by, added_at FROM admin_limits WHERE user_id = ?")) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                AdminLimit limit = new AdminLimit();
                limit.userId = rs.getLong("user_id");
                limit.limit = new BigDecimal(rs.getString("limit_amount"));
                limit.spent = new BigDecimal(rs.getString("spent"));
                limit.addedBy = rs.getLong("added_by");
                limit.addedAt = rs.getString("added_at");
                return limit;
            }
        }
    }

    // Payments

    /** Appends a completed payment and credits the user by its amount, both or neither. */
    public synchronized Payment recordPayment(long userId, BigDecimal amount, String screenshotRef) {
        requireNonNegative(amount);
        Payment payment = inTransaction(conn -> {
            String created = now();
            long id;
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO payments (user_id, amount, screenshot_ref, status, created_at) VALUES (?, ?, ?, 'completed', ?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setLong(1, userId);
                ps.setString(2, store(amount));
                ps.setString(3, screenshotRef);
                ps.setString(4, created);
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No id generated for payment");
                    }
                    id = keys.getLong(1);
                }
            }
            writeBalance(conn, userId, readBalance(conn, userId).add(amount));

            Payment p = new Payment();
            p.id = id;
            p.userId = userId;
            p.amount = amount;
            p.screenshotRef = screenshotRef;
            p.status = "completed";
            p.createdAt = created;
            return p;
        }, "Failed to record payment");
        log.info("Payment #{} recorded: user={} amount={}", payment.id, userId, amount);
        return payment;
    }

    public synchronized List<Payment> listPayments(int limit) {
        return inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT id, user_id, amount, screenshot_ref, status, created_at FROM payments ORDER BY id DESC LIMIT ?")) {
                ps.setInt(1, limit);
                return readPayments(ps);
            }
        }, "Failed to list payments");
    }

    public synchronized List<Payment> paymentsFor(long userId) {
        return inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT id, user_id, amount, screenshot_ref, status, created_at FROM payments WHERE user_id = ? ORDER BY id DESC")) {
                ps.setLong(1, userId);
                return readPayments(ps);
            }
        }, "Failed to list user payments");
    }

    public synchronized PaymentStats paymentStats() {
        return inTransaction(conn -> {
            PaymentStats stats = new PaymentStats();
            try (PreparedStatement ps = conn.prepareStatement("SELECT amount FROM payments");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    stats.count++;
                    stats.total = stats.total.add(new BigDecimal(rs.getString("amount")));
                }
            }
            return stats;
        }, "Failed to read payment stats");
    }

    private List<Payment> readPayments(PreparedStatement ps) throws SQLException {
        List<Payment> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Payment p = new Payment();
                p.id = rs.getLong("id");
                p.userId = rs.getLong("user_id");
                p.amount = new BigDecimal(rs.getString("amount"));
                p.screenshotRef = rs.getString("screenshot_ref");
                p.status = rs.getString("status");
                p.createdAt = rs.getString("created_at");
                result.add(p);
            }
        }
        return result;
    }

    // Plumbing

    private <T> T inTransaction(SqlFunction<T> work, String errorMessage) {
        int attempts = 5;
        for (int i = 0; i < attempts; i++) {
            try (Connection conn = connect()) {
                conn.setAutoCommit(false);
                try {
                    T result = work.apply(conn);
                    conn.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    conn.rollback();
                    throw e;
                }
            } catch (SQLException e) {
                if (isBusy(e) && i < attempts - 1) {
                    log.debug("Database busy, retrying ({}/{})", i + 1, attempts);
                    sleep(200);
                    continue;
                }
                throw new StorageException(errorMessage, e);
            }
        }
        throw new StorageException(errorMessage, null);
    }

    private boolean isBusy(SQLException e) {
        String msg = e.getMessage();
        return msg != null && (msg.toLowerCase(Locale.ROOT).contains("database is locked")
                || msg.contains("SQLITE_BUSY"));
    }

    private void sleep(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative: " + amount);
        }
    }

    private static String store(BigDecimal amount) {
        return amount.stripTrailingZeros().toPlainString();
    }

    @FunctionalInterface
    private interface SqlFunction<T> {
        T apply(Connection conn) throws SQLException;
    }

    public static class AdminLimit {
        public long userId;
        public BigDecimal limit;
        public BigDecimal spent;
        public long addedBy;
        public String addedAt;
    }

    public static class Payment {
        public long id;
        public long userId;
        public BigDecimal amount;
        public String screenshotRef;
        public String status;
        public String createdAt;
    }

    public static class PaymentStats {
        public int count;
        public BigDecimal total = BigDecimal.ZERO;
    }
}
