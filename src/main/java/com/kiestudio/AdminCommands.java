package com.kiestudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Primary-admin commands: payment log, blocking, user lookup, limited admins and the OCR self-test.
 */
public class AdminCommands {
    private static final Logger log = LoggerFactory.getLogger(AdminCommands.class);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");
    static final int RECENT_PAYMENTS = 10;

    private final Config config;
    private final Database db;
    private final SessionStore sessions;
    private final PaymentVerifier verifier;
    private final TextRecognizer recognizer;
    private final MediaFiles files;
    private final Replies replies;

    public AdminCommands(Config config, Database db, SessionStore sessions, PaymentVerifier verifier,
                         TextRecognizer recognizer, MediaFiles files, Messenger messenger) {
        this.config = config;
        this.db = db;
        this.sessions = sessions;
        this.verifier = verifier;
        this.recognizer = recognizer;
        this.files = files;
        this.replies = new Replies(messenger);
    }

    public static boolean isAdminCommand(String command) {
        return switch (command) {
            case "/payments", "/block_user", "/unblock_user", "/user_balance", "/add_admin", "/user_mode" -> true;
            default -> false;
        };
    }

    public void handle(Inbound in, String command, String args) {
        if (in.userId != config.primaryAdminId) {
            replies.send(in.chatId, Texts.ADMIN_ONLY);
            return;
        }
        switch (command) {
            case "/payments" -> payments(in);
            case "/block_user" -> withUserId(in, "/block_user", args, id -> {
                db.block(id);
                log.info("User {} blocked by {}", id, in.userId);
                replies.send(in.chatId, "✅ Пользователь " + id + " заблокирован.");
            });
            case "/unblock_user" -> withUserId(in, "/unblock_user", args, id -> {
                db.unblock(id);
                log.info("User {} unblocked by {}", id, in.userId);
                replies.send(in.chatId, "✅ Пользователь " + id + " разблокирован.");
            });
            case "/user_balance" -> withUserId(in, "/user_balance", args, id -> userBalance(in, id));
            case "/add_admin" -> withUserId(in, "/add_admin", args, id -> addAdmin(in, id));
            case "/user_mode" -> toggleUserMode(in);
            default -> log.warn("Unhandled admin command {}", command);
        }
    }

    private void payments(Inbound in) {
        Database.PaymentStats stats = db.paymentStats();
        if (stats.count == 0) {
            replies.send(in.chatId, "📊 <b>Платежи</b>\n\nНет зарегистрированных платежей.");
            return;
        }
        StringBuilder sb = new StringBuilder("📊 <b>Статистика платежей:</b>\n\n");
        sb.append("💰 <b>Всего:</b> ").append(Texts.rub(stats.total)).append("\n");
        sb.append("📝 <b>Количество:</b> ").append(stats.count).append("\n\n");
        sb.append("<b>Последние платежи:</b>\n\n");
        for (Database.Payment p : db.listPayments(RECENT_PAYMENTS)) {
            sb.append("👤 ID: ").append(p.userId)
                    .append(" | 💵 ").append(Texts.rub(p.amount))
                    .append(" | 📅 ").append(formatDate(p.createdAt))
                    .append("\n");
        }
        if (stats.count > RECENT_PAYMENTS) {
            sb.append("\n... и ещё ").append(stats.count - RECENT_PAYMENTS).append(" платежей");
        }
        replies.send(in.chatId, sb.toString());
    }

    private void userBalance(Inbound in, long userId) {
        List<Database.Payment> payments = db.paymentsFor(userId);
        BigDecimal totalPaid = payments.stream().map(p -> p.amount).reduce(BigDecimal.ZERO, BigDecimal::add);
        StringBuilder sb = new StringBuilder();
        sb.append("👤 <b>Пользователь:</b> ").append(userId).append("\n");
        sb.append("💰 <b>Баланс:</b> ").append(Texts.rub(db.getBalance(userId))).append("\n");
        sb.append("💵 <b>Всего пополнено:</b> ").append(Texts.rub(totalPaid)).append("\n");
        sb.append("📝 <b>Платежей:</b> ").append(payments.size()).append("\n");
        sb.append("🔐 <b>Статус:</b> ").append(db.isBlocked(userId) ? "🔒 Заблокирован" : "✅ Активен");
        if (db.roleOf(userId) == Role.LIMITED_ADMIN) {
            sb.append("\n\n").append(limitSummary(userId));
        }
        replies.send(in.chatId, sb.toString());
    }

    private void addAdmin(Inbound in, long userId) {
        if (userId == config.primaryAdminId) {
            replies.send(in.chatId, "❌ Это главный администратор.");
            return;
        }
        if (db.isLimitedAdmin(userId)) {
            replies.send(in.chatId, "❌ Пользователь " + userId + " уже является админом.");
            return;
        }
        db.addLimitedAdmin(userId, config.adminDefaultLimit, in.userId);
        replies.send(in.chatId, "✅ <b>Админ добавлен!</b>\n\n👤 User ID: " + userId + "\n" + limitSummary(userId));
    }

    String limitSummary(long userId) {
        BigDecimal limit = db.limitFor(userId).orElse(BigDecimal.ZERO);
        return "💳 Лимит: " + Texts.rub(limit) + "\n"
                + "💸 Потрачено: " + Texts.rub(db.spentFor(userId)) + "\n"
                + "✅ Осталось: " + Texts.rub(db.remainingFor(userId).orElse(BigDecimal.ZERO));
    }

    private void withUserId(Inbound in, String command, String args, UserAction action) {
        String raw = args == null ? "" : args.trim();
        if (raw.isEmpty()) {
            replies.send(in.chatId, "Использование: " + command + " [user_id]");
            return;
        }
        long userId;
        try {
            userId = Long.parseLong(raw.split("\\s+")[0]);
        } catch (NumberFormatException e) {
            replies.send(in.chatId, "❌ Неверный формат user_id. Используйте число.");
            return;
        }
        action.run(userId);
    }

    /**
     * Switches the primary admin between admin pricing and regular-user pricing with balance charging.
     * Any open session is dropped.
     */
    public void toggleUserMode(Inbound in) {
        if (in.userId != config.primaryAdminId) {
            replies.send(in.chatId, Texts.ADMIN_ONLY);
            return;
        }
        boolean on = db.toggleUserMode(in.userId);
        sessions.clear(in.userId);
        log.info("Primary admin {} user mode {}", in.userId, on ? "on" : "off");
        String text = on
                ? "👤 <b>Режим пользователя включен</b>\n\nЦены и списания как у обычного пользователя. "
                + "Баланс: " + Texts.rub(db.getBalance(in.userId))
                : "👑 <b>Режим админа включен</b>\n\nГенерации без списания.";
        replies.reply(in, text, Keyboards.mainMenu(true, on));
    }

    // OCR self-test

    public void startOcrTest(Inbound in) {
        if (in.userId != config.primaryAdminId) {
            replies.send(in.chatId, Texts.ADMIN_ONLY);
            return;
        }
        sessions.put(new Session(in.userId, Session.State.ADMIN_TEST_OCR));
        String status = recognizer.isAvailable() ? "✅ OCR доступен" : "⚠️ OCR недоступен: проверка будет пропускаться";
        replies.reply(in, "🔍 <b>Тест OCR</b>\n\n" + status + "\n\nОтправьте скриншот перевода.", Keyboards.cancelOnly());
    }

    /** Shows what the verifier would read from a screenshot. No ledger effect. */
    public void onOcrScreenshot(Inbound in, String fileRef) {
        if (!recognizer.isAvailable()) {
            replies.send(in.chatId, "⚠️ OCR недоступен. Укажите TESSDATA_PATH с языковыми данными.", Keyboards.cancelOnly());
            return;
        }
        String text;
        try {
            text = recognizer.recognize(files.download(fileRef));
        } catch (IOException | TextRecognizer.RecognitionException e) {
            log.warn("OCR test failed for {}: {}", fileRef, e.getMessage());
            replies.send(in.chatId, "❌ Ошибка OCR: " + Texts.escape(e.getMessage()), Keyboards.cancelOnly());
            return;
        }
        List<BigDecimal> amounts = verifier.extractAmounts(text);
        String shown = text.length() > 3000 ? text.substring(0, 3000) + "…" : text;
        replies.send(in.chatId, "📝 <b>Распознанный текст:</b>\n<pre>" + Texts.escape(shown) + "</pre>\n\n"
                + "🔑 Ключевые слова: " + (verifier.hasPaymentKeywords(text) ? "найдены" : "не найдены") + "\n"
                + "💵 Суммы: " + (amounts.isEmpty() ? "не найдены" : amounts.stream()
                .map(BigDecimal::toPlainString).collect(Collectors.joining(", "))) + "\n\n"
                + "Отправьте ещё скриншот или нажмите «Отмена».", Keyboards.cancelOnly());
    }

    private String formatDate(String stored) {
        try {
            return OffsetDateTime.parse(stored).atZoneSameInstant(ZoneId.of(config.timeZone)).format(DATE);
        } catch (DateTimeException e) {
            return "Неизвестно";
        }
    }

    @FunctionalInterface
    private interface UserAction {
        void run(long userId);
    }
}
