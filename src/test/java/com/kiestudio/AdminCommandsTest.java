package com.kiestudio;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Admin commands")
class AdminCommandsTest {
    private static final long ADMIN = 1L;
    private static final long USER = 42L;

    @TempDir
    Path dir;

    private final RecordingMessenger messenger = new RecordingMessenger();
    private final SessionStore sessions = new SessionStore();
    private final Inbound admin = Inbound.message(ADMIN, ADMIN);
    private Database db;
    private TextRecognizer recognizer;
    private MediaFiles files;
    private AdminCommands commands;

    @BeforeEach
    void setUp() {
        Config config = Config.from(Map.of(
                "BOT_TOKEN", "t",
                "BOT_USERNAME", "bot",
                "ADMIN_ID", String.valueOf(ADMIN),
                "ADMIN_DEFAULT_LIMIT", "250"));
        db = new Database(dir.resolve("bot.db").toString(), ADMIN, config.adminDefaultLimit);
        db.init();
        recognizer = mock(TextRecognizer.class);
        files = mock(MediaFiles.class);
        commands = new AdminCommands(config, db, sessions, new PaymentVerifier(recognizer), recognizer, files, messenger);
    }

    @Test
    void onlyPrimaryAdminMayRunThem() {
        commands.handle(Inbound.message(USER, USER), "/block_user", "7");

        assertThat(db.isBlocked(7)).isFalse();
        assertThat(messenger.last().body).isEqualTo(Texts.ADMIN_ONLY);
    }

    @Test
    void recognizesCommandNames() {
        assertThat(AdminCommands.isAdminCommand("/payments")).isTrue();
        assertThat(AdminCommands.isAdminCommand("/add_admin")).isTrue();
        assertThat(AdminCommands.isAdminCommand("/user_mode")).isTrue();
        assertThat(AdminCommands.isAdminCommand("/balance")).isFalse();
    }

    @Nested
    @DisplayName("user management")
    class Users {

        @Test
        void blockAndUnblock() {
            commands.handle(admin, "/block_user", "42");
            assertThat(db.isBlocked(USER)).isTrue();

            commands.handle(admin, "/unblock_user", " 42 ");
            assertThat(db.isBlocked(USER)).isFalse();
            assertThat(messenger.last().body).contains("разблокирован");
        }

        @Test
        void missingOrMalformedUserId() {
            commands.handle(admin, "/block_user", "");
            assertThat(messenger.last().body).isEqualTo("Использование: /block_user [user_id]");

            commands.handle(admin, "/block_user", "abc");
            assertThat(messenger.last().body).contains("Неверный формат");
        }

        @Test
        void userBalanceShowsPayments() {
            db.recordPayment(USER, new BigDecimal("300"), "s1");
            db.recordPayment(USER, new BigDecimal("200"), "s2");
            db.debit(USER, new BigDecimal("50"));

            commands.handle(admin, "/user_balance", "42");

            assertThat(messenger.last().body)
                    .contains("Баланс:</b> 450.00 ₽")
                    .contains("Всего пополнено:</b> 500.00 ₽")
                    .contains("Платежей:</b> 2")
                    .contains("Активен");
        }

        @Test
        void addAdminUsesDefaultLimit() {
            commands.handle(admin, "/add_admin", "7");

            assertThat(db.isLimitedAdmin(7)).isTrue();
            assertThat(db.limitFor(7)).hasValueSatisfying(l -> assertThat(l).isEqualByComparingTo("250"));
            assertThat(messenger.last().body).contains("Админ добавлен").contains("Лимит: 250.00 ₽");

            commands.handle(admin, "/add_admin", "7");
            assertThat(messenger.last().body).contains("уже является админом");
        }

        @Test
        void userModeTogglesAndDropsOpenSession() {
            sessions.put(new Session(ADMIN, Session.State.SELECTING_MODEL));

            commands.handle(admin, "/user_mode", "");

            assertThat(db.roleOf(ADMIN)).isEqualTo(Role.USER);
            assertThat(sessions.get(ADMIN)).isEmpty();
            assertThat(messenger.last().body).contains("Режим пользователя включен");
            assertThat(messenger.last().commands()).contains(Command.of(Command.Type.ADMIN_USER_MODE));

            commands.handle(admin, "/user_mode", "");

            assertThat(db.roleOf(ADMIN)).isEqualTo(Role.PRIMARY_ADMIN);
        }

        @Test
        void primaryAdminCannotBeDemoted() {
            commands.handle(admin, "/add_admin", "1");

            assertThat(db.isLimitedAdmin(ADMIN)).isFalse();
            assertThat(messenger.last().body).contains("главный администратор");
        }
    }

    @Nested
    @DisplayName("/payments")
    class Payments {

        @Test
        void emptyLog() {
            commands.handle(admin, "/payments", "");

            assertThat(messenger.last().body).contains("Нет зарегистрированных платежей");
        }

        @Test
        void summarizesRecentPayments() {
            for (int i = 0; i < 12; i++) {
                db.recordPayment(USER + i, new BigDecimal("100"), "s" + i);
            }

            commands.handle(admin, "/payments", "");

            String body = messenger.last().body;
            assertThat(body).contains("Всего:</b> 1200.00 ₽").contains("Количество:</b> 12").contains("и ещё 2 платежей");
            assertThat(body.split("👤 ID:", -1)).hasSize(AdminCommands.RECENT_PAYMENTS + 1);
        }
    }

    @Nested
    @DisplayName("OCR self-test")
    class OcrTest {

        @Test
        void opensTestSession() {
            when(recognizer.isAvailable()).thenReturn(true);

            commands.startOcrTest(admin);

            assertThat(sessions.get(ADMIN)).hasValueSatisfying(s -> assertThat(s.state).isEqualTo(Session.State.ADMIN_TEST_OCR));
            assertThat(messenger.last().body).contains("OCR доступен");
        }

        @Test
        void reportsRecognizedText() throws Exception {
            when(recognizer.isAvailable()).thenReturn(true);
            when(files.download("shot")).thenReturn(new byte[] {1});
            when(recognizer.recognize(any())).thenReturn("Перевод выполнен\nСумма 500 ₽");

            commands.onOcrScreenshot(admin, "shot");

            assertThat(messenger.last().body)
                    .contains("Перевод выполнен")
                    .contains("Ключевые слова: найдены")
                    .contains("500");
            assertThat(db.getBalance(ADMIN)).isEqualByComparingTo("0");
        }

        @Test
        void unavailableEngine() {
            when(recognizer.isAvailable()).thenReturn(false);

            commands.onOcrScreenshot(admin, "shot");

            assertThat(messenger.last().body).contains("OCR недоступен");
        }

        @Test
        void downloadFailure() throws Exception {
            when(recognizer.isAvailable()).thenReturn(true);
            when(files.download("shot")).thenThrow(new IOException("gone"));

            commands.onOcrScreenshot(admin, "shot");

            assertThat(messenger.last().body).contains("Ошибка OCR: gone");
        }
    }
}
