package com.kiestudio;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Balance top-up")
class TopUpFlowTest {
    private static final long ADMIN = 1L;
    private static final long USER = 42L;
    private static final byte[] SCREENSHOT = {1, 2, 3};

    @TempDir
    Path dir;

    private final RecordingMessenger messenger = new RecordingMessenger();
    private final SessionStore sessions = new SessionStore();
    private final Inbound in = Inbound.message(USER, USER);
    private Database db;
    private PaymentVerifier verifier;
    private MediaFiles files;
    private TopUpFlow flow;

    @BeforeEach
    void setUp() throws Exception {
        Map<String, String> env = new HashMap<>();
        env.put("BOT_TOKEN", "t");
        env.put("BOT_USERNAME", "bot");
        env.put("ADMIN_ID", String.valueOf(ADMIN));
        env.put("PAYMENT_PHONE", "+79001234567");
        env.put("PAYMENT_BANK", "Т-Банк");
        Config config = Config.from(env);

        db = new Database(dir.resolve("bot.db").toString(), ADMIN, new BigDecimal("100"));
        db.init();
        verifier = mock(PaymentVerifier.class);
        files = mock(MediaFiles.class);
        when(files.download("shot")).thenReturn(SCREENSHOT);
        flow = new TopUpFlow(config, db, sessions, verifier, files, messenger);
    }

    private Session awaitingScreenshot(String amount) {
        flow.start(in);
        Session session = sessions.get(USER).orElseThrow();
        flow.onPresetAmount(in, session, amount);
        return session;
    }

    private static PaymentVerifier.Verdict verdict(boolean valid) {
        return new PaymentVerifier.Verdict(valid, valid, valid ? new BigDecimal("500") : null, false, true,
                valid ? "✅ ok" : "❌ not a receipt", true);
    }

    @Test
    void startOffersPresetAmounts() {
        flow.start(in);

        assertThat(sessions.get(USER)).hasValueSatisfying(s -> assertThat(s.state).isEqualTo(Session.State.SELECTING_AMOUNT));
        assertThat(messenger.last().commands()).contains(Command.topUpAmount(500), Command.of(Command.Type.TOPUP_CUSTOM));
    }

    @Test
    void blockedUserCannotTopUp() {
        db.block(USER);

        flow.start(in);

        assertThat(sessions.get(USER)).isEmpty();
        assertThat(messenger.last().body).isEqualTo(Texts.BLOCKED);
    }

    @Test
    void presetAmountShowsPaymentDetails() {
        Session session = awaitingScreenshot("500");

        assertThat(session.state).isEqualTo(Session.State.WAITING_PAYMENT_SCREENSHOT);
        assertThat(session.topUpAmount).isEqualByComparingTo("500");
        assertThat(messenger.last().body).contains("500.00 ₽").contains("+79001234567").contains("Т-Банк");
    }

    @Test
    void customAmountIsValidated() {
        flow.start(in);
        Session session = sessions.get(USER).orElseThrow();
        flow.onCustomRequested(in, session);

        flow.onText(in, session, "49");
        assertThat(session.state).isEqualTo(Session.State.SELECTING_AMOUNT);

        flow.onText(in, session, "1 000,5");
        assertThat(session.state).isEqualTo(Session.State.WAITING_PAYMENT_SCREENSHOT);
        assertThat(session.topUpAmount).isEqualByComparingTo("1000.5");
    }

    @ParameterizedTest
    @CsvSource({"50,50", "50000,50000", "'2 500',2500", "99.99,99.99", "'150,5',150.5"})
    void parsesAmountsInRange(String raw, String expected) {
        assertThat(TopUpFlow.parseAmount(raw)).hasValueSatisfying(a -> assertThat(a).isEqualByComparingTo(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"49.99", "50001", "abc", "", "-100", "1e3", "5E+2", "100.555", "+500", "100.", ".5"})
    void rejectsMalformedOrOutOfRangeAmounts(String raw) {
        assertThat(TopUpFlow.parseAmount(raw)).isEmpty();
    }

    @Test
    void validScreenshotCreditsAndNotifiesAdmin() {
        Session session = awaitingScreenshot("500");
        when(verifier.verify(SCREENSHOT, new BigDecimal("500"), "+79001234567")).thenReturn(verdict(true));

        flow.onScreenshot(in, session, "shot");

        assertThat(db.getBalance(USER)).isEqualByComparingTo("500");
        assertThat(db.paymentsFor(USER)).singleElement().satisfies(p -> assertThat(p.screenshotRef).isEqualTo("shot"));
        assertThat(sessions.get(USER)).isEmpty();
        assertThat(messenger.sent).anySatisfy(s -> {
            assertThat(s.chatId).isEqualTo(USER);
            assertThat(s.body).contains("Баланс пополнен");
        });
        assertThat(messenger.last().chatId).isEqualTo(ADMIN);
        assertThat(messenger.last().body).contains("Новый платеж");
    }

    @Test
    void rejectedScreenshotKeepsSession() {
        Session session = awaitingScreenshot("500");
        when(verifier.verify(any(), any(), any())).thenReturn(verdict(false));

        flow.onScreenshot(in, session, "shot");

        assertThat(db.getBalance(USER)).isEqualByComparingTo("0");
        assertThat(sessions.get(USER)).containsSame(session);
        assertThat(messenger.last().body).contains("not a receipt").contains("Поддержка");
    }

    @Test
    void downloadFailureAsksAgain() throws Exception {
        Session session = awaitingScreenshot("500");
        when(files.download("broken")).thenThrow(new IOException("404"));

        flow.onScreenshot(in, session, "broken");

        verify(verifier, never()).verify(any(), any(), any());
        assertThat(session.state).isEqualTo(Session.State.WAITING_PAYMENT_SCREENSHOT);
        assertThat(messenger.last().body).contains("Не удалось загрузить скриншот");
    }

    @Test
    void textWhileAwaitingScreenshotAsksForPhoto() {
        Session session = awaitingScreenshot("100");

        flow.onText(in, session, "paid!");

        assertThat(messenger.last().body).contains("скриншот");
        verify(verifier, never()).verify(any(), eq(new BigDecimal("100")), any());
    }
}
