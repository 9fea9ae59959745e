package com.kiestudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Balance top-up: amount selection, payment requisites, screenshot verification and crediting.
 * All methods expect the caller to hold the user's session lock.
 */
public class TopUpFlow {
    private static final Logger log = LoggerFactory.getLogger(TopUpFlow.class);
    static final BigDecimal MIN_AMOUNT = new BigDecimal("50");
    static final BigDecimal MAX_AMOUNT = new BigDecimal("50000");
    // Whole rubles, optionally with kopecks.
    private static final Pattern AMOUNT_FORMAT = Pattern.compile("\\d+(\\.\\d{1,2})?");

    private final Config config;
    private final Database db;
    private final SessionStore sessions;
    private final PaymentVerifier verifier;
    private final MediaFiles files;
    private final Replies replies;

    public TopUpFlow(Config config, Database db, SessionStore sessions, PaymentVerifier verifier,
                     MediaFiles files, Messenger messenger) {
        this.config = config;
        this.db = db;
        this.sessions = sessions;
        this.verifier = verifier;
        this.files = files;
        this.replies = new Replies(messenger);
    }

    public void start(Inbound in) {
        if (db.isBlocked(in.userId)) {
            replies.send(in.chatId, Texts.BLOCKED);
            return;
        }
        sessions.put(new Session(in.userId, Session.State.SELECTING_AMOUNT));
        replies.reply(in, "💳 <b>Пополнение баланса</b>\n\n"
                + "Текущий баланс: " + Texts.rub(db.getBalance(in.userId)) + "\n\n"
                + "Выберите сумму или введите свою (от " + MIN_AMOUNT + " до " + MAX_AMOUNT + " ₽):",
                Keyboards.topUpAmounts());
    }

    public void onPresetAmount(Inbound in, Session session, String rawAmount) {
        if (session.state != Session.State.SELECTING_AMOUNT) {
            replies.send(in.chatId, Texts.NO_SESSION);
            return;
        }
        Optional<BigDecimal> amount = parseAmount(rawAmount);
        if (amount.isEmpty()) {
            replies.send(in.chatId, "⚠️ Некорректная сумма. Выберите сумму из списка.", Keyboards.topUpAmounts());
            return;
        }
        selectAmount(in, session, amount.get());
    }

    public void onCustomRequested(Inbound in, Session session) {
        if (session.state != Session.State.SELECTING_AMOUNT) {
            replies.send(in.chatId, Texts.NO_SESSION);
            return;
        }
        session.waitingFor = Session.Waiting.CUSTOM_AMOUNT;
        replies.reply(in, "✏️ Введите сумму пополнения от " + MIN_AMOUNT + " до " + MAX_AMOUNT + " ₽:",
                Keyboards.cancelOnly());
    }

    public void onText(Inbound in, Session session, String text) {
        if (session.state == Session.State.WAITING_PAYMENT_SCREENSHOT) {
            replies.send(in.chatId, "📷 Отправьте скриншот перевода одним фото.", Keyboards.cancelOnly());
            return;
        }
        Optional<BigDecimal> amount = parseAmount(text);
        if (amount.isEmpty()) {
            replies.send(in.chatId, "⚠️ Введите число от " + MIN_AMOUNT + " до " + MAX_AMOUNT + ", например 500.",
                    Keyboards.cancelOnly());
            return;
        }
        selectAmount(in, session, amount.get());
    }

    private void selectAmount(Inbound in, Session session, BigDecimal amount) {
        session.topUpAmount = amount;
        session.state = Session.State.WAITING_PAYMENT_SCREENSHOT;
        session.waitingFor = Session.Waiting.SCREENSHOT;
        replies.reply(in, Texts.paymentDetails(config, amount), Keyboards.cancelOnly());
    }

    /** Accepts one screenshot; on rejection the session stays so the user can send another. */
    public void onScreenshot(Inbound in, Session session, String fileRef) {
        if (session.state != Session.State.WAITING_PAYMENT_SCREENSHOT) {
            replies.send(in.chatId, "⚠️ Сначала выберите сумму пополнения.", Keyboards.topUpAmounts());
            return;
        }
        byte[] image;
        try {
            image = files.download(fileRef);
        } catch (IOException e) {
            log.warn("Could not download screenshot {} of user {}: {}", fileRef, in.userId, e.getMessage());
            replies.send(in.chatId, "⚠️ Не удалось загрузить скриншот. Отправьте его ещё раз.", Keyboards.cancelOnly());
            return;
        }

        BigDecimal amount = session.topUpAmount;
        String phone = config.paymentPhone.isBlank() ? null : config.paymentPhone;
        PaymentVerifier.Verdict verdict = verifier.verify(image, amount, phone);
        if (!verdict.valid) {
            replies.send(in.chatId, verdict.message + "\n\n"
                    + "Проверьте, что на скриншоте видны сумма и статус перевода, и отправьте его ещё раз.\n\n"
                    + Texts.support(config), Keyboards.cancelOnly());
            return;
        }

        Database.Payment payment = db.recordPayment(in.userId, amount, fileRef);
        sessions.clear(in.userId);
        BigDecimal balance = db.getBalance(in.userId);
        replies.send(in.chatId, verdict.message + "\n\n"
                + "✅ <b>Баланс пополнен на " + Texts.rub(amount) + "</b>\n"
                + "Текущий баланс: " + Texts.rub(balance),
                Keyboards.mainMenu(in.userId == config.primaryAdminId, db.isInUserMode(in.userId)));
        notifyAdmin(payment, verdict);
    }

    private void notifyAdmin(Database.Payment payment, PaymentVerifier.Verdict verdict) {
        if (config.primaryAdminId == 0 || config.primaryAdminId == payment.userId) {
            return;
        }
        replies.send(config.primaryAdminId, "💰 <b>Новый платеж #" + payment.id + "</b>\n\n"
                + "👤 ID: " + payment.userId + "\n"
                + "💵 Сумма: " + Texts.rub(payment.amount) + "\n"
                + "🔍 Проверка: " + (verdict.checked ? "OCR" : "без OCR"));
    }

    static Optional<BigDecimal> parseAmount(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().replace(" ", "").replace(',', '.');
        if (!AMOUNT_FORMAT.matcher(normalized).matches()) {
            return Optional.empty();
        }
        BigDecimal amount = new BigDecimal(normalized);
        if (amount.compareTo(MIN_AMOUNT) < 0 || amount.compareTo(MAX_AMOUNT) > 0) {
            return Optional.empty();
        }
        return Optional.of(amount);
    }
}
