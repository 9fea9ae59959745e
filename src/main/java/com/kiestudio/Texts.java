package com.kiestudio;

import java.math.BigDecimal;

final class Texts {
    static final String WELCOME = """
            👋 <b>Добро пожаловать в KIE Studio!</b>

            Здесь можно генерировать изображения и видео с помощью моделей KIE AI.
            Выберите модель, заполните параметры и подтвердите генерацию — стоимость спишется только после успешного результата.""";

    static final String HELP = """
            ℹ️ <b>Как это работает</b>

            1. /models — выберите категорию и модель
            2. Отправьте описание (промпт) и при необходимости фото
            3. Выберите параметры и подтвердите генерацию
            4. Дождитесь результата (обычно до 5 минут)

            /balance — баланс и пополнение
            /cancel — отменить текущее действие""";

    static final String NO_SESSION = "⚠️ Нет активной операции. Начните заново: /models";
    static final String CANCELLED = "❌ Действие отменено.";
    static final String BLOCKED = "🔒 Ваш аккаунт заблокирован. Обратитесь в поддержку.";
    static final String KIE_DISABLED = "⚠️ Генерация временно недоступна: сервис не настроен. Обратитесь к администратору.";
    static final String STORAGE_ERROR = "⚠️ Хранилище баланса временно недоступно. Повторите попытку позже или обратитесь в поддержку.";
    static final String ADMIN_ONLY = "❌ Эта команда доступна только главному администратору.";

    private Texts() {
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static String rub(BigDecimal amount) {
        return Pricing.format(amount) + " ₽";
    }

    static String support(Config config) {
        StringBuilder sb = new StringBuilder("🆘 <b>Поддержка</b>");
        if (!config.supportTelegram.isBlank()) {
            String handle = config.supportTelegram.startsWith("@") ? config.supportTelegram : "@" + config.supportTelegram;
            sb.append("\nTelegram: ").append(escape(handle));
        }
        if (!config.supportText.isBlank()) {
            sb.append("\n").append(escape(config.supportText));
        }
        if (config.supportTelegram.isBlank() && config.supportText.isBlank()) {
            sb.append("\nНапишите администратору бота.");
        }
        return sb.toString();
    }

    static String paymentDetails(Config config, BigDecimal amount) {
        StringBuilder sb = new StringBuilder();
        sb.append("💳 <b>Пополнение на ").append(rub(amount)).append("</b>\n\n");
        sb.append("Переведите сумму по реквизитам:\n");
        if (!config.paymentPhone.isBlank()) {
            sb.append("📱 Телефон (СБП): <code>").append(escape(config.paymentPhone)).append("</code>\n");
        }
        if (!config.paymentBank.isBlank()) {
            sb.append("🏦 Банк: ").append(escape(config.paymentBank)).append("\n");
        }
        if (!config.paymentCardHolder.isBlank()) {
            sb.append("👤 Получатель: ").append(escape(config.paymentCardHolder)).append("\n");
        }
        sb.append("\nПосле оплаты отправьте <b>скриншот</b> перевода одним фото.");
        return sb.toString();
    }
}
