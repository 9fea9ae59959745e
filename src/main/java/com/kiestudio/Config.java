package com.kiestudio;

import java.math.BigDecimal;
import java.util.Map;

public class Config {
    public final String botToken;
    public final String botUsername;
    public final long primaryAdminId;
    public final String kieApiKey;
    public final String kieApiBase;
    public final String kieUploadBase;
    public final int kieTimeoutSeconds;
    public final String dbPath;
    public final String timeZone;
    public final BigDecimal adminDefaultLimit;
    public final long pollIntervalMillis;
    public final int pollMaxAttempts;
    public final String paymentPhone;
    public final String paymentBank;
    public final String paymentCardHolder;
    public final String supportTelegram;
    public final String supportText;
    public final String tessdataPath;

    private Config(Map<String, String> env) {
        this.botToken = envRequired(env, "BOT_TOKEN");
        this.botUsername = envRequired(env, "BOT_USERNAME");
        this.primaryAdminId = Long.parseLong(envDefault(env, "ADMIN_ID", "0"));

        // Optional: without a key generation is reported as disabled instead of failing startup.
        this.kieApiKey = envDefault(env, "KIE_API_KEY", "");
        this.kieApiBase = envDefault(env, "KIE_API_BASE", "https://api.kie.ai");
        this.kieUploadBase = envDefault(env, "KIE_UPLOAD_BASE", "https://kieai.redpandaai.co");
        this.kieTimeoutSeconds = Integer.parseInt(envDefault(env, "KIE_TIMEOUT_SECONDS", "30"));

        this.dbPath = envDefault(env, "BOT_DB_PATH", "data/bot.db");
        this.timeZone = envDefault(env, "BOT_TIMEZONE", "Europe/Moscow");
        this.adminDefaultLimit = new BigDecimal(envDefault(env, "ADMIN_DEFAULT_LIMIT", "100"));

        this.pollIntervalMillis = Long.parseLong(envDefault(env, "POLL_INTERVAL_SECONDS", "5")) * 1000L;
        this.pollMaxAttempts = Integer.parseInt(envDefault(env, "POLL_MAX_ATTEMPTS", "60"));

        this.paymentPhone = envDefault(env, "PAYMENT_PHONE", "");
        this.paymentBank = envDefault(env, "PAYMENT_BANK", "");
        this.paymentCardHolder = envDefault(env, "PAYMENT_CARD_HOLDER", "");
        this.supportTelegram = envDefault(env, "SUPPORT_TELEGRAM", "");
        this.supportText = envDefault(env, "SUPPORT_TEXT", "");
        this.tessdataPath = envDefault(env, "TESSDATA_PATH", "");
    }

    public static Config load() {
        return new Config(System.getenv());
    }

    public static Config from(Map<String, String> env) {
        return new Config(env);
    }

    public boolean isKieConfigured() {
        return !kieApiKey.isBlank();
    }

    private static String envRequired(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required env: " + key);
        }
        return value.trim();
    }

    private static String envDefault(Map<String, String> env, String key, String def) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return def;
        }
        return value.trim();
    }
}
