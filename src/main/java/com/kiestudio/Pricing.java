package com.kiestudio;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Converts model credits into rubles. Pure functions only; the returned amounts are unrounded
 * and {@link #format(BigDecimal)} is for display.
 */
public final class Pricing {
    public static final BigDecimal CREDIT_TO_USD = new BigDecimal("0.005");
    public static final BigDecimal USD_TO_RUB = new BigDecimal("6.95")
            .divide(new BigDecimal("0.09"), new MathContext(16, RoundingMode.HALF_EVEN));
    public static final BigDecimal USER_MARKUP = BigDecimal.valueOf(2);
    static final BigDecimal DEFAULT_CREDITS = BigDecimal.ONE;

    private static final Map<String, BigDecimal> BASE_CREDITS = Map.of(
            "z-image", new BigDecimal("0.8"),
            "seedream/4.5-text-to-image", new BigDecimal("6.5"),
            "seedream/4.5-edit", new BigDecimal("6.5"),
            "sora-watermark-remover", new BigDecimal("10"),
            "sora-2-text-to-video", new BigDecimal("30")
    );

    private Pricing() {
    }

    public static BigDecimal baseCredits(String modelId, Map<String, Object> params) {
        if ("nano-banana-pro".equals(modelId)) {
            Object resolution = params == null ? null : params.get("resolution");
            return "4K".equals(resolution) ? new BigDecimal("24") : new BigDecimal("18");
        }
        return BASE_CREDITS.getOrDefault(modelId, DEFAULT_CREDITS);
    }

    public static BigDecimal creditsToRub(BigDecimal credits) {
        return credits.multiply(CREDIT_TO_USD).multiply(USD_TO_RUB);
    }

    public static BigDecimal price(String modelId, Map<String, Object> params, Role role) {
        BigDecimal admin = creditsToRub(baseCredits(modelId, params));
        return role == Role.USER ? admin.multiply(USER_MARKUP) : admin;
    }

    /** Price of a model with every parameter at its schema default. */
    public static BigDecimal minimumPrice(ModelSchema schema, Role role) {
        return price(schema.id, schema.defaults(), role);
    }

    public static String format(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
