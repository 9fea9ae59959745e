package com.kiestudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic check of a payment screenshot: OCR text must look like a payment receipt and mention
 * the expected amount (or the recipient phone, when one is configured).
 * <p>
 * Fails open: without OCR, or when analysis itself breaks, the screenshot is accepted.
 */
public class PaymentVerifier {
    private static final Logger log = LoggerFactory.getLogger(PaymentVerifier.class);

    static final List<String> KEYWORDS = List.of(
            "перевод", "оплата", "платеж", "спб", "сбп", "payment", "transfer",
            "отправлено", "успешно", "success", "получатель", "сумма", "итого",
            "amount", "total", "переведено", "квитанция", "receipt", "статус",
            "status", "комиссия", "commission"
    );

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String CURRENCY = "[₽рубР]";
    private static final String AMOUNT_WORD = "(?:сумма|итого|перевод|amount|total)";

    // All matches are pooled before a candidate is selected.
    private static final List<Pattern> AMOUNT_PATTERNS = List.of(
            Pattern.compile("(\\d+[.,]\\d+)\\s*" + CURRENCY, FLAGS),
            Pattern.compile("(\\d+)\\s*" + CURRENCY, FLAGS),
            Pattern.compile(CURRENCY + "\\s*(\\d+[.,]\\d+)", FLAGS),
            Pattern.compile(CURRENCY + "\\s*(\\d+)", FLAGS),
            Pattern.compile(AMOUNT_WORD + "[:\\s]+(\\d+[.,]?\\d*)", FLAGS),
            Pattern.compile("(\\d+[.,]?\\d*)\\s*" + AMOUNT_WORD, FLAGS),
            Pattern.compile(AMOUNT_WORD + "[:\\s]*\\s*(\\d+[.,]?\\d*)\\s*" + CURRENCY + "?", FLAGS),
            // OCR often reads the ruble sign as B or 2
            Pattern.compile("(\\d+)\\s*[B2]", FLAGS),
            Pattern.compile("(\\d+)\\s*[₽рубРB2]", FLAGS),
            Pattern.compile("\\b(\\d{2,6})\\b", FLAGS)
    );

    private static final List<Pattern> PHONE_PATTERNS = List.of(
            Pattern.compile("\\+?7\\d{10}"),
            Pattern.compile("\\+?7\\s?\\d{3}\\s?\\d{3}\\s?\\d{2}\\s?\\d{2}"),
            Pattern.compile("\\d{11}"),
            Pattern.compile("\\+?\\d\\s?\\d{3}\\s?\\d{3}\\s?\\d{2}\\s?\\d{2}")
    );

    private static final BigDecimal CLOSE_ABSOLUTE = BigDecimal.ONE;
    private static final BigDecimal CLOSE_RELATIVE = new BigDecimal("0.1");
    private static final BigDecimal LOOSE_ABSOLUTE = BigDecimal.TEN;
    private static final BigDecimal PLAUSIBLE_MIN = BigDecimal.TEN;
    private static final BigDecimal PLAUSIBLE_MAX = new BigDecimal("100000");

    private final TextRecognizer recognizer;

    public PaymentVerifier(TextRecognizer recognizer) {
        this.recognizer = recognizer;
    }

    public boolean isOcrAvailable() {
        return recognizer.isAvailable();
    }

    public Verdict verify(byte[] image, BigDecimal expectedAmount, String expectedPhone) {
        if (!recognizer.isAvailable()) {
            log.warn("OCR unavailable, accepting payment screenshot without verification");
            return Verdict.failOpen("ℹ️ Автоматическая проверка скриншота недоступна, платеж принят.");
        }
        try {
            String text = recognizer.recognize(image);
            Verdict verdict = analyze(text, expectedAmount, expectedPhone);
            log.info("Screenshot verdict valid={} amountMatched={} phoneMatched={} keywords={} expected={}",
                    verdict.valid, verdict.amountMatched, verdict.phoneMatched, verdict.keywordsPresent, expectedAmount);
            return verdict;
        } catch (TextRecognizer.RecognitionException | RuntimeException e) {
            log.warn("Screenshot analysis failed, accepting payment: {}", e.getMessage(), e);
            return Verdict.failOpen("ℹ️ Не удалось проверить скриншот автоматически, платеж принят.");
        }
    }

    /**
     * Applies the keyword, amount and phone rules to already recognized text.
     */
    public Verdict analyze(String text, BigDecimal expectedAmount, String expectedPhone) {
        String source = text == null ? "" : text;
        boolean keywords = hasPaymentKeywords(source);
        Optional<BigDecimal> amount = matchAmount(extractAmounts(source), expectedAmount);
        boolean phoneExpected = expectedPhone != null && !expectedPhone.isBlank();
        Boolean phone = phoneExpected ? phoneMatches(source, expectedPhone) : null;

        boolean valid = phoneExpected
                ? (amount.isPresent() || phone) && keywords
                : amount.isPresent() && keywords;

        String message;
        if (valid) {
            message = "✅ Скриншот проверен: " + (amount.isPresent()
                    ? "найдена сумма " + Texts.rub(amount.get())
                    : "найден номер получателя") + ".";
        } else {
            List<String> problems = new ArrayList<>();
            if (!keywords) {
                problems.add("не похоже на квитанцию об оплате");
            }
            if (amount.isEmpty() && !Boolean.TRUE.equals(phone)) {
                problems.add("не найдена сумма " + Texts.rub(expectedAmount));
            }
            message = "❌ Не удалось подтвердить оплату: " + String.join(", ", problems) + ".";
        }
        return new Verdict(valid, amount.isPresent(), amount.orElse(null), phone, keywords, message, true);
    }

    public boolean hasPaymentKeywords(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return KEYWORDS.stream().anyMatch(lower::contains);
    }

    /** Every number any amount pattern finds, de-duplicated, largest first. */
    public List<BigDecimal> extractAmounts(String text) {
        TreeSet<BigDecimal> found = new TreeSet<>(Comparator.reverseOrder());
        for (Pattern pattern : AMOUNT_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String raw = m.group(1).replace(',', '.');
                if (raw.endsWith(".")) {
                    raw = raw.substring(0, raw.length() - 1);
                }
                try {
                    found.add(new BigDecimal(raw).stripTrailingZeros());
                } catch (NumberFormatException e) {
                    log.debug("Skipping unparsable amount '{}'", raw);
                }
            }
        }
        return new ArrayList<>(found);
    }

    static Optional<BigDecimal> matchAmount(List<BigDecimal> candidates, BigDecimal expected) {
        for (BigDecimal amount : candidates) {
            BigDecimal diff = amount.subtract(expected).abs();
            boolean relativeClose = expected.signum() > 0
                    && diff.divide(expected, MathContext.DECIMAL64).compareTo(CLOSE_RELATIVE) < 0;
            if (diff.compareTo(CLOSE_ABSOLUTE) < 0 || relativeClose) {
                return Optional.of(amount);
            }
        }
        for (BigDecimal amount : candidates) {
            if (amount.compareTo(PLAUSIBLE_MIN) >= 0 && amount.compareTo(PLAUSIBLE_MAX) <= 0
                    && amount.subtract(expected).abs().compareTo(LOOSE_ABSOLUTE) < 0) {
                return Optional.of(amount);
            }
        }
        return Optional.empty();
    }

    static boolean phoneMatches(String text, String expectedPhone) {
        String expected = normalizePhone(expectedPhone);
        String suffix = expected.length() > 10 ? expected.substring(expected.length() - 10) : expected;
        for (Pattern pattern : PHONE_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String candidate = normalizePhone(m.group());
                if (candidate.equals(expected) || candidate.endsWith(suffix)) {
                    return true;
                }
            }
        }
        return false;
    }

    static String normalizePhone(String phone) {
        return phone.replaceAll("[+\\s\\-()]", "");
    }

    public static final class Verdict {
        public final boolean valid;
        public final boolean amountMatched;
        public final BigDecimal matchedAmount;
        /** Null when no phone was expected. */
        public final Boolean phoneMatched;
        public final boolean keywordsPresent;
        public final String message;
        public final boolean checked;

        Verdict(boolean valid, boolean amountMatched, BigDecimal matchedAmount, Boolean phoneMatched,
                boolean keywordsPresent, String message, boolean checked) {
            this.valid = valid;
            this.amountMatched = amountMatched;
            this.matchedAmount = matchedAmount;
            this.phoneMatched = phoneMatched;
            this.keywordsPresent = keywordsPresent;
            this.message = message;
            this.checked = checked;
        }

        static Verdict failOpen(String message) {
            return new Verdict(true, false, null, null, false, message, false);
        }
    }
}
