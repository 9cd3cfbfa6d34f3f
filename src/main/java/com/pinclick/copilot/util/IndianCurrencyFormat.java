package com.pinclick.copilot.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Crore/lakh shorthand for rupee amounts: 10,000,000 renders as "1Cr", 8,800,000 as "88L".
 */
public final class IndianCurrencyFormat {

    public static final long ONE_CRORE = 10_000_000L;
    public static final long ONE_LAKH = 100_000L;

    private static final Pattern AMOUNT = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*(cr|crs|crore|crores|l|lac|lacs|lakh|lakhs)?\\b");

    private IndianCurrencyFormat() {
    }

    /**
     * Reads "1.2 Cr", "85 lakhs", "85L" or a plain rupee figure into whole rupees.
     */
    public static Optional<Long> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = AMOUNT.matcher(text.replace(",", "").toLowerCase(Locale.ROOT));
        if (!m.find()) {
            return Optional.empty();
        }
        BigDecimal number = new BigDecimal(m.group(1));
        String unit = m.group(2);
        if (unit != null) {
            long multiplier = unit.startsWith("c") ? ONE_CRORE : ONE_LAKH;
            number = number.multiply(BigDecimal.valueOf(multiplier));
        }
        return Optional.of(number.setScale(0, RoundingMode.HALF_UP).longValue());
    }

    public static String format(long amount) {
        if (Math.abs(amount) >= ONE_CRORE) {
            return oneDecimal(amount, ONE_CRORE) + "Cr";
        }
        return oneDecimal(amount, ONE_LAKH) + "L";
    }

    private static String oneDecimal(long amount, long unit) {
        BigDecimal value = BigDecimal.valueOf(amount)
                .divide(BigDecimal.valueOf(unit), 1, RoundingMode.HALF_UP);
        if (value.stripTrailingZeros().scale() <= 0) {
            return value.setScale(0, RoundingMode.UNNECESSARY).toPlainString();
        }
        return value.toPlainString();
    }
}
