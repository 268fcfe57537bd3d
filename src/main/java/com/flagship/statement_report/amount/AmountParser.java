package com.flagship.statement_report.amount;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Lenient parser for monetary amounts found in the transaction log.
 *
 * Accepted form: optional leading minus, one or more digits, optionally a
 * decimal point followed by one or more digits. Anything else parses to
 * {@link #ZERO}. A corrupted field must never abort the batch, so this
 * class never throws.
 */
public final class AmountParser {

    public static final BigDecimal ZERO = new BigDecimal("0.00");

    private static final Pattern AMOUNT = Pattern.compile("-?\\d+(\\.\\d+)?");

    private AmountParser() {
        // Utility class
    }

    /**
     * Parses a token into an amount.
     *
     * @param token raw field text, may be null or carry surrounding whitespace
     * @return the parsed amount, or {@link #ZERO} when the token is malformed
     */
    public static BigDecimal parse(String token) {
        if (token == null) {
            return ZERO;
        }
        String trimmed = token.trim();
        if (!AMOUNT.matcher(trimmed).matches()) {
            return ZERO;
        }
        return new BigDecimal(trimmed);
    }

    /**
     * Checks whether a token would parse to a real value instead of the default.
     */
    public static boolean isWellFormed(String token) {
        return token != null && AMOUNT.matcher(token.trim()).matches();
    }
}
