package com.flagship.statement_report.amount;

import java.math.BigDecimal;

/**
 * Renders amounts for the statement report.
 *
 * The amount is written in its plain decimal form with at least one
 * fraction digit. A single trailing ".0" is widened to ".00"; any other
 * fraction is passed through as-is, so "3.1" stays "3.1".
 */
public final class AmountFormatter {

    private AmountFormatter() {
        // Utility class
    }

    public static String format(BigDecimal amount) {
        if (amount == null) {
            amount = AmountParser.ZERO;
        }
        BigDecimal display = amount.scale() < 1 ? amount.setScale(1) : amount;
        String rendered = display.toPlainString();
        if (rendered.endsWith(".0")) {
            return rendered + "0";
        }
        return rendered;
    }
}
