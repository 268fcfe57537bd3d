package com.flagship.statement_report.transaction;

import java.util.Locale;

/**
 * Transaction type tag taken from the first field of a log line.
 */
public enum TransactionType {
    /**
     * Money paid into the account. Increases the balance.
     */
    PAYMENT,

    /**
     * Money spent at a merchant. Decreases the balance.
     */
    PURCHASE,

    /**
     * Any other tag. Kept in the statement but never moves the balance.
     */
    UNKNOWN;

    public static TransactionType fromTag(String tag) {
        if (tag == null) {
            return UNKNOWN;
        }
        return switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "payment" -> PAYMENT;
            case "purchase" -> PURCHASE;
            default -> UNKNOWN;
        };
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
