package com.flagship.statement_report.transaction;

/**
 * How a transaction was settled, as shown on the statement.
 *
 * {@link #PURCHASE} is the implicit method of every non-payment transaction.
 */
public enum PaymentMethod {
    CASH("Cash"),
    CREDIT("Credit"),
    CHECK("Check"),
    UNKNOWN("Unknown"),
    PURCHASE("Purchase");

    private final String displayName;

    PaymentMethod(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether this method carries a card or check number.
     */
    public boolean hasReferenceNumber() {
        return this == CREDIT || this == CHECK;
    }
}
