package com.flagship.statement_report.transaction;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One parsed line of the transaction log. Immutable once created.
 */
@Value
public class Transaction {

    /**
     * Account number given to lines whose account field is not an integer.
     * Ledger account numbers are positive, so it never matches an account.
     */
    public static final int UNPARSED_ACCOUNT_NUMBER = -1;

    TransactionType type;
    long sequenceNumber;
    int accountNumber;
    String timestamp;
    String merchant;
    PaymentMethod paymentMethod;
    String cardOrCheckNumber;
    BigDecimal amount;

    public boolean isPayment() {
        return type == TransactionType.PAYMENT;
    }

    public boolean isPurchase() {
        return type == TransactionType.PURCHASE;
    }
}
