package com.flagship.statement_report.transaction;

import lombok.Value;

/**
 * Result of reading the payment-method fields of a log line.
 *
 * {@code amountText} is the raw amount field the method layout points at.
 * It is informational: the stored transaction amount comes from the
 * record-level field selection in {@link TransactionParser}.
 */
@Value
public class PaymentDetails {

    public static final PaymentDetails NOT_A_PAYMENT = new PaymentDetails(PaymentMethod.PURCHASE, "", "");

    PaymentMethod method;
    String referenceNumber;
    String amountText;
}
