package com.flagship.statement_report.statement;

import com.flagship.statement_report.transaction.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Subtotals shown at the foot of a statement.
 *
 * Invariant: finalBalance = startingBalance + totalPayments - totalPurchases.
 */
@Value
public class StatementTotals {
    BigDecimal totalPurchases;
    BigDecimal totalPayments;
    BigDecimal finalBalance;

    /**
     * Computes the totals from exactly the transactions shown on the statement.
     */
    public static StatementTotals of(BigDecimal startingBalance, List<Transaction> transactions) {
        BigDecimal purchases = transactions.stream()
            .filter(Transaction::isPurchase)
            .map(Transaction::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal payments = transactions.stream()
            .filter(Transaction::isPayment)
            .map(Transaction::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new StatementTotals(purchases, payments, startingBalance.add(payments).subtract(purchases));
    }
}
