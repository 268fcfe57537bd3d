package com.flagship.statement_report.ledger;

import com.flagship.statement_report.transaction.Transaction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Derives an account's current balance from its transaction history.
 *
 * Balances are never adjusted in place: every call folds the full
 * transaction group over the starting balance and returns a new
 * {@link Account}. Neither the account nor the transaction map is modified.
 */
@Component
public class BalanceReconciler {

    /**
     * @param account account as loaded from the ledger
     * @param transactionsByAccount all transactions grouped by account number
     * @return a copy of the account carrying the reconciled balance
     */
    public Account reconcile(Account account, Map<Integer, List<Transaction>> transactionsByAccount) {
        List<Transaction> transactions =
            transactionsByAccount.getOrDefault(account.getAccountNumber(), List.of());

        BigDecimal balance = account.getStartingBalance();
        for (Transaction transaction : transactions) {
            balance = apply(balance, transaction);
        }
        return account.withBalance(balance);
    }

    /**
     * Payments add, purchases subtract, anything else leaves the balance as is.
     */
    static BigDecimal apply(BigDecimal balance, Transaction transaction) {
        return switch (transaction.getType()) {
            case PAYMENT -> balance.add(transaction.getAmount());
            case PURCHASE -> balance.subtract(transaction.getAmount());
            case UNKNOWN -> balance;
        };
    }
}
