package com.flagship.statement_report.statement;

import com.flagship.statement_report.amount.AmountFormatter;
import com.flagship.statement_report.ledger.Account;
import com.flagship.statement_report.transaction.Transaction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lays out the plain-text statement, one block per account.
 *
 * Totals are recomputed here from the transactions being printed, so the
 * footer always describes exactly the lines above it.
 */
@Component
public class StatementRenderer {

    static final String SEPARATOR = "-".repeat(50);

    private static final String INDENT = "  ";
    private static final String COLUMN_GAP = "  ";

    /**
     * Renders every account in the iteration order of {@code accounts}.
     */
    public String renderAll(Map<Integer, Account> accounts, Map<Integer, List<Transaction>> transactionsByAccount) {
        StringBuilder report = new StringBuilder();
        for (Account account : accounts.values()) {
            List<Transaction> transactions =
                transactionsByAccount.getOrDefault(account.getAccountNumber(), List.of());
            report.append(render(account, transactions));
        }
        return report.toString();
    }

    public String render(Account account, List<Transaction> transactions) {
        StatementTotals totals = StatementTotals.of(account.getStartingBalance(), transactions);
        StringBuilder block = new StringBuilder();

        block.append("Account ").append(account.getAccountNumber())
            .append(" - ").append(account.getCustomerInfo())
            .append(" - Starting balance: ").append(AmountFormatter.format(account.getStartingBalance()))
            .append('\n');

        for (Transaction transaction : transactions) {
            block.append(INDENT).append(transactionLine(transaction)).append('\n');
        }

        block.append("Total purchases: ").append(AmountFormatter.format(totals.getTotalPurchases())).append('\n');
        block.append("Total payments: ").append(AmountFormatter.format(totals.getTotalPayments())).append('\n');
        block.append("Final balance: ").append(AmountFormatter.format(totals.getFinalBalance())).append('\n');
        block.append(SEPARATOR).append('\n');
        return block.toString();
    }

    String transactionLine(Transaction transaction) {
        List<String> columns = new ArrayList<>();
        if (!transaction.getTimestamp().isEmpty()) {
            columns.add(transaction.getTimestamp());
        }
        if (transaction.isPurchase() && !transaction.getMerchant().isEmpty()) {
            columns.add(transaction.getMerchant());
        }
        columns.add(transaction.getPaymentMethod().getDisplayName());
        if (!transaction.getCardOrCheckNumber().isEmpty()) {
            columns.add("#" + transaction.getCardOrCheckNumber());
        }
        columns.add(AmountFormatter.format(transaction.getAmount()));
        return String.join(COLUMN_GAP, columns);
    }
}
