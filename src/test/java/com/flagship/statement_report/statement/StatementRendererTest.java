package com.flagship.statement_report.statement;

import com.flagship.statement_report.ledger.Account;
import com.flagship.statement_report.ledger.BalanceReconciler;
import com.flagship.statement_report.transaction.PaymentMethod;
import com.flagship.statement_report.transaction.Transaction;
import com.flagship.statement_report.transaction.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatementRendererTest {

    private final StatementRenderer renderer = new StatementRenderer();
    private final BalanceReconciler reconciler = new BalanceReconciler();

    private static final Transaction MART = new Transaction(TransactionType.PURCHASE, 0, 200,
        "2024-01-02 09:00", "Mart", PaymentMethod.PURCHASE, "", new BigDecimal("25.00"));
    private static final Transaction CREDIT = new Transaction(TransactionType.PAYMENT, 1, 200,
        "2024-01-03 10:00", "credit", PaymentMethod.CREDIT, "1234", new BigDecimal("40.00"));
    private static final Transaction CASH = new Transaction(TransactionType.PAYMENT, 2, 200,
        "2024-01-04", "cash", PaymentMethod.CASH, "", new BigDecimal("5"));
    private static final Transaction REFUND = new Transaction(TransactionType.UNKNOWN, 3, 200,
        "2024-01-05", "Mart", PaymentMethod.PURCHASE, "", new BigDecimal("3.00"));

    @Test
    @DisplayName("Statement block lists header, transactions and totals")
    void testRenderBlock() {
        Account account = Account.opened(200, "Bob", new BigDecimal("100.0"));

        String block = renderer.render(account, List.of(MART, CREDIT));

        String expected = "Account 200 - Bob - Starting balance: 100.00\n"
            + "  2024-01-02 09:00  Mart  Purchase  25.00\n"
            + "  2024-01-03 10:00  Credit  #1234  40.00\n"
            + "Total purchases: 25.00\n"
            + "Total payments: 40.00\n"
            + "Final balance: 115.00\n"
            + StatementRenderer.SEPARATOR + "\n";
        assertEquals(expected, block);
    }

    @Test
    @DisplayName("Merchant only shown for purchases, number only when present")
    void testTransactionLine() {
        assertEquals("2024-01-04  Cash  5.00", renderer.transactionLine(CASH));
        assertEquals("2024-01-05  Purchase  3.00", renderer.transactionLine(REFUND));

        Transaction noTimestamp = new Transaction(TransactionType.PURCHASE, 9, 1, "", "",
            PaymentMethod.PURCHASE, "", new BigDecimal("0.00"));
        assertEquals("Purchase  0.00", renderer.transactionLine(noTimestamp));
    }

    @Test
    @DisplayName("Statement totals agree with the reconciled balance")
    void testTotalsMatchReconciler() {
        Account account = Account.opened(200, "Bob", new BigDecimal("100.0"));
        List<Transaction> transactions = List.of(MART, CREDIT, CASH, REFUND);

        StatementTotals totals = StatementTotals.of(account.getStartingBalance(), transactions);
        Account reconciled = reconciler.reconcile(account, Map.of(200, transactions));

        assertEquals(0, totals.getFinalBalance().compareTo(reconciled.getBalance()));
        assertEquals(0, new BigDecimal("25.00").compareTo(totals.getTotalPurchases()));
        assertEquals(0, new BigDecimal("45.00").compareTo(totals.getTotalPayments()));
        assertEquals(0, new BigDecimal("120.00").compareTo(totals.getFinalBalance()));
    }

    @Test
    @DisplayName("Account without transactions shows zero totals")
    void testEmptyStatement() {
        Account account = Account.opened(5, "Quiet", new BigDecimal("7.5"));

        String block = renderer.render(account, List.of());

        assertTrue(block.contains("Total purchases: 0.00\n"));
        assertTrue(block.contains("Total payments: 0.00\n"));
        assertTrue(block.contains("Final balance: 7.5\n"));
    }

    @Test
    @DisplayName("renderAll follows account order and skips transactions with no account")
    void testRenderAll() {
        Map<Integer, Account> accounts = new LinkedHashMap<>();
        accounts.put(100, Account.opened(100, "Jane", new BigDecimal("1.00")));
        accounts.put(200, Account.opened(200, "Bob", new BigDecimal("100.0")));
        Map<Integer, List<Transaction>> groups = Map.of(
            200, List.of(MART),
            999, List.of(new Transaction(TransactionType.PURCHASE, 5, 999, "", "Ghost",
                PaymentMethod.PURCHASE, "", new BigDecimal("1.00"))));

        String report = renderer.renderAll(accounts, groups);

        assertTrue(report.indexOf("Account 100") < report.indexOf("Account 200"));
        assertFalse(report.contains("Ghost"));
        assertFalse(report.contains("999"));
    }
}
