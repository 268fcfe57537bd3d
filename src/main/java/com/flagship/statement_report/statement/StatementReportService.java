package com.flagship.statement_report.statement;

import com.flagship.statement_report.exception.MissingInputFileException;
import com.flagship.statement_report.ledger.Account;
import com.flagship.statement_report.ledger.AccountLoader;
import com.flagship.statement_report.ledger.BalanceReconciler;
import com.flagship.statement_report.ledger.LedgerLoadResult;
import com.flagship.statement_report.observability.RunContext;
import com.flagship.statement_report.observability.StatementMetrics;
import com.flagship.statement_report.transaction.Transaction;
import com.flagship.statement_report.transaction.TransactionGrouper;
import com.flagship.statement_report.transaction.TransactionParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the statement pipeline end to end.
 *
 * Order of work:
 * 1. Load the ledger into the account registry
 * 2. Parse the transaction log and group it by account
 * 3. Reconcile each account, in ascending account number
 * 4. Render and write the report
 *
 * Both inputs are read in full before anything is written, so a missing
 * input leaves any previous report untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementReportService {

    private final AccountLoader accountLoader;
    private final TransactionParser transactionParser;
    private final TransactionGrouper transactionGrouper;
    private final BalanceReconciler balanceReconciler;
    private final StatementRenderer statementRenderer;
    private final StatementWriter statementWriter;
    private final StatementMetrics statementMetrics;

    /**
     * Produces the statement report.
     *
     * @param ledgerFile account ledger
     * @param transactionsFile tab-delimited transaction log
     * @param outputFile report destination, overwritten
     * @return summary of the run
     * @throws MissingInputFileException if an input cannot be read
     * @throws com.flagship.statement_report.exception.StatementWriteException if the report cannot be written
     */
    public ReportSummary generate(Path ledgerFile, Path transactionsFile, Path outputFile) {
        String runId = RunContext.begin();
        try {
            return statementMetrics.timeRun(() -> run(runId, ledgerFile, transactionsFile, outputFile));
        } finally {
            RunContext.clear();
        }
    }

    private ReportSummary run(String runId, Path ledgerFile, Path transactionsFile, Path outputFile) {
        log.info("Generating statements: ledger={}, transactions={}, output={}",
                ledgerFile, transactionsFile, outputFile);

        String ledgerText = readInput("Ledger file", ledgerFile);
        String transactionText = readInput("Transaction file", transactionsFile);

        LedgerLoadResult ledger = accountLoader.load(ledgerText);
        statementMetrics.recordLedgerLoaded(ledger.getAccounts().size(), ledger.getSkippedLines());
        log.info("Loaded {} accounts ({} ledger lines skipped)",
                ledger.getAccounts().size(), ledger.getSkippedLines());

        List<Transaction> transactions = transactionParser.parseAll(transactionText);
        transactions.forEach(transaction -> statementMetrics.recordTransactionParsed(transaction.getType()));
        Map<Integer, List<Transaction>> transactionsByAccount = transactionGrouper.groupByAccount(transactions);
        log.info("Parsed {} transactions for {} account numbers",
                transactions.size(), transactionsByAccount.size());

        int unmatched = countUnmatched(ledger.getAccounts(), transactionsByAccount);
        if (unmatched > 0) {
            statementMetrics.recordUnmatchedTransactions(unmatched);
            log.warn("{} transactions reference accounts missing from the ledger and are not reported", unmatched);
        }

        Map<Integer, Account> reconciled = reconcileAll(ledger.getAccounts(), transactionsByAccount);

        String report = statementRenderer.renderAll(reconciled, transactionsByAccount);
        statementWriter.write(outputFile, report);
        log.info("Wrote statements for {} accounts to {}", reconciled.size(), outputFile);

        return ReportSummary.builder()
                .runId(runId)
                .outputFile(outputFile)
                .accountsRendered(reconciled.size())
                .transactionsParsed(transactions.size())
                .unmatchedTransactions(unmatched)
                .skippedLedgerLines(ledger.getSkippedLines())
                .build();
    }

    /**
     * Reconciles every account independently, keeping registry order.
     */
    Map<Integer, Account> reconcileAll(Map<Integer, Account> accounts,
                                       Map<Integer, List<Transaction>> transactionsByAccount) {
        Map<Integer, Account> reconciled = new LinkedHashMap<>();
        for (Account account : accounts.values()) {
            RunContext.enterAccount(account.getAccountNumber());
            try {
                Account updated = balanceReconciler.reconcile(account, transactionsByAccount);
                log.debug("Reconciled balance {} -> {}", account.getStartingBalance(), updated.getBalance());
                reconciled.put(updated.getAccountNumber(), updated);
                statementMetrics.recordAccountReconciled();
            } finally {
                RunContext.leaveAccount();
            }
        }
        return reconciled;
    }

    private int countUnmatched(Map<Integer, Account> accounts,
                               Map<Integer, List<Transaction>> transactionsByAccount) {
        return transactionsByAccount.entrySet().stream()
                .filter(entry -> !accounts.containsKey(entry.getKey()))
                .mapToInt(entry -> entry.getValue().size())
                .sum();
    }

    /**
     * Reads an input file as UTF-8. Byte sequences that are not valid UTF-8
     * are replaced with U+FFFD so one badly encoded field cannot stop the run.
     */
    private String readInput(String description, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new MissingInputFileException(description, file);
        }
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MissingInputFileException(description, file, e);
        }
    }
}
