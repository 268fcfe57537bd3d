package com.flagship.statement_report.observability;

import com.flagship.statement_report.transaction.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Counters for statement runs.
 *
 * Metrics exposed:
 * - statement.ledger.accounts.loaded: Accounts read from the ledger
 * - statement.ledger.lines.skipped: Ledger lines that did not match the line format
 * - statement.transactions.parsed: Transactions read, tagged by type
 * - statement.transactions.unmatched: Transactions with no ledger account
 * - statement.accounts.reconciled: Accounts reconciled and rendered
 * - statement.run.duration: Time taken by a full run
 */
@Component
public class StatementMetrics {

    private final MeterRegistry registry;

    private final Counter accountsLoaded;
    private final Counter ledgerLinesSkipped;
    private final Counter transactionsUnmatched;
    private final Counter accountsReconciled;

    private final Timer runTimer;

    public StatementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountsLoaded = Counter.builder("statement.ledger.accounts.loaded")
                .description("Number of accounts loaded from the ledger")
                .register(registry);

        this.ledgerLinesSkipped = Counter.builder("statement.ledger.lines.skipped")
                .description("Number of ledger lines dropped as malformed")
                .register(registry);

        this.transactionsUnmatched = Counter.builder("statement.transactions.unmatched")
                .description("Number of transactions whose account is not in the ledger")
                .register(registry);

        this.accountsReconciled = Counter.builder("statement.accounts.reconciled")
                .description("Number of accounts reconciled")
                .register(registry);

        this.runTimer = Timer.builder("statement.run.duration")
                .description("Time taken to produce the statement report")
                .register(registry);
    }

    public void recordLedgerLoaded(int accounts, int skippedLines) {
        accountsLoaded.increment(accounts);
        ledgerLinesSkipped.increment(skippedLines);
    }

    public void recordTransactionParsed(TransactionType type) {
        registry.counter("statement.transactions.parsed", "type", type.tag()).increment();
    }

    public void recordUnmatchedTransactions(int count) {
        transactionsUnmatched.increment(count);
    }

    public void recordAccountReconciled() {
        accountsReconciled.increment();
    }

    /**
     * Times a full run.
     */
    public <T> T timeRun(Supplier<T> operation) {
        return runTimer.record(operation);
    }
}
