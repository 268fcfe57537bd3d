package com.flagship.statement_report.statement;

import com.flagship.statement_report.exception.StatementReportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs one statement batch when the application starts.
 *
 * File locations come from configuration and can be overridden on the
 * command line, e.g. {@code --statement.output-file=out/statements.txt}.
 * A fatal error propagates so the process exits with a failure status.
 */
@Component
@ConditionalOnProperty(name = "statement.job.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class StatementJobRunner implements CommandLineRunner {

    private final StatementReportService statementReportService;
    private final Path ledgerFile;
    private final Path transactionsFile;
    private final Path outputFile;

    public StatementJobRunner(StatementReportService statementReportService,
                              @Value("${statement.ledger-file:accounts.txt}") String ledgerFile,
                              @Value("${statement.transactions-file:transactions.txt}") String transactionsFile,
                              @Value("${statement.output-file:statements.txt}") String outputFile) {
        this.statementReportService = statementReportService;
        this.ledgerFile = Path.of(ledgerFile);
        this.transactionsFile = Path.of(transactionsFile);
        this.outputFile = Path.of(outputFile);
    }

    @Override
    public void run(String... args) {
        try {
            ReportSummary summary = statementReportService.generate(ledgerFile, transactionsFile, outputFile);
            log.info("Statement run {} complete: {} accounts, {} transactions, {} unmatched",
                    summary.getRunId(), summary.getAccountsRendered(),
                    summary.getTransactionsParsed(), summary.getUnmatchedTransactions());
        } catch (StatementReportException e) {
            log.error("Statement run failed: {}", e.getMessage(), e);
            throw e;
        }
    }
}
