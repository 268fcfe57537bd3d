package com.flagship.statement_report.statement;

import com.flagship.statement_report.exception.MissingInputFileException;
import com.flagship.statement_report.exception.StatementWriteException;
import com.flagship.statement_report.ledger.AccountLoader;
import com.flagship.statement_report.ledger.BalanceReconciler;
import com.flagship.statement_report.observability.StatementMetrics;
import com.flagship.statement_report.transaction.TransactionGrouper;
import com.flagship.statement_report.transaction.TransactionParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests for the statement pipeline without a Spring context.
 *
 * These tests verify that:
 * - Counts in the summary and metrics match the inputs
 * - A missing input stops the run before anything is written
 * - A write failure surfaces as a fatal error
 */
class StatementReportServiceTest {

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry meterRegistry;
    private StatementWriter writer;
    private StatementReportService service;

    private Path ledger;
    private Path transactions;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        meterRegistry = new SimpleMeterRegistry();
        writer = mock(StatementWriter.class);
        service = new StatementReportService(
            new AccountLoader(),
            new TransactionParser(),
            new TransactionGrouper(),
            new BalanceReconciler(),
            new StatementRenderer(),
            writer,
            new StatementMetrics(meterRegistry));

        ledger = tempDir.resolve("accounts.txt");
        transactions = tempDir.resolve("transactions.txt");
        output = tempDir.resolve("statements.txt");

        Files.writeString(ledger, "200 \"Bob\" 100.0\nbroken line\n100 \"Jane Doe\" 250.00\n");
        Files.writeString(transactions, String.join("\n",
            "purchase\t200\t2024-01-02\tMart\t25.00",
            "payment\t200\t2024-01-03\tcredit\t1234\t40.00",
            "purchase\t404\t2024-01-03\tNowhere\t1.00",
            "refund\t100\t2024-01-04\tShop\t9.00",
            ""));
    }

    @Test
    @DisplayName("Summary reports accounts, transactions, unmatched and skipped lines")
    void testSummary() {
        ReportSummary summary = service.generate(ledger, transactions, output);

        assertEquals(2, summary.getAccountsRendered());
        assertEquals(4, summary.getTransactionsParsed());
        assertEquals(1, summary.getUnmatchedTransactions());
        assertEquals(1, summary.getSkippedLedgerLines());
        assertEquals(output, summary.getOutputFile());
        assertNotNull(summary.getRunId());
        verify(writer).write(any(Path.class), anyString());
    }

    @Test
    @DisplayName("Metrics count loaded accounts, parsed types and unmatched transactions")
    void testMetrics() {
        service.generate(ledger, transactions, output);

        assertEquals(2.0, meterRegistry.get("statement.ledger.accounts.loaded").counter().count());
        assertEquals(1.0, meterRegistry.get("statement.ledger.lines.skipped").counter().count());
        assertEquals(2.0, meterRegistry.get("statement.transactions.parsed").tag("type", "purchase").counter().count());
        assertEquals(1.0, meterRegistry.get("statement.transactions.parsed").tag("type", "payment").counter().count());
        assertEquals(1.0, meterRegistry.get("statement.transactions.parsed").tag("type", "unknown").counter().count());
        assertEquals(1.0, meterRegistry.get("statement.transactions.unmatched").counter().count());
        assertEquals(2.0, meterRegistry.get("statement.accounts.reconciled").counter().count());
        assertEquals(1L, meterRegistry.get("statement.run.duration").timer().count());
    }

    @Test
    @DisplayName("Bytes that are not valid UTF-8 do not stop the run")
    void testInvalidUtf8DoesNotAbortRun() throws IOException {
        Files.write(transactions, "purchase\t200\tts\tCaf\u00e9\t25.00\npayment\t200\tts\tcash\t40.00\n"
            .getBytes(StandardCharsets.ISO_8859_1));

        ReportSummary summary = service.generate(ledger, transactions, output);

        assertEquals(2, summary.getTransactionsParsed());
        assertEquals(2, summary.getAccountsRendered());
        verify(writer).write(eq(output), contains("Final balance: 115.00\n"));
    }

    @Test
    @DisplayName("Missing ledger file is fatal and nothing is written")
    void testMissingLedger() {
        Path missing = tempDir.resolve("missing.txt");

        MissingInputFileException e = assertThrows(MissingInputFileException.class,
            () -> service.generate(missing, transactions, output));

        assertEquals(missing, e.getPath());
        verify(writer, never()).write(any(), any());
    }

    @Test
    @DisplayName("Missing transaction file is fatal and nothing is written")
    void testMissingTransactions() {
        assertThrows(MissingInputFileException.class,
            () -> service.generate(ledger, tempDir.resolve("none.txt"), output));

        verify(writer, never()).write(any(), any());
    }

    @Test
    @DisplayName("Write failure propagates to the caller")
    void testWriteFailure() {
        doThrow(new StatementWriteException(output, new IOException("disk full")))
            .when(writer).write(any(Path.class), anyString());

        assertThrows(StatementWriteException.class, () -> service.generate(ledger, transactions, output));
    }
}
