package com.flagship.statement_report.statement;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * What a statement run produced.
 */
@Value
@Builder
public class ReportSummary {
    String runId;
    Path outputFile;
    int accountsRendered;
    int transactionsParsed;
    int unmatchedTransactions;
    int skippedLedgerLines;
}
