package com.flagship.statement_report.ledger;

import lombok.Value;

import java.util.SortedMap;

/**
 * Outcome of loading the ledger: the account registry keyed by account
 * number plus the number of non-blank lines that did not match the
 * ledger line format.
 */
@Value
public class LedgerLoadResult {
    SortedMap<Integer, Account> accounts;
    int skippedLines;
}
