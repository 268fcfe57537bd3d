package com.flagship.statement_report.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the account registry from the ledger text.
 *
 * Each line has the form {@code <number> "<customer>" <balance>} where the
 * balance carries at least one fraction digit. Lines that do not match are
 * dropped without error, and no partial account is ever created for them.
 * A later line with the same account number replaces the earlier one.
 */
@Component
@Slf4j
public class AccountLoader {

    private static final Pattern LEDGER_LINE =
        Pattern.compile("(\\d+)\\s+\"([^\"]*)\"\\s+(\\d+\\.\\d+)");

    private static final String LINE_SEPARATOR = "\r\n|\r|\n";

    public LedgerLoadResult load(String ledgerText) {
        SortedMap<Integer, Account> accounts = new TreeMap<>();
        int skipped = 0;

        String[] lines = ledgerText.split(LINE_SEPARATOR);
        for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
            String line = lines[lineIndex].trim();
            if (line.isEmpty()) {
                continue;
            }
            Account account = parseLine(line);
            if (account == null) {
                log.debug("Skipping ledger line {}: {}", lineIndex + 1, line);
                skipped++;
                continue;
            }
            accounts.put(account.getAccountNumber(), account);
        }

        return new LedgerLoadResult(Collections.unmodifiableSortedMap(accounts), skipped);
    }

    /**
     * Parses a single ledger line.
     *
     * @return the account, or null if the line is not a valid ledger entry
     */
    Account parseLine(String line) {
        Matcher matcher = LEDGER_LINE.matcher(line.trim());
        if (!matcher.matches()) {
            return null;
        }
        int accountNumber;
        try {
            accountNumber = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            // digits only, so this is an overflow
            return null;
        }
        return Account.opened(accountNumber, matcher.group(2), new BigDecimal(matcher.group(3)));
    }
}
