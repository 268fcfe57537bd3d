package com.flagship.statement_report.transaction;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions parsed transactions by account number.
 *
 * Each group lists its transactions in ascending sequence number, which is
 * file order. Every input transaction lands in exactly one group, including
 * those whose account number has no ledger entry.
 */
@Component
public class TransactionGrouper {

    public Map<Integer, List<Transaction>> groupByAccount(List<Transaction> transactions) {
        Map<Integer, List<Transaction>> groups = new LinkedHashMap<>();
        for (Transaction transaction : transactions) {
            groups.computeIfAbsent(transaction.getAccountNumber(), key -> new ArrayList<>())
                .add(transaction);
        }

        Map<Integer, List<Transaction>> ordered = new LinkedHashMap<>();
        groups.forEach((accountNumber, group) -> {
            group.sort(Comparator.comparingLong(Transaction::getSequenceNumber));
            ordered.put(accountNumber, Collections.unmodifiableList(group));
        });
        return Collections.unmodifiableMap(ordered);
    }
}
