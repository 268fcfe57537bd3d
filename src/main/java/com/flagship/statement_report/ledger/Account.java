package com.flagship.statement_report.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Domain model for a customer account read from the ledger.
 *
 * The starting balance is fixed when the ledger is loaded. The current
 * balance is derived from the transaction history on every reconciliation
 * and is carried in a new instance rather than mutated.
 */
@Value
public class Account {
    int accountNumber;
    String customerInfo;
    BigDecimal startingBalance;
    BigDecimal balance;

    /**
     * Creates a freshly loaded account whose balance equals its starting balance.
     */
    public static Account opened(int accountNumber, String customerInfo, BigDecimal startingBalance) {
        return new Account(accountNumber, customerInfo, startingBalance, startingBalance);
    }

    /**
     * @return a copy of this account carrying the given balance
     */
    public Account withBalance(BigDecimal newBalance) {
        return new Account(accountNumber, customerInfo, startingBalance, newBalance);
    }
}
