package com.dinoventures.ledger.exception;

import java.time.LocalDate;

/**
 * Raised when a transaction is dated before the ledger's latest transaction,
 * or when interest and fees are assessed twice for the same month.
 */
public class TransactionSequenceException extends LedgerException {

    private final LocalDate latestDate;

    public TransactionSequenceException(LocalDate latestDate) {
        this(latestDate, "New transactions must be from " + latestDate + " onward.");
    }

    public TransactionSequenceException(LocalDate latestDate, String message) {
        super(message);
        this.latestDate = latestDate;
    }

    public LocalDate getLatestDate() {
        return latestDate;
    }

    @Override
    public String getCode() {
        return "TRANSACTION_SEQUENCE";
    }
}
