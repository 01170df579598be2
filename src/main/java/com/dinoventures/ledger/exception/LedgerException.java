package com.dinoventures.ledger.exception;

/**
 * Base type for every rejection raised by a ledger's admission or assessment routine.
 * The ledger is left unchanged whenever one of these is thrown.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    /**
     * Short machine-readable code used in API error bodies.
     */
    public abstract String getCode();
}
