package com.dinoventures.ledger.exception;

public class OverdraftException extends LedgerException {

    public OverdraftException() {
        super("This transaction could not be completed due to an insufficient account balance.");
    }

    @Override
    public String getCode() {
        return "OVERDRAFT";
    }
}
