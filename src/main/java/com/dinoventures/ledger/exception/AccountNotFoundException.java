package com.dinoventures.ledger.exception;

public class AccountNotFoundException extends RuntimeException {
    public AccountNotFoundException(long accountNumber) {
        super(String.format("Account not found: number=%09d", accountNumber));
    }
}
