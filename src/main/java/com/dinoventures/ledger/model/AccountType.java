package com.dinoventures.ledger.model;

import java.util.Locale;

public enum AccountType {
    SAVINGS("Savings"),
    CHECKING("Checking");

    private final String displayName;

    AccountType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Case-insensitive lookup of "savings" / "checking".
     *
     * @throws IllegalArgumentException for any other value
     */
    public static AccountType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown account type: " + name, e);
        }
    }
}
