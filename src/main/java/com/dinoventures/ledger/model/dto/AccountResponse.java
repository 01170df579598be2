package com.dinoventures.ledger.model.dto;

import com.dinoventures.ledger.model.Ledger;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
public class AccountResponse {
    private Long accountNumber;
    private String type;
    private BigDecimal balance;
    /**
     * YYYY-MM of the last interest/fee assessment, null if never assessed.
     */
    private String lastAssessedPeriod;
    /**
     * Display line, e.g. "Checking#000000002,\tbalance: $44.29".
     */
    private String summary;

    public static AccountResponse from(Ledger ledger) {
        return new AccountResponse(
                ledger.getAccountNumber(),
                ledger.getType().getDisplayName(),
                ledger.getBalance(),
                ledger.getLastAssessedPeriod() != null ? ledger.getLastAssessedPeriod().toString() : null,
                ledger.toString()
        );
    }
}
