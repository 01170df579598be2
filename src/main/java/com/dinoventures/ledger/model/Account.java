package com.dinoventures.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.time.YearMonth;

/**
 * Persisted header of a ledger: everything except its transactions.
 */
@Data
@Builder
public class Account {
    private Long accountNumber;
    private AccountType type;
    private YearMonth lastAssessedPeriod;
    private OffsetDateTime createdAt;
}
