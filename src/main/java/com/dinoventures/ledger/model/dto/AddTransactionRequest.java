package com.dinoventures.ledger.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Positive amount = deposit, negative amount = withdrawal. Date as YYYY-MM-DD.
 */
@Data
public class AddTransactionRequest {

    @NotNull(message = "amount is required")
    private BigDecimal amount;

    @NotNull(message = "date is required")
    private LocalDate date;
}
