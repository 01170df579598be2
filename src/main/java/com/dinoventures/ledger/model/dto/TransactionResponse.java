package com.dinoventures.ledger.model.dto;

import com.dinoventures.ledger.model.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@AllArgsConstructor
public class TransactionResponse {
    private LocalDate date;
    private BigDecimal amount;
    private boolean exempt;
    /**
     * Display line, e.g. "2024-01-31, $-5.75".
     */
    private String display;

    public static TransactionResponse from(Transaction transaction) {
        return new TransactionResponse(
                transaction.getDate(),
                transaction.getAmount(),
                transaction.isExempt(),
                transaction.toString()
        );
    }
}
