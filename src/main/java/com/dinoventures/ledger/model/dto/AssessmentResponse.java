package com.dinoventures.ledger.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class AssessmentResponse {
    private AccountResponse account;
    /**
     * Interest first, then any fee. Empty when the account had no transactions.
     */
    private List<TransactionResponse> assessed;
}
