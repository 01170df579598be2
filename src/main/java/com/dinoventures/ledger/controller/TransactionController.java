package com.dinoventures.ledger.controller;

import com.dinoventures.ledger.model.Transaction;
import com.dinoventures.ledger.model.dto.AccountResponse;
import com.dinoventures.ledger.model.dto.AddTransactionRequest;
import com.dinoventures.ledger.model.dto.AssessmentResponse;
import com.dinoventures.ledger.model.dto.TransactionResponse;
import com.dinoventures.ledger.service.BankService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/accounts/{number}")
@RequiredArgsConstructor
public class TransactionController {

    private final BankService bankService;

    /**
     * GET /api/v1/accounts/{number}/transactions
     * Transactions sorted by date; same-day entries in the order they were added.
     */
    @GetMapping("/transactions")
    public ResponseEntity<List<TransactionResponse>> listTransactions(@PathVariable("number") long accountNumber) {
        return ResponseEntity.ok(bankService.listTransactions(accountNumber).stream()
                .map(TransactionResponse::from)
                .toList());
    }

    /**
     * POST /api/v1/accounts/{number}/transactions
     *
     * Admits a user transaction. Returns 422 if it is out of date order,
     * would overdraw the account, or breaks a savings rate limit.
     */
    @PostMapping("/transactions")
    public ResponseEntity<TransactionResponse> addTransaction(
            @PathVariable("number") long accountNumber,
            @Valid @RequestBody AddTransactionRequest req) {

        Transaction admitted = bankService.addTransaction(accountNumber, req.getAmount(), req.getDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(admitted));
    }

    /**
     * POST /api/v1/accounts/{number}/interest-and-fees
     *
     * Appends the month's interest and any low-balance fee.
     * Returns 422 if the month of the latest transaction was already assessed.
     */
    @PostMapping("/interest-and-fees")
    public ResponseEntity<AssessmentResponse> assessInterestAndFees(@PathVariable("number") long accountNumber) {
        List<TransactionResponse> assessed = bankService.assessInterestAndFees(accountNumber).stream()
                .map(TransactionResponse::from)
                .toList();
        AccountResponse account = AccountResponse.from(bankService.getAccount(accountNumber));
        return ResponseEntity.ok(new AssessmentResponse(account, assessed));
    }
}
