package com.dinoventures.ledger.controller;

import com.dinoventures.ledger.model.AccountType;
import com.dinoventures.ledger.model.Ledger;
import com.dinoventures.ledger.model.dto.AccountResponse;
import com.dinoventures.ledger.model.dto.OpenAccountRequest;
import com.dinoventures.ledger.service.BankService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AccountController {

    private final BankService bankService;

    /**
     * GET /health
     * Liveness probe. Returns 200 while the service is running.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * GET /api/v1/accounts
     * Summary of every account, ordered by account number.
     */
    @GetMapping("/api/v1/accounts")
    public ResponseEntity<List<AccountResponse>> listAccounts() {
        return ResponseEntity.ok(bankService.getAllAccounts().stream()
                .map(AccountResponse::from)
                .toList());
    }

    /**
     * POST /api/v1/accounts
     * Opens a savings or checking account with an empty ledger.
     */
    @PostMapping("/api/v1/accounts")
    public ResponseEntity<AccountResponse> openAccount(@Valid @RequestBody OpenAccountRequest req) {
        Ledger ledger = bankService.openAccount(AccountType.fromName(req.getType()));
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(ledger));
    }

    /**
     * GET /api/v1/accounts/{number}
     * A single account with its current balance.
     */
    @GetMapping("/api/v1/accounts/{number}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("number") long accountNumber) {
        return ResponseEntity.ok(AccountResponse.from(bankService.getAccount(accountNumber)));
    }
}
