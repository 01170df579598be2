package com.dinoventures.ledger.service;

import com.dinoventures.ledger.exception.AccountNotFoundException;
import com.dinoventures.ledger.model.Account;
import com.dinoventures.ledger.model.AccountType;
import com.dinoventures.ledger.model.Ledger;
import com.dinoventures.ledger.model.Transaction;
import com.dinoventures.ledger.repository.AccountRepository;
import com.dinoventures.ledger.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * The account registry: opens accounts, looks them up, and runs ledger
 * operations against the persisted state.
 *
 * Every mutation follows the same steps inside a single DB transaction:
 *   1. Lock the account row (FOR UPDATE)
 *   2. Rebuild the ledger from its stored transactions
 *   3. Apply the domain operation (may throw a LedgerException)
 *   4. Insert only the newly appended transactions, at their insertion index
 *   5. Commit
 * A rejection in step 3 rolls back, so the stored ledger is never touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BankService {

    private final AccountRepository     accountRepo;
    private final TransactionRepository txRepo;
    private final AccountPolicies       policies;

    // =========================================================================
    // REGISTRY
    // =========================================================================

    @Transactional
    public Ledger openAccount(AccountType type) {
        Account account = accountRepo.save(type);
        log.debug("Created account: number={}, type={}", account.getAccountNumber(), type);
        return toLedger(account, List.of());
    }

    @Transactional(readOnly = true)
    public List<Ledger> getAllAccounts() {
        return accountRepo.findAll().stream()
                .map(this::load)
                .toList();
    }

    @Transactional(readOnly = true)
    public Ledger getAccount(long accountNumber) {
        Account account = accountRepo.findById(accountNumber)
                .orElseThrow(() -> new AccountNotFoundException(accountNumber));
        return load(account);
    }

    // =========================================================================
    // LEDGER OPERATIONS
    // =========================================================================

    /**
     * Admits a user transaction on the account.
     *
     * @throws com.dinoventures.ledger.exception.LedgerException if admission rejects it
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Transaction addTransaction(long accountNumber, BigDecimal amount, LocalDate date) {
        Ledger ledger = lockAndLoad(accountNumber);
        int seq = ledger.size();

        Transaction admitted = ledger.addTransaction(amount, date);
        txRepo.insert(accountNumber, seq, admitted);
        return admitted;
    }

    @Transactional(readOnly = true)
    public List<Transaction> listTransactions(long accountNumber) {
        return getAccount(accountNumber).getTransactions();
    }

    /**
     * Assesses the month's interest and fees and persists what was appended.
     *
     * @return the appended transactions, empty for an account with no history
     * @throws com.dinoventures.ledger.exception.TransactionSequenceException if the month was already assessed
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public List<Transaction> assessInterestAndFees(long accountNumber) {
        Ledger ledger = lockAndLoad(accountNumber);
        int seq = ledger.size();

        List<Transaction> assessed = ledger.assessInterestAndFees();
        if (assessed.isEmpty()) {
            return assessed;
        }
        for (Transaction transaction : assessed) {
            txRepo.insert(accountNumber, seq++, transaction);
        }
        accountRepo.updateLastAssessedPeriod(accountNumber, ledger.getLastAssessedPeriod());
        log.debug("Assessed interest and fees: account={}, period={}, entries={}",
                accountNumber, ledger.getLastAssessedPeriod(), assessed.size());
        return assessed;
    }

    // =========================================================================
    // LOADING
    // =========================================================================

    private Ledger lockAndLoad(long accountNumber) {
        Account account = accountRepo.findByIdForUpdate(accountNumber)
                .orElseThrow(() -> new AccountNotFoundException(accountNumber));
        return load(account);
    }

    private Ledger load(Account account) {
        return toLedger(account, txRepo.findByAccountNumber(account.getAccountNumber()));
    }

    private Ledger toLedger(Account account, List<Transaction> transactions) {
        return Ledger.restore(
                account.getAccountNumber(),
                account.getType(),
                policies.policyFor(account.getType()),
                transactions,
                account.getLastAssessedPeriod()
        );
    }
}
