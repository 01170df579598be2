package com.dinoventures.ledger.model;

import com.dinoventures.ledger.exception.TransactionSequenceException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * The validated transaction history of one account.
 *
 * Admission routine (fixed order, nothing is appended unless all pass):
 *   1. Chronology: a transaction dated before the latest held date is rejected,
 *      whatever its amount or exemption.
 *   2. Overdraft: a non-exempt transaction may not take the balance below zero.
 *   3. Rate limits: delegated to the account's {@link AccountPolicy}; skipped for exempt entries.
 *
 * Monthly assessment appends interest (and any policy fee) as exempt
 * transactions on the last day of the latest transaction's month, at most
 * once per month.
 *
 * Not thread-safe. Callers that share a ledger must serialise access.
 */
@Slf4j
public class Ledger {

    private final long accountNumber;
    private final AccountType type;
    private final AccountPolicy policy;
    private final List<Transaction> transactions;
    private YearMonth lastAssessedPeriod;

    public Ledger(long accountNumber, AccountType type, AccountPolicy policy) {
        this(accountNumber, type, policy, new ArrayList<>(), null);
    }

    private Ledger(long accountNumber, AccountType type, AccountPolicy policy,
                   List<Transaction> transactions, YearMonth lastAssessedPeriod) {
        if (accountNumber <= 0) {
            throw new IllegalArgumentException("Account number must be positive: " + accountNumber);
        }
        this.accountNumber = accountNumber;
        this.type = Objects.requireNonNull(type, "type");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.transactions = transactions;
        this.lastAssessedPeriod = lastAssessedPeriod;
    }

    /**
     * Rebuilds a ledger from persisted state. Transactions must be given in
     * their original insertion order; admission checks are not re-run.
     */
    public static Ledger restore(long accountNumber, AccountType type, AccountPolicy policy,
                                 List<Transaction> transactions, YearMonth lastAssessedPeriod) {
        return new Ledger(accountNumber, type, policy, new ArrayList<>(transactions), lastAssessedPeriod);
    }

    public long getAccountNumber() {
        return accountNumber;
    }

    public AccountType getType() {
        return type;
    }

    public YearMonth getLastAssessedPeriod() {
        return lastAssessedPeriod;
    }

    /**
     * Number of held transactions; also the insertion index of the next one.
     */
    public int size() {
        return transactions.size();
    }

    /**
     * Admits a user-initiated transaction.
     */
    public Transaction addTransaction(BigDecimal amount, LocalDate date) {
        return addTransaction(amount, date, false);
    }

    /**
     * Runs the admission routine and appends the transaction.
     *
     * @return the admitted transaction
     * @throws TransactionSequenceException if {@code date} is before the latest held date
     * @throws com.dinoventures.ledger.exception.OverdraftException if a non-exempt amount overdraws the balance
     * @throws com.dinoventures.ledger.exception.TransactionLimitException if the policy's rate limit is hit
     */
    public Transaction addTransaction(BigDecimal amount, LocalDate date, boolean exempt) {
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(date, "date");
        return admit(Transaction.of(amount, date, exempt));
    }

    private Transaction admit(Transaction candidate) {
        Optional<Transaction> latest = latest();
        if (latest.isPresent() && candidate.precedes(latest.get())) {
            throw new TransactionSequenceException(latest.get().getDate());
        }

        if (!candidate.isExempt()) {
            candidate.checkBalance(getBalance());
            policy.checkLimits(candidate, Collections.unmodifiableList(transactions));
        }

        transactions.add(candidate);
        log.debug("Created transaction: account={}, amount={}, date={}, exempt={}",
                accountNumber, candidate.getAmount(), candidate.getDate(), candidate.isExempt());
        return candidate;
    }

    /**
     * Exact sum of every held amount, exempt entries included. Never rounded.
     */
    public BigDecimal getBalance() {
        return Transaction.sum(transactions);
    }

    /**
     * Held transactions sorted by date; same-day entries keep insertion order.
     */
    public List<Transaction> getTransactions() {
        return transactions.stream()
                .sorted(Transaction.CHRONOLOGICAL)
                .toList();
    }

    /**
     * Appends this month's interest and any fee the policy charges.
     *
     * The assessment period is the month of the latest transaction; entries are
     * dated on its last day, which is never before the latest held date.
     * Does nothing on an empty ledger.
     *
     * @return the exempt transactions appended, interest first
     * @throws TransactionSequenceException if the period was already assessed
     */
    public List<Transaction> assessInterestAndFees() {
        Optional<Transaction> latest = latest();
        if (latest.isEmpty()) {
            return List.of();
        }

        LocalDate assessmentDate = latest.get().lastDayOfMonth();
        YearMonth period = YearMonth.from(assessmentDate);
        if (period.equals(lastAssessedPeriod)) {
            LocalDate latestDate = latest.get().getDate();
            throw new TransactionSequenceException(latestDate, String.format(
                    "Cannot apply interest and fees again in the month of %s.",
                    latestDate.getMonth().getDisplayName(TextStyle.FULL, Locale.US)));
        }

        log.debug("Triggered interest and fees: account={}, period={}", accountNumber, period);
        List<Transaction> assessed = new ArrayList<>(2);

        BigDecimal interest = getBalance().multiply(policy.interestRate());
        assessed.add(admit(Transaction.of(interest, assessmentDate, true)));

        policy.assessFees(getBalance(), assessmentDate)
                .map(this::admit)
                .ifPresent(assessed::add);

        lastAssessedPeriod = period;
        return List.copyOf(assessed);
    }

    private Optional<Transaction> latest() {
        return transactions.stream().max(Transaction.CHRONOLOGICAL);
    }

    /**
     * Formats as {@code Savings#000000001,\tbalance: $1,234.50}.
     */
    @Override
    public String toString() {
        return String.format("%s#%09d,\tbalance: $%s",
                type.getDisplayName(), accountNumber, Money.format(getBalance()));
    }
}
