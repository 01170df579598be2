package com.dinoventures.ledger.model;

import com.dinoventures.ledger.exception.TransactionLimitException;
import com.dinoventures.ledger.exception.TransactionLimitException.LimitType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Savings accounts: higher interest, capped number of user transactions per day and per month, no fees.
 */
public class SavingsPolicy implements AccountPolicy {

    private final BigDecimal interestRate;
    private final int dailyLimit;
    private final int monthlyLimit;

    public SavingsPolicy(BigDecimal interestRate, int dailyLimit, int monthlyLimit) {
        this.interestRate = interestRate;
        this.dailyLimit = dailyLimit;
        this.monthlyLimit = monthlyLimit;
    }

    @Override
    public BigDecimal interestRate() {
        return interestRate;
    }

    /**
     * Daily limit is checked first, so a candidate breaking both reports DAILY.
     */
    @Override
    public void checkLimits(Transaction candidate, List<Transaction> held) {
        if (countNonExempt(held, candidate::inSameDay) >= dailyLimit) {
            throw new TransactionLimitException(LimitType.DAILY, dailyLimit);
        }
        if (countNonExempt(held, candidate::inSameMonth) >= monthlyLimit) {
            throw new TransactionLimitException(LimitType.MONTHLY, monthlyLimit);
        }
    }

    @Override
    public Optional<Transaction> assessFees(BigDecimal postInterestBalance, LocalDate date) {
        return Optional.empty();
    }

    private static long countNonExempt(List<Transaction> held, Predicate<Transaction> matches) {
        return held.stream()
                .filter(t -> !t.isExempt())
                .filter(matches)
                .count();
    }
}
