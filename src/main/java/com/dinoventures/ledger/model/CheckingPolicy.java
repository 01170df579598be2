package com.dinoventures.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Checking accounts: lower interest, no rate limits, and a flat fee when the
 * post-interest balance falls under the threshold.
 */
public class CheckingPolicy implements AccountPolicy {

    private final BigDecimal interestRate;
    private final BigDecimal lowBalanceThreshold;
    private final BigDecimal lowBalanceFee;

    public CheckingPolicy(BigDecimal interestRate, BigDecimal lowBalanceThreshold, BigDecimal lowBalanceFee) {
        if (lowBalanceFee.signum() > 0) {
            throw new IllegalArgumentException("Low balance fee must be zero or negative: " + lowBalanceFee);
        }
        this.interestRate = interestRate;
        this.lowBalanceThreshold = lowBalanceThreshold;
        this.lowBalanceFee = lowBalanceFee;
    }

    @Override
    public BigDecimal interestRate() {
        return interestRate;
    }

    @Override
    public void checkLimits(Transaction candidate, List<Transaction> held) {
        // unlimited
    }

    @Override
    public Optional<Transaction> assessFees(BigDecimal postInterestBalance, LocalDate date) {
        if (postInterestBalance.compareTo(lowBalanceThreshold) < 0) {
            return Optional.of(Transaction.of(lowBalanceFee, date, true));
        }
        return Optional.empty();
    }
}
