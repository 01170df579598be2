package com.dinoventures.ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Rates, limits and fees for each account type, bound from the {@code ledger.*} keys.
 */
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
        Savings savings,
        Checking checking
) {

    public LedgerProperties {
        if (savings == null) {
            throw new IllegalArgumentException("ledger.savings configuration must be provided");
        }
        if (checking == null) {
            throw new IllegalArgumentException("ledger.checking configuration must be provided");
        }
    }

    public record Savings(
            BigDecimal interestRate,
            int dailyLimit,
            int monthlyLimit
    ) {
        public Savings {
            requireRate(interestRate, "ledger.savings.interest-rate");
            if (dailyLimit < 1) {
                throw new IllegalArgumentException("ledger.savings.daily-limit must be at least 1");
            }
            if (monthlyLimit < dailyLimit) {
                throw new IllegalArgumentException("ledger.savings.monthly-limit must not be below the daily limit");
            }
        }
    }

    public record Checking(
            BigDecimal interestRate,
            BigDecimal lowBalanceThreshold,
            BigDecimal lowBalanceFee
    ) {
        public Checking {
            requireRate(interestRate, "ledger.checking.interest-rate");
            if (lowBalanceThreshold == null) {
                throw new IllegalArgumentException("ledger.checking.low-balance-threshold must be provided");
            }
            if (lowBalanceFee == null || lowBalanceFee.signum() > 0) {
                throw new IllegalArgumentException("ledger.checking.low-balance-fee must be zero or negative");
            }
        }
    }

    private static void requireRate(BigDecimal rate, String key) {
        if (rate == null || rate.signum() < 0) {
            throw new IllegalArgumentException(key + " must be provided and non-negative");
        }
    }
}
