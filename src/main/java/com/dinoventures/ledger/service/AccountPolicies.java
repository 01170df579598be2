package com.dinoventures.ledger.service;

import com.dinoventures.ledger.config.LedgerProperties;
import com.dinoventures.ledger.model.AccountPolicy;
import com.dinoventures.ledger.model.AccountType;
import com.dinoventures.ledger.model.CheckingPolicy;
import com.dinoventures.ledger.model.SavingsPolicy;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves the configured {@link AccountPolicy} for an account type.
 * Policies are stateless, so one instance per type is shared by every ledger.
 */
@Component
public class AccountPolicies {

    private final Map<AccountType, AccountPolicy> policies = new EnumMap<>(AccountType.class);

    public AccountPolicies(LedgerProperties properties) {
        LedgerProperties.Savings savings = properties.savings();
        LedgerProperties.Checking checking = properties.checking();
        policies.put(AccountType.SAVINGS,
                new SavingsPolicy(savings.interestRate(), savings.dailyLimit(), savings.monthlyLimit()));
        policies.put(AccountType.CHECKING,
                new CheckingPolicy(checking.interestRate(), checking.lowBalanceThreshold(), checking.lowBalanceFee()));
    }

    public AccountPolicy policyFor(AccountType type) {
        return policies.get(type);
    }
}
