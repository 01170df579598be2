package com.dinoventures.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Variant-specific rules plugged into a {@link Ledger} when the account is opened.
 */
public interface AccountPolicy {

    /**
     * Monthly interest rate applied to the balance at assessment time.
     */
    BigDecimal interestRate();

    /**
     * Rejects a non-exempt candidate that would break a rate limit.
     *
     * @param candidate the transaction being admitted, not yet in {@code held}
     * @param held      transactions already on the ledger
     * @throws com.dinoventures.ledger.exception.TransactionLimitException if a limit is hit
     */
    void checkLimits(Transaction candidate, List<Transaction> held);

    /**
     * Returns the exempt fee to append after interest, if one is due.
     *
     * @param postInterestBalance balance once interest has been admitted
     * @param date                assessment date; the fee carries the same date
     */
    Optional<Transaction> assessFees(BigDecimal postInterestBalance, LocalDate date);
}
