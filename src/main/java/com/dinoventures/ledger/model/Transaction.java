package com.dinoventures.ledger.model;

import com.dinoventures.ledger.exception.OverdraftException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.Collection;
import java.util.Comparator;

/**
 * A single signed movement on a ledger.
 *
 * Positive amount = deposit, negative amount = withdrawal or fee.
 * Exempt transactions are system-generated (interest, fees) and bypass the
 * overdraft and rate-limit checks. Instances are immutable; validation is the
 * owning {@link Ledger}'s job, not the constructor's.
 */
@Value
public class Transaction {

    /**
     * Orders transactions by date only. Used with stable sorts, so ties keep insertion order.
     */
    public static final Comparator<Transaction> CHRONOLOGICAL = Comparator.comparing(Transaction::getDate);

    BigDecimal amount;
    LocalDate date;
    boolean exempt;

    public static Transaction of(BigDecimal amount, LocalDate date, boolean exempt) {
        return new Transaction(amount, date, exempt);
    }

    /**
     * Sums the amounts of the given transactions exactly.
     */
    public static BigDecimal sum(Collection<Transaction> transactions) {
        return transactions.stream()
                .map(Transaction::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Checks whether applying this transaction to {@code balance} would overdraw it.
     * Deposits always pass.
     *
     * @throws OverdraftException if the resulting balance would be negative
     */
    public void checkBalance(BigDecimal balance) {
        if (amount.signum() < 0 && balance.add(amount).signum() < 0) {
            throw new OverdraftException();
        }
    }

    public boolean inSameDay(Transaction other) {
        return date.equals(other.date);
    }

    public boolean inSameMonth(Transaction other) {
        return period().equals(other.period());
    }

    public boolean precedes(Transaction other) {
        return date.isBefore(other.date);
    }

    public YearMonth period() {
        return YearMonth.from(date);
    }

    public LocalDate lastDayOfMonth() {
        return date.with(TemporalAdjusters.lastDayOfMonth());
    }

    /**
     * Formats as {@code 2024-01-31, $1,234.50}. Negative amounts print as {@code $-5.75}.
     */
    @Override
    public String toString() {
        return date + ", $" + Money.format(amount);
    }
}
