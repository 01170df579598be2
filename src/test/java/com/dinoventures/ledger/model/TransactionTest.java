package com.dinoventures.ledger.model;

import com.dinoventures.ledger.exception.OverdraftException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TransactionTest {

    private static Transaction txn(String amount, String date) {
        return Transaction.of(new BigDecimal(amount), LocalDate.parse(date), false);
    }

    @Test @DisplayName("withdrawal larger than balance → OverdraftException")
    void overdraftRejected() {
        assertThatThrownBy(() -> txn("-50.01", "2024-01-10").checkBalance(new BigDecimal("50.00")))
            .isInstanceOf(OverdraftException.class)
            .hasMessageContaining("insufficient account balance");
    }

    @Test @DisplayName("withdrawal down to exactly zero is allowed")
    void withdrawalToZeroAllowed() {
        assertThatCode(() -> txn("-50.00", "2024-01-10").checkBalance(new BigDecimal("50.00")))
            .doesNotThrowAnyException();
    }

    @Test @DisplayName("deposit passes even against a negative balance")
    void depositAlwaysPasses() {
        assertThatCode(() -> txn("1.00", "2024-01-10").checkBalance(new BigDecimal("-10.00")))
            .doesNotThrowAnyException();
    }

    @Test
    void sameDayAndSameMonth() {
        Transaction a = txn("1", "2024-03-05");
        assertThat(a.inSameDay(txn("2", "2024-03-05"))).isTrue();
        assertThat(a.inSameDay(txn("2", "2024-03-06"))).isFalse();
        assertThat(a.inSameMonth(txn("2", "2024-03-31"))).isTrue();
        assertThat(a.inSameMonth(txn("2", "2023-03-05"))).as("same month, other year").isFalse();
    }

    @Test
    void precedesComparesDatesOnly() {
        assertThat(txn("100", "2024-02-15").precedes(txn("1", "2024-02-20"))).isTrue();
        assertThat(txn("100", "2024-02-20").precedes(txn("1", "2024-02-20"))).isFalse();
    }

    @Test
    void lastDayOfMonthHandlesLeapYears() {
        assertThat(txn("1", "2024-02-10").lastDayOfMonth()).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(txn("1", "2023-02-10").lastDayOfMonth()).isEqualTo(LocalDate.of(2023, 2, 28));
        assertThat(txn("1", "2024-12-01").lastDayOfMonth()).isEqualTo(LocalDate.of(2024, 12, 31));
    }

    @Test
    void sumIsExact() {
        List<Transaction> list = List.of(txn("0.10", "2024-01-01"), txn("0.20", "2024-01-02"), txn("-0.05", "2024-01-03"));
        assertThat(Transaction.sum(list)).isEqualByComparingTo("0.25");
        assertThat(Transaction.sum(List.of())).isEqualByComparingTo("0");
    }

    @Test @DisplayName("chronological sort keeps insertion order for same-day entries")
    void chronologicalComparatorIsStable() {
        Transaction first = txn("10", "2024-01-05");
        Transaction second = txn("20", "2024-01-05");
        Transaction earlier = txn("30", "2024-01-01");
        List<Transaction> list = new ArrayList<>(List.of(first, second, earlier));
        list.sort(Transaction.CHRONOLOGICAL);
        assertThat(list).containsExactly(earlier, first, second);
    }

    @Test
    void rendersWithThousandsSeparatorAndTwoDecimals() {
        assertThat(txn("1234.5", "2024-01-31")).hasToString("2024-01-31, $1,234.50");
        assertThat(txn("50", "2022-09-15")).hasToString("2022-09-15, $50.00");
        assertThat(txn("0.04", "2024-01-31")).hasToString("2024-01-31, $0.04");
    }

    @Test
    void rendersNegativeAmountsAfterTheDollarSign() {
        assertThat(txn("-5.75", "2024-01-31")).hasToString("2024-01-31, $-5.75");
        assertThat(txn("-1234567.891", "2024-01-31")).hasToString("2024-01-31, $-1,234,567.89");
    }

    @Test
    void roundsHalfUpOnlyForDisplay() {
        Transaction t = txn("0.125", "2024-01-31");
        assertThat(t).hasToString("2024-01-31, $0.13");
        assertThat(t.getAmount()).isEqualByComparingTo("0.125");
    }
}
