package com.dinoventures.ledger.repository;

import com.dinoventures.ledger.model.Transaction;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Append-only store of ledger transactions.
 *
 * Each row carries its insertion index ({@code seq}) within the account so a
 * ledger reloads in exactly the order it was built. Amounts are stored as
 * unscaled NUMERIC, so interest values keep every fraction digit.
 */
@Repository
@RequiredArgsConstructor
public class TransactionRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final RowMapper<Transaction> ROW_MAPPER = (rs, rowNum) -> Transaction.of(
            rs.getBigDecimal("amount"),
            rs.getObject("txn_date", LocalDate.class),
            rs.getBoolean("exempt")
    );

    /**
     * Appends one transaction at position {@code seq}. Must be called within a
     * transaction holding the account's row lock.
     */
    public void insert(long accountNumber, int seq, Transaction transaction) {
        namedJdbc.update(
                "INSERT INTO ledger_transactions (account_number, seq, amount, txn_date, exempt) " +
                "VALUES (:accountNumber, :seq, :amount, :txnDate, :exempt)",
                new MapSqlParameterSource()
                        .addValue("accountNumber", accountNumber)
                        .addValue("seq", seq)
                        .addValue("amount", transaction.getAmount())
                        .addValue("txnDate", transaction.getDate())
                        .addValue("exempt", transaction.isExempt())
        );
    }

    /**
     * All transactions of an account in insertion order.
     */
    public List<Transaction> findByAccountNumber(long accountNumber) {
        return namedJdbc.query(
                "SELECT amount, txn_date, exempt FROM ledger_transactions " +
                "WHERE account_number = :accountNumber ORDER BY seq",
                new MapSqlParameterSource("accountNumber", accountNumber),
                ROW_MAPPER
        );
    }
}
