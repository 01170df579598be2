package com.dinoventures.ledger.repository;

import com.dinoventures.ledger.model.Account;
import com.dinoventures.ledger.model.AccountType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final String COLUMNS = "account_number, type, last_assessed_period, created_at";

    private static final RowMapper<Account> ROW_MAPPER = (rs, rowNum) -> {
        String period = rs.getString("last_assessed_period");
        return Account.builder()
                .accountNumber(rs.getLong("account_number"))
                .type(AccountType.valueOf(rs.getString("type")))
                .lastAssessedPeriod(period != null ? YearMonth.parse(period) : null)
                .createdAt(rs.getObject("created_at", java.time.OffsetDateTime.class))
                .build();
    };

    public List<Account> findAll() {
        return namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts ORDER BY account_number",
                ROW_MAPPER
        );
    }

    public Optional<Account> findById(long accountNumber) {
        List<Account> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE account_number = :accountNumber",
                new MapSqlParameterSource("accountNumber", accountNumber),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    /**
     * Reads the account row and holds a row-level lock on it until the
     * surrounding transaction ends. Every ledger mutation goes through this,
     * so the admission checks and the insert of new transactions form one
     * critical section per account. Must be called within a transaction.
     */
    public Optional<Account> findByIdForUpdate(long accountNumber) {
        List<Account> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE account_number = :accountNumber FOR UPDATE",
                new MapSqlParameterSource("accountNumber", accountNumber),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    /**
     * Opens an account. The database assigns the next account number.
     */
    public Account save(AccountType type) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        namedJdbc.update(
                "INSERT INTO accounts (type) VALUES (:type)",
                new MapSqlParameterSource("type", type.name()),
                keyHolder,
                new String[]{"account_number"}
        );
        long accountNumber = keyHolder.getKey().longValue();
        return findById(accountNumber).orElseThrow();
    }

    public void updateLastAssessedPeriod(long accountNumber, YearMonth period) {
        namedJdbc.update(
                "UPDATE accounts SET last_assessed_period = :period WHERE account_number = :accountNumber",
                new MapSqlParameterSource()
                        .addValue("period", period.toString())
                        .addValue("accountNumber", accountNumber)
        );
    }
}
