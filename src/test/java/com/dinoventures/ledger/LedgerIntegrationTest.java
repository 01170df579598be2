package com.dinoventures.ledger;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.jdbc.Sql;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full-stack integration tests: HTTP → Controller → Service → PostgreSQL (Testcontainers).
 *
 * Each test method starts from an empty database; account numbers restart at 1.
 * Skipped when no Docker daemon is available.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
@Sql(
    scripts = "/db/truncate.sql",
    executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD
)
class LedgerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url",      postgres::getJdbcUrl);
        registry.add("spring.datasource.username",  postgres::getUsername);
        registry.add("spring.datasource.password",  postgres::getPassword);
    }

    @Autowired
    private TestRestTemplate restTemplate;

    // =========================================================================
    // Helper methods
    // =========================================================================

    private ResponseEntity<Map> post(String path, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(body, headers), Map.class);
    }

    private long openAccount(String type) {
        ResponseEntity<Map> resp = post("/api/v1/accounts", Map.of("type", type));
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return ((Number) resp.getBody().get("account_number")).longValue();
    }

    private ResponseEntity<Map> addTransaction(long account, String amount, String date) {
        return post("/api/v1/accounts/" + account + "/transactions",
                Map.of("amount", new BigDecimal(amount), "date", date));
    }

    private ResponseEntity<Map> assess(long account) {
        return post("/api/v1/accounts/" + account + "/interest-and-fees", Map.of());
    }

    private Map<?, ?> getAccount(long account) {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/accounts/{n}", Map.class, account);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        return resp.getBody();
    }

    private BigDecimal balanceOf(long account) {
        return new BigDecimal(getAccount(account).get("balance").toString());
    }

    // =========================================================================
    // Accounts
    // =========================================================================

    @Test
    void openAccount_assignsSequentialNumbers() {
        assertThat(openAccount("savings")).isEqualTo(1L);
        assertThat(openAccount("Checking")).isEqualTo(2L);

        ResponseEntity<List> resp = restTemplate.getForEntity("/api/v1/accounts", List.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> accounts = resp.getBody();
        assertThat(accounts).extracting(a -> a.get("summary")).containsExactly(
                "Savings#000000001,\tbalance: $0.00",
                "Checking#000000002,\tbalance: $0.00");
    }

    @Test
    void openAccount_unknownType_returns400() {
        ResponseEntity<Map> resp = post("/api/v1/accounts", Map.of("type", "brokerage"));
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void unknownAccount_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/accounts/{n}", Map.class, 99);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    // =========================================================================
    // Admission
    // =========================================================================

    @Test
    void addTransaction_updatesBalance() {
        long account = openAccount("checking");

        ResponseEntity<Map> resp = addTransaction(account, "1250.50", "2024-01-10");
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(resp.getBody().get("display")).isEqualTo("2024-01-10, $1,250.50");

        addTransaction(account, "-250.25", "2024-01-11");
        assertThat(balanceOf(account)).isEqualByComparingTo("1000.25");
    }

    @Test
    void overdraft_returns422AndBalanceUnchanged() {
        long account = openAccount("checking");
        addTransaction(account, "20.00", "2024-01-10");

        ResponseEntity<Map> resp = addTransaction(account, "-20.01", "2024-01-11");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("error")).isEqualTo("OVERDRAFT");
        assertThat(balanceOf(account)).isEqualByComparingTo("20.00");
    }

    @Test
    void outOfOrderDate_returns422WithLatestDate() {
        long account = openAccount("checking");
        addTransaction(account, "100", "2024-02-20");

        ResponseEntity<Map> resp = addTransaction(account, "5", "2024-02-15");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("message")).isEqualTo("New transactions must be from 2024-02-20 onward.");
        assertThat(((Map<?, ?>) resp.getBody().get("details")).get("latest_date")).isEqualTo("2024-02-20");
        assertThat(balanceOf(account)).isEqualByComparingTo("100");
    }

    @Test
    void savingsDailyLimit_returns422() {
        long account = openAccount("savings");
        addTransaction(account, "100", "2024-03-05");
        addTransaction(account, "100", "2024-03-05");

        ResponseEntity<Map> resp = addTransaction(account, "100", "2024-03-05");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(((Map<?, ?>) resp.getBody().get("details")).get("limit_type")).isEqualTo("daily");
        assertThat(balanceOf(account)).isEqualByComparingTo("200");
    }

    @Test
    void missingDate_returns400() {
        long account = openAccount("checking");
        ResponseEntity<Map> resp = post("/api/v1/accounts/" + account + "/transactions", Map.of("amount", 10));
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    // =========================================================================
    // Assessment and persistence
    // =========================================================================

    @Test
    @SuppressWarnings("unchecked")
    void assessment_checkingLowBalance_chargesFeeAndPersists() {
        long account = openAccount("checking");
        addTransaction(account, "50.00", "2024-01-10");

        ResponseEntity<Map> resp = assess(account);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<Map<String, Object>> assessed = (List<Map<String, Object>>) resp.getBody().get("assessed");
        assertThat(assessed).extracting(t -> t.get("display"))
                .containsExactly("2024-01-31, $0.04", "2024-01-31, $-5.75");

        Map<?, ?> reloaded = getAccount(account);
        assertThat(reloaded.get("summary")).isEqualTo("Checking#000000001,\tbalance: $44.29");
        assertThat(reloaded.get("last_assessed_period")).isEqualTo("2024-01");
    }

    @Test
    void assessment_twiceInSameMonth_returns422AndStateUnchanged() {
        long account = openAccount("savings");
        addTransaction(account, "1000", "2024-01-10");
        assess(account);
        BigDecimal before = balanceOf(account);

        ResponseEntity<Map> resp = assess(account);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("message").toString()).contains("month of January");
        assertThat(balanceOf(account)).isEqualByComparingTo(before);
    }

    @Test
    @SuppressWarnings("unchecked")
    void listTransactions_sortedByDateInInsertionOrder() {
        long account = openAccount("checking");
        addTransaction(account, "10", "2024-01-05");
        addTransaction(account, "20", "2024-01-05");
        addTransaction(account, "30", "2024-01-09");
        assess(account);

        ResponseEntity<List> resp = restTemplate.getForEntity(
                "/api/v1/accounts/{n}/transactions", List.class, account);

        List<Map<String, Object>> transactions = resp.getBody();
        assertThat(transactions).extracting(t -> t.get("display")).containsExactly(
                "2024-01-05, $10.00",
                "2024-01-05, $20.00",
                "2024-01-09, $30.00",
                "2024-01-31, $0.05",
                "2024-01-31, $-5.75");
        assertThat(transactions).extracting(t -> t.get("exempt"))
                .containsExactly(false, false, false, true, true);
    }

    @Test
    void interestKeepsFullPrecisionInStorage() {
        long account = openAccount("savings");
        addTransaction(account, "1234.56", "2024-05-02");
        assess(account);

        assertThat(balanceOf(account)).isEqualByComparingTo("1238.634048");
    }

    // =========================================================================
    // Concurrency
    // =========================================================================

    /**
     * Ten threads race to withdraw the whole balance. The account row lock
     * serialises admission, so exactly one withdrawal is admitted.
     */
    @Test
    void concurrentWithdrawals_exactlyOneSucceeds() throws InterruptedException {
        long account = openAccount("checking");
        addTransaction(account, "500", "2024-01-10");

        int threadCount = 10;
        CountDownLatch ready = new CountDownLatch(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        List<Integer> statusCodes = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            pool.submit(() -> {
                ready.countDown();
                try { start.await(); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
                statusCodes.add(addTransaction(account, "-500", "2024-01-11").getStatusCode().value());
            });
        }

        ready.await();
        start.countDown();
        pool.shutdown();
        pool.awaitTermination(30, TimeUnit.SECONDS);

        assertThat(statusCodes.stream().filter(c -> c == 201).count()).isEqualTo(1);
        assertThat(statusCodes.stream().filter(c -> c == 422).count()).isEqualTo(9);
        assertThat(balanceOf(account)).isEqualByComparingTo("0");
    }
}
