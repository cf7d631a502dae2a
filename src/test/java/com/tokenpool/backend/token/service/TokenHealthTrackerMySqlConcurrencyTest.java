package com.tokenpool.backend.token.service;

import com.tokenpool.backend.testsupport.MySqlContainerBaseTest;
import com.tokenpool.backend.token.entity.TokenEntity;
import com.tokenpool.backend.token.model.TokenStatus;
import com.tokenpool.backend.token.model.TokenType;
import com.tokenpool.backend.token.repo.TokenRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class TokenHealthTrackerMySqlConcurrencyTest extends MySqlContainerBaseTest {

    private static final int THREADS = 8;
    private static final int CALLS = 40;

    @Autowired TokenHealthTracker tracker;
    @Autowired TokenAdminService adminService;
    @Autowired TokenRepository repo;

    @Test
    void concurrent_server_errors_never_lose_increments() throws Exception {
        String token = "sso-concurrent-5xx-000001";
        adminService.addTokens(List.of(token), TokenType.STANDARD);

        List<TokenHealthTracker.FailureResult> results = runConcurrently(() -> tracker.recordFailure(token, 500, "boom"));

        assertThat(results).allSatisfy(r -> assertThat(r.recorded()).isTrue());
        TokenEntity e = repo.findById(token).orElseThrow();
        assertThat(e.getFailedCount()).isEqualTo(CALLS);
        assertThat(e.getStatus()).isEqualTo(TokenStatus.ACTIVE);
    }

    @Test
    void concurrent_client_errors_expire_exactly_once() throws Exception {
        String token = "sso-concurrent-4xx-000001";
        adminService.addTokens(List.of(token), TokenType.STANDARD);

        List<TokenHealthTracker.FailureResult> results = runConcurrently(() -> tracker.recordFailure(token, 403, "forbidden"));

        assertThat(results).filteredOn(TokenHealthTracker.FailureResult::expired).hasSize(1);
        TokenEntity e = repo.findById(token).orElseThrow();
        assertThat(e.getFailedCount()).isEqualTo(CALLS);
        assertThat(e.getStatus()).isEqualTo(TokenStatus.EXPIRED);
    }

    private static <T> List<T> runConcurrently(Callable<T> call) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < CALLS; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();

            List<T> out = new ArrayList<>();
            for (Future<T> f : futures) out.add(f.get(30, TimeUnit.SECONDS));
            return out;
        } finally {
            pool.shutdownNow();
        }
    }
}
