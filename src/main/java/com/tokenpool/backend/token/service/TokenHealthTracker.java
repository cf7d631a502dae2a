package com.tokenpool.backend.token.service;

import com.tokenpool.backend.common.TokenMasks;
import com.tokenpool.backend.token.config.TokenPoolProperties;
import com.tokenpool.backend.token.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * ✅ upstream 呼叫結果回寫
 * - recordFailure：失敗數 +1；4xx 且到門檻 => EXPIRED（5xx / 網路錯只加計數，不判死）
 * - applyCooldown：429 看剩餘額度決定 1h / 10h；其他錯誤 30s
 * 兩個操作互相獨立，呼叫端依回應分類決定要叫哪個（或都叫）。
 *
 * 寫進去的 EXPIRED / cooldown 這裡不會回滾。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenHealthTracker {

    public static final int TOO_MANY_REQUESTS = 429;

    private static final int MAX_REASON_LEN = 500;

    private final TokenRepository repo;
    private final TokenPoolProperties props;
    private final Clock clock;

    /**
     * @param recorded false = token 不存在（已被刪掉）
     * @param expired  true = 這次呼叫讓 token 轉成 EXPIRED
     */
    public record FailureResult(boolean recorded, boolean expired) {
        public static final FailureResult NOT_FOUND = new FailureResult(false, false);
    }

    @Transactional
    public FailureResult recordFailure(String token, int httpStatus, String message) {
        return recordFailure(token, httpStatus, message, Instant.now(clock));
    }

    @Transactional
    public FailureResult recordFailure(String token, int httpStatus, String message, Instant nowUtc) {
        String reason = truncate(httpStatus + ": " + (message == null ? "" : message));

        int updated = repo.incrementFailure(token, nowUtc, reason);
        if (updated == 0) {
            log.debug("token_failure token={} status={} result=NOT_FOUND", TokenMasks.suffix(token), httpStatus);
            return FailureResult.NOT_FOUND;
        }

        boolean expired = false;
        if (isClientError(httpStatus)) {
            expired = repo.expireIfFailuresReached(token, props.getFailureLimit()) > 0;
        }

        if (expired) {
            log.warn("token_expired token={} status={} reason={}", TokenMasks.suffix(token), httpStatus, reason);
        } else {
            log.info("token_failure token={} status={}", TokenMasks.suffix(token), httpStatus);
        }
        return new FailureResult(true, expired);
    }

    @Transactional
    public Optional<Instant> applyCooldown(String token, int httpStatus) {
        return applyCooldown(token, httpStatus, Instant.now(clock));
    }

    /**
     * @return 這次寫進去的 cooldownUntil；empty = token 不存在，或原本的 cooldown 更久（不會往回縮）
     */
    @Transactional
    public Optional<Instant> applyCooldown(String token, int httpStatus, Instant nowUtc) {
        TokenPoolProperties.Cooldown c = props.getCooldown();

        Optional<Instant> applied;
        if (httpStatus == TOO_MANY_REQUESTS) {
            // 額度 = 0 的 429 多半短時間內不會恢復，休久一點
            Instant exhaustedUntil = nowUtc.plus(c.getRateLimitedExhausted());
            if (repo.extendCooldownIfExhausted(token, exhaustedUntil) > 0) {
                applied = Optional.of(exhaustedUntil);
            } else {
                Instant until = nowUtc.plus(c.getRateLimited());
                applied = repo.extendCooldownIfQuotaLeft(token, until) > 0 ? Optional.of(until) : Optional.empty();
            }
        } else {
            Instant until = nowUtc.plus(c.getTransientError());
            applied = repo.extendCooldown(token, until) > 0 ? Optional.of(until) : Optional.empty();
        }

        applied.ifPresentOrElse(
                until -> log.info("token_cooldown token={} status={} until={}", TokenMasks.suffix(token), httpStatus, until),
                () -> log.debug("token_cooldown token={} status={} result=UNCHANGED", TokenMasks.suffix(token), httpStatus)
        );
        return applied;
    }

    static boolean isClientError(int httpStatus) {
        return httpStatus >= 400 && httpStatus < 500;
    }

    private static String truncate(String s) {
        return s.length() <= MAX_REASON_LEN ? s : s.substring(0, MAX_REASON_LEN);
    }
}
