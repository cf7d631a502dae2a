package com.tokenpool.backend.token.health;

import com.tokenpool.backend.token.model.StatusBucket;
import com.tokenpool.backend.token.model.WorkloadClass;
import com.tokenpool.backend.token.service.TokenAllocator;
import com.tokenpool.backend.token.service.TokenQueryService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * ✅ /actuator/health 的 tokenPool 區塊
 * - 選不到 token 不算故障（pool 空 / 全部冷卻中是正常狀態），維持 UP，用 selectable=false 標示
 * - 查 DB 丟例外 -> actuator 自己回 DOWN
 * - 附上各 bucket 數量；不輸出任何 token 原文
 */
@Component("tokenPool")
@ConditionalOnProperty(prefix = "app.token-pool.health", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TokenPoolHealthIndicator implements HealthIndicator {

    private final TokenAllocator allocator;
    private final TokenQueryService queryService;
    private final Clock clock;

    public TokenPoolHealthIndicator(TokenAllocator allocator, TokenQueryService queryService, Clock clock) {
        this.allocator = allocator;
        this.queryService = queryService;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Instant now = Instant.now(clock);
        Map<StatusBucket, Long> counts = queryService.countByBucket(now);

        boolean selectable = allocator.select(WorkloadClass.STANDARD, now).isPresent();
        Health.Builder b = Health.up().withDetail("selectable", selectable);
        if (!selectable) b.withDetail("reason", "NO_SELECTABLE_TOKEN");

        counts.forEach((bucket, n) -> b.withDetail(bucket.name().toLowerCase(Locale.ROOT), n));
        return b.build();
    }
}
