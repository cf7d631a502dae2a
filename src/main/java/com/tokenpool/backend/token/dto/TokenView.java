package com.tokenpool.backend.token.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tokenpool.backend.token.entity.TokenEntity;
import com.tokenpool.backend.token.model.LimitReason;
import com.tokenpool.backend.token.model.StatusBucket;
import com.tokenpool.backend.token.model.TokenType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * admin UI 用的 token 顯示資料（時間一律 epoch millis）。
 *
 * @param status            中文狀態（失效 / 冷却中 / 额度耗尽 / 未使用 / 正常）
 * @param cooldownRemaining 剩幾秒（無條件進位），沒在冷卻 = 0
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenView(
        String token,
        TokenType tokenType,
        long createdTime,
        int remainingQueries,
        int heavyRemainingQueries,
        String status,
        String statusCode,
        List<String> tags,
        String note,
        Long cooldownUntil,
        int failedCount,
        Long lastFailureTime,
        String lastFailureReason,
        LimitReason limitReason,
        long cooldownRemaining
) {

    public static TokenView of(TokenEntity e, Instant nowUtc) {
        StatusBucket bucket = e.bucketAt(nowUtc);
        Instant until = e.getCooldownUntilUtc();
        boolean cooling = StatusBucket.isCooling(until, nowUtc);

        long remainingSec = 0;
        if (cooling) {
            // 不足一秒（含次毫秒）也算 1 秒，冷卻中不會顯示 0
            Duration d = Duration.between(nowUtc, until);
            remainingSec = d.getSeconds() + (d.getNano() > 0 ? 1 : 0);
        }

        LimitReason reason;
        if (cooling) reason = LimitReason.COOLDOWN;
        else if (StatusBucket.isExhausted(e.getTokenType(), e.getQuota(), e.getHeavyQuota())) reason = LimitReason.EXHAUSTED;
        else reason = LimitReason.NONE;

        return new TokenView(
                e.getToken(),
                e.getTokenType(),
                e.getCreatedAtUtc().toEpochMilli(),
                e.getRemainingQueries(),
                e.getHeavyRemainingQueries(),
                bucket.label(),
                bucket.code(),
                List.copyOf(e.getTags()),
                e.getNote() == null ? "" : e.getNote(),
                until == null ? null : until.toEpochMilli(),
                e.getFailedCount(),
                e.getLastFailureAtUtc() == null ? null : e.getLastFailureAtUtc().toEpochMilli(),
                e.getLastFailureReason() == null ? "" : e.getLastFailureReason(),
                reason,
                remainingSec
        );
    }
}
