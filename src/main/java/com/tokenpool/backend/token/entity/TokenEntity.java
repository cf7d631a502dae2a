package com.tokenpool.backend.token.entity;

import com.tokenpool.backend.token.model.Quota;
import com.tokenpool.backend.token.model.StatusBucket;
import com.tokenpool.backend.token.model.TokenStatus;
import com.tokenpool.backend.token.model.TokenType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Getter
@Setter
@Entity
@Table(
        name = "tokens",
        indexes = {
                @Index(name = "idx_tokens_type_status", columnList = "token_type,status"),
                @Index(name = "idx_tokens_created", columnList = "created_at_utc")
        }
)
public class TokenEntity {

    @Id
    @Column(name = "token", length = 512, nullable = false)
    private String token;

    /** 建立後不可改 */
    @Enumerated(EnumType.STRING)
    @Column(name = "token_type", length = 16, nullable = false, updatable = false)
    private TokenType tokenType;

    @Column(name = "created_at_utc", nullable = false, updatable = false)
    private Instant createdAtUtc;

    /** -1 = 還沒用過；只透過 {@link #getQuota()} 給業務邏輯用 */
    @Column(name = "remaining_queries", nullable = false)
    private int remainingQueries = Quota.UNUSED_RAW;

    @Column(name = "heavy_remaining_queries", nullable = false)
    private int heavyRemainingQueries = Quota.UNUSED_RAW;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private TokenStatus status = TokenStatus.ACTIVE;

    @Column(name = "cooldown_until_utc")
    private Instant cooldownUntilUtc;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    @Column(name = "last_failure_at_utc")
    private Instant lastFailureAtUtc;

    @Column(name = "last_failure_reason", length = 512)
    private String lastFailureReason;

    @Convert(converter = TagSetConverter.class)
    @Column(name = "tags", length = 2048, nullable = false)
    private Set<String> tags = new LinkedHashSet<>();

    @Column(name = "note", length = 1024, nullable = false)
    private String note = "";

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
        if (status == null) status = TokenStatus.ACTIVE;
        if (tags == null) tags = new LinkedHashSet<>();
        if (note == null) note = "";
    }

    public static TokenEntity fresh(String token, TokenType type, Instant nowUtc) {
        TokenEntity e = new TokenEntity();
        e.setToken(token);
        e.setTokenType(type);
        e.setCreatedAtUtc(nowUtc);
        return e;
    }

    public Quota getQuota() {
        return Quota.fromRaw(remainingQueries);
    }

    public Quota getHeavyQuota() {
        return Quota.fromRaw(heavyRemainingQueries);
    }

    public StatusBucket bucketAt(Instant nowUtc) {
        return StatusBucket.classify(tokenType, status, getQuota(), getHeavyQuota(), cooldownUntilUtc, nowUtc);
    }
}
