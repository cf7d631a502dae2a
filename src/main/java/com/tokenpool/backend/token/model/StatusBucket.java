package com.tokenpool.backend.token.model;

import java.time.Instant;

/**
 * 列表 / 顯示用的衍生狀態。非 EXPIRED 的 token 一定剛好落在
 * ACTIVE / COOLING / EXHAUSTED / UNUSED 其中一個。
 *
 * SQL 版本在 {@code TokenListDao}，兩邊規則要一起改。
 */
public enum StatusBucket {
    INVALID("invalid", "失效"),
    ACTIVE("active", "正常"),
    COOLING("cooling", "冷却中"),
    EXHAUSTED("exhausted", "额度耗尽"),
    UNUSED("unused", "未使用");

    private final String code;
    private final String label;

    StatusBucket(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /** 英文 code 或中文 label 都收；不認得 => null（不過濾） */
    public static StatusBucket parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim();
        for (StatusBucket b : values()) {
            if (b.code.equalsIgnoreCase(v) || b.label.equals(v)) return b;
        }
        return null;
    }

    public static StatusBucket classify(
            TokenType type,
            TokenStatus status,
            Quota quota,
            Quota heavyQuota,
            Instant cooldownUntil,
            Instant nowUtc
    ) {
        if (status == TokenStatus.EXPIRED) return INVALID;
        if (isCooling(cooldownUntil, nowUtc)) return COOLING;
        if (isExhausted(type, quota, heavyQuota)) return EXHAUSTED;
        if (isUnused(type, quota, heavyQuota)) return UNUSED;
        return ACTIVE;
    }

    public static boolean isCooling(Instant cooldownUntil, Instant nowUtc) {
        return cooldownUntil != null && cooldownUntil.isAfter(nowUtc);
    }

    /** PREMIUM：任一欄位用完就算 exhausted */
    public static boolean isExhausted(TokenType type, Quota quota, Quota heavyQuota) {
        if (type == TokenType.PREMIUM) return quota.isExhausted() || heavyQuota.isExhausted();
        return quota.isExhausted();
    }

    /** PREMIUM：兩個欄位都沒用過才算 unused */
    public static boolean isUnused(TokenType type, Quota quota, Quota heavyQuota) {
        if (type == TokenType.PREMIUM) return quota.isUnused() && heavyQuota.isUnused();
        return quota.isUnused();
    }
}
