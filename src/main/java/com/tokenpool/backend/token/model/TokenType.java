package com.tokenpool.backend.token.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * DB 存 enum name；對外（admin UI / request）沿用舊的 wire name：sso / ssoSuper。
 */
public enum TokenType {
    STANDARD("sso"),
    PREMIUM("ssoSuper");

    private final String wireName;

    TokenType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** 不認得就丟 TOKEN_TYPE_INVALID */
    public static TokenType parse(String raw) {
        TokenType t = parseOrNull(raw);
        if (t == null) throw new IllegalArgumentException("TOKEN_TYPE_INVALID");
        return t;
    }

    /** 空字串 / "all" / 不認得 => null（= 不過濾） */
    public static TokenType parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim();
        for (TokenType t : values()) {
            if (t.wireName.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v)) return t;
        }
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "basic", "ssobasic" -> STANDARD;
            case "super" -> PREMIUM;
            default -> null;
        };
    }
}
