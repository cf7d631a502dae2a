package com.tokenpool.backend.token.model;

import java.util.Locale;
import java.util.Set;

/**
 * admin 列表條件，全部 AND。null = 不過濾。
 *
 * @param nsfw 由 note 是否含 "nsfw" 判斷；TRUE 只要有、FALSE 只要沒有
 */
public record TokenListFilters(
        TokenType tokenType,
        StatusBucket status,
        Boolean nsfw,
        String search,
        String tag
) {

    public static final TokenListFilters NONE = new TokenListFilters(null, null, null, null, null);

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "on", "enabled");
    private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no", "off", "disabled");

    public TokenListFilters {
        search = blankToNull(search);
        tag = blankToNull(tag);
        if (tag != null && "all".equalsIgnoreCase(tag)) tag = null;
    }

    public static TokenListFilters ofStatus(StatusBucket status) {
        return new TokenListFilters(null, status, null, null, null);
    }

    /** query string 原樣進來，寬鬆解析（不認得的值就當沒給） */
    public static TokenListFilters parse(String tokenType, String status, String nsfw, String search, String tag) {
        return new TokenListFilters(
                TokenType.parseOrNull(tokenType),
                StatusBucket.parseOrNull(status),
                parseFlag(nsfw),
                search,
                tag
        );
    }

    private static Boolean parseFlag(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(v)) return Boolean.TRUE;
        if (FALSE_VALUES.contains(v)) return Boolean.FALSE;
        return null;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
