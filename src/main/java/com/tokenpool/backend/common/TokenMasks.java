package com.tokenpool.backend.common;

/**
 * token 原文不進 log / request_logs，只留尾碼方便對帳。
 */
public final class TokenMasks {

    private static final int SUFFIX_LEN = 6;

    private TokenMasks() {}

    public static String suffix(String token) {
        if (token == null || token.isBlank()) return "";
        String t = token.trim();
        if (t.length() <= SUFFIX_LEN) return "***";
        return "..." + t.substring(t.length() - SUFFIX_LEN);
    }
}
