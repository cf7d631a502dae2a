package com.tokenpool.backend.token.model;

import com.tokenpool.backend.common.TokenMasks;

/**
 * allocator 選出來的 token。不鎖、不扣額度：呼叫端打完 upstream 再回報結果。
 */
public record TokenHandle(String token, TokenType tokenType) {

    @Override
    public String toString() {
        return "TokenHandle[" + TokenMasks.suffix(token) + ", " + tokenType + "]";
    }
}
