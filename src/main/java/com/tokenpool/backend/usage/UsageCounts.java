package com.tokenpool.backend.usage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * 一次呼叫的 token 用量（估算值）。cachedTokens 目前沒有訊號來源，固定 0。
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UsageCounts(
        int totalTokens,
        int inputTokens,
        int outputTokens,
        int reasoningTokens,
        int cachedTokens,
        InputDetails inputTokensDetails,
        OutputDetails outputTokensDetails
) {

    public static final UsageCounts ZERO = new UsageCounts(0, 0, 0, 0, 0,
            new InputDetails(0, 0), new OutputDetails(0, 0));

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record InputDetails(int textTokens, int imageTokens) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record OutputDetails(int textTokens, int reasoningTokens) {}
}
