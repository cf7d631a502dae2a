package com.tokenpool.backend.requestlog.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tokenpool.backend.requestlog.entity.RequestLogEntity;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RequestLogView(
        String id,
        String time,
        long timestamp,
        String ip,
        String model,
        double duration,
        int status,
        String keyName,
        String tokenSuffix,
        int totalTokens,
        int inputTokens,
        int outputTokens,
        int reasoningTokens,
        int cachedTokens,
        String error
) {
    public static RequestLogView of(RequestLogEntity e) {
        return new RequestLogView(
                e.getId(),
                e.getTime(),
                e.getCreatedAtUtc().toEpochMilli(),
                e.getIp(),
                e.getModel(),
                e.getDurationSec(),
                e.getStatus(),
                e.getKeyName(),
                e.getTokenSuffix(),
                e.getTotalTokens(),
                e.getInputTokens(),
                e.getOutputTokens(),
                e.getReasoningTokens(),
                e.getCachedTokens(),
                e.getError() == null ? "" : e.getError()
        );
    }
}
