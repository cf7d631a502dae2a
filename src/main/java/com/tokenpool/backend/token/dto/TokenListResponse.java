package com.tokenpool.backend.token.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param perPage 數字，或 "all"
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenListResponse(
        long total,
        int page,
        Object perPage,
        int pages,
        List<TokenView> items
) {}
