package com.tokenpool.backend.token.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * admin API request bodies（snake_case，跟舊 UI 相容）
 */
public final class TokenAdminRequests {

    private TokenAdminRequests() {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record AddTokens(@NotEmpty List<String> tokens, @NotBlank String tokenType) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DeleteTokens(@NotEmpty List<String> tokens, @NotBlank String tokenType) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record UpdateTags(@NotBlank String token, @NotBlank String tokenType, @NotNull List<String> tags) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record UpdateNote(@NotBlank String token, @NotBlank String tokenType, @NotNull String note) {}

    /** null = 不改該欄位 */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record UpdateLimits(@NotBlank String token, Integer remainingQueries, Integer heavyRemainingQueries) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ResetHealth(@NotBlank String token) {}

    public record CountResponse(int count) {}
}
