package com.tokenpool.backend.token.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenAdminErrorResponse(
        String errorCode,
        String message,
        String requestId
) {
    /** 舊 UI 讀 code */
    @JsonProperty("code")
    public String code() {
        return errorCode;
    }
}
