package com.tokenpool.backend.usage;

public record PromptEstimate(int textTokens, int imageTokens, int promptTokens) {}
