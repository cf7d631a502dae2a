package com.tokenpool.backend.token.dto;

import java.util.List;

public record TokenPage(long total, List<TokenView> items) {}
