package com.tokenpool.backend.token.model;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * 請求分類：決定看哪個 quota 欄位、可以用哪些 token type。
 */
public enum WorkloadClass {

    /** 先用 STANDARD，沒有再退到 PREMIUM（吃 PREMIUM 的一般額度） */
    STANDARD(List.of(TokenType.STANDARD, TokenType.PREMIUM)),

    /** 只能用 PREMIUM 的 heavy 額度，不 fallback */
    HEAVY(List.of(TokenType.PREMIUM));

    private final List<TokenType> candidateTypes;

    WorkloadClass(List<TokenType> candidateTypes) {
        this.candidateTypes = candidateTypes;
    }

    public List<TokenType> candidateTypes() {
        return candidateTypes;
    }

    public static WorkloadClass fromModel(String model, Collection<String> heavyModels) {
        if (model == null || model.isBlank() || heavyModels == null) return STANDARD;
        String m = model.trim().toLowerCase(Locale.ROOT);
        for (String h : heavyModels) {
            if (h != null && m.equals(h.trim().toLowerCase(Locale.ROOT))) return HEAVY;
        }
        return STANDARD;
    }
}
