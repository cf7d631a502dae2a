package com.tokenpool.backend.usage;

public record ReasoningSplit(String reasoningText, String outputText) {

    public static final ReasoningSplit EMPTY = new ReasoningSplit("", "");

    public boolean hasReasoning() {
        return !reasoningText.isEmpty();
    }
}
