package com.tokenpool.backend.usage;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 無 tokenizer 的用量估算（給 request log / usage 欄位用）
 * - ASCII：4 個字元算 1 token（無條件進位）
 * - 非 ASCII：每個 code point 算 1 token
 * - {@code <think>...</think>} 內的文字算 reasoning
 *
 * 圖片 token 目前一律 0，等真的有圖片計價再補。
 */
public final class TokenUsageEstimator {

    private static final Pattern THINK = Pattern.compile("<think>(.*?)</think>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final int ASCII_CHARS_PER_TOKEN = 4;

    /** 圖片成本尚未接上，先固定 0 */
    private static final int IMAGE_PART_TOKENS = 0;

    private TokenUsageEstimator() {}

    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0;

        int ascii = 0;
        int nonAscii = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            if (cp <= 0x7F) ascii++;
            else nonAscii++;
            i += Character.charCount(cp);
        }
        return (ascii + ASCII_CHARS_PER_TOKEN - 1) / ASCII_CHARS_PER_TOKEN + nonAscii;
    }

    public static ReasoningSplit splitReasoningSegments(String text) {
        if (text == null || text.isEmpty()) return ReasoningSplit.EMPTY;

        List<String> parts = new ArrayList<>();
        Matcher m = THINK.matcher(text);
        while (m.find()) {
            String seg = m.group(1);
            if (!seg.isEmpty()) parts.add(seg);
        }
        String output = THINK.matcher(text).replaceAll("");
        return new ReasoningSplit(String.join("\n", parts), output);
    }

    /**
     * OpenAI 風格 messages：content 可以是字串，或 [{type:"text",text:...},{type:"image_url",...}]。
     */
    public static PromptEstimate estimatePromptTokens(JsonNode messages) {
        List<String> parts = new ArrayList<>();
        int imageTokens = 0;

        if (messages != null && messages.isArray()) {
            for (JsonNode msg : messages) {
                JsonNode content = msg == null ? null : msg.get("content");
                if (content == null || content.isNull()) continue;

                if (content.isArray()) {
                    for (JsonNode item : content) {
                        String type = item.path("type").asText("");
                        if ("text".equals(type) && item.path("text").isTextual()) {
                            parts.add(item.get("text").asText());
                        } else if ("image_url".equals(type)) {
                            imageTokens += IMAGE_PART_TOKENS;
                        }
                    }
                } else if (content.isTextual()) {
                    parts.add(content.asText());
                }
            }
        }

        int textTokens = estimateTokens(String.join("\n", parts));
        return new PromptEstimate(textTokens, imageTokens, textTokens + imageTokens);
    }

    public static UsageCounts buildChatUsage(int promptTextTokens, int promptImageTokens, String completionText) {
        ReasoningSplit split = splitReasoningSegments(completionText);
        int completionTextTokens = estimateTokens(split.outputText());
        int reasoningTokens = estimateTokens(split.reasoningText());

        int outputTokens = completionTextTokens + reasoningTokens;
        int inputTokens = promptTextTokens + promptImageTokens;

        return new UsageCounts(
                inputTokens + outputTokens,
                inputTokens,
                outputTokens,
                reasoningTokens,
                0,
                new UsageCounts.InputDetails(promptTextTokens, promptImageTokens),
                new UsageCounts.OutputDetails(completionTextTokens, reasoningTokens)
        );
    }

    public static UsageCounts buildChatUsage(JsonNode messages, String completionText) {
        PromptEstimate p = estimatePromptTokens(messages);
        return buildChatUsage(p.textTokens(), p.imageTokens(), completionText);
    }

    /** 生圖：只算 prompt，成功幾張 total / input 就乘幾倍（至少 1）；details 留單張的 prompt 數 */
    public static UsageCounts buildImageUsage(String prompt, int successCount) {
        int textTokens = estimateTokens(prompt);
        int input = textTokens * Math.max(1, successCount);
        return new UsageCounts(
                input,
                input,
                0,
                0,
                0,
                new UsageCounts.InputDetails(textTokens, 0),
                new UsageCounts.OutputDetails(0, 0)
        );
    }
}
