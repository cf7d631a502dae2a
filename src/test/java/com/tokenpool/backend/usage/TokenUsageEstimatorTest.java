package com.tokenpool.backend.usage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenUsageEstimatorTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void estimate_ascii_rounds_up_per_four_chars() {
        assertThat(TokenUsageEstimator.estimateTokens("")).isZero();
        assertThat(TokenUsageEstimator.estimateTokens(null)).isZero();
        assertThat(TokenUsageEstimator.estimateTokens("abcd")).isEqualTo(1);
        assertThat(TokenUsageEstimator.estimateTokens("abcde")).isEqualTo(2);
    }

    @Test
    void estimate_non_ascii_counts_each_code_point() {
        assertThat(TokenUsageEstimator.estimateTokens("好")).isEqualTo(1);
        assertThat(TokenUsageEstimator.estimateTokens("abcdefgh好")).isEqualTo(3);

        // surrogate pair 只算一個 code point
        assertThat(TokenUsageEstimator.estimateTokens("😀")).isEqualTo(1);
    }

    @Test
    void split_collects_think_segments_and_strips_them_from_output() {
        ReasoningSplit s = TokenUsageEstimator.splitReasoningSegments("a<think>x</think>b<THINK>y</THINK>c");

        assertThat(s.reasoningText()).isEqualTo("x\ny");
        assertThat(s.outputText()).isEqualTo("abc");
        assertThat(s.hasReasoning()).isTrue();
    }

    @Test
    void split_without_think_keeps_text_as_output() {
        ReasoningSplit s = TokenUsageEstimator.splitReasoningSegments("plain answer");

        assertThat(s.reasoningText()).isEmpty();
        assertThat(s.outputText()).isEqualTo("plain answer");
        assertThat(s.hasReasoning()).isFalse();
    }

    @Test
    void split_spans_newlines_and_skips_empty_segments() {
        ReasoningSplit s = TokenUsageEstimator.splitReasoningSegments("<think></think><think>line1\nline2</think>ok");

        assertThat(s.reasoningText()).isEqualTo("line1\nline2");
        assertThat(s.outputText()).isEqualTo("ok");
    }

    @Test
    void chat_usage_adds_reasoning_into_output() {
        // output "abcd" = 1, reasoning "abcdefgh" = 2
        UsageCounts u = TokenUsageEstimator.buildChatUsage(5, 0, "<think>abcdefgh</think>abcd");

        assertThat(u.inputTokens()).isEqualTo(5);
        assertThat(u.reasoningTokens()).isEqualTo(2);
        assertThat(u.outputTokens()).isEqualTo(3);
        assertThat(u.totalTokens()).isEqualTo(8);
        assertThat(u.cachedTokens()).isZero();
        assertThat(u.outputTokensDetails().textTokens()).isEqualTo(1);
        assertThat(u.outputTokensDetails().reasoningTokens()).isEqualTo(2);
        assertThat(u.inputTokensDetails().textTokens()).isEqualTo(5);
    }

    @Test
    void prompt_estimate_reads_string_and_part_contents() throws Exception {
        JsonNode messages = om.readTree("""
                [
                  {"role":"system","content":"abc"},
                  {"role":"user","content":[
                    {"type":"text","text":"好"},
                    {"type":"image_url","image_url":{"url":"https://x/y.png"}}
                  ]},
                  {"role":"assistant","content":null}
                ]
                """);

        PromptEstimate p = TokenUsageEstimator.estimatePromptTokens(messages);

        // "abc\n好" => 4 ascii -> 1, 好 -> 1
        assertThat(p.textTokens()).isEqualTo(2);
        assertThat(p.imageTokens()).isZero();
        assertThat(p.promptTokens()).isEqualTo(2);
    }

    @Test
    void prompt_estimate_tolerates_non_array() {
        assertThat(TokenUsageEstimator.estimatePromptTokens(null).promptTokens()).isZero();
        assertThat(TokenUsageEstimator.estimatePromptTokens(om.createObjectNode()).promptTokens()).isZero();
    }

    @Test
    void image_usage_multiplies_prompt_by_success_count() {
        UsageCounts u = TokenUsageEstimator.buildImageUsage("abcdefgh", 3);

        assertThat(u.inputTokens()).isEqualTo(6);
        assertThat(u.totalTokens()).isEqualTo(6);
        assertThat(u.outputTokens()).isZero();
        // details 是單張 prompt 的數量，不乘張數
        assertThat(u.inputTokensDetails().textTokens()).isEqualTo(2);
        assertThat(u.inputTokensDetails().imageTokens()).isZero();

        assertThat(TokenUsageEstimator.buildImageUsage("abcd", 0).inputTokens()).isEqualTo(1);
    }

    @Test
    void usage_serializes_snake_case() throws Exception {
        String json = om.writeValueAsString(TokenUsageEstimator.buildChatUsage(1, 0, "abcd"));

        assertThat(json).contains("\"total_tokens\":2");
        assertThat(json).contains("\"input_tokens_details\"", "\"text_tokens\":1", "\"image_tokens\":0");
    }
}
