package com.tokenpool.backend.token.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * tags 欄位存 JSON array 字串（["a","b"]）。
 * 讀到壞掉的資料一律當「沒有 tag」，不讓整個列表炸掉。
 */
@Slf4j
@Converter(autoApply = false)
public class TagSetConverter implements AttributeConverter<Set<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(Set<String> tags) {
        if (tags == null || tags.isEmpty()) return "[]";
        try {
            return MAPPER.writeValueAsString(clean(tags));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("TAGS_ENCODE_FAILED", e);
        }
    }

    @Override
    public Set<String> convertToEntityAttribute(String raw) {
        return decode(raw);
    }

    public static Set<String> decode(String raw) {
        if (raw == null || raw.isBlank()) return new LinkedHashSet<>();
        try {
            JsonNode node = MAPPER.readTree(raw);
            if (node == null || !node.isArray()) return new LinkedHashSet<>();

            Set<String> out = new LinkedHashSet<>();
            for (JsonNode it : node) {
                if (it != null && it.isTextual()) out.add(it.asText());
            }
            return out;
        } catch (JsonProcessingException e) {
            log.debug("malformed tags column, treated as empty: {}", e.getOriginalMessage());
            return new LinkedHashSet<>();
        }
    }

    /** 單一 tag 的 JSON 字串（含雙引號），跟欄位裡的寫法一字不差，給 LIKE 比對用 */
    public static String encodeOne(String tag) {
        try {
            return MAPPER.writeValueAsString(tag);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("TAGS_ENCODE_FAILED", e);
        }
    }

    /** trim + 去空白 + 去重（保留原順序） */
    public static Set<String> clean(Set<String> tags) {
        if (tags == null) return Collections.emptySet();
        Set<String> out = new LinkedHashSet<>();
        for (String t : tags) {
            if (t == null) continue;
            String v = t.trim();
            if (!v.isEmpty()) out.add(v);
        }
        return out;
    }
}
