package com.tokenpool.backend.token.service;

import com.tokenpool.backend.common.TokenMasks;
import com.tokenpool.backend.token.entity.TagSetConverter;
import com.tokenpool.backend.token.entity.TokenEntity;
import com.tokenpool.backend.token.model.Quota;
import com.tokenpool.backend.token.model.TokenType;
import com.tokenpool.backend.token.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * ✅ admin 操作（新增 / 刪除 / tag / note / 額度覆寫 / 健康狀態重置）
 * 不在請求熱路徑上，不需要特別處理並發。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenAdminService {

    private final TokenRepository repo;
    private final Clock clock;

    @Transactional
    public int addTokens(Collection<String> tokens, TokenType type) {
        return addTokens(tokens, type, Instant.now(clock));
    }

    /**
     * 已存在的 token 會整筆覆蓋（額度 / 失敗數 / 狀態全部回到初始值）。
     * type 建立後不可改：已經以另一個 type 存在的 token 直接跳過，不覆蓋、不計數。
     *
     * @return 實際新增 / 覆蓋的筆數
     */
    @Transactional
    public int addTokens(Collection<String> tokens, TokenType type, Instant nowUtc) {
        Set<String> cleaned = requireTokens(tokens);

        Set<String> typeMismatch = new LinkedHashSet<>();
        for (TokenEntity existing : repo.findAllById(cleaned)) {
            if (existing.getTokenType() != type) typeMismatch.add(existing.getToken());
        }

        List<TokenEntity> rows = new ArrayList<>(cleaned.size());
        for (String t : cleaned) {
            if (typeMismatch.contains(t)) continue;
            rows.add(TokenEntity.fresh(t, type, nowUtc));
        }
        repo.saveAll(rows);

        if (!typeMismatch.isEmpty()) {
            log.warn("tokens_add_type_mismatch type={} skipped={} tokens={}", type, typeMismatch.size(),
                    typeMismatch.stream().map(TokenMasks::suffix).toList());
        }
        log.info("tokens_added type={} count={}", type, rows.size());
        return rows.size();
    }

    /** @return 實際刪掉的筆數（type 不符的不刪） */
    @Transactional
    public int deleteTokens(Collection<String> tokens, TokenType type) {
        Set<String> cleaned = requireTokens(tokens);

        int deleted = repo.deleteByTypeAndTokens(type, cleaned);
        log.info("tokens_deleted type={} requested={} deleted={}", type, cleaned.size(), deleted);
        return deleted;
    }

    @Transactional
    public void updateTags(String token, TokenType type, Collection<String> tags) {
        TokenEntity e = requireToken(token, type);
        e.setTags(TagSetConverter.clean(tags == null ? Set.of() : new LinkedHashSet<>(tags)));
    }

    @Transactional
    public void updateNote(String token, TokenType type, String note) {
        TokenEntity e = requireToken(token, type);
        e.setNote(note == null ? "" : note.trim());
    }

    @Transactional(readOnly = true)
    public List<String> allTags() {
        Set<String> out = new TreeSet<>();
        for (Set<String> tags : repo.findAllTagSets()) {
            if (tags != null) out.addAll(tags);
        }
        return List.copyOf(out);
    }

    /**
     * 額度覆寫（proxy 打完 upstream 後同步剩餘次數也走這裡）。null = 不改。
     */
    @Transactional
    public void updateLimits(String token, Integer remainingQueries, Integer heavyRemainingQueries) {
        if (remainingQueries == null && heavyRemainingQueries == null) return;
        validateQuota(remainingQueries);
        validateQuota(heavyRemainingQueries);

        int updated = 0;
        if (remainingQueries != null) updated += repo.updateRemainingQueries(token, remainingQueries);
        if (heavyRemainingQueries != null) updated += repo.updateHeavyRemainingQueries(token, heavyRemainingQueries);
        if (updated == 0) throw new IllegalArgumentException("TOKEN_NOT_FOUND");

        log.debug("token_limits token={} remaining={} heavy={}",
                TokenMasks.suffix(token), remainingQueries, heavyRemainingQueries);
    }

    @Transactional
    public void resetHealth(String token) {
        if (repo.resetHealth(token) == 0) throw new IllegalArgumentException("TOKEN_NOT_FOUND");
        log.info("token_health_reset token={}", TokenMasks.suffix(token));
    }

    private TokenEntity requireToken(String token, TokenType type) {
        String t = token == null ? "" : token.trim();
        return repo.findByTokenAndTokenType(t, type)
                .orElseThrow(() -> new IllegalArgumentException("TOKEN_NOT_FOUND"));
    }

    private static void validateQuota(Integer v) {
        if (v != null && !Quota.isValidRaw(v)) throw new IllegalArgumentException("QUOTA_INVALID");
    }

    private static Set<String> requireTokens(Collection<String> tokens) {
        Set<String> cleaned = cleanTokens(tokens);
        if (cleaned.isEmpty()) throw new IllegalArgumentException("TOKENS_REQUIRED");
        return cleaned;
    }

    private static Set<String> cleanTokens(Collection<String> tokens) {
        Set<String> out = new LinkedHashSet<>();
        if (tokens == null) return out;
        for (String t : tokens) {
            if (t == null) continue;
            String v = t.trim();
            if (!v.isEmpty()) out.add(v);
        }
        return out;
    }
}
