package com.tokenpool.backend.token.repo;

import com.tokenpool.backend.token.entity.TagSetConverter;
import com.tokenpool.backend.token.entity.TokenEntity;
import com.tokenpool.backend.token.model.StatusBucket;
import com.tokenpool.backend.token.model.TokenListFilters;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import lombok.RequiredArgsConstructor;
import org.hibernate.dialect.MySQLDialect;
import org.hibernate.engine.spi.SessionFactoryImplementor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ✅ admin 列表：動態 WHERE + 分頁 + count
 * - 條件全部 AND
 * - status bucket 規則跟 {@link StatusBucket#classify} 一致（改一邊要改另一邊）
 * - LIKE 一律 escape（'!' 當 escape char，MySQL / H2 都吃）
 * - tag 比對要分大小寫：MySQL 預設 collation 不分，所以轉 BINARY 比；H2 本來就分
 */
@Repository
@RequiredArgsConstructor
public class TokenListDao {

    private static final String NOT_EXPIRED = "status <> 'EXPIRED'";
    private static final String COOLING = "(cooldown_until_utc IS NOT NULL AND cooldown_until_utc > :now)";
    private static final String NOT_COOLING = "(cooldown_until_utc IS NULL OR cooldown_until_utc <= :now)";

    private static final String EXHAUSTED_RULE = """
            ((token_type = 'PREMIUM' AND (remaining_queries = 0 OR heavy_remaining_queries = 0))
              OR (token_type <> 'PREMIUM' AND remaining_queries = 0))""";

    private static final String UNUSED_RULE = """
            ((token_type = 'PREMIUM' AND remaining_queries = -1 AND heavy_remaining_queries = -1)
              OR (token_type <> 'PREMIUM' AND remaining_queries = -1))""";

    private static final String TAG_LIKE = "tags LIKE :tag ESCAPE '!'";
    private static final String TAG_LIKE_BINARY = "CAST(tags AS BINARY) LIKE CAST(:tag AS BINARY) ESCAPE '!'";

    private final EntityManager em;

    /** 第一次用到才看 dialect */
    private volatile Boolean mysql;

    public record Result(long total, List<TokenEntity> items) {}

    /**
     * @param limit null = 全部
     */
    public Result list(TokenListFilters filters, Integer limit, int offset, Instant nowUtc) {
        Where w = buildWhere(filters == null ? TokenListFilters.NONE : filters, nowUtc, isMySql());

        Query count = em.createNativeQuery("SELECT COUNT(1) FROM tokens" + w.sql());
        w.bind(count);
        long total = ((Number) count.getSingleResult()).longValue();

        if (total == 0 || (limit != null && limit <= 0)) return new Result(total, List.of());

        Query page = em.createNativeQuery(
                "SELECT * FROM tokens" + w.sql() + " ORDER BY created_at_utc DESC, token ASC",
                TokenEntity.class
        );
        w.bind(page);
        page.setFirstResult(Math.max(0, offset));
        if (limit != null) page.setMaxResults(limit);

        @SuppressWarnings("unchecked")
        List<TokenEntity> items = page.getResultList();
        return new Result(total, items);
    }

    public long count(TokenListFilters filters, Instant nowUtc) {
        Where w = buildWhere(filters == null ? TokenListFilters.NONE : filters, nowUtc, isMySql());
        Query count = em.createNativeQuery("SELECT COUNT(1) FROM tokens" + w.sql());
        w.bind(count);
        return ((Number) count.getSingleResult()).longValue();
    }

    private boolean isMySql() {
        Boolean v = mysql;
        if (v == null) {
            v = em.getEntityManagerFactory()
                    .unwrap(SessionFactoryImplementor.class)
                    .getJdbcServices()
                    .getDialect() instanceof MySQLDialect;
            mysql = v;
        }
        return v;
    }

    static Where buildWhere(TokenListFilters f, Instant nowUtc, boolean binaryTagMatch) {
        List<String> clauses = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();

        if (f.tokenType() != null) {
            clauses.add("token_type = :tokenType");
            params.put("tokenType", f.tokenType().name());
        }

        if (f.search() != null) {
            clauses.add("token LIKE :search ESCAPE '!'");
            params.put("search", "%" + escapeLike(f.search()) + "%");
        }

        if (f.tag() != null) {
            // tags 存的是 JSON array：用同一個 ObjectMapper 編出 "tag"（含跳脫）整段比對 = 精確成員
            clauses.add(binaryTagMatch ? TAG_LIKE_BINARY : TAG_LIKE);
            params.put("tag", "%" + escapeLike(TagSetConverter.encodeOne(f.tag())) + "%");
        }

        if (f.nsfw() != null) {
            clauses.add(f.nsfw() ? "LOWER(note) LIKE '%nsfw%'" : "LOWER(note) NOT LIKE '%nsfw%'");
        }

        StatusBucket b = f.status();
        if (b != null) {
            switch (b) {
                case INVALID -> clauses.add("status = 'EXPIRED'");
                case COOLING -> {
                    clauses.add(NOT_EXPIRED);
                    clauses.add(COOLING);
                }
                case EXHAUSTED -> {
                    clauses.add(NOT_EXPIRED);
                    clauses.add(NOT_COOLING);
                    clauses.add(EXHAUSTED_RULE);
                }
                case UNUSED -> {
                    clauses.add(NOT_EXPIRED);
                    clauses.add(NOT_COOLING);
                    clauses.add("NOT " + EXHAUSTED_RULE);
                    clauses.add(UNUSED_RULE);
                }
                case ACTIVE -> {
                    clauses.add(NOT_EXPIRED);
                    clauses.add(NOT_COOLING);
                    clauses.add("NOT " + EXHAUSTED_RULE);
                    clauses.add("NOT " + UNUSED_RULE);
                }
            }
            if (b != StatusBucket.INVALID) params.put("now", nowUtc);
        }

        String sql = clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        return new Where(sql, params);
    }

    static String escapeLike(String s) {
        return s.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    record Where(String sql, Map<String, Object> params) {
        void bind(Query q) {
            params.forEach(q::setParameter);
        }
    }
}
