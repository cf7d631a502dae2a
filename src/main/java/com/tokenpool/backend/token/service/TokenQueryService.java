package com.tokenpool.backend.token.service;

import com.tokenpool.backend.token.config.TokenPoolProperties;
import com.tokenpool.backend.token.dto.TokenListResponse;
import com.tokenpool.backend.token.dto.TokenPage;
import com.tokenpool.backend.token.dto.TokenView;
import com.tokenpool.backend.token.model.StatusBucket;
import com.tokenpool.backend.token.model.TokenListFilters;
import com.tokenpool.backend.token.repo.TokenListDao;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class TokenQueryService {

    public static final String PER_PAGE_ALL = "all";

    private final TokenListDao dao;
    private final TokenPoolProperties props;
    private final Clock clock;

    /**
     * @param limit null = 不限
     */
    @Transactional(readOnly = true)
    public TokenPage list(TokenListFilters filters, Integer limit, int offset, Instant nowUtc) {
        TokenListDao.Result r = dao.list(filters, limit, offset, nowUtc);
        List<TokenView> items = r.items().stream().map(e -> TokenView.of(e, nowUtc)).toList();
        return new TokenPage(r.total(), items);
    }

    @Transactional(readOnly = true)
    public TokenListResponse page(TokenListFilters filters, Integer page, String perPageRaw) {
        return page(filters, page, perPageRaw, Instant.now(clock));
    }

    /**
     * page 從 1 開始；perPage 可以是數字或 "all"（全部一頁）。
     */
    @Transactional(readOnly = true)
    public TokenListResponse page(TokenListFilters filters, Integer page, String perPageRaw, Instant nowUtc) {
        Integer perPage = parsePerPage(perPageRaw);

        if (perPage == null) {
            TokenPage all = list(filters, null, 0, nowUtc);
            return new TokenListResponse(all.total(), 1, PER_PAGE_ALL, 1, all.items());
        }

        int p = (page == null || page < 1) ? 1 : page;
        long offset = (long) (p - 1) * perPage;
        TokenPage slice = list(filters, perPage, (int) Math.min(Integer.MAX_VALUE, offset), nowUtc);

        int pages = (int) Math.max(1, (slice.total() + perPage - 1) / perPage);
        return new TokenListResponse(slice.total(), p, perPage, pages, slice.items());
    }

    /** health / dashboard 用：每個 bucket 的數量 */
    @Transactional(readOnly = true)
    public Map<StatusBucket, Long> countByBucket(Instant nowUtc) {
        Map<StatusBucket, Long> out = new EnumMap<>(StatusBucket.class);
        for (StatusBucket b : StatusBucket.values()) {
            out.put(b, dao.count(TokenListFilters.ofStatus(b), nowUtc));
        }
        return out;
    }

    /** null = all */
    Integer parsePerPage(String raw) {
        if (raw == null || raw.isBlank()) return props.getDefaultPerPage();
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (PER_PAGE_ALL.equals(v)) return null;
        try {
            int n = Integer.parseInt(v);
            if (n <= 0) throw new IllegalArgumentException("PER_PAGE_INVALID");
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("PER_PAGE_INVALID");
        }
    }
}
