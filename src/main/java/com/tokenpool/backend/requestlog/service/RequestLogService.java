package com.tokenpool.backend.requestlog.service;

import com.tokenpool.backend.common.TokenMasks;
import com.tokenpool.backend.requestlog.dto.RequestLogView;
import com.tokenpool.backend.requestlog.entity.RequestLogEntity;
import com.tokenpool.backend.requestlog.repo.RequestLogRepository;
import com.tokenpool.backend.token.config.TokenPoolProperties;
import com.tokenpool.backend.usage.UsageCounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RequestLogService {

    private static final DateTimeFormatter TIME_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final int MAX_ERROR_LEN = 500;

    private final RequestLogRepository repo;
    private final TokenPoolProperties props;
    private final Clock clock;

    @Transactional
    public String append(CallOutcome outcome) {
        return append(outcome, Instant.now(clock));
    }

    /** @return 新紀錄的 id */
    @Transactional
    public String append(CallOutcome outcome, Instant nowUtc) {
        UsageCounts u = outcome.usage() == null ? UsageCounts.ZERO : outcome.usage();

        RequestLogEntity e = new RequestLogEntity();
        e.setId(UUID.randomUUID().toString());
        e.setCreatedAtUtc(nowUtc);
        e.setTime(TIME_FMT.format(nowUtc));
        e.setIp(outcome.ip());
        e.setModel(outcome.model());
        e.setDurationSec(Math.max(0d, outcome.durationSec()));
        e.setStatus(outcome.status());
        e.setKeyName(outcome.keyName());
        e.setTokenSuffix(TokenMasks.suffix(outcome.token()));
        e.setTotalTokens(u.totalTokens());
        e.setInputTokens(u.inputTokens());
        e.setOutputTokens(u.outputTokens());
        e.setReasoningTokens(u.reasoningTokens());
        e.setCachedTokens(u.cachedTokens());
        e.setError(truncate(outcome.error()));

        repo.save(e);
        log.debug("request_log id={} model={} status={} token={}", e.getId(), e.getModel(), e.getStatus(), e.getTokenSuffix());
        return e.getId();
    }

    @Transactional(readOnly = true)
    public List<RequestLogView> latest() {
        return latest(props.getRequestLogLimit());
    }

    /** 新的在前 */
    @Transactional(readOnly = true)
    public List<RequestLogView> latest(int limit) {
        int n = limit <= 0 ? props.getRequestLogLimit() : limit;
        return repo.findAllByOrderByCreatedAtUtcDescIdAsc(PageRequest.of(0, n))
                .stream()
                .map(RequestLogView::of)
                .toList();
    }

    @Transactional
    public long clear() {
        long n = repo.count();
        repo.deleteAllInBatch();
        log.info("request_log_cleared count={}", n);
        return n;
    }

    private static String truncate(String s) {
        if (s == null || s.isBlank()) return null;
        return s.length() <= MAX_ERROR_LEN ? s : s.substring(0, MAX_ERROR_LEN);
    }
}
