package com.tokenpool.backend.token.service;

import com.tokenpool.backend.common.TokenMasks;
import com.tokenpool.backend.token.config.TokenPoolProperties;
import com.tokenpool.backend.token.entity.TokenEntity;
import com.tokenpool.backend.token.model.TokenHandle;
import com.tokenpool.backend.token.model.TokenType;
import com.tokenpool.backend.token.model.WorkloadClass;
import com.tokenpool.backend.token.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * ✅ 選 token（純讀，不鎖、不扣額度）
 * - 同時多個請求可能拿到同一個 token：額度 / cooldown 是打完 upstream 後才回寫
 * - 找不到 = Optional.empty()，不是錯誤；要重試 / 排隊 / 直接失敗由呼叫端決定
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenAllocator {

    private final TokenRepository repo;
    private final TokenPoolProperties props;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<TokenHandle> select(WorkloadClass workload) {
        return select(workload, Instant.now(clock));
    }

    @Transactional(readOnly = true)
    public Optional<TokenHandle> select(WorkloadClass workload, Instant nowUtc) {
        for (TokenType type : workload.candidateTypes()) {
            Optional<TokenEntity> hit = pick(workload, type, nowUtc);
            if (hit.isPresent()) {
                TokenEntity e = hit.get();
                log.debug("token_select workload={} type={} token={}", workload, type, TokenMasks.suffix(e.getToken()));
                return Optional.of(new TokenHandle(e.getToken(), e.getTokenType()));
            }
        }
        log.info("token_select workload={} result=NONE", workload);
        return Optional.empty();
    }

    @Transactional(readOnly = true)
    public Optional<TokenHandle> selectForModel(String model, Instant nowUtc) {
        return select(props.workloadOf(model), nowUtc);
    }

    @Transactional(readOnly = true)
    public Optional<TokenHandle> selectForModel(String model) {
        return selectForModel(model, Instant.now(clock));
    }

    private Optional<TokenEntity> pick(WorkloadClass workload, TokenType type, Instant nowUtc) {
        int limit = props.getFailureLimit();
        return switch (workload) {
            case HEAVY -> repo.pickBestByHeavyRemaining(type.name(), limit, nowUtc);
            case STANDARD -> repo.pickBestByRemaining(type.name(), limit, nowUtc);
        };
    }
}
