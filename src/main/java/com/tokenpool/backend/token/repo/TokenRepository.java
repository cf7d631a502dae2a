package com.tokenpool.backend.token.repo;

import com.tokenpool.backend.token.entity.TokenEntity;
import com.tokenpool.backend.token.model.TokenType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 所有計數器的變更都是單一 UPDATE（在 DB 內 +1 / 條件式改狀態），
 * 不做 read-modify-write，多台機器同時回報同一個 token 也不會掉更新。
 */
public interface TokenRepository extends JpaRepository<TokenEntity, String> {

    Optional<TokenEntity> findByTokenAndTokenType(String token, TokenType tokenType);

    // ===== selection（純讀） =====

    /**
     * 一般額度：-1（沒用過）排最前，再來剩餘多的，最後舊的優先。
     */
    @Query(value = """
            SELECT * FROM tokens
            WHERE token_type = :tokenType
              AND status <> 'EXPIRED'
              AND failed_count < :failureLimit
              AND (cooldown_until_utc IS NULL OR cooldown_until_utc <= :now)
              AND remaining_queries <> 0
            ORDER BY CASE WHEN remaining_queries = -1 THEN 0 ELSE 1 END,
                     remaining_queries DESC,
                     created_at_utc ASC,
                     token ASC
            LIMIT 1
            """, nativeQuery = true)
    Optional<TokenEntity> pickBestByRemaining(
            @Param("tokenType") String tokenType,
            @Param("failureLimit") int failureLimit,
            @Param("now") Instant now
    );

    /** heavy 額度版本（只有 PREMIUM 有意義） */
    @Query(value = """
            SELECT * FROM tokens
            WHERE token_type = :tokenType
              AND status <> 'EXPIRED'
              AND failed_count < :failureLimit
              AND (cooldown_until_utc IS NULL OR cooldown_until_utc <= :now)
              AND heavy_remaining_queries <> 0
            ORDER BY CASE WHEN heavy_remaining_queries = -1 THEN 0 ELSE 1 END,
                     heavy_remaining_queries DESC,
                     created_at_utc ASC,
                     token ASC
            LIMIT 1
            """, nativeQuery = true)
    Optional<TokenEntity> pickBestByHeavyRemaining(
            @Param("tokenType") String tokenType,
            @Param("failureLimit") int failureLimit,
            @Param("now") Instant now
    );

    // ===== health tracker =====

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            UPDATE tokens
            SET failed_count = failed_count + 1,
                last_failure_at_utc = :now,
                last_failure_reason = :reason
            WHERE token = :token
            """, nativeQuery = true)
    int incrementFailure(@Param("token") String token, @Param("now") Instant now, @Param("reason") String reason);

    /** 條件式：只有還沒 EXPIRED 且失敗數到門檻才改，回傳 1 = 這次轉成 EXPIRED */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            UPDATE tokens
            SET status = 'EXPIRED'
            WHERE token = :token
              AND status <> 'EXPIRED'
              AND failed_count >= :failureLimit
            """, nativeQuery = true)
    int expireIfFailuresReached(@Param("token") String token, @Param("failureLimit") int failureLimit);

    /** cooldown 只會往後延，不會被較短的 cooldown 蓋回去 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            UPDATE tokens
            SET cooldown_until_utc = :until
            WHERE token = :token
              AND (cooldown_until_utc IS NULL OR cooldown_until_utc < :until)
            """, nativeQuery = true)
    int extendCooldown(@Param("token") String token, @Param("until") Instant until);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            UPDATE tokens
            SET cooldown_until_utc = :until
            WHERE token = :token
              AND remaining_queries = 0
              AND (cooldown_until_utc IS NULL OR cooldown_until_utc < :until)
            """, nativeQuery = true)
    int extendCooldownIfExhausted(@Param("token") String token, @Param("until") Instant until);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            UPDATE tokens
            SET cooldown_until_utc = :until
            WHERE token = :token
              AND remaining_queries <> 0
              AND (cooldown_until_utc IS NULL OR cooldown_until_utc < :until)
            """, nativeQuery = true)
    int extendCooldownIfQuotaLeft(@Param("token") String token, @Param("until") Instant until);

    // ===== admin =====

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE tokens SET remaining_queries = :value WHERE token = :token", nativeQuery = true)
    int updateRemainingQueries(@Param("token") String token, @Param("value") int value);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE tokens SET heavy_remaining_queries = :value WHERE token = :token", nativeQuery = true)
    int updateHeavyRemainingQueries(@Param("token") String token, @Param("value") int value);

    /** 失敗數歸零 + 解除 cooldown；EXPIRED 不會被救回來 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            UPDATE tokens
            SET failed_count = 0,
                cooldown_until_utc = NULL
            WHERE token = :token
            """, nativeQuery = true)
    int resetHealth(@Param("token") String token);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TokenEntity t where t.tokenType = :tokenType and t.token in :tokens")
    int deleteByTypeAndTokens(@Param("tokenType") TokenType tokenType, @Param("tokens") Collection<String> tokens);

    @Query("select t.tags from TokenEntity t")
    List<Set<String>> findAllTagSets();
}
