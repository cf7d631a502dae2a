package com.tokenpool.backend.token.repo;

import com.tokenpool.backend.token.entity.TokenEntity;
import com.tokenpool.backend.token.model.StatusBucket;
import com.tokenpool.backend.token.model.TokenListFilters;
import com.tokenpool.backend.token.model.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static com.tokenpool.backend.testsupport.TokenFixtures.T0;
import static com.tokenpool.backend.testsupport.TokenFixtures.premium;
import static com.tokenpool.backend.testsupport.TokenFixtures.standard;
import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(TokenListDao.class)
class TokenListDaoTest {

    private static final Instant NOW = T0.plusSeconds(3600);

    @Autowired TokenRepository repo;
    @Autowired TokenListDao dao;

    @BeforeEach
    void seed() {
        // created 依序遞增，列表預設新的在前
        repo.save(standard("sso-active-000001").remaining(5).tags("vip", "team-a").createdAt(T0.plusSeconds(1)).build());
        repo.save(standard("sso-unused-000002").tags("vip2").note("NSFW ok").createdAt(T0.plusSeconds(2)).build());
        repo.save(standard("sso-exhaust-00003").remaining(0).createdAt(T0.plusSeconds(3)).build());
        repo.save(standard("sso-cooling-00004").remaining(0).coolingUntil(NOW.plusSeconds(30)).createdAt(T0.plusSeconds(4)).build());
        repo.save(standard("sso-expired-00005").remaining(5).expired().createdAt(T0.plusSeconds(5)).build());
        repo.save(premium("super_half_000006").remaining(-1).heavy(7).createdAt(T0.plusSeconds(6)).build());
        repo.save(premium("super-heavy0-0007").remaining(9).heavy(0).note("nsfw").createdAt(T0.plusSeconds(7)).build());
        repo.save(premium("super-fresh-00008").createdAt(T0.plusSeconds(8)).build());
        repo.flush();
    }

    @Test
    void no_filter_lists_all_newest_first() {
        TokenListDao.Result r = dao.list(TokenListFilters.NONE, null, 0, NOW);

        assertThat(r.total()).isEqualTo(8);
        assertThat(r.items()).extracting(TokenEntity::getToken)
                .startsWith("super-fresh-00008", "super-heavy0-0007")
                .endsWith("sso-active-000001");
    }

    @Test
    void limit_and_offset_page_through_but_total_counts_everything() {
        TokenListDao.Result r = dao.list(TokenListFilters.NONE, 3, 3, NOW);

        assertThat(r.total()).isEqualTo(8);
        assertThat(r.items()).extracting(TokenEntity::getToken)
                .containsExactly("sso-expired-00005", "sso-cooling-00004", "sso-exhaust-00003");
    }

    @Test
    void type_filter() {
        assertThat(dao.count(new TokenListFilters(TokenType.PREMIUM, null, null, null, null), NOW)).isEqualTo(3);
        assertThat(dao.count(new TokenListFilters(TokenType.STANDARD, null, null, null, null), NOW)).isEqualTo(5);
    }

    @Test
    void search_is_substring_and_escapes_wildcards() {
        assertThat(dao.count(new TokenListFilters(null, null, null, "cooling", null), NOW)).isEqualTo(1);

        // '_' 不能當萬用字元：只有 super_half 真的含底線
        TokenListDao.Result r = dao.list(new TokenListFilters(null, null, null, "_", null), null, 0, NOW);
        assertThat(r.items()).extracting(TokenEntity::getToken).containsExactly("super_half_000006");

        assertThat(dao.count(new TokenListFilters(null, null, null, "%", null), NOW)).isZero();
    }

    @Test
    void tag_filter_matches_whole_tag_only() {
        TokenListDao.Result r = dao.list(new TokenListFilters(null, null, null, null, "vip"), null, 0, NOW);

        assertThat(r.items()).extracting(TokenEntity::getToken).containsExactly("sso-active-000001");
    }

    @Test
    void tag_filter_matches_tags_with_json_escaped_characters() {
        repo.save(standard("sso-tag-backslash").tags("a\\b").build());
        repo.save(standard("sso-tag-quote0001").tags("say\"hi").build());
        repo.save(standard("sso-tag-percent01").tags("50%_off").build());
        repo.save(standard("sso-tag-lookalike").tags("50xxoff").build());
        repo.flush();

        assertThat(dao.list(new TokenListFilters(null, null, null, null, "a\\b"), null, 0, NOW).items())
                .extracting(TokenEntity::getToken).containsExactly("sso-tag-backslash");
        assertThat(dao.list(new TokenListFilters(null, null, null, null, "say\"hi"), null, 0, NOW).items())
                .extracting(TokenEntity::getToken).containsExactly("sso-tag-quote0001");
        assertThat(dao.list(new TokenListFilters(null, null, null, null, "50%_off"), null, 0, NOW).items())
                .extracting(TokenEntity::getToken).containsExactly("sso-tag-percent01");

        // % 和 _ 不能當萬用字元；拿掉引號的近似字串也不能誤中
        assertThat(dao.count(new TokenListFilters(null, null, null, null, "sayhi"), NOW)).isZero();
    }

    @Test
    void tag_filter_is_case_sensitive() {
        assertThat(dao.count(new TokenListFilters(null, null, null, null, "VIP"), NOW)).isZero();
        assertThat(dao.count(new TokenListFilters(null, null, null, null, "vip"), NOW)).isEqualTo(1);
    }

    @Test
    void mysql_tag_clause_compares_bytes() {
        TokenListFilters f = new TokenListFilters(null, null, null, null, "VIP");

        assertThat(TokenListDao.buildWhere(f, NOW, true).sql()).contains("CAST(tags AS BINARY) LIKE CAST(:tag AS BINARY)");
        assertThat(TokenListDao.buildWhere(f, NOW, false).sql()).contains("tags LIKE :tag").doesNotContain("BINARY");
        assertThat(TokenListDao.buildWhere(f, NOW, false).params()).containsEntry("tag", "%\"VIP\"%");
    }

    @Test
    void nsfw_filter_reads_note_case_insensitively() {
        assertThat(dao.count(new TokenListFilters(null, null, true, null, null), NOW)).isEqualTo(2);
        assertThat(dao.count(new TokenListFilters(null, null, false, null, null), NOW)).isEqualTo(6);
    }

    @Test
    void status_buckets_match_in_memory_classification() {
        for (StatusBucket b : StatusBucket.values()) {
            TokenListDao.Result r = dao.list(TokenListFilters.ofStatus(b), null, 0, NOW);
            assertThat(r.items()).allSatisfy(e -> assertThat(e.bucketAt(NOW)).isEqualTo(b));
        }

        assertThat(dao.count(TokenListFilters.ofStatus(StatusBucket.INVALID), NOW)).isEqualTo(1);
        assertThat(dao.count(TokenListFilters.ofStatus(StatusBucket.COOLING), NOW)).isEqualTo(1);
        assertThat(dao.count(TokenListFilters.ofStatus(StatusBucket.EXHAUSTED), NOW)).isEqualTo(2);
        assertThat(dao.count(TokenListFilters.ofStatus(StatusBucket.UNUSED), NOW)).isEqualTo(2);
        assertThat(dao.count(TokenListFilters.ofStatus(StatusBucket.ACTIVE), NOW)).isEqualTo(2);
    }

    @Test
    void buckets_partition_the_whole_table() {
        long sum = 0;
        for (StatusBucket b : StatusBucket.values()) {
            sum += dao.count(TokenListFilters.ofStatus(b), NOW);
        }
        assertThat(sum).isEqualTo(dao.count(TokenListFilters.NONE, NOW));
    }

    @Test
    void cooldown_end_moves_token_out_of_cooling() {
        Instant later = NOW.plusSeconds(30);

        assertThat(dao.count(TokenListFilters.ofStatus(StatusBucket.COOLING), later)).isZero();
        assertThat(dao.count(TokenListFilters.ofStatus(StatusBucket.EXHAUSTED), later)).isEqualTo(3);
    }

    @Test
    void escape_like_handles_escape_char_itself() {
        assertThat(TokenListDao.escapeLike("a!b%c_d")).isEqualTo("a!!b!%c!_d");
    }
}
