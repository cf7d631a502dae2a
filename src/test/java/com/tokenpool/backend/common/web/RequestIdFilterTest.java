package com.tokenpool.backend.common.web;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void safe_client_id_is_kept_and_visible_in_mdc_during_the_request() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/v1/admin/tokens");
        req.addHeader(RequestIdFilter.HEADER, "RID-abc.123:x");
        MockHttpServletResponse res = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(req, res, (request, response) -> seen.set(MDC.get(RequestIdFilter.MDC_KEY)));

        assertThat(seen.get()).isEqualTo("RID-abc.123:x");
        assertThat(res.getHeader(RequestIdFilter.HEADER)).isEqualTo("RID-abc.123:x");
        assertThat(RequestIdFilter.getOrCreate(req)).isEqualTo("RID-abc.123:x");
        assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isNull();
    }

    @Test
    void unsafe_or_oversized_ids_are_replaced() {
        assertThat(RequestIdFilter.resolve("abc\r\nFAKE LOG LINE")).doesNotContain("FAKE").hasSize(36);
        assertThat(RequestIdFilter.resolve("x".repeat(65))).hasSize(36);
        assertThat(RequestIdFilter.resolve("   ")).hasSize(36);
        assertThat(RequestIdFilter.resolve(null)).hasSize(36);
        assertThat(RequestIdFilter.resolve(" rid-1 ")).isEqualTo("rid-1");
    }
}
