package com.tokenpool.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * ✅ 每個請求一個 request id：admin 錯誤回應的 requestId、log 的 [rid=...] 都用它
 * - client 帶的 X-Request-Id 只接受安全字元（避免換行 / 控制字元混進 log）
 * - 不合格就換成新的 UUID，並回寫到 response header
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = resolve(req.getHeader(HEADER));

        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /** client 給的 id 合格就沿用，否則產生新的 */
    static String resolve(String header) {
        if (header != null) {
            String v = header.trim();
            if (SAFE_ID.matcher(v).matches()) return v;
        }
        return UUID.randomUUID().toString();
    }

    /** filter 沒跑到（例如直接呼叫 advice）也要有 id */
    public static String getOrCreate(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }
}
