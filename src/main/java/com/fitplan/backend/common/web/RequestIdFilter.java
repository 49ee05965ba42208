package com.fitplan.backend.common.web;

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
 * 每個 request 一個 id：錯誤 body、response header、log（MDC rid）共用。
 * client 帶來的 id 只收短的安全字元，其他一律換成 UUID。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = accept(req.getHeader(HEADER));

        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /** 換行、空白、過長的 id 會弄亂 log → 不收 */
    static String accept(String incoming) {
        if (incoming != null) {
            String t = incoming.trim();
            if (SAFE_ID.matcher(t).matches()) return t;
        }
        return UUID.randomUUID().toString();
    }

    /** filter 沒跑到（例如 standalone MockMvc）→ null */
    public static String current(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? null : String.valueOf(v);
    }
}
