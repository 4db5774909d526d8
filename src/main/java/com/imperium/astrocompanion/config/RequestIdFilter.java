package com.imperium.astrocompanion.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * 为每个请求分配 requestId：写入请求属性、响应头与 MDC（日志 pattern 中的 %X{requestId}），
 * 生成线程池通过 {@link RequestIdSupport#propagate(Runnable)} 继续沿用。
 * <p>
 * 客户端传入的 X-Request-Id 只接受字母、数字与 . _ -，最长 64 位；否则重新生成，避免日志注入。
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

    private static final Pattern ACCEPTED_INBOUND = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String inbound = request.getHeader(RequestIdSupport.HEADER_REQUEST_ID);
        String requestId;
        if (inbound != null && ACCEPTED_INBOUND.matcher(inbound).matches()) {
            requestId = inbound;
        } else {
            requestId = RequestIdSupport.newRequestId();
            if (inbound != null && !inbound.isBlank()) {
                log.debug("Replaced malformed inbound request id ({} chars) with {} for {} {}",
                        inbound.length(), requestId, request.getMethod(), request.getRequestURI());
            }
        }
        request.setAttribute(RequestIdSupport.ATTR_REQUEST_ID, requestId);
        response.setHeader(RequestIdSupport.HEADER_REQUEST_ID, requestId);
        MDC.put(RequestIdSupport.ATTR_REQUEST_ID, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestIdSupport.ATTR_REQUEST_ID);
        }
    }
}
