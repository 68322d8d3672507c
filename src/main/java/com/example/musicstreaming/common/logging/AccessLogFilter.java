package com.example.musicstreaming.common.logging;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.servlet.AsyncEvent;
import javax.servlet.AsyncListener;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Assigns a request id, fills the MDC and writes one {@code ACCESS} line per request. Requests answered
 * asynchronously (readiness waits) are logged when the async response completes.
 * <p>
 * Query strings are never logged: they carry session tokens.
 */
public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_CLIENT_IP = "clientIp";
    private static final String MDC_SESSION_ID = "streamingSessionId";
    private static final Pattern STREAMING_SESSION_URI_PATTERN =
            Pattern.compile("^/api/streaming/v1/sessions/([^/]+)/.*$");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();
        String requestId = request.getHeader(HEADER_REQUEST_ID);
        if (requestId == null || requestId.trim().isEmpty()) {
            requestId = UUID.randomUUID().toString().replace("-", "");
        }

        response.setHeader(HEADER_REQUEST_ID, requestId);
        String clientIp = resolveClientIp(request);
        String sessionId = resolveStreamingSessionId(request.getRequestURI());

        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_CLIENT_IP, clientIp);
        if (sessionId != null) {
            MDC.put(MDC_SESSION_ID, sessionId);
        }
        boolean async = false;
        try {
            filterChain.doFilter(request, response);
            if (request.isAsyncStarted()) {
                async = true;
                request.getAsyncContext().addListener(new AccessLogAsyncListener(request, response, start,
                        clientIp, requestId));
            }
        } finally {
            if (!async) {
                logAccess(request, response.getStatus(), start, clientIp);
            }
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_CLIENT_IP);
            MDC.remove(MDC_SESSION_ID);
        }
    }

    private void logAccess(HttpServletRequest request, int status, long start, String clientIp) {
        long cost = System.currentTimeMillis() - start;
        log.info("ACCESS method={} uri={} status={} costMs={} ip={}",
                request.getMethod(), request.getRequestURI(), status, cost, clientIp);
    }

    static String resolveStreamingSessionId(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher matcher = STREAMING_SESSION_URI_PATTERN.matcher(uri);
        return matcher.matches() ? matcher.group(1) : null;
    }

    private String resolveClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.trim().isEmpty()) {
            int commaIndex = xForwardedFor.indexOf(',');
            return commaIndex > 0 ? xForwardedFor.substring(0, commaIndex).trim() : xForwardedFor.trim();
        }
        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.trim().isEmpty()) {
            return xRealIp.trim();
        }
        return request.getRemoteAddr();
    }

    private final class AccessLogAsyncListener implements AsyncListener {

        private final HttpServletRequest request;
        private final HttpServletResponse response;
        private final long start;
        private final String clientIp;
        private final String requestId;

        private AccessLogAsyncListener(HttpServletRequest request,
                                       HttpServletResponse response,
                                       long start,
                                       String clientIp,
                                       String requestId) {
            this.request = request;
            this.response = response;
            this.start = start;
            this.clientIp = clientIp;
            this.requestId = requestId;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            MDC.put(MDC_REQUEST_ID, requestId);
            try {
                logAccess(request, response.getStatus(), start, clientIp);
            } finally {
                MDC.remove(MDC_REQUEST_ID);
            }
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            log.warn("ACCESS_ASYNC_TIMEOUT method={} uri={} requestId={}",
                    request.getMethod(), request.getRequestURI(), requestId);
        }

        @Override
        public void onError(AsyncEvent event) {
            log.warn("ACCESS_ASYNC_ERROR method={} uri={} requestId={} error={}", request.getMethod(),
                    request.getRequestURI(), requestId,
                    event.getThrowable() == null ? "unknown" : event.getThrowable().getMessage());
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            event.getAsyncContext().addListener(this);
        }
    }
}
