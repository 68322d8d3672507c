package com.example.musicstreaming.infrastructure.security;

import com.example.musicstreaming.api.response.ApiResponse;
import com.example.musicstreaming.application.service.AccessTokenService;
import com.example.musicstreaming.common.exception.BusinessException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.regex.Pattern;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates API calls with a bearer access token. Manifest and segment fetches are skipped: media
 * players cannot attach headers, so those requests are authorized by their session token instead.
 */
public class TokenAuthFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Pattern SESSION_MEDIA_URI_PATTERN =
            Pattern.compile("^/api/streaming/v1/sessions/[^/]+/(manifest\\.mpd|segments/[^/]+)$");

    private final AccessTokenService accessTokenService;
    private final ObjectMapper objectMapper;

    public TokenAuthFilter(AccessTokenService accessTokenService) {
        this.accessTokenService = accessTokenService;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri.startsWith("/actuator/health")
                || uri.startsWith("/actuator/info")
                || uri.startsWith("/v3/api-docs")
                || uri.startsWith("/swagger-ui")
                || uri.startsWith("/error")
                || isSessionMediaRequest(uri);
    }

    static boolean isSessionMediaRequest(String uri) {
        return uri != null && SESSION_MEDIA_URI_PATTERN.matcher(uri).matches();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String bearerToken = extractBearerToken(request);
        if (bearerToken == null || bearerToken.isEmpty()) {
            unauthorized(response, "AUTH_MISSING_TOKEN", "缺少 Bearer token", "请先登录");
            return;
        }

        String userId;
        try {
            userId = accessTokenService.verifyAccessTokenAndGetSubject(bearerToken);
        } catch (BusinessException e) {
            unauthorized(response, e.getCode(), e.getMessage(), e.getUserAction());
            return;
        }
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(
                        userId,
                        null,
                        Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER")));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        filterChain.doFilter(request, response);
    }

    private String extractBearerToken(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return authHeader.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    private void unauthorized(HttpServletResponse response,
                              String code,
                              String message,
                              String userAction) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType("application/json;charset=UTF-8");
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, buildWwwAuthenticateValue(code));
        ApiResponse<Void> body = ApiResponse.fail(code, message, userAction);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private String buildWwwAuthenticateValue(String code) {
        if ("AUTH_MISSING_TOKEN".equals(code)) {
            return "Bearer error=\"invalid_request\", error_description=\"missing bearer token\"";
        }
        if ("AUTH_ACCESS_TOKEN_EXPIRED".equals(code)) {
            return "Bearer error=\"invalid_token\", error_description=\"access token expired\"";
        }
        return "Bearer error=\"invalid_token\", error_description=\"access token invalid\"";
    }
}
