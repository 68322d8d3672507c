package com.example.musicstreaming.application.service;

import com.example.musicstreaming.common.config.AppAuthProperties;
import com.example.musicstreaming.common.config.AppStreamingProperties;
import com.example.musicstreaming.common.exception.BusinessException;
import com.example.musicstreaming.common.exception.StreamingErrorCodes;
import com.example.musicstreaming.common.util.JwtTokenCodec;
import com.example.musicstreaming.domain.model.StreamingSession;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Mints and checks the tokens that scope media requests to one streaming session.
 * <p>
 * A token whose wall-clock expiry has passed is still honoured while its session is alive and has been
 * heartbeated at or after the token's issue time, so segment requests already in flight survive token
 * rotation.
 */
@Service
public class SessionTokenService {

    static final String TOKEN_TYPE = "segmented-streaming-session-v1";

    private static final String CLAIM_TYPE = "typ";
    private static final String CLAIM_SESSION_ID = "sid";
    private static final String CLAIM_USER_ID = "uid";
    private static final String CLAIM_TRACK_ID = "tid";
    private static final String CLAIM_QUALITY = "quality";
    private static final String CLAIM_SOURCE_TYPE = "sourceType";

    private final AppAuthProperties authProperties;
    private final AppStreamingProperties streamingProperties;
    private final Clock clock;

    @Autowired
    public SessionTokenService(AppAuthProperties authProperties, AppStreamingProperties streamingProperties) {
        this(authProperties, streamingProperties, Clock.systemUTC());
    }

    SessionTokenService(AppAuthProperties authProperties, AppStreamingProperties streamingProperties, Clock clock) {
        this.authProperties = authProperties;
        this.streamingProperties = streamingProperties;
        this.clock = clock;
    }

    public String issueSessionToken(StreamingSession session) {
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plusSeconds(Math.max(5L, streamingProperties.getTokenTtlSeconds()));

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(CLAIM_TYPE, TOKEN_TYPE);
        claims.put(CLAIM_SESSION_ID, session.getSessionId());
        claims.put(CLAIM_USER_ID, session.getUserId());
        claims.put(CLAIM_TRACK_ID, session.getTrackId());
        claims.put(CLAIM_QUALITY, session.getQuality().getValue());
        claims.put(CLAIM_SOURCE_TYPE, session.getSourceType().getValue());
        claims.put(Claims.ISSUER, authProperties.getIssuer());
        claims.put(Claims.AUDIENCE, authProperties.getAudience());

        try {
            return JwtTokenCodec.encode(claims, session.getSessionId(), issuedAt, expiresAt,
                    authProperties.getJwtSecret());
        } catch (RuntimeException e) {
            throw new BusinessException(StreamingErrorCodes.SIGNING_FAILED, "播放会话令牌生成失败", "请稍后重试", 500);
        }
    }

    /**
     * @throws BusinessException {@code STREAMING_SESSION_TOKEN_INVALID} for missing or unverifiable tokens,
     *                           {@code STREAMING_SESSION_TOKEN_EXPIRED} for expired tokens the session has not
     *                           continued, {@code STREAMING_SESSION_TOKEN_SCOPE_MISMATCH} when the token was
     *                           minted for another user, track, quality, source type or session
     */
    public void validateSessionToken(StreamingSession session, String token, boolean allowSessionIdMismatch) {
        VerifiedToken verified = verify(token);
        Claims claims = verified.claims;

        boolean scopeMatches = Objects.equals(session.getUserId(), stringClaim(claims, CLAIM_USER_ID))
                && Objects.equals(session.getTrackId(), longClaim(claims, CLAIM_TRACK_ID))
                && Objects.equals(session.getQuality().getValue(), stringClaim(claims, CLAIM_QUALITY))
                && Objects.equals(session.getSourceType().getValue(), stringClaim(claims, CLAIM_SOURCE_TYPE));
        if (!scopeMatches) {
            throw scopeMismatch();
        }
        boolean sessionIdMatches = Objects.equals(session.getSessionId(), stringClaim(claims, CLAIM_SESSION_ID));
        if (!sessionIdMatches && !allowSessionIdMismatch) {
            throw scopeMismatch();
        }

        if (verified.expired && !isContinuedBySession(session, claims)) {
            throw new BusinessException(StreamingErrorCodes.SESSION_TOKEN_EXPIRED, "播放会话令牌已过期", "请重新开始播放", 401);
        }
    }

    /**
     * Reads the user a token was minted for. The signature and token type are verified; wall-clock expiry
     * is not, because continuity is judged against the session record afterwards.
     */
    public String resolveTokenUserId(String token) {
        String userId = stringClaim(verify(token).claims, CLAIM_USER_ID);
        if (!StringUtils.hasText(userId)) {
            throw invalid();
        }
        return userId;
    }

    private VerifiedToken verify(String token) {
        if (!StringUtils.hasText(token)) {
            throw new BusinessException(StreamingErrorCodes.SESSION_TOKEN_INVALID, "播放会话令牌缺失", "请重新开始播放", 401);
        }
        Claims claims;
        boolean expired = false;
        try {
            claims = JwtTokenCodec.decodeAndVerify(token.trim(), authProperties.getJwtSecret(), clock);
        } catch (ExpiredJwtException e) {
            claims = e.getClaims();
            expired = true;
        } catch (JwtException | IllegalArgumentException e) {
            throw invalid();
        }

        if (!TOKEN_TYPE.equals(stringClaim(claims, CLAIM_TYPE))
                || !Objects.equals(authProperties.getIssuer(), claims.getIssuer())
                || !Objects.equals(authProperties.getAudience(), claims.getAudience())
                || claims.getIssuedAt() == null) {
            throw invalid();
        }
        return new VerifiedToken(claims, expired);
    }

    private boolean isContinuedBySession(StreamingSession session, Claims claims) {
        Instant lastHeartbeatAt = session.getLastHeartbeatAt();
        if (lastHeartbeatAt == null || session.isExpiredAt(clock.instant())) {
            return false;
        }
        return lastHeartbeatAt.toEpochMilli() >= claims.getIssuedAt().getTime();
    }

    private String stringClaim(Claims claims, String key) {
        Object value = claims.get(key);
        return value instanceof String ? (String) value : null;
    }

    private Long longClaim(Claims claims, String key) {
        Object value = claims.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return null;
    }

    private BusinessException invalid() {
        return new BusinessException(StreamingErrorCodes.SESSION_TOKEN_INVALID, "播放会话令牌无效", "请重新开始播放", 401);
    }

    private BusinessException scopeMismatch() {
        return new BusinessException(StreamingErrorCodes.SESSION_TOKEN_SCOPE_MISMATCH, "播放会话令牌与当前会话不匹配",
                "请刷新播放器后重试", 403);
    }

    private static final class VerifiedToken {
        private final Claims claims;
        private final boolean expired;

        private VerifiedToken(Claims claims, boolean expired) {
            this.claims = claims;
            this.expired = expired;
        }
    }
}
