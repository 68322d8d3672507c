package com.example.musicstreaming.application.service;

import com.example.musicstreaming.common.config.AppAuthProperties;
import com.example.musicstreaming.common.exception.BusinessException;
import com.example.musicstreaming.common.util.JwtTokenCodec;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import java.time.Clock;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Verifies bearer access tokens issued by the account service.
 */
@Service
public class AccessTokenService {

    static final String TOKEN_TYPE_ACCESS = "access";

    static final String CODE_TOKEN_INVALID = "AUTH_ACCESS_TOKEN_INVALID";
    static final String CODE_TOKEN_EXPIRED = "AUTH_ACCESS_TOKEN_EXPIRED";

    private final AppAuthProperties authProperties;
    private final Clock clock;

    @Autowired
    public AccessTokenService(AppAuthProperties authProperties) {
        this(authProperties, Clock.systemUTC());
    }

    AccessTokenService(AppAuthProperties authProperties, Clock clock) {
        this.authProperties = authProperties;
        this.clock = clock;
    }

    /**
     * @return the user id carried in the token subject
     */
    public String verifyAccessTokenAndGetSubject(String token) {
        if (!StringUtils.hasText(token)) {
            throw new BusinessException(CODE_TOKEN_INVALID, "访问令牌缺失", "请先登录", 401);
        }
        Claims claims;
        try {
            claims = JwtTokenCodec.decodeAndVerify(token.trim(), authProperties.getJwtSecret(), clock);
        } catch (ExpiredJwtException e) {
            throw new BusinessException(CODE_TOKEN_EXPIRED, "访问令牌已过期", "请重新登录", 401);
        } catch (JwtException | IllegalArgumentException e) {
            throw new BusinessException(CODE_TOKEN_INVALID, "访问令牌无效", "请重新登录", 401);
        }

        Object type = claims.get("typ");
        if (!TOKEN_TYPE_ACCESS.equals(type)
                || !Objects.equals(authProperties.getIssuer(), claims.getIssuer())
                || !Objects.equals(authProperties.getAudience(), claims.getAudience())
                || !StringUtils.hasText(claims.getSubject())) {
            throw new BusinessException(CODE_TOKEN_INVALID, "访问令牌无效", "请重新登录", 401);
        }
        return claims.getSubject().trim();
    }
}
