package com.example.musicstreaming.common.util;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

/**
 * HS256 JWT encoding and verification shared by access tokens and streaming session tokens.
 * <p>
 * Verification failures surface as jjwt exceptions; {@code ExpiredJwtException} still carries the
 * verified claims so callers can apply their own continuity rules.
 */
public final class JwtTokenCodec {

    private JwtTokenCodec() {
    }

    public static String encode(Map<String, Object> claims,
                                String subject,
                                Instant issuedAt,
                                Instant expiresAt,
                                String secret) {
        return Jwts.builder()
                .addClaims(claims)
                .setSubject(subject)
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey(secret))
                .compact();
    }

    public static Claims decodeAndVerify(String token, String secret, Clock clock) {
        return Jwts.parserBuilder()
                .setSigningKey(signingKey(secret))
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    private static Key signingKey(String secret) {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
