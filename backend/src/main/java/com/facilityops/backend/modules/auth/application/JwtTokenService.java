package com.facilityops.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

import com.facilityops.backend.modules.auth.domain.TokenKind;
import com.facilityops.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String CLAIM_TYPE = "typ";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Duration rememberMeTtl;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:2592000000}") long refreshTokenTtlMillis,
            @Value("${jwt.remember-me-expiration:604800000}") long rememberMeTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = Duration.ofMillis(accessTokenTtlMillis);
        this.refreshTokenTtl = Duration.ofMillis(refreshTokenTtlMillis);
        this.rememberMeTtl = Duration.ofMillis(rememberMeTtlMillis);
        this.clock = clock;
    }

    public IssuedToken issue(UUID accountId, TokenKind kind) {
        return issue(accountId, kind, defaultTtl(kind), Map.of());
    }

    /**
     * 서명된 토큰을 발급한다. jti를 무작위로 넣어 같은 초에 발급된 토큰도 서로 다르다.
     */
    public IssuedToken issue(UUID accountId, TokenKind kind, Duration ttl, Map<String, ?> extraClaims) {
        Instant now = clock.instant();
        Instant expiry = now.plus(ttl);

        JwtBuilder builder = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(accountId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_TYPE, kind.getClaimValue());
        extraClaims.forEach(builder::claim);
        String token = builder.signWith(tokenProvider.getSecretKey(kind), SIG.HS256).compact();

        return new IssuedToken(
                token,
                kind,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiry, clock.getZone())
        );
    }

    public IssuedToken issueAccess(UUID accountId, String email, String roleCode, boolean rememberMe) {
        Duration ttl = rememberMe ? rememberMeTtl : accessTokenTtl;
        return issue(accountId, TokenKind.ACCESS, ttl, Map.of(CLAIM_EMAIL, email, CLAIM_ROLE, roleCode));
    }

    public IssuedToken issueRefresh(UUID accountId) {
        return issue(accountId, TokenKind.REFRESH);
    }

    public ParsedToken verify(String token, TokenKind expectedKind) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey(expectedKind))
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new MalformedTokenException("Token could not be verified", e);
        }

        TokenKind kind = TokenKind.fromClaim(claims.get(CLAIM_TYPE, String.class))
                .orElseThrow(() -> new MalformedTokenException("Token type missing", null));
        if (kind != expectedKind) {
            throw new MalformedTokenException("Unexpected token type " + kind.getClaimValue(), null);
        }
        if (claims.getSubject() == null || claims.getExpiration() == null) {
            throw new MalformedTokenException("Token is missing required claims", null);
        }

        UUID accountId;
        try {
            accountId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException e) {
            throw new MalformedTokenException("Token subject is not an account id", e);
        }
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
        Instant expiresAt = claims.getExpiration().toInstant();

        return new ParsedToken(
                accountId,
                kind,
                OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        );
    }

    private Duration defaultTtl(TokenKind kind) {
        return kind == TokenKind.REFRESH ? refreshTokenTtl : accessTokenTtl;
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    public record IssuedToken(String token, TokenKind kind, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {

        public long expiresInSeconds() {
            return Duration.between(issuedAt, expiresAt).getSeconds();
        }
    }

    public record ParsedToken(UUID accountId, TokenKind kind, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class TokenExpiredException extends InvalidTokenException {
        public TokenExpiredException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class MalformedTokenException extends InvalidTokenException {
        public MalformedTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
