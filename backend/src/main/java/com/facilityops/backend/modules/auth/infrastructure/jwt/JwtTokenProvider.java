package com.facilityops.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.EnumMap;
import java.util.Map;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.facilityops.backend.modules.auth.domain.TokenKind;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 토큰 종류별 서명 키 보관소. 액세스/리프레시 토큰은 서로 다른 키로 서명한다.
 */
@Component
public class JwtTokenProvider {

    /** HS256 needs at least a 256-bit key. */
    public static final int MIN_KEY_BYTES = 32;

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final Map<TokenKind, SecretKey> keys = new EnumMap<>(TokenKind.class);

    public JwtTokenProvider(
            @Value("${jwt.secret}") String accessSecret,
            @Value("${jwt.refresh-secret}") String refreshSecret
    ) {
        keys.put(TokenKind.ACCESS, toKey(accessSecret));
        keys.put(TokenKind.REFRESH, toKey(refreshSecret));
    }

    public SecretKey getSecretKey(TokenKind kind) {
        return keys.get(kind);
    }

    /**
     * Base64 로 읽히는 비밀값은 디코딩한 바이트를, 그렇지 않으면 UTF-8 바이트를 키로 쓴다.
     */
    public static byte[] decodeSecret(String secretString) {
        try {
            return Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            return secretString.getBytes(StandardCharsets.UTF_8);
        }
    }

    private static SecretKey toKey(String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("JWT signing secret is not configured");
        }
        byte[] keyBytes = decodeSecret(secretString);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("JWT signing key must be at least " + MIN_KEY_BYTES
                    + " bytes after decoding, got " + keyBytes.length);
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }
}
