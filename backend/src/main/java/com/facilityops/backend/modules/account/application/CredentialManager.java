package com.facilityops.backend.modules.account.application;

import java.time.OffsetDateTime;
import java.util.Objects;

import com.facilityops.backend.modules.account.domain.Account;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * 평문 비밀번호를 저장용 다이제스트로 바꾸고 검증한다. 다이제스트에는 솔트와 비용이 포함된다.
 */
@Component
public class CredentialManager {

    private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

    private final PasswordEncoder passwordEncoder;

    public CredentialManager(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        return passwordEncoder.encode(plaintext);
    }

    /**
     * 형식이 잘못된 다이제스트는 예외 대신 {@code false}로 처리한다.
     */
    public boolean verify(String plaintext, String digest) {
        if (plaintext == null || digest == null || digest.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, digest);
        } catch (IllegalArgumentException ex) {
            log.warn("Stored password digest could not be parsed: {}", ex.getMessage());
            return false;
        }
    }

    public void applyNewPassword(Account account, String plaintext, OffsetDateTime now) {
        account.setPasswordHash(hash(plaintext));
        account.getSecurity().setLastPasswordChange(now);
    }
}
