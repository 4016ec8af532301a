package com.facilityops.backend.modules.account.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;

/**
 * 계정에 내장된 보안 상태. 세션 목록은 삽입 순서를 유지한다.
 */
@Embeddable
public class SecurityState {

    @Column(name = "last_password_change")
    private OffsetDateTime lastPasswordChange;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    @Column(name = "lockout_until")
    private OffsetDateTime lockoutUntil;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    @Column(name = "last_login_ip", length = 64)
    private String lastLoginIp;

    @Column(name = "two_factor_enabled", nullable = false)
    private boolean twoFactorEnabled;

    @Column(name = "two_factor_secret", length = 255)
    private String twoFactorSecret;

    @ElementCollection
    @CollectionTable(name = "account_session_token", joinColumns = @JoinColumn(name = "account_id"))
    @OrderColumn(name = "entry_order")
    private List<SessionToken> sessionTokens = new ArrayList<>();

    public OffsetDateTime getLastPasswordChange() {
        return lastPasswordChange;
    }

    public void setLastPasswordChange(OffsetDateTime lastPasswordChange) {
        this.lastPasswordChange = lastPasswordChange;
    }

    public int getFailedLoginAttempts() {
        return failedLoginAttempts;
    }

    public void setFailedLoginAttempts(int failedLoginAttempts) {
        this.failedLoginAttempts = failedLoginAttempts;
    }

    public OffsetDateTime getLockoutUntil() {
        return lockoutUntil;
    }

    public void setLockoutUntil(OffsetDateTime lockoutUntil) {
        this.lockoutUntil = lockoutUntil;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public void setLastLoginAt(OffsetDateTime lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }

    public String getLastLoginIp() {
        return lastLoginIp;
    }

    public void setLastLoginIp(String lastLoginIp) {
        this.lastLoginIp = lastLoginIp;
    }

    public boolean isTwoFactorEnabled() {
        return twoFactorEnabled;
    }

    public void setTwoFactorEnabled(boolean twoFactorEnabled) {
        this.twoFactorEnabled = twoFactorEnabled;
    }

    public String getTwoFactorSecret() {
        return twoFactorSecret;
    }

    public void setTwoFactorSecret(String twoFactorSecret) {
        this.twoFactorSecret = twoFactorSecret;
    }

    public List<SessionToken> getSessionTokens() {
        return Collections.unmodifiableList(sessionTokens);
    }

    void appendSession(SessionToken session, int capacity) {
        sessionTokens.add(session);
        while (sessionTokens.size() > capacity) {
            sessionTokens.remove(0);
        }
    }

    boolean removeSession(String token) {
        return sessionTokens.removeIf(session -> session.matches(token));
    }

    void clearSessions() {
        sessionTokens.clear();
    }

    boolean hasSession(String token) {
        if (token == null) {
            return false;
        }
        return sessionTokens.stream().anyMatch(session -> session.matches(token));
    }
}
