package com.facilityops.backend.modules.account.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class SessionToken {

    @Column(name = "token", nullable = false, length = 2048)
    private String token;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "device", length = 255)
    private String device;

    @Column(name = "ip", length = 64)
    private String ip;

    protected SessionToken() {
    }

    public SessionToken(String token, OffsetDateTime createdAt, OffsetDateTime expiresAt, String device, String ip) {
        this.token = Objects.requireNonNull(token, "token");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        this.device = device;
        this.ip = ip;
    }

    public String getToken() {
        return token;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public String getDevice() {
        return device;
    }

    public String getIp() {
        return ip;
    }

    public boolean matches(String candidate) {
        return token.equals(candidate);
    }
}
