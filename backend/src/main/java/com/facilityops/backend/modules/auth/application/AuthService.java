package com.facilityops.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.facilityops.backend.global.error.ProblemException;
import com.facilityops.backend.global.security.AuthFailure;
import com.facilityops.backend.global.security.JwtAuthenticationPrincipal;
import com.facilityops.backend.modules.account.application.CredentialManager;
import com.facilityops.backend.modules.account.application.OneTimeTokens;
import com.facilityops.backend.modules.account.application.PermissionResolver;
import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.AccountStatus;
import com.facilityops.backend.modules.account.domain.LockoutPolicy;
import com.facilityops.backend.modules.account.domain.SessionPolicy;
import com.facilityops.backend.modules.account.domain.VerificationStatus;
import com.facilityops.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.facilityops.backend.modules.account.presentation.dto.AccountResponse;
import com.facilityops.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.facilityops.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.facilityops.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.facilityops.backend.modules.auth.domain.TokenKind;
import com.facilityops.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.facilityops.backend.modules.auth.presentation.dto.ForgotPasswordResponse;
import com.facilityops.backend.modules.auth.presentation.dto.LoginRequest;
import com.facilityops.backend.modules.auth.presentation.dto.LoginResponse;
import com.facilityops.backend.modules.auth.presentation.dto.RefreshResponse;
import com.facilityops.backend.modules.auth.presentation.dto.SessionStatusResponse;
import com.facilityops.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * 로그인, 토큰 갱신, 로그아웃, 비밀번호 변경/재설정, 이메일 인증 흐름.
 * 실패 응답을 던지더라도 실패 횟수/잠금 기록은 커밋되어야 하므로 rollback 대상에서 제외한다.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AccountRepository accountRepository;
    private final CredentialManager credentialManager;
    private final JwtTokenService jwtTokenService;
    private final LockoutPolicy lockoutPolicy;
    private final SessionPolicy sessionPolicy;
    private final PermissionResolver permissionResolver;
    private final OneTimeTokens oneTimeTokens;
    private final Clock clock;
    private final Duration passwordResetTtl;
    private final boolean exposeResetToken;

    public AuthService(
            AccountRepository accountRepository,
            CredentialManager credentialManager,
            JwtTokenService jwtTokenService,
            LockoutPolicy lockoutPolicy,
            SessionPolicy sessionPolicy,
            PermissionResolver permissionResolver,
            OneTimeTokens oneTimeTokens,
            Clock clock,
            @Value("${auth.password-reset.ttl:PT1H}") Duration passwordResetTtl,
            @Value("${auth.password-reset.expose-token:false}") boolean exposeResetToken
    ) {
        this.accountRepository = accountRepository;
        this.credentialManager = credentialManager;
        this.jwtTokenService = jwtTokenService;
        this.lockoutPolicy = lockoutPolicy;
        this.sessionPolicy = sessionPolicy;
        this.permissionResolver = permissionResolver;
        this.oneTimeTokens = oneTimeTokens;
        this.clock = clock;
        this.passwordResetTtl = passwordResetTtl;
        this.exposeResetToken = exposeResetToken;
    }

    public LoginResponse login(LoginRequest request, ClientInfo client) {
        Account account = findLoginCandidate(request)
                .orElseThrow(AuthService::invalidCredentials);
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (LockoutPolicy.isLocked(account.getSecurity(), now)) {
            log.warn("Login rejected for locked account {}", account.getId());
            throw AuthFailure.locked(LockoutPolicy.remainingMinutes(account.getSecurity(), now));
        }

        if (!credentialManager.verify(request.password(), account.getPasswordHash())) {
            boolean locked = lockoutPolicy.recordFailure(account.getSecurity(), now);
            accountRepository.save(account);
            if (locked) {
                log.warn("Account {} locked after {} failed login attempts",
                        account.getId(), account.getSecurity().getFailedLoginAttempts());
                throw AuthFailure.locked(LockoutPolicy.remainingMinutes(account.getSecurity(), now));
            }
            log.warn("Failed login for account {} (attempt {})",
                    account.getId(), account.getSecurity().getFailedLoginAttempts());
            throw invalidCredentials();
        }

        if (!account.getStatus().isActive()) {
            throw AuthFailure.notActive(account.getStatus().getCode());
        }
        if (!account.getVerificationStatus().isVerified()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "auth.account_not_verified",
                    "Please verify your email before logging in");
        }

        lockoutPolicy.recordSuccess(account.getSecurity());
        account.getSecurity().setLastLoginAt(now);
        account.getSecurity().setLastLoginIp(client.ip());

        IssuedToken access = jwtTokenService.issueAccess(account.getId(), account.getEmail(),
                account.getRole().getCode(), request.rememberMeRequested());
        IssuedToken refresh = jwtTokenService.issueRefresh(account.getId());
        sessionPolicy.add(account.getSecurity(), access.token(), client.device(), client.ip(), now);
        accountRepository.save(account);

        log.info("Account {} logged in", account.getId());
        return new LoginResponse(toTokenPair(access, refresh.token(), refresh.expiresInSeconds()), toResponse(account));
    }

    public RefreshResponse refresh(String refreshToken, ClientInfo client) {
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.verify(refreshToken, TokenKind.REFRESH);
        } catch (InvalidTokenException ex) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_refresh_token", "Invalid refresh token");
        }

        Account account = lockAccount(parsed.accountId());
        if (!account.getStatus().isActive()) {
            throw AuthFailure.notActive(account.getStatus().getCode());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        IssuedToken access = jwtTokenService.issueAccess(account.getId(), account.getEmail(),
                account.getRole().getCode(), false);
        sessionPolicy.add(account.getSecurity(), access.token(), client.device(), client.ip(), now);
        accountRepository.save(account);

        long refreshRemaining = Math.max(Duration.between(now, parsed.expiresAt()).getSeconds(), 0);
        return new RefreshResponse(toTokenPair(access, refreshToken, refreshRemaining));
    }

    public void logout(UUID accountId, String accessToken) {
        Account account = lockAccount(accountId);
        sessionPolicy.remove(account.getSecurity(), accessToken);
        accountRepository.save(account);
        log.info("Account {} logged out", accountId);
    }

    public void logoutAll(UUID accountId) {
        Account account = lockAccount(accountId);
        sessionPolicy.clearAll(account.getSecurity());
        accountRepository.save(account);
        log.info("Account {} logged out from all devices", accountId);
    }

    @Transactional(readOnly = true)
    public AccountResponse loadProfile(UUID accountId) {
        return toResponse(loadAccount(accountId));
    }

    @Transactional(readOnly = true)
    public SessionStatusResponse sessionStatus(JwtAuthenticationPrincipal principal) {
        if (principal == null) {
            return new SessionStatusResponse(false, null);
        }
        return accountRepository.findByIdAndDeletedFalse(principal.accountId())
                .map(account -> new SessionStatusResponse(true, toResponse(account)))
                .orElseGet(() -> new SessionStatusResponse(false, null));
    }

    public void changePassword(UUID accountId, ChangePasswordRequest request) {
        Account account = lockAccount(accountId);
        if (!credentialManager.verify(request.currentPassword(), account.getPasswordHash())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "auth.current_password_incorrect",
                    "Current password is incorrect");
        }
        credentialManager.applyNewPassword(account, request.newPassword(), OffsetDateTime.now(clock));
        if (Boolean.TRUE.equals(request.logoutAllDevices())) {
            sessionPolicy.clearAll(account.getSecurity());
        }
        accountRepository.save(account);
        log.info("Account {} changed password", accountId);
    }

    public void verifyEmail(String rawToken) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Account account = accountRepository.findByPendingEmailVerification(oneTimeTokens.hash(rawToken), now)
                .orElseThrow(AuthService::invalidOneTimeToken);
        account.setVerificationStatus(VerificationStatus.VERIFIED);
        account.setStatus(AccountStatus.ACTIVE);
        account.setEmailVerificationTokenHash(null);
        account.setEmailVerificationExpiresAt(null);
        accountRepository.save(account);
        log.info("Account {} verified email", account.getId());
    }

    /**
     * 존재하지 않는 이메일이어도 같은 응답을 돌려준다.
     */
    public ForgotPasswordResponse forgotPassword(String email) {
        Optional<Account> candidate = accountRepository.findActiveByEmail(email.trim());
        if (candidate.isEmpty()) {
            return new ForgotPasswordResponse(ForgotPasswordResponse.GENERIC_MESSAGE, null);
        }
        Account account = candidate.get();
        OneTimeTokens.IssuedToken token = oneTimeTokens.issue();
        account.setPasswordResetTokenHash(token.hash());
        account.setPasswordResetExpiresAt(OffsetDateTime.now(clock).plus(passwordResetTtl));
        accountRepository.save(account);
        log.info("Password reset requested for account {}", account.getId());
        return new ForgotPasswordResponse(ForgotPasswordResponse.GENERIC_MESSAGE,
                exposeResetToken ? token.raw() : null);
    }

    public void resetPassword(String rawToken, String newPassword) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Account account = accountRepository.findByPendingPasswordReset(oneTimeTokens.hash(rawToken), now)
                .orElseThrow(AuthService::invalidOneTimeToken);
        credentialManager.applyNewPassword(account, newPassword, now);
        account.setPasswordResetTokenHash(null);
        account.setPasswordResetExpiresAt(null);
        sessionPolicy.clearAll(account.getSecurity());
        accountRepository.save(account);
        log.info("Account {} reset password", account.getId());
    }

    private Optional<Account> findLoginCandidate(LoginRequest request) {
        if (request.email() != null && !request.email().isBlank()) {
            return accountRepository.findActiveByEmailForUpdate(request.email().trim());
        }
        if (request.username() != null && !request.username().isBlank()) {
            return accountRepository.findActiveByUsernameForUpdate(request.username().trim());
        }
        return Optional.empty();
    }

    private Account lockAccount(UUID accountId) {
        return accountRepository.findActiveByIdForUpdate(accountId)
                .orElseThrow(AuthService::accountNotFound);
    }

    private Account loadAccount(UUID accountId) {
        return accountRepository.findByIdAndDeletedFalse(accountId)
                .orElseThrow(AuthService::accountNotFound);
    }

    private AccountResponse toResponse(Account account) {
        return AccountResponse.from(account, permissionResolver.effectiveCapabilities(account.getPermissions()));
    }

    private static TokenPairResponse toTokenPair(IssuedToken access, String refreshToken, long refreshExpiresIn) {
        return new TokenPairResponse(
                access.token(),
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                access.expiresInSeconds(),
                refreshToken,
                refreshExpiresIn,
                access.issuedAt()
        );
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials", "Invalid credentials");
    }

    private static ProblemException accountNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, "account.not_found", "User not found");
    }

    private static ProblemException invalidOneTimeToken() {
        return new ProblemException(HttpStatus.BAD_REQUEST, "auth.invalid_or_expired_token",
                "Invalid or expired token");
    }
}
