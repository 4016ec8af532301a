package com.facilityops.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.facilityops.backend.global.error.ProblemException;
import com.facilityops.backend.global.security.AuthFailure;
import com.facilityops.backend.global.security.JwtAuthenticationPrincipal;
import com.facilityops.backend.modules.account.application.PermissionResolver;
import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.LockoutPolicy;
import com.facilityops.backend.modules.account.domain.SessionPolicy;
import com.facilityops.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.facilityops.backend.modules.auth.application.JwtTokenService.MalformedTokenException;
import com.facilityops.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.facilityops.backend.modules.auth.application.JwtTokenService.TokenExpiredException;
import com.facilityops.backend.modules.auth.domain.TokenKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 요청 게이트 체인의 인증 단계.
 * 토큰 검증, 계정 로드, 상태/잠금/세션 검사를 순서대로 수행하고 첫 실패에서 멈춘다.
 */
@Service
@Transactional(readOnly = true)
public class AccountAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(AccountAuthenticator.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final AccountRepository accountRepository;
    private final SessionPolicy sessionPolicy;
    private final PermissionResolver permissionResolver;
    private final Clock clock;

    public AccountAuthenticator(
            JwtTokenService jwtTokenService,
            AccountRepository accountRepository,
            SessionPolicy sessionPolicy,
            PermissionResolver permissionResolver,
            Clock clock
    ) {
        this.jwtTokenService = jwtTokenService;
        this.accountRepository = accountRepository;
        this.sessionPolicy = sessionPolicy;
        this.permissionResolver = permissionResolver;
        this.clock = clock;
    }

    public static Optional<String> extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    public JwtAuthenticationPrincipal authenticate(String token) {
        try {
            ParsedToken parsed = verify(token);
            Account account = accountRepository.findByIdAndDeletedFalse(parsed.accountId())
                    .orElseThrow(AuthFailure.ACCOUNT_GONE::exception);

            if (!account.getStatus().isActive()) {
                throw AuthFailure.notActive(account.getStatus().getCode());
            }

            OffsetDateTime now = OffsetDateTime.now(clock);
            if (LockoutPolicy.isLocked(account.getSecurity(), now)) {
                throw AuthFailure.locked(LockoutPolicy.remainingMinutes(account.getSecurity(), now));
            }

            if (!sessionPolicy.contains(account.getSecurity(), token)) {
                throw AuthFailure.SESSION_INVALID.exception();
            }
            return toPrincipal(account);
        } catch (ProblemException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Unexpected failure while authenticating request", ex);
            throw AuthFailure.INTERNAL_FAILURE.exception();
        }
    }

    /**
     * 선택적 인증. 어떤 실패든 "신원 없음"으로 처리하며 세션 목록은 확인하지 않는다.
     */
    public Optional<JwtAuthenticationPrincipal> authenticateOptional(String token) {
        try {
            ParsedToken parsed = jwtTokenService.verify(token, TokenKind.ACCESS);
            OffsetDateTime now = OffsetDateTime.now(clock);
            return accountRepository.findByIdAndDeletedFalse(parsed.accountId())
                    .filter(account -> account.getStatus().isActive())
                    .filter(account -> !LockoutPolicy.isLocked(account.getSecurity(), now))
                    .map(this::toPrincipal);
        } catch (JwtTokenService.InvalidTokenException ex) {
            log.debug("Optional authentication ignored invalid token: {}", ex.getMessage());
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("Optional authentication failed", ex);
            return Optional.empty();
        }
    }

    private ParsedToken verify(String token) {
        try {
            return jwtTokenService.verify(token, TokenKind.ACCESS);
        } catch (TokenExpiredException ex) {
            throw AuthFailure.TOKEN_EXPIRED.exception();
        } catch (MalformedTokenException ex) {
            log.debug("Rejected access token: {}", ex.getMessage());
            throw AuthFailure.TOKEN_INVALID.exception();
        }
    }

    private JwtAuthenticationPrincipal toPrincipal(Account account) {
        return new JwtAuthenticationPrincipal(
                account.getId(),
                account.getEmail(),
                account.getRole(),
                permissionResolver.effectiveCapabilities(account.getPermissions()),
                account.getPermissions().getOverrides(),
                account.getManagedFacilities()
        );
    }
}
