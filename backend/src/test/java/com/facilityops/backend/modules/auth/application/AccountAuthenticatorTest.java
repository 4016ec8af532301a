package com.facilityops.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.facilityops.backend.global.error.ProblemException;
import com.facilityops.backend.global.error.RetryableProblemException;
import com.facilityops.backend.global.security.AuthFailure;
import com.facilityops.backend.global.security.JwtAuthenticationPrincipal;
import com.facilityops.backend.modules.account.application.PermissionResolver;
import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.account.domain.AccountStatus;
import com.facilityops.backend.modules.account.domain.Capability;
import com.facilityops.backend.modules.account.domain.SessionPolicy;
import com.facilityops.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.facilityops.backend.support.TestAccounts;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AccountAuthenticatorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private AccountRepository accountRepository;

    private final SessionPolicy sessionPolicy = SessionPolicy.defaults();
    private final JwtTokenService jwtTokenService = JwtTokenServiceTest.serviceAt(NOW);
    private AccountAuthenticator authenticator;

    private UUID accountId;
    private Account account;
    private String token;

    @BeforeEach
    void setUp() {
        authenticator = new AccountAuthenticator(jwtTokenService, accountRepository, sessionPolicy,
                new PermissionResolver(), Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        accountId = UUID.randomUUID();
        account = TestAccounts.account(accountId, AccountRole.TECHNICIAN);
        token = jwtTokenService.issueAccess(accountId, account.getEmail(), "technician", false).token();
    }

    @Test
    @DisplayName("유효한 토큰과 세션이면 권한이 포함된 신원을 만든다")
    void authenticatesActiveSession() {
        UUID facilityId = UUID.randomUUID();
        account.replaceManagedFacilities(Set.of(facilityId));
        sessionPolicy.add(account.getSecurity(), token, "junit", "127.0.0.1", NOW);
        when(accountRepository.findByIdAndDeletedFalse(accountId)).thenReturn(Optional.of(account));

        JwtAuthenticationPrincipal principal = authenticator.authenticate(token);

        assertThat(principal.accountId()).isEqualTo(accountId);
        assertThat(principal.role()).isEqualTo(AccountRole.TECHNICIAN);
        assertThat(principal.capabilities()).containsExactlyInAnyOrder(Capability.MANAGE_IOT, Capability.VIEW_REPORTS);
        assertThat(principal.managesFacility(facilityId)).isTrue();
    }

    @Test
    @DisplayName("로그아웃으로 세션에서 빠진 토큰은 서명이 유효해도 SessionInvalid")
    void loggedOutTokenIsRejected() {
        sessionPolicy.add(account.getSecurity(), token, null, null, NOW);
        sessionPolicy.remove(account.getSecurity(), token);
        when(accountRepository.findByIdAndDeletedFalse(accountId)).thenReturn(Optional.of(account));

        assertFailure(() -> authenticator.authenticate(token), AuthFailure.SESSION_INVALID);
    }

    @Test
    @DisplayName("계정이 없거나 삭제되었으면 AccountGone")
    void missingAccountIsGone() {
        when(accountRepository.findByIdAndDeletedFalse(accountId)).thenReturn(Optional.empty());

        assertFailure(() -> authenticator.authenticate(token), AuthFailure.ACCOUNT_GONE);
    }

    @Test
    @DisplayName("비활성 계정은 상태 코드와 함께 AccountNotActive")
    void inactiveAccountIsRejected() {
        account.setStatus(AccountStatus.SUSPENDED);
        when(accountRepository.findByIdAndDeletedFalse(accountId)).thenReturn(Optional.of(account));

        assertThatThrownBy(() -> authenticator.authenticate(token))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getCode()).isEqualTo("auth.account_not_active");
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(problem.getDetailMessage()).contains("suspended");
                });
    }

    @Test
    @DisplayName("잠긴 계정은 남은 분과 Retry-After를 담아 AccountLocked")
    void lockedAccountReportsRemainingMinutes() {
        account.getSecurity().setFailedLoginAttempts(5);
        account.getSecurity().setLockoutUntil(NOW.plusMinutes(9).plusSeconds(30));
        sessionPolicy.add(account.getSecurity(), token, null, null, NOW);
        when(accountRepository.findByIdAndDeletedFalse(accountId)).thenReturn(Optional.of(account));

        assertThatThrownBy(() -> authenticator.authenticate(token))
                .isInstanceOf(RetryableProblemException.class)
                .satisfies(ex -> {
                    RetryableProblemException problem = (RetryableProblemException) ex;
                    assertThat(problem.getCode()).isEqualTo("auth.account_locked");
                    assertThat(problem.getDetailMessage()).contains("10 minutes");
                    assertThat(problem.getRetryAfterSeconds()).isEqualTo(600);
                });
    }

    @Test
    @DisplayName("만료된 토큰은 계정을 조회하지 않고 TokenExpired")
    void expiredTokenShortCircuits() {
        String stale = JwtTokenServiceTest.serviceAt(NOW.minusHours(2))
                .issueAccess(accountId, account.getEmail(), "technician", false)
                .token();

        assertFailure(() -> authenticator.authenticate(stale), AuthFailure.TOKEN_EXPIRED);
        verifyNoInteractions(accountRepository);
    }

    @Test
    @DisplayName("위조된 토큰은 TokenInvalid")
    void invalidTokenIsRejected() {
        assertFailure(() -> authenticator.authenticate("garbage.token.value"), AuthFailure.TOKEN_INVALID);
        verifyNoInteractions(accountRepository);
    }

    @Test
    @DisplayName("저장소 오류는 InternalFailure로 닫힌다")
    void repositoryFailureFailsClosed() {
        when(accountRepository.findByIdAndDeletedFalse(accountId))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertFailure(() -> authenticator.authenticate(token), AuthFailure.INTERNAL_FAILURE);
    }

    @Test
    @DisplayName("선택적 인증은 세션 목록 없이도 활성 계정을 붙인다")
    void optionalAuthenticationSkipsSessionCheck() {
        when(accountRepository.findByIdAndDeletedFalse(accountId)).thenReturn(Optional.of(account));

        assertThat(authenticator.authenticateOptional(token))
                .get()
                .extracting(JwtAuthenticationPrincipal::accountId)
                .isEqualTo(accountId);
    }

    @Test
    @DisplayName("선택적 인증은 잠긴 계정, 잘못된 토큰, 저장소 오류 모두 신원 없음")
    void optionalAuthenticationNeverThrows() {
        account.getSecurity().setLockoutUntil(NOW.plusMinutes(5));
        when(accountRepository.findByIdAndDeletedFalse(accountId)).thenReturn(Optional.of(account));
        assertThat(authenticator.authenticateOptional(token)).isEmpty();

        assertThat(authenticator.authenticateOptional("garbage")).isEmpty();

        when(accountRepository.findByIdAndDeletedFalse(accountId))
                .thenThrow(new DataAccessResourceFailureException("db down"));
        assertThat(authenticator.authenticateOptional(token)).isEmpty();
    }

    @Test
    @DisplayName("Bearer 접두사가 있는 헤더에서만 토큰을 꺼낸다")
    void extractsBearerToken() {
        assertThat(AccountAuthenticator.extractBearerToken("Bearer abc.def")).contains("abc.def");
        assertThat(AccountAuthenticator.extractBearerToken("Bearer   ")).isEmpty();
        assertThat(AccountAuthenticator.extractBearerToken("Basic dXNlcjpwYXNz")).isEmpty();
        assertThat(AccountAuthenticator.extractBearerToken(null)).isEmpty();
    }

    private static void assertFailure(Runnable call, AuthFailure expected) {
        assertThatThrownBy(call::run)
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getCode()).isEqualTo(expected.getCode());
                    assertThat(problem.getStatusCode()).isEqualTo(expected.getStatus());
                });
    }
}
