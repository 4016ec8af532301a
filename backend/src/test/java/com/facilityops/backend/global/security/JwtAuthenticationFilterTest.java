package com.facilityops.backend.global.security;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Optional;
import java.util.UUID;

import com.facilityops.backend.global.error.ProblemResponseWriter;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.auth.application.AccountAuthenticator;
import com.facilityops.backend.support.TestAccounts;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    private static final String TOKEN = "header.payload.signature";

    @Mock
    private AccountAuthenticator accountAuthenticator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        JwtAuthenticationFilter filter =
                new JwtAuthenticationFilter(accountAuthenticator, new ProblemResponseWriter(new ObjectMapper()));
        mockMvc = MockMvcBuilders.standaloneSetup(new ProbeController())
                .addFilters(filter)
                .build();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Authorization 헤더가 없으면 401 Unauthenticated")
    void missingHeaderIsUnauthenticated() throws Exception {
        mockMvc.perform(get("/probe"))
                .andExpect(status().isUnauthorized())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(jsonPath("$.code").value("auth.unauthenticated"))
                .andExpect(jsonPath("$.instance").value("/probe"));
        verifyNoInteractions(accountAuthenticator);
    }

    @Test
    @DisplayName("유효한 토큰이면 신원이 부착되어 핸들러까지 도달한다")
    void validTokenReachesHandler() throws Exception {
        UUID accountId = UUID.randomUUID();
        when(accountAuthenticator.authenticate(TOKEN))
                .thenReturn(TestAccounts.principal(accountId, AccountRole.TECHNICIAN));

        mockMvc.perform(get("/probe").header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN))
                .andExpect(status().isOk())
                .andExpect(content().string(accountId.toString()));
    }

    @Test
    @DisplayName("세션에서 빠진 토큰은 401 SessionInvalid")
    void revokedSessionIsRejected() throws Exception {
        when(accountAuthenticator.authenticate(TOKEN)).thenThrow(AuthFailure.SESSION_INVALID.exception());

        mockMvc.perform(get("/probe").header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.session_invalid"));
    }

    @Test
    @DisplayName("잠긴 계정은 403과 Retry-After 헤더")
    void lockedAccountCarriesRetryAfter() throws Exception {
        when(accountAuthenticator.authenticate(TOKEN)).thenThrow(AuthFailure.locked(12));

        mockMvc.perform(get("/probe").header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN))
                .andExpect(status().isForbidden())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "720"))
                .andExpect(jsonPath("$.code").value("auth.account_locked"))
                .andExpect(jsonPath("$.detail").value("Account is locked. Try again in 12 minutes"));
    }

    @Test
    @DisplayName("예상하지 못한 오류는 원인을 노출하지 않고 500 InternalFailure")
    void unexpectedFailureFailsClosed() throws Exception {
        when(accountAuthenticator.authenticate(TOKEN)).thenThrow(new IllegalStateException("connection refused"));

        mockMvc.perform(get("/probe").header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("auth.internal_failure"))
                .andExpect(jsonPath("$.detail").value("Authentication failed"));
    }

    @Test
    @DisplayName("공개 경로는 토큰 검사를 건너뛴다")
    void publicPathSkipsAuthentication() throws Exception {
        mockMvc.perform(post("/auth/login").header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN))
                .andExpect(status().isOk())
                .andExpect(content().string("anonymous"));
        verifyNoInteractions(accountAuthenticator);
    }

    @Test
    @DisplayName("선택적 인증 경로는 토큰이 없거나 무효여도 통과한다")
    void optionalPathNeverRejects() throws Exception {
        mockMvc.perform(get("/auth/session"))
                .andExpect(status().isOk())
                .andExpect(content().string("anonymous"));

        when(accountAuthenticator.authenticateOptional(anyString())).thenReturn(Optional.empty());
        mockMvc.perform(get("/auth/session").header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN))
                .andExpect(status().isOk())
                .andExpect(content().string("anonymous"));
        verify(accountAuthenticator, never()).authenticate(anyString());
    }

    @Test
    @DisplayName("선택적 인증 경로에서 유효한 토큰이면 신원이 붙는다")
    void optionalPathAttachesIdentity() throws Exception {
        UUID accountId = UUID.randomUUID();
        when(accountAuthenticator.authenticateOptional(TOKEN))
                .thenReturn(Optional.of(TestAccounts.principal(accountId, AccountRole.USER)));

        mockMvc.perform(get("/auth/session").header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN))
                .andExpect(status().isOk())
                .andExpect(content().string(accountId.toString()));
    }

    @RestController
    static class ProbeController {

        @GetMapping({"/probe", "/auth/session"})
        String whoAmI() {
            return describe();
        }

        @PostMapping("/auth/login")
        String login() {
            return describe();
        }

        private static String describe() {
            return SecurityUtils.findCurrentPrincipal()
                    .map(principal -> principal.accountId().toString())
                    .orElse("anonymous");
        }
    }
}
