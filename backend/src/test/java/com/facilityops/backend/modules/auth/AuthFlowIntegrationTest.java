package com.facilityops.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.facilityops.backend.modules.auth.application.AuthService;
import com.facilityops.backend.modules.auth.application.ClientInfo;
import com.facilityops.backend.modules.auth.presentation.dto.LoginRequest;
import com.facilityops.backend.modules.auth.presentation.dto.LoginResponse;
import com.facilityops.backend.support.AbstractPostgresIntegrationTest;
import com.facilityops.backend.support.TestAccountFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class AuthFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "Str0ng@Pass";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private TestAccountFactory testAccountFactory;

    @Autowired
    private AuthService authService;

    @BeforeEach
    void setUp() {
        testAccountFactory.deleteAll();
    }

    @Test
    void loggedOutTokenIsRejectedEvenThoughSignatureIsValid() throws Exception {
        testAccountFactory.activeAccount("flow@example.com", PASSWORD, AccountRole.TECHNICIAN);
        String accessToken = login("flow@example.com", PASSWORD).path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(accessToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("flow@example.com"))
                .andExpect(jsonPath("$.role").value("technician"))
                .andExpect(jsonPath("$.passwordHash").doesNotExist())
                .andExpect(jsonPath("$.security.activeSessions").value(1));

        mockMvc.perform(post("/auth/logout").header(HttpHeaders.AUTHORIZATION, bearer(accessToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(accessToken)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.session_invalid"));
    }

    @Test
    void concurrentLoginsAllKeepTheirSessions() throws Exception {
        testAccountFactory.activeAccount("multi@example.com", PASSWORD, AccountRole.TECHNICIAN);
        int devices = 3;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(devices);
        List<Future<LoginResponse>> results = new ArrayList<>();
        try {
            for (int device = 0; device < devices; device++) {
                ClientInfo client = new ClientInfo("10.0.0." + device, "device-" + device);
                results.add(executor.submit(() -> {
                    start.await();
                    return authService.login(new LoginRequest("multi@example.com", null, PASSWORD, null), client);
                }));
            }
            start.countDown();

            List<String> accessTokens = new ArrayList<>();
            for (Future<LoginResponse> result : results) {
                accessTokens.add(result.get(30, TimeUnit.SECONDS).tokens().accessToken());
            }

            for (String accessToken : accessTokens) {
                mockMvc.perform(get("/auth/me").header(HttpHeaders.AUTHORIZATION, bearer(accessToken)))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.security.activeSessions").value(devices));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void fiveFailedLoginsLockTheAccount() throws Exception {
        Account account = testAccountFactory.activeAccount("locked@example.com", PASSWORD, AccountRole.USER);

        for (int attempt = 1; attempt <= 4; attempt++) {
            performLogin("locked@example.com", "Wr0ng@Pass")
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("auth.invalid_credentials"));
        }

        performLogin("locked@example.com", "Wr0ng@Pass")
                .andExpect(status().isForbidden())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "1800"))
                .andExpect(jsonPath("$.code").value("auth.account_locked"));

        performLogin("locked@example.com", PASSWORD)
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("auth.account_locked"));

        Account stored = accountRepository.findById(account.getId()).orElseThrow();
        assertThat(stored.getSecurity().getFailedLoginAttempts()).isEqualTo(5);
        assertThat(stored.getSecurity().getLockoutUntil()).isNotNull();
    }

    @Test
    void superAdminCreatesAccountThatLogsInAfterVerification() throws Exception {
        testAccountFactory.activeAccount("root@example.com", PASSWORD, AccountRole.SUPER_ADMIN);
        String adminToken = login("root@example.com", PASSWORD).path("tokens").path("accessToken").asText();

        MvcResult created = mockMvc.perform(post("/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "New.Tech@Example.com",
                                  "password": "%s",
                                  "firstName": "New",
                                  "lastName": "Tech",
                                  "role": "technician"
                                }
                                """.formatted(PASSWORD)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.account.email").value("new.tech@example.com"))
                .andExpect(jsonPath("$.account.status").value("pending"))
                .andExpect(jsonPath("$.account.permissions.effective[0]").value("canManageIOT"))
                .andReturn();
        String verificationToken = objectMapper.readTree(created.getResponse().getContentAsString())
                .path("verificationToken").asText();

        performLogin("new.tech@example.com", PASSWORD)
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("auth.account_not_active"));

        mockMvc.perform(get("/auth/verify-email/{token}", verificationToken))
                .andExpect(status().isNoContent());

        performLogin("new.tech@example.com", PASSWORD)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.verificationStatus").value("verified"));
    }

    @Test
    void technicianCannotCreateAccounts() throws Exception {
        testAccountFactory.activeAccount("tech@example.com", PASSWORD, AccountRole.TECHNICIAN);
        String token = login("tech@example.com", PASSWORD).path("tokens").path("accessToken").asText();

        mockMvc.perform(post("/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "other@example.com",
                                  "password": "%s",
                                  "firstName": "Other",
                                  "lastName": "Person"
                                }
                                """.formatted(PASSWORD)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("auth.insufficient_role"));
    }

    @Test
    void sessionProbeReportsAnonymousWithoutToken() throws Exception {
        mockMvc.perform(get("/auth/session"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(false))
                .andExpect(jsonPath("$.user").doesNotExist());
    }

    @Test
    void protectedRouteWithoutTokenIsUnauthenticated() throws Exception {
        mockMvc.perform(get("/users"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.unauthenticated"));
    }

    private JsonNode login(String email, String password) throws Exception {
        MvcResult result = performLogin(email, password)
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private ResultActions performLogin(String email, String password)
            throws Exception {
        return mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {
                          "email": "%s",
                          "password": "%s"
                        }
                        """.formatted(email, password)));
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}
