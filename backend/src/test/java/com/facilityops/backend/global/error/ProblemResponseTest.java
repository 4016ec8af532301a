package com.facilityops.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ProblemResponseTest {

    @Test
    @DisplayName("응답 type 은 코드에서 만들고 detail 이 없으면 코드를 쓴다")
    void buildsTypeFromCode() {
        ProblemException ex = new ProblemException(HttpStatus.CONFLICT, "account.email_taken", " ");

        ProblemResponse response = ProblemResponse.of(ex, "/users");

        assertThat(response.type()).isEqualTo("https://facilityops.app/errors/account.email_taken");
        assertThat(response.status()).isEqualTo(409);
        assertThat(response.title()).isEqualTo("Conflict");
        assertThat(response.detail()).isEqualTo("account.email_taken");
        assertThat(response.code()).isEqualTo("account.email_taken");
        assertThat(response.instance()).isEqualTo("/users");
    }

    @Test
    @DisplayName("재시도 가능한 오류는 Retry-After 초를 함께 가진다")
    void retryableCarriesRetryAfter() {
        RetryableProblemException ex = new RetryableProblemException(HttpStatus.FORBIDDEN, "auth.account_locked",
                "Account is locked. Try again in 30 minutes", 1800);

        assertThat(ex.getRetryAfterSeconds()).isEqualTo(1800);
        assertThat(ProblemResponse.of(ex, "/auth/login").detail()).isEqualTo("Account is locked. Try again in 30 minutes");
    }
}
