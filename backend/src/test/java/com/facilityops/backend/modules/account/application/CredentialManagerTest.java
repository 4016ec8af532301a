package com.facilityops.backend.modules.account.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.support.TestAccounts;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class CredentialManagerTest {

    private static final String PASSWORD = "Str0ng@Pass";
    // bcrypt: "$2a$04$" prefix, then salt and hash
    private static final int SALT_START = 7;

    private final CredentialManager credentialManager = new CredentialManager(new BCryptPasswordEncoder(4));

    @Test
    @DisplayName("해시한 비밀번호는 같은 평문으로만 검증된다")
    void hashThenVerify() {
        String digest = credentialManager.hash(PASSWORD);

        assertThat(digest).isNotEqualTo(PASSWORD);
        assertThat(credentialManager.verify(PASSWORD, digest)).isTrue();
        assertThat(credentialManager.verify("Str0ng@Pasx", digest)).isFalse();
    }

    @Test
    @DisplayName("같은 평문도 매번 다른 다이제스트가 된다")
    void saltsEveryHash() {
        assertThat(credentialManager.hash(PASSWORD)).isNotEqualTo(credentialManager.hash(PASSWORD));
    }

    @Test
    @DisplayName("솔트/해시 부분의 어떤 한 글자를 바꿔도 검증에 실패한다")
    void anySingleCharacterMutationFails() {
        String digest = credentialManager.hash(PASSWORD);

        for (int i = SALT_START; i < digest.length(); i++) {
            char original = digest.charAt(i);
            char replacement = original == 'a' ? 'b' : 'a';
            String mutated = digest.substring(0, i) + replacement + digest.substring(i + 1);

            assertThat(credentialManager.verify(PASSWORD, mutated))
                    .as("mutation at index %d", i)
                    .isFalse();
        }
    }

    @Test
    @DisplayName("비어 있거나 형식이 잘못된 다이제스트는 예외 없이 false")
    void malformedDigestIsRejected() {
        assertThat(credentialManager.verify(PASSWORD, null)).isFalse();
        assertThat(credentialManager.verify(PASSWORD, "")).isFalse();
        assertThat(credentialManager.verify(PASSWORD, "not-a-bcrypt-digest")).isFalse();
        assertThat(credentialManager.verify(null, credentialManager.hash(PASSWORD))).isFalse();
    }

    @Test
    @DisplayName("새 비밀번호 적용 시 변경 시각이 기록된다")
    void applyNewPasswordStampsChange() {
        Account account = TestAccounts.account(UUID.randomUUID(), AccountRole.USER);
        OffsetDateTime now = OffsetDateTime.parse("2025-01-01T00:00:00Z");

        credentialManager.applyNewPassword(account, PASSWORD, now);

        assertThat(credentialManager.verify(PASSWORD, account.getPasswordHash())).isTrue();
        assertThat(account.getSecurity().getLastPasswordChange()).isEqualTo(now);
    }
}
