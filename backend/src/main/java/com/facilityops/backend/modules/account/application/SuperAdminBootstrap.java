package com.facilityops.backend.modules.account.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;

import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.account.domain.AccountStatus;
import com.facilityops.backend.modules.account.domain.VerificationStatus;
import com.facilityops.backend.modules.account.infrastructure.persistence.AccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * 설정된 경우 최초 기동 시 super_admin 계정을 한 번 만든다. 이미 있으면 아무것도 하지 않는다.
 */
@Component
public class SuperAdminBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SuperAdminBootstrap.class);

    private final AccountRepository accountRepository;
    private final CredentialManager credentialManager;
    private final PermissionResolver permissionResolver;
    private final Clock clock;
    private final String email;
    private final String password;
    private final String firstName;
    private final String lastName;

    public SuperAdminBootstrap(
            AccountRepository accountRepository,
            CredentialManager credentialManager,
            PermissionResolver permissionResolver,
            Clock clock,
            @Value("${app.bootstrap.super-admin.email:}") String email,
            @Value("${app.bootstrap.super-admin.password:}") String password,
            @Value("${app.bootstrap.super-admin.first-name:Super}") String firstName,
            @Value("${app.bootstrap.super-admin.last-name:Admin}") String lastName
    ) {
        this.accountRepository = accountRepository;
        this.credentialManager = credentialManager;
        this.permissionResolver = permissionResolver;
        this.clock = clock;
        this.email = email;
        this.password = password;
        this.firstName = firstName;
        this.lastName = lastName;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(email) || !StringUtils.hasText(password)) {
            return;
        }
        if (accountRepository.existsByRoleAndDeletedFalse(AccountRole.SUPER_ADMIN)) {
            log.info("Super admin already present; bootstrap skipped");
            return;
        }
        if (accountRepository.existsActiveEmail(email.trim().toLowerCase(Locale.ROOT), null)) {
            log.warn("Super admin bootstrap skipped: email {} belongs to another account", email);
            return;
        }

        Account account = new Account();
        account.setEmail(email);
        account.setFirstName(firstName);
        account.setLastName(lastName);
        account.setRole(AccountRole.SUPER_ADMIN);
        account.setStatus(AccountStatus.ACTIVE);
        account.setVerificationStatus(VerificationStatus.VERIFIED);
        credentialManager.applyNewPassword(account, password, OffsetDateTime.now(clock));
        permissionResolver.recompute(account);

        Account saved = accountRepository.save(account);
        log.info("Super admin {} created", saved.getId());
    }
}
