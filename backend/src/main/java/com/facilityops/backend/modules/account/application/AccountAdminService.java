package com.facilityops.backend.modules.account.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.facilityops.backend.global.error.ProblemException;
import com.facilityops.backend.global.security.JwtAuthenticationPrincipal;
import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.account.domain.AccountStatus;
import com.facilityops.backend.modules.account.domain.Capability;
import com.facilityops.backend.modules.account.domain.PermissionSet;
import com.facilityops.backend.modules.account.domain.SessionPolicy;
import com.facilityops.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.facilityops.backend.modules.account.presentation.dto.AccountPageResponse;
import com.facilityops.backend.modules.account.presentation.dto.AccountResponse;
import com.facilityops.backend.modules.account.presentation.dto.CreateAccountRequest;
import com.facilityops.backend.modules.account.presentation.dto.CreateAccountResponse;
import com.facilityops.backend.modules.account.presentation.dto.UpdateAccountRequest;
import com.facilityops.backend.modules.account.presentation.dto.UpdatePermissionsRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 계정 관리(생성, 조회, 수정, 소프트 삭제, 상태/역할/비밀번호 변경, 관리 시설 지정).
 * 호출 권한 검사는 컨트롤러에서 끝난 상태로 들어온다.
 */
@Service
@Transactional
public class AccountAdminService {

    private static final Logger log = LoggerFactory.getLogger(AccountAdminService.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final AccountRepository accountRepository;
    private final CredentialManager credentialManager;
    private final PermissionResolver permissionResolver;
    private final SessionPolicy sessionPolicy;
    private final OneTimeTokens oneTimeTokens;
    private final Clock clock;
    private final Duration emailVerificationTtl;
    private final boolean exposeVerificationToken;

    public AccountAdminService(
            AccountRepository accountRepository,
            CredentialManager credentialManager,
            PermissionResolver permissionResolver,
            SessionPolicy sessionPolicy,
            OneTimeTokens oneTimeTokens,
            Clock clock,
            @Value("${auth.email-verification.ttl:PT24H}") Duration emailVerificationTtl,
            @Value("${auth.email-verification.expose-token:false}") boolean exposeVerificationToken
    ) {
        this.accountRepository = accountRepository;
        this.credentialManager = credentialManager;
        this.permissionResolver = permissionResolver;
        this.sessionPolicy = sessionPolicy;
        this.oneTimeTokens = oneTimeTokens;
        this.clock = clock;
        this.emailVerificationTtl = emailVerificationTtl;
        this.exposeVerificationToken = exposeVerificationToken;
    }

    public CreateAccountResponse create(JwtAuthenticationPrincipal actor, CreateAccountRequest request) {
        AccountRole role = request.role() == null ? AccountRole.USER : parseRole(request.role());
        if (role.isAdministrative()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "account.role_not_assignable",
                    "Cannot create admin or super admin users");
        }
        ensureEmailAvailable(request.email(), null);
        ensureUsernameAvailable(request.username(), null);

        OffsetDateTime now = OffsetDateTime.now(clock);
        Account account = new Account();
        account.setEmail(request.email());
        account.setUsername(request.username());
        account.setFirstName(request.firstName().trim());
        account.setLastName(request.lastName().trim());
        account.setPhone(request.phone());
        account.setRole(role);
        credentialManager.applyNewPassword(account, request.password(), now);
        account.replaceManagedFacilities(actor.managedFacilities());
        permissionResolver.recompute(account);

        OneTimeTokens.IssuedToken verification = oneTimeTokens.issue();
        account.setEmailVerificationTokenHash(verification.hash());
        account.setEmailVerificationExpiresAt(now.plus(emailVerificationTtl));

        Account saved = accountRepository.save(account);
        log.info("Account {} created by {} with role {}", saved.getId(), actor.accountId(), role.getCode());
        return new CreateAccountResponse(toResponse(saved), exposeVerificationToken ? verification.raw() : null);
    }

    @Transactional(readOnly = true)
    public AccountPageResponse list(String role, String status, String search, int page, int size) {
        AccountRole roleFilter = role == null || role.isBlank() ? null : parseRole(role);
        AccountStatus statusFilter = status == null || status.isBlank() ? null : parseStatus(status);
        String searchPattern = search == null || search.isBlank()
                ? null
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        int safePage = Math.max(page, 1) - 1;
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);

        Page<Account> result = accountRepository.findByFilters(roleFilter, statusFilter, searchPattern,
                PageRequest.of(safePage, safeSize, Sort.by(Sort.Direction.DESC, "createdAt")));
        List<AccountResponse> items = result.getContent().stream().map(this::toResponse).toList();
        return new AccountPageResponse(items, safePage + 1, safeSize, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public AccountResponse get(UUID accountId) {
        return toResponse(loadAccount(accountId));
    }

    public AccountResponse update(UUID accountId, UpdateAccountRequest request) {
        Account account = loadAccount(accountId);
        if (request.email() != null) {
            ensureEmailAvailable(request.email(), accountId);
            account.setEmail(request.email());
        }
        if (request.username() != null) {
            ensureUsernameAvailable(request.username(), accountId);
            account.setUsername(request.username());
        }
        if (request.firstName() != null) {
            account.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            account.setLastName(request.lastName().trim());
        }
        if (request.phone() != null) {
            account.setPhone(request.phone());
        }
        log.info("Account {} profile updated", accountId);
        return toResponse(accountRepository.save(account));
    }

    public void delete(JwtAuthenticationPrincipal actor, UUID accountId) {
        Account account = lockAccount(accountId);
        if (account.getRole() == AccountRole.SUPER_ADMIN) {
            throw superAdminProtected("Cannot delete super admin user");
        }
        account.markDeleted(actor.accountId(), OffsetDateTime.now(clock));
        sessionPolicy.clearAll(account.getSecurity());
        accountRepository.save(account);
        log.info("Account {} deleted by {}", accountId, actor.accountId());
    }

    public AccountResponse restore(UUID accountId) {
        Account account = accountRepository.findByIdAndDeletedTrue(accountId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "account.not_found",
                        "Deleted user not found"));
        ensureEmailAvailable(account.getEmail(), accountId);
        if (account.getUsername() != null) {
            ensureUsernameAvailable(account.getUsername(), accountId);
        }
        account.restore();
        log.info("Account {} restored", accountId);
        return toResponse(accountRepository.save(account));
    }

    public AccountResponse updateStatus(JwtAuthenticationPrincipal actor, UUID accountId, String status) {
        AccountStatus newStatus = parseStatus(status);
        Account account = lockAccount(accountId);
        guardSuperAdminTarget(actor, account, "Cannot change status of super admin user");
        account.setStatus(newStatus);
        if (!newStatus.isActive()) {
            sessionPolicy.clearAll(account.getSecurity());
        }
        log.info("Account {} status changed to {}", accountId, newStatus.getCode());
        return toResponse(accountRepository.save(account));
    }

    public AccountResponse updateRole(JwtAuthenticationPrincipal actor, UUID accountId, String role) {
        AccountRole newRole = parseRole(role);
        Account account = loadAccount(accountId);
        guardSuperAdminTarget(actor, account, "Cannot change role of super admin user");
        if (newRole.isAdministrative() && !actor.isSuperAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "account.role_not_assignable",
                    "Only a super admin can assign admin roles");
        }
        if (permissionResolver.changeRole(account, newRole)) {
            log.info("Account {} role changed to {}", accountId, newRole.getCode());
        }
        return toResponse(accountRepository.save(account));
    }

    public void setPassword(JwtAuthenticationPrincipal actor, UUID accountId, String password) {
        Account account = lockAccount(accountId);
        guardSuperAdminTarget(actor, account, "Cannot change password of super admin user");
        credentialManager.applyNewPassword(account, password, OffsetDateTime.now(clock));
        sessionPolicy.clearAll(account.getSecurity());
        accountRepository.save(account);
        log.info("Account {} password set by {}", accountId, actor.accountId());
    }

    public AccountResponse replaceManagedFacilities(UUID accountId, Set<UUID> facilityIds) {
        Account account = loadAccount(accountId);
        account.replaceManagedFacilities(facilityIds);
        log.info("Account {} now manages {} facilities", accountId, facilityIds.size());
        return toResponse(accountRepository.save(account));
    }

    public AccountResponse updatePermissions(UUID accountId, UpdatePermissionsRequest request) {
        Account account = lockAccount(accountId);
        PermissionSet permissions = account.getPermissions();
        if (request.grants() != null) {
            for (Map.Entry<String, Boolean> entry : request.grants().entrySet()) {
                Capability capability = Capability.fromKey(entry.getKey())
                        .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "account.invalid_capability",
                                "Unknown capability " + entry.getKey()));
                if (entry.getValue() == null) {
                    permissions.clearGrant(capability);
                } else {
                    permissions.grant(capability, entry.getValue());
                }
            }
        }
        if (request.removeOverrides() != null) {
            request.removeOverrides().forEach(permissions::removeOverride);
        }
        if (request.addOverrides() != null) {
            request.addOverrides().forEach(permissions::addOverride);
        }
        permissionResolver.recompute(account);
        log.info("Account {} permissions adjusted", accountId);
        return toResponse(accountRepository.save(account));
    }

    @Transactional(readOnly = true)
    public List<AccountResponse> listByRole(String role) {
        return accountRepository.findActiveByRole(parseRole(role)).stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public List<AccountResponse> listByManagedFacility(UUID facilityId) {
        return accountRepository.findActiveByManagedFacility(facilityId).stream().map(this::toResponse).toList();
    }

    private Account lockAccount(UUID accountId) {
        return accountRepository.findActiveByIdForUpdate(accountId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "account.not_found", "User not found"));
    }

    private Account loadAccount(UUID accountId) {
        return accountRepository.findByIdAndDeletedFalse(accountId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "account.not_found", "User not found"));
    }

    private void ensureEmailAvailable(String email, UUID excludeId) {
        if (accountRepository.existsActiveEmail(email.trim(), excludeId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "account.email_taken", "Email already in use");
        }
    }

    private void ensureUsernameAvailable(String username, UUID excludeId) {
        if (username == null || username.isBlank()) {
            return;
        }
        if (accountRepository.existsActiveUsername(username.trim(), excludeId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "account.username_taken", "Username already in use");
        }
    }

    private static void guardSuperAdminTarget(JwtAuthenticationPrincipal actor, Account target, String detail) {
        if (target.getRole() == AccountRole.SUPER_ADMIN && !actor.isSuperAdmin()) {
            throw superAdminProtected(detail);
        }
    }

    private static ProblemException superAdminProtected(String detail) {
        return new ProblemException(HttpStatus.FORBIDDEN, "account.super_admin_protected", detail);
    }

    private static AccountRole parseRole(String value) {
        return AccountRole.fromCode(value)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "account.invalid_role",
                        "Invalid role value"));
    }

    private static AccountStatus parseStatus(String value) {
        return AccountStatus.fromCode(value)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "account.invalid_status",
                        "Invalid status value"));
    }

    private AccountResponse toResponse(Account account) {
        return AccountResponse.from(account, permissionResolver.effectiveCapabilities(account.getPermissions()));
    }
}
