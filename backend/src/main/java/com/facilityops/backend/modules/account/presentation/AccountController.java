package com.facilityops.backend.modules.account.presentation;

import java.util.List;
import java.util.UUID;

import com.facilityops.backend.global.security.AccessGuard;
import com.facilityops.backend.global.security.JwtAuthenticationPrincipal;
import com.facilityops.backend.modules.account.application.AccountAdminService;
import com.facilityops.backend.modules.account.presentation.dto.AccountPageResponse;
import com.facilityops.backend.modules.account.presentation.dto.AccountResponse;
import com.facilityops.backend.modules.account.presentation.dto.CreateAccountRequest;
import com.facilityops.backend.modules.account.presentation.dto.CreateAccountResponse;
import com.facilityops.backend.modules.account.presentation.dto.ManagedFacilitiesRequest;
import com.facilityops.backend.modules.account.presentation.dto.SetPasswordRequest;
import com.facilityops.backend.modules.account.presentation.dto.UpdateAccountRequest;
import com.facilityops.backend.modules.account.presentation.dto.UpdatePermissionsRequest;
import com.facilityops.backend.modules.account.presentation.dto.UpdateRoleRequest;
import com.facilityops.backend.modules.account.presentation.dto.UpdateStatusRequest;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class AccountController {

    private final AccountAdminService accountAdminService;
    private final AccessGuard accessGuard;

    public AccountController(AccountAdminService accountAdminService, AccessGuard accessGuard) {
        this.accountAdminService = accountAdminService;
        this.accessGuard = accessGuard;
    }

    @PostMapping
    public ResponseEntity<CreateAccountResponse> create(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateAccountRequest request
    ) {
        accessGuard.requireManager(principal);
        return ResponseEntity.status(HttpStatus.CREATED).body(accountAdminService.create(principal, request));
    }

    @GetMapping
    public ResponseEntity<AccountPageResponse> list(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "role", required = false) String role,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "size", defaultValue = "10") int size
    ) {
        accessGuard.requireManager(principal);
        return ResponseEntity.ok(accountAdminService.list(role, status, search, page, size));
    }

    @GetMapping("/role/{role}")
    public ResponseEntity<List<AccountResponse>> listByRole(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable String role
    ) {
        accessGuard.requireManager(principal);
        return ResponseEntity.ok(accountAdminService.listByRole(role));
    }

    @GetMapping("/facility/{facilityId}")
    public ResponseEntity<List<AccountResponse>> listByFacility(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID facilityId
    ) {
        accessGuard.requireFacilityAccess(principal, facilityId);
        return ResponseEntity.ok(accountAdminService.listByManagedFacility(facilityId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountResponse> get(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID id
    ) {
        accessGuard.requireOwnershipOrAdmin(principal, id);
        return ResponseEntity.ok(accountAdminService.get(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<AccountResponse> update(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID id,
            @Valid @RequestBody UpdateAccountRequest request
    ) {
        accessGuard.requireOwnershipOrAdmin(principal, id);
        return ResponseEntity.ok(accountAdminService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID id
    ) {
        accessGuard.requireSupervisor(principal);
        accountAdminService.delete(principal, id);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}/restore")
    public ResponseEntity<AccountResponse> restore(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID id
    ) {
        accessGuard.requireSupervisor(principal);
        return ResponseEntity.ok(accountAdminService.restore(id));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<AccountResponse> updateStatus(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID id,
            @Valid @RequestBody UpdateStatusRequest request
    ) {
        accessGuard.requireSupervisor(principal);
        return ResponseEntity.ok(accountAdminService.updateStatus(principal, id, request.status()));
    }

    @PatchMapping("/{id}/role")
    public ResponseEntity<AccountResponse> updateRole(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID id,
            @Valid @RequestBody UpdateRoleRequest request
    ) {
        accessGuard.requireSupervisor(principal);
        return ResponseEntity.ok(accountAdminService.updateRole(principal, id, request.role()));
    }

    @PatchMapping("/{id}/password")
    public ResponseEntity<Void> setPassword(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID id,
            @Valid @RequestBody SetPasswordRequest request
    ) {
        accessGuard.requireSupervisor(principal);
        accountAdminService.setPassword(principal, id, request.password());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/facilities")
    public ResponseEntity<AccountResponse> replaceFacilities(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID id,
            @Valid @RequestBody ManagedFacilitiesRequest request
    ) {
        accessGuard.requireAdmin(principal);
        return ResponseEntity.ok(accountAdminService.replaceManagedFacilities(id, request.facilityIds()));
    }

    @PatchMapping("/{id}/permissions")
    public ResponseEntity<AccountResponse> updatePermissions(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID id,
            @RequestBody UpdatePermissionsRequest request
    ) {
        accessGuard.requireAdmin(principal);
        return ResponseEntity.ok(accountAdminService.updatePermissions(id, request));
    }
}
