package com.facilityops.backend.modules.account.application;

import java.util.EnumSet;
import java.util.Set;

import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.account.domain.Capability;
import com.facilityops.backend.modules.account.domain.PermissionSet;
import com.facilityops.backend.modules.account.domain.RolePermissionMatrix;

import org.springframework.stereotype.Component;

@Component
public class PermissionResolver {

    public PermissionSet defaultsFor(AccountRole role) {
        return RolePermissionMatrix.defaultsFor(role);
    }

    public boolean effective(PermissionSet permissions, Capability capability) {
        return permissions.isGranted(capability)
                || permissions.hasOverride(PermissionSet.ALL_OVERRIDE)
                || permissions.hasOverride(capability.getKey());
    }

    public boolean effective(Account account, Capability capability) {
        return effective(account.getPermissions(), capability);
    }

    public Set<Capability> effectiveCapabilities(PermissionSet permissions) {
        Set<Capability> granted = EnumSet.noneOf(Capability.class);
        for (Capability capability : Capability.values()) {
            if (effective(permissions, capability)) {
                granted.add(capability);
            }
        }
        return granted;
    }

    /**
     * 현재 역할의 기본값으로 저장 권한을 다시 만든다. 계정에 직접 부여된 값은 유지된다.
     */
    public void recompute(Account account) {
        account.getPermissions().rebase(defaultsFor(account.getRole()));
    }

    /**
     * 역할이 실제로 바뀐 경우에만 역할을 교체하고 권한을 다시 계산한다.
     *
     * @return 역할이 변경되었으면 {@code true}
     */
    public boolean changeRole(Account account, AccountRole newRole) {
        if (account.getRole() == newRole) {
            return false;
        }
        account.setRole(newRole);
        recompute(account);
        return true;
    }
}
