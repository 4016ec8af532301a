package com.facilityops.backend.modules.account.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.MapKeyEnumerated;
import jakarta.persistence.OrderColumn;

/**
 * 계정에 귀속된 권한 집합.
 * <p>
 * {@code grants}/{@code overrides}는 역할 기본값과 계정별 부여가 합쳐진 저장 상태이고,
 * {@code customGrants}/{@code customOverrides}는 관리자가 계정에 직접 부여한 값이다.
 * 역할 기본값을 다시 병합해도 직접 부여한 값은 그대로 위에 얹힌다.
 */
@Embeddable
public class PermissionSet {

    public static final String ALL_OVERRIDE = "all";

    @ElementCollection
    @CollectionTable(name = "account_permission", joinColumns = @JoinColumn(name = "account_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "capability", length = 64)
    @Column(name = "granted", nullable = false)
    private Map<Capability, Boolean> grants = new LinkedHashMap<>();

    @ElementCollection
    @CollectionTable(name = "account_permission_custom", joinColumns = @JoinColumn(name = "account_id"))
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "capability", length = 64)
    @Column(name = "granted", nullable = false)
    private Map<Capability, Boolean> customGrants = new LinkedHashMap<>();

    @ElementCollection
    @CollectionTable(name = "account_permission_override", joinColumns = @JoinColumn(name = "account_id"))
    @OrderColumn(name = "entry_order")
    @Column(name = "override_value", nullable = false, length = 64)
    private List<String> overrides = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "account_permission_custom_override", joinColumns = @JoinColumn(name = "account_id"))
    @OrderColumn(name = "entry_order")
    @Column(name = "override_value", nullable = false, length = 64)
    private List<String> customOverrides = new ArrayList<>();

    public PermissionSet() {
    }

    public static PermissionSet of(Map<Capability, Boolean> grants, List<String> overrides) {
        PermissionSet set = new PermissionSet();
        set.grants.putAll(grants);
        overrides.forEach(value -> appendDistinct(set.overrides, value));
        return set;
    }

    public Optional<Boolean> get(Capability capability) {
        return Optional.ofNullable(grants.get(capability));
    }

    public boolean isGranted(Capability capability) {
        return Boolean.TRUE.equals(grants.get(capability));
    }

    public boolean hasOverride(String value) {
        return value != null && overrides.contains(value);
    }

    /**
     * 계정에 권한 값을 직접 지정한다. 역할이 바뀌어도 유지된다.
     */
    public void grant(Capability capability, boolean granted) {
        customGrants.put(capability, granted);
        grants.put(capability, granted);
    }

    /**
     * 직접 지정한 값을 지운다. 저장 상태는 다음 병합 때 역할 기본값으로 돌아간다.
     */
    public void clearGrant(Capability capability) {
        customGrants.remove(capability);
    }

    public void addOverride(String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        String trimmed = value.trim();
        appendDistinct(customOverrides, trimmed);
        appendDistinct(overrides, trimmed);
    }

    public void removeOverride(String value) {
        customOverrides.remove(value);
        overrides.remove(value);
    }

    /**
     * 역할 기본값 위에 계정별 부여를 얹어 저장 상태를 다시 만든다.
     * 같은 기본값으로 여러 번 호출해도 결과는 같다.
     */
    public void rebase(PermissionSet defaults) {
        Map<Capability, Boolean> merged = new LinkedHashMap<>(defaults.grants);
        merged.putAll(customGrants);
        grants.clear();
        grants.putAll(merged);

        List<String> mergedOverrides = new ArrayList<>(customOverrides);
        defaults.overrides.forEach(value -> appendDistinct(mergedOverrides, value));
        overrides.clear();
        overrides.addAll(mergedOverrides);
    }

    public Map<Capability, Boolean> asMap() {
        Map<Capability, Boolean> view = new EnumMap<>(Capability.class);
        view.putAll(grants);
        return Collections.unmodifiableMap(view);
    }

    public Map<Capability, Boolean> getCustomGrants() {
        Map<Capability, Boolean> view = new EnumMap<>(Capability.class);
        view.putAll(customGrants);
        return Collections.unmodifiableMap(view);
    }

    public List<String> getOverrides() {
        return Collections.unmodifiableList(overrides);
    }

    public List<String> getCustomOverrides() {
        return Collections.unmodifiableList(customOverrides);
    }

    private static void appendDistinct(List<String> target, String value) {
        if (!target.contains(value)) {
            target.add(value);
        }
    }
}
