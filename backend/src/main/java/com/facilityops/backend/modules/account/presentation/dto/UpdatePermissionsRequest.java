package com.facilityops.backend.modules.account.presentation.dto;

import java.util.List;
import java.util.Map;

/**
 * 계정별 권한 조정. grants 값이 null이면 해당 능력의 직접 부여를 해제한다.
 */
public record UpdatePermissionsRequest(
        Map<String, Boolean> grants,
        List<String> addOverrides,
        List<String> removeOverrides
) {
}
