package com.facilityops.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 부분 수정. null 필드는 변경하지 않는다.
 */
public record UpdateAccountRequest(
        @Email @Size(max = 320) String email,
        @Size(min = 3, max = 30) @Pattern(regexp = "^[A-Za-z0-9_.-]+$") String username,
        @Size(max = 50) @Pattern(regexp = "(?s).*\\S.*", message = "firstName must not be blank") String firstName,
        @Size(max = 50) @Pattern(regexp = "(?s).*\\S.*", message = "lastName must not be blank") String lastName,
        @Size(max = 32) String phone
) {
}
