package com.facilityops.backend.modules.auth.application;

/**
 * 세션 항목에 기록하는 클라이언트 정보.
 */
public record ClientInfo(String ip, String device) {

    private static final int IP_MAX_LENGTH = 64;
    private static final int DEVICE_MAX_LENGTH = 255;

    public ClientInfo {
        ip = truncate(ip, IP_MAX_LENGTH);
        device = truncate(device, DEVICE_MAX_LENGTH);
    }

    public static ClientInfo unknown() {
        return new ClientInfo(null, null);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
