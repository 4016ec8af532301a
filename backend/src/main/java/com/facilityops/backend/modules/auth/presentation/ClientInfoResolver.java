package com.facilityops.backend.modules.auth.presentation;

import com.facilityops.backend.modules.auth.application.ClientInfo;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;

/**
 * 프록시 헤더는 server.forward-headers-strategy 로 컨테이너가 반영하므로 원격 주소만 읽는다.
 */
final class ClientInfoResolver {

    private ClientInfoResolver() {
    }

    static ClientInfo resolve(HttpServletRequest request) {
        return new ClientInfo(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
    }
}
