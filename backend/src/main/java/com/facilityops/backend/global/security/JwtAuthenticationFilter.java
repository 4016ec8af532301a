package com.facilityops.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.facilityops.backend.global.error.ProblemException;
import com.facilityops.backend.global.error.ProblemResponseWriter;
import com.facilityops.backend.modules.auth.application.AccountAuthenticator;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 보호 경로에서 베어러 토큰을 검증하고 계정 신원을 부착한다.
 * 실패는 MVC 디스패치 이전이므로 문제 응답을 직접 기록하고 체인을 중단한다.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String ACCOUNT_MDC_KEY = "accountId";

    static final List<String> PUBLIC_PATTERNS = List.of(
            "/auth/login",
            "/auth/refresh",
            "/auth/forgot-password",
            "/auth/reset-password/**",
            "/auth/verify-email/**",
            "/health",
            "/actuator/health",
            "/actuator/health/**"
    );
    static final List<String> OPTIONAL_AUTH_PATTERNS = List.of("/auth/session");

    private static final AntPathMatcher PATH_MATCHER = new AntPathMatcher();

    private final AccountAuthenticator accountAuthenticator;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(AccountAuthenticator accountAuthenticator,
                                   ProblemResponseWriter problemResponseWriter) {
        this.accountAuthenticator = accountAuthenticator;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (matchesAny(OPTIONAL_AUTH_PATTERNS, resolvePath(request))) {
            attachOptional(request, authorization);
            proceed(request, response, filterChain);
            return;
        }

        try {
            String token = AccountAuthenticator.extractBearerToken(authorization)
                    .orElseThrow(AuthFailure.UNAUTHENTICATED::exception);
            attach(request, accountAuthenticator.authenticate(token), token);
        } catch (ProblemException ex) {
            SecurityContextHolder.clearContext();
            problemResponseWriter.write(request, response, ex);
            return;
        } catch (RuntimeException ex) {
            log.error("Authentication chain failed for {}", request.getRequestURI(), ex);
            SecurityContextHolder.clearContext();
            problemResponseWriter.write(request, response, AuthFailure.INTERNAL_FAILURE.exception());
            return;
        }

        proceed(request, response, filterChain);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return matchesAny(PUBLIC_PATTERNS, resolvePath(request));
    }

    private void attachOptional(HttpServletRequest request, String authorization) {
        Optional<String> token = AccountAuthenticator.extractBearerToken(authorization);
        if (token.isEmpty()) {
            return;
        }
        try {
            accountAuthenticator.authenticateOptional(token.get())
                    .ifPresent(principal -> attach(request, principal, token.get()));
        } catch (RuntimeException ex) {
            log.warn("Optional authentication skipped for {}: {}", request.getRequestURI(), ex.toString());
        }
    }

    private void attach(HttpServletRequest request, JwtAuthenticationPrincipal principal, String token) {
        List<SimpleGrantedAuthority> authorities = List.of(
                new SimpleGrantedAuthority("ROLE_" + principal.role().name()));
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, token, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        MDC.put(ACCOUNT_MDC_KEY, principal.accountId().toString());
    }

    private void proceed(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(ACCOUNT_MDC_KEY);
        }
    }

    private static boolean matchesAny(List<String> patterns, String path) {
        return patterns.stream().anyMatch(pattern -> PATH_MATCHER.match(pattern, path));
    }

    private static String resolvePath(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
