package com.foodsync.common.security;

import com.foodsync.common.exception.ErrorCode;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * API 토큰 필터 - {@code /api/*} 경로의 Bearer 토큰 검사.
 *
 * <p>푸시 웹훅은 이 필터 밖에 있다. 웹훅은 수집 게이트웨이 안에서
 * 플랫폼 마스터 키로 인증한다.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ApiTokenFilter implements Filter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String UNAUTHORIZED_BODY =
            "{\"success\":false,\"message\":\"" + ErrorCode.UNAUTHORIZED.getMessage() + "\"}";

    private final String apiToken;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String token = resolveToken(httpRequest);

        if (token == null || !matches(token)) {
            log.warn("Rejected API request without valid token: {} {}",
                    httpRequest.getMethod(), httpRequest.getRequestURI());
            HttpServletResponse httpResponse = (HttpServletResponse) response;
            httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
            httpResponse.getWriter().write(UNAUTHORIZED_BODY);
            return;
        }

        chain.doFilter(request, response);
    }

    private boolean matches(String token) {
        if (apiToken == null || apiToken.isEmpty()) {
            return false;
        }
        // 상수 시간 비교
        return MessageDigest.isEqual(
                token.getBytes(StandardCharsets.UTF_8),
                apiToken.getBytes(StandardCharsets.UTF_8));
    }

    private String resolveToken(HttpServletRequest request) {
        String bearer = request.getHeader("Authorization");
        if (bearer != null && bearer.startsWith(BEARER_PREFIX)) {
            return bearer.substring(BEARER_PREFIX.length());
        }
        return null;
    }
}
