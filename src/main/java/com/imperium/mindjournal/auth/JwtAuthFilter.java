package com.imperium.mindjournal.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.mindjournal.config.RequestIdSupport;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * /api/** 下除登录接口外都要求 Bearer Token。
 * 认证成功后把 {@link AuthenticatedUser} 放入请求属性 {@link #ATTR_USER}，控制器通过 @RequestAttribute 取用。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    public static final String ATTR_USER = "authenticatedUser";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String PROTECTED_PREFIX = "/api/";
    private static final String PUBLIC_PREFIX = "/api/v0/auth/";

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;

    public JwtAuthFilter(JwtService jwtService, ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith(PROTECTED_PREFIX) || path.startsWith(PUBLIC_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String auth = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith(BEARER_PREFIX)) {
            reject(request, response, "Bearer token is required");
            return;
        }
        Optional<AuthenticatedUser> user = jwtService.parse(auth.substring(BEARER_PREFIX.length()).trim());
        if (user.isEmpty()) {
            reject(request, response, "Bearer token is invalid or expired");
            return;
        }
        request.setAttribute(ATTR_USER, user.get());
        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String message) throws IOException {
        log.info("Unauthenticated request: {} {}", request.getMethod(), request.getRequestURI());
        Map<String, Object> err = new LinkedHashMap<>();
        err.put("code", "unauthenticated");
        err.put("message", message);
        err.put("requestId", RequestIdSupport.resolve(request));

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        objectMapper.writeValue(response.getOutputStream(), Map.of("error", err));
    }
}
