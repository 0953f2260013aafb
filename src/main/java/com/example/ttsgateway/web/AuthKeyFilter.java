package com.example.ttsgateway.web;

import com.example.ttsgateway.api.common.ErrorResponse;
import com.example.ttsgateway.config.GatewayProperties;
import com.example.ttsgateway.error.GatewayException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Rejects requests whose {@code Authorization} header does not equal the configured key.
 * Does nothing when no key is configured.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthKeyFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthKeyFilter.class);

    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    public AuthKeyFilter(GatewayProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String authKey = properties.getAuthKey();
        if (authKey == null || authKey.isEmpty() || matches(authKey, request.getHeader(HttpHeaders.AUTHORIZATION))) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("Rejected unauthorized request method={} path={}", request.getMethod(), request.getRequestURI());
        GatewayException error = GatewayException.unauthorized();
        response.setStatus(error.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(),
                new ErrorResponse(error.getMessage(), error.getErrorCode().code()));
    }

    private boolean matches(String expected, String provided) {
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
