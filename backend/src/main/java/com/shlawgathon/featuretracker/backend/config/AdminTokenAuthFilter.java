package com.shlawgathon.featuretracker.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Filter to authenticate admin requests using an {@code Authorization: Bearer} token.
 * Applies to /api/admin/** and to the POST /api/run-* triggers.
 */
@Component
public class AdminTokenAuthFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    @Value("${tracker.admin.token:}")
    private String adminToken;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!requiresToken(request)) {
            filterChain.doFilter(request, response);
            return;
        }

        // If no token is configured, allow the request (development mode)
        if (adminToken == null || adminToken.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String header = request.getHeader("Authorization");

        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            reject(response, "Missing bearer token");
            return;
        }

        String providedToken = header.substring(BEARER_PREFIX.length()).trim();
        if (!MessageDigest.isEqual(adminToken.getBytes(StandardCharsets.UTF_8),
                providedToken.getBytes(StandardCharsets.UTF_8))) {
            reject(response, "Invalid admin token");
            return;
        }

        filterChain.doFilter(request, response);
    }

    static boolean requiresToken(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.startsWith("/api/admin/")) {
            return true;
        }
        return "POST".equalsIgnoreCase(request.getMethod()) && path.startsWith("/api/run-");
    }

    private static void reject(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\":\"unauthorized\",\"message\":\"" + message + "\"}");
    }
}
