package com.keelson.core.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;

@Component
@Order(1)
public class AuthFilter implements Filter {

    private static final Set<String> PUBLIC_PATHS = Set.of(
            "/api/health",
            "/auth",
            "/actuator/health"
    );

    private final SessionAuthService authService;

    public AuthFilter(SessionAuthService authService) {
        this.authService = authService;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String path = httpRequest.getRequestURI();

        if (!authService.isEnabled() || isPublicPath(path) || !isProtected(path)) {
            chain.doFilter(request, response);
            return;
        }

        // covers the WebSocket upgrade requests too, they arrive here as plain GETs
        if (authService.isAuthorized(httpRequest)) {
            chain.doFilter(request, response);
            return;
        }

        httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        httpResponse.setContentType("text/plain");
        httpResponse.getWriter().write("unauthorized");
    }

    private boolean isPublicPath(String path) {
        return PUBLIC_PATHS.contains(path);
    }

    private boolean isProtected(String path) {
        return path.startsWith("/api/") || path.startsWith("/actuator/");
    }
}
