package com.keelson.core.security;

import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Single-user token auth. The operator opens {@code /auth?token=<bootstrap token>} once;
 * the response sets a session cookie whose value is the same token, and every later
 * request is checked against it.
 */
@Service
public class SessionAuthService {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthService.class);

    private final AuthProperties properties;
    private String token;

    public SessionAuthService(AuthProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void init() {
        if (!properties.isEnabled()) {
            log.info("Authentication disabled");
            return;
        }
        String configured = properties.getBootstrapToken();
        if (configured == null || configured.isBlank()) {
            byte[] bytes = new byte[24];
            new SecureRandom().nextBytes(bytes);
            token = HexFormat.of().formatHex(bytes);
            log.info("Generated bootstrap token (see the serve banner for the login URL)");
        } else {
            token = configured.trim();
        }
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public String cookieName() {
        return properties.getCookieName();
    }

    /**
     * The bootstrap token, or {@code null} when auth is disabled.
     */
    public String token() {
        return token;
    }

    /**
     * Checks a bootstrap token. The token stays valid, so the login link can be reused.
     *
     * @return the session cookie value on success
     */
    public String consumeBootstrapToken(String candidate) {
        if (!isEnabled() || !matches(candidate)) {
            return null;
        }
        return token;
    }

    public boolean isAuthorized(HttpServletRequest request) {
        if (!isEnabled()) {
            return true;
        }
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return false;
        }
        for (Cookie cookie : cookies) {
            if (cookieName().equals(cookie.getName()) && matches(cookie.getValue())) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String candidate) {
        if (candidate == null || token == null) {
            return false;
        }
        return MessageDigest.isEqual(candidate.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8));
    }
}
