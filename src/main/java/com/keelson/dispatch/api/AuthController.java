package com.keelson.dispatch.api;

import com.keelson.core.security.SessionAuthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bootstrap login: {@code GET /auth?token=...} exchanges the printed token for a session
 * cookie and sends the browser back to the app.
 */
@RestController
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    static final String REDIRECT_PAGE = """
            <!doctype html>
            <html><head><meta charset="utf-8"><title>Keelson</title></head>
            <body><script>window.location.replace("/");</script>Signed in.</body></html>
            """;

    private final SessionAuthService authService;

    public AuthController(SessionAuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/auth")
    public ResponseEntity<String> login(@RequestParam(required = false) String token) {
        if (!authService.isEnabled()) {
            return ResponseEntity.notFound().build();
        }
        String cookieValue = authService.consumeBootstrapToken(token);
        if (cookieValue == null) {
            log.debug("Rejected bootstrap token");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("unauthorized");
        }
        ResponseCookie cookie = ResponseCookie.from(authService.cookieName(), cookieValue)
                .path("/")
                .httpOnly(true)
                .sameSite("Lax")
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .contentType(MediaType.TEXT_HTML)
                .body(REDIRECT_PAGE);
    }
}
