package com.keelson.dispatch.api;

import com.keelson.core.security.SessionAuthService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionAuthService authService;

    @Test
    @DisplayName("login is not served when auth is disabled")
    void disabled() throws Exception {
        when(authService.isEnabled()).thenReturn(false);

        mockMvc.perform(get("/auth").param("token", "anything"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("a wrong token is 401")
    void wrongToken() throws Exception {
        when(authService.isEnabled()).thenReturn(true);
        when(authService.consumeBootstrapToken("wrong")).thenReturn(null);

        mockMvc.perform(get("/auth").param("token", "wrong"))
                .andExpect(status().isUnauthorized())
                .andExpect(content().string("unauthorized"));
    }

    @Test
    @DisplayName("the bootstrap token sets the session cookie and redirects home")
    void login() throws Exception {
        when(authService.isEnabled()).thenReturn(true);
        when(authService.consumeBootstrapToken("s3cret")).thenReturn("s3cret");
        when(authService.cookieName()).thenReturn("session");

        mockMvc.perform(get("/auth").param("token", "s3cret"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.SET_COOKIE, allOf(
                        containsString("session=s3cret"),
                        containsString("HttpOnly"),
                        containsString("SameSite=Lax"))))
                .andExpect(content().string(containsString("window.location.replace(\"/\")")));
    }
}
