package com.keelson.core.security;

import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

class AuthFilterTest {

    private AuthFilter filter;

    @BeforeEach
    void setUp() {
        AuthProperties properties = new AuthProperties();
        properties.setMode("single-user");
        properties.setBootstrapToken("s3cret");
        SessionAuthService service = new SessionAuthService(properties);
        service.init();
        filter = new AuthFilter(service);
    }

    private MockHttpServletResponse run(MockHttpServletRequest request, MockFilterChain chain) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, chain);
        return response;
    }

    @Test
    @DisplayName("API calls without the cookie are 401")
    void blocksApi() throws Exception {
        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = run(new MockHttpServletRequest("GET", "/api/app"), chain);

        assertEquals(401, response.getStatus());
        assertEquals("unauthorized", response.getContentAsString());
        assertNull(chain.getRequest());
    }

    @Test
    @DisplayName("the events socket upgrade is checked like any API call")
    void blocksUpgrade() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/events");
        request.addHeader("Upgrade", "websocket");

        assertEquals(401, run(request, new MockFilterChain()).getStatus());
    }

    @Test
    @DisplayName("the session cookie lets requests through")
    void allowsCookie() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/app");
        request.setCookies(new Cookie("session", "s3cret"));
        MockFilterChain chain = new MockFilterChain();

        assertEquals(200, run(request, chain).getStatus());
        assertNotNull(chain.getRequest());
    }

    @Test
    @DisplayName("health, login and static assets stay public")
    void publicPaths() throws Exception {
        for (String path : new String[] {"/api/health", "/auth", "/", "/index.html"}) {
            MockFilterChain chain = new MockFilterChain();
            run(new MockHttpServletRequest("GET", path), chain);
            assertNotNull(chain.getRequest(), path);
        }
    }
}
