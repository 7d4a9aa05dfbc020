package com.keelson.dispatch.ws;

import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the event socket and the terminal socket. Origins default to same-origin.
 */
@Configuration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final EventsWebSocketHandler eventsHandler;
    private final PtyWebSocketHandler ptyHandler;
    private final PtyHandshakeInterceptor ptyHandshakeInterceptor;

    public WebSocketConfig(EventsWebSocketHandler eventsHandler,
                           PtyWebSocketHandler ptyHandler,
                           PtyHandshakeInterceptor ptyHandshakeInterceptor) {
        this.eventsHandler = eventsHandler;
        this.ptyHandler = ptyHandler;
        this.ptyHandshakeInterceptor = ptyHandshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(eventsHandler, "/api/events");
        registry.addHandler(ptyHandler, "/api/pty/*/*")
                .addInterceptors(ptyHandshakeInterceptor);
    }
}
