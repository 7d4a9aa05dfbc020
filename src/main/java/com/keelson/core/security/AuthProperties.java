package com.keelson.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "keelson.auth")
public class AuthProperties {

    /** {@code disabled} or {@code single-user}. */
    private String mode = "disabled";
    /** Bootstrap token; generated at startup when blank. */
    private String bootstrapToken = "";
    private String cookieName = "session";

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getBootstrapToken() {
        return bootstrapToken;
    }

    public void setBootstrapToken(String bootstrapToken) {
        this.bootstrapToken = bootstrapToken;
    }

    public String getCookieName() {
        return cookieName;
    }

    public void setCookieName(String cookieName) {
        this.cookieName = cookieName;
    }

    public boolean isEnabled() {
        return "single-user".equalsIgnoreCase(mode);
    }
}
