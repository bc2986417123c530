package com.portray.portal.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for sessions, verification, password setup and the seed admin.
 * Binds to app.portal.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.portal")
public class PortalProperties {

    private final Session session = new Session();
    private final Verification verification = new Verification();
    private final SetupToken setupToken = new SetupToken();
    private final BootstrapAdmin bootstrapAdmin = new BootstrapAdmin();
    private final Mail mail = new Mail();

    public Session getSession() {
        return session;
    }

    public Verification getVerification() {
        return verification;
    }

    public SetupToken getSetupToken() {
        return setupToken;
    }

    public BootstrapAdmin getBootstrapAdmin() {
        return bootstrapAdmin;
    }

    public Mail getMail() {
        return mail;
    }

    public static class Session {
        private Duration ttl = Duration.ofHours(24);
        private Duration rememberMeTtl = Duration.ofDays(30);

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public Duration getRememberMeTtl() { return rememberMeTtl; }
        public void setRememberMeTtl(Duration rememberMeTtl) { this.rememberMeTtl = rememberMeTtl; }
    }

    public static class Verification {
        private Duration ttl = Duration.ofHours(24);
        private String baseUrl = "http://localhost:5000";

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    public static class SetupToken {
        private String secret;
        private Duration ttl = Duration.ofHours(24);
        private String issuer = "portray";

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public String getIssuer() { return issuer; }
        public void setIssuer(String issuer) { this.issuer = issuer; }
    }

    /**
     * Seed SystemAdmin created once at startup. Blank email disables seeding.
     */
    public static class BootstrapAdmin {
        private String email;
        private String password;
        private String firstName = "System";
        private String lastName = "Administrator";

        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public String getFirstName() { return firstName; }
        public void setFirstName(String firstName) { this.firstName = firstName; }
        public String getLastName() { return lastName; }
        public void setLastName(String lastName) { this.lastName = lastName; }

        public boolean isConfigured() {
            return email != null && !email.isBlank() && password != null && !password.isBlank();
        }
    }

    public static class Mail {
        private boolean enabled = true;
        private String from = "PortRay <no-reply@portray.local>";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getFrom() { return from; }
        public void setFrom(String from) { this.from = from; }
    }
}
