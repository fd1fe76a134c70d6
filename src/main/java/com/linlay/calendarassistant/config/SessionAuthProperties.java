package com.linlay.calendarassistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * How a request becomes a calendar session: a verified bearer JWT when enabled, the
 * development headers otherwise.
 */
@ConfigurationProperties(prefix = "assistant.auth")
public class SessionAuthProperties {

    private boolean enabled = true;
    private String jwksUri;
    private String issuer;
    private Long jwksCacheSeconds;
    private String localPublicKey;
    private String accessTokenClaim = "calendar_access_token";
    private String nameClaim = "name";
    private String emailClaim = "email";

    /**
     * True when at least one of the three JWKS settings is present.
     */
    public boolean hasAnyJwksSetting() {
        return StringUtils.hasText(jwksUri) || StringUtils.hasText(issuer) || jwksCacheSeconds != null;
    }

    public boolean hasCompleteJwksSettings() {
        return StringUtils.hasText(jwksUri) && StringUtils.hasText(issuer) && jwksCacheSeconds != null;
    }

    public boolean isJwksUsable() {
        return hasCompleteJwksSettings() && jwksCacheSeconds > 0;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getJwksUri() {
        return jwksUri;
    }

    public void setJwksUri(String jwksUri) {
        this.jwksUri = jwksUri;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public Long getJwksCacheSeconds() {
        return jwksCacheSeconds;
    }

    public void setJwksCacheSeconds(Long jwksCacheSeconds) {
        this.jwksCacheSeconds = jwksCacheSeconds;
    }

    public String getLocalPublicKey() {
        return localPublicKey;
    }

    public void setLocalPublicKey(String localPublicKey) {
        this.localPublicKey = localPublicKey;
    }

    public String getAccessTokenClaim() {
        return accessTokenClaim;
    }

    public void setAccessTokenClaim(String accessTokenClaim) {
        this.accessTokenClaim = accessTokenClaim;
    }

    public String getNameClaim() {
        return nameClaim;
    }

    public void setNameClaim(String nameClaim) {
        this.nameClaim = nameClaim;
    }

    public String getEmailClaim() {
        return emailClaim;
    }

    public void setEmailClaim(String emailClaim) {
        this.emailClaim = emailClaim;
    }
}
