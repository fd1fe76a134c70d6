package com.linlay.calendarassistant.security;

import java.net.URI;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.text.ParseException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import com.linlay.calendarassistant.config.SessionAuthProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Verifies session tokens issued by the sign-in front end and turns their claims into a
 * {@link CalendarSession}. Signatures are checked against the configured PEM public key first,
 * then against the RSA keys of the JWKS endpoint, which are cached for
 * {@code assistant.auth.jwks-cache-seconds}.
 */
@Component
public class JwksJwtVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwksJwtVerifier.class);

    private static final String INVALID_PEM = "assistant.auth.local-public-key is not a valid PEM RSA public key";

    private final SessionAuthProperties authProperties;
    private final Object reloadLock = new Object();

    private volatile RSAPublicKey localKey;
    private volatile KeySetSnapshot keySetSnapshot;

    public JwksJwtVerifier(SessionAuthProperties authProperties) {
        this.authProperties = authProperties;
    }

    @PostConstruct
    void initialize() {
        if (authProperties.hasAnyJwksSetting() && !authProperties.hasCompleteJwksSettings()) {
            throw new IllegalStateException(
                    "assistant.auth.jwks-uri, assistant.auth.issuer and assistant.auth.jwks-cache-seconds must be configured together"
            );
        }
        if (authProperties.hasCompleteJwksSettings() && !authProperties.isJwksUsable()) {
            throw new IllegalStateException("assistant.auth.jwks-cache-seconds must be greater than 0");
        }
        String pem = authProperties.getLocalPublicKey();
        if (pem != null) {
            if (!StringUtils.hasText(pem)) {
                throw new IllegalStateException("assistant.auth.local-public-key cannot be blank");
            }
            localKey = readPublicKey(pem);
        }
    }

    public Optional<CalendarSession> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token.trim());
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException ex) {
            log.debug("Rejecting unparsable session token: {}", ex.getMessage());
            return Optional.empty();
        }
        if (!acceptable(claims)) {
            return Optional.empty();
        }
        RSAPublicKey local = localKey;
        boolean signed = (local != null && signatureMatches(jwt, local))
                || (authProperties.isJwksUsable() && remoteKeys(jwt.getHeader().getKeyID()).stream()
                        .anyMatch(key -> signatureMatches(jwt, key)));
        return signed ? Optional.of(toSession(claims)) : Optional.empty();
    }

    private boolean acceptable(JWTClaimsSet claims) {
        if (claims.getExpirationTime() == null || claims.getExpirationTime().toInstant().isBefore(Instant.now())) {
            return false;
        }
        String expectedIssuer = authProperties.getIssuer();
        if (StringUtils.hasText(expectedIssuer) && !expectedIssuer.equals(claims.getIssuer())) {
            return false;
        }
        return StringUtils.hasText(claims.getSubject());
    }

    private CalendarSession toSession(JWTClaimsSet claims) {
        String name = claim(claims, authProperties.getNameClaim());
        return new CalendarSession(
                claim(claims, authProperties.getAccessTokenClaim()),
                StringUtils.hasText(name) ? name : claims.getSubject(),
                claim(claims, authProperties.getEmailClaim())
        );
    }

    private static String claim(JWTClaimsSet claims, String name) {
        if (!StringUtils.hasText(name)) {
            return null;
        }
        Object raw = claims.getClaim(name);
        return raw == null ? null : String.valueOf(raw);
    }

    // a kid that matches nothing falls back to every RSA key in the set
    private List<RSAPublicKey> remoteKeys(String kid) {
        List<RSAKey> rsaKeys = currentKeySet().getKeys().stream()
                .filter(RSAKey.class::isInstance)
                .map(RSAKey.class::cast)
                .toList();
        List<RSAKey> matching = StringUtils.hasText(kid)
                ? rsaKeys.stream().filter(key -> kid.equals(key.getKeyID())).toList()
                : List.of();
        List<RSAPublicKey> publicKeys = new ArrayList<>();
        for (RSAKey key : matching.isEmpty() ? rsaKeys : matching) {
            try {
                publicKeys.add(key.toRSAPublicKey());
            } catch (JOSEException ex) {
                log.debug("Skipping unusable JWKS key {}: {}", key.getKeyID(), ex.getMessage());
            }
        }
        return publicKeys;
    }

    private JWKSet currentKeySet() {
        KeySetSnapshot snapshot = keySetSnapshot;
        if (snapshot != null && snapshot.isFresh()) {
            return snapshot.keySet();
        }
        synchronized (reloadLock) {
            snapshot = keySetSnapshot;
            if (snapshot != null && snapshot.isFresh()) {
                return snapshot.keySet();
            }
            String uri = authProperties.getJwksUri().trim();
            try {
                JWKSet loaded = JWKSet.load(URI.create(uri).toURL());
                keySetSnapshot = new KeySetSnapshot(
                        loaded, Instant.now().plusSeconds(Math.max(30L, authProperties.getJwksCacheSeconds())));
                return loaded;
            } catch (Exception ex) {
                if (snapshot != null) {
                    log.warn("JWKS reload from {} failed, keeping the previous key set", uri);
                    return snapshot.keySet();
                }
                log.warn("Failed to load JWKS from {}", uri, ex);
                return new JWKSet();
            }
        }
    }

    private static boolean signatureMatches(SignedJWT jwt, RSAPublicKey key) {
        try {
            return jwt.verify(new RSASSAVerifier(key));
        } catch (JOSEException ex) {
            return false;
        }
    }

    private static RSAPublicKey readPublicKey(String pem) {
        String body = pem.trim()
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s+", "");
        if (body.isEmpty()) {
            throw new IllegalStateException(INVALID_PEM);
        }
        try {
            byte[] der = Base64.getDecoder().decode(body);
            return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (Exception ex) {
            log.error("Invalid local public key configuration", ex);
            throw new IllegalStateException(INVALID_PEM, ex);
        }
    }

    private record KeySetSnapshot(JWKSet keySet, Instant expiresAt) {

        boolean isFresh() {
            return Instant.now().isBefore(expiresAt);
        }
    }
}
