package com.easycashflows.security;

import com.easycashflows.config.WebhookProperties;
import com.easycashflows.domain.enums.Provider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Applies the signature policy of the current deployment. Enforcement is on for the
 * {@code production} profile unless {@code app.webhooks.enforce-signatures} says otherwise.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookAuthenticator {

    private static final String PRODUCTION_PROFILE = "production";

    private final WebhookProperties properties;
    private final WebhookSignatureValidator signatureValidator;
    private final Environment environment;

    public boolean isEnforcing() {
        if (properties.enforceSignatures() != null) {
            return properties.enforceSignatures();
        }
        return environment.acceptsProfiles(Profiles.of(PRODUCTION_PROFILE));
    }

    public boolean verify(Provider provider, byte[] body, String signatureHeader) {
        if (!isEnforcing()) {
            return true;
        }
        String secret = properties.signingSecretFor(provider);
        if (secret == null || secret.isBlank()) {
            return switch (provider) {
                case SKEBBY, SENDGRID, FACEBOOK -> true;
                case TWILIO, LINKMOBILITY -> {
                    log.error("Rejected {} webhook: signature enforcement is on but no secret is configured", provider);
                    yield false;
                }
            };
        }
        boolean valid = signatureValidator.validate(body, signatureHeader, secret, provider);
        if (!valid) {
            log.warn("Rejected {} webhook: invalid signature. hasHeader={}, bodyLength={}",
                    provider, signatureHeader != null, body == null ? 0 : body.length);
        }
        return valid;
    }

    /**
     * Facebook subscription handshake: returns the challenge to echo back, or empty when the request must get 403.
     */
    public Optional<String> verifySubscription(String mode, String verifyToken, String challenge) {
        String expected = properties.facebook().verifyToken();
        if (!"subscribe".equals(mode) || expected == null || expected.isBlank() || verifyToken == null) {
            log.warn("Rejected Messenger subscription handshake. mode={}", mode);
            return Optional.empty();
        }
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                verifyToken.getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            log.warn("Rejected Messenger subscription handshake: verify token mismatch");
            return Optional.empty();
        }
        return Optional.ofNullable(challenge);
    }
}
