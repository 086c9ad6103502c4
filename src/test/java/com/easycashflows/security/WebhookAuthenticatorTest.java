package com.easycashflows.security;

import com.easycashflows.config.WebhookProperties;
import com.easycashflows.domain.enums.Provider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebhookAuthenticator")
class WebhookAuthenticatorTest {

    private static final byte[] BODY = "{}".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("Outside production any request passes, even without a signature")
    void notEnforcingOutsideProduction() {
        WebhookAuthenticator authenticator = authenticator(null, "token", new MockEnvironment());

        assertThat(authenticator.isEnforcing()).isFalse();
        assertThat(authenticator.verify(Provider.TWILIO, BODY, null)).isTrue();
    }

    @Test
    @DisplayName("In production a missing signature is rejected")
    void productionRejectsMissingSignature() {
        MockEnvironment environment = new MockEnvironment();
        environment.setActiveProfiles("production");
        WebhookAuthenticator authenticator = authenticator(null, "token", environment);

        assertThat(authenticator.isEnforcing()).isTrue();
        assertThat(authenticator.verify(Provider.TWILIO, BODY, null)).isFalse();
    }

    @Test
    @DisplayName("Explicit property overrides the profile")
    void propertyOverridesProfile() {
        MockEnvironment environment = new MockEnvironment();
        environment.setActiveProfiles("production");

        assertThat(authenticator(false, "token", environment).isEnforcing()).isFalse();
        assertThat(authenticator(true, "token", new MockEnvironment()).isEnforcing()).isTrue();
    }

    @Test
    @DisplayName("Enforcing without a configured Twilio secret fails closed")
    void failsClosedWithoutSecret() {
        WebhookAuthenticator authenticator = authenticator(true, null, new MockEnvironment());

        assertThat(authenticator.verify(Provider.TWILIO, BODY, "anything")).isFalse();
        assertThat(authenticator.verify(Provider.SKEBBY, BODY, null)).isTrue();
    }

    @Test
    @DisplayName("Messenger handshake echoes the challenge only for a matching verify token")
    void messengerHandshake() {
        WebhookAuthenticator authenticator = authenticator(null, "token", new MockEnvironment());

        assertThat(authenticator.verifySubscription("subscribe", "verify-me", "42")).contains("42");
        assertThat(authenticator.verifySubscription("subscribe", "wrong", "42")).isEmpty();
        assertThat(authenticator.verifySubscription("unsubscribe", "verify-me", "42")).isEmpty();
    }

    private WebhookAuthenticator authenticator(Boolean enforce, String twilioToken, MockEnvironment environment) {
        WebhookProperties properties = new WebhookProperties(null, enforce, null, null, null, null, null,
                new WebhookProperties.Twilio("AC123", twilioToken, "+390000000", null),
                null, null, null,
                new WebhookProperties.Facebook(null, null, "verify-me", null, null));
        return new WebhookAuthenticator(properties, new WebhookSignatureValidator(), environment);
    }
}
