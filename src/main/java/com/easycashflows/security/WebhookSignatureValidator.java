package com.easycashflows.security;

import com.easycashflows.domain.enums.Provider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Locale;

/**
 * Verifies that a raw webhook body was signed with the provider's shared secret.
 * <p>
 * Twilio signs with HMAC-SHA1 (base64), LinkMobility with HMAC-SHA256 (hex) and Facebook with
 * HMAC-SHA256 (hex, {@code sha256=} prefixed). Digests are compared with {@link MessageDigest#isEqual},
 * whose running time does not depend on where the first mismatch is, nor on a length mismatch.
 */
@Slf4j
@Component
public class WebhookSignatureValidator {

    private static final String HMAC_SHA1 = "HmacSHA1";
    private static final String HMAC_SHA256 = "HmacSHA256";

    public boolean validate(byte[] payload, String signature, String secret, Provider provider) {
        if (payload == null || signature == null || signature.isBlank() || secret == null || secret.isBlank()) {
            return false;
        }
        try {
            return switch (provider) {
                case TWILIO -> constantTimeEquals(
                        Base64.getEncoder().encodeToString(hmac(HMAC_SHA1, payload, secret)),
                        stripPrefix(signature.trim(), "sha1="));
                case LINKMOBILITY -> constantTimeEquals(
                        toHex(hmac(HMAC_SHA256, payload, secret)),
                        signature.trim().toLowerCase(Locale.ROOT));
                case FACEBOOK -> constantTimeEquals(
                        toHex(hmac(HMAC_SHA256, payload, secret)),
                        stripPrefix(signature.trim(), "sha256=").toLowerCase(Locale.ROOT));
                case SKEBBY, SENDGRID -> false;
            };
        } catch (GeneralSecurityException e) {
            log.error("Signature computation failed. provider={}", provider, e);
            return false;
        }
    }

    private boolean constantTimeEquals(String expected, String provided) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                provided.getBytes(StandardCharsets.US_ASCII));
    }

    private String stripPrefix(String signature, String prefix) {
        return signature.startsWith(prefix) ? signature.substring(prefix.length()) : signature;
    }

    private byte[] hmac(String algorithm, byte[] data, String key) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(algorithm);
        mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), algorithm));
        return mac.doFinal(data);
    }

    private String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
