package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.config.WhatsAppConfig;
import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.exception.SignatureInvalidException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Collection;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;

/**
 * Verifies X-Hub-Signature-256 on webhook deliveries.
 *
 * The header carries "sha256=" followed by the hex HMAC-SHA256 of the raw
 * request body, keyed with the app secret. The secret is the tenant's own
 * when its channel has one, otherwise the platform secret.
 *
 * A delivery is signed with exactly one secret, so every business number it
 * carries must resolve to that same secret. Otherwise one tenant could sign
 * entries for another tenant's number with its own secret.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGO = "HmacSHA256";

    private final WhatsAppConfig whatsAppConfig;
    private final TenantCredentialResolver credentialResolver;

    /**
     * @return true only when the header is well formed and matches the body.
     *         Any missing piece fails closed.
     */
    public boolean verify(byte[] body, String signatureHeader, String secret) {
        if (body == null || secret == null || secret.isEmpty()) {
            return false;
        }
        if (signatureHeader == null || !signatureHeader.startsWith(ConversationConstants.SIGNATURE_PREFIX)) {
            return false;
        }

        byte[] received;
        try {
            received = HexFormat.of().parseHex(
                    signatureHeader.substring(ConversationConstants.SIGNATURE_PREFIX.length()).trim());
        } catch (IllegalArgumentException ex) {
            return false;
        }

        return MessageDigest.isEqual(received, hmac(body, secret));
    }

    /**
     * Resolves the signing secret for the delivery and verifies it.
     *
     * @param phoneNumberIds every business number found in the delivery, empty when it names none
     * @throws SignatureInvalidException when the signature does not verify, the numbers
     *         resolve to different secrets, or no secret is available and unsigned
     *         deliveries are not allowed
     */
    public void authenticate(byte[] body, String signatureHeader, Collection<String> phoneNumberIds) {
        Set<Optional<String>> secrets = new HashSet<>();
        if (phoneNumberIds.isEmpty()) {
            secrets.add(resolveSecret(null));
        }
        for (String phoneNumberId : phoneNumberIds) {
            secrets.add(resolveSecret(phoneNumberId));
        }
        if (secrets.size() > 1) {
            log.warn("Rejecting webhook: phoneNumberIds {} resolve to different signing secrets", phoneNumberIds);
            throw new SignatureInvalidException("Delivery mixes business numbers with different signing secrets");
        }

        Optional<String> secret = secrets.iterator().next();
        if (secret.isEmpty()) {
            if (whatsAppConfig.isAllowUnsignedWebhooks()) {
                log.warn("Processing webhook WITHOUT signature check: no secret for phoneNumberIds={}", phoneNumberIds);
                return;
            }
            log.warn("Rejecting webhook: no signing secret for phoneNumberIds={}", phoneNumberIds);
            throw new SignatureInvalidException("No signing secret configured for this delivery");
        }

        if (!verify(body, signatureHeader, secret.get())) {
            log.warn("Webhook HMAC mismatch, rejecting delivery (phoneNumberIds={})", phoneNumberIds);
            throw new SignatureInvalidException("Invalid webhook signature");
        }
        log.debug("Webhook signature verified");
    }

    private Optional<String> resolveSecret(String phoneNumberId) {
        Optional<String> tenantSecret = credentialResolver.resolveByPhoneNumberId(phoneNumberId)
                .filter(TenantCredentials::hasAppSecret)
                .map(TenantCredentials::getAppSecret);
        if (tenantSecret.isPresent()) {
            return tenantSecret;
        }
        return whatsAppConfig.hasGlobalAppSecret()
                ? Optional.of(whatsAppConfig.getAppSecret())
                : Optional.empty();
    }

    private static byte[] hmac(byte[] body, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGO);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGO));
            return mac.doFinal(body);
        } catch (GeneralSecurityException ex) {
            // HmacSHA256 is mandatory on every JRE
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }
}
