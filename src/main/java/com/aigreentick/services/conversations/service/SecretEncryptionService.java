package com.aigreentick.services.conversations.service;

import com.aigreentick.services.conversations.exception.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * AES-256-GCM encryption for tenant credentials at rest
 * (access tokens and per-tenant app secrets in tenant_channels).
 *
 * Stored format: "ENC:" + base64(iv || ciphertext+tag)
 */
@Component
@Slf4j
public class SecretEncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH_BYTES = 12;
    private static final int GCM_TAG_LENGTH_BITS = 128;
    private static final String ENCRYPTED_PREFIX = "ENC:";

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * @param encryptionKeyHex 32-byte AES key as 64 hex chars (SECRET_ENCRYPTION_KEY)
     */
    public SecretEncryptionService(@Value("${secret.encryption.key}") String encryptionKeyHex) {
        if (encryptionKeyHex == null || encryptionKeyHex.isBlank()) {
            throw new IllegalStateException(
                    "SECRET_ENCRYPTION_KEY is not set. Generate one with: openssl rand -hex 32");
        }
        if (encryptionKeyHex.length() != 64) {
            throw new IllegalStateException(
                    "SECRET_ENCRYPTION_KEY must be 64 hex chars (32 bytes). Current length: "
                            + encryptionKeyHex.length());
        }
        byte[] keyBytes;
        try {
            keyBytes = HexFormat.of().parseHex(encryptionKeyHex);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("SECRET_ENCRYPTION_KEY is not valid hex", ex);
        }
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
        log.info("SecretEncryptionService initialized with AES-256-GCM");
    }

    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new InvalidRequestException("Cannot encrypt null or blank secret");
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH_BYTES];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(ciphertext, 0, combined, iv.length, ciphertext.length);

            return ENCRYPTED_PREFIX + Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException ex) {
            // never include the plaintext
            throw new InvalidRequestException("Secret encryption failed: " + ex.getMessage());
        }
    }

    /**
     * Values without the ENC: prefix were stored before encryption was introduced
     * and are returned unchanged.
     */
    public String decrypt(String storedValue) {
        if (storedValue == null || storedValue.isBlank()) {
            throw new InvalidRequestException("Cannot decrypt null or blank stored secret");
        }
        if (!storedValue.startsWith(ENCRYPTED_PREFIX)) {
            log.warn("Read a plaintext tenant secret; re-encrypt tenant_channels");
            return storedValue;
        }
        try {
            byte[] combined = Base64.getDecoder().decode(storedValue.substring(ENCRYPTED_PREFIX.length()));
            if (combined.length <= GCM_IV_LENGTH_BYTES) {
                throw new InvalidRequestException("Stored secret is truncated");
            }
            byte[] iv = new byte[GCM_IV_LENGTH_BYTES];
            byte[] ciphertext = new byte[combined.length - GCM_IV_LENGTH_BYTES];
            System.arraycopy(combined, 0, iv, 0, iv.length);
            System.arraycopy(combined, iv.length, ciphertext, 0, ciphertext.length);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (AEADBadTagException ex) {
            throw new InvalidRequestException(
                    "Secret decryption failed: authentication tag mismatch (wrong key or corrupted data)");
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            throw new InvalidRequestException("Secret decryption failed: " + ex.getMessage());
        }
    }

    public boolean isEncrypted(String storedValue) {
        return storedValue != null && storedValue.startsWith(ENCRYPTED_PREFIX);
    }
}
