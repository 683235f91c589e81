package com.example.ample.common.util;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM sealing of short secrets. The AES key is the SHA-256 of the passphrase, so any
 * non-empty passphrase is accepted. Output is Base64 of {@code iv || ciphertext+tag}.
 */
public final class AesCryptoUtil {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH_BIT = 128;
    private static final int GCM_IV_LENGTH_BYTE = 12;
    private static final SecureRandom RANDOM = new SecureRandom();

    private AesCryptoUtil() {
    }

    public static String encrypt(String plainText, String passphrase) {
        try {
            byte[] iv = new byte[GCM_IV_LENGTH_BYTE];
            RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(passphrase), new GCMParameterSpec(GCM_TAG_LENGTH_BIT, iv));
            byte[] encrypted = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + encrypted.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);
            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Secret encryption failed", e);
        }
    }

    public static String decrypt(String cipherText, String passphrase) {
        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(cipherText);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Sealed secret is not valid Base64", e);
        }
        if (combined.length <= GCM_IV_LENGTH_BYTE) {
            throw new IllegalArgumentException("Sealed secret is too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(passphrase),
                    new GCMParameterSpec(GCM_TAG_LENGTH_BIT, combined, 0, GCM_IV_LENGTH_BYTE));
            byte[] plainBytes = cipher.doFinal(combined, GCM_IV_LENGTH_BYTE, combined.length - GCM_IV_LENGTH_BYTE);
            return new String(plainBytes, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Secret decryption failed", e);
        }
    }

    private static SecretKeySpec deriveKey(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("Secret store passphrase must not be empty");
        }
        return new SecretKeySpec(HashUtil.sha256(passphrase), "AES");
    }
}
