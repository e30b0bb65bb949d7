package com.aino.session;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM encryption of session payloads.
 *
 * <p>The encoded form is {@code base64(ciphertext)--base64(iv)--base64(tag)} with a 16 byte
 * random IV, a 16 byte tag and a fixed associated-data string bound into the tag.</p>
 */
final class AesGcm {
    static final String DELIMITER = "--";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final byte[] AAD = "aino-session-crypto-module".getBytes(StandardCharsets.UTF_8);
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    private AesGcm() {
    }

    static void checkKey(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Session encryption key must be exactly 32 bytes");
        }
    }

    static String encrypt(String data, byte[] key) throws GeneralSecurityException {
        byte[] iv = new byte[IV_LENGTH];
        RANDOM.nextBytes(iv);

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, iv));
        cipher.updateAAD(AAD);
        byte[] sealed = cipher.doFinal(data.getBytes(StandardCharsets.UTF_8));

        // the JCE appends the tag to the ciphertext
        byte[] encrypted = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH);
        byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH, sealed.length);

        Base64.Encoder encoder = Base64.getEncoder();
        return encoder.encodeToString(encrypted)
                + DELIMITER + encoder.encodeToString(iv)
                + DELIMITER + encoder.encodeToString(tag);
    }

    /**
     * Decrypts and authenticates an encoded payload.
     *
     * @throws GeneralSecurityException if the payload is malformed or fails authentication
     * @throws IllegalArgumentException if a part is not valid base64
     */
    static String decrypt(String blob, byte[] key) throws GeneralSecurityException {
        String[] parts = blob.split(DELIMITER, -1);
        if (parts.length != 3) {
            throw new GeneralSecurityException("Expected 3 parts in encrypted payload, got " + parts.length);
        }

        Base64.Decoder decoder = Base64.getDecoder();
        byte[] encrypted = decoder.decode(parts[0]);
        byte[] iv = decoder.decode(parts[1]);
        byte[] tag = decoder.decode(parts[2]);
        if (iv.length != IV_LENGTH || tag.length != TAG_LENGTH) {
            throw new GeneralSecurityException("Malformed IV or tag in encrypted payload");
        }

        byte[] sealed = new byte[encrypted.length + tag.length];
        System.arraycopy(encrypted, 0, sealed, 0, encrypted.length);
        System.arraycopy(tag, 0, sealed, encrypted.length, tag.length);

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, iv));
        cipher.updateAAD(AAD);
        return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
    }
}
