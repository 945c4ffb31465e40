package com.heronix.decora.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;

import com.heronix.decora.exception.DecryptionException;
import com.heronix.decora.exception.EncryptionException;

/**
 * Encrypts and decrypts single credential values using AES-256-CBC.
 *
 * Encrypted values are stored as Base64-encoded strings containing:
 * [16-byte IV][PKCS7-padded ciphertext]
 *
 * There is no authentication tag. A modified blob can decrypt to wrong
 * plaintext without any error being raised.
 */
public class CredentialCipher {

    public static final int IV_LENGTH = 16;

    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final int BLOCK_SIZE = 16;

    private final SymmetricKeyStore keyStore;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialCipher(SymmetricKeyStore keyStore) {
        this.keyStore = keyStore;
    }

    /**
     * Encrypt a plaintext value with the installation key.
     * Returns null or empty input unchanged.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return plaintext;
        }
        return encrypt(plaintext, keyStore.ensureKey());
    }

    /**
     * Decrypt a value produced by {@link #encrypt(String)}.
     * Returns null or empty input unchanged.
     *
     * @throws DecryptionException on malformed Base64, truncated input or bad padding
     */
    public String decrypt(String encryptedValue) {
        if (encryptedValue == null || encryptedValue.isEmpty()) {
            return encryptedValue;
        }
        return decrypt(encryptedValue, keyStore.ensureKey());
    }

    /**
     * Zero the key material cached by the backing key store.
     */
    public void clearKey() {
        keyStore.destroy();
    }

    public String encrypt(String plaintext, SecretKey key) {
        if (plaintext == null || plaintext.isEmpty()) {
            return plaintext;
        }

        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));

            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // Prepend IV to ciphertext
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);

            return Base64.getEncoder().encodeToString(buffer.array());

        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to encrypt credential", e);
        }
    }

    public String decrypt(String encryptedValue, SecretKey key) {
        if (encryptedValue == null || encryptedValue.isEmpty()) {
            return encryptedValue;
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encryptedValue);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Encrypted value is not valid Base64", e);
        }

        int ciphertextLength = decoded.length - IV_LENGTH;
        if (ciphertextLength < BLOCK_SIZE || ciphertextLength % BLOCK_SIZE != 0) {
            throw new DecryptionException("Encrypted value is truncated (" + decoded.length + " bytes)");
        }

        // Extract IV from the beginning
        ByteBuffer buffer = ByteBuffer.wrap(decoded);
        byte[] iv = new byte[IV_LENGTH];
        buffer.get(iv);
        byte[] ciphertext = new byte[buffer.remaining()];
        buffer.get(ciphertext);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(iv));

            byte[] plaintext = cipher.doFinal(ciphertext);
            return new String(plaintext, StandardCharsets.UTF_8);

        } catch (BadPaddingException | IllegalBlockSizeException e) {
            throw new DecryptionException("Failed to decrypt credential: padding check failed", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt credential", e);
        }
    }
}
