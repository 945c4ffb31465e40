package com.heronix.decora.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.StringLength;

/**
 * Property-based tests for credential encryption.
 *
 * Uses an in-memory key so no key file is touched.
 */
class CredentialCipherPropertyTest {

    private final CredentialCipher cipher = new CredentialCipher(new SymmetricKeyStore(Path.of("unused", ".key")));
    private final SecretKey key = randomKey();

    /**
     * Property: any string survives an encrypt/decrypt round trip.
     */
    @Property(tries = 200)
    void roundTripPreservesPlaintext(@ForAll @StringLength(max = 300) String plaintext) {
        String blob = cipher.encrypt(plaintext, key);

        assertEquals(plaintext, cipher.decrypt(blob, key));
    }

    /**
     * Property: the blob holds a 16-byte IV followed by whole AES blocks.
     */
    @Property(tries = 100)
    void blobIsIvPlusWholeBlocks(@ForAll @StringLength(min = 1, max = 200) String plaintext) {
        byte[] decoded = Base64.getDecoder().decode(cipher.encrypt(plaintext, key));

        int ciphertextLength = decoded.length - CredentialCipher.IV_LENGTH;
        assertTrue(ciphertextLength >= 16);
        assertEquals(0, ciphertextLength % 16);
    }

    /**
     * Property: encrypting the same value twice never yields the same blob.
     */
    @Property(tries = 100)
    void encryptionIsNotDeterministic(@ForAll @StringLength(min = 1, max = 100) String plaintext) {
        assertNotEquals(cipher.encrypt(plaintext, key), cipher.encrypt(plaintext, key));
    }

    private static SecretKey randomKey() {
        byte[] bytes = new byte[SymmetricKeyStore.KEY_LENGTH];
        new SecureRandom().nextBytes(bytes);
        return new SecretKeySpec(bytes, "AES");
    }
}
