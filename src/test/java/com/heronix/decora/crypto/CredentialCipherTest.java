package com.heronix.decora.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Base64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.heronix.decora.exception.DecryptionException;

class CredentialCipherTest {

    @TempDir
    Path tempDir;

    private CredentialCipher cipher;

    @BeforeEach
    void setUp() {
        cipher = new CredentialCipher(new SymmetricKeyStore(tempDir.resolve(".key")));
    }

    @Test
    void emptyAndNullValuesPassThrough() {
        assertEquals("", cipher.encrypt(""));
        assertEquals("", cipher.decrypt(""));
        assertNull(cipher.encrypt(null));
        assertNull(cipher.decrypt(null));
    }

    @Test
    void roundTripUsesPersistedKey() {
        String blob = cipher.encrypt("s3cret");

        CredentialCipher other = new CredentialCipher(new SymmetricKeyStore(tempDir.resolve(".key")));

        assertEquals("s3cret", other.decrypt(blob));
    }

    @Test
    void unicodeRoundTrip() {
        String plaintext = "pässwörd ✓ 密码";

        assertEquals(plaintext, cipher.decrypt(cipher.encrypt(plaintext)));
    }

    @Test
    void malformedBase64IsRejected() {
        assertThrows(DecryptionException.class, () -> cipher.decrypt("not*base64!"));
    }

    @Test
    void truncatedBlobIsRejected() {
        String shortBlob = Base64.getEncoder().encodeToString(new byte[20]);

        DecryptionException e = assertThrows(DecryptionException.class, () -> cipher.decrypt(shortBlob));
        assertTrue(e.getMessage().contains("truncated"));
    }

    @Test
    void ivOnlyBlobIsRejected() {
        String ivOnly = Base64.getEncoder().encodeToString(new byte[CredentialCipher.IV_LENGTH]);

        assertThrows(DecryptionException.class, () -> cipher.decrypt(ivOnly));
    }

    @Test
    void corruptedPaddingIsRejected() {
        // 15 bytes leave a single 0x01 pad byte; flipping the last IV bit turns it into 0x00
        byte[] blob = Base64.getDecoder().decode(cipher.encrypt("fifteen-bytes!!"));
        blob[CredentialCipher.IV_LENGTH - 1] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(blob);

        DecryptionException e = assertThrows(DecryptionException.class, () -> cipher.decrypt(tampered));
        assertTrue(e.getMessage().contains("padding"));
    }

    @Test
    void wrongKeyFailsOrYieldsDifferentPlaintext() {
        String blob = cipher.encrypt("correct horse battery staple");

        CredentialCipher stranger = new CredentialCipher(new SymmetricKeyStore(tempDir.resolve("other.key")));

        // CBC without an integrity tag: a wrong key usually fails the padding check
        try {
            assertNotEquals("correct horse battery staple", stranger.decrypt(blob));
        } catch (DecryptionException expected) {
            assertNotNull(expected.getMessage());
        }
    }
}
