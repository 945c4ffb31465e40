package com.heronix.decora.crypto;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Set;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.heronix.decora.exception.KeyCorruptException;
import com.heronix.decora.exception.KeyFileAccessException;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns the 256-bit AES key that protects credential values at rest.
 *
 * The key is generated once per installation and stored as 32 raw bytes in
 * a dedicated key file. An existing file of the wrong length is reported as
 * corrupt instead of being replaced, so previously encrypted values are
 * never orphaned by a silent regeneration.
 *
 * Not safe for concurrent use from several threads.
 */
@Slf4j
public class SymmetricKeyStore {

    public static final int KEY_LENGTH = 32;

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path keyFile;
    private final SecureRandom secureRandom;
    private byte[] keyBytes;

    public SymmetricKeyStore(Path keyFile) {
        this(keyFile, new SecureRandom());
    }

    public SymmetricKeyStore(Path keyFile, SecureRandom secureRandom) {
        this.keyFile = keyFile;
        this.secureRandom = secureRandom;
    }

    /**
     * Load the key from the key file, generating and persisting a new one if
     * the file does not exist yet.
     *
     * @throws KeyCorruptException if the key file does not hold exactly 32 bytes
     * @throws KeyFileAccessException if the key file cannot be read or written
     */
    public synchronized SecretKey ensureKey() {
        if (keyBytes == null) {
            keyBytes = Files.exists(keyFile) ? readKey() : generateAndStoreKey();
        }
        return new SecretKeySpec(keyBytes, "AES");
    }

    public Path getKeyFile() {
        return keyFile;
    }

    /**
     * Zero the cached key material. The next {@link #ensureKey()} re-reads the file.
     */
    public synchronized void destroy() {
        if (keyBytes != null) {
            Arrays.fill(keyBytes, (byte) 0);
            keyBytes = null;
        }
    }

    private byte[] readKey() {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(keyFile);
        } catch (IOException e) {
            throw new KeyFileAccessException("Failed to read key file " + keyFile, e);
        }

        if (bytes.length != KEY_LENGTH) {
            Arrays.fill(bytes, (byte) 0);
            throw KeyCorruptException.wrongLength(keyFile.toString(), bytes.length);
        }

        log.debug("Loaded encryption key from {}", keyFile);
        return bytes;
    }

    private byte[] generateAndStoreKey() {
        byte[] bytes = new byte[KEY_LENGTH];
        secureRandom.nextBytes(bytes);

        try {
            Path directory = keyFile.toAbsolutePath().getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }

            if (supportsPosix()) {
                Files.createFile(keyFile, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
            }
            Files.write(keyFile, bytes);
        } catch (IOException e) {
            Arrays.fill(bytes, (byte) 0);
            throw new KeyFileAccessException("Failed to save key file " + keyFile, e);
        }

        restrictToOwner();
        log.info("Generated new encryption key at {}", keyFile);
        return bytes;
    }

    // Best effort: not every file system honours owner-only flags.
    private void restrictToOwner() {
        if (supportsPosix()) {
            return;
        }
        File file = keyFile.toFile();
        boolean restricted = file.setReadable(false, false) && file.setReadable(true, true)
                && file.setWritable(false, false) && file.setWritable(true, true);
        if (!restricted) {
            log.warn("Could not restrict access to key file {} to the owning user", keyFile);
        }
    }

    private static boolean supportsPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
}
