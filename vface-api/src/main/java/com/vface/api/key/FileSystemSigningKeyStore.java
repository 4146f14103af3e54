package com.vface.api.key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Stores the signing keypair as PEM files (PKCS#8 private key, X.509 public key) in a directory.
 *
 * A directory holding only one of the two key files is treated as corrupt rather than empty,
 * so a partial store never leads to silent key regeneration.
 */
public class FileSystemSigningKeyStore implements SigningKeyStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSigningKeyStore.class);

    static final String PRIVATE_KEY_FILE = "signing-key.pem";
    static final String PUBLIC_KEY_FILE = "signing-key.pub.pem";
    static final String CREATED_AT_FILE = "signing-key.created";

    private final Path directory;

    public FileSystemSigningKeyStore(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("Key directory cannot be null");
        }
        this.directory = directory;
    }

    @Override
    public synchronized void storeSigningKeyPair(KeyPair keyPair, Instant createdAt) {
        try {
            Files.createDirectories(directory);
            writeAtomically(PRIVATE_KEY_FILE, PemKeys.toPem(keyPair.getPrivate()), true);
            writeAtomically(PUBLIC_KEY_FILE, PemKeys.toPem(keyPair.getPublic()), false);
            writeAtomically(CREATED_AT_FILE, createdAt.toString(), false);
            log.info("Signing keypair written to {}", directory.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist signing keypair to " + directory, e);
        }
    }

    @Override
    public synchronized KeyPair loadSigningKeyPair() {
        Path privatePath = directory.resolve(PRIVATE_KEY_FILE);
        Path publicPath = directory.resolve(PUBLIC_KEY_FILE);
        boolean hasPrivate = Files.exists(privatePath);
        boolean hasPublic = Files.exists(publicPath);
        if (!hasPrivate && !hasPublic) {
            return null;
        }
        if (hasPrivate != hasPublic) {
            throw new KeyManagementService.KeyManagementException(
                    "Key store " + directory + " is incomplete: expected both " + PRIVATE_KEY_FILE
                            + " and " + PUBLIC_KEY_FILE);
        }
        try {
            String privatePem = Files.readString(privatePath, StandardCharsets.US_ASCII);
            String publicPem = Files.readString(publicPath, StandardCharsets.US_ASCII);
            return new KeyPair(PemKeys.parseEcPublicKey(publicPem), PemKeys.parseEcPrivateKey(privatePem));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read signing keypair from " + directory, e);
        } catch (GeneralSecurityException e) {
            throw new KeyManagementService.KeyManagementException(
                    "Stored signing keypair in " + directory + " is not a valid EC keypair", e);
        }
    }

    @Override
    public synchronized Instant getSigningKeyCreatedAt() {
        Path createdPath = directory.resolve(CREATED_AT_FILE);
        try {
            if (Files.exists(createdPath)) {
                return Instant.parse(Files.readString(createdPath, StandardCharsets.US_ASCII).trim());
            }
            Path privatePath = directory.resolve(PRIVATE_KEY_FILE);
            return Files.exists(privatePath) ? Files.getLastModifiedTime(privatePath).toInstant() : null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read key creation time from " + directory, e);
        } catch (DateTimeParseException e) {
            throw new KeyManagementService.KeyManagementException(
                    "Corrupt key creation timestamp in " + createdPath, e);
        }
    }

    @Override
    public boolean isPersistent() {
        return true;
    }

    @Override
    public synchronized void wipe() {
        try {
            Files.deleteIfExists(directory.resolve(PRIVATE_KEY_FILE));
            Files.deleteIfExists(directory.resolve(PUBLIC_KEY_FILE));
            Files.deleteIfExists(directory.resolve(CREATED_AT_FILE));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to wipe key store " + directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private void writeAtomically(String fileName, String content, boolean ownerOnly) throws IOException {
        Path target = directory.resolve(fileName);
        Path temp = Files.createTempFile(directory, fileName, ".tmp");
        Files.writeString(temp, content, StandardCharsets.US_ASCII);
        if (ownerOnly) {
            restrictToOwner(temp);
        }
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private void restrictToOwner(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.warn("File system does not support POSIX permissions; {} is not restricted to its owner", path);
        }
    }
}
