package com.example.ample.infrastructure.secret;

import com.example.ample.common.config.AppSecretProperties;
import com.example.ample.common.exception.ErrorKind;
import com.example.ample.common.exception.ScrobblerException;
import com.example.ample.common.util.AesCryptoUtil;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Secret store backed by a properties file whose values are AES-GCM sealed.
 */
@Component
public class EncryptedFileSecretStore implements SecretStore {

    private static final Logger log = LoggerFactory.getLogger(EncryptedFileSecretStore.class);

    static final String CODE_STORE_FAILED = "SECRET_STORE_FAILED";

    private final Path storePath;
    private final String encryptKey;

    @Autowired
    public EncryptedFileSecretStore(AppSecretProperties properties) {
        this(Paths.get(properties.getStorePath()), properties.getEncryptKey());
    }

    EncryptedFileSecretStore(Path storePath, String encryptKey) {
        this.storePath = storePath;
        this.encryptKey = encryptKey;
    }

    @Override
    public synchronized Optional<String> get(String entryName) {
        String sealed = load().getProperty(entryName);
        if (sealed == null || sealed.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(AesCryptoUtil.decrypt(sealed, encryptKey));
        } catch (RuntimeException e) {
            throw new ScrobblerException(ErrorKind.CONFIGURATION, CODE_STORE_FAILED,
                    "Secret entry " + entryName + " cannot be decrypted",
                    "Check app.secrets.encrypt-key or provision the entry again", e);
        }
    }

    @Override
    public synchronized void set(String entryName, String value) {
        Properties properties = load();
        properties.setProperty(entryName, AesCryptoUtil.encrypt(value, encryptKey));
        store(properties);
        log.info("Secret entry stored, entry={}, path={}", entryName, storePath);
    }

    private Properties load() {
        Properties properties = new Properties();
        if (!Files.exists(storePath)) {
            return properties;
        }
        try (InputStream in = Files.newInputStream(storePath)) {
            properties.load(in);
            return properties;
        } catch (IOException e) {
            throw new ScrobblerException(ErrorKind.CONFIGURATION, CODE_STORE_FAILED,
                    "Reading secret store failed, path=" + storePath + ": " + e.getMessage(), e);
        }
    }

    private void store(Properties properties) {
        try {
            Path parent = storePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, "secrets", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                properties.store(out, "ample secret store");
            }
            try {
                Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ScrobblerException(ErrorKind.CONFIGURATION, CODE_STORE_FAILED,
                    "Writing secret store failed, path=" + storePath + ": " + e.getMessage(), e);
        }
    }
}
