package io.surfworks.gatekeeper.client;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.surfworks.gatekeeper.core.json.GatekeeperJson;
import io.surfworks.gatekeeper.core.security.IntegrityException;
import io.surfworks.gatekeeper.core.security.SecretCipher;
import io.surfworks.gatekeeper.core.security.SecurityEvents;
import io.surfworks.gatekeeper.core.tier.TierTable;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Persists {@link ClientConfig} in {@code <configDir>/config.json}.
 *
 * <p>The file is replaced atomically and readable only by its owner where the
 * file system supports POSIX permissions. The license key is stored encrypted
 * under a key derived from the machine id, so a copied config file does not
 * carry a usable key to another machine.
 */
public class ClientConfigStore {

    private static final Logger LOG = Logger.getLogger(ClientConfigStore.class.getName());

    public static final String CONFIG_FILE = "config.json";

    private static final Gson GSON = GatekeeperJson.pretty();
    private static final Set<PosixFilePermission> OWNER_FILE = PosixFilePermissions.fromString("rw-------");
    private static final Set<PosixFilePermission> OWNER_DIR = PosixFilePermissions.fromString("rwx------");

    private final Path configDir;
    private final Path configFile;
    private final String machineId;
    private final TierTable tiers;
    private final SecretCipher cipher;

    public ClientConfigStore(Path configDir, String machineId, TierTable tiers) {
        this.configDir = configDir;
        this.configFile = configDir.resolve(CONFIG_FILE);
        this.machineId = machineId;
        this.tiers = tiers;
        this.cipher = new SecretCipher("gatekeeper-config:" + machineId);
    }

    public Path path() {
        return configFile;
    }

    /**
     * Load the stored config.
     *
     * <p>Never fails: an absent, unreadable or corrupt file yields FREE-tier
     * defaults, and a key that cannot be decrypted is dropped.
     *
     * @param today date used for the usage counter of a fresh config
     */
    public ClientConfig load(LocalDate today) {
        if (!Files.exists(configFile)) {
            return ClientConfig.defaults(tiers, machineId, today);
        }

        JsonObject json;
        ClientConfig config;
        try {
            json = GSON.fromJson(Files.readString(configFile), JsonObject.class);
            config = json != null ? GSON.fromJson(json, ClientConfig.class) : null;
        } catch (IOException | RuntimeException e) {
            LOG.warning("Ignoring unreadable license config " + configFile + ": " + e.getMessage());
            return ClientConfig.defaults(tiers, machineId, today);
        }
        if (config == null || config.tier == null || config.limits == null) {
            LOG.warning("Ignoring incomplete license config " + configFile);
            return ClientConfig.defaults(tiers, machineId, today);
        }

        if (config.features == null) {
            config.features = tiers.features(config.tier);
        }
        if (config.usage == null) {
            config.usage = new ClientConfig.Usage(0, today);
        } else if (config.usage.callsToday < 0) {
            config.usage.callsToday = 0;
        }
        clampOfflineWindow(config);
        config.licenseKey = decryptKey(json);
        return config;
    }

    /**
     * Write the config. Failures are logged; the in-memory state stays authoritative.
     *
     * @return whether the file was written
     */
    public boolean save(ClientConfig config) {
        JsonObject json = GSON.toJsonTree(config).getAsJsonObject();
        if (config.licenseKey != null) {
            json.addProperty("licenseKey", cipher.encrypt(config.licenseKey));
        }

        Path temp = configDir.resolve(CONFIG_FILE + ".tmp");
        try {
            createPrivateDirectory();
            Files.writeString(temp, GSON.toJson(json));
            restrictToOwner(temp, OWNER_FILE);
            try {
                Files.move(temp, configFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, configFile, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            LOG.warning("Could not save license config to " + configFile + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * A stored window never reaches past {@link LicenseClient#OFFLINE_WINDOW}
     * after the validation that opened it.
     */
    private void clampOfflineWindow(ClientConfig config) {
        ClientConfig.ValidationCache cache = config.validationCache;
        if (cache == null || cache.validUntil == null) {
            return;
        }
        if (cache.lastValidated == null) {
            LOG.warning("Ignoring validation window without a validation time in " + configFile);
            config.validationCache = null;
            return;
        }
        Instant limit = cache.lastValidated.plus(LicenseClient.OFFLINE_WINDOW);
        if (cache.validUntil.isAfter(limit)) {
            LOG.warning("Validation window in " + configFile + " exceeds "
                + LicenseClient.OFFLINE_WINDOW.toHours() + " hours; clamping to " + limit);
            cache.validUntil = limit;
        }
    }

    private String decryptKey(JsonObject json) {
        JsonElement stored = json.get("licenseKey");
        if (stored == null || stored.isJsonNull()) {
            return null;
        }
        try {
            return cipher.decrypt(stored.getAsString());
        } catch (IntegrityException | IllegalStateException | UnsupportedOperationException e) {
            SecurityEvents.record("config_key_unreadable", SecurityEvents.Severity.MEDIUM,
                Map.of("file", configFile, "reason", String.valueOf(e.getMessage())));
            return null;
        }
    }

    private void createPrivateDirectory() throws IOException {
        if (Files.isDirectory(configDir)) {
            return;
        }
        Files.createDirectories(configDir);
        restrictToOwner(configDir, OWNER_DIR);
    }

    private static void restrictToOwner(Path path, Set<PosixFilePermission> permissions) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, permissions);
        }
    }
}
