package io.surfworks.gatekeeper.server.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads {@link ServerSettings}.
 *
 * <p>Sources (in order of precedence):
 * <ol>
 *   <li>Environment variables ({@code GATEKEEPER_*})</li>
 *   <li>Config file (JSON, optional)</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>Secrets that are still missing afterwards are generated for this
 * process only. Fingerprints, webhook signatures and admin signatures made
 * with them do not survive a restart, so a warning names each one.
 */
public final class ServerSettingsLoader {

    private static final Logger LOG = Logger.getLogger(ServerSettingsLoader.class.getName());

    public static final String ENV_HOST = "GATEKEEPER_HOST";
    public static final String ENV_PORT = "GATEKEEPER_PORT";
    public static final String ENV_DB_URL = "GATEKEEPER_DB_URL";
    public static final String ENV_DB_USER = "GATEKEEPER_DB_USER";
    public static final String ENV_DB_PASSWORD = "GATEKEEPER_DB_PASSWORD";
    public static final String ENV_FINGERPRINT_SECRET = "GATEKEEPER_FINGERPRINT_SECRET";
    public static final String ENV_WEBHOOK_SECRET = "GATEKEEPER_WEBHOOK_SECRET";
    public static final String ENV_ADMIN_SECRET = "GATEKEEPER_ADMIN_SECRET";
    public static final String ENV_CACHE_TTL_SECONDS = "GATEKEEPER_CACHE_TTL_SECONDS";
    public static final String ENV_USAGE_RETENTION_DAYS = "GATEKEEPER_USAGE_RETENTION_DAYS";
    public static final String ENV_VALIDATIONS_PER_MINUTE = "GATEKEEPER_VALIDATIONS_PER_MINUTE";

    private static final SecureRandom RANDOM = new SecureRandom();

    private ServerSettingsLoader() {
    }

    /**
     * Load from the process environment and an optional config file.
     *
     * @param configFile JSON config file, or null for none
     * @throws IOException if the config file exists but cannot be read
     */
    public static ServerSettings load(Path configFile) throws IOException {
        return load(configFile, System.getenv());
    }

    /**
     * Load from the given environment and an optional config file.
     *
     * @throws IOException if the config file exists but cannot be read
     * @throws IllegalArgumentException if a value is malformed
     */
    public static ServerSettings load(Path configFile, Map<String, String> env) throws IOException {
        ServerSettings settings = ServerSettings.defaults();

        if (configFile != null && Files.exists(configFile)) {
            settings = loadFromFile(configFile, settings);
        }

        settings = applyEnvironment(env, settings);

        return generateMissingSecrets(settings);
    }

    private static ServerSettings loadFromFile(Path configFile, ServerSettings base) throws IOException {
        JsonObject root;
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                throw new IllegalArgumentException("Config file must hold a JSON object: " + configFile);
            }
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed config file " + configFile + ": " + e.getMessage(), e);
        }

        ServerSettings settings = base
            .withHost(getString(root, "host", base.host()))
            .withPort(getInt(root, "port", base.port()));

        if (root.has("database") && root.get("database").isJsonObject()) {
            JsonObject db = root.getAsJsonObject("database");
            settings = settings.withDatabase(
                getString(db, "url", base.dbUrl()),
                getString(db, "user", base.dbUser()),
                getString(db, "password", base.dbPassword())
            );
        }

        if (root.has("secrets") && root.get("secrets").isJsonObject()) {
            JsonObject secrets = root.getAsJsonObject("secrets");
            settings = settings.withSecrets(
                getString(secrets, "fingerprint", base.fingerprintSecret()),
                getString(secrets, "webhook", base.webhookSecret()),
                getString(secrets, "admin", base.adminSecret())
            );
        }

        if (root.has("cache") && root.get("cache").isJsonObject()) {
            JsonObject cache = root.getAsJsonObject("cache");
            settings = settings.withCache(
                Duration.ofSeconds(getInt(cache, "ttlSeconds", (int) base.cacheTtl().toSeconds())),
                Duration.ofSeconds(getInt(cache, "cleanupIntervalSeconds", (int) base.cacheCleanupInterval().toSeconds()))
            );
        }

        settings = settings.withUsageRetentionDays(getInt(root, "usageRetentionDays", base.usageRetentionDays()));
        settings = settings.withValidationsPerMinute(
            getInt(root, "validationsPerMinute", base.validationsPerMinute()));
        LOG.fine("Loaded server settings from " + configFile);
        return settings;
    }

    private static ServerSettings applyEnvironment(Map<String, String> env, ServerSettings settings) {
        String host = env.get(ENV_HOST);
        if (isSet(host)) {
            settings = settings.withHost(host);
        }
        String port = env.get(ENV_PORT);
        if (isSet(port)) {
            settings = settings.withPort(parseInt(ENV_PORT, port));
        }
        if (isSet(env.get(ENV_DB_URL)) || isSet(env.get(ENV_DB_USER)) || isSet(env.get(ENV_DB_PASSWORD))) {
            settings = settings.withDatabase(
                orElse(env.get(ENV_DB_URL), settings.dbUrl()),
                orElse(env.get(ENV_DB_USER), settings.dbUser()),
                orElse(env.get(ENV_DB_PASSWORD), settings.dbPassword())
            );
        }
        settings = settings.withSecrets(
            orElse(env.get(ENV_FINGERPRINT_SECRET), settings.fingerprintSecret()),
            orElse(env.get(ENV_WEBHOOK_SECRET), settings.webhookSecret()),
            orElse(env.get(ENV_ADMIN_SECRET), settings.adminSecret())
        );
        String ttl = env.get(ENV_CACHE_TTL_SECONDS);
        if (isSet(ttl)) {
            settings = settings.withCache(
                Duration.ofSeconds(parseInt(ENV_CACHE_TTL_SECONDS, ttl)), settings.cacheCleanupInterval());
        }
        String retention = env.get(ENV_USAGE_RETENTION_DAYS);
        if (isSet(retention)) {
            settings = settings.withUsageRetentionDays(parseInt(ENV_USAGE_RETENTION_DAYS, retention));
        }
        String validations = env.get(ENV_VALIDATIONS_PER_MINUTE);
        if (isSet(validations)) {
            settings = settings.withValidationsPerMinute(parseInt(ENV_VALIDATIONS_PER_MINUTE, validations));
        }
        return settings;
    }

    private static ServerSettings generateMissingSecrets(ServerSettings settings) {
        List<String> generated = new ArrayList<>();
        String fingerprint = settings.fingerprintSecret();
        if (!isSet(fingerprint)) {
            fingerprint = randomSecret();
            generated.add(ENV_FINGERPRINT_SECRET);
        }
        String webhook = settings.webhookSecret();
        if (!isSet(webhook)) {
            webhook = randomSecret();
            generated.add(ENV_WEBHOOK_SECRET);
        }
        String admin = settings.adminSecret();
        if (!isSet(admin)) {
            admin = randomSecret();
            generated.add(ENV_ADMIN_SECRET);
        }
        if (!generated.isEmpty()) {
            LOG.warning("Generated per-process secrets for " + generated
                + "; set them to keep signatures valid across restarts");
        }
        return settings.withSecrets(fingerprint, webhook, admin);
    }

    private static String randomSecret() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String getString(JsonObject node, String field, String defaultValue) {
        return node.has(field) && !node.get(field).isJsonNull() ? node.get(field).getAsString() : defaultValue;
    }

    private static int getInt(JsonObject node, String field, int defaultValue) {
        if (!node.has(field) || node.get(field).isJsonNull()) {
            return defaultValue;
        }
        try {
            return node.get(field).getAsInt();
        } catch (NumberFormatException | UnsupportedOperationException e) {
            throw new IllegalArgumentException("Config field '" + field + "' must be an integer", e);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static String orElse(String value, String fallback) {
        return isSet(value) ? value : fallback;
    }
}
