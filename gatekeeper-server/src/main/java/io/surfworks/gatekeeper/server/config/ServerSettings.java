package io.surfworks.gatekeeper.server.config;

import java.time.Duration;

/**
 * Settings for a license server process.
 *
 * @param host interface the HTTP surface binds to
 * @param port HTTP port
 * @param dbUrl JDBC URL of the license database
 * @param dbUser database user
 * @param dbPassword database password
 * @param fingerprintSecret key for machine fingerprint HMACs
 * @param webhookSecret shared secret for payment-provider webhooks
 * @param adminSecret shared secret for signed admin requests
 * @param cacheTtl lifetime of cached validations
 * @param cacheCleanupInterval how often expired cache entries are removed
 * @param usageRetentionDays usage rows older than this are purged daily
 * @param validationsPerMinute license validations allowed per client address and minute
 */
public record ServerSettings(
    String host,
    int port,
    String dbUrl,
    String dbUser,
    String dbPassword,
    String fingerprintSecret,
    String webhookSecret,
    String adminSecret,
    Duration cacheTtl,
    Duration cacheCleanupInterval,
    int usageRetentionDays,
    int validationsPerMinute
) {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8787;
    public static final String DEFAULT_DB_URL = "jdbc:h2:./gatekeeper-data/licenses;LOCK_TIMEOUT=10000";
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(10);
    public static final int DEFAULT_USAGE_RETENTION_DAYS = 90;
    public static final int DEFAULT_VALIDATIONS_PER_MINUTE = 20;

    public ServerSettings {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (usageRetentionDays < 1) {
            throw new IllegalArgumentException("usageRetentionDays must be >= 1: " + usageRetentionDays);
        }
        if (validationsPerMinute < 1) {
            throw new IllegalArgumentException("validationsPerMinute must be >= 1: " + validationsPerMinute);
        }
    }

    /**
     * Defaults with no secrets set.
     */
    public static ServerSettings defaults() {
        return new ServerSettings(
            DEFAULT_HOST, DEFAULT_PORT, DEFAULT_DB_URL, "sa", "",
            null, null, null,
            DEFAULT_CACHE_TTL, DEFAULT_CLEANUP_INTERVAL, DEFAULT_USAGE_RETENTION_DAYS,
            DEFAULT_VALIDATIONS_PER_MINUTE
        );
    }

    public ServerSettings withHost(String newHost) {
        return new ServerSettings(newHost, port, dbUrl, dbUser, dbPassword,
            fingerprintSecret, webhookSecret, adminSecret, cacheTtl, cacheCleanupInterval, usageRetentionDays,
            validationsPerMinute);
    }

    public ServerSettings withPort(int newPort) {
        return new ServerSettings(host, newPort, dbUrl, dbUser, dbPassword,
            fingerprintSecret, webhookSecret, adminSecret, cacheTtl, cacheCleanupInterval, usageRetentionDays,
            validationsPerMinute);
    }

    public ServerSettings withDatabase(String newUrl, String newUser, String newPassword) {
        return new ServerSettings(host, port, newUrl, newUser, newPassword,
            fingerprintSecret, webhookSecret, adminSecret, cacheTtl, cacheCleanupInterval, usageRetentionDays,
            validationsPerMinute);
    }

    public ServerSettings withSecrets(String newFingerprintSecret, String newWebhookSecret, String newAdminSecret) {
        return new ServerSettings(host, port, dbUrl, dbUser, dbPassword,
            newFingerprintSecret, newWebhookSecret, newAdminSecret, cacheTtl, cacheCleanupInterval, usageRetentionDays,
            validationsPerMinute);
    }

    public ServerSettings withCache(Duration newTtl, Duration newCleanupInterval) {
        return new ServerSettings(host, port, dbUrl, dbUser, dbPassword,
            fingerprintSecret, webhookSecret, adminSecret, newTtl, newCleanupInterval, usageRetentionDays,
            validationsPerMinute);
    }

    public ServerSettings withUsageRetentionDays(int days) {
        return new ServerSettings(host, port, dbUrl, dbUser, dbPassword,
            fingerprintSecret, webhookSecret, adminSecret, cacheTtl, cacheCleanupInterval, days, validationsPerMinute);
    }

    public ServerSettings withValidationsPerMinute(int perMinute) {
        return new ServerSettings(host, port, dbUrl, dbUser, dbPassword,
            fingerprintSecret, webhookSecret, adminSecret, cacheTtl, cacheCleanupInterval, usageRetentionDays,
            perMinute);
    }

    @Override
    public String toString() {
        return "ServerSettings[host=" + host + ", port=" + port + ", dbUrl=" + dbUrl
            + ", cacheTtl=" + cacheTtl + ", cacheCleanupInterval=" + cacheCleanupInterval
            + ", usageRetentionDays=" + usageRetentionDays
            + ", validationsPerMinute=" + validationsPerMinute + "]";
    }
}
