package io.surfworks.gatekeeper.server.store;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.surfworks.gatekeeper.core.api.ValidationResult;
import io.surfworks.gatekeeper.core.json.GatekeeperJson;
import io.surfworks.gatekeeper.core.security.FingerprintComponents;
import io.surfworks.gatekeeper.core.tier.Tier;

import javax.sql.DataSource;
import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link LicenseStore} over plain JDBC.
 *
 * <p>Written against H2 (embedded or in-memory) but sticks to statements any
 * database with row locks ({@code SELECT ... FOR UPDATE}) accepts. Times are
 * stored as epoch millis, usage dates as {@code DATE}.
 *
 * <p>Usage:
 * <pre>{@code
 * DataSource ds = JdbcConnectionPool.create("jdbc:h2:./gatekeeper", "sa", "");
 * JdbcLicenseStore store = new JdbcLicenseStore(ds);
 * store.initializeSchema();
 * }</pre>
 */
public class JdbcLicenseStore implements LicenseStore {

    private static final Logger LOG = Logger.getLogger(JdbcLicenseStore.class.getName());

    /**
     * How long a claimed but unfinished webhook event is held before a
     * redelivery may take it over.
     */
    public static final Duration WEBHOOK_CLAIM_LEASE = Duration.ofMinutes(5);

    private static final Gson GSON = GatekeeperJson.compact();
    private static final Type STRING_LIST = new TypeToken<List<String>>() {}.getType();

    private static final List<String> SCHEMA = List.of(
        """
        CREATE TABLE IF NOT EXISTS users (
            id VARCHAR(36) PRIMARY KEY,
            email VARCHAR(255) UNIQUE,
            name VARCHAR(255),
            created_at BIGINT NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS licenses (
            id VARCHAR(36) PRIMARY KEY,
            license_key VARCHAR(64) NOT NULL UNIQUE,
            user_id VARCHAR(255),
            tier VARCHAR(20) NOT NULL,
            status VARCHAR(20) NOT NULL,
            subscription_id VARCHAR(255),
            max_machines INT NOT NULL,
            daily_calls_override INT,
            concurrent_sessions_override INT,
            created_at BIGINT NOT NULL,
            expires_at BIGINT,
            revoked_at BIGINT,
            revocation_reason VARCHAR(1000),
            CHECK (tier IN ('FREE', 'PRO', 'ENTERPRISE')),
            CHECK (status IN ('active', 'expired', 'revoked', 'suspended'))
        )""",
        "CREATE UNIQUE INDEX IF NOT EXISTS uq_licenses_subscription ON licenses(subscription_id)",
        """
        CREATE TABLE IF NOT EXISTS license_machines (
            license_id VARCHAR(36) NOT NULL,
            machine_id VARCHAR(255) NOT NULL,
            fingerprint_hash VARCHAR(128) NOT NULL,
            fingerprint_components VARCHAR(2000),
            first_seen BIGINT NOT NULL,
            last_seen BIGINT NOT NULL,
            is_active BOOLEAN NOT NULL,
            CONSTRAINT uq_license_machine UNIQUE (license_id, machine_id),
            FOREIGN KEY (license_id) REFERENCES licenses(id)
        )""",
        """
        CREATE TABLE IF NOT EXISTS license_usage (
            license_id VARCHAR(36) NOT NULL,
            machine_id VARCHAR(255) NOT NULL,
            usage_date DATE NOT NULL,
            call_count INT NOT NULL,
            features VARCHAR(4000),
            updated_at BIGINT NOT NULL,
            CONSTRAINT uq_license_usage UNIQUE (license_id, machine_id, usage_date),
            FOREIGN KEY (license_id) REFERENCES licenses(id)
        )""",
        """
        CREATE TABLE IF NOT EXISTS validation_cache (
            license_key VARCHAR(64) PRIMARY KEY,
            result_json VARCHAR(65535) NOT NULL,
            machine_ids VARCHAR(65535) NOT NULL,
            cached_at BIGINT NOT NULL,
            expires_at BIGINT NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS subscriptions (
            subscription_id VARCHAR(255) PRIMARY KEY,
            user_id VARCHAR(36),
            plan_id VARCHAR(255),
            status VARCHAR(20) NOT NULL,
            expires_at BIGINT,
            grace_period_ends BIGINT,
            updated_at BIGINT NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS webhook_events (
            idempotency_key VARCHAR(128) PRIMARY KEY,
            event_type VARCHAR(100) NOT NULL,
            subscription_id VARCHAR(255),
            payload CLOB,
            received_at BIGINT NOT NULL,
            claimed_at BIGINT NOT NULL,
            processed BOOLEAN NOT NULL,
            processed_at BIGINT
        )"""
    );

    private static final String LICENSE_COLUMNS =
        "id, license_key, user_id, tier, status, subscription_id, max_machines, daily_calls_override, "
            + "concurrent_sessions_override, created_at, expires_at, revoked_at, revocation_reason";

    private static final String MACHINE_COLUMNS =
        "license_id, machine_id, fingerprint_hash, fingerprint_components, first_seen, last_seen, is_active";

    private final DataSource dataSource;

    public JdbcLicenseStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create tables and indexes that do not exist yet.
     */
    public void initializeSchema() {
        inTransaction("initialize schema", c -> {
            try (Statement st = c.createStatement()) {
                for (String ddl : SCHEMA) {
                    st.execute(ddl);
                }
            }
            return null;
        });
        LOG.info("License store schema ready");
    }

    // ===== Licenses =====

    @Override
    public void createLicense(LicenseRecord license) {
        inTransaction("create license", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO licenses (" + LICENSE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, license.id());
                ps.setString(2, license.licenseKey());
                ps.setString(3, license.userId());
                ps.setString(4, license.tier().name());
                ps.setString(5, license.status().dbValue());
                ps.setString(6, license.subscriptionId());
                ps.setInt(7, license.maxMachines());
                setNullableInt(ps, 8, license.dailyCallsOverride());
                setNullableInt(ps, 9, license.concurrentSessionsOverride());
                setInstant(ps, 10, license.createdAt());
                setInstant(ps, 11, license.expiresAt());
                setInstant(ps, 12, license.revokedAt());
                ps.setString(13, license.revocationReason());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Optional<LicenseRecord> getLicenseByKey(String licenseKey) {
        return inConnection("get license", c ->
            queryLicense(c, "SELECT " + LICENSE_COLUMNS + " FROM licenses WHERE license_key = ?", licenseKey));
    }

    @Override
    public Optional<LicenseRecord> findLicenseBySubscription(String subscriptionId) {
        return inConnection("find license by subscription", c ->
            queryLicense(c, "SELECT " + LICENSE_COLUMNS + " FROM licenses WHERE subscription_id = ? "
                + "ORDER BY created_at LIMIT 1", subscriptionId));
    }

    @Override
    public boolean updateLicenseStatus(String licenseKey, LicenseStatus status, String reason, Instant now) {
        return inTransaction("update license status", c -> {
            if (lockLicenseByKey(c, licenseKey) == null) {
                return false;
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE licenses SET status = ?, revoked_at = ?, revocation_reason = ? WHERE license_key = ?")) {
                ps.setString(1, status.dbValue());
                setInstant(ps, 2, status == LicenseStatus.REVOKED ? now : null);
                ps.setString(3, reason);
                ps.setString(4, licenseKey);
                ps.executeUpdate();
            }
            deleteCacheEntry(c, licenseKey);
            return true;
        });
    }

    @Override
    public void updateLicenseTier(String licenseId, Tier tier, int maxMachines) {
        inTransaction("update license tier", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE licenses SET tier = ?, max_machines = ? WHERE id = ?")) {
                ps.setString(1, tier.name());
                ps.setInt(2, maxMachines);
                ps.setString(3, licenseId);
                ps.executeUpdate();
            }
            deleteCacheEntryForLicense(c, licenseId);
            return null;
        });
    }

    @Override
    public void updateLicenseExpiry(String licenseId, Instant expiresAt) {
        inTransaction("update license expiry", c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE licenses SET expires_at = ? WHERE id = ?")) {
                setInstant(ps, 1, expiresAt);
                ps.setString(2, licenseId);
                ps.executeUpdate();
            }
            deleteCacheEntryForLicense(c, licenseId);
            return null;
        });
    }

    // ===== Machines =====

    @Override
    public MachineRegistration registerMachine(String licenseId, String machineId, String fingerprintHash,
                                               FingerprintComponents components, Instant now) {
        return inTransaction("register machine", c -> {
            Integer maxMachines = null;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT max_machines FROM licenses WHERE id = ? FOR UPDATE")) {
                ps.setString(1, licenseId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        maxMachines = rs.getInt(1);
                    }
                }
            }
            if (maxMachines == null) {
                throw new StoreException("Unknown license id: " + licenseId);
            }

            Boolean active = null;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT is_active FROM license_machines WHERE license_id = ? AND machine_id = ?")) {
                ps.setString(1, licenseId);
                ps.setString(2, machineId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        active = rs.getBoolean(1);
                    }
                }
            }

            String componentsJson = components != null ? GSON.toJson(components) : null;
            if (Boolean.TRUE.equals(active)) {
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE license_machines SET fingerprint_hash = ?, fingerprint_components = ?, last_seen = ? "
                            + "WHERE license_id = ? AND machine_id = ?")) {
                    ps.setString(1, fingerprintHash);
                    ps.setString(2, componentsJson);
                    setInstant(ps, 3, now);
                    ps.setString(4, licenseId);
                    ps.setString(5, machineId);
                    ps.executeUpdate();
                }
                return MachineRegistration.REFRESHED;
            }

            int activeCount;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT COUNT(*) FROM license_machines WHERE license_id = ? AND is_active = TRUE")) {
                ps.setString(1, licenseId);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    activeCount = rs.getInt(1);
                }
            }
            if (activeCount >= maxMachines) {
                return MachineRegistration.LIMIT_EXCEEDED;
            }

            if (active != null) {
                try (PreparedStatement ps = c.prepareStatement(
                        "UPDATE license_machines SET is_active = TRUE, fingerprint_hash = ?, "
                            + "fingerprint_components = ?, last_seen = ? WHERE license_id = ? AND machine_id = ?")) {
                    ps.setString(1, fingerprintHash);
                    ps.setString(2, componentsJson);
                    setInstant(ps, 3, now);
                    ps.setString(4, licenseId);
                    ps.setString(5, machineId);
                    ps.executeUpdate();
                }
            } else {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO license_machines (" + MACHINE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, TRUE)")) {
                    ps.setString(1, licenseId);
                    ps.setString(2, machineId);
                    ps.setString(3, fingerprintHash);
                    ps.setString(4, componentsJson);
                    setInstant(ps, 5, now);
                    setInstant(ps, 6, now);
                    ps.executeUpdate();
                }
            }
            return MachineRegistration.ADMITTED;
        });
    }

    @Override
    public boolean deactivateMachine(String licenseId, String machineId) {
        return inTransaction("deactivate machine", c -> {
            int updated;
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE license_machines SET is_active = FALSE "
                        + "WHERE license_id = ? AND machine_id = ? AND is_active = TRUE")) {
                ps.setString(1, licenseId);
                ps.setString(2, machineId);
                updated = ps.executeUpdate();
            }
            deleteCacheEntryForLicense(c, licenseId);
            return updated > 0;
        });
    }

    @Override
    public Optional<MachineRecord> findMachine(String licenseId, String machineId) {
        return inConnection("find machine", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + MACHINE_COLUMNS + " FROM license_machines WHERE license_id = ? AND machine_id = ?")) {
                ps.setString(1, licenseId);
                ps.setString(2, machineId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(readMachine(rs)) : Optional.<MachineRecord>empty();
                }
            }
        });
    }

    @Override
    public List<MachineRecord> getMachinesForLicense(String licenseId) {
        return inConnection("list machines", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + MACHINE_COLUMNS + " FROM license_machines "
                        + "WHERE license_id = ? AND is_active = TRUE ORDER BY first_seen, machine_id")) {
                ps.setString(1, licenseId);
                List<MachineRecord> machines = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        machines.add(readMachine(rs));
                    }
                }
                return machines;
            }
        });
    }

    // ===== Usage =====

    @Override
    public int recordUsage(String licenseId, String machineId, List<String> features, LocalDate date) {
        String featuresJson = GSON.toJson(features != null ? features : List.of());
        long now = System.currentTimeMillis();
        return inTransaction("record usage", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT id FROM licenses WHERE id = ? FOR UPDATE")) {
                ps.setString(1, licenseId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new StoreException("Unknown license id: " + licenseId);
                    }
                }
            }
            int updated;
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE license_usage SET call_count = call_count + 1, features = ?, updated_at = ? "
                        + "WHERE license_id = ? AND machine_id = ? AND usage_date = ?")) {
                ps.setString(1, featuresJson);
                ps.setLong(2, now);
                ps.setString(3, licenseId);
                ps.setString(4, machineId);
                ps.setObject(5, date);
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO license_usage (license_id, machine_id, usage_date, call_count, features, updated_at) "
                            + "VALUES (?, ?, ?, 1, ?, ?)")) {
                    ps.setString(1, licenseId);
                    ps.setString(2, machineId);
                    ps.setObject(3, date);
                    ps.setString(4, featuresJson);
                    ps.setLong(5, now);
                    ps.executeUpdate();
                }
                return 1;
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT call_count FROM license_usage WHERE license_id = ? AND machine_id = ? AND usage_date = ?")) {
                ps.setString(1, licenseId);
                ps.setString(2, machineId);
                ps.setObject(3, date);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    return rs.getInt(1);
                }
            }
        });
    }

    @Override
    public int getDailyUsage(String licenseId, LocalDate date) {
        return inConnection("get daily usage", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT COALESCE(SUM(call_count), 0) FROM license_usage WHERE license_id = ? AND usage_date = ?")) {
                ps.setString(1, licenseId);
                ps.setObject(2, date);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    return rs.getInt(1);
                }
            }
        });
    }

    @Override
    public List<UsageRecord> getUsageHistory(String licenseId, LocalDate from, LocalDate to) {
        return inConnection("get usage history", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT license_id, machine_id, usage_date, call_count, features FROM license_usage "
                        + "WHERE license_id = ? AND usage_date BETWEEN ? AND ? ORDER BY usage_date, machine_id")) {
                ps.setString(1, licenseId);
                ps.setObject(2, from);
                ps.setObject(3, to);
                List<UsageRecord> rows = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        rows.add(new UsageRecord(
                            rs.getString(1),
                            rs.getString(2),
                            rs.getObject(3, LocalDate.class),
                            rs.getInt(4),
                            parseStringList(rs.getString(5))
                        ));
                    }
                }
                return rows;
            }
        });
    }

    @Override
    public int purgeUsageBefore(LocalDate cutoff) {
        int deleted = inTransaction("purge usage", c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM license_usage WHERE usage_date < ?")) {
                ps.setObject(1, cutoff);
                return ps.executeUpdate();
            }
        });
        LOG.info("Purged " + deleted + " usage rows before " + cutoff);
        return deleted;
    }

    // ===== Validation cache =====

    @Override
    public Optional<CachedValidation> getCachedValidation(String licenseKey, Instant now) {
        return inConnection("get cached validation", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT result_json, machine_ids, expires_at FROM validation_cache "
                        + "WHERE license_key = ? AND expires_at > ?")) {
                ps.setString(1, licenseKey);
                setInstant(ps, 2, now);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<CachedValidation>empty();
                    }
                    try {
                        return Optional.of(new CachedValidation(
                            GSON.fromJson(rs.getString(1), ValidationResult.class),
                            parseStringList(rs.getString(2)),
                            getInstant(rs, 3)
                        ));
                    } catch (JsonParseException e) {
                        LOG.log(Level.WARNING, "Ignoring unreadable cache entry", e);
                        return Optional.<CachedValidation>empty();
                    }
                }
            }
        });
    }

    @Override
    public boolean setCachedValidation(String licenseKey, ValidationResult result, List<String> machineIds,
                                       Duration ttl, Instant now) {
        String resultJson = GSON.toJson(result);
        String machinesJson = GSON.toJson(machineIds != null ? machineIds : List.of());
        return inTransaction("cache validation", c -> {
            LicenseStatus status = lockLicenseByKey(c, licenseKey);
            if (status != LicenseStatus.ACTIVE) {
                return false;
            }
            deleteCacheEntry(c, licenseKey);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO validation_cache (license_key, result_json, machine_ids, cached_at, expires_at) "
                        + "VALUES (?, ?, ?, ?, ?)")) {
                ps.setString(1, licenseKey);
                ps.setString(2, resultJson);
                ps.setString(3, machinesJson);
                setInstant(ps, 4, now);
                setInstant(ps, 5, now.plus(ttl));
                ps.executeUpdate();
            }
            return true;
        });
    }

    @Override
    public void invalidateCachedValidation(String licenseKey) {
        inTransaction("invalidate cached validation", c -> {
            deleteCacheEntry(c, licenseKey);
            return null;
        });
    }

    @Override
    public int cleanupExpiredCache(Instant now) {
        return inTransaction("cleanup cache", c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM validation_cache WHERE expires_at <= ?")) {
                setInstant(ps, 1, now);
                return ps.executeUpdate();
            }
        });
    }

    // ===== Users, subscriptions, webhook events =====

    @Override
    public UserRecord ensureUser(String email, String name) {
        if (email != null && !email.isBlank()) {
            Optional<UserRecord> existing = findUserByEmail(email);
            if (existing.isPresent()) {
                return existing.get();
            }
        }
        UserRecord user = new UserRecord(UUID.randomUUID().toString(),
            email != null && !email.isBlank() ? email : null, name);
        try {
            inTransaction("create user", c -> {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO users (id, email, name, created_at) VALUES (?, ?, ?, ?)")) {
                    ps.setString(1, user.id());
                    ps.setString(2, user.email());
                    ps.setString(3, user.name());
                    ps.setLong(4, System.currentTimeMillis());
                    ps.executeUpdate();
                }
                return null;
            });
            return user;
        } catch (StoreException e) {
            // Lost a race with another delivery for the same email
            if (user.email() != null && isConstraintViolation(e)) {
                return findUserByEmail(user.email()).orElseThrow(() -> e);
            }
            throw e;
        }
    }

    private Optional<UserRecord> findUserByEmail(String email) {
        return inConnection("find user", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT id, email, name FROM users WHERE email = ?")) {
                ps.setString(1, email);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next()
                        ? Optional.of(new UserRecord(rs.getString(1), rs.getString(2), rs.getString(3)))
                        : Optional.<UserRecord>empty();
                }
            }
        });
    }

    @Override
    public Optional<SubscriptionRecord> findSubscription(String subscriptionId) {
        return inConnection("find subscription", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT subscription_id, user_id, plan_id, status, expires_at, grace_period_ends, updated_at "
                        + "FROM subscriptions WHERE subscription_id = ?")) {
                ps.setString(1, subscriptionId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<SubscriptionRecord>empty();
                    }
                    return Optional.of(new SubscriptionRecord(
                        rs.getString(1),
                        rs.getString(2),
                        rs.getString(3),
                        SubscriptionState.fromDbValue(rs.getString(4)),
                        getInstant(rs, 5),
                        getInstant(rs, 6),
                        getInstant(rs, 7)
                    ));
                }
            }
        });
    }

    @Override
    public void saveSubscription(SubscriptionRecord subscription) {
        try {
            upsertSubscription(subscription);
        } catch (StoreException e) {
            if (!isConstraintViolation(e)) {
                throw e;
            }
            // Inserted concurrently; the row exists now, so this is an update
            upsertSubscription(subscription);
        }
    }

    private void upsertSubscription(SubscriptionRecord subscription) {
        inTransaction("save subscription", c -> {
            int updated;
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE subscriptions SET user_id = ?, plan_id = ?, status = ?, expires_at = ?, "
                        + "grace_period_ends = ?, updated_at = ? WHERE subscription_id = ?")) {
                bindSubscription(ps, subscription);
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO subscriptions (user_id, plan_id, status, expires_at, grace_period_ends, "
                            + "updated_at, subscription_id) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                    bindSubscription(ps, subscription);
                    ps.executeUpdate();
                }
            }
            return null;
        });
    }

    private static void bindSubscription(PreparedStatement ps, SubscriptionRecord s) throws SQLException {
        ps.setString(1, s.userId());
        ps.setString(2, s.planId());
        ps.setString(3, s.state().dbValue());
        setInstant(ps, 4, s.expiresAt());
        setInstant(ps, 5, s.gracePeriodEnds());
        setInstant(ps, 6, s.updatedAt());
        ps.setString(7, s.subscriptionId());
    }

    @Override
    public boolean claimWebhookEvent(String idempotencyKey, String eventType, String subscriptionId,
                                     String payload, Instant now) {
        try {
            inTransaction("claim webhook event", c -> {
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO webhook_events (idempotency_key, event_type, subscription_id, payload, "
                            + "received_at, claimed_at, processed) VALUES (?, ?, ?, ?, ?, ?, FALSE)")) {
                    ps.setString(1, idempotencyKey);
                    ps.setString(2, eventType);
                    ps.setString(3, subscriptionId);
                    ps.setString(4, payload);
                    setInstant(ps, 5, now);
                    setInstant(ps, 6, now);
                    ps.executeUpdate();
                }
                return null;
            });
            return true;
        } catch (StoreException e) {
            if (!isConstraintViolation(e)) {
                throw e;
            }
        }
        // Seen before: take it over only if unprocessed and its claim lease has run out
        return inTransaction("reclaim webhook event", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE webhook_events SET claimed_at = ? "
                        + "WHERE idempotency_key = ? AND processed = FALSE AND claimed_at <= ?")) {
                setInstant(ps, 1, now);
                ps.setString(2, idempotencyKey);
                setInstant(ps, 3, now.minus(WEBHOOK_CLAIM_LEASE));
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public void markWebhookProcessed(String idempotencyKey, Instant now) {
        inTransaction("mark webhook processed", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE webhook_events SET processed = TRUE, processed_at = ? WHERE idempotency_key = ?")) {
                setInstant(ps, 1, now);
                ps.setString(2, idempotencyKey);
                ps.executeUpdate();
            }
            return null;
        });
    }

    // ===== Helpers =====

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private <T> T inConnection(String operation, SqlWork<T> work) {
        try (Connection c = dataSource.getConnection()) {
            return work.run(c);
        } catch (SQLException e) {
            throw new StoreException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    /**
     * Lock a license row for the rest of the transaction.
     *
     * @return the license's status, or null if no license has this key
     */
    private static LicenseStatus lockLicenseByKey(Connection c, String licenseKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT status FROM licenses WHERE license_key = ? FOR UPDATE")) {
            ps.setString(1, licenseKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? LicenseStatus.fromDbValue(rs.getString(1)) : null;
            }
        }
    }

    private static void deleteCacheEntry(Connection c, String licenseKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM validation_cache WHERE license_key = ?")) {
            ps.setString(1, licenseKey);
            ps.executeUpdate();
        }
    }

    private static void deleteCacheEntryForLicense(Connection c, String licenseId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM validation_cache WHERE license_key IN (SELECT license_key FROM licenses WHERE id = ?)")) {
            ps.setString(1, licenseId);
            ps.executeUpdate();
        }
    }

    private static Optional<LicenseRecord> queryLicense(Connection c, String sql, String param) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new LicenseRecord(
                    rs.getString("id"),
                    rs.getString("license_key"),
                    rs.getString("user_id"),
                    Tier.valueOf(rs.getString("tier")),
                    LicenseStatus.fromDbValue(rs.getString("status")),
                    rs.getString("subscription_id"),
                    rs.getInt("max_machines"),
                    getNullableInt(rs, "daily_calls_override"),
                    getNullableInt(rs, "concurrent_sessions_override"),
                    getInstant(rs, "created_at"),
                    getInstant(rs, "expires_at"),
                    getInstant(rs, "revoked_at"),
                    rs.getString("revocation_reason")
                ));
            }
        }
    }

    private static MachineRecord readMachine(ResultSet rs) throws SQLException {
        String componentsJson = rs.getString("fingerprint_components");
        FingerprintComponents components = null;
        if (componentsJson != null) {
            try {
                components = GSON.fromJson(componentsJson, FingerprintComponents.class);
            } catch (JsonParseException e) {
                LOG.log(Level.WARNING, "Unreadable fingerprint components for machine "
                    + rs.getString("machine_id"), e);
            }
        }
        return new MachineRecord(
            rs.getString("license_id"),
            rs.getString("machine_id"),
            rs.getString("fingerprint_hash"),
            components,
            getInstant(rs, "first_seen"),
            getInstant(rs, "last_seen"),
            rs.getBoolean("is_active")
        );
    }

    private static List<String> parseStringList(String json) {
        if (json == null || json.isEmpty()) {
            return List.of();
        }
        List<String> list = GSON.fromJson(json, STRING_LIST);
        return list != null ? list : List.of();
    }

    private static boolean isConstraintViolation(StoreException e) {
        return e.getCause() instanceof SQLException sql
            && sql.getSQLState() != null
            && sql.getSQLState().startsWith("23");
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static Instant getInstant(ResultSet rs, int column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
