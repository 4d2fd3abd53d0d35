package io.surfworks.gatekeeper.server;

import io.surfworks.gatekeeper.core.security.FingerprintHasher;
import io.surfworks.gatekeeper.core.security.HmacSigner;
import io.surfworks.gatekeeper.core.security.WebhookVerifier;
import io.surfworks.gatekeeper.core.tier.TierTable;
import io.surfworks.gatekeeper.server.authority.LicenseAuthority;
import io.surfworks.gatekeeper.server.config.ServerSettings;
import io.surfworks.gatekeeper.server.config.ServerSettingsLoader;
import io.surfworks.gatekeeper.server.http.LicenseHttpServer;
import io.surfworks.gatekeeper.server.http.RequestRateLimiter;
import io.surfworks.gatekeeper.server.store.JdbcLicenseStore;
import io.surfworks.gatekeeper.server.subscription.SubscriptionSync;
import org.h2.jdbcx.JdbcConnectionPool;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * License server entry point.
 *
 * <p>Usage:
 * <pre>
 * gatekeeper-server [--port 8787] [--config server.json]
 * </pre>
 *
 * <p>Wires the JDBC store, license authority, subscription sync and HTTP
 * surface together, and runs two housekeeping jobs: expired cache cleanup
 * and daily usage retention.
 */
public final class GatekeeperServer implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(GatekeeperServer.class.getName());

    public static final String VERSION = "0.1.0";

    private final JdbcConnectionPool pool;
    private final LicenseAuthority authority;
    private final LicenseHttpServer http;
    private final ScheduledExecutorService housekeeping;

    private GatekeeperServer(JdbcConnectionPool pool, LicenseAuthority authority,
                             LicenseHttpServer http, ScheduledExecutorService housekeeping) {
        this.pool = pool;
        this.authority = authority;
        this.http = http;
        this.housekeeping = housekeeping;
    }

    public static void main(String[] args) {
        configureLogging();
        try {
            ServerArgs parsed = parseArgs(args);
            ServerSettings settings = ServerSettingsLoader.load(parsed.configFile());
            if (parsed.port() != null) {
                settings = settings.withPort(parsed.port());
            }

            GatekeeperServer server = start(settings);
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.close();
                stopped.countDown();
            }, "gatekeeper-shutdown"));
            stopped.await();
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Run with --help for usage.");
            System.exit(2);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "License server failed to start", e);
            System.exit(1);
        }
    }

    /**
     * Start a server with the given settings.
     *
     * @throws IOException if the HTTP port cannot be bound
     */
    public static GatekeeperServer start(ServerSettings settings) throws IOException {
        LOG.info("Starting Gatekeeper license server " + VERSION + " with " + settings);

        JdbcConnectionPool pool = JdbcConnectionPool.create(settings.dbUrl(), settings.dbUser(), settings.dbPassword());
        JdbcLicenseStore store = new JdbcLicenseStore(pool);
        store.initializeSchema();

        Clock clock = Clock.systemUTC();
        LicenseAuthority authority = new LicenseAuthority(
            store, TierTable.standard(), new FingerprintHasher(settings.fingerprintSecret(), clock),
            clock, settings.cacheTtl());
        SubscriptionSync sync = new SubscriptionSync(store, authority, new WebhookVerifier(settings.webhookSecret()));

        LicenseHttpServer http = new LicenseHttpServer(
            new InetSocketAddress(settings.host(), settings.port()),
            authority, sync, new HmacSigner(settings.adminSecret()),
            new RequestRateLimiter(settings.validationsPerMinute(), Duration.ofMinutes(1)), VERSION);

        ScheduledExecutorService housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gatekeeper-housekeeping");
            t.setDaemon(true);
            return t;
        });
        long cleanupSeconds = settings.cacheCleanupInterval().toSeconds();
        housekeeping.scheduleAtFixedRate(() -> runQuietly("cache cleanup", authority::cleanupExpiredCache),
            cleanupSeconds, cleanupSeconds, TimeUnit.SECONDS);
        housekeeping.scheduleAtFixedRate(() -> runQuietly("usage retention", () -> authority.purgeUsageBefore(
                LocalDate.now(ZoneOffset.UTC).minusDays(settings.usageRetentionDays()))),
            1, TimeUnit.DAYS.toMinutes(1), TimeUnit.MINUTES);

        http.start();
        return new GatekeeperServer(pool, authority, http, housekeeping);
    }

    public int port() {
        return http.port();
    }

    public LicenseAuthority authority() {
        return authority;
    }

    @Override
    public void close() {
        LOG.info("Stopping Gatekeeper license server");
        http.stop();
        housekeeping.shutdownNow();
        pool.dispose();
    }

    private static void runQuietly(String job, Runnable task) {
        // A throwing task would cancel its schedule
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Housekeeping job '" + job + "' failed", e);
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = GatekeeperServer.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }

    private record ServerArgs(Integer port, Path configFile) {}

    private static ServerArgs parseArgs(String[] args) {
        Integer port = null;
        Path configFile = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port", "-p" -> {
                    if (++i >= args.length) throw new IllegalArgumentException("Missing value for --port");
                    try {
                        port = Integer.parseInt(args[i]);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--port must be a number: " + args[i]);
                    }
                }
                case "--config", "-c" -> {
                    if (++i >= args.length) throw new IllegalArgumentException("Missing value for --config");
                    configFile = Path.of(args[i]);
                }
                case "--version", "-v" -> {
                    System.out.println("gatekeeper-server " + VERSION);
                    System.exit(0);
                }
                case "--help", "-h" -> {
                    printUsage();
                    System.exit(0);
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        return new ServerArgs(port, configFile);
    }

    private static void printUsage() {
        System.out.println("Gatekeeper License Server " + VERSION);
        System.out.println();
        System.out.println("Usage: gatekeeper-server [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --port, -p <port>     HTTP port (default: " + ServerSettings.DEFAULT_PORT + ")");
        System.out.println("  --config, -c <file>   JSON settings file");
        System.out.println("  --version, -v         Print version and exit");
        System.out.println("  --help, -h            Show this help");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  " + ServerSettingsLoader.ENV_DB_URL + "                 JDBC URL of the license database");
        System.out.println("  " + ServerSettingsLoader.ENV_PORT + "                   HTTP port");
        System.out.println("  " + ServerSettingsLoader.ENV_FINGERPRINT_SECRET + "     Machine fingerprint key");
        System.out.println("  " + ServerSettingsLoader.ENV_WEBHOOK_SECRET + "         Payment webhook secret");
        System.out.println("  " + ServerSettingsLoader.ENV_ADMIN_SECRET + "           Admin request signing secret");
    }
}
