package io.surfworks.gatekeeper.client;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Client configuration resolved from the environment and the command line.
 *
 * <p>Environment variables:
 * <ul>
 *   <li>{@code GATEKEEPER_LICENSE_KEY} - license key to activate when none is configured</li>
 *   <li>{@code GATEKEEPER_SERVER_URL} - license server base URL; unset means offline</li>
 *   <li>{@code GATEKEEPER_CONFIG_DIR} - config directory (else {@code $XDG_CONFIG_HOME/gatekeeper},
 *       else {@code ~/.config/gatekeeper})</li>
 *   <li>{@code GATEKEEPER_ENVIRONMENT} - deployment environment, {@code production} when unset</li>
 *   <li>{@code GATEKEEPER_ENFORCEMENT_DISABLED} - request to turn gating off; honoured
 *       only outside production</li>
 * </ul>
 *
 * <p>{@code --license KEY} (or {@code --license=KEY}) on the command line takes
 * precedence over {@code GATEKEEPER_LICENSE_KEY}.
 *
 * @param licenseKey externally supplied license key, or null
 * @param serverUrl license server base URL, or null for offline operation
 * @param configDir directory holding {@code config.json}
 * @param environment deployment environment name (lower case)
 * @param enforcementDisabled whether disabling enforcement was requested
 * @param clientVersion version reported to the license server
 */
public record ClientSettings(
    String licenseKey,
    String serverUrl,
    Path configDir,
    String environment,
    boolean enforcementDisabled,
    String clientVersion
) {

    public static final String ENV_LICENSE_KEY = "GATEKEEPER_LICENSE_KEY";
    public static final String ENV_SERVER_URL = "GATEKEEPER_SERVER_URL";
    public static final String ENV_CONFIG_DIR = "GATEKEEPER_CONFIG_DIR";
    public static final String ENV_ENVIRONMENT = "GATEKEEPER_ENVIRONMENT";
    public static final String ENV_ENFORCEMENT_DISABLED = "GATEKEEPER_ENFORCEMENT_DISABLED";

    public static final String PRODUCTION = "production";
    public static final String CLIENT_VERSION = "0.1.0";

    private static final String APP_DIR = "gatekeeper";

    public ClientSettings {
        if (configDir == null) {
            throw new IllegalArgumentException("configDir cannot be null");
        }
        environment = environment == null || environment.isBlank()
            ? PRODUCTION
            : environment.trim().toLowerCase(Locale.ROOT);
        if (clientVersion == null || clientVersion.isBlank()) {
            clientVersion = CLIENT_VERSION;
        }
    }

    /**
     * Production settings with no key and no server, rooted at {@code configDir}.
     */
    public static ClientSettings defaults(Path configDir) {
        return new ClientSettings(null, null, configDir, PRODUCTION, false, CLIENT_VERSION);
    }

    /**
     * Settings from the process environment, with no command-line arguments.
     */
    public static ClientSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), new String[0]);
    }

    /**
     * Resolve settings from environment variables and command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --license} is given without a value
     */
    public static ClientSettings fromEnvironment(Map<String, String> env, String[] args) {
        String licenseKey = blankToNull(env.get(ENV_LICENSE_KEY));
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--license")) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--license requires a value");
                }
                licenseKey = blankToNull(args[++i]);
            } else if (arg.startsWith("--license=")) {
                licenseKey = blankToNull(arg.substring("--license=".length()));
            }
        }

        return new ClientSettings(
            licenseKey != null ? licenseKey.trim() : null,
            blankToNull(env.get(ENV_SERVER_URL)),
            resolveConfigDir(env),
            env.get(ENV_ENVIRONMENT),
            isTrue(env.get(ENV_ENFORCEMENT_DISABLED)),
            CLIENT_VERSION
        );
    }

    public boolean isProduction() {
        return PRODUCTION.equals(environment);
    }

    /**
     * Whether feature gating is actually turned off: requested and not in production.
     */
    public boolean bypassEnforcement() {
        return enforcementDisabled && !isProduction();
    }

    public ClientSettings withServerUrl(String url) {
        return new ClientSettings(licenseKey, url, configDir, environment, enforcementDisabled, clientVersion);
    }

    public ClientSettings withLicenseKey(String key) {
        return new ClientSettings(key, serverUrl, configDir, environment, enforcementDisabled, clientVersion);
    }

    public ClientSettings withEnforcementDisabled(String env, boolean disabled) {
        return new ClientSettings(licenseKey, serverUrl, configDir, env, disabled, clientVersion);
    }

    static Path resolveConfigDir(Map<String, String> env) {
        String explicit = blankToNull(env.get(ENV_CONFIG_DIR));
        if (explicit != null) {
            return Path.of(explicit);
        }
        String configHome = blankToNull(env.get("XDG_CONFIG_HOME"));
        if (configHome != null) {
            return Path.of(configHome, APP_DIR);
        }
        return Path.of(System.getProperty("user.home"), ".config", APP_DIR);
    }

    private static boolean isTrue(String value) {
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
