package io.surfworks.gatekeeper.core.security;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Audit log for security-relevant events (bad signatures, stale webhooks,
 * fingerprint mismatches, enforcement bypass).
 *
 * <p>Events go to a dedicated logger so deployments can route them separately.
 */
public final class SecurityEvents {

    public static final String LOGGER_NAME = "io.surfworks.gatekeeper.security";

    private static final Logger LOG = Logger.getLogger(LOGGER_NAME);

    public enum Severity {
        LOW(Level.INFO),
        MEDIUM(Level.WARNING),
        HIGH(Level.WARNING),
        CRITICAL(Level.SEVERE);

        private final Level level;

        Severity(Level level) {
            this.level = level;
        }
    }

    private SecurityEvents() {}

    public static void record(String event, Severity severity, Map<String, ?> details) {
        if (!LOG.isLoggable(severity.level)) {
            return;
        }
        String rendered = details.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
        LOG.log(severity.level, "[SECURITY-" + severity + "] " + event + " {" + rendered + "}");
    }
}
