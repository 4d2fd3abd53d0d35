package io.surfworks.gatekeeper.server.http;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.surfworks.gatekeeper.core.api.ValidationRequest;
import io.surfworks.gatekeeper.core.api.ValidationResult;
import io.surfworks.gatekeeper.core.json.GatekeeperJson;
import io.surfworks.gatekeeper.core.security.HmacSigner;
import io.surfworks.gatekeeper.core.security.IntegrityException;
import io.surfworks.gatekeeper.core.security.SecurityEvents;
import io.surfworks.gatekeeper.core.tier.Tier;
import io.surfworks.gatekeeper.server.authority.GenerateRequest;
import io.surfworks.gatekeeper.server.authority.LicenseAuthority;
import io.surfworks.gatekeeper.server.authority.LicenseUsageReport;
import io.surfworks.gatekeeper.server.store.LicenseRecord;
import io.surfworks.gatekeeper.server.subscription.SubscriptionSync;
import io.surfworks.gatekeeper.server.subscription.SyncOutcome;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-over-HTTP surface for the license authority.
 *
 * <p>Routes:
 * <ul>
 *   <li>{@code GET  /api/health}</li>
 *   <li>{@code POST /api/validate-license} (rate limited per client address)</li>
 *   <li>{@code POST /api/generate-license} (admin)</li>
 *   <li>{@code POST /api/revoke-license} (admin)</li>
 *   <li>{@code GET  /api/license-usage?key=...} (admin)</li>
 *   <li>{@code POST /api/webhooks/subscription}</li>
 * </ul>
 *
 * <p>Admin requests carry {@value #TIMESTAMP_HEADER} (epoch millis) and
 * {@value #SIGNATURE_HEADER}, an {@link HmacSigner} signature over the body
 * (POST) or the raw query string (GET). Webhooks carry
 * {@value #WEBHOOK_SIGNATURE_HEADER}.
 *
 * <p>This class only marshals requests; all decisions are made by
 * {@link LicenseAuthority} and {@link SubscriptionSync}.
 */
public class LicenseHttpServer {

    private static final Logger LOG = Logger.getLogger(LicenseHttpServer.class.getName());

    public static final String TIMESTAMP_HEADER = "X-Gatekeeper-Timestamp";
    public static final String SIGNATURE_HEADER = "X-Gatekeeper-Signature";
    public static final String WEBHOOK_SIGNATURE_HEADER = "X-Webhook-Signature";

    private static final int MAX_BODY_BYTES = 64 * 1024;
    private static final Gson GSON = GatekeeperJson.compact();

    private final LicenseAuthority authority;
    private final SubscriptionSync subscriptions;
    private final HmacSigner adminSigner;
    private final RequestRateLimiter validationLimiter;
    private final String version;
    private final HttpServer server;
    private final ExecutorService executor;

    public LicenseHttpServer(InetSocketAddress address, LicenseAuthority authority,
                             SubscriptionSync subscriptions, HmacSigner adminSigner,
                             String version) throws IOException {
        this(address, authority, subscriptions, adminSigner, RequestRateLimiter.forValidation(), version);
    }

    public LicenseHttpServer(InetSocketAddress address, LicenseAuthority authority,
                             SubscriptionSync subscriptions, HmacSigner adminSigner,
                             RequestRateLimiter validationLimiter, String version) throws IOException {
        this.authority = authority;
        this.subscriptions = subscriptions;
        this.adminSigner = adminSigner;
        this.validationLimiter = validationLimiter;
        this.version = version;
        this.server = HttpServer.create(address, 0);
        this.executor = Executors.newFixedThreadPool(
            Math.max(4, Runtime.getRuntime().availableProcessors()), new HandlerThreadFactory());
        server.setExecutor(executor);

        route("/api/health", "GET", this::health);
        route("/api/validate-license", "POST", this::validate);
        route("/api/generate-license", "POST", this::generate);
        route("/api/revoke-license", "POST", this::revoke);
        route("/api/license-usage", "GET", this::usage);
        route("/api/webhooks/subscription", "POST", this::webhook);
    }

    public void start() {
        server.start();
        LOG.info("License API listening on " + server.getAddress());
    }

    /**
     * Stop accepting requests, giving in-flight ones up to a second to finish.
     */
    public void stop() {
        server.stop(1);
        executor.shutdownNow();
        LOG.info("License API stopped");
    }

    /**
     * The bound port (useful when started on port 0).
     */
    public int port() {
        return server.getAddress().getPort();
    }

    // ===== Handlers =====

    private Response health(HttpExchange exchange, byte[] body) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", "healthy");
        out.put("timestamp", Instant.now().toString());
        out.put("version", version);
        return Response.ok(out);
    }

    private Response validate(HttpExchange exchange, byte[] body) {
        String remote = exchange.getRemoteAddress().getAddress().getHostAddress();
        if (!validationLimiter.tryAcquire(remote)) {
            LOG.warning("Validation rate limit exceeded for " + remote);
            exchange.getResponseHeaders().set("Retry-After",
                Long.toString(validationLimiter.retryAfterSeconds(remote)));
            return Response.error(429, "License validation rate limit exceeded", "RATE_LIMITED");
        }
        JsonObject json = parseObject(body);
        String licenseKey = requireString(json, "licenseKey");
        String machineId = requireString(json, "machineId");
        List<String> features = new ArrayList<>();
        if (json.has("features") && !json.get("features").isJsonNull()) {
            if (!json.get("features").isJsonArray()) {
                throw new BadRequestException("features must be an array");
            }
            JsonArray array = json.getAsJsonArray("features");
            for (JsonElement element : array) {
                if (!element.isJsonPrimitive()) {
                    throw new BadRequestException("features must be an array of strings");
                }
                features.add(element.getAsString());
            }
        }
        ValidationRequest request = new ValidationRequest(
            licenseKey, machineId, features,
            optionalString(json, "version"),
            optionalString(json, "platform"),
            optionalString(json, "arch")
        );
        ValidationResult result = authority.validateLicense(request);
        return Response.ok(result);
    }

    private Response generate(HttpExchange exchange, byte[] body) throws IntegrityException {
        verifyAdmin(exchange, new String(body, StandardCharsets.UTF_8));
        JsonObject json = parseObject(body);
        String userId = requireString(json, "userId");
        Tier tier;
        try {
            tier = Tier.valueOf(requireString(json, "tier"));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("tier must be one of FREE, PRO, ENTERPRISE");
        }
        Instant expiresAt = null;
        String expires = optionalString(json, "expiresAt");
        if (expires != null) {
            try {
                expiresAt = Instant.parse(expires);
            } catch (DateTimeParseException e) {
                throw new BadRequestException("expiresAt must be an ISO-8601 instant");
            }
        }
        Integer dailyCalls = null;
        Integer concurrentSessions = null;
        if (json.has("customLimits") && json.get("customLimits").isJsonObject()) {
            JsonObject limits = json.getAsJsonObject("customLimits");
            dailyCalls = optionalInt(limits, "dailyCalls");
            concurrentSessions = optionalInt(limits, "concurrentSessions");
        }

        LicenseRecord license = authority.generateLicense(new GenerateRequest(
            userId, tier, optionalString(json, "subscriptionId"), expiresAt,
            optionalInt(json, "maxMachines"), dailyCalls, concurrentSessions));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("licenseKey", license.licenseKey());
        out.put("tier", license.tier());
        out.put("expiresAt", license.expiresAt());
        out.put("maxMachines", license.maxMachines());
        return Response.ok(out);
    }

    private Response revoke(HttpExchange exchange, byte[] body) throws IntegrityException {
        verifyAdmin(exchange, new String(body, StandardCharsets.UTF_8));
        JsonObject json = parseObject(body);
        String licenseKey = requireString(json, "licenseKey");
        if (!authority.revokeLicense(licenseKey, optionalString(json, "reason"))) {
            return Response.error(404, "License not found", "LICENSE_NOT_FOUND");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("message", "License revoked successfully");
        return Response.ok(out);
    }

    private Response usage(HttpExchange exchange, byte[] body) throws IntegrityException {
        String rawQuery = exchange.getRequestURI().getRawQuery();
        verifyAdmin(exchange, rawQuery != null ? rawQuery : "");
        String key = queryParam(rawQuery, "key");
        if (key == null || key.isBlank()) {
            throw new BadRequestException("key query parameter is required");
        }
        Optional<LicenseUsageReport> report = authority.getLicenseUsage(key);
        if (report.isEmpty()) {
            return Response.error(404, "License not found", "LICENSE_NOT_FOUND");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("usage", report.get());
        return Response.ok(out);
    }

    private Response webhook(HttpExchange exchange, byte[] body) throws IntegrityException {
        String signature = exchange.getRequestHeaders().getFirst(WEBHOOK_SIGNATURE_HEADER);
        SyncOutcome outcome;
        try {
            outcome = subscriptions.handleWebhook(body, signature);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("outcome", outcome);
        return Response.ok(out);
    }

    // ===== Plumbing =====

    @FunctionalInterface
    private interface Handler {
        Response handle(HttpExchange exchange, byte[] body) throws IntegrityException;
    }

    private record Response(int status, Object body) {
        static Response ok(Object body) {
            return new Response(200, body);
        }

        static Response error(int status, String message, String code) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("success", false);
            out.put("error", message);
            out.put("code", code);
            return new Response(status, out);
        }
    }

    private static final class BadRequestException extends RuntimeException {
        BadRequestException(String message) {
            super(message);
        }
    }

    private void route(String path, String method, Handler handler) {
        server.createContext(path, exchange -> {
            Response response;
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    response = Response.error(404, "Not found", "NOT_FOUND");
                } else if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    response = Response.error(405, "Method not allowed", "METHOD_NOT_ALLOWED");
                } else {
                    response = handler.handle(exchange, readBody(exchange.getRequestBody()));
                }
            } catch (BadRequestException e) {
                response = Response.error(400, e.getMessage(), "INVALID_REQUEST");
            } catch (IntegrityException e) {
                response = Response.error(401, "Signature verification failed", "UNAUTHORIZED");
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Request to " + path + " failed", e);
                response = Response.error(500, "Internal server error", "INTERNAL_ERROR");
            }
            send(exchange, response);
        });
    }

    private void verifyAdmin(HttpExchange exchange, String payload) throws IntegrityException {
        String timestamp = exchange.getRequestHeaders().getFirst(TIMESTAMP_HEADER);
        String signature = exchange.getRequestHeaders().getFirst(SIGNATURE_HEADER);
        try {
            long ts;
            try {
                ts = timestamp != null ? Long.parseLong(timestamp.trim()) : 0L;
            } catch (NumberFormatException e) {
                throw new IntegrityException(IntegrityException.Reason.STALE_TIMESTAMP,
                    "Unparseable request timestamp");
            }
            adminSigner.verifyRequest(payload, ts, signature);
        } catch (IntegrityException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("path", exchange.getRequestURI().getPath());
            details.put("reason", e.getReason());
            details.put("remote", exchange.getRemoteAddress());
            SecurityEvents.record("admin_request_rejected", SecurityEvents.Severity.HIGH, details);
            throw e;
        }
    }

    private static void send(HttpExchange exchange, Response response) throws IOException {
        byte[] bytes = GSON.toJson(response.body()).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static byte[] readBody(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        int n;
        while ((n = in.read(chunk)) != -1) {
            if (buffer.size() + n > MAX_BODY_BYTES) {
                throw new BadRequestException("Request body too large");
            }
            buffer.write(chunk, 0, n);
        }
        return buffer.toByteArray();
    }

    private static JsonObject parseObject(byte[] body) {
        try {
            JsonElement parsed = JsonParser.parseString(new String(body, StandardCharsets.UTF_8));
            if (!parsed.isJsonObject()) {
                throw new BadRequestException("Request body must be a JSON object");
            }
            return parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new BadRequestException("Invalid JSON: " + e.getMessage());
        }
    }

    private static String requireString(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new BadRequestException(field + " is required");
        }
        return value.getAsString();
    }

    private static String optionalString(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive()) {
            throw new BadRequestException(field + " must be a string");
        }
        return value.getAsString();
    }

    private static Integer optionalInt(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        try {
            return value.getAsInt();
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            throw new BadRequestException(field + " must be an integer");
        }
    }

    private static String queryParam(String rawQuery, String name) {
        if (rawQuery == null) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                return eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
            }
        }
        return null;
    }

    private static final class HandlerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "gatekeeper-http-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
