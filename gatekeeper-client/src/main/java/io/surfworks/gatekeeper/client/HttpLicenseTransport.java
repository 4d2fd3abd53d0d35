package io.surfworks.gatekeeper.client;

import com.google.gson.Gson;
import io.surfworks.gatekeeper.core.api.LicenseTransport;
import io.surfworks.gatekeeper.core.api.TransportException;
import io.surfworks.gatekeeper.core.api.ValidationRequest;
import io.surfworks.gatekeeper.core.api.ValidationResult;
import io.surfworks.gatekeeper.core.json.GatekeeperJson;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Validates licenses against a license server over HTTP.
 *
 * <p>Posts the request as JSON to {@code <baseUrl>/api/validate-license}. Any
 * answer other than a well-formed HTTP 200 result is a {@link TransportException}.
 */
public class HttpLicenseTransport implements LicenseTransport {

    private static final Logger LOG = Logger.getLogger(HttpLicenseTransport.class.getName());

    public static final String VALIDATE_PATH = "/api/validate-license";

    private static final Duration TIMEOUT = Duration.ofSeconds(15);
    private static final Gson GSON = GatekeeperJson.compact();

    private final URI validateUri;
    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpLicenseTransport(String baseUrl) {
        this(baseUrl, TIMEOUT);
    }

    public HttpLicenseTransport(String baseUrl, Duration timeout) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    HttpLicenseTransport(String baseUrl, HttpClient httpClient, Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be empty");
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.validateUri = URI.create(base + VALIDATE_PATH);
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override
    public ValidationResult validate(ValidationRequest request) throws TransportException {
        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(validateUri)
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(GSON.toJson(request)))
            .timeout(timeout)
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("Network error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request interrupted", e);
        }

        int status = response.statusCode();
        if (status != 200) {
            LOG.fine("License server answered HTTP " + status + ": " + response.body());
            throw new TransportException("License validation failed (HTTP " + status + ")");
        }
        return parse(response.body());
    }

    @Override
    public String getName() {
        return "HTTP (" + validateUri.getHost() + ")";
    }

    private static ValidationResult parse(String body) throws TransportException {
        ValidationResult result;
        try {
            result = GSON.fromJson(body, ValidationResult.class);
        } catch (RuntimeException e) {
            throw new TransportException("Failed to parse response: " + e.getMessage(), e);
        }
        if (result == null || result.tier() == null || result.limits() == null) {
            throw new TransportException("Invalid response format");
        }
        return result;
    }
}
