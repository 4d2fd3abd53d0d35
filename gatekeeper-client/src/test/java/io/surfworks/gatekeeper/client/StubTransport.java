package io.surfworks.gatekeeper.client;

import io.surfworks.gatekeeper.core.api.LicenseTransport;
import io.surfworks.gatekeeper.core.api.TransportException;
import io.surfworks.gatekeeper.core.api.ValidationRequest;
import io.surfworks.gatekeeper.core.api.ValidationResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Transport returning a fixed answer, or failing, and recording requests.
 */
final class StubTransport implements LicenseTransport {

    private volatile ValidationResult answer;
    private volatile TransportException failure;
    final List<ValidationRequest> requests = new CopyOnWriteArrayList<>();

    void answer(ValidationResult result) {
        this.answer = result;
        this.failure = null;
    }

    void fail(String message) {
        this.failure = new TransportException(message);
    }

    @Override
    public ValidationResult validate(ValidationRequest request) throws TransportException {
        requests.add(request);
        if (failure != null) {
            throw failure;
        }
        if (answer == null) {
            throw new TransportException("no answer configured");
        }
        return answer;
    }

    @Override
    public String getName() {
        return "Stub";
    }
}
