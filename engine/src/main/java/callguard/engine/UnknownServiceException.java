package callguard.engine;

import java.util.Collection;

/**
 * A service name that was not configured on the {@link RateLimiter}.
 * This is a usage error, never a silent no-op.
 */
public class UnknownServiceException extends IllegalArgumentException {

    private final String service;

    public UnknownServiceException(String service, Collection<String> knownServices) {
        super("Unknown service: " + service + ". Known services: " + knownServices);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
