package callguard.guard;

/**
 * Endpoint path checks applied before an endpoint reaches the cache or a provider.
 */
public final class Endpoints {

    private Endpoints() {
        // Utility class, no instantiation
    }

    /**
     * Rejects path traversal and returns the path with a leading slash.
     *
     * @throws IllegalArgumentException if the endpoint is blank or contains {@code ..} or a backslash
     */
    public static String sanitize(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be blank");
        }
        if (endpoint.contains("..") || endpoint.contains("\\")) {
            throw new IllegalArgumentException("Invalid endpoint: path traversal detected");
        }
        return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
    }
}
