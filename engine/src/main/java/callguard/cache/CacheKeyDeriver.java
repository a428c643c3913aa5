package callguard.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Derives cache keys from (endpoint, params).
 *
 * Key material is {@code endpoint ":" json(params)}, with {@code ":" bucket} appended for
 * live endpoints, hashed with SHA-256. The JSON is canonical: map entries and bean
 * properties are sorted at every level, so parameter order never changes the key.
 */
final class CacheKeyDeriver {

    private static final ObjectMapper CANONICAL_JSON = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .build();

    private final TtlPolicy policy;
    private final long bucketWidthNanos;

    CacheKeyDeriver(TtlPolicy policy) {
        this.policy = policy;
        this.bucketWidthNanos = policy.liveBucketWidth().toNanos();
    }

    String keyFor(String endpoint, Map<String, ?> params, long nowNanos) {
        StringBuilder material = new StringBuilder(endpoint)
            .append(':')
            .append(canonicalParams(params));
        if (policy.isLive(endpoint)) {
            material.append(':').append(bucketOf(nowNanos));
        }
        return sha256Hex(material.toString());
    }

    long bucketOf(long nowNanos) {
        return Math.floorDiv(nowNanos, bucketWidthNanos);
    }

    static String canonicalParams(Map<String, ?> params) {
        try {
            return CANONICAL_JSON.writeValueAsString(params == null ? Map.of() : params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("params cannot be serialized for a cache key", e);
        }
    }

    private static String sha256Hex(String material) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
