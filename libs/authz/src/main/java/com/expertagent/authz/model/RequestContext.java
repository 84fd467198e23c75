package com.expertagent.authz.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-level facts available to conditions under the {@code context.} root.
 *
 * @param activeOrgId organization the caller is currently working in (nullable)
 * @param ipAddress   caller address (nullable)
 * @param userAgent   caller user agent (nullable)
 * @param timestamp   request time (nullable)
 * @param environment deployment environment, e.g. "production" (nullable)
 */
public record RequestContext(
        String activeOrgId,
        String ipAddress,
        String userAgent,
        Instant timestamp,
        String environment
) {

    private static final RequestContext EMPTY = new RequestContext(null, null, null, null, null);

    public static RequestContext empty() {
        return EMPTY;
    }

    public static RequestContext forEnvironment(String environment) {
        return new RequestContext(null, null, null, null, environment);
    }

    /**
     * Exposes the populated fields as a condition attribute map. Null fields are left out so that
     * conditions see them as absent.
     */
    public Map<String, Object> asAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, "activeOrgId", activeOrgId);
        putIfPresent(attributes, "ipAddress", ipAddress);
        putIfPresent(attributes, "userAgent", userAgent);
        putIfPresent(attributes, "timestamp", timestamp == null ? null : timestamp.toString());
        putIfPresent(attributes, "environment", environment);
        return attributes;
    }

    private static void putIfPresent(Map<String, Object> attributes, String key, Object value) {
        if (value != null) {
            attributes.put(key, value);
        }
    }
}
