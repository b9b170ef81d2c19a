package net.vortexdevelopment.vcache.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Centralized cache key management with namespacing.
 * Keys have the form {@code namespace:part[:part...]}.
 */
public final class CacheKeys {

    public static final String USER_SESSION = "user_session";
    public static final String FORM_DATA = "form_data";
    public static final String JOB_RESULT = "job_result";
    public static final String COMPUTED_DATA = "computed";
    public static final String QUERY_RESULT = "query";
    public static final String WIDGET_STATE = "widget";
    public static final String NAVIGATION = "navigation";

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private CacheKeys() {
    }

    public static String userSession(String userId) {
        return USER_SESSION + ":" + userId;
    }

    public static String formData(String formId, String userId) {
        return FORM_DATA + ":" + formId + ":" + userId;
    }

    public static String jobResult(String jobId) {
        return JOB_RESULT + ":" + jobId;
    }

    /**
     * Key for a computed value, hashed over the function arguments.
     */
    public static String computed(String functionName, Object... args) {
        return COMPUTED_DATA + ":" + functionName + ":" + shortHash(canonicalJson(Arrays.asList(args)));
    }

    /**
     * Key for a query result, hashed over the query text and its parameters.
     */
    public static String queryResult(String query, Map<String, ?> params) {
        String paramsJson = canonicalJson(params == null ? Map.of() : new TreeMap<>(params));
        return QUERY_RESULT + ":" + shortHash(query + paramsJson);
    }

    public static String widgetState(String widgetKey, String userId) {
        return WIDGET_STATE + ":" + widgetKey + ":" + userId;
    }

    public static String navigation(String userId) {
        return NAVIGATION + ":" + userId;
    }

    public static String custom(String namespace, String... parts) {
        List<String> segments = new ArrayList<>(parts.length + 1);
        segments.add(namespace);
        segments.addAll(Arrays.asList(parts));
        return String.join(":", segments);
    }

    private static String canonicalJson(Object value) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    /**
     * First 8 hex characters of the MD5 digest.
     */
    static String shortHash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (int i = 0; i < 4; i++) {
                hex.append(String.format("%02x", hash[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
