package com.annograph.caching.key;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Builds per-user result cache keys.
 *
 * <p>Every key carries the document id in clear text, so a document-wide pattern delete still
 * reaches keys whose filter part had to be hashed. The user part is always included in the
 * hashed material; two users never share a key.</p>
 */
@Component
public class CacheKeyBuilder {

    public static final String KEY_PREFIX = "annograph";
    private static final int MIN_KEY_LENGTH = 64;

    private final int maxKeyLength;

    public CacheKeyBuilder(@Value("${annograph.cache.max-key-length:200}") int maxKeyLength) {
        this.maxKeyLength = Math.max(MIN_KEY_LENGTH, maxKeyLength);
    }

    public String scopeKey(String namespace, long documentId, Map<String, String> dimensions, String userKey) {
        if (userKey == null || userKey.isBlank()) {
            throw new IllegalArgumentException("cache keys require a user identity");
        }
        String documentPrefix = documentPrefix(namespace, documentId);
        StringBuilder key = new StringBuilder(documentPrefix);
        for (Map.Entry<String, String> dimension : dimensions.entrySet()) {
            key.append(':').append(dimension.getKey()).append(':').append(normalize(dimension.getValue()));
        }
        key.append(":user:").append(userKey);
        String full = key.toString();
        if (full.length() <= maxKeyLength) {
            return full;
        }
        return documentPrefix + ":h:" + sha256(full);
    }

    /**
     * Glob matching every result key of a document across all namespaces.
     */
    public static String documentPattern(long documentId) {
        return KEY_PREFIX + ":*:doc:" + documentId + ":*";
    }

    public int maxKeyLength() {
        return maxKeyLength;
    }

    private static String documentPrefix(String namespace, long documentId) {
        return KEY_PREFIX + ":" + namespace + ":doc:" + documentId;
    }

    private static String normalize(String value) {
        return value == null ? "-" : value;
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
