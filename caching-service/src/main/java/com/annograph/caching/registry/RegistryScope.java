package com.annograph.caching.registry;

/**
 * Coarse scopes under which result keys are recorded. A scope is shared by all users and all
 * result namespaces touching the same document.
 */
public final class RegistryScope {

    private static final String PREFIX = "annograph-registry:doc:";
    private static final String GENERATION_PREFIX = "annograph-registry:gen:";

    private RegistryScope() {
    }

    public static String document(long documentId) {
        return PREFIX + documentId;
    }

    public static String documentCorpus(long documentId, long corpusId) {
        return PREFIX + documentId + ":corpus:" + corpusId;
    }

    public static String documentExtract(long documentId, long extractId) {
        return PREFIX + documentId + ":extract:" + extractId;
    }

    static String generation(String scope) {
        return GENERATION_PREFIX + scope;
    }
}
