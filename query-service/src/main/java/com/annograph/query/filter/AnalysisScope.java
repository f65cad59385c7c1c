package com.annograph.query.filter;

/**
 * Analysis dimension of a filter. A request id of 0 means human-authored rows only.
 */
public record AnalysisScope(Kind kind, Long analysisId) {

    public enum Kind {
        ANY,
        HUMAN_ONLY,
        SPECIFIC
    }

    private static final AnalysisScope ANY_ANALYSIS = new AnalysisScope(Kind.ANY, null);
    private static final AnalysisScope HUMAN = new AnalysisScope(Kind.HUMAN_ONLY, null);

    public AnalysisScope {
        if (kind == null) {
            throw new IllegalArgumentException("analysis scope kind is required");
        }
        if (kind == Kind.SPECIFIC && (analysisId == null || analysisId <= 0)) {
            throw new IllegalArgumentException("specific analysis scope needs a positive id");
        }
        if (kind != Kind.SPECIFIC) {
            analysisId = null;
        }
    }

    public static AnalysisScope any() {
        return ANY_ANALYSIS;
    }

    public static AnalysisScope humanOnly() {
        return HUMAN;
    }

    public static AnalysisScope specific(long analysisId) {
        return new AnalysisScope(Kind.SPECIFIC, analysisId);
    }

    public static AnalysisScope fromRequest(Long analysisId) {
        if (analysisId == null) {
            return ANY_ANALYSIS;
        }
        if (analysisId < 0) {
            throw new IllegalArgumentException("analysisId must not be negative: " + analysisId);
        }
        return analysisId == 0L ? HUMAN : specific(analysisId);
    }

    public String label() {
        switch (kind) {
            case HUMAN_ONLY:
                return "human";
            case SPECIFIC:
                return String.valueOf(analysisId);
            default:
                return "any";
        }
    }
}
