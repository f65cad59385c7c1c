package com.annograph.query.filter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Optional filter dimensions shared by annotation and relationship retrieval. An empty page
 * collection means no page restriction.
 */
public record FilterSet(
        Long corpusId,
        Set<Integer> pages,
        Tristate structural,
        AnalysisScope analysis,
        Long extractId,
        boolean strictExtractMode
) {

    public FilterSet {
        pages = pages == null || pages.isEmpty() ? null : Collections.unmodifiableSet(new TreeSet<>(pages));
        structural = structural == null ? Tristate.UNSET : structural;
        analysis = analysis == null ? AnalysisScope.any() : analysis;
    }

    public static FilterSet none() {
        return new FilterSet(null, null, Tristate.UNSET, AnalysisScope.any(), null, false);
    }

    public static FilterSet of(
            Long corpusId,
            Collection<Integer> pages,
            Boolean structural,
            Long analysisId,
            Long extractId
    ) {
        return of(corpusId, pages, structural, analysisId, extractId, false);
    }

    public static FilterSet of(
            Long corpusId,
            Collection<Integer> pages,
            Boolean structural,
            Long analysisId,
            Long extractId,
            boolean strictExtractMode
    ) {
        return new FilterSet(
                corpusId,
                pages == null ? null : new TreeSet<>(pages),
                Tristate.of(structural),
                AnalysisScope.fromRequest(analysisId),
                extractId,
                strictExtractMode
        );
    }

    public FilterSet withCorpus(Long corpus) {
        return new FilterSet(corpus, pages, structural, analysis, extractId, strictExtractMode);
    }

    public FilterSet withStructural(Tristate value) {
        return new FilterSet(corpusId, pages, value, analysis, extractId, strictExtractMode);
    }

    public FilterSet withAnalysis(AnalysisScope value) {
        return new FilterSet(corpusId, pages, structural, value, extractId, strictExtractMode);
    }

    public FilterSet withExtract(Long extract) {
        return new FilterSet(corpusId, pages, structural, analysis, extract, strictExtractMode);
    }

    public FilterSet withPages(Collection<Integer> value) {
        return new FilterSet(corpusId, value == null ? null : new TreeSet<>(value), structural, analysis, extractId, strictExtractMode);
    }

    public FilterSet withStrictExtractMode(boolean value) {
        return new FilterSet(corpusId, pages, structural, analysis, extractId, value);
    }

    /**
     * Every dimension in a fixed order, for cache key composition.
     */
    public Map<String, String> cacheDimensions() {
        Map<String, String> dimensions = new LinkedHashMap<>();
        dimensions.put("corpus", corpusId == null ? null : String.valueOf(corpusId));
        dimensions.put("pages", pages == null ? null
                : pages.stream().map(String::valueOf).collect(Collectors.joining(",")));
        dimensions.put("structural", structural.label());
        dimensions.put("analysis", analysis.label());
        dimensions.put("extract", extractId == null ? null : String.valueOf(extractId));
        dimensions.put("strict", String.valueOf(strictExtractMode));
        return dimensions;
    }
}
