package com.annograph.query.filter;

import com.annograph.query.filter.InclusionRule.AnalysisClause;
import com.annograph.query.filter.InclusionRule.CorpusClause;
import com.annograph.query.filter.InclusionRule.ExtractClause;

/**
 * Turns a {@link FilterSet} into an {@link InclusionRule}. This is the only place where the
 * corpus, structural, analysis and extract dimensions are interpreted.
 *
 * <pre>
 * corpus  structural   rows
 * given   false        corpus = C AND NOT structural
 * given   unset/true   corpus = C OR structural
 * absent  false        none
 * absent  unset/true   structural only
 *
 * analysis unset       no restriction
 * analysis 0           no analysis (relationships: OR structural)
 * analysis N           analysis = N
 *
 * extract E            annotation in E's sources; relationship with one endpoint in E
 *                      (strict: a source and a target in E)
 * </pre>
 *
 * Analysis and extract restrictions always intersect.
 */
public final class FilterPolicy {

    private FilterPolicy() {
    }

    public static InclusionRule resolve(FilterSet filters, RetrievalTarget target) {
        boolean corpusGiven = filters.corpusId() != null;
        boolean nonStructuralOnly = filters.structural() == Tristate.FALSE;

        CorpusClause corpusClause;
        if (corpusGiven) {
            corpusClause = nonStructuralOnly ? CorpusClause.CORPUS_NON_STRUCTURAL : CorpusClause.CORPUS_OR_STRUCTURAL;
        } else {
            corpusClause = nonStructuralOnly ? CorpusClause.NOTHING : CorpusClause.STRUCTURAL_ONLY;
        }

        AnalysisClause analysisClause;
        switch (filters.analysis().kind()) {
            case HUMAN_ONLY:
                analysisClause = target == RetrievalTarget.RELATIONSHIP
                        ? AnalysisClause.HUMAN_OR_STRUCTURAL
                        : AnalysisClause.HUMAN_ONLY;
                break;
            case SPECIFIC:
                analysisClause = AnalysisClause.SPECIFIC;
                break;
            default:
                analysisClause = AnalysisClause.ANY;
        }

        ExtractClause extractClause;
        if (filters.extractId() == null) {
            extractClause = ExtractClause.NONE;
        } else if (target == RetrievalTarget.ANNOTATION) {
            extractClause = ExtractClause.MEMBER;
        } else {
            extractClause = filters.strictExtractMode() ? ExtractClause.BOTH_ENDPOINTS : ExtractClause.ANY_ENDPOINT;
        }

        return new InclusionRule(
                corpusClause,
                filters.corpusId(),
                analysisClause,
                filters.analysis().analysisId(),
                filters.pages(),
                extractClause,
                filters.extractId()
        );
    }
}
