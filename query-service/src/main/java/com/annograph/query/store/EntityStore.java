package com.annograph.query.store;

import com.annograph.query.model.AnalysisRecord;
import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.model.DatacellRecord;
import com.annograph.query.model.ExtractRecord;
import com.annograph.query.model.RelationshipRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to annotations, relationships, analyses, extracts and extract provenance.
 *
 * <p>Implementations throw {@link RetrievalException} when the backing store fails.</p>
 */
public interface EntityStore {

    List<AnnotationRecord> findDocumentAnnotations(long documentId);

    List<AnnotationRecord> findAnnotationsByIds(Collection<Long> annotationIds);

    /**
     * Relationships of a document with their source and target ids populated.
     */
    List<RelationshipRecord> findDocumentRelationships(long documentId);

    List<RelationshipRecord> findRelationshipsByIds(Collection<Long> relationshipIds);

    /**
     * Relationship counts of a document within a corpus, grouped by label text. Unlabeled
     * relationships are counted under the empty string.
     */
    Map<String, Long> countRelationshipsByLabel(long documentId, long corpusId);

    Map<Long, Integer> findAnnotationPages(Collection<Long> annotationIds);

    /**
     * Ids of the annotations cited as datacell sources by an extract within one document.
     */
    Set<Long> findExtractSourceAnnotationIds(long extractId, long documentId);

    Optional<ExtractRecord> findExtract(long extractId);

    /**
     * Analyses of a corpus, or all analyses when {@code corpusId} is null, in id order.
     */
    List<AnalysisRecord> findAnalyses(Long corpusId);

    /**
     * Annotations produced by an analysis, optionally limited to one document, ordered by
     * document, page and id.
     */
    List<AnnotationRecord> findAnalysisAnnotations(long analysisId, Long documentId);

    /**
     * Extracts of a corpus, or all extracts when {@code corpusId} is null, in id order.
     */
    List<ExtractRecord> findExtracts(Long corpusId);

    /**
     * Datacells of an extract with their source annotation ids, optionally limited to one
     * document, ordered by document and id.
     */
    List<DatacellRecord> findExtractDatacells(long extractId, Long documentId);
}
