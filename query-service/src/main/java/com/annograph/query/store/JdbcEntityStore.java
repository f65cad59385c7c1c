package com.annograph.query.store;

import com.annograph.query.model.AnalysisRecord;
import com.annograph.query.model.AnnotationRecord;
import com.annograph.query.model.DatacellRecord;
import com.annograph.query.model.ExtractRecord;
import com.annograph.query.model.RelationshipRecord;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Repository
public class JdbcEntityStore implements EntityStore {

    private static final String ANNOTATION_SELECT = """
            SELECT a.id, a.document_id, a.corpus_id, a.analysis_id, a.structural, a.page,
                   COALESCE(l.text, '') AS label, a.creator_id,
                   a.created_by_analysis_id, a.created_by_extract_id
            FROM annotations a
            LEFT JOIN annotation_labels l ON l.id = a.label_id
            """;

    private static final String RELATIONSHIP_SELECT = """
            SELECT r.id, r.document_id, r.corpus_id, r.analysis_id, r.structural,
                   COALESCE(l.text, '') AS label
            FROM relationships r
            LEFT JOIN annotation_labels l ON l.id = r.label_id
            """;

    private static final String SOURCE_SELECT = """
            SELECT relationship_id, annotation_id FROM relationship_sources WHERE relationship_id IN (:ids)
            ORDER BY relationship_id, annotation_id
            """;

    private static final String TARGET_SELECT = """
            SELECT relationship_id, annotation_id FROM relationship_targets WHERE relationship_id IN (:ids)
            ORDER BY relationship_id, annotation_id
            """;

    private static final String DATACELL_SELECT = """
            SELECT dc.id, dc.extract_id, dc.document_id, dc.column_id, dc.data::text AS data,
                   dc.approved_by_id, dc.rejected_by_id
            FROM datacells dc
            WHERE dc.extract_id = :extractId
            """;

    private static final RowMapper<ExtractRecord> EXTRACT_MAPPER = (rs, rowNum) -> new ExtractRecord(
            rs.getLong("id"),
            rs.getString("name"),
            nullableLong(rs, "corpus_id"),
            toInstant(rs.getTimestamp("started")),
            toInstant(rs.getTimestamp("finished")),
            rs.getString("error")
    );

    private static final RowMapper<AnalysisRecord> ANALYSIS_MAPPER = (rs, rowNum) -> new AnalysisRecord(
            rs.getLong("id"),
            rs.getString("analyzer_id"),
            nullableLong(rs, "analyzed_corpus_id"),
            nullableLong(rs, "creator_id"),
            toInstant(rs.getTimestamp("started")),
            toInstant(rs.getTimestamp("completed"))
    );

    private static final RowMapper<AnnotationRecord> ANNOTATION_MAPPER = (rs, rowNum) -> new AnnotationRecord(
            rs.getLong("id"),
            rs.getLong("document_id"),
            nullableLong(rs, "corpus_id"),
            nullableLong(rs, "analysis_id"),
            rs.getBoolean("structural"),
            rs.getInt("page"),
            rs.getString("label"),
            nullableLong(rs, "creator_id"),
            nullableLong(rs, "created_by_analysis_id"),
            nullableLong(rs, "created_by_extract_id")
    );

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcEntityStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public List<AnnotationRecord> findDocumentAnnotations(long documentId) {
        return run("annotations of document " + documentId, () -> jdbcTemplate.query(
                ANNOTATION_SELECT + " WHERE a.document_id = :documentId",
                new MapSqlParameterSource("documentId", documentId),
                ANNOTATION_MAPPER
        ));
    }

    @Override
    public List<AnnotationRecord> findAnnotationsByIds(Collection<Long> annotationIds) {
        if (annotationIds.isEmpty()) {
            return List.of();
        }
        return run("annotations by id", () -> jdbcTemplate.query(
                ANNOTATION_SELECT + " WHERE a.id IN (:ids)",
                new MapSqlParameterSource("ids", annotationIds),
                ANNOTATION_MAPPER
        ));
    }

    @Override
    public List<RelationshipRecord> findDocumentRelationships(long documentId) {
        return run("relationships of document " + documentId, () -> withEndpoints(jdbcTemplate.query(
                RELATIONSHIP_SELECT + " WHERE r.document_id = :documentId",
                new MapSqlParameterSource("documentId", documentId),
                RelationshipRow.MAPPER
        )));
    }

    @Override
    public List<RelationshipRecord> findRelationshipsByIds(Collection<Long> relationshipIds) {
        if (relationshipIds.isEmpty()) {
            return List.of();
        }
        return run("relationships by id", () -> withEndpoints(jdbcTemplate.query(
                RELATIONSHIP_SELECT + " WHERE r.id IN (:ids)",
                new MapSqlParameterSource("ids", relationshipIds),
                RelationshipRow.MAPPER
        )));
    }

    @Override
    public Map<Long, Integer> findAnnotationPages(Collection<Long> annotationIds) {
        if (annotationIds.isEmpty()) {
            return Map.of();
        }
        return run("annotation pages", () -> {
            Map<Long, Integer> pages = new HashMap<>();
            jdbcTemplate.query(
                    "SELECT id, page FROM annotations WHERE id IN (:ids)",
                    new MapSqlParameterSource("ids", annotationIds),
                    rs -> {
                        pages.put(rs.getLong("id"), rs.getInt("page"));
                    }
            );
            return pages;
        });
    }

    @Override
    public Set<Long> findExtractSourceAnnotationIds(long extractId, long documentId) {
        return run("sources of extract " + extractId, () -> new LinkedHashSet<>(jdbcTemplate.queryForList(
                """
                SELECT DISTINCT s.annotation_id
                FROM datacells dc
                JOIN datacell_sources s ON s.datacell_id = dc.id
                WHERE dc.extract_id = :extractId AND dc.document_id = :documentId
                """,
                new MapSqlParameterSource("extractId", extractId).addValue("documentId", documentId),
                Long.class
        )));
    }

    @Override
    public Optional<ExtractRecord> findExtract(long extractId) {
        return run("extract " + extractId, () -> jdbcTemplate.query(
                "SELECT id, name, corpus_id, started, finished, error FROM extracts WHERE id = :id",
                new MapSqlParameterSource("id", extractId),
                EXTRACT_MAPPER
        ).stream().findFirst());
    }

    @Override
    public Map<String, Long> countRelationshipsByLabel(long documentId, long corpusId) {
        return run("relationship counts of document " + documentId, () -> {
            Map<String, Long> counts = new HashMap<>();
            jdbcTemplate.query(
                    """
                    SELECT COALESCE(l.text, '') AS label, COUNT(*) AS relationships
                    FROM relationships r
                    LEFT JOIN annotation_labels l ON l.id = r.label_id
                    WHERE r.document_id = :documentId AND r.corpus_id = :corpusId
                    GROUP BY COALESCE(l.text, '')
                    """,
                    new MapSqlParameterSource("documentId", documentId).addValue("corpusId", corpusId),
                    rs -> {
                        counts.merge(rs.getString("label"), rs.getLong("relationships"), Long::sum);
                    }
            );
            return counts;
        });
    }

    @Override
    public List<AnalysisRecord> findAnalyses(Long corpusId) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "SELECT id, analyzer_id, analyzed_corpus_id, creator_id, started, completed FROM analyses";
        if (corpusId != null) {
            sql += " WHERE analyzed_corpus_id = :corpusId";
            params.addValue("corpusId", corpusId);
        }
        String query = sql + " ORDER BY id";
        return run("analyses", () -> jdbcTemplate.query(query, params, ANALYSIS_MAPPER));
    }

    @Override
    public List<AnnotationRecord> findAnalysisAnnotations(long analysisId, Long documentId) {
        MapSqlParameterSource params = new MapSqlParameterSource("analysisId", analysisId);
        String sql = ANNOTATION_SELECT + " WHERE a.analysis_id = :analysisId";
        if (documentId != null) {
            sql += " AND a.document_id = :documentId";
            params.addValue("documentId", documentId);
        }
        String query = sql + " ORDER BY a.document_id, a.page, a.id";
        return run("annotations of analysis " + analysisId, () -> jdbcTemplate.query(query, params, ANNOTATION_MAPPER));
    }

    @Override
    public List<ExtractRecord> findExtracts(Long corpusId) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "SELECT id, name, corpus_id, started, finished, error FROM extracts";
        if (corpusId != null) {
            sql += " WHERE corpus_id = :corpusId";
            params.addValue("corpusId", corpusId);
        }
        String query = sql + " ORDER BY id";
        return run("extracts", () -> jdbcTemplate.query(query, params, EXTRACT_MAPPER));
    }

    @Override
    public List<DatacellRecord> findExtractDatacells(long extractId, Long documentId) {
        MapSqlParameterSource params = new MapSqlParameterSource("extractId", extractId);
        String sql = DATACELL_SELECT;
        if (documentId != null) {
            sql += " AND dc.document_id = :documentId";
            params.addValue("documentId", documentId);
        }
        String query = sql + " ORDER BY dc.document_id, dc.id";
        return run("datacells of extract " + extractId, () -> withSources(jdbcTemplate.query(query, params, DatacellRow.MAPPER)));
    }

    private List<RelationshipRecord> withEndpoints(List<RelationshipRow> rows) {
        if (rows.isEmpty()) {
            return List.of();
        }
        List<Long> ids = rows.stream().map(RelationshipRow::id).toList();
        Map<Long, List<Long>> sources = endpoints(SOURCE_SELECT, ids);
        Map<Long, List<Long>> targets = endpoints(TARGET_SELECT, ids);
        List<RelationshipRecord> records = new ArrayList<>(rows.size());
        for (RelationshipRow row : rows) {
            records.add(new RelationshipRecord(
                    row.id(),
                    row.documentId(),
                    row.corpusId(),
                    row.analysisId(),
                    row.structural(),
                    row.label(),
                    sources.getOrDefault(row.id(), List.of()),
                    targets.getOrDefault(row.id(), List.of())
            ));
        }
        return records;
    }

    private List<DatacellRecord> withSources(List<DatacellRow> rows) {
        if (rows.isEmpty()) {
            return List.of();
        }
        List<Long> ids = rows.stream().map(DatacellRow::id).toList();
        Map<Long, List<Long>> sources = new HashMap<>();
        jdbcTemplate.query(
                "SELECT datacell_id, annotation_id FROM datacell_sources WHERE datacell_id IN (:ids) ORDER BY datacell_id, annotation_id",
                new MapSqlParameterSource("ids", ids),
                rs -> {
                    sources.computeIfAbsent(rs.getLong("datacell_id"), ignored -> new ArrayList<>())
                            .add(rs.getLong("annotation_id"));
                }
        );
        List<DatacellRecord> records = new ArrayList<>(rows.size());
        for (DatacellRow row : rows) {
            records.add(new DatacellRecord(
                    row.id(),
                    row.extractId(),
                    row.documentId(),
                    row.columnId(),
                    row.data(),
                    row.approvedById(),
                    row.rejectedById(),
                    sources.getOrDefault(row.id(), List.of())
            ));
        }
        return records;
    }

    private Map<Long, List<Long>> endpoints(String sql, List<Long> relationshipIds) {
        Map<Long, List<Long>> endpoints = new HashMap<>();
        jdbcTemplate.query(sql, new MapSqlParameterSource("ids", relationshipIds), rs -> {
            endpoints.computeIfAbsent(rs.getLong("relationship_id"), ignored -> new ArrayList<>())
                    .add(rs.getLong("annotation_id"));
        });
        return endpoints;
    }

    private static <T> T run(String description, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException ex) {
            throw new RetrievalException("entity store query failed: " + description, ex);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private record RelationshipRow(long id, long documentId, Long corpusId, Long analysisId, boolean structural, String label) {
        private static final RowMapper<RelationshipRow> MAPPER = (rs, rowNum) -> new RelationshipRow(
                rs.getLong("id"),
                rs.getLong("document_id"),
                nullableLong(rs, "corpus_id"),
                nullableLong(rs, "analysis_id"),
                rs.getBoolean("structural"),
                rs.getString("label")
        );
    }

    private record DatacellRow(long id, long extractId, long documentId, Long columnId, String data, Long approvedById, Long rejectedById) {
        private static final RowMapper<DatacellRow> MAPPER = (rs, rowNum) -> new DatacellRow(
                rs.getLong("id"),
                rs.getLong("extract_id"),
                rs.getLong("document_id"),
                nullableLong(rs, "column_id"),
                rs.getString("data"),
                nullableLong(rs, "approved_by_id"),
                nullableLong(rs, "rejected_by_id")
        );
    }
}
