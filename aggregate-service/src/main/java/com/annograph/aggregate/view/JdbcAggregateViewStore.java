package com.annograph.aggregate.view;

import com.annograph.aggregate.source.DatacellSourceLink;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Publishes the view as versioned rows plus a one-row pointer per view. A rebuild writes its rows
 * under the next version and moves the pointer in the same transaction, so readers on any
 * instance see the old version or the new one. Older versions are deleted on publish.
 */
public class JdbcAggregateViewStore implements AggregateViewStore {

    private static final String STATE_SEED = """
            INSERT INTO aggregate_view_state (view_name, version, refreshed_at, row_count, summary_count)
            VALUES (?, 0, ?, 0, 0)
            ON CONFLICT (view_name) DO NOTHING
            """;

    private static final String SUMMARY_SELECT = """
            SELECT s.refreshed_at, r.annotation_id, r.page, r.label
            FROM aggregate_view_state s
            LEFT JOIN extract_annotation_view r
              ON r.version = s.version AND r.extract_id = ? AND r.document_id = ?
            WHERE s.view_name = ? AND s.version > 0
            """;

    private static final String VIEW_SELECT = """
            SELECT s.refreshed_at, r.extract_id, r.document_id, r.annotation_id, r.page, r.label
            FROM aggregate_view_state s
            LEFT JOIN extract_annotation_view r ON r.version = s.version
            WHERE s.view_name = ? AND s.version > 0
            """;

    private static final String VIEW_NAME = "extract_annotation_view";

    private final JdbcTemplate jdbcTemplate;

    public JdbcAggregateViewStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public boolean publish(AggregateSnapshot next) {
        jdbcTemplate.update(STATE_SEED, VIEW_NAME, Timestamp.from(Instant.EPOCH));
        PublishedVersion current = jdbcTemplate.queryForObject(
                "SELECT version, refreshed_at FROM aggregate_view_state WHERE view_name = ? FOR UPDATE",
                (rs, rowNum) -> new PublishedVersion(rs.getLong("version"), rs.getTimestamp("refreshed_at").toInstant()),
                VIEW_NAME
        );
        if (current.version() > 0 && !next.refreshedAt().isAfter(current.refreshedAt())) {
            return false;
        }

        long version = current.version() + 1;
        List<Object[]> batch = new ArrayList<>(next.rowCount());
        for (AggregateRow row : next.rows()) {
            batch.add(new Object[]{version, row.extractId(), row.documentId(), row.annotationId(), row.page(),
                    row.label() == null ? "" : row.label()});
        }
        jdbcTemplate.batchUpdate(
                "INSERT INTO extract_annotation_view (version, extract_id, document_id, annotation_id, page, label) VALUES (?, ?, ?, ?, ?, ?)",
                batch
        );
        jdbcTemplate.update(
                "UPDATE aggregate_view_state SET version = ?, refreshed_at = ?, row_count = ?, summary_count = ? WHERE view_name = ?",
                version,
                Timestamp.from(next.refreshedAt()),
                next.rowCount(),
                next.summaryCount(),
                VIEW_NAME
        );
        jdbcTemplate.update("DELETE FROM extract_annotation_view WHERE version < ?", version);
        return true;
    }

    @Override
    public Optional<AggregateSnapshot> load() {
        List<DatacellSourceLink> links = new ArrayList<>();
        Instant[] refreshedAt = {null};
        jdbcTemplate.query(VIEW_SELECT, rs -> {
            refreshedAt[0] = rs.getTimestamp("refreshed_at").toInstant();
            long annotationId = rs.getLong("annotation_id");
            if (!rs.wasNull()) {
                links.add(new DatacellSourceLink(
                        rs.getLong("extract_id"),
                        rs.getLong("document_id"),
                        annotationId,
                        rs.getInt("page"),
                        rs.getString("label")
                ));
            }
        }, VIEW_NAME);
        if (refreshedAt[0] == null) {
            return Optional.empty();
        }
        return Optional.of(AggregateSnapshot.build(links, refreshedAt[0]));
    }

    @Override
    public Optional<ViewState> state() {
        return jdbcTemplate.query(
                "SELECT refreshed_at, row_count, summary_count FROM aggregate_view_state WHERE view_name = ? AND version > 0",
                (rs, rowNum) -> new ViewState(
                        rs.getTimestamp("refreshed_at").toInstant(),
                        rs.getInt("row_count"),
                        rs.getInt("summary_count")
                ),
                VIEW_NAME
        ).stream().findFirst();
    }

    @Override
    public Optional<ViewedSummary> summaryFor(long extractId, long documentId) {
        List<DatacellSourceLink> links = new ArrayList<>();
        Instant[] refreshedAt = {null};
        jdbcTemplate.query(SUMMARY_SELECT, rs -> {
            refreshedAt[0] = rs.getTimestamp("refreshed_at").toInstant();
            long annotationId = rs.getLong("annotation_id");
            if (!rs.wasNull()) {
                links.add(new DatacellSourceLink(extractId, documentId, annotationId, rs.getInt("page"), rs.getString("label")));
            }
        }, extractId, documentId, VIEW_NAME);
        if (refreshedAt[0] == null) {
            return Optional.empty();
        }
        return Optional.of(new ViewedSummary(ExtractDocumentSummary.fromLinks(extractId, documentId, links), refreshedAt[0]));
    }

    private record PublishedVersion(long version, Instant refreshedAt) {
    }
}
