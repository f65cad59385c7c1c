package com.annograph.aggregate.source;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class JdbcDatacellSourceReader implements DatacellSourceReader {

    private static final String SOURCE_LINK_SELECT = """
            SELECT DISTINCT dc.extract_id, dc.document_id, a.id AS annotation_id, a.page,
                   COALESCE(l.text, '') AS label
            FROM datacells dc
            JOIN datacell_sources s ON s.datacell_id = dc.id
            JOIN annotations a ON a.id = s.annotation_id
            LEFT JOIN annotation_labels l ON l.id = a.label_id
            """;

    private static final RowMapper<DatacellSourceLink> LINK_MAPPER = (rs, rowNum) -> new DatacellSourceLink(
            rs.getLong("extract_id"),
            rs.getLong("document_id"),
            rs.getLong("annotation_id"),
            rs.getInt("page"),
            rs.getString("label")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcDatacellSourceReader(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<DatacellSourceLink> loadAllSourceLinks() {
        return jdbcTemplate.query(SOURCE_LINK_SELECT + " WHERE dc.extract_id IS NOT NULL", LINK_MAPPER);
    }

    @Override
    public List<DatacellSourceLink> loadSourceLinks(long extractId, long documentId) {
        return jdbcTemplate.query(
                SOURCE_LINK_SELECT + " WHERE dc.extract_id = ? AND dc.document_id = ?",
                LINK_MAPPER,
                extractId,
                documentId
        );
    }
}
