package com.annograph.query.permission;

import com.annograph.query.model.ObjectAccess;
import com.annograph.query.model.UserIdentity;
import com.annograph.query.store.RetrievalException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcPermissionStore implements PermissionStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPermissionStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<UserIdentity> findUser(long userId) {
        try {
            return jdbcTemplate.query(
                    "SELECT id, is_superuser FROM users WHERE id = ? AND is_active",
                    (rs, rowNum) -> new UserIdentity(rs.getLong("id"), rs.getBoolean("is_superuser")),
                    userId
            ).stream().findFirst();
        } catch (DataAccessException ex) {
            throw new RetrievalException("user lookup failed: " + userId, ex);
        }
    }

    @Override
    public Optional<ObjectAccess> findAccess(PermissionedType type, long objectId) {
        String publicColumn = type.hasPublicFlag() ? "is_public" : "FALSE AS is_public";
        String scopeColumn = type.scopeCorpusColumn() == null
                ? "NULL AS scope_corpus_id"
                : type.scopeCorpusColumn() + " AS scope_corpus_id";
        try {
            List<AccessRow> rows = jdbcTemplate.query(
                    "SELECT creator_id, " + publicColumn + ", " + scopeColumn + " FROM " + type.table() + " WHERE id = ?",
                    (rs, rowNum) -> new AccessRow(
                            nullableLong(rs, "creator_id"),
                            rs.getBoolean("is_public"),
                            nullableLong(rs, "scope_corpus_id")
                    ),
                    objectId
            );
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            List<Long> readers = jdbcTemplate.queryForList(
                    """
                    SELECT user_id FROM object_permissions
                    WHERE object_type = ? AND object_id = ? AND permission IN ('READ', 'ALL')
                    """,
                    Long.class,
                    type.label(),
                    objectId
            );
            AccessRow row = rows.get(0);
            return Optional.of(new ObjectAccess(
                    objectId,
                    row.creatorId(),
                    row.publiclyVisible(),
                    new HashSet<>(readers),
                    row.scopeCorpusId()
            ));
        } catch (DataAccessException ex) {
            throw new RetrievalException("permission lookup failed: " + type.label() + " " + objectId, ex);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private record AccessRow(Long creatorId, boolean publiclyVisible, Long scopeCorpusId) {
    }
}
