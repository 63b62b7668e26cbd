package com.flagship.split_ledger.group;

import com.flagship.split_ledger.concurrency.TransactionalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Group records, with the same compare-and-swap contract as the ledger stores.
 * A group is its own "group", so {@link #listByGroup} returns at most one row.
 */
@Repository
@Slf4j
public class GroupStore implements TransactionalStore<Group> {

    public static final String RECORD_TYPE = "group";

    private static final String SELECT_GROUP =
        "SELECT id, name, description, created_by, version, created_at, updated_at FROM ledger_groups ";

    private final JdbcTemplate jdbcTemplate;

    public GroupStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String recordType() {
        return RECORD_TYPE;
    }

    @Override
    public Optional<Group> read(UUID id) {
        return jdbcTemplate.query(SELECT_GROUP + "WHERE id = ?", groupRowMapper(), id).stream().findFirst();
    }

    /**
     * Looks a group up by the id used in request paths. Ids that are not UUIDs name no group.
     */
    public Optional<Group> find(String groupId) {
        UUID id;
        try {
            id = UUID.fromString(groupId);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return read(id);
    }

    @Override
    public void insert(Group group) {
        jdbcTemplate.update(
            "INSERT INTO ledger_groups (id, name, description, created_by, version, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            group.getId(),
            group.getName(),
            group.getDescription(),
            group.getCreatedBy(),
            group.getVersion(),
            Timestamp.from(group.getCreatedAt()),
            Timestamp.from(group.getUpdatedAt())
        );
        log.debug("Inserted group {}", group.getId());
    }

    @Override
    public boolean writeIfVersion(UUID id, long expectedVersion, Group next) {
        int updated = jdbcTemplate.update(
            "UPDATE ledger_groups SET name = ?, description = ?, version = ?, updated_at = ? " +
            "WHERE id = ? AND version = ?",
            next.getName(),
            next.getDescription(),
            next.getVersion(),
            Timestamp.from(next.getUpdatedAt()),
            id,
            expectedVersion
        );
        return updated == 1;
    }

    @Override
    public List<Group> listByGroup(String groupId) {
        return find(groupId).stream().toList();
    }

    private static RowMapper<Group> groupRowMapper() {
        return (rs, rowNum) -> Group.builder()
            .id(rs.getObject("id", UUID.class))
            .name(rs.getString("name"))
            .description(rs.getString("description"))
            .createdBy(rs.getString("created_by"))
            .version(rs.getLong("version"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
