package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.concurrency.TransactionalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger store for settlements. Same compare-and-swap contract as the expense store.
 */
@Repository
@Slf4j
public class SettlementStore implements TransactionalStore<Settlement> {

    public static final String RECORD_TYPE = "settlement";

    private static final String SELECT_SETTLEMENT =
        "SELECT id, group_id, payer_id, payee_id, amount, currency, settlement_date, note, created_by, " +
        "version, created_at, updated_at, deleted_at, deleted_by FROM settlements ";

    private final JdbcTemplate jdbcTemplate;

    public SettlementStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String recordType() {
        return RECORD_TYPE;
    }

    @Override
    public Optional<Settlement> read(UUID id) {
        List<Settlement> rows = jdbcTemplate.query(SELECT_SETTLEMENT + "WHERE id = ?", settlementRowMapper(), id);
        if (rows.size() > 1) {
            throw new IncorrectResultSizeDataAccessException(1, rows.size());
        }
        return rows.stream().findFirst();
    }

    @Override
    public void insert(Settlement settlement) {
        insert(settlement, null);
    }

    public void insert(Settlement settlement, String idempotencyKey) {
        jdbcTemplate.update(
            "INSERT INTO settlements (id, group_id, payer_id, payee_id, amount, currency, settlement_date, note, " +
            "created_by, version, created_at, updated_at, deleted_at, deleted_by, idempotency_key) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            settlement.getId(),
            settlement.getGroupId(),
            settlement.getPayerId(),
            settlement.getPayeeId(),
            settlement.getAmount(),
            settlement.getCurrency(),
            toTimestamp(settlement.getDate()),
            settlement.getNote(),
            settlement.getCreatedBy(),
            settlement.getVersion(),
            toTimestamp(settlement.getCreatedAt()),
            toTimestamp(settlement.getUpdatedAt()),
            toTimestamp(settlement.getDeletedAt()),
            settlement.getDeletedBy(),
            idempotencyKey
        );
        log.debug("Inserted settlement {} in group {}", settlement.getId(), settlement.getGroupId());
    }

    @Override
    public boolean writeIfVersion(UUID id, long expectedVersion, Settlement next) {
        int updated = jdbcTemplate.update(
            "UPDATE settlements SET payer_id = ?, payee_id = ?, amount = ?, currency = ?, settlement_date = ?, " +
            "note = ?, version = ?, updated_at = ?, deleted_at = ?, deleted_by = ? " +
            "WHERE id = ? AND version = ?",
            next.getPayerId(),
            next.getPayeeId(),
            next.getAmount(),
            next.getCurrency(),
            toTimestamp(next.getDate()),
            next.getNote(),
            next.getVersion(),
            toTimestamp(next.getUpdatedAt()),
            toTimestamp(next.getDeletedAt()),
            next.getDeletedBy(),
            id,
            expectedVersion
        );
        return updated == 1;
    }

    @Override
    public List<Settlement> listByGroup(String groupId) {
        return jdbcTemplate.query(
            SELECT_SETTLEMENT + "WHERE group_id = ? AND deleted_at IS NULL ORDER BY settlement_date, created_at, id",
            settlementRowMapper(),
            groupId
        );
    }

    public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT id FROM settlements WHERE idempotency_key = ?",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            idempotencyKey
        ).stream().findFirst();
    }

    private static RowMapper<Settlement> settlementRowMapper() {
        return (rs, rowNum) -> Settlement.builder()
            .id(rs.getObject("id", UUID.class))
            .groupId(rs.getString("group_id"))
            .payerId(rs.getString("payer_id"))
            .payeeId(rs.getString("payee_id"))
            .amount(rs.getLong("amount"))
            .currency(rs.getString("currency"))
            .date(toInstant(rs.getTimestamp("settlement_date")))
            .note(rs.getString("note"))
            .createdBy(rs.getString("created_by"))
            .version(rs.getLong("version"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .deletedAt(toInstant(rs.getTimestamp("deleted_at")))
            .deletedBy(rs.getString("deleted_by"))
            .build();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
