package com.flagship.split_ledger.expense;

import com.flagship.split_ledger.concurrency.TransactionalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger store for expenses, plain JDBC.
 *
 * An expense row and its split rows always change together, inside the
 * caller's transaction. Updates are compare-and-swap on {@code version}:
 * zero affected rows means someone else committed first.
 */
@Repository
@Slf4j
public class ExpenseStore implements TransactionalStore<Expense> {

    public static final String RECORD_TYPE = "expense";

    private static final String SELECT_EXPENSE =
        "SELECT id, group_id, description, category, expense_date, payer_id, amount, currency, split_type, " +
        "created_by, version, created_at, updated_at, deleted_at, deleted_by FROM expenses ";

    private final JdbcTemplate jdbcTemplate;

    public ExpenseStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String recordType() {
        return RECORD_TYPE;
    }

    @Override
    public Optional<Expense> read(UUID id) {
        List<Expense> rows = jdbcTemplate.query(SELECT_EXPENSE + "WHERE id = ?", expenseRowMapper(), id);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        if (rows.size() > 1) {
            throw new IncorrectResultSizeDataAccessException(1, rows.size());
        }
        return Optional.of(rows.get(0).toBuilder().splits(loadSplits(id)).build());
    }

    @Override
    public void insert(Expense expense) {
        insert(expense, null);
    }

    /**
     * Inserts a new expense. A non-null idempotency key is stored with it;
     * the unique constraint rejects a second insert with the same key.
     */
    public void insert(Expense expense, String idempotencyKey) {
        jdbcTemplate.update(
            "INSERT INTO expenses (id, group_id, description, category, expense_date, payer_id, amount, currency, " +
            "split_type, created_by, version, created_at, updated_at, deleted_at, deleted_by, idempotency_key) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            expense.getId(),
            expense.getGroupId(),
            expense.getDescription(),
            expense.getCategory(),
            toTimestamp(expense.getDate()),
            expense.getPayerId(),
            expense.getAmount(),
            expense.getCurrency(),
            expense.getSplitType().name(),
            expense.getCreatedBy(),
            expense.getVersion(),
            toTimestamp(expense.getCreatedAt()),
            toTimestamp(expense.getUpdatedAt()),
            toTimestamp(expense.getDeletedAt()),
            expense.getDeletedBy(),
            idempotencyKey
        );
        insertSplits(expense);
        log.debug("Inserted expense {} in group {}", expense.getId(), expense.getGroupId());
    }

    @Override
    public boolean writeIfVersion(UUID id, long expectedVersion, Expense next) {
        int updated = jdbcTemplate.update(
            "UPDATE expenses SET description = ?, category = ?, expense_date = ?, payer_id = ?, amount = ?, " +
            "currency = ?, split_type = ?, version = ?, updated_at = ?, deleted_at = ?, deleted_by = ? " +
            "WHERE id = ? AND version = ?",
            next.getDescription(),
            next.getCategory(),
            toTimestamp(next.getDate()),
            next.getPayerId(),
            next.getAmount(),
            next.getCurrency(),
            next.getSplitType().name(),
            next.getVersion(),
            toTimestamp(next.getUpdatedAt()),
            toTimestamp(next.getDeletedAt()),
            next.getDeletedBy(),
            id,
            expectedVersion
        );
        if (updated == 0) {
            return false;
        }
        jdbcTemplate.update("DELETE FROM expense_splits WHERE expense_id = ?", id);
        insertSplits(next);
        return true;
    }

    /**
     * Live (not deleted) expenses of a group, oldest first.
     */
    @Override
    public List<Expense> listByGroup(String groupId) {
        List<Expense> rows = jdbcTemplate.query(
            SELECT_EXPENSE + "WHERE group_id = ? AND deleted_at IS NULL ORDER BY expense_date, created_at, id",
            expenseRowMapper(),
            groupId
        );
        if (rows.isEmpty()) {
            return List.of();
        }

        Map<UUID, List<ExpenseSplit>> splitsByExpense = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT s.expense_id, s.member_id, s.amount, s.percentage_bp FROM expense_splits s " +
            "JOIN expenses e ON e.id = s.expense_id " +
            "WHERE e.group_id = ? AND e.deleted_at IS NULL ORDER BY s.expense_id, s.position",
            rs -> {
                UUID expenseId = rs.getObject("expense_id", UUID.class);
                splitsByExpense.computeIfAbsent(expenseId, k -> new ArrayList<>()).add(mapSplit(rs));
            },
            groupId
        );

        List<Expense> expenses = new ArrayList<>(rows.size());
        for (Expense row : rows) {
            List<ExpenseSplit> splits = splitsByExpense.getOrDefault(row.getId(), List.of());
            expenses.add(row.toBuilder().splits(Collections.unmodifiableList(splits)).build());
        }
        return expenses;
    }

    public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        List<UUID> ids = jdbcTemplate.query(
            "SELECT id FROM expenses WHERE idempotency_key = ?",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            idempotencyKey
        );
        return ids.stream().findFirst();
    }

    private List<ExpenseSplit> loadSplits(UUID expenseId) {
        return jdbcTemplate.query(
            "SELECT member_id, amount, percentage_bp FROM expense_splits WHERE expense_id = ? ORDER BY position",
            (rs, rowNum) -> mapSplit(rs),
            expenseId
        );
    }

    private void insertSplits(Expense expense) {
        List<Object[]> batch = new ArrayList<>(expense.getSplits().size());
        int position = 0;
        for (ExpenseSplit split : expense.getSplits()) {
            batch.add(new Object[]{
                expense.getId(), position++, split.getMemberId(), split.getAmount(), split.getPercentageBasisPoints()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO expense_splits (expense_id, position, member_id, amount, percentage_bp) VALUES (?, ?, ?, ?, ?)",
            batch
        );
    }

    private static ExpenseSplit mapSplit(ResultSet rs) throws SQLException {
        int bp = rs.getInt("percentage_bp");
        Integer basisPoints = rs.wasNull() ? null : bp;
        return new ExpenseSplit(rs.getString("member_id"), rs.getLong("amount"), basisPoints);
    }

    /**
     * Maps the expense row only; splits are attached by the caller.
     */
    private static RowMapper<Expense> expenseRowMapper() {
        return (rs, rowNum) -> Expense.builder()
            .id(rs.getObject("id", UUID.class))
            .groupId(rs.getString("group_id"))
            .description(rs.getString("description"))
            .category(rs.getString("category"))
            .date(toInstant(rs.getTimestamp("expense_date")))
            .payerId(rs.getString("payer_id"))
            .amount(rs.getLong("amount"))
            .currency(rs.getString("currency"))
            .splitType(SplitType.valueOf(rs.getString("split_type")))
            .createdBy(rs.getString("created_by"))
            .version(rs.getLong("version"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .deletedAt(toInstant(rs.getTimestamp("deleted_at")))
            .deletedBy(rs.getString("deleted_by"))
            .splits(List.of())
            .build();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
