package com.flagship.split_ledger.comment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Comment threads. Comments are append-only, so there is no version column.
 */
@Repository
@Slf4j
public class CommentStore {

    private static final String SELECT_COMMENT =
        "SELECT id, group_id, expense_id, author_id, author_name, text, created_at FROM comments ";

    private final JdbcTemplate jdbcTemplate;

    public CommentStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Comment comment) {
        jdbcTemplate.update(
            "INSERT INTO comments (id, group_id, expense_id, author_id, author_name, text, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            comment.getId(),
            comment.getGroupId(),
            comment.getExpenseId(),
            comment.getAuthorId(),
            comment.getAuthorName(),
            comment.getText(),
            Timestamp.from(comment.getCreatedAt())
        );
        log.debug("Inserted comment {} in group {}", comment.getId(), comment.getGroupId());
    }

    /**
     * Newest-first slice of one thread: the group's own comments when
     * {@code expenseId} is null, otherwise that expense's.
     *
     * @param after cursor of the last comment already seen, or null for the first page
     */
    public List<Comment> listThread(String groupId, UUID expenseId, CommentCursor after, int limit) {
        StringBuilder sql = new StringBuilder(SELECT_COMMENT).append("WHERE group_id = ? ");
        List<Object> args = new ArrayList<>();
        args.add(groupId);
        if (expenseId == null) {
            sql.append("AND expense_id IS NULL ");
        } else {
            sql.append("AND expense_id = ? ");
            args.add(expenseId);
        }
        if (after != null) {
            sql.append("AND (created_at, id) < (?, ?) ");
            args.add(Timestamp.from(after.getCreatedAt()));
            args.add(after.getId());
        }
        sql.append("ORDER BY created_at DESC, id DESC LIMIT ?");
        args.add(limit);
        return jdbcTemplate.query(sql.toString(), commentRowMapper(), args.toArray());
    }

    private static RowMapper<Comment> commentRowMapper() {
        return (rs, rowNum) -> Comment.builder()
            .id(rs.getObject("id", UUID.class))
            .groupId(rs.getString("group_id"))
            .expenseId(rs.getObject("expense_id", UUID.class))
            .authorId(rs.getString("author_id"))
            .authorName(rs.getString("author_name"))
            .text(rs.getString("text"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .build();
    }
}
