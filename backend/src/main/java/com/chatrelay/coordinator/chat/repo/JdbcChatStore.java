package com.chatrelay.coordinator.chat.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class JdbcChatStore implements ChatStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcChatStore.class);

    private static final RowMapper<StoredMessage> MESSAGE_ROW = (rs, rowNum) -> new StoredMessage(
            rs.getString("conversation_id"),
            rs.getLong("seq"),
            rs.getString("sender_id"),
            new MessagePayload(rs.getString("text_content"), rs.getString("attachment_ref")),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcChatStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public long appendMessage(String conversationId, String senderId, MessagePayload payload) {
        // Callers serialize appends per conversation; the primary key rejects a racing writer.
        Long next = jdbcTemplate.queryForObject(
                "select coalesce(max(seq), 0) + 1 from chat_message where conversation_id = ?",
                Long.class,
                conversationId
        );
        long seq = next == null ? 1L : next;

        var sql = """
                insert into chat_message(conversation_id, seq, sender_id, text_content, attachment_ref, created_at)
                values (?, ?, ?, ?, ?, ?)
                """;
        jdbcTemplate.update(sql,
                conversationId,
                seq,
                senderId,
                blankToNull(payload.text()),
                blankToNull(payload.attachmentRef()),
                Timestamp.from(clock.instant())
        );
        return seq;
    }

    @Override
    public List<StoredMessage> fetchHistory(String conversationId, long sinceSeq, int limit) {
        var sql = """
                select conversation_id, seq, sender_id, text_content, attachment_ref, created_at
                from chat_message
                where conversation_id = ? and seq > ?
                order by seq asc
                limit ?
                """;
        return jdbcTemplate.query(sql, MESSAGE_ROW, conversationId, sinceSeq, limit);
    }

    @Override
    public Optional<StoredMessage> findMessage(String conversationId, long seq) {
        var sql = """
                select conversation_id, seq, sender_id, text_content, attachment_ref, created_at
                from chat_message
                where conversation_id = ? and seq = ?
                """;
        return jdbcTemplate.query(sql, MESSAGE_ROW, conversationId, seq).stream().findFirst();
    }

    @Override
    public Set<String> fetchMembership(String conversationId) {
        var list = jdbcTemplate.queryForList(
                "select user_id from conversation_member where conversation_id = ?",
                String.class,
                conversationId
        );
        return new LinkedHashSet<>(list);
    }

    @Override
    public Set<String> listConversationIds(String userId) {
        var list = jdbcTemplate.queryForList(
                "select conversation_id from conversation_member where user_id = ?",
                String.class,
                userId
        );
        return new LinkedHashSet<>(list);
    }

    @Override
    public long updateReadCursor(String conversationId, String userId, long seq) {
        var now = Timestamp.from(clock.instant());
        var updated = jdbcTemplate.update("""
                update read_cursor set last_read_seq = ?, updated_at = ?
                where conversation_id = ? and user_id = ? and last_read_seq < ?
                """, seq, now, conversationId, userId, seq);

        if (updated == 0) {
            try {
                jdbcTemplate.update("""
                        insert into read_cursor(conversation_id, user_id, last_read_seq, updated_at)
                        values (?, ?, ?, ?)
                        """, conversationId, userId, seq, now);
            } catch (DuplicateKeyException alreadyAhead) {
                // Row exists with a cursor at or past seq.
                log.debug("read_cursor_not_advanced conversationId={} userId={} seq={}", conversationId, userId, seq);
            }
        }

        Long cursor = jdbcTemplate.queryForObject(
                "select last_read_seq from read_cursor where conversation_id = ? and user_id = ?",
                Long.class,
                conversationId,
                userId
        );
        return cursor == null ? seq : cursor;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
