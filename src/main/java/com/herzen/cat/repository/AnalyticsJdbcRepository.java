package com.herzen.cat.repository;

import com.herzen.cat.analytics.AnalyticsModels.LearningEvent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class AnalyticsJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AnalyticsJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveEvents(List<LearningEvent> events) {
        events.forEach(e -> jdbcTemplate.update(
                "INSERT INTO learning_events(session_id, learner_id, topic, item_id, event_type, ts, payload) VALUES (?,?,?,?,?,?,?)",
                e.sessionId(), e.learnerId(), e.topic(), e.itemId(), e.eventType(),
                (e.ts() == null ? Instant.now() : e.ts()).toString(), e.payload()));
    }

    public List<LearningEvent> loadSessionEvents(String sessionId) {
        return jdbcTemplate.query(
                "SELECT session_id, learner_id, topic, item_id, event_type, ts, payload FROM learning_events WHERE session_id = ? ORDER BY id",
                (rs, n) -> new LearningEvent(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getString(5), Instant.parse(rs.getString(6)), rs.getString(7)),
                sessionId);
    }

    public long countEvents(String eventType, String topic) {
        Long value = topic == null
                ? jdbcTemplate.queryForObject("SELECT COUNT(*) FROM learning_events WHERE event_type = ?", Long.class, eventType)
                : jdbcTemplate.queryForObject("SELECT COUNT(*) FROM learning_events WHERE event_type = ? AND LOWER(topic) = LOWER(?)",
                Long.class, eventType, topic);
        return value == null ? 0 : value;
    }

    public List<ItemCountRow> countByItem(String eventType, String topic) {
        RowMapper<ItemCountRow> mapper = (rs, n) -> new ItemCountRow(rs.getString(1), rs.getLong(2));
        return topic == null
                ? jdbcTemplate.query("SELECT item_id, COUNT(*) FROM learning_events WHERE event_type = ? AND item_id IS NOT NULL GROUP BY item_id",
                mapper, eventType)
                : jdbcTemplate.query("SELECT item_id, COUNT(*) FROM learning_events WHERE event_type = ? AND item_id IS NOT NULL AND LOWER(topic) = LOWER(?) GROUP BY item_id",
                mapper, eventType, topic);
    }

    public record ItemCountRow(String itemId, long count) {}
}
