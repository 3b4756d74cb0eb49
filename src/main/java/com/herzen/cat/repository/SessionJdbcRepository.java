package com.herzen.cat.repository;

import com.herzen.cat.session.SessionModels.SessionSnapshot;
import com.herzen.cat.session.SessionModels.SessionState;
import com.herzen.cat.session.SessionSnapshotCodec;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class SessionJdbcRepository {
    private final JdbcTemplate jdbcTemplate;
    private final SessionSnapshotCodec codec;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate, SessionSnapshotCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    public void save(SessionSnapshot snapshot) {
        jdbcTemplate.update(
                "MERGE INTO adaptive_sessions(session_id, learner_id, topic, state, schema_version, snapshot, started_at, updated_at) KEY(session_id) VALUES (?,?,?,?,?,?,?,?)",
                snapshot.sessionId(), snapshot.learner().id(), snapshot.topic(), snapshot.state().name(),
                snapshot.schemaVersion(), codec.write(snapshot), snapshot.startedAt().toString(), Instant.now().toString());
    }

    public Optional<SessionSnapshot> findById(String sessionId) {
        return jdbcTemplate.query(
                        "SELECT snapshot FROM adaptive_sessions WHERE session_id = ?",
                        (rs, n) -> rs.getString(1),
                        sessionId)
                .stream()
                .findFirst()
                .map(codec::read);
    }

    public List<SessionSnapshot> findByLearner(String learnerId, SessionState state) {
        List<String> rows = state == null
                ? jdbcTemplate.queryForList(
                "SELECT snapshot FROM adaptive_sessions WHERE learner_id = ? ORDER BY started_at DESC", String.class, learnerId)
                : jdbcTemplate.queryForList(
                "SELECT snapshot FROM adaptive_sessions WHERE learner_id = ? AND state = ? ORDER BY started_at DESC", String.class, learnerId, state.name());
        return rows.stream()
                .map(codec::read)
                .toList();
    }
}
