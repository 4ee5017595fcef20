package com.gt.lse.sessionState.impl;

import com.gt.lse.model.SessionContext;
import com.gt.lse.sessionState.SessionContextDao;
import com.gt.lse.sessionState.converter.SessionContextJsonConverter;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

public class SessionContextDaoPG implements SessionContextDao {

    private static final String LOAD_SESSION_CONTEXT_SQL =
            "SELECT context_json FROM session_context WHERE session_id = :sessionId";

    private static final String SAVE_SESSION_CONTEXT_SQL =
            "INSERT INTO session_context (session_id, user_id, status, context_json, ended_at, update_instant) " +
            "VALUES (:sessionId, :userId, :status, CAST(:contextJson AS jsonb), :endedAt, now()) " +
            "ON CONFLICT (session_id) DO UPDATE " +
            "SET status = EXCLUDED.status, context_json = EXCLUDED.context_json, ended_at = EXCLUDED.ended_at, update_instant = now()";

    private static final String PURGE_COMPLETED_SESSIONS_SQL =
            "DELETE FROM session_context WHERE status = 'Completed' AND ended_at < :cutoff";

    private static final String PURGE_ABANDONED_SESSIONS_SQL =
            "DELETE FROM session_context WHERE status <> 'Completed' AND update_instant < :cutoff";

    private final NamedParameterJdbcTemplate template;
    private final SessionContextJsonConverter converter;

    public SessionContextDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, SessionContextJsonConverter converter) {
        this.template = namedParameterJdbcTemplate;
        this.converter = converter;
    }

    @Override
    public Optional<SessionContext> loadSessionContext(String sessionId) {
        return template.query(LOAD_SESSION_CONTEXT_SQL, Map.of("sessionId", sessionId),
                        (rs, rowNum) -> converter.fromJson(rs.getString("context_json")))
                .stream()
                .findFirst();
    }

    @Override
    public void saveSessionContext(SessionContext sessionContext) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("sessionId", sessionContext.sessionId())
                .addValue("userId", sessionContext.userId())
                .addValue("status", sessionContext.status().toString())
                .addValue("contextJson", converter.toJson(sessionContext))
                .addValue("endedAt", sessionContext.endedAt() == null ? null : Timestamp.from(sessionContext.endedAt()));

        template.update(SAVE_SESSION_CONTEXT_SQL, params);
    }

    @Override
    public int purgeCompletedSessions(Instant cutoff) {
        return template.update(PURGE_COMPLETED_SESSIONS_SQL, Map.of("cutoff", Timestamp.from(cutoff)));
    }

    @Override
    public int purgeAbandonedSessions(Instant cutoff) {
        return template.update(PURGE_ABANDONED_SESSIONS_SQL, Map.of("cutoff", Timestamp.from(cutoff)));
    }
}
