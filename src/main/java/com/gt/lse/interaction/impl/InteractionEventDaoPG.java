package com.gt.lse.interaction.impl;

import com.gt.lse.interaction.InteractionEventDao;
import com.gt.lse.model.InteractionEvent;
import com.gt.lse.model.InteractionKind;
import com.gt.lse.model.Outcome;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class InteractionEventDaoPG implements InteractionEventDao {

    private static final String INSERT_INTERACTION_EVENT_SQL =
            "INSERT INTO interaction_event " +
                    "(event_id, session_id, item_id, outcome, latency_ms, cursor_position, kind, occurred_at, update_instant) " +
                    "VALUES " +
                    "(:eventId, :sessionId, :itemId, :outcome, :latencyMs, :cursorPosition, :kind, :occurredAt, now()) " +
                    "ON CONFLICT (event_id) DO NOTHING";

    private static final String LOAD_SESSION_EVENTS_SQL =
            "SELECT event_id, session_id, item_id, outcome, latency_ms, cursor_position, kind, occurred_at " +
                    "FROM interaction_event " +
                    "WHERE session_id = :sessionId " +
                    "ORDER BY cursor_position ASC, occurred_at ASC";

    private static final String PURGE_OLD_EVENTS_SQL =
            "DELETE FROM interaction_event WHERE update_instant < :cutoff";

    private final NamedParameterJdbcTemplate template;

    public InteractionEventDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void appendEvents(List<InteractionEvent> events) {
        if (events.isEmpty()) {
            return;
        }

        SqlParameterSource[] batch = events.stream()
                .map(event -> new MapSqlParameterSource()
                        .addValue("eventId", event.eventId())
                        .addValue("sessionId", event.sessionId())
                        .addValue("itemId", event.itemId())
                        .addValue("outcome", event.outcome().toString())
                        .addValue("latencyMs", event.latencyMs())
                        .addValue("cursorPosition", event.cursorPosition())
                        .addValue("kind", event.kind().toString())
                        .addValue("occurredAt", Timestamp.from(event.occurredAt())))
                .toArray(SqlParameterSource[]::new);

        template.batchUpdate(INSERT_INTERACTION_EVENT_SQL, batch);
    }

    @Override
    public List<InteractionEvent> loadSessionEvents(String sessionId) {
        return template.query(LOAD_SESSION_EVENTS_SQL, Map.of("sessionId", sessionId),
                (rs, rowNum) -> new InteractionEvent(
                        rs.getString("event_id"),
                        rs.getString("session_id"),
                        rs.getString("item_id"),
                        Outcome.valueOf(rs.getString("outcome")),
                        rs.getLong("latency_ms"),
                        rs.getInt("cursor_position"),
                        InteractionKind.valueOf(rs.getString("kind")),
                        rs.getTimestamp("occurred_at").toInstant()));
    }

    @Override
    public int purgeOldEvents(Instant cutoff) {
        return template.update(PURGE_OLD_EVENTS_SQL, Map.of("cutoff", Timestamp.from(cutoff)));
    }
}
