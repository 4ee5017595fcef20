package com.gt.lse.analytics.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.lse.analytics.AnalyticsSink;
import com.gt.lse.exception.MappingException;
import com.gt.lse.model.AnalyticsRecord;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;

public class AnalyticsSinkPG implements AnalyticsSink {

    private static final String INSERT_ANALYTICS_EVENT_SQL =
            "INSERT INTO analytics_event (event_id, session_id, user_id, skill_domain, score, payload, update_instant) " +
            "VALUES (:eventId, :sessionId, :userId, :skillDomain, :score, CAST(:payload AS jsonb), now()) " +
            "ON CONFLICT (event_id) DO NOTHING";

    private static final String PURGE_OLD_ANALYTICS_EVENTS_SQL =
            "DELETE FROM analytics_event WHERE update_instant < :cutoff";

    private final NamedParameterJdbcTemplate template;
    private final ObjectMapper objectMapper;

    public AnalyticsSinkPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        this.template = namedParameterJdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(AnalyticsRecord analyticsRecord) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(analyticsRecord);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Unable to serialize analytics for event " + analyticsRecord.event().eventId(), ex);
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("eventId", analyticsRecord.event().eventId())
                .addValue("sessionId", analyticsRecord.event().sessionId())
                .addValue("userId", analyticsRecord.userId())
                .addValue("skillDomain", analyticsRecord.signal().skillDomain())
                .addValue("score", analyticsRecord.signal().score())
                .addValue("payload", payload);

        template.update(INSERT_ANALYTICS_EVENT_SQL, params);
    }

    @Override
    public int purgeOldRecords(Instant cutoff) {
        return template.update(PURGE_OLD_ANALYTICS_EVENTS_SQL, Map.of("cutoff", Timestamp.from(cutoff)));
    }
}
