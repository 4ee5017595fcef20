package com.gt.lse.reviewState.impl;

import com.gt.lse.model.ReviewState;
import com.gt.lse.reviewState.ReviewStateDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ReviewStateDaoPG implements ReviewStateDao {

    private static final String REVIEW_STATE_COLUMNS =
            "user_id, item_id, repetitions, stability_days, difficulty_factor, last_reviewed, next_due, lapses, correct_streak, version ";

    private static final String LOAD_REVIEW_STATE_SQL =
            "SELECT " + REVIEW_STATE_COLUMNS +
            "FROM review_state " +
            "WHERE user_id = :userId AND item_id = :itemId";

    private static final String LOAD_REVIEW_STATES_SQL =
            "SELECT " + REVIEW_STATE_COLUMNS +
            "FROM review_state " +
            "WHERE user_id = :userId AND item_id IN (:itemIds)";

    private static final String LOAD_DUE_REVIEW_STATES_SQL =
            "SELECT " + REVIEW_STATE_COLUMNS +
            "FROM review_state rs " +
            "JOIN learning_item li ON li.id = rs.item_id " +
            "WHERE rs.user_id = :userId AND rs.next_due <= :cutoff " +
            "ORDER BY rs.next_due ASC, rs.stability_days ASC " +
            "LIMIT :limit";

    private static final String LOAD_DUE_REVIEW_STATES_IN_DOMAINS_SQL =
            "SELECT " + REVIEW_STATE_COLUMNS +
            "FROM review_state rs " +
            "JOIN learning_item li ON li.id = rs.item_id " +
            "WHERE rs.user_id = :userId AND rs.next_due <= :cutoff " +
                "AND EXISTS (SELECT 1 FROM unnest(li.skill_domains) AS domain WHERE domain IN (:skillDomains)) " +
            "ORDER BY rs.next_due ASC, rs.stability_days ASC " +
            "LIMIT :limit";

    private static final String INSERT_REVIEW_STATE_SQL =
            "INSERT INTO review_state (" + REVIEW_STATE_COLUMNS + ", update_instant) " +
            "VALUES (:userId, :itemId, :repetitions, :stabilityDays, :difficultyFactor, :lastReviewed, :nextDue, :lapses, :correctStreak, :newVersion, now()) " +
            "ON CONFLICT (user_id, item_id) DO NOTHING";

    private static final String UPDATE_REVIEW_STATE_SQL =
            "UPDATE review_state " +
            "SET repetitions = :repetitions, stability_days = :stabilityDays, difficulty_factor = :difficultyFactor, last_reviewed = :lastReviewed, " +
                "next_due = :nextDue, lapses = :lapses, correct_streak = :correctStreak, version = :newVersion, update_instant = now() " +
            "WHERE user_id = :userId AND item_id = :itemId AND version = :expectedVersion";

    private final NamedParameterJdbcTemplate template;

    public ReviewStateDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Optional<ReviewState> loadReviewState(String userId, String itemId) {
        return template.query(LOAD_REVIEW_STATE_SQL, Map.of("userId", userId, "itemId", itemId),
                ReviewStateDaoPG::getReviewStateFromResultSet).stream().findFirst();
    }

    @Override
    public List<ReviewState> loadReviewStates(String userId, Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_REVIEW_STATES_SQL, Map.of("userId", userId, "itemIds", itemIds),
                ReviewStateDaoPG::getReviewStateFromResultSet);
    }

    @Override
    public List<ReviewState> loadDueReviewStates(String userId, Instant cutoff, Collection<String> skillDomains, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("cutoff", Timestamp.from(cutoff))
                .addValue("limit", limit);

        if (skillDomains.isEmpty()) {
            return template.query(LOAD_DUE_REVIEW_STATES_SQL, params, ReviewStateDaoPG::getReviewStateFromResultSet);
        }

        params.addValue("skillDomains", skillDomains);
        return template.query(LOAD_DUE_REVIEW_STATES_IN_DOMAINS_SQL, params, ReviewStateDaoPG::getReviewStateFromResultSet);
    }

    @Override
    public boolean compareAndSwap(ReviewState updated, long expectedVersion) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", updated.userId())
                .addValue("itemId", updated.itemId())
                .addValue("repetitions", updated.repetitions())
                .addValue("stabilityDays", updated.stabilityDays())
                .addValue("difficultyFactor", updated.difficultyFactor())
                .addValue("lastReviewed", toTimestamp(updated.lastReviewed()))
                .addValue("nextDue", toTimestamp(updated.nextDue()))
                .addValue("lapses", updated.lapses())
                .addValue("correctStreak", updated.correctStreak())
                .addValue("expectedVersion", expectedVersion)
                .addValue("newVersion", expectedVersion + 1);

        String sql = expectedVersion == 0 ? INSERT_REVIEW_STATE_SQL : UPDATE_REVIEW_STATE_SQL;

        return template.update(sql, params) == 1;
    }

    private static ReviewState getReviewStateFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewState(
                rs.getString("user_id"),
                rs.getString("item_id"),
                rs.getInt("repetitions"),
                rs.getDouble("stability_days"),
                rs.getDouble("difficulty_factor"),
                toInstant(rs.getTimestamp("last_reviewed")),
                toInstant(rs.getTimestamp("next_due")),
                rs.getInt("lapses"),
                rs.getInt("correct_streak"),
                rs.getLong("version"));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
