package com.gt.lse.content.impl;

import com.gt.lse.content.LearningItemDao;
import com.gt.lse.model.DifficultyRange;
import com.gt.lse.model.LearningItem;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class LearningItemDaoPG implements LearningItemDao {

    private static final String LOAD_ITEMS_SQL =
            "SELECT id, skill_domains, base_difficulty, payload_ref " +
            "FROM learning_item " +
            "WHERE id IN (:itemIds)";

    private static final String FIND_ITEMS_SQL =
            "SELECT id, skill_domains, base_difficulty, payload_ref " +
            "FROM learning_item " +
            "WHERE :skillDomain = ANY(skill_domains) AND base_difficulty >= :minDifficulty AND base_difficulty <= :maxDifficulty " +
                "AND id NOT IN (:excludeIds) " +
            "LIMIT :limit";

    private final NamedParameterJdbcTemplate template;

    public LearningItemDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<LearningItem> loadItems(Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_ITEMS_SQL, Map.of("itemIds", itemIds), LearningItemDaoPG::getLearningItemFromResultSet);
    }

    @Override
    public List<LearningItem> findItems(String skillDomain, DifficultyRange difficultyRange, Collection<String> excludeIds, int limit) {
        return template.query(FIND_ITEMS_SQL, Map.of(
                        "skillDomain", skillDomain,
                        "minDifficulty", difficultyRange.min(),
                        "maxDifficulty", difficultyRange.max(),
                        "excludeIds", excludeIds.isEmpty() ? List.of("") : excludeIds,   // an empty IN list is not valid SQL
                        "limit", limit),
                LearningItemDaoPG::getLearningItemFromResultSet);
    }

    private static LearningItem getLearningItemFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        Array skillDomains = rs.getArray("skill_domains");

        return new LearningItem(
                rs.getString("id"),
                skillDomains == null ? List.of() : Arrays.asList((String[]) skillDomains.getArray()),
                rs.getDouble("base_difficulty"),
                rs.getString("payload_ref"));
    }
}
