package com.gt.lse.content;

import com.gt.lse.model.DifficultyRange;
import com.gt.lse.model.LearningItem;

import java.util.Collection;
import java.util.List;

public interface LearningItemDao {

    List<LearningItem> loadItems(Collection<String> itemIds);

    List<LearningItem> findItems(String skillDomain, DifficultyRange difficultyRange, Collection<String> excludeIds, int limit);
}
