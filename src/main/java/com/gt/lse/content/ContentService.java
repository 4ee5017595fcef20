package com.gt.lse.content;

import com.gt.lse.conf.CachingConfig;
import com.gt.lse.exception.ContentServiceUnavailableException;
import com.gt.lse.model.DifficultyRange;
import com.gt.lse.model.LearningItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to published learning items. Results come back in no particular order; callers
 * sort them. Any backend failure surfaces as {@link ContentServiceUnavailableException}, which
 * callers treat as recoverable.
 */
@Component
public class ContentService {

    private static final Logger log = LoggerFactory.getLogger(ContentService.class);

    private final LearningItemDao learningItemDao;
    private final int maxFetchSize;

    @Autowired
    public ContentService(LearningItemDao learningItemDao,
                          @Value("${lse.content.maxFetchSize:50}") int maxFetchSize) {
        this.learningItemDao = learningItemDao;
        this.maxFetchSize = maxFetchSize;
    }

    public List<LearningItem> fetchItems(String skillDomain, DifficultyRange difficultyRange, Collection<String> excludeIds) {
        try {
            return learningItemDao.findItems(skillDomain, difficultyRange, excludeIds, maxFetchSize);
        } catch (DataAccessException ex) {
            throw unavailable("fetch items for domain " + skillDomain, ex);
        }
    }

    public List<LearningItem> loadItems(Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }

        try {
            return learningItemDao.loadItems(itemIds);
        } catch (DataAccessException ex) {
            throw unavailable("load " + itemIds.size() + " items", ex);
        }
    }

    @Cacheable(CachingConfig.LEARNING_ITEMS)
    public Optional<LearningItem> getItem(String itemId) {
        return loadItems(List.of(itemId)).stream().findFirst();
    }

    private ContentServiceUnavailableException unavailable(String operation, DataAccessException ex) {
        String errMsg = "Content service unable to " + operation;

        log.warn(errMsg, ex);
        return new ContentServiceUnavailableException(errMsg, ex);
    }
}
