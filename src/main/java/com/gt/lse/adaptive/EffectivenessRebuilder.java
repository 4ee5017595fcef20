package com.gt.lse.adaptive;

import com.gt.lse.model.DomainProgress;
import com.gt.lse.model.EffectivenessSignal;
import com.gt.lse.model.InteractionEvent;
import com.gt.lse.model.LearningItem;
import com.gt.lse.model.QueuedItem;
import com.gt.lse.model.SessionContext;
import com.gt.lse.model.WindowEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays a session's interaction log to reconstruct per-domain effectiveness for a context that was
 * reloaded without it. Replay never fetches content: injections that already happened are part of
 * the stored queue.
 */
@Component
public class EffectivenessRebuilder {

    private static final Logger log = LoggerFactory.getLogger(EffectivenessRebuilder.class);

    private final EffectivenessCalculator effectivenessCalculator;
    private final AdaptiveController adaptiveController;

    @Autowired
    public EffectivenessRebuilder(EffectivenessCalculator effectivenessCalculator, AdaptiveController adaptiveController) {
        this.effectivenessCalculator = effectivenessCalculator;
        this.adaptiveController = adaptiveController;
    }

    public Map<String, DomainProgress> rebuild(SessionContext sessionContext, List<InteractionEvent> events) {
        Map<String, LearningItem> itemsById = new HashMap<>();
        for (QueuedItem queuedItem : sessionContext.queue()) {
            itemsById.putIfAbsent(queuedItem.itemId(), queuedItem.item());
        }

        Map<String, DomainProgress> effectiveness = new LinkedHashMap<>();
        int skipped = 0;
        for (InteractionEvent event : events) {
            LearningItem item = itemsById.get(event.itemId());
            if (item == null || event.outcome() == null) {
                skipped++;
                continue;
            }

            String domain = item.primaryDomain();
            DomainProgress progress = effectiveness.getOrDefault(domain,
                    DomainProgress.empty(domain, effectivenessCalculator.getNeutralScore()));

            List<WindowEntry> window = effectivenessCalculator.append(progress.window(),
                    new WindowEntry(item.id(), event.outcome(), event.latencyMs(), item.baseDifficulty(), event.occurredAt()));
            EffectivenessSignal signal = effectivenessCalculator.compute(sessionContext.sessionId(), domain, window, event.occurredAt());

            DomainProgress transitioned = adaptiveController.applyTransition(new DomainProgress(domain, window, signal.score(),
                    progress.state(), progress.belowLowStreak(), progress.aboveLowStreak(), progress.aboveHighStreak(), false));

            effectiveness.put(domain, new DomainProgress(domain, transitioned.window(), transitioned.score(), transitioned.state(),
                    transitioned.belowLowStreak(), transitioned.aboveLowStreak(), transitioned.aboveHighStreak(), false));
        }

        if (skipped > 0) {
            log.warn("Skipped {} of {} events rebuilding effectiveness for session {}", skipped, events.size(), sessionContext.sessionId());
        }

        return effectiveness;
    }
}
