package com.gt.lse.adaptive;

import com.gt.lse.content.ContentService;
import com.gt.lse.exception.ContentServiceUnavailableException;
import com.gt.lse.model.AdaptationAction;
import com.gt.lse.model.AdaptationHint;
import com.gt.lse.model.DifficultyRange;
import com.gt.lse.model.DomainProgress;
import com.gt.lse.model.DomainState;
import com.gt.lse.model.LearningItem;
import com.gt.lse.model.Outcome;
import com.gt.lse.model.QueuedItem;
import com.gt.lse.model.WindowEntry;
import com.gt.lse.scheduler.ItemScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per skill domain state machine over the effectiveness score. Entering STRUGGLING asks for easier
 * content plus a second look at items lapsed in this session; entering ACCELERATING asks for harder
 * content. An injection that cannot be fetched stays pending and is retried on the domain's next
 * interaction.
 */
@Component
public class AdaptiveController {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveController.class);

    private final ContentService contentService;
    private final double lowThreshold;
    private final double highThreshold;
    private final int transitionWindow;
    private final double difficultyStep;
    private final int injectionSize;
    private final double maxDifficulty;

    @Autowired
    public AdaptiveController(ContentService contentService,
                              ItemScheduler itemScheduler,
                              @Value("${lse.adaptive.lowThreshold:0.6}") double lowThreshold,
                              @Value("${lse.adaptive.highThreshold:0.9}") double highThreshold,
                              @Value("${lse.adaptive.transitionWindow:5}") int transitionWindow,
                              @Value("${lse.adaptive.difficultyStep:0.5}") double difficultyStep,
                              @Value("${lse.adaptive.injectionSize:3}") int injectionSize) {
        if (lowThreshold >= highThreshold) {
            throw new IllegalArgumentException("Low threshold " + lowThreshold + " must be below high threshold " + highThreshold);
        }

        this.contentService = contentService;
        this.lowThreshold = lowThreshold;
        this.highThreshold = highThreshold;
        this.transitionWindow = transitionWindow;
        this.difficultyStep = difficultyStep;
        this.injectionSize = injectionSize;
        this.maxDifficulty = itemScheduler.getMaxDifficulty();
    }

    /**
     * Advances the domain's state machine for a freshly scored window and, when an injection is
     * pending, tries to fetch it.
     *
     * @param progress the domain's progress with the new window and score but the previous state
     * @param queue    the session queue after the answered item has been consumed
     * @param cursor   index of the first remaining queue entry
     */
    public AdaptationDecision adapt(DomainProgress progress, List<QueuedItem> queue, int cursor) {
        DomainProgress transitioned = applyTransition(progress);
        if (transitioned.state() != progress.state()) {
            log.info("Domain {} moved from {} to {} at score {}", progress.skillDomain(), progress.state(), transitioned.state(), progress.score());
        }

        if (!transitioned.adaptationPending() || transitioned.state() == DomainState.Nominal) {
            return new AdaptationDecision(withPending(transitioned, false),
                    AdaptationHint.hold(transitioned.skillDomain(), transitioned.state()), List.of(), List.of());
        }

        return inject(transitioned, queue, cursor);
    }

    // State transition only, with no content fetch
    public DomainProgress applyTransition(DomainProgress progress) {
        double score = progress.score();
        boolean belowLow = score < lowThreshold;
        boolean aboveHigh = score > highThreshold;

        int belowLowStreak = belowLow ? progress.belowLowStreak() + 1 : 0;
        int aboveLowStreak = belowLow ? 0 : progress.aboveLowStreak() + 1;
        int aboveHighStreak = aboveHigh ? progress.aboveHighStreak() + 1 : 0;

        DomainState state = progress.state();
        boolean pending = progress.adaptationPending();

        switch (state) {
            case Nominal -> {
                if (belowLow && progress.window().size() >= transitionWindow) {
                    state = DomainState.Struggling;
                    pending = true;
                } else if (aboveHighStreak >= transitionWindow) {
                    state = DomainState.Accelerating;
                    pending = true;
                }
            }
            case Struggling -> {
                if (aboveLowStreak >= transitionWindow) {
                    state = DomainState.Nominal;
                    pending = false;
                }
            }
            case Accelerating -> {
                if (!aboveHigh) {
                    state = DomainState.Nominal;
                    pending = false;
                }
            }
        }

        return new DomainProgress(progress.skillDomain(), progress.window(), score, state,
                belowLowStreak, aboveLowStreak, aboveHighStreak, pending);
    }

    private AdaptationDecision inject(DomainProgress progress, List<QueuedItem> queue, int cursor) {
        String domain = progress.skillDomain();
        boolean remediate = progress.state() == DomainState.Struggling;
        double reference = referenceDifficulty(progress.window());

        DifficultyRange range = remediate ? easierRange(reference) : harderRange(reference);
        Set<String> queuedIds = queue.stream().map(QueuedItem::itemId).collect(Collectors.toSet());

        List<LearningItem> fetched;
        try {
            fetched = contentService.fetchItems(domain, range, queuedIds).stream()
                    .filter(item -> !queuedIds.contains(item.id()))
                    .sorted(Comparator.comparingDouble(LearningItem::baseDifficulty).thenComparing(LearningItem::id))
                    .limit(injectionSize)
                    .toList();
        } catch (ContentServiceUnavailableException ex) {
            log.warn("Content service unavailable, holding queue for domain {} in degraded mode. Injection stays pending.", domain);
            return new AdaptationDecision(progress,
                    new AdaptationHint(domain, progress.state(), AdaptationAction.Hold, List.of(), true),
                    List.of(), List.of());
        }

        List<String> requeueIds = remediate ? lapsedItemIds(progress.window(), queue, cursor) : List.of();

        List<String> injectedIds = new ArrayList<>(requeueIds);
        fetched.forEach(item -> injectedIds.add(item.id()));

        AdaptationAction action = remediate ? AdaptationAction.Remediate : AdaptationAction.Escalate;
        log.debug("{} for domain {}: range [{}, {}], injecting {}", action, domain, range.min(), range.max(), injectedIds);

        return new AdaptationDecision(withPending(progress, false),
                new AdaptationHint(domain, progress.state(), action, injectedIds, false),
                fetched, requeueIds);
    }

    // Items answered incorrectly within the window that are not already waiting in the remaining queue
    private static List<String> lapsedItemIds(List<WindowEntry> window, List<QueuedItem> queue, int cursor) {
        Set<String> remainingIds = queue.subList(Math.min(cursor, queue.size()), queue.size()).stream()
                .map(QueuedItem::itemId)
                .collect(Collectors.toSet());

        Set<String> lapsed = new LinkedHashSet<>();
        for (WindowEntry entry : window) {
            if (entry.outcome() == Outcome.Incorrect && !remainingIds.contains(entry.itemId())) {
                lapsed.add(entry.itemId());
            }
        }

        return List.copyOf(lapsed);
    }

    private DifficultyRange easierRange(double reference) {
        double upper = reference - difficultyStep;
        return upper > 0 ? new DifficultyRange(0, upper) : new DifficultyRange(0, reference);
    }

    private DifficultyRange harderRange(double reference) {
        double lower = reference + difficultyStep;
        return lower <= maxDifficulty
                ? new DifficultyRange(lower, maxDifficulty)
                : new DifficultyRange(Math.min(reference, maxDifficulty), maxDifficulty);
    }

    private double referenceDifficulty(List<WindowEntry> window) {
        return window.stream()
                .mapToDouble(WindowEntry::baseDifficulty)
                .average()
                .orElse(maxDifficulty / 2);
    }

    private static DomainProgress withPending(DomainProgress progress, boolean pending) {
        if (progress.adaptationPending() == pending) {
            return progress;
        }

        return new DomainProgress(progress.skillDomain(), progress.window(), progress.score(), progress.state(),
                progress.belowLowStreak(), progress.aboveLowStreak(), progress.aboveHighStreak(), pending);
    }
}
