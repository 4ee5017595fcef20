package com.gt.lse.adaptive;

import com.gt.lse.model.DomainProgress;
import com.gt.lse.model.DomainSummary;
import com.gt.lse.model.OutcomeCounts;
import com.gt.lse.model.WindowEntry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Learning metrics reported in a session summary. All of them are derived from the effectiveness
 * windows and outcome counts the session already holds, so summarizing never touches the durable tier.
 */
@Component
public class LearningMetrics {

    private static final Duration MIN_VELOCITY_SPAN = Duration.ofMinutes(1);
    private static final double SECONDS_PER_HOUR = 3600;

    private final EffectivenessCalculator effectivenessCalculator;
    private final double masteryThreshold;

    @Autowired
    public LearningMetrics(EffectivenessCalculator effectivenessCalculator,
                           @Value("${lse.metrics.masteryThreshold:0.85}") double masteryThreshold) {
        if (masteryThreshold <= 0 || masteryThreshold > 1) {
            throw new IllegalArgumentException("Mastery threshold must be in (0, 1], was " + masteryThreshold);
        }

        this.effectivenessCalculator = effectivenessCalculator;
        this.masteryThreshold = masteryThreshold;
    }

    public DomainSummary summarize(DomainProgress progress) {
        List<WindowEntry> window = progress.window();

        return new DomainSummary(
                progress.skillDomain(),
                progress.state(),
                progress.score(),
                window.size(),
                effectivenessCalculator.accuracy(window),
                effectivenessCalculator.difficultyTrend(window),
                difficultyProgression(window),
                retentionRate(window),
                estimateMasteryTime(window));
    }

    // Correct answers per hour of session time. Sessions shorter than a minute count as one minute.
    public double learningVelocity(OutcomeCounts outcomeCounts, Instant startedAt, Instant endedAt) {
        if (outcomeCounts.correct() == 0) {
            return 0;
        }

        Duration span = Duration.between(startedAt, endedAt);
        if (span.compareTo(MIN_VELOCITY_SPAN) < 0) {
            span = MIN_VELOCITY_SPAN;
        }

        return outcomeCounts.correct() / (span.toMillis() / 1000.0 / SECONDS_PER_HOUR);
    }

    // Average change in base difficulty per interaction between the oldest and newest window entries
    public double difficultyProgression(List<WindowEntry> window) {
        if (window.size() < 2) {
            return 0;
        }

        double first = window.get(0).baseDifficulty();
        double last = window.get(window.size() - 1).baseDifficulty();
        return (last - first) / (window.size() - 1);
    }

    /**
     * Accuracy on items seen again within the window relative to accuracy on their first showing,
     * capped at 1. Returns 0 when the window has no repeats or the first showings earned no credit.
     */
    public double retentionRate(List<WindowEntry> window) {
        Set<String> seen = new HashSet<>();
        double initialCredit = 0;
        int initialCount = 0;
        double repeatCredit = 0;
        int repeatCount = 0;

        for (WindowEntry entry : window) {
            if (seen.add(entry.itemId())) {
                initialCredit += entry.outcome().getCredit();
                initialCount++;
            } else {
                repeatCredit += entry.outcome().getCredit();
                repeatCount++;
            }
        }

        if (initialCount == 0 || repeatCount == 0 || initialCredit == 0) {
            return 0;
        }

        double initialAccuracy = initialCredit / initialCount;
        double repeatAccuracy = repeatCredit / repeatCount;
        return Math.min(repeatAccuracy / initialAccuracy, 1.0);
    }

    /**
     * Linear projection of the time left until window accuracy reaches the mastery threshold, based on
     * the accuracy gained over the window's time span. Zero once the threshold is reached; null when
     * there is no trajectory to project from.
     */
    public Duration estimateMasteryTime(List<WindowEntry> window) {
        if (window.isEmpty()) {
            return null;
        }

        double accuracy = effectivenessCalculator.accuracy(window);
        if (accuracy >= masteryThreshold) {
            return Duration.ZERO;
        }

        if (window.size() < 2) {
            return null;
        }

        Instant first = window.get(0).occurredAt();
        Instant last = window.get(window.size() - 1).occurredAt();
        if (first == null || last == null) {
            return null;
        }

        double elapsedSeconds = Duration.between(first, last).toMillis() / 1000.0;
        if (elapsedSeconds <= 0 || accuracy <= 0) {
            return null;
        }

        double accuracyPerSecond = accuracy / elapsedSeconds;
        return Duration.ofMillis(Math.round((masteryThreshold - accuracy) / accuracyPerSecond * 1000));
    }
}
