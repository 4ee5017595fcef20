package com.gt.lse.scheduler;

import com.gt.lse.exception.SchedulerBoundsViolationException;
import com.gt.lse.model.Outcome;
import com.gt.lse.model.ReviewState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * SM-2 style scheduler. Stateless and free of I/O: every call maps a review state and an outcome
 * to the next review state. Malformed inputs are clamped into range rather than rejected.
 */
@Component
public class ItemScheduler {

    private static final Logger log = LoggerFactory.getLogger(ItemScheduler.class);

    private static final double SECONDS_PER_DAY = 86400;

    private final double initialStabilityDays;
    private final double lapseStabilityDays;
    private final double maxStabilityDays;
    private final double minDifficulty;
    private final double maxDifficulty;
    private final double baseGrowth;
    private final double growthPerDifficulty;
    private final double minGrowth;
    private final double easeStep;
    private final double lapseStep;
    private final int lapseForgivenessStreak;
    private final boolean strictBounds;

    @Autowired
    public ItemScheduler(@Value("${lse.scheduler.initialStabilityDays:1.0}") double initialStabilityDays,
                         @Value("${lse.scheduler.lapseStabilityDays:1.0}") double lapseStabilityDays,
                         @Value("${lse.scheduler.maxStabilityDays:36500}") double maxStabilityDays,
                         @Value("${lse.scheduler.minDifficulty:0.3}") double minDifficulty,
                         @Value("${lse.scheduler.maxDifficulty:5.0}") double maxDifficulty,
                         @Value("${lse.scheduler.baseGrowth:3.5}") double baseGrowth,
                         @Value("${lse.scheduler.growthPerDifficulty:0.5}") double growthPerDifficulty,
                         @Value("${lse.scheduler.minGrowth:1.3}") double minGrowth,
                         @Value("${lse.scheduler.easeStep:0.15}") double easeStep,
                         @Value("${lse.scheduler.lapseStep:0.3}") double lapseStep,
                         @Value("${lse.scheduler.lapseForgivenessStreak:3}") int lapseForgivenessStreak,
                         @Value("${lse.scheduler.strictBounds:false}") boolean strictBounds) {
        if (lapseStabilityDays <= 0 || initialStabilityDays <= 0) {
            throw new IllegalArgumentException("Stability floors must be positive");
        }
        if (minDifficulty > maxDifficulty) {
            throw new IllegalArgumentException("Difficulty bounds are inverted: " + minDifficulty + " > " + maxDifficulty);
        }
        if (minGrowth < 1) {
            throw new IllegalArgumentException("Minimum stability growth must be at least 1, was " + minGrowth);
        }

        this.initialStabilityDays = initialStabilityDays;
        this.lapseStabilityDays = lapseStabilityDays;
        this.maxStabilityDays = Math.max(maxStabilityDays, Math.max(initialStabilityDays, lapseStabilityDays));
        this.minDifficulty = minDifficulty;
        this.maxDifficulty = maxDifficulty;
        this.baseGrowth = baseGrowth;
        this.growthPerDifficulty = growthPerDifficulty;
        this.minGrowth = minGrowth;
        this.easeStep = easeStep;
        this.lapseStep = lapseStep;
        this.lapseForgivenessStreak = lapseForgivenessStreak;
        this.strictBounds = strictBounds;
    }

    public ReviewState schedule(ReviewState current, Outcome outcome, Instant now) {
        ReviewState sanitized = sanitize(current);
        Instant reviewInstant = sanitized.lastReviewed() != null && now.isBefore(sanitized.lastReviewed())
                ? sanitized.lastReviewed()
                : now;

        ReviewState scheduled = switch (outcome) {
            case Correct -> processRecalled(sanitized, reviewInstant, true);
            case Partial -> processRecalled(sanitized, reviewInstant, false);
            case Incorrect -> processLapse(sanitized, reviewInstant);
        };

        return verifyBounds(scheduled, reviewInstant);
    }

    public double clampDifficulty(double difficulty) {
        if (Double.isNaN(difficulty)) {
            return minDifficulty;
        }

        return clamp(difficulty, minDifficulty, maxDifficulty);
    }

    public double getMinDifficulty() {
        return minDifficulty;
    }

    public double getMaxDifficulty() {
        return maxDifficulty;
    }

    // Partial credit grows stability like a correct answer but never eases the item
    private ReviewState processRecalled(ReviewState state, Instant reviewInstant, boolean fullCredit) {
        double newStability = state.repetitions() == 0 || state.stabilityDays() <= 0
                ? initialStabilityDays
                : state.stabilityDays() * calculateGrowth(state.difficultyFactor());
        newStability = clamp(newStability, lapseStabilityDays, maxStabilityDays);

        double newDifficulty = fullCredit ? state.difficultyFactor() - easeStep : state.difficultyFactor();

        int newStreak = fullCredit ? state.correctStreak() + 1 : state.correctStreak();
        int newLapses = state.lapses();
        if (newStreak >= lapseForgivenessStreak && newLapses > 0) {
            newLapses--;
            newStreak = 0;
        }

        return buildState(state, reviewInstant, newStability, newDifficulty, newLapses, newStreak);
    }

    private ReviewState processLapse(ReviewState state, Instant reviewInstant) {
        return buildState(state, reviewInstant, lapseStabilityDays, state.difficultyFactor() + lapseStep, state.lapses() + 1, 0);
    }

    private double calculateGrowth(double difficultyFactor) {
        return Math.max(minGrowth, baseGrowth - growthPerDifficulty * difficultyFactor);
    }

    private ReviewState buildState(ReviewState state, Instant reviewInstant, double stabilityDays, double difficulty, int lapses, int correctStreak) {
        return new ReviewState(
                state.userId(),
                state.itemId(),
                state.repetitions() + 1,
                stabilityDays,
                clampDifficulty(difficulty),
                reviewInstant,
                reviewInstant.plus(toDuration(stabilityDays)),
                lapses,
                correctStreak,
                state.version());
    }

    private ReviewState sanitize(ReviewState state) {
        double stability = state.stabilityDays();
        if (Double.isNaN(stability) || stability < 0) {
            stability = 0;
        } else if (stability > maxStabilityDays) {
            stability = maxStabilityDays;
        }

        return new ReviewState(
                state.userId(),
                state.itemId(),
                Math.max(0, state.repetitions()),
                stability,
                clampDifficulty(state.difficultyFactor()),
                state.lastReviewed(),
                state.nextDue(),
                Math.max(0, state.lapses()),
                Math.max(0, state.correctStreak()),
                state.version());
    }

    private ReviewState verifyBounds(ReviewState state, Instant reviewInstant) {
        boolean difficultyInBounds = state.difficultyFactor() >= minDifficulty && state.difficultyFactor() <= maxDifficulty;
        boolean stabilityInBounds = state.stabilityDays() >= lapseStabilityDays && state.stabilityDays() <= maxStabilityDays;
        boolean dueInFuture = state.nextDue().isAfter(reviewInstant);

        if (difficultyInBounds && stabilityInBounds && dueInFuture) {
            return state;
        }

        String errMsg = "Scheduled state for item " + state.itemId() + " out of bounds: difficulty=" + state.difficultyFactor()
                + " stability=" + state.stabilityDays() + " nextDue=" + state.nextDue();
        if (strictBounds) {
            throw new SchedulerBoundsViolationException(errMsg);
        }

        log.debug(errMsg);
        double stability = Double.isNaN(state.stabilityDays()) ? lapseStabilityDays : clamp(state.stabilityDays(), lapseStabilityDays, maxStabilityDays);
        return new ReviewState(state.userId(), state.itemId(), state.repetitions(), stability, clampDifficulty(state.difficultyFactor()),
                reviewInstant, reviewInstant.plus(toDuration(stability)), state.lapses(), state.correctStreak(), state.version());
    }

    private static Duration toDuration(double days) {
        return Duration.ofSeconds(Math.max(1, Math.round(days * SECONDS_PER_DAY)));
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
