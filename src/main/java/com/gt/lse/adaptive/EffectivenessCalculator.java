package com.gt.lse.adaptive;

import com.gt.lse.model.EffectivenessSignal;
import com.gt.lse.model.WindowEntry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores a rolling window of interactions in [0, 1]. The score blends credit-weighted accuracy,
 * response efficiency against a baseline latency, the share of answers given without hesitation and,
 * when weighted, the trend of item difficulty across the window. An empty window scores neutral.
 */
@Component
public class EffectivenessCalculator {

    private static final double NEUTRAL_TREND = 0.5;

    private final int windowSize;
    private final double accuracyWeight;
    private final double efficiencyWeight;
    private final double fluencyWeight;
    private final double difficultyTrendWeight;
    private final long baselineLatencyMs;
    private final long hesitationThresholdMs;
    private final double neutralScore;

    @Autowired
    public EffectivenessCalculator(@Value("${lse.effectiveness.windowSize:10}") int windowSize,
                                   @Value("${lse.effectiveness.accuracyWeight:0.6}") double accuracyWeight,
                                   @Value("${lse.effectiveness.efficiencyWeight:0.25}") double efficiencyWeight,
                                   @Value("${lse.effectiveness.fluencyWeight:0.15}") double fluencyWeight,
                                   @Value("${lse.effectiveness.difficultyTrendWeight:0.0}") double difficultyTrendWeight,
                                   @Value("${lse.effectiveness.baselineLatencyMs:30000}") long baselineLatencyMs,
                                   @Value("${lse.effectiveness.hesitationThresholdMs:10000}") long hesitationThresholdMs,
                                   @Value("${lse.effectiveness.neutralScore:0.5}") double neutralScore) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Effectiveness window must hold at least one event, was " + windowSize);
        }
        if (baselineLatencyMs <= 0) {
            throw new IllegalArgumentException("Baseline latency must be positive, was " + baselineLatencyMs);
        }

        this.windowSize = windowSize;
        this.accuracyWeight = accuracyWeight;
        this.efficiencyWeight = efficiencyWeight;
        this.fluencyWeight = fluencyWeight;
        this.difficultyTrendWeight = difficultyTrendWeight;
        this.baselineLatencyMs = baselineLatencyMs;
        this.hesitationThresholdMs = hesitationThresholdMs;
        this.neutralScore = neutralScore;
    }

    // Returns a new window with the entry appended and the oldest entries dropped beyond the window size
    public List<WindowEntry> append(List<WindowEntry> window, WindowEntry entry) {
        List<WindowEntry> updated = new ArrayList<>(window.size() + 1);
        updated.addAll(window);
        updated.add(entry);

        if (updated.size() > windowSize) {
            return new ArrayList<>(updated.subList(updated.size() - windowSize, updated.size()));
        }
        return updated;
    }

    public EffectivenessSignal compute(String sessionId, String skillDomain, List<WindowEntry> window, Instant computedAt) {
        if (window.isEmpty()) {
            return new EffectivenessSignal(sessionId, skillDomain, neutralScore, 0, 0, 0, NEUTRAL_TREND, 0, computedAt);
        }

        double totalLatency = 0;
        int hesitations = 0;
        for (WindowEntry entry : window) {
            long latency = Math.max(0, entry.latencyMs());
            totalLatency += latency;
            if (latency > hesitationThresholdMs) {
                hesitations++;
            }
        }

        double accuracy = accuracy(window);
        double averageLatency = totalLatency / window.size();
        double responseEfficiency = Math.max(0, 1 - averageLatency / baselineLatencyMs);
        double hesitationRate = (double) hesitations / window.size();
        double difficultyTrend = difficultyTrend(window);

        double score = accuracy * accuracyWeight
                + responseEfficiency * efficiencyWeight
                + (1 - hesitationRate) * fluencyWeight
                + difficultyTrend * difficultyTrendWeight;

        return new EffectivenessSignal(sessionId, skillDomain, Math.min(Math.max(score, 0.0), 1.0),
                accuracy, averageLatency, hesitationRate, difficultyTrend, window.size(), computedAt);
    }

    /**
     * Correlation between position in the window and item base difficulty, mapped from [-1, 1] onto
     * [0, 1]. Values above 0.5 mean the learner is working through harder items over time. Windows
     * shorter than three entries, or without variation in difficulty, are neutral.
     */
    public double difficultyTrend(List<WindowEntry> window) {
        int n = window.size();
        if (n < 3) {
            return NEUTRAL_TREND;
        }

        double meanPosition = (n - 1) / 2.0;
        double meanDifficulty = window.stream().mapToDouble(WindowEntry::baseDifficulty).average().orElse(0);

        double covariance = 0;
        double positionVariance = 0;
        double difficultyVariance = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanPosition;
            double dy = window.get(i).baseDifficulty() - meanDifficulty;
            covariance += dx * dy;
            positionVariance += dx * dx;
            difficultyVariance += dy * dy;
        }

        if (positionVariance == 0 || difficultyVariance == 0) {
            return NEUTRAL_TREND;
        }

        double correlation = covariance / Math.sqrt(positionVariance * difficultyVariance);
        return Math.min(Math.max((correlation + 1) / 2, 0.0), 1.0);
    }

    // Credit-weighted share of correct answers, 0 for an empty window
    public double accuracy(List<WindowEntry> window) {
        if (window.isEmpty()) {
            return 0;
        }

        return window.stream().mapToDouble(entry -> entry.outcome().getCredit()).sum() / window.size();
    }

    public double getNeutralScore() {
        return neutralScore;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
