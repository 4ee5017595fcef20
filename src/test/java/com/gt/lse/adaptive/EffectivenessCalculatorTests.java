package com.gt.lse.adaptive;

import com.gt.lse.model.EffectivenessSignal;
import com.gt.lse.model.Outcome;
import com.gt.lse.model.WindowEntry;
import com.gt.lse.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.ArrayList;
import java.util.List;

import static com.gt.lse.util.TestUtils.NOW;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class EffectivenessCalculatorTests {

    private static final String SESSION_ID = "session-1";
    private static final String DOMAIN = "greetings";
    private static final double DELTA = 1e-6;

    private EffectivenessCalculator effectivenessCalculator;

    @BeforeEach
    public void initTests() {
        effectivenessCalculator = TestUtils.getEffectivenessCalculator();
    }

    @Test
    public void testEmptyWindowScoresNeutral() {
        EffectivenessSignal signal = effectivenessCalculator.compute(SESSION_ID, DOMAIN, List.of(), NOW);

        assertEquals(0.5, signal.score(), DELTA);
        assertEquals(0, signal.sampleSize());
        assertEquals(0, signal.accuracy(), DELTA);
        assertEquals(NOW, signal.computedAt());
    }

    @Test
    public void testFastCorrectAnswersScoreHigh() {
        List<WindowEntry> window = buildWindow(Outcome.Correct, 2000, 5);

        EffectivenessSignal signal = effectivenessCalculator.compute(SESSION_ID, DOMAIN, window, NOW);

        assertEquals(1.0, signal.accuracy(), DELTA);
        assertEquals(2000, signal.averageLatencyMs(), DELTA);
        assertEquals(0, signal.hesitationRate(), DELTA);
        assertEquals(0.6 + 0.25 * (1 - 2000.0 / 30000) + 0.15, signal.score(), DELTA);
        assertEquals(5, signal.sampleSize());
    }

    @Test
    public void testSlowIncorrectAnswersScoreZero() {
        List<WindowEntry> window = buildWindow(Outcome.Incorrect, 40000, 4);

        EffectivenessSignal signal = effectivenessCalculator.compute(SESSION_ID, DOMAIN, window, NOW);

        assertEquals(0, signal.score(), DELTA);
        assertEquals(1.0, signal.hesitationRate(), DELTA);
    }

    @Test
    public void testPartialCreditAndHesitation() {
        List<WindowEntry> window = List.of(
                new WindowEntry("a", Outcome.Partial, 12000, 1.0, NOW),
                new WindowEntry("b", Outcome.Correct, 3000, 1.0, NOW),
                new WindowEntry("c", Outcome.Incorrect, 6000, 1.0, NOW),
                new WindowEntry("d", Outcome.Partial, 15000, 1.0, NOW));

        EffectivenessSignal signal = effectivenessCalculator.compute(SESSION_ID, DOMAIN, window, NOW);

        assertEquals(0.5, signal.accuracy(), DELTA);
        assertEquals(9000, signal.averageLatencyMs(), DELTA);
        assertEquals(0.5, signal.hesitationRate(), DELTA);
        assertEquals(0.5 * 0.6 + 0.7 * 0.25 + 0.5 * 0.15, signal.score(), DELTA);
    }

    @Test
    public void testNegativeLatencyTreatedAsZero() {
        List<WindowEntry> window = List.of(new WindowEntry("a", Outcome.Correct, -500, 1.0, NOW));

        EffectivenessSignal signal = effectivenessCalculator.compute(SESSION_ID, DOMAIN, window, NOW);

        assertEquals(0, signal.averageLatencyMs(), DELTA);
        assertEquals(1.0, signal.score(), DELTA);
    }

    @Test
    public void testAppendKeepsMostRecentEntries() {
        List<WindowEntry> window = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            window = effectivenessCalculator.append(window, new WindowEntry("item-" + i, Outcome.Correct, 1000, 1.0, NOW.plusSeconds(i)));
        }

        assertEquals(effectivenessCalculator.getWindowSize(), window.size());
        assertEquals("item-4", window.get(0).itemId());
        assertEquals("item-13", window.get(window.size() - 1).itemId());
    }

    @Test
    public void testAppendLeavesOriginalWindowUntouched() {
        List<WindowEntry> original = List.of(new WindowEntry("a", Outcome.Correct, 1000, 1.0, NOW));

        List<WindowEntry> appended = effectivenessCalculator.append(original, new WindowEntry("b", Outcome.Incorrect, 1000, 1.0, NOW));

        assertEquals(1, original.size());
        assertEquals(2, appended.size());
    }

    @Test
    public void testDifficultyTrendFollowsItemDifficulty() {
        List<WindowEntry> rising = withDifficulties(1.0, 2.0, 3.0, 4.0);
        List<WindowEntry> falling = withDifficulties(4.0, 3.0, 2.0, 1.0);

        assertEquals(1.0, effectivenessCalculator.difficultyTrend(rising), DELTA);
        assertEquals(0.0, effectivenessCalculator.difficultyTrend(falling), DELTA);
        assertEquals(0.5, effectivenessCalculator.difficultyTrend(withDifficulties(2.0, 2.0, 2.0)), DELTA);
        assertEquals(0.5, effectivenessCalculator.difficultyTrend(withDifficulties(1.0, 3.0)), DELTA);
        assertEquals(1.0, effectivenessCalculator.compute(SESSION_ID, DOMAIN, rising, NOW).difficultyTrend(), DELTA);
        assertEquals(0.5, effectivenessCalculator.compute(SESSION_ID, DOMAIN, List.of(), NOW).difficultyTrend(), DELTA);
    }

    @Test
    public void testDifficultyTrendIgnoredUnlessWeighted() {
        List<WindowEntry> falling = withDifficulties(4.0, 3.0, 2.0, 1.0);
        EffectivenessCalculator trendWeighted = new EffectivenessCalculator(10, 0.4, 0.2, 0.2, 0.2, 30000, 10000, 0.5);

        assertEquals(0.6 + 0.25 * (1 - 2000.0 / 30000) + 0.15,
                effectivenessCalculator.compute(SESSION_ID, DOMAIN, falling, NOW).score(), DELTA);
        assertEquals(0.4 + 0.2 * (1 - 2000.0 / 30000) + 0.2,
                trendWeighted.compute(SESSION_ID, DOMAIN, falling, NOW).score(), DELTA);
        assertEquals(0.4 + 0.2 * (1 - 2000.0 / 30000) + 0.2 + 0.2,
                trendWeighted.compute(SESSION_ID, DOMAIN, withDifficulties(1.0, 2.0, 3.0, 4.0), NOW).score(), DELTA);
    }

    @Test
    public void testInvalidConfigurationRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EffectivenessCalculator(0, 0.6, 0.25, 0.15, 0.0, 30000, 10000, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new EffectivenessCalculator(10, 0.6, 0.25, 0.15, 0.0, 0, 10000, 0.5));
    }

    private static List<WindowEntry> withDifficulties(double... difficulties) {
        List<WindowEntry> window = new ArrayList<>();
        for (int i = 0; i < difficulties.length; i++) {
            window.add(new WindowEntry("item-" + i, Outcome.Correct, 2000, difficulties[i], NOW.plusSeconds(i)));
        }
        return window;
    }

    private static List<WindowEntry> buildWindow(Outcome outcome, long latencyMs, int size) {
        List<WindowEntry> window = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            window.add(new WindowEntry("item-" + i, outcome, latencyMs, 1.0, NOW.plusSeconds(i)));
        }
        return window;
    }
}
