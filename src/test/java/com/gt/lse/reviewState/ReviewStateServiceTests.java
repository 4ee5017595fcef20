package com.gt.lse.reviewState;

import com.gt.lse.exception.DaoException;
import com.gt.lse.exception.StoreUnavailableException;
import com.gt.lse.model.LearningItem;
import com.gt.lse.model.Outcome;
import com.gt.lse.model.ReviewState;
import com.gt.lse.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.gt.lse.util.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class ReviewStateServiceTests {

    private static final int MAX_SWAP_ATTEMPTS = 3;
    private static final int STORE_ATTEMPTS = 3;
    private static final LearningItem ITEM = TestUtils.buildItem("item-x", "greetings", 2.0);

    @Mock private ReviewStateDao reviewStateDao;

    private ReviewStateService reviewStateService;

    @BeforeEach
    public void initTests() {
        reviewStateService = new ReviewStateService(reviewStateDao, TestUtils.getItemScheduler(),
                TestUtils.getDurableStoreRetry(STORE_ATTEMPTS), MAX_SWAP_ATTEMPTS);
    }

    @Test
    public void testRecordOutcomeInsertsFirstExposure() {
        when(reviewStateDao.loadReviewState(TEST_USER_ID, ITEM.id())).thenReturn(Optional.empty());
        when(reviewStateDao.compareAndSwap(any(ReviewState.class), eq(0L))).thenReturn(true);

        ReviewState recorded = reviewStateService.recordOutcome(TEST_USER_ID, ITEM, Outcome.Correct, NOW);

        ArgumentCaptor<ReviewState> stateCaptor = ArgumentCaptor.forClass(ReviewState.class);
        verify(reviewStateDao, times(1)).compareAndSwap(stateCaptor.capture(), eq(0L));
        ReviewState written = stateCaptor.getValue();

        assertEquals(1, written.repetitions());
        assertEquals(INITIAL_STABILITY_DAYS, written.stabilityDays(), 1e-9);
        assertEquals(NOW.plus(Duration.ofDays(1)), written.nextDue());
        assertEquals(1, recorded.version());
        assertTrue(recorded.isPersisted());
    }

    @Test
    public void testRecordOutcomeRetriesLostSwap() {
        ReviewState stored = new ReviewState(TEST_USER_ID, ITEM.id(), 2, 3, 2.0, NOW.minus(Duration.ofDays(3)), NOW, 0, 2, 3);
        ReviewState concurrentlyUpdated = new ReviewState(TEST_USER_ID, ITEM.id(), 3, 7, 1.85, NOW.minusSeconds(5), NOW.plus(Duration.ofDays(7)), 0, 3, 4);

        when(reviewStateDao.loadReviewState(TEST_USER_ID, ITEM.id())).thenReturn(Optional.of(stored), Optional.of(concurrentlyUpdated));
        when(reviewStateDao.compareAndSwap(any(ReviewState.class), eq(3L))).thenReturn(false);
        when(reviewStateDao.compareAndSwap(any(ReviewState.class), eq(4L))).thenReturn(true);

        ReviewState recorded = reviewStateService.recordOutcome(TEST_USER_ID, ITEM, Outcome.Incorrect, NOW);

        verify(reviewStateDao, times(2)).loadReviewState(TEST_USER_ID, ITEM.id());
        assertEquals(5, recorded.version());
        assertEquals(4, recorded.repetitions());
        assertEquals(1, recorded.lapses());
    }

    @Test
    public void testRecordOutcomeGivesUpAfterRepeatedLostSwaps() {
        when(reviewStateDao.loadReviewState(TEST_USER_ID, ITEM.id())).thenReturn(Optional.empty());
        when(reviewStateDao.compareAndSwap(any(ReviewState.class), anyLong())).thenReturn(false);

        assertThrows(DaoException.class, () -> reviewStateService.recordOutcome(TEST_USER_ID, ITEM, Outcome.Correct, NOW));

        verify(reviewStateDao, times(MAX_SWAP_ATTEMPTS)).compareAndSwap(any(ReviewState.class), eq(0L));
    }

    @Test
    public void testTransientFailureRetriedUntilUnavailable() {
        when(reviewStateDao.loadReviewState(TEST_USER_ID, ITEM.id())).thenThrow(new TransientDataAccessResourceException("connection reset"));

        assertThrows(StoreUnavailableException.class, () -> reviewStateService.recordOutcome(TEST_USER_ID, ITEM, Outcome.Correct, NOW));

        verify(reviewStateDao, times(STORE_ATTEMPTS)).loadReviewState(TEST_USER_ID, ITEM.id());
        verify(reviewStateDao, never()).compareAndSwap(any(ReviewState.class), anyLong());
    }

    @Test
    public void testTransientFailureRecovers() {
        when(reviewStateDao.loadReviewState(TEST_USER_ID, ITEM.id()))
                .thenThrow(new TransientDataAccessResourceException("connection reset"))
                .thenReturn(Optional.empty());
        when(reviewStateDao.compareAndSwap(any(ReviewState.class), eq(0L))).thenReturn(true);

        ReviewState recorded = reviewStateService.recordOutcome(TEST_USER_ID, ITEM, Outcome.Partial, NOW);

        assertEquals(1, recorded.version());
        verify(reviewStateDao, times(2)).loadReviewState(TEST_USER_ID, ITEM.id());
    }

    @Test
    public void testPermanentFailureNotRetried() {
        when(reviewStateDao.loadReviewState(TEST_USER_ID, ITEM.id())).thenThrow(new DataIntegrityViolationException("bad row"));

        assertThrows(DataIntegrityViolationException.class, () -> reviewStateService.recordOutcome(TEST_USER_ID, ITEM, Outcome.Correct, NOW));

        verify(reviewStateDao, times(1)).loadReviewState(TEST_USER_ID, ITEM.id());
    }

    @Test
    public void testLoadDueReviewStatesFiltersByDomainAtTheStore() {
        ReviewState due = new ReviewState(TEST_USER_ID, "g", 2, 3, 2.0, NOW.minus(Duration.ofDays(3)), NOW.minusSeconds(60), 0, 2, 2);
        when(reviewStateDao.loadDueReviewStates(TEST_USER_ID, NOW, List.of("greetings"), 20))
                .thenThrow(new TransientDataAccessResourceException("connection reset"))
                .thenReturn(List.of(due));

        assertEquals(List.of(due), reviewStateService.loadDueReviewStates(TEST_USER_ID, NOW, List.of("greetings"), 20));

        verify(reviewStateDao, times(2)).loadDueReviewStates(TEST_USER_ID, NOW, List.of("greetings"), 20);
    }

    @Test
    public void testLoadReviewStatesKeyedByItem() {
        ReviewState first = new ReviewState(TEST_USER_ID, "a", 1, 1, 2.0, NOW, NOW.plus(Duration.ofDays(1)), 0, 1, 1);
        ReviewState second = new ReviewState(TEST_USER_ID, "b", 2, 3, 2.0, NOW, NOW.plus(Duration.ofDays(3)), 0, 2, 2);
        when(reviewStateDao.loadReviewStates(TEST_USER_ID, List.of("a", "b", "c"))).thenReturn(List.of(first, second));

        Map<String, ReviewState> states = reviewStateService.loadReviewStates(TEST_USER_ID, List.of("a", "b", "c"));

        assertEquals(Map.of("a", first, "b", second), states);
        assertTrue(reviewStateService.loadReviewStates(TEST_USER_ID, List.of()).isEmpty());
    }
}
