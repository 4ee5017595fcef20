package com.gt.lse.analytics;

import com.gt.lse.model.AnalyticsRecord;
import com.gt.lse.model.EffectivenessSignal;
import com.gt.lse.model.Outcome;
import com.gt.lse.util.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static com.gt.lse.util.TestUtils.NOW;
import static com.gt.lse.util.TestUtils.TEST_USER_ID;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class AnalyticsPublisherTests {

    private static final AnalyticsRecord RECORD = new AnalyticsRecord(TEST_USER_ID,
            TestUtils.buildEvent("session-1", "hello", Outcome.Correct, 2000, 0),
            new EffectivenessSignal("session-1", "greetings", 0.98, 1.0, 2000, 0, 0.5, 1, NOW));

    @Mock private AnalyticsSink analyticsSink;

    @Test
    public void testRecordDeliveredToSink() {
        TaskExecutor directExecutor = Runnable::run;
        AnalyticsPublisher analyticsPublisher = new AnalyticsPublisher(analyticsSink, directExecutor);

        analyticsPublisher.publish(RECORD);

        verify(analyticsSink, times(1)).publish(RECORD);
        assertEquals(0, analyticsPublisher.getDroppedRecords());
    }

    @Test
    public void testSinkFailureDoesNotReachCaller() {
        TaskExecutor directExecutor = Runnable::run;
        AnalyticsPublisher analyticsPublisher = new AnalyticsPublisher(analyticsSink, directExecutor);
        doThrow(new TransientDataAccessResourceException("analytics db down")).when(analyticsSink).publish(any(AnalyticsRecord.class));

        assertDoesNotThrow(() -> analyticsPublisher.publish(RECORD));

        verify(analyticsSink, times(1)).publish(RECORD);
    }

    @Test
    public void testFullQueueDropsRecords() {
        TaskExecutor saturatedExecutor = task -> {
            throw new TaskRejectedException("queue full");
        };
        AnalyticsPublisher analyticsPublisher = new AnalyticsPublisher(analyticsSink, saturatedExecutor);

        analyticsPublisher.publish(RECORD);
        analyticsPublisher.publish(RECORD);

        assertEquals(2, analyticsPublisher.getDroppedRecords());
        verifyNoInteractions(analyticsSink);
    }
}
