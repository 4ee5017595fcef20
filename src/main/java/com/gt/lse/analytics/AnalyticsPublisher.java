package com.gt.lse.analytics;

import com.gt.lse.conf.BeanConfig;
import com.gt.lse.model.AnalyticsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget hand-off to the analytics sink. Publishing never blocks or fails the caller: when
 * the executor's queue is full the record is dropped, and sink failures are only logged.
 */
@Component
public class AnalyticsPublisher {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsPublisher.class);

    private final AnalyticsSink analyticsSink;
    private final TaskExecutor analyticsExecutor;

    private final AtomicLong droppedRecords = new AtomicLong();

    @Autowired
    public AnalyticsPublisher(AnalyticsSink analyticsSink,
                              @Qualifier(BeanConfig.ANALYTICS_EXECUTOR) TaskExecutor analyticsExecutor) {
        this.analyticsSink = analyticsSink;
        this.analyticsExecutor = analyticsExecutor;
    }

    public void publish(AnalyticsRecord analyticsRecord) {
        try {
            analyticsExecutor.execute(() -> deliver(analyticsRecord));
        } catch (TaskRejectedException ex) {
            long dropped = droppedRecords.incrementAndGet();
            log.warn("Analytics queue full, dropped record for event {}. {} records dropped so far.",
                    analyticsRecord.event().eventId(), dropped);
        }
    }

    public long getDroppedRecords() {
        return droppedRecords.get();
    }

    private void deliver(AnalyticsRecord analyticsRecord) {
        try {
            analyticsSink.publish(analyticsRecord);
        } catch (RuntimeException ex) {
            log.warn("Unable to publish analytics for event {}", analyticsRecord.event().eventId(), ex);
        }
    }
}
