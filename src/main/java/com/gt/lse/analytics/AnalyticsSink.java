package com.gt.lse.analytics;

import com.gt.lse.model.AnalyticsRecord;

import java.time.Instant;

public interface AnalyticsSink {

    void publish(AnalyticsRecord analyticsRecord);

    int purgeOldRecords(Instant cutoff);
}
