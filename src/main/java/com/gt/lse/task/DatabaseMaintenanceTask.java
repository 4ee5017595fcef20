package com.gt.lse.task;

import com.gt.lse.analytics.AnalyticsSink;
import com.gt.lse.interaction.InteractionEventDao;
import com.gt.lse.sessionState.SessionContextDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class DatabaseMaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(DatabaseMaintenanceTask.class);

    private final SessionContextDao sessionContextDao;
    private final InteractionEventDao interactionEventDao;
    private final AnalyticsSink analyticsSink;
    private final Clock clock;
    private final Duration completedSessionRetention;
    private final int purgeEventsAfterDays;

    public DatabaseMaintenanceTask(SessionContextDao sessionContextDao,
                                   InteractionEventDao interactionEventDao,
                                   AnalyticsSink analyticsSink,
                                   Clock clock,
                                   @Value("${lse.session.idleTimeoutMinutes:30}") long idleTimeoutMinutes,
                                   @Value("${lse.maintenance.completedSessionGraceMinutes:1440}") long graceMinutes,
                                   @Value("${lse.maintenance.purgeAfterDays:30}") int purgeEventsAfterDays) {
        this.sessionContextDao = sessionContextDao;
        this.interactionEventDao = interactionEventDao;
        this.analyticsSink = analyticsSink;
        this.clock = clock;

        this.completedSessionRetention = Duration.ofMinutes(idleTimeoutMinutes + graceMinutes);
        this.purgeEventsAfterDays = purgeEventsAfterDays;
    }

    @Scheduled(cron = "@daily")
    public void performDatabaseMaintenance() {
        purgeCompletedSessions();
        purgeAbandonedSessions();
        purgeOldInteractionEvents();
        purgeOldAnalyticsRecords();
    }

    private void purgeCompletedSessions() {
        Instant cutoff = clock.instant().minus(completedSessionRetention);

        int rowsDeleted = sessionContextDao.purgeCompletedSessions(cutoff);

        log.info("Purged completed sessions. {} row deleted.", rowsDeleted);
    }

    // Sessions left unended are kept as long as their event log
    private void purgeAbandonedSessions() {
        Instant cutoff = clock.instant().minus(purgeEventsAfterDays, ChronoUnit.DAYS);

        int rowsDeleted = sessionContextDao.purgeAbandonedSessions(cutoff);

        log.info("Purged abandoned sessions. {} row deleted.", rowsDeleted);
    }

    private void purgeOldInteractionEvents() {
        Instant cutoff = clock.instant().minus(purgeEventsAfterDays, ChronoUnit.DAYS);

        int rowsDeleted = interactionEventDao.purgeOldEvents(cutoff);

        log.info("Purged old interaction events. {} row deleted.", rowsDeleted);
    }

    private void purgeOldAnalyticsRecords() {
        Instant cutoff = clock.instant().minus(purgeEventsAfterDays, ChronoUnit.DAYS);

        int rowsDeleted = analyticsSink.purgeOldRecords(cutoff);

        log.info("Purged old analytics records. {} row deleted.", rowsDeleted);
    }
}
