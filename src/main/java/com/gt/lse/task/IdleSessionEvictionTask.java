package com.gt.lse.task;

import com.gt.lse.sessionState.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class IdleSessionEvictionTask {

    private static final Logger log = LoggerFactory.getLogger(IdleSessionEvictionTask.class);

    private final SessionStateStore sessionStateStore;
    private final Duration idleTimeout;

    public IdleSessionEvictionTask(SessionStateStore sessionStateStore,
                                   @Value("${lse.session.idleTimeoutMinutes:30}") long idleTimeoutMinutes) {
        this.sessionStateStore = sessionStateStore;

        this.idleTimeout = Duration.ofMinutes(idleTimeoutMinutes);
    }

    @Scheduled(fixedDelayString = "${lse.session.evictionIntervalMs:60000}", initialDelayString = "${lse.session.evictionIntervalMs:60000}")
    public void evictIdleSessions() {
        int evicted = sessionStateStore.evictIdle(idleTimeout);

        if (evicted > 0) {
            log.info("Evicted {} idle sessions. {} sessions still resident.", evicted, sessionStateStore.residentCount());
        }
    }
}
