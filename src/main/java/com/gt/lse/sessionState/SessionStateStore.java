package com.gt.lse.sessionState;

import com.gt.lse.conf.BeanConfig;
import com.gt.lse.exception.StoreUnavailableException;
import com.gt.lse.interaction.InteractionEventDao;
import com.gt.lse.model.InteractionEvent;
import com.gt.lse.model.SessionContext;
import com.gt.lse.util.DurableStoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Two-tier store for session contexts. The in-memory fast tier is authoritative while a session is
 * live; every write is propagated to the durable tier by an ordered, per-session chain of flush
 * tasks. Consecutive writes that land before a flush runs are coalesced into one durable write of
 * the newest version.
 *
 * <p>An entry leaves the fast tier only once the durable tier holds its latest version. A miss in
 * the fast tier reads the durable tier and installs what it finds.
 */
@Component
public class SessionStateStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStateStore.class);

    private final SessionContextDao sessionContextDao;
    private final InteractionEventDao interactionEventDao;
    private final DurableStoreRetry durableStoreRetry;
    private final Executor flushExecutor;
    private final Clock clock;

    private final ConcurrentMap<String, FastTierEntry> fastTier = new ConcurrentHashMap<>();

    @Autowired
    public SessionStateStore(SessionContextDao sessionContextDao,
                             InteractionEventDao interactionEventDao,
                             @Qualifier("durableStoreRetry") DurableStoreRetry durableStoreRetry,
                             @Qualifier(BeanConfig.SESSION_FLUSH_EXECUTOR) Executor flushExecutor,
                             Clock clock) {
        this.sessionContextDao = sessionContextDao;
        this.interactionEventDao = interactionEventDao;
        this.durableStoreRetry = durableStoreRetry;
        this.flushExecutor = flushExecutor;
        this.clock = clock;
    }

    public Optional<SessionContext> get(String sessionId) {
        FastTierEntry entry = fastTier.get(sessionId);
        if (entry != null) {
            synchronized (entry) {
                if (!entry.evicted && entry.context != null) {
                    entry.lastAccess = clock.instant();
                    return Optional.of(entry.context);
                }
            }
        }

        Optional<SessionContext> stored = durableStoreRetry.execute("loadSessionContext",
                () -> sessionContextDao.loadSessionContext(sessionId));
        if (stored.isEmpty()) {
            return Optional.empty();
        }

        log.debug("Session {} loaded from durable tier", sessionId);
        FastTierEntry installed = fastTier.merge(sessionId, new FastTierEntry(stored.get(), clock.instant()),
                (existing, loaded) -> existing.evicted ? loaded : existing);
        synchronized (installed) {
            return Optional.of(installed.context != null ? installed.context : stored.get());
        }
    }

    public void put(String sessionId, SessionContext sessionContext) {
        write(sessionId, sessionContext, null);
    }

    // Put that also queues the event for the durable event log, written before the context it produced
    public void record(String sessionId, SessionContext sessionContext, InteractionEvent event) {
        write(sessionId, sessionContext, event);
    }

    /**
     * Blocks until the durable tier holds the session's current version.
     *
     * @throws StoreUnavailableException if the durable write failed after retries
     */
    public void flush(String sessionId) {
        FastTierEntry entry = fastTier.get(sessionId);
        if (entry == null) {
            return;
        }

        long targetVersion;
        CompletableFuture<Void> tail;
        synchronized (entry) {
            targetVersion = entry.version;
            if (entry.flushedVersion < targetVersion) {
                scheduleFlush(sessionId, entry);
            }
            tail = entry.flushTail;
        }

        try {
            tail.join();
        } catch (CompletionException ex) {
            synchronized (entry) {
                entry.flushTail = CompletableFuture.completedFuture(null);
            }
            throw new StoreUnavailableException("Flush of session " + sessionId + " could not be scheduled", ex);
        }

        synchronized (entry) {
            if (entry.flushedVersion < targetVersion) {
                throw new StoreUnavailableException("Unable to flush session " + sessionId
                        + ", durable tier holds version " + entry.flushedVersion + " of " + targetVersion, entry.lastFlushFailure);
            }
        }
    }

    /**
     * Flushes and then drops the session from the fast tier. Returns false when a newer write arrived
     * while the flush was running, in which case the entry stays resident.
     */
    public boolean evict(String sessionId) {
        FastTierEntry entry = fastTier.get(sessionId);
        if (entry == null) {
            return true;
        }

        flush(sessionId);

        synchronized (entry) {
            if (entry.flushedVersion < entry.version) {
                log.debug("Session {} written during eviction, keeping it resident", sessionId);
                return false;
            }

            entry.evicted = true;
            fastTier.remove(sessionId, entry);
            return true;
        }
    }

    public int evictIdle(Duration idleTimeout) {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;

        for (Map.Entry<String, FastTierEntry> fastTierEntry : fastTier.entrySet()) {
            Instant lastAccess;
            synchronized (fastTierEntry.getValue()) {
                lastAccess = fastTierEntry.getValue().lastAccess;
            }
            if (!lastAccess.isBefore(cutoff)) {
                continue;
            }

            try {
                if (evict(fastTierEntry.getKey())) {
                    evicted++;
                }
            } catch (StoreUnavailableException ex) {
                log.warn("Unable to evict idle session {}, will retry on next pass", fastTierEntry.getKey(), ex);
            }
        }

        return evicted;
    }

    // True while the session's latest write-behind attempt failed after retries
    public boolean isDegraded(String sessionId) {
        FastTierEntry entry = fastTier.get(sessionId);
        if (entry == null) {
            return false;
        }

        synchronized (entry) {
            return entry.lastFlushFailure != null;
        }
    }

    public boolean isResident(String sessionId) {
        return fastTier.containsKey(sessionId);
    }

    public int residentCount() {
        return fastTier.size();
    }

    private void write(String sessionId, SessionContext sessionContext, InteractionEvent event) {
        while (true) {
            FastTierEntry entry = fastTier.computeIfAbsent(sessionId, id -> new FastTierEntry(clock.instant()));
            synchronized (entry) {
                if (entry.evicted) {
                    continue;
                }

                entry.context = sessionContext;
                entry.version++;
                entry.lastAccess = clock.instant();
                if (event != null) {
                    entry.pendingEvents.add(event);
                }

                scheduleFlush(sessionId, entry);
                return;
            }
        }
    }

    // Caller holds the entry's monitor
    private void scheduleFlush(String sessionId, FastTierEntry entry) {
        entry.flushTail = entry.flushTail.thenRunAsync(() -> flushLatest(sessionId, entry), flushExecutor);
    }

    private void flushLatest(String sessionId, FastTierEntry entry) {
        SessionContext snapshot;
        long snapshotVersion;
        List<InteractionEvent> events;

        synchronized (entry) {
            if (entry.flushedVersion >= entry.version) {
                return;
            }

            snapshot = entry.context;
            snapshotVersion = entry.version;
            events = new ArrayList<>(entry.pendingEvents);
            entry.pendingEvents.clear();
        }

        try {
            if (!events.isEmpty()) {
                durableStoreRetry.run("appendInteractionEvents", () -> interactionEventDao.appendEvents(events));
            }
            durableStoreRetry.run("saveSessionContext", () -> sessionContextDao.saveSessionContext(snapshot));

            synchronized (entry) {
                entry.flushedVersion = Math.max(entry.flushedVersion, snapshotVersion);
                entry.lastFlushFailure = null;
            }
        } catch (RuntimeException ex) {
            log.error("Write-behind flush of session {} version {} failed, keeping it dirty", sessionId, snapshotVersion, ex);

            synchronized (entry) {
                entry.pendingEvents.addAll(0, events);
                entry.lastFlushFailure = ex;
            }
        }
    }

    private static final class FastTierEntry {
        private SessionContext context;
        private long version;
        private long flushedVersion;
        private Instant lastAccess;
        private boolean evicted;
        private RuntimeException lastFlushFailure;
        private final List<InteractionEvent> pendingEvents = new ArrayList<>();
        private CompletableFuture<Void> flushTail = CompletableFuture.completedFuture(null);

        private FastTierEntry(Instant lastAccess) {
            this.lastAccess = lastAccess;
        }

        // An entry read from the durable tier starts out clean
        private FastTierEntry(SessionContext context, Instant lastAccess) {
            this.context = context;
            this.lastAccess = lastAccess;
        }
    }
}
