package com.gt.lse.sessionState;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped fair locks that serialize all work on a single session while letting different sessions
 * proceed in parallel. Two sessions may share a stripe; that costs throughput, never correctness.
 */
@Component
public class SessionLocks {

    private final ReentrantLock[] stripes;

    @Autowired
    public SessionLocks(@Value("${lse.session.lockStripes:256}") int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("Session lock stripe count must be positive, was " + stripeCount);
        }

        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    public <T> T withSessionLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithSessionLock(String sessionId, Runnable action) {
        withSessionLock(sessionId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String sessionId) {
        return lockFor(sessionId).isHeldByCurrentThread();
    }

    int stripeIndex(String sessionId) {
        int hash = sessionId.hashCode();
        return Math.floorMod(hash ^ (hash >>> 16), stripes.length);
    }

    private ReentrantLock lockFor(String sessionId) {
        return stripes[stripeIndex(sessionId)];
    }
}
