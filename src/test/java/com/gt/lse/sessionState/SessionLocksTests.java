package com.gt.lse.sessionState;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class SessionLocksTests {

    @Test
    public void testSameSessionAlwaysMapsToSameStripe() {
        SessionLocks sessionLocks = new SessionLocks(16);

        for (int i = 0; i < 100; i++) {
            String sessionId = "session-" + i;
            int stripe = sessionLocks.stripeIndex(sessionId);

            assertEquals(stripe, sessionLocks.stripeIndex(new String(sessionId)));
            assertTrue(stripe >= 0 && stripe < 16);
        }
    }

    @Test
    public void testWorkOnOneSessionIsSerialized() throws Exception {
        SessionLocks sessionLocks = new SessionLocks(4);
        int[] counter = new int[1];
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    for (int j = 0; j < 1000; j++) {
                        sessionLocks.runWithSessionLock("shared-session", () -> counter[0]++);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(8000, counter[0]);
    }

    @Test
    public void testLockHeldOnlyForTheAction() {
        SessionLocks sessionLocks = new SessionLocks(8);

        boolean heldInside = sessionLocks.withSessionLock("session-1", () -> sessionLocks.isHeldByCurrentThread("session-1"));

        assertTrue(heldInside);
        assertFalse(sessionLocks.isHeldByCurrentThread("session-1"));
    }

    @Test
    public void testLockReleasedWhenActionThrows() {
        SessionLocks sessionLocks = new SessionLocks(8);

        assertThrows(IllegalStateException.class, () -> sessionLocks.runWithSessionLock("session-1", () -> {
            throw new IllegalStateException("boom");
        }));
        assertFalse(sessionLocks.isHeldByCurrentThread("session-1"));
    }

    @Test
    public void testStripeCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SessionLocks(0));
    }
}
