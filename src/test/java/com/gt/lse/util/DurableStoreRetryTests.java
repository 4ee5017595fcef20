package com.gt.lse.util;

import com.gt.lse.exception.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class DurableStoreRetryTests {

    @Test
    public void testTransientFailureRetriedThenSucceeds() {
        DurableStoreRetry durableStoreRetry = TestUtils.getDurableStoreRetry(3);
        AtomicInteger attempts = new AtomicInteger();

        String result = durableStoreRetry.execute("load", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientDataAccessResourceException("connection reset");
            }
            return "loaded";
        });

        assertEquals("loaded", result);
        assertEquals(3, attempts.get());
    }

    @Test
    public void testExhaustedRetriesReportUnavailable() {
        DurableStoreRetry durableStoreRetry = TestUtils.getDurableStoreRetry(2);
        AtomicInteger attempts = new AtomicInteger();

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class, () -> durableStoreRetry.run("save", () -> {
            attempts.incrementAndGet();
            throw new TransientDataAccessResourceException("connection reset");
        }));

        assertEquals(2, attempts.get());
        assertInstanceOf(TransientDataAccessResourceException.class, ex.getCause());
    }

    @Test
    public void testPermanentFailurePropagatesImmediately() {
        DurableStoreRetry durableStoreRetry = TestUtils.getDurableStoreRetry(3);
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(DataIntegrityViolationException.class, () -> durableStoreRetry.run("save", () -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key");
        }));

        assertEquals(1, attempts.get());
    }
}
