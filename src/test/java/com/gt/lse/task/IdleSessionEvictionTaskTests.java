package com.gt.lse.task;

import com.gt.lse.sessionState.SessionStateStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;

import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class IdleSessionEvictionTaskTests {

    @Mock private SessionStateStore sessionStateStore;

    @Test
    public void testEvictsWithConfiguredTimeout() {
        when(sessionStateStore.evictIdle(Duration.ofMinutes(45))).thenReturn(2);
        IdleSessionEvictionTask task = new IdleSessionEvictionTask(sessionStateStore, 45);

        task.evictIdleSessions();

        verify(sessionStateStore, times(1)).evictIdle(Duration.ofMinutes(45));
        verify(sessionStateStore, times(1)).residentCount();
    }
}
