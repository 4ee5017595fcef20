package com.gt.lse.session;

import com.gt.lse.exception.InvalidEventException;
import com.gt.lse.exception.SessionNotFoundException;
import com.gt.lse.exception.StoreUnavailableException;
import com.gt.lse.model.InteractionEvent;
import com.gt.lse.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.http.MediaType;
import org.springframework.test.context.junit.jupiter.SpringExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static com.gt.lse.util.TestUtils.TEST_USER_ID;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(SpringExtension.class)
public class SessionControllerTests {

    @Mock private SessionOrchestrator sessionOrchestrator;

    private MockMvc mockMvc;

    @BeforeEach
    public void initTests() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SessionController(sessionOrchestrator))
                .setControllerAdvice(new SessionExceptionHandler())
                .build();
    }

    @Test
    public void testStartSession() throws Exception {
        when(sessionOrchestrator.startSession(TEST_USER_ID, List.of("greetings"), true))
                .thenReturn(TestUtils.buildSession("session-1", List.of(), true));

        mockMvc.perform(post("/rest/session/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"testUser\", \"skillDomains\": [\"greetings\"], \"extraCurricular\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("session-1"))
                .andExpect(jsonPath("$.status").value("Active"))
                .andExpect(jsonPath("$.extraCurricular").value(true));
    }

    @Test
    public void testInteractFillsSessionIdFromPath() throws Exception {
        mockMvc.perform(post("/rest/session/session-1/interact")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"itemId\": \"hello\", \"outcome\": \"Correct\", \"latencyMs\": 2000, \"cursorPosition\": 0}"))
                .andExpect(status().isOk());

        ArgumentCaptor<InteractionEvent> eventCaptor = ArgumentCaptor.forClass(InteractionEvent.class);
        verify(sessionOrchestrator).interact(eq("session-1"), eventCaptor.capture());
        assertEquals("session-1", eventCaptor.getValue().sessionId());
        assertEquals("hello", eventCaptor.getValue().itemId());
        assertEquals(2000, eventCaptor.getValue().latencyMs());
    }

    @Test
    public void testUnknownSessionReturnsNotFound() throws Exception {
        when(sessionOrchestrator.getSession("missing")).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/rest/session/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("SessionNotFound"))
                .andExpect(jsonPath("$.retriable").value(false));
    }

    @Test
    public void testInvalidEventReturnsConflictWithReason() throws Exception {
        when(sessionOrchestrator.interact(eq("session-1"), any(InteractionEvent.class)))
                .thenThrow(new InvalidEventException(InvalidEventException.Reason.CursorSuperseded, "stale event"));

        mockMvc.perform(post("/rest/session/session-1/interact")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"session-1\", \"itemId\": \"hello\", \"outcome\": \"Correct\", \"cursorPosition\": 0}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("InvalidEvent"))
                .andExpect(jsonPath("$.reason").value("CursorSuperseded"))
                .andExpect(jsonPath("$.retriable").value(false));
    }

    @Test
    public void testStoreOutageReturnsRetriableUnavailable() throws Exception {
        when(sessionOrchestrator.endSession("session-1")).thenThrow(new StoreUnavailableException("store down"));

        mockMvc.perform(post("/rest/session/session-1/end"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("StoreUnavailable"))
                .andExpect(jsonPath("$.retriable").value(true));
    }
}
