package com.tripsync.api;

import com.tripsync.orchestration.OrchestrationException;
import com.tripsync.orchestration.TravelOrchestrator;
import com.tripsync.orchestration.api.AgentException;
import com.tripsync.orchestration.model.OrchestrationResult;
import com.tripsync.orchestration.model.OrchestrationStage;
import com.tripsync.state.CommitContentionException;
import com.tripsync.state.DiffValidationException;
import com.tripsync.state.SessionStateManager;
import com.tripsync.state.StatePersistenceException;
import com.tripsync.state.model.SessionState;
import com.tripsync.state.model.StateDiff;
import com.tripsync.store.ChatMessage;
import com.tripsync.store.ConversationHistory;
import com.tripsync.store.PlanRecord;
import com.tripsync.store.PlanRecords;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TravelOrchestrator orchestrator;

    @MockitoBean
    private SessionStateManager stateManager;

    @MockitoBean
    private ConversationHistory conversationHistory;

    @MockitoBean
    private PlanRecords planRecords;

    private static final String MESSAGE = "{\"message\": \"Flights from Mumbai to Goa on Dec 1\"}";

    @Test
    void testCreateSession() throws Exception {
        when(stateManager.commit(anyString(), eq(StateDiff.empty()))).thenReturn(SessionState.empty());

        mockMvc.perform(post("/api/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").isString())
                .andExpect(jsonPath("$.state.tasks").isArray());
    }

    @Test
    void testPostMessage() throws Exception {
        when(orchestrator.handle("s1", "Flights from Mumbai to Goa on Dec 1")).thenReturn(new OrchestrationResult(
                "s1", "AI101 at 4200 is the cheapest.", OrchestrationStage.DONE, false, List.of(), SessionState.empty()));

        mockMvc.perform(post("/api/sessions/{id}/messages", "s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MESSAGE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.reply").value("AI101 at 4200 is the cheapest."))
                .andExpect(jsonPath("$.stage").value("DONE"))
                .andExpect(jsonPath("$.clarificationNeeded").value(false))
                .andExpect(jsonPath("$.state.travel_info").isMap());
    }

    @Test
    void testBlankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/sessions/{id}/messages", "s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verify(orchestrator, never()).handle(anyString(), anyString());
    }

    @Test
    void testInvalidProposalMapsToUnprocessableEntity() throws Exception {
        when(orchestrator.handle(anyString(), anyString())).thenThrow(new OrchestrationException("s1",
                OrchestrationStage.REFLECT, new DiffValidationException("Task p1 cannot move from done to pending")));

        mockMvc.perform(post("/api/sessions/{id}/messages", "s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MESSAGE))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INVALID_DIFF"))
                .andExpect(jsonPath("$.stage").value("REFLECT"))
                .andExpect(jsonPath("$.message").value("Task p1 cannot move from done to pending"));
    }

    @Test
    void testContentionMapsToConflict() throws Exception {
        when(orchestrator.handle(anyString(), anyString())).thenThrow(new OrchestrationException("s1",
                OrchestrationStage.EXECUTE, new CommitContentionException("s1", Duration.ofSeconds(5))));

        mockMvc.perform(post("/api/sessions/{id}/messages", "s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MESSAGE))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("COMMIT_CONTENTION"));
    }

    @Test
    void testAgentFailureMapsToBadGateway() throws Exception {
        when(orchestrator.handle(anyString(), anyString())).thenThrow(new OrchestrationException("s1",
                OrchestrationStage.PLAN, new AgentException("plan", "Model returned no valid JSON for plan")));

        mockMvc.perform(post("/api/sessions/{id}/messages", "s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MESSAGE))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.stage").value("PLAN"));
    }

    @Test
    void testPersistenceFailureMapsToServiceUnavailable() throws Exception {
        when(stateManager.getState("s1")).thenThrow(
                new StatePersistenceException("s1", "Failed to load state of session s1", new IllegalStateException("db down")));

        mockMvc.perform(get("/api/sessions/{id}/state", "s1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("PERSISTENCE_ERROR"))
                .andExpect(jsonPath("$.stage").doesNotExist());
    }

    @Test
    void testGetState() throws Exception {
        when(stateManager.getState("s1")).thenReturn(SessionState.empty());

        mockMvc.perform(get("/api/sessions/{id}/state", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.state.user_profile").isMap());
    }

    @Test
    void testGetHistory() throws Exception {
        when(conversationHistory.messages("s1")).thenReturn(List.of(ChatMessage.human("hi"), ChatMessage.ai("hello")));

        mockMvc.perform(get("/api/sessions/{id}/history", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("human"))
                .andExpect(jsonPath("$[1].content").value("hello"))
                .andExpect(jsonPath("$[0].human").doesNotExist());
    }

    @Test
    void testGetPlans() throws Exception {
        PlanRecord record = new PlanRecord("Flights to Goa", "2025-11-20T10:00:00Z", Map.of("destination", "GOI"),
                List.of(new PlanRecord.IterationSummary(1, "2025-11-20T10:00:01Z", List.of("p1", "p2"), 2, 1, 1, 850)),
                1, 2, 850);
        when(planRecords.records("s1")).thenReturn(List.of(record));

        mockMvc.perform(get("/api/sessions/{id}/plans", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].query").value("Flights to Goa"))
                .andExpect(jsonPath("$[0].extracted_info.destination").value("GOI"))
                .andExpect(jsonPath("$[0].total_tool_calls").value(2))
                .andExpect(jsonPath("$[0].iterations[0].task_ids[1]").value("p2"));
    }

    @Test
    void testClearSession() throws Exception {
        mockMvc.perform(delete("/api/sessions/{id}", "s1"))
                .andExpect(status().isNoContent());

        verify(stateManager).clear("s1");
    }
}
