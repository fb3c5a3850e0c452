package com.tripsync.api;

import com.tripsync.orchestration.TravelOrchestrator;
import com.tripsync.state.SessionStateManager;
import com.tripsync.state.model.StateDiff;
import com.tripsync.store.ChatMessage;
import com.tripsync.store.ConversationHistory;
import com.tripsync.store.PlanRecord;
import com.tripsync.store.PlanRecords;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final TravelOrchestrator orchestrator;
    private final SessionStateManager stateManager;
    private final ConversationHistory conversationHistory;
    private final PlanRecords planRecords;

    public SessionController(TravelOrchestrator orchestrator,
                             SessionStateManager stateManager,
                             ConversationHistory conversationHistory,
                             PlanRecords planRecords) {
        this.orchestrator = orchestrator;
        this.stateManager = stateManager;
        this.conversationHistory = conversationHistory;
        this.planRecords = planRecords;
    }

    /**
     * Starts a session from the state template and persists it.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionResponse create() {
        String sessionId = UUID.randomUUID().toString();
        return SessionResponse.from(sessionId, stateManager.commit(sessionId, StateDiff.empty()));
    }

    @PostMapping("/{sessionId}/messages")
    public MessageResponse message(@PathVariable String sessionId, @Valid @RequestBody MessageRequest request) {
        return MessageResponse.from(orchestrator.handle(sessionId, request.message()));
    }

    @GetMapping("/{sessionId}/state")
    public SessionResponse state(@PathVariable String sessionId) {
        return SessionResponse.from(sessionId, stateManager.getState(sessionId));
    }

    @GetMapping("/{sessionId}/history")
    public List<ChatMessage> history(@PathVariable String sessionId) {
        return conversationHistory.messages(sessionId);
    }

    @GetMapping("/{sessionId}/plans")
    public List<PlanRecord> plans(@PathVariable String sessionId) {
        return planRecords.records(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clear(@PathVariable String sessionId) {
        stateManager.clear(sessionId);
    }
}
