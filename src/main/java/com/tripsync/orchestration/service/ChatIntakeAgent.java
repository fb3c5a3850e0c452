package com.tripsync.orchestration.service;

import static com.tripsync.orchestration.OrchestrationConstants.*;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.orchestration.api.AgentProposal;
import com.tripsync.orchestration.api.IntakeAgent;
import com.tripsync.orchestration.model.IntakeDecision;
import com.tripsync.state.StateView;
import com.tripsync.state.model.StateDiff;
import com.tripsync.store.ChatMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ChatIntakeAgent implements IntakeAgent {

    private final AgentChatService agentChatService;
    private final JsonProcessingService jsonProcessingService;
    private final ProposalFactory proposalFactory;

    @Override
    public AgentProposal<IntakeDecision> intake(StateView view, String message, List<ChatMessage> recentHistory) {
        IntakeDecision decision = agentChatService.requestJson(PURPOSE_INTAKE,
                INTAKE_SYSTEM_PROMPT.formatted(LocalDate.now()),
                INTAKE_USER_TEMPLATE,
                Map.of("input", message,
                        "history", formatHistory(recentHistory),
                        "state", jsonProcessingService.toJson(view.getState().toJson())),
                IntakeDecision.class);
        log.info("Intake for session {}: intent={}, sufficient={}", view.sessionId(), decision.intent(), decision.sufficientInfo());

        ObjectNode candidate = proposalFactory.newCandidate();
        candidate.putArray(StateDiff.TASKS_FIELD).add(proposalFactory.rootTask(message, decision));
        ObjectNode travelInfo = proposalFactory.travelInfo(decision);
        if (!travelInfo.isEmpty()) {
            candidate.set(StateDiff.TRAVEL_INFO_FIELD, travelInfo);
        }
        return AgentProposal.of(withReply(decision), view.proposeDiff(candidate));
    }

    private IntakeDecision withReply(IntakeDecision decision) {
        if (decision.sufficientInfo() || (decision.clarificationReply() != null && !decision.clarificationReply().isBlank())) {
            return decision;
        }
        String reply = decision.clarifyingQuestions().isEmpty()
                ? "Happy to help with your trip! Could you share where you are travelling from and to, and on which dates?"
                : "Happy to help with your trip! " + String.join(" ", decision.clarifyingQuestions());
        return new IntakeDecision(false, decision.missingInfo(), decision.clarifyingQuestions(),
                decision.extractedInfo(), decision.intent(), decision.reasoning(), reply);
    }

    private static String formatHistory(List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return "None.";
        }
        StringBuilder out = new StringBuilder();
        for (ChatMessage message : history) {
            out.append(message.isHuman() ? "User: " : "Assistant: ").append(message.content()).append('\n');
        }
        return out.toString();
    }
}
