package com.tripsync.orchestration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.orchestration.model.IntakeDecision;
import com.tripsync.orchestration.model.TaskPlan;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonProcessingService service = new JsonProcessingService(objectMapper);

    @Test
    void testParseJsonResponseWithSurroundingText() {
        String raw = "Here is my analysis: {\"has_sufficient_info\": true, \"intent\": \"flight_search\"} Let me know.";
        IntakeDecision decision = service.parseJsonResponse("intake", raw, IntakeDecision.class);
        assertNotNull(decision);
        assertTrue(decision.sufficientInfo());
        assertEquals("flight_search", decision.intent());
        assertTrue(decision.missingInfo().isEmpty());
    }

    @Test
    void testParseJsonResponseInCodeFence() {
        String raw = """
                ```json
                {"flights": [{"task_name": "Search", "function": "search_flights_tool", "priority": 2}]}
                ```
                """;
        TaskPlan plan = service.parseJsonResponse("plan", raw, TaskPlan.class);
        assertNotNull(plan);
        assertEquals(1, plan.size());
        assertEquals("search_flights_tool", plan.flights().get(0).function());
        assertTrue(plan.hotels().isEmpty());
    }

    @Test
    void testParseEmptyResponse() {
        assertNull(service.parseJsonResponse("test", "", IntakeDecision.class));
        assertNull(service.parseJsonResponse("test", null, IntakeDecision.class));
    }

    @Test
    void testParseInvalidJson() {
        assertNull(service.parseJsonResponse("test", "{invalid-json}", IntakeDecision.class));
    }

    @Test
    void testBracesInsideStringsDoNotEndTheObject() {
        String raw = "{\"has_sufficient_info\": false, \"clarification_reply\": \"Which dates? {e.g. Dec 1}\"} trailing }";
        IntakeDecision decision = service.parseJsonResponse("intake", raw, IntakeDecision.class);
        assertNotNull(decision);
        assertFalse(decision.sufficientInfo());
        assertEquals("Which dates? {e.g. Dec 1}", decision.clarificationReply());
    }

    @Test
    void testAnswerWithoutObject() {
        assertNull(service.parseJsonResponse("plan", "I cannot plan this trip.", TaskPlan.class));
    }

    @Test
    void testToJson() {
        String json = service.toJson(Map.of("origin", "BOM"));
        assertTrue(json.contains("\"origin\" : \"BOM\""));
    }
}
