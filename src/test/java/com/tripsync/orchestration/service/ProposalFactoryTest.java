package com.tripsync.orchestration.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.orchestration.OrchestrationConstants;
import com.tripsync.orchestration.model.IntakeDecision;
import com.tripsync.orchestration.model.PlannedTask;
import com.tripsync.orchestration.model.TaskPlan;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProposalFactoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProposalFactory factory = new ProposalFactory(objectMapper);

    @Test
    void testTaskEntriesFollowCategoryOrderAndSkipEntriesWithoutFunction() throws Exception {
        JsonNode request = objectMapper.readTree("{\"origin\": \"BOM\", \"destination\": \"GOI\"}");
        TaskPlan plan = new TaskPlan(
                List.of(new PlannedTask("Search flights", "search_flights_tool", request, true, 2)),
                List.of(new PlannedTask("Pick a hotel", " ", null, false, 1)),
                List.of(),
                List.of(new PlannedTask(null, "geocode_tool", null, false, 0)),
                null);

        ArrayNode entries = factory.taskEntries(plan, OrchestrationConstants.ORIGIN_PLANNER,
                OrchestrationConstants.TASK_PREFIX_PLANNER);

        assertEquals(2, entries.size());
        JsonNode flights = entries.get(0);
        assertTrue(flights.get("task_id").asText().startsWith("subtask_planner_"));
        assertEquals("planner", flights.get("agent_origin").asText());
        assertEquals("Search flights", flights.get("intent").asText());
        assertEquals("pending", flights.get("status").asText());
        assertEquals("search_flights_tool", flights.at("/metadata/tool").asText());
        assertEquals("GOI", flights.at("/metadata/arguments/destination").asText());
        assertEquals("flights", flights.at("/metadata/category").asText());
        assertEquals(2, flights.at("/metadata/priority").asInt());
        assertTrue(flights.at("/metadata/agent_call_required").asBoolean());

        JsonNode maps = entries.get(1);
        assertEquals("geocode_tool", maps.get("intent").asText());
        assertTrue(maps.at("/metadata/arguments").isObject());
        assertNotEquals(flights.get("task_id").asText(), maps.get("task_id").asText());
    }

    @Test
    void testTravelInfoMapsExtractedFields() {
        Map<String, Object> extracted = new HashMap<>();
        extracted.put("origin", "Mumbai");
        extracted.put("destination", "null");
        extracted.put("departure_date", "2025-12-01");
        extracted.put("return_date", null);
        extracted.put("travelers", 2);
        IntakeDecision decision = new IntakeDecision(true, null, null, extracted, "flight_search", null, null);

        ObjectNode travelInfo = factory.travelInfo(decision);

        assertEquals("Mumbai", travelInfo.get("origin").asText());
        assertEquals("2025-12-01", travelInfo.get("start_date").asText());
        assertFalse(travelInfo.has("destination"));
        assertFalse(travelInfo.has("end_date"));
        assertFalse(travelInfo.has("travelers"));
    }

    @Test
    void testStateUpdatesKeepOnlyProfileAndTravelInfo() throws Exception {
        JsonNode proposed = objectMapper.readTree("""
                {"travel_info": {"destination": "GOI"}, "user_profile": {}, "tasks": [{"task_id": "x"}],
                 "secret": "value"}
                """);

        ObjectNode updates = factory.stateUpdates(proposed);

        assertEquals(List.of("travel_info"), fieldNames(updates));
        assertTrue(factory.stateUpdates(null).isEmpty());
    }

    @Test
    void testRootTaskRecordsQueryAndDefaultsIntent() {
        IntakeDecision decision = new IntakeDecision(true, null, null, Map.of("origin", "BOM"), "", "looks complete", null);

        ObjectNode task = factory.rootTask("Trip to Goa", decision);

        assertTrue(task.get("task_id").asText().startsWith("task_"));
        assertEquals("root", task.get("agent_origin").asText());
        assertEquals("information_query", task.get("intent").asText());
        assertEquals("Trip to Goa", task.at("/metadata/user_query").asText());
        assertEquals("BOM", task.at("/metadata/extracted_info/origin").asText());
        assertEquals("looks complete", task.at("/metadata/reasoning").asText());
    }

    private static List<String> fieldNames(ObjectNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
