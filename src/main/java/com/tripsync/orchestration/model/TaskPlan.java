package com.tripsync.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Planned tool calls grouped by category, as returned by the planner model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskPlan(
        @JsonProperty("flights") List<PlannedTask> flights,
        @JsonProperty("hotels") List<PlannedTask> hotels,
        @JsonProperty("trains") List<PlannedTask> trains,
        @JsonProperty("maps") List<PlannedTask> maps,
        @JsonProperty("proposed_state_updates") JsonNode proposedStateUpdates
) {

    public TaskPlan {
        flights = flights == null ? List.of() : List.copyOf(flights);
        hotels = hotels == null ? List.of() : List.copyOf(hotels);
        trains = trains == null ? List.of() : List.copyOf(trains);
        maps = maps == null ? List.of() : List.copyOf(maps);
    }

    public static TaskPlan empty() {
        return new TaskPlan(null, null, null, null, null);
    }

    /**
     * Tasks keyed by category name, categories in a fixed order.
     */
    public Map<String, List<PlannedTask>> byCategory() {
        Map<String, List<PlannedTask>> categories = new LinkedHashMap<>();
        categories.put("flights", flights);
        categories.put("hotels", hotels);
        categories.put("trains", trains);
        categories.put("maps", maps);
        return categories;
    }

    public int size() {
        return flights.size() + hotels.size() + trains.size() + maps.size();
    }

    public List<PlannedTask> all() {
        List<PlannedTask> all = new ArrayList<>(size());
        byCategory().values().forEach(all::addAll);
        return all;
    }
}
