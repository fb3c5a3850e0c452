package com.tripsync.orchestration.model;

public record FinalSummary(String reply) {
}
