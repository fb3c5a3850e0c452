package com.tripsync.orchestration.model;

public enum OrchestrationStage {
    INTAKE,
    PLAN,
    EXECUTE,
    REFLECT,
    FINALIZE,
    DONE
}
