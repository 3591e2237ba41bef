package com.researchpipeline.orchestrator.model;

/** Result of a single stage attempt. */
public enum AttemptOutcome {
    SUCCESS,
    FAILURE
}
