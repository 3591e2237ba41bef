package com.researchpipeline.orchestrator.stage;

public class StageCollaboratorNotFoundException extends RuntimeException {
    public StageCollaboratorNotFoundException(String name) {
        super("No stage collaborator registered with name: '" + name + "'");
    }
}
