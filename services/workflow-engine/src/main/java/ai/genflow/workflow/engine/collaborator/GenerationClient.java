package ai.genflow.workflow.engine.collaborator;

public interface GenerationClient {

    GenerationResult complete(GenerationRequest request);
}
