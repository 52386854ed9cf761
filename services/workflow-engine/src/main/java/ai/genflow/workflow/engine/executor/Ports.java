package ai.genflow.workflow.engine.executor;

/**
 * Port names shared by node executors and connection handles.
 */
public final class Ports {

    public static final String QUERY = "query";
    public static final String CONTEXT = "context";
    public static final String SOURCES = "sources";
    public static final String RESPONSE = "response";
    public static final String RESULT = "result";

    private Ports() {
    }
}
