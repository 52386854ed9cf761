package ai.genflow.workflow.engine;

import ai.genflow.workflow.engine.config.CollaboratorProperties;
import ai.genflow.workflow.engine.config.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application for the workflow engine.
 * Validates editor-authored workflow graphs and executes them against a single query.
 */
@SpringBootApplication(scanBasePackages = "ai.genflow.workflow.engine")
@EnableConfigurationProperties({EngineProperties.class, CollaboratorProperties.class})
public class WorkflowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowEngineApplication.class, args);
    }
}
