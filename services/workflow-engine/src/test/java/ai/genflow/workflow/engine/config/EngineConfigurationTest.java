package ai.genflow.workflow.engine.config;

import ai.genflow.workflow.engine.collaborator.CollaboratorException;
import ai.genflow.workflow.engine.collaborator.http.HttpRetrievalClient;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigurationTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private HttpServer server;
    private ExecutorService serverExecutor;

    @BeforeEach
    void setUp() throws IOException {
        serverExecutor = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(serverExecutor);
        server.createContext("/search", exchange -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void withTimeouts_ShouldAbandonUnresponsiveService() {
        CollaboratorProperties properties = new CollaboratorProperties();
        properties.getRetrieval().setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
        HttpRetrievalClient client = new HttpRetrievalClient(properties,
                EngineConfiguration.withTimeouts(RestClient.builder(), Duration.ofMillis(200)));

        long started = System.nanoTime();
        assertThatThrownBy(() -> client.search("q", null, 5, 0.7))
                .isInstanceOfSatisfying(CollaboratorException.class,
                        ex -> assertThat(ex.isTransientFailure()).isTrue());
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void historyExecutor_ShouldBeBounded() {
        EngineProperties properties = new EngineProperties();
        properties.setHistoryThreads(1);
        properties.setHistoryQueueCapacity(3);

        ThreadPoolExecutor executor = (ThreadPoolExecutor) new EngineConfiguration().historyExecutor(properties);
        try {
            assertThat(executor.getMaximumPoolSize()).isEqualTo(1);
            assertThat(executor.getQueue().remainingCapacity()).isEqualTo(3);
        } finally {
            executor.shutdownNow();
        }
    }
}
