package ai.genflow.workflow.engine.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run store of node outputs.
 *
 * <p>Every value is addressed by its producer and port. A port name also resolves on its own while
 * exactly one node has published it; once a second producer publishes the same port the bare name
 * becomes ambiguous and stops resolving. Safe for concurrent publishers.</p>
 */
public class ContextBus {

    private static final Logger logger = LoggerFactory.getLogger(ContextBus.class);

    private final Map<PortKey, Object> values = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> producersByPort = new ConcurrentHashMap<>();

    public void publish(String nodeId, Map<String, ?> outputs) {
        outputs.forEach((port, value) -> publish(nodeId, port, value));
    }

    public void publish(String nodeId, String port, Object value) {
        if (value == null) {
            return;
        }
        values.put(PortKey.of(nodeId, port), value);
        producersByPort.computeIfAbsent(port, ignored -> Collections.synchronizedSet(new HashSet<>())).add(nodeId);
        logger.debug("Published nodeId={} port={}", nodeId, port);
    }

    public Optional<Object> get(String nodeId, String port) {
        return Optional.ofNullable(values.get(PortKey.of(nodeId, port)));
    }

    /**
     * Returns the producer of a bare port name while exactly one node has published it.
     */
    public Optional<String> uniqueProducer(String port) {
        Set<String> producers = producersByPort.get(port);
        if (producers == null) {
            return Optional.empty();
        }
        synchronized (producers) {
            return producers.size() == 1 ? Optional.of(producers.iterator().next()) : Optional.empty();
        }
    }

    public boolean contains(String nodeId, String port) {
        return values.containsKey(PortKey.of(nodeId, port));
    }

    public int size() {
        return values.size();
    }
}
