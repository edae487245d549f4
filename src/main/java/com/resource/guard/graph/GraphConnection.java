package com.resource.guard.graph;

import java.util.List;
import java.util.Map;

/**
 * Minimal Cypher connection used by {@link com.resource.guard.lock.GraphLeaseStore}.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns one map per result record.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    @Override
    void close();
}
