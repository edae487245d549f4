package com.resource.guard.lock;

import com.resource.guard.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FalkorDB {@link LeaseStore} for multi-JVM locking on an existing graph deployment.
 *
 * <p>Each lock is a {@code :Lock} node keyed by name. Acquisition is a single {@code MERGE}
 * that creates the node or takes over an expired one; release and extension match on both
 * name and owner. Expiry instants are stored as epoch milliseconds.</p>
 */
public class GraphLeaseStore implements LeaseStore {
    private static final Logger log = LoggerFactory.getLogger(GraphLeaseStore.class);

    private static final String ACQUIRE = """
            MERGE (l:Lock {key: $key})
            ON CREATE SET l.owner = $owner, l.acquiredAt = $now, l.expiresAt = $expiresAt
            ON MATCH SET l.owner = CASE
                WHEN l.expiresAt <= $now THEN $owner
                ELSE l.owner
            END,
            l.acquiredAt = CASE
                WHEN l.expiresAt <= $now THEN $now
                ELSE l.acquiredAt
            END,
            l.expiresAt = CASE
                WHEN l.expiresAt <= $now THEN $expiresAt
                ELSE l.expiresAt
            END
            RETURN l.owner AS owner
            """;

    private static final String RELEASE = """
            MATCH (l:Lock {key: $key, owner: $owner})
            WHERE l.expiresAt > $now
            DELETE l
            RETURN 1 AS released
            """;

    private static final String EXTEND = """
            MATCH (l:Lock {key: $key, owner: $owner})
            WHERE l.expiresAt > $now
            SET l.expiresAt = $expiresAt
            RETURN l.owner AS owner
            """;

    private static final String OWNER = """
            MATCH (l:Lock {key: $key})
            WHERE l.expiresAt > $now
            RETURN l.owner AS owner
            """;

    private final GraphConnection connection;
    private final Clock clock;

    public GraphLeaseStore(GraphConnection connection) {
        this(connection, Clock.systemUTC());
    }

    public GraphLeaseStore(GraphConnection connection, Clock clock) {
        this.connection = connection;
        this.clock = clock;
        createLockIndex();
    }

    @Override
    public boolean tryCreate(String name, String ownerToken, Duration ttl) {
        long now = clock.millis();
        List<Map<String, Object>> rows = query("acquire", name, ACQUIRE, Map.of(
                "key", name,
                "owner", ownerToken,
                "now", now,
                "expiresAt", now + ttl.toMillis()));
        return !rows.isEmpty() && ownerToken.equals(rows.get(0).get("owner"));
    }

    @Override
    public boolean deleteIfOwner(String name, String ownerToken) {
        List<Map<String, Object>> rows = query("release", name, RELEASE, Map.of(
                "key", name,
                "owner", ownerToken,
                "now", clock.millis()));
        return !rows.isEmpty();
    }

    @Override
    public boolean extendIfOwner(String name, String ownerToken, Duration ttl) {
        long now = clock.millis();
        List<Map<String, Object>> rows = query("extend", name, EXTEND, Map.of(
                "key", name,
                "owner", ownerToken,
                "now", now,
                "expiresAt", now + ttl.toMillis()));
        return !rows.isEmpty();
    }

    @Override
    public Optional<String> currentOwner(String name) {
        List<Map<String, Object>> rows = query("read", name, OWNER, Map.of(
                "key", name,
                "now", clock.millis()));
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable((String) rows.get(0).get("owner"));
    }

    private List<Map<String, Object>> query(String operation, String name, String cypher, Map<String, Object> params) {
        try {
            return connection.query(cypher, params);
        } catch (RuntimeException e) {
            throw new LeaseStoreException("Failed to " + operation + " lease for '" + name + "'", e);
        }
    }

    private void createLockIndex() {
        try {
            connection.execute("CREATE INDEX FOR (l:Lock) ON (l.key)");
        } catch (RuntimeException e) {
            // already exists
            log.debug("Lock index creation: {}", e.getMessage());
        }
    }
}
