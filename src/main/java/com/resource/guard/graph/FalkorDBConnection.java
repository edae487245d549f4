package com.resource.guard.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link GraphConnection} on the JFalkorDB client.
 *
 * <p>Parameters are inlined as Cypher literals in a single scan of the query: strings are
 * quoted and escaped, numbers and booleans are written as-is. Placeholders without a
 * parameter are left untouched.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);
    private static final Pattern PARAMETER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized for graph {} at {}:{}", graphName, host, port);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        graph.query(bind(query, params));
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        ResultSet resultSet = graph.query(bind(query, params));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String column : record.keys()) {
                row.put(column, record.getValue(column));
            }
            rows.add(row);
        }
        return rows;
    }

    static String bind(String query, Map<String, Object> params) {
        // one pass: inlined values are never scanned for placeholders again
        return PARAMETER.matcher(query).replaceAll(match -> {
            String name = match.group(1);
            String replacement = params.containsKey(name) ? literal(params.get(name)) : match.group();
            return Matcher.quoteReplacement(replacement);
        });
    }

    private static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection", e);
        }
        log.info("FalkorDB connection to graph {} closed", graphName);
    }
}
