package org.carball.tuner.replica;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.schema.Column;
import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.schema.Table;
import org.carball.tuner.model.workload.Query;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Cost oracle backed by a PostgreSQL replica with the hypopg extension. Simulated indexes live in the
 * JDBC session, so each replica keeps one dedicated connection; if it is lost, the next call reconnects
 * and re-simulates the active configuration before doing anything else.
 */
@Slf4j
public class PostgresCostOracle implements CostOracle {

    private static final String RESET = "SELECT hypopg_reset()";
    private static final String CREATE_HYPOTHETICAL = "SELECT indexrelid FROM hypopg_create_index(?)";
    private static final String RELATION_SIZE = "SELECT hypopg_relation_size(?)";
    private static final String DROP_HYPOTHETICAL = "SELECT hypopg_drop_index(?)";
    private static final String EXPLAIN = "EXPLAIN (FORMAT JSON) ";

    private static final String LIST_COLUMNS = """
        SELECT table_name, column_name
        FROM information_schema.columns
        WHERE table_schema = 'public'
        ORDER BY table_name, ordinal_position
        """;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ReplicaEndpoint endpoint;
    private final int queryTimeoutSeconds;
    private final ConnectionFactory connectionFactory;
    private Connection connection;
    private List<Index> simulated = List.of();

    public PostgresCostOracle(ReplicaEndpoint endpoint, int queryTimeoutSeconds) {
        this(endpoint, queryTimeoutSeconds, DriverManager::getConnection);
    }

    PostgresCostOracle(ReplicaEndpoint endpoint, int queryTimeoutSeconds, ConnectionFactory connectionFactory) {
        this.endpoint = endpoint;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.connectionFactory = connectionFactory;
    }

    @Override
    public void applyConfiguration(List<Index> indexes) {
        try {
            Connection conn = connection();
            simulated = List.of();
            try (Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
                stmt.execute(RESET);
            }
            for (Index index : indexes) {
                createHypotheticalIndex(conn, index);
            }
            simulated = List.copyOf(indexes);
        } catch (SQLException e) {
            throw translate("Failed to apply " + indexes.size() + " hypothetical indexes", e);
        }
    }

    @Override
    public double estimateCost(Query query) {
        try (Statement stmt = connection().createStatement()) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = stmt.executeQuery(EXPLAIN + stripTerminator(query.getText()))) {
                if (!rs.next()) {
                    throw new CostOracleException("EXPLAIN returned no plan for query " + query.getId(), null, false);
                }
                return parseTotalCost(rs.getString(1));
            }
        } catch (SQLException e) {
            throw translate("Failed to estimate cost of query " + query.getId(), e);
        }
    }

    @Override
    public long estimateIndexSize(Index index) {
        try {
            Connection conn = connection();
            long oid = createHypotheticalIndex(conn, index);
            try (PreparedStatement stmt = conn.prepareStatement(RELATION_SIZE)) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
                stmt.setLong(1, oid);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            } finally {
                try (PreparedStatement drop = conn.prepareStatement(DROP_HYPOTHETICAL)) {
                    drop.setLong(1, oid);
                    drop.execute();
                }
            }
        } catch (SQLException e) {
            throw translate("Failed to estimate size of " + index, e);
        }
    }

    @Override
    public DatabaseSchema listColumns() {
        Map<String, Table> tables = new LinkedHashMap<>();
        try (PreparedStatement stmt = connection().prepareStatement(LIST_COLUMNS)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tables.computeIfAbsent(rs.getString("table_name"), Table::new)
                            .addColumn(rs.getString("column_name"));
                }
            }
        } catch (SQLException e) {
            throw translate("Failed to list columns", e);
        }
        log.debug("Replica {} exposes {} tables", endpoint.getId(), tables.size());
        return new DatabaseSchema(List.copyOf(tables.values()));
    }

    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing connection to replica {}: {}", endpoint.getId(), e.getMessage());
        } finally {
            connection = null;
        }
    }

    private Connection connection() throws SQLException {
        if (connection != null && connection.isValid(queryTimeoutSeconds)) {
            return connection;
        }
        if (connection != null) {
            log.warn("Connection to replica {} was lost, reconnecting", endpoint.getId());
            close();
        }

        Properties props = new Properties();
        props.setProperty("user", endpoint.getUser());
        if (endpoint.getPassword() != null) {
            props.setProperty("password", endpoint.getPassword());
        }
        props.setProperty("connectTimeout", String.valueOf(queryTimeoutSeconds));
        props.setProperty("socketTimeout", String.valueOf(queryTimeoutSeconds * 2));

        Connection fresh = connectionFactory.open(endpoint.jdbcUrl(), props);
        try {
            for (Index index : simulated) {
                createHypotheticalIndex(fresh, index);
            }
        } catch (SQLException | RuntimeException e) {
            closeAfterFailure(fresh, e);
            throw e;
        }
        connection = fresh;
        log.debug("Connected to replica {} at {}", endpoint.getId(), endpoint.jdbcUrl());
        return connection;
    }

    private void closeAfterFailure(Connection fresh, Exception cause) {
        try {
            fresh.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private long createHypotheticalIndex(Connection conn, Index index) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(CREATE_HYPOTHETICAL)) {
            stmt.setQueryTimeout(queryTimeoutSeconds);
            stmt.setString(1, createIndexStatement(index));
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("hypopg_create_index returned no row for " + index);
                }
                return rs.getLong(1);
            }
        }
    }

    private CostOracleException translate(String message, SQLException e) {
        return new CostOracleException(message + ": " + e.getMessage(), e, isTransient(e));
    }

    static String createIndexStatement(Index index) {
        String columns = index.getColumns().stream()
                .map(Column::getName)
                .collect(Collectors.joining(", "));
        return "CREATE INDEX ON " + index.getTable().getName() + " (" + columns + ")";
    }

    static double parseTotalCost(String explainJson) {
        try {
            JsonNode plan = OBJECT_MAPPER.readTree(explainJson).path(0).path("Plan");
            JsonNode totalCost = plan.get("Total Cost");
            if (totalCost == null || !totalCost.isNumber()) {
                throw new CostOracleException("EXPLAIN output has no Total Cost: " + explainJson, null, false);
            }
            return totalCost.asDouble();
        } catch (JsonProcessingException e) {
            throw new CostOracleException("Unreadable EXPLAIN output", e, false);
        }
    }

    static boolean isTransient(SQLException e) {
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        if (state == null) {
            return false;
        }
        // 08: connection exception, 57014: statement timeout, 57P01: admin shutdown
        return state.startsWith("08") || state.equals("57014") || state.equals("57P01");
    }

    static String stripTerminator(String sql) {
        String trimmed = sql.trim();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    @FunctionalInterface
    interface ConnectionFactory {
        Connection open(String url, Properties properties) throws SQLException;
    }
}
