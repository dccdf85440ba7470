package org.finos.stitch.engine.execution;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link QueryBackend} over JDBC.
 * 
 * Two modes:
 * <ul>
 * <li>{@link #shared(Connection)} - one long-lived connection; statements are serialized on it</li>
 * <li>{@link #perQuery(ConnectionSource)} - a connection is obtained for every query
 * and closed afterwards (hand in a pooled source to bound connections)</li>
 * </ul>
 */
public final class JdbcQueryBackend implements QueryBackend {

    /**
     * Supplies connections, typically a pooled DataSource's {@code getConnection}.
     */
    @FunctionalInterface
    public interface ConnectionSource {
        Connection open() throws SQLException;
    }

    private final ConnectionSource source;
    private final Connection sharedConnection;
    private final ReentrantLock sharedLock = new ReentrantLock();

    private JdbcQueryBackend(ConnectionSource source, Connection sharedConnection) {
        this.source = source;
        this.sharedConnection = sharedConnection;
    }

    public static JdbcQueryBackend shared(Connection connection) {
        return new JdbcQueryBackend(null, connection);
    }

    public static JdbcQueryBackend perQuery(ConnectionSource source) {
        return new JdbcQueryBackend(source, null);
    }

    @Override
    public List<Map<String, Object>> execute(String sql, List<Object> parameters) throws SQLException {
        if (sharedConnection != null) {
            sharedLock.lock();
            try {
                return run(sharedConnection, sql, parameters);
            } finally {
                sharedLock.unlock();
            }
        }
        try (Connection conn = source.open()) {
            return run(conn, sql, parameters);
        }
    }

    private static List<Map<String, Object>> run(Connection conn, String sql, List<Object> parameters)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < parameters.size(); i++) {
                stmt.setObject(i + 1, parameters.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return readRows(rs);
            }
        }
    }

    /**
     * Materializes a ResultSet into insertion-ordered maps keyed by column label.
     */
    static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        String[] labels = new String[columnCount];
        for (int i = 0; i < columnCount; i++) {
            labels[i] = meta.getColumnLabel(i + 1);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);
            for (int i = 0; i < columnCount; i++) {
                row.put(labels[i], rs.getObject(i + 1));
            }
            rows.add(row);
        }
        return rows;
    }
}
