package io.bridged.capability.database;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

final class StatementState implements AutoCloseable {
    private final PreparedStatement statement;
    private ResultSet resultSet;
    private List<String> columnNames = List.of();
    private List<String> columnTypes = List.of();
    private boolean executed;
    private long executions;

    StatementState(PreparedStatement statement) {
        this.statement = statement;
    }

    PreparedStatement statement() {
        return statement;
    }

    ResultSet resultSet() {
        return resultSet;
    }

    boolean executed() {
        return executed;
    }

    long executions() {
        return executions;
    }

    List<String> columnNames() {
        return columnNames;
    }

    List<String> columnTypes() {
        return columnTypes;
    }

    /**
     * Drops the previous result so the statement can run again.
     */
    void reset() throws SQLException {
        closeResultSet();
        statement.clearParameters();
        columnNames = List.of();
        columnTypes = List.of();
        executed = false;
    }

    void executedWith(ResultSet rs) throws SQLException {
        this.resultSet = rs;
        this.executed = true;
        this.executions++;
        if (rs != null) {
            ResultSetMetaData meta = rs.getMetaData();
            List<String> names = new ArrayList<>(meta.getColumnCount());
            List<String> types = new ArrayList<>(meta.getColumnCount());
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                names.add(meta.getColumnLabel(i));
                types.add(meta.getColumnTypeName(i));
            }
            this.columnNames = List.copyOf(names);
            this.columnTypes = List.copyOf(types);
        }
    }

    void closeResultSet() throws SQLException {
        if (resultSet != null) {
            ResultSet rs = resultSet;
            resultSet = null;
            rs.close();
        }
    }

    @Override
    public void close() throws SQLException {
        try {
            closeResultSet();
        } finally {
            statement.close();
        }
    }
}
