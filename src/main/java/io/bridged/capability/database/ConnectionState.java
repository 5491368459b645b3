package io.bridged.capability.database;

import java.sql.Connection;
import java.sql.SQLException;

final class ConnectionState implements AutoCloseable {
    private final Connection connection;
    private final String dbType;
    private boolean inTransaction;

    ConnectionState(Connection connection, String dbType) {
        this.connection = connection;
        this.dbType = dbType;
    }

    Connection connection() {
        return connection;
    }

    String dbType() {
        return dbType;
    }

    void begin() throws SQLException {
        if (inTransaction) {
            throw new SQLException("Already in a transaction");
        }
        connection.setAutoCommit(false);
        inTransaction = true;
    }

    void commit() throws SQLException {
        if (connection.getAutoCommit()) {
            throw new SQLException("commit ineffective with AutoCommit enabled");
        }
        connection.commit();
        endTransaction();
    }

    void rollback() throws SQLException {
        if (connection.getAutoCommit()) {
            throw new SQLException("rollback ineffective with AutoCommit enabled");
        }
        connection.rollback();
        endTransaction();
    }

    private void endTransaction() throws SQLException {
        if (inTransaction) {
            inTransaction = false;
            connection.setAutoCommit(true);
        }
    }

    @Override
    public void close() throws SQLException {
        if (connection.isClosed()) {
            return;
        }
        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
            }
        } finally {
            connection.close();
        }
    }
}
