package io.bridged.capability.database;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.CapabilityModule;
import io.bridged.capability.InvocationContext;
import io.bridged.capability.Operation;
import io.bridged.capability.Params;
import io.bridged.model.BridgeException;
import io.bridged.model.HandleKind;
import io.bridged.pool.Handle;
import io.bridged.util.Jsons;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Relational database access over JDBC. Connections and prepared statements live in the handle
 * pool; a statement is a child of its connection and goes away with it.
 */
public final class DatabaseModule implements CapabilityModule {
    private static final int DEFAULT_LOGIN_TIMEOUT_SECONDS = 30;

    @Override
    public String name() {
        return "database";
    }

    @Override
    public Map<String, Operation> operations() {
        Map<String, Operation> ops = new LinkedHashMap<>();
        ops.put("connect", this::connect);
        ops.put("prepare", this::prepare);
        ops.put("execute_statement", this::executeStatement);
        ops.put("fetch_row", this::fetchRow);
        ops.put("fetch_all", this::fetchAll);
        ops.put("execute_immediate", this::executeImmediate);
        ops.put("begin_transaction", (params, ctx) -> transaction(params, ctx, "begin"));
        ops.put("commit", (params, ctx) -> transaction(params, ctx, "commit"));
        ops.put("rollback", (params, ctx) -> transaction(params, ctx, "rollback"));
        ops.put("finish_statement", this::finishStatement);
        ops.put("disconnect", this::disconnect);
        return ops;
    }

    private ObjectNode connect(Params params, InvocationContext ctx) throws SQLException {
        String username = params.text("username", null);
        DsnTranslator.Target target = DsnTranslator.translate(params.requireText("dsn"), username);
        Properties props = new Properties();
        String user = DsnTranslator.stripTnsSuffix(username);
        if (user != null && !user.isBlank()) {
            props.setProperty("user", user);
        }
        String password = params.text("password", null);
        if (password != null && !password.isEmpty()) {
            props.setProperty("password", password);
        }
        ObjectNode options = params.object("options");
        DriverManager.setLoginTimeout(DEFAULT_LOGIN_TIMEOUT_SECONDS);
        Connection connection = DriverManager.getConnection(target.jdbcUrl(), props);
        ConnectionState state = new ConnectionState(connection, target.dbType());
        try {
            connection.setAutoCommit(options.path("AutoCommit").asBoolean(true));
        } catch (SQLException e) {
            state.close();
            throw e;
        }
        String id = ctx.pool().create(HandleKind.DATABASE_CONNECTION, state, ctx.exchangeId());
        ObjectNode out = Jsons.object();
        out.put("connection_id", id);
        out.put("db_type", target.dbType());
        return out;
    }

    private ObjectNode prepare(Params params, InvocationContext ctx) throws Exception {
        String connectionId = params.requireText("connection_id");
        String sql = params.requireNonBlank("sql");
        PreparedStatement statement = ctx.pool().withHandle(connectionId, HandleKind.DATABASE_CONNECTION,
                h -> h.state(ConnectionState.class).connection().prepareStatement(sql));
        String id = ctx.pool().create(
                HandleKind.PREPARED_STATEMENT,
                new StatementState(statement),
                ctx.exchangeId(),
                connectionId
        );
        ObjectNode out = Jsons.object();
        out.put("statement_id", id);
        out.put("connection_id", connectionId);
        return out;
    }

    private ObjectNode executeStatement(Params params, InvocationContext ctx) throws Exception {
        String statementId = params.requireText("statement_id");
        String connectionId = params.text("connection_id", null);
        return ctx.pool().withHandle(statementId, HandleKind.PREPARED_STATEMENT, h -> {
            if (connectionId != null && !connectionId.equals(h.parentId())) {
                throw BridgeException.validation(
                        "statement " + statementId + " does not belong to connection " + connectionId);
            }
            StatementState state = h.state(StatementState.class);
            state.reset();
            JdbcValues.bind(state.statement(),
                    JdbcValues.withBindParams(params.list("bind_values"), params.object("bind_params")));
            boolean hasResultSet = state.statement().execute();
            long rowsAffected;
            if (hasResultSet) {
                state.executedWith(state.statement().getResultSet());
                rowsAffected = -1L;
            } else {
                state.executedWith(null);
                rowsAffected = state.statement().getUpdateCount();
            }
            ObjectNode out = Jsons.object();
            out.put("statement_id", statementId);
            out.put("rows_affected", rowsAffected);
            out.put("has_result_set", hasResultSet);
            out.put("executions", state.executions());
            ObjectNode columns = out.putObject("column_info");
            columns.put("count", state.columnNames().size());
            columns.set("names", Jsons.wire().valueToTree(state.columnNames()));
            columns.set("types", Jsons.wire().valueToTree(state.columnTypes()));
            return out;
        });
    }

    private ObjectNode fetchRow(Params params, InvocationContext ctx) throws Exception {
        String statementId = params.requireText("statement_id");
        boolean asHash = "hash".equalsIgnoreCase(params.text("format", "array"));
        return ctx.pool().withHandle(statementId, HandleKind.PREPARED_STATEMENT, h -> {
            StatementState state = requireExecuted(h, statementId);
            ObjectNode out = Jsons.object();
            ResultSet rs = state.resultSet();
            if (rs == null || !rs.next()) {
                state.closeResultSet();
                out.putNull("row");
                out.put("exhausted", true);
                return out;
            }
            out.set("row", asHash
                    ? JdbcValues.rowAsObject(rs, state.columnNames())
                    : JdbcValues.rowAsArray(rs, state.columnNames().size()));
            out.put("exhausted", false);
            return out;
        });
    }

    private ObjectNode fetchAll(Params params, InvocationContext ctx) throws Exception {
        String statementId = params.requireText("statement_id");
        boolean asHash = "hash".equalsIgnoreCase(params.text("format", "array"));
        return ctx.pool().withHandle(statementId, HandleKind.PREPARED_STATEMENT, h -> {
            StatementState state = requireExecuted(h, statementId);
            ArrayNode rows = Jsons.wire().createArrayNode();
            ResultSet rs = state.resultSet();
            if (rs != null) {
                while (rs.next()) {
                    rows.add(asHash
                            ? JdbcValues.rowAsObject(rs, state.columnNames())
                            : JdbcValues.rowAsArray(rs, state.columnNames().size()));
                }
                state.closeResultSet();
            }
            ObjectNode out = Jsons.object();
            out.set("rows", rows);
            out.put("count", rows.size());
            return out;
        });
    }

    private ObjectNode executeImmediate(Params params, InvocationContext ctx) throws Exception {
        String connectionId = params.requireText("connection_id");
        String sql = params.requireNonBlank("sql");
        return ctx.pool().withHandle(connectionId, HandleKind.DATABASE_CONNECTION, h -> {
            Connection connection = h.state(ConnectionState.class).connection();
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                JdbcValues.bind(statement, params.list("bind_values"));
                ObjectNode out = Jsons.object();
                if (statement.execute()) {
                    ArrayNode rows = out.putArray("rows");
                    try (ResultSet rs = statement.getResultSet()) {
                        int columns = rs.getMetaData().getColumnCount();
                        while (rs.next()) {
                            rows.add(JdbcValues.rowAsArray(rs, columns));
                        }
                    }
                    out.put("rows_affected", -1L);
                } else {
                    out.put("rows_affected", statement.getUpdateCount());
                }
                return out;
            }
        });
    }

    private ObjectNode transaction(Params params, InvocationContext ctx, String action) throws Exception {
        String connectionId = params.requireText("connection_id");
        return ctx.pool().withHandle(connectionId, HandleKind.DATABASE_CONNECTION, h -> {
            ConnectionState state = h.state(ConnectionState.class);
            switch (action) {
                case "begin":
                    state.begin();
                    break;
                case "commit":
                    state.commit();
                    break;
                default:
                    state.rollback();
                    break;
            }
            ObjectNode out = Jsons.object();
            out.put("connection_id", connectionId);
            out.put("action", action);
            out.put("db_type", state.dbType());
            out.put("auto_commit", state.connection().getAutoCommit());
            return out;
        });
    }

    private ObjectNode finishStatement(Params params, InvocationContext ctx) {
        String statementId = params.requireText("statement_id");
        ctx.pool().removeExpected(statementId, HandleKind.PREPARED_STATEMENT);
        ObjectNode out = Jsons.object();
        out.put("statement_id", statementId);
        out.put("finished", true);
        return out;
    }

    private ObjectNode disconnect(Params params, InvocationContext ctx) {
        String connectionId = params.requireText("connection_id");
        ctx.pool().removeExpected(connectionId, HandleKind.DATABASE_CONNECTION);
        ObjectNode out = Jsons.object();
        out.put("connection_id", connectionId);
        out.put("disconnected", true);
        return out;
    }

    private static StatementState requireExecuted(Handle handle, String statementId) {
        StatementState state = handle.state(StatementState.class);
        if (!state.executed()) {
            throw BridgeException.execution("Statement " + statementId + " has not been executed");
        }
        return state;
    }
}
