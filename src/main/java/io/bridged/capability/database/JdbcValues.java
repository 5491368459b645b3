package io.bridged.capability.database;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.model.BridgeException;
import io.bridged.util.Jsons;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Clob;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

final class JdbcValues {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JdbcValues() {
    }

    /**
     * Overlays {@code bind_params} on the positional values. Keys are 1-based positions
     * ({@code "2"}); each value is either the bound value itself or {@code {"value": ...}}.
     * Positions past the end extend the list with nulls.
     */
    static List<JsonNode> withBindParams(List<JsonNode> values, ObjectNode bindParams) {
        List<JsonNode> merged = new ArrayList<>(values);
        Iterator<Map.Entry<String, JsonNode>> it = bindParams.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            int position = position(entry.getKey());
            while (merged.size() < position) {
                merged.add(NODES.nullNode());
            }
            JsonNode spec = entry.getValue();
            JsonNode value = spec != null && spec.isObject() && spec.has("value") ? spec.get("value") : spec;
            merged.set(position - 1, value);
        }
        return merged;
    }

    private static int position(String key) {
        String trimmed = key.trim();
        if (trimmed.startsWith(":")) {
            throw BridgeException.validation(
                    "named bind parameter '" + trimmed + "' is not supported, use its 1-based position");
        }
        try {
            int position = Integer.parseInt(trimmed);
            if (position < 1) {
                throw BridgeException.validation("bind parameter position must be >= 1: " + key);
            }
            return position;
        } catch (NumberFormatException e) {
            throw BridgeException.validation("bind parameter key must be a position: " + key);
        }
    }

    static void bind(PreparedStatement statement, List<JsonNode> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            JsonNode value = values.get(i);
            int index = i + 1;
            if (value == null || value.isNull()) {
                statement.setNull(index, Types.NULL);
            } else if (value.isBoolean()) {
                statement.setBoolean(index, value.booleanValue());
            } else if (value.isIntegralNumber()) {
                if (value.canConvertToLong()) {
                    statement.setLong(index, value.longValue());
                } else {
                    statement.setBigDecimal(index, new BigDecimal(value.bigIntegerValue()));
                }
            } else if (value.isNumber()) {
                statement.setDouble(index, value.doubleValue());
            } else if (value.isTextual()) {
                statement.setString(index, value.textValue());
            } else {
                statement.setString(index, value.toString());
            }
        }
    }

    static ArrayNode rowAsArray(ResultSet rs, int columns) throws SQLException {
        ArrayNode row = Jsons.wire().createArrayNode();
        for (int i = 1; i <= columns; i++) {
            row.add(toJson(rs.getObject(i)));
        }
        return row;
    }

    static ObjectNode rowAsObject(ResultSet rs, List<String> columnNames) throws SQLException {
        ObjectNode row = Jsons.object();
        for (int i = 0; i < columnNames.size(); i++) {
            row.set(columnNames.get(i), toJson(rs.getObject(i + 1)));
        }
        return row;
    }

    static JsonNode toJson(Object value) throws SQLException {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof Boolean) {
            return NODES.booleanNode((Boolean) value);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return NODES.numberNode(((Number) value).intValue());
        }
        if (value instanceof Long) {
            return NODES.numberNode((Long) value);
        }
        if (value instanceof BigInteger) {
            return NODES.numberNode((BigInteger) value);
        }
        if (value instanceof BigDecimal) {
            return NODES.numberNode((BigDecimal) value);
        }
        if (value instanceof Number) {
            return NODES.numberNode(((Number) value).doubleValue());
        }
        if (value instanceof byte[]) {
            return NODES.textNode(HexFormat.of().formatHex((byte[]) value));
        }
        if (value instanceof Clob) {
            Clob clob = (Clob) value;
            return NODES.textNode(clob.getSubString(1L, (int) Math.min(Integer.MAX_VALUE, clob.length())));
        }
        return NODES.textNode(value.toString());
    }
}
