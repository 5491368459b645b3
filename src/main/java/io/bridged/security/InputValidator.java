package io.bridged.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.bridged.model.BridgeException;

import java.util.Iterator;
import java.util.Map;

/**
 * Structural shape check of a request's params tree.
 *
 * <p>The top-level params mapping sits at depth 0; each nested array or object adds one level.
 * Object keys count against the string length limit. The parameter count is the number of
 * values in the tree below the root, containers included.
 */
public final class InputValidator {
    private final InputLimits limits;

    public InputValidator(InputLimits limits) {
        this.limits = limits;
    }

    public InputLimits limits() {
        return limits;
    }

    public void validate(JsonNode params) {
        if (params == null || params.isNull() || params.isMissingNode()) {
            return;
        }
        int[] count = new int[1];
        visit(params, "params", 0, count);
    }

    private void visit(JsonNode node, String path, int depth, int[] count) {
        if (depth > limits.maxDepth()) {
            throw BridgeException.validation(
                    "nesting depth exceeds " + limits.maxDepth() + " at " + path
            );
        }
        if (node.isTextual()) {
            checkString(node.textValue(), path);
            return;
        }
        if (node.isArray()) {
            checkCollection(node.size(), path);
            int i = 0;
            for (JsonNode child : node) {
                String childPath = path + "[" + i++ + "]";
                countOne(count, childPath);
                visit(child, childPath, depth + 1, count);
            }
            return;
        }
        if (node.isObject()) {
            checkCollection(node.size(), path);
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String childPath = path + "." + entry.getKey();
                checkString(entry.getKey(), path + " key");
                countOne(count, childPath);
                visit(entry.getValue(), childPath, depth + 1, count);
            }
        }
    }

    private void checkString(String value, String path) {
        if (value.length() > limits.maxStringLength()) {
            throw BridgeException.validation(
                    "string at " + path + " exceeds max length " + limits.maxStringLength()
                            + " (got " + value.length() + ")"
            );
        }
    }

    private void checkCollection(int size, String path) {
        if (size > limits.maxCollectionLength()) {
            throw BridgeException.validation(
                    "collection at " + path + " exceeds max length " + limits.maxCollectionLength()
                            + " (got " + size + ")"
            );
        }
    }

    private void countOne(int[] count, String path) {
        if (++count[0] > limits.maxParamCount()) {
            throw BridgeException.validation(
                    "parameter count exceeds " + limits.maxParamCount() + " at " + path
            );
        }
    }
}
