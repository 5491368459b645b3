package io.bridged.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.model.BridgeException;
import io.bridged.model.ErrorCategory;
import io.bridged.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class InputValidatorTest {
    private final InputValidator validator = new InputValidator(new InputLimits(16, 3, 2, 8));

    @Test
    void acceptsParamsWithinLimits() throws Exception {
        validator.validate(parse("{\"dsn\":\"dbi:SQLite:x\",\"bind\":[1,2,3],\"opts\":{\"a\":1}}"));
        validator.validate(null);
        validator.validate(Jsons.object());
    }

    @Test
    void rejectsLongStringsIncludingKeys() throws Exception {
        BridgeException value = Assertions.assertThrows(BridgeException.class,
                () -> validator.validate(parse("{\"sql\":\"select * from very_long\"}")));
        Assertions.assertEquals(ErrorCategory.VALIDATION, value.category());
        Assertions.assertTrue(value.getMessage().contains("params.sql"));
        Assertions.assertTrue(value.getMessage().contains("max length 16"));

        Assertions.assertThrows(BridgeException.class,
                () -> validator.validate(parse("{\"a_really_long_key_name\":1}")));
    }

    @Test
    void rejectsOversizedCollections() throws Exception {
        BridgeException error = Assertions.assertThrows(BridgeException.class,
                () -> validator.validate(parse("{\"bind\":[1,2,3,4]}")));
        Assertions.assertTrue(error.getMessage().contains("params.bind"));
    }

    @Test
    void rejectsExcessiveNesting() throws Exception {
        validator.validate(parse("{\"a\":{\"b\":1}}"));
        BridgeException error = Assertions.assertThrows(BridgeException.class,
                () -> validator.validate(parse("{\"a\":{\"b\":{\"c\":1}}}")));
        Assertions.assertTrue(error.getMessage().contains("nesting depth"));
    }

    @Test
    void rejectsTooManyValuesAcrossTheTree() {
        ObjectNode params = Jsons.object();
        for (int i = 0; i < 3; i++) {
            ArrayNode list = params.putArray("l" + i);
            list.add(1).add(2);
        }
        BridgeException error = Assertions.assertThrows(BridgeException.class, () -> validator.validate(params));
        Assertions.assertTrue(error.getMessage().contains("parameter count exceeds 8"));
    }

    private static JsonNode parse(String json) throws Exception {
        return Jsons.wire().readTree(json);
    }
}
