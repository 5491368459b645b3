package io.bridged.capability.xml;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.InvocationContext;
import io.bridged.capability.Params;
import io.bridged.model.BridgeException;
import io.bridged.model.ErrorCategory;
import io.bridged.pool.HandlePool;
import io.bridged.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class XmlDomModuleTest {
    private static final String CATALOG =
            "<catalog><book id=\"b1\" lang=\"en\"><title> Dune </title></book>"
                    + "<book id=\"b2\"><title>Solaris</title></book></catalog>";

    private final XmlDomModule module = new XmlDomModule();
    private final HandlePool pool = new HandlePool(20);
    private final InvocationContext ctx = new InvocationContext("x1", pool);

    @Test
    void navigatesParsedDocument() throws Exception {
        ObjectNode parsed = call("parse_string", params().put("xml_string", CATALOG));
        String documentId = parsed.path("document_id").asText();
        String rootId = parsed.path("root_node_id").asText();
        Assertions.assertTrue(documentId.startsWith("doc_"));
        Assertions.assertTrue(rootId.startsWith(documentId + ":n"));
        Assertions.assertEquals(rootId, call("get_document_root", params().put("document_id", documentId)).path("node_id").asText());
        Assertions.assertEquals("catalog", call("get_tag_name", params().put("node_id", rootId)).path("tag_name").asText());

        ObjectNode books = call("get_elements_by_tag_name", params().put("document_id", documentId).put("tag_name", "book"));
        Assertions.assertEquals(2, books.path("length").asInt());
        String first = books.path("node_ids").get(0).asText();
        Assertions.assertEquals(first, call("get_first_child", params().put("node_id", rootId)).path("node_id").asText());
        Assertions.assertEquals(rootId, call("get_parent_node", params().put("node_id", first)).path("node_id").asText());

        Assertions.assertEquals("en", call("get_attribute", params().put("node_id", first).put("attr_name", "lang")).path("value").asText());
        String second = books.path("node_ids").get(1).asText();
        Assertions.assertTrue(call("get_attribute", params().put("node_id", second).put("attr_name", "lang")).path("value").isNull());

        Assertions.assertEquals(" Dune ", call("get_text_contents", params().put("node_id", first)).path("text_content").asText());
        Assertions.assertEquals("Dune", call("get_text_contents", params().put("node_id", first).put("trim", true))
                .path("text_content").asText());

        String title = call("get_first_child", params().put("node_id", first)).path("node_id").asText();
        String text = call("get_first_child", params().put("node_id", title)).path("node_id").asText();
        Assertions.assertFalse(call("is_element_node", params().put("node_id", text)).path("is_element").asBoolean());
        Assertions.assertEquals(" Dune ", call("get_node_value", params().put("node_id", text)).path("value").asText());
    }

    @Test
    void sameNodeAlwaysGetsSameReference() throws Exception {
        String documentId = call("parse_string", params().put("xml_string", CATALOG)).path("document_id").asText();
        ObjectNode once = call("get_elements_by_tag_name", params().put("document_id", documentId).put("tag_name", "title"));
        ObjectNode twice = call("get_elements_by_tag_name", params().put("document_id", documentId).put("tag_name", "title"));
        Assertions.assertEquals(once.path("node_ids"), twice.path("node_ids"));
    }

    @Test
    void buildsAndSerializesNewContent() throws Exception {
        ObjectNode parsed = call("parse_string", params().put("xml_string", "<list/>"));
        String documentId = parsed.path("document_id").asText();
        String rootId = parsed.path("root_node_id").asText();

        String item = call("create_element", params().put("document_id", documentId).put("tag_name", "item")).path("node_id").asText();
        String text = call("create_text_node", params().put("document_id", documentId).put("data", "first")).path("node_id").asText();
        call("append_child", params().put("parent_id", item).put("child_id", text));
        call("set_attribute", params().put("node_id", item).put("attr_name", "n").put("value", "1"));
        call("append_child", params().put("parent_id", rootId).put("child_id", item));

        String copy = call("clone_node", params().put("node_id", item).put("deep", true)).path("node_id").asText();
        call("set_attribute", params().put("node_id", copy).put("attr_name", "n").put("value", "0"));
        call("insert_before", params().put("parent_id", rootId).put("new_child_id", copy).put("ref_child_id", item));

        Assertions.assertEquals("<list><item n=\"0\">first</item><item n=\"1\">first</item></list>",
                call("to_string", params().put("node_id", rootId)).path("xml").asText());

        ObjectNode removed = call("remove_attribute", params().put("node_id", copy).put("attr_name", "n"));
        Assertions.assertTrue(removed.path("removed").asBoolean());
        Assertions.assertFalse(call("has_attribute", params().put("node_id", copy).put("attr_name", "n")).path("has_attribute").asBoolean());

        call("remove_child", params().put("parent_id", rootId).put("child_id", item));
        Assertions.assertEquals("<list><item>first</item></list>",
                call("to_string", params().put("node_id", rootId)).path("xml").asText());
    }

    @Test
    void xpathQueries() throws Exception {
        String documentId = call("parse_string", params().put("xml_string", CATALOG)).path("document_id").asText();
        ObjectNode nodes = call("xql_find_nodes", params().put("document_id", documentId).put("xpath", "//book[@id]"));
        Assertions.assertEquals(2, nodes.path("length").asInt());

        ObjectNode value = call("xql_find_value", params().put("document_id", documentId).put("xpath", "//book[@id='b2']/title"));
        Assertions.assertTrue(value.path("found").asBoolean());
        Assertions.assertEquals("Solaris", value.path("value").asText());

        ObjectNode missing = call("xql_find_value", params().put("document_id", documentId).put("query", "//magazine"));
        Assertions.assertFalse(missing.path("found").asBoolean());
        Assertions.assertTrue(missing.path("value").isNull());

        Assertions.assertTrue(call("xql_exists", params().put("document_id", documentId).put("xpath", "//title")).path("exists").asBoolean());

        BridgeException invalid = Assertions.assertThrows(BridgeException.class,
                () -> call("xql_find_nodes", params().put("document_id", documentId).put("xpath", "//book[")));
        Assertions.assertEquals(ErrorCategory.VALIDATION, invalid.category());
    }

    @Test
    void rejectsDoctypeAndMalformedInput() {
        String xxe = "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><r>&x;</r>";
        BridgeException doctype = Assertions.assertThrows(BridgeException.class,
                () -> call("parse_string", params().put("xml_string", xxe)));
        Assertions.assertEquals(ErrorCategory.EXECUTION, doctype.category());
        Assertions.assertTrue(doctype.getMessage().startsWith("XML parsing failed"));

        BridgeException broken = Assertions.assertThrows(BridgeException.class,
                () -> call("parse_string", params().put("xml_string", "<a><b></a>")));
        Assertions.assertTrue(broken.getMessage().startsWith("XML parsing failed"));
        Assertions.assertEquals(0, pool.size());
    }

    @Test
    void parsesFilesAndReportsMissingOnes() throws Exception {
        Path root = Files.createTempDirectory("bridged-xml-test-");
        try {
            Path file = root.resolve("config.xml");
            Files.writeString(file, "<?xml version=\"1.0\" encoding=\"UTF-8\"?><config><name>Zoë</name></config>", StandardCharsets.UTF_8);
            String documentId = call("parse_file", params().put("filename", file.toString())).path("document_id").asText();
            ObjectNode value = call("xql_find_value", params().put("document_id", documentId).put("xpath", "/config/name"));
            Assertions.assertEquals("Zoë", value.path("value").asText());

            BridgeException missing = Assertions.assertThrows(BridgeException.class,
                    () -> call("parse_file", params().put("filename", root.resolve("nope.xml").toString())));
            Assertions.assertEquals("File not found: " + root.resolve("nope.xml"), missing.getMessage());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nodesFromAnotherDocumentAreRejectedAndDisposeInvalidatesReferences() throws Exception {
        ObjectNode a = call("parse_string", params().put("xml_string", "<a/>"));
        ObjectNode b = call("parse_string", params().put("xml_string", "<b/>"));
        String foreign = call("create_element", params().put("document_id", b.path("document_id").asText()).put("tag_name", "x"))
                .path("node_id").asText();

        BridgeException cross = Assertions.assertThrows(BridgeException.class,
                () -> call("append_child", params().put("parent_id", a.path("root_node_id").asText()).put("child_id", foreign)));
        Assertions.assertEquals(ErrorCategory.VALIDATION, cross.category());

        String documentId = a.path("document_id").asText();
        Assertions.assertTrue(call("dispose_document", params().put("document_id", documentId)).path("disposed").asBoolean());
        BridgeException gone = Assertions.assertThrows(BridgeException.class,
                () -> call("get_tag_name", params().put("node_id", a.path("root_node_id").asText())));
        Assertions.assertEquals(ErrorCategory.HANDLE, gone.category());

        BridgeException unknownNode = Assertions.assertThrows(BridgeException.class,
                () -> call("get_tag_name", params().put("node_id", b.path("document_id").asText() + ":n999")));
        Assertions.assertEquals(ErrorCategory.HANDLE, unknownNode.category());
    }

    private ObjectNode call(String function, ObjectNode params) throws Exception {
        return module.operations().get(function).invoke(new Params(params), ctx);
    }

    private static ObjectNode params() {
        return Jsons.object();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
