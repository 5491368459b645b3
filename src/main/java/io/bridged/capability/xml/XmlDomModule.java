package io.bridged.capability.xml;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.capability.CapabilityModule;
import io.bridged.capability.InvocationContext;
import io.bridged.capability.Operation;
import io.bridged.capability.Params;
import io.bridged.model.BridgeException;
import io.bridged.model.HandleKind;
import io.bridged.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.DOMException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

public final class XmlDomModule implements CapabilityModule {
    private static final Logger LOG = LoggerFactory.getLogger(XmlDomModule.class);

    @Override
    public String name() {
        return "xml";
    }

    @Override
    public Map<String, Operation> operations() {
        Map<String, Operation> ops = new LinkedHashMap<>();
        ops.put("parse_string", (params, ctx) -> parse(
                new InputSource(new StringReader(params.requireText("xml_string"))), "string", ctx));
        ops.put("parse_file", this::parseFile);
        ops.put("get_document_root", (params, ctx) -> onNode(params.requireText("document_id"), ctx, (doc, node) -> {
            ObjectNode out = Jsons.object();
            out.put("node_id", doc.reference(doc.document().getDocumentElement()));
            return out;
        }));
        ops.put("get_elements_by_tag_name", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            String tag = params.requireNonBlank("tag_name");
            NodeList found = node instanceof Document
                    ? ((Document) node).getElementsByTagName(tag)
                    : asElement(node, "get_elements_by_tag_name").getElementsByTagName(tag);
            return nodeList(doc, found);
        }));
        ops.put("get_child_nodes", (params, ctx) -> onNode(target(params), ctx,
                (doc, node) -> nodeList(doc, node.getChildNodes())));
        ops.put("get_first_child", (params, ctx) -> onNode(target(params), ctx,
                (doc, node) -> single("node_id", doc.reference(node.getFirstChild()))));
        ops.put("get_parent_node", (params, ctx) -> onNode(target(params), ctx,
                (doc, node) -> single("node_id", doc.reference(node.getParentNode()))));
        ops.put("get_tag_name", (params, ctx) -> onNode(target(params), ctx,
                (doc, node) -> single("tag_name", asElement(node, "get_tag_name").getTagName())));
        ops.put("is_element_node", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            ObjectNode out = Jsons.object();
            out.put("is_element", node.getNodeType() == Node.ELEMENT_NODE);
            return out;
        }));
        ops.put("get_attribute", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            Element element = asElement(node, "get_attribute");
            String attr = params.requireNonBlank("attr_name");
            return single("value", element.hasAttribute(attr) ? element.getAttribute(attr) : null);
        }));
        ops.put("set_attribute", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            String attr = params.requireNonBlank("attr_name");
            String value = params.requireText("value");
            asElement(node, "set_attribute").setAttribute(attr, value);
            ObjectNode out = Jsons.object();
            out.put("attribute", attr);
            out.put("value", value);
            return out;
        }));
        ops.put("has_attribute", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            ObjectNode out = Jsons.object();
            out.put("has_attribute", asElement(node, "has_attribute").hasAttribute(params.requireNonBlank("attr_name")));
            return out;
        }));
        ops.put("remove_attribute", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            Element element = asElement(node, "remove_attribute");
            String attr = params.requireNonBlank("attr_name");
            boolean present = element.hasAttribute(attr);
            element.removeAttribute(attr);
            ObjectNode out = Jsons.object();
            out.put("attribute", attr);
            out.put("removed", present);
            return out;
        }));
        ops.put("get_text_contents", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            String text = node instanceof Document
                    ? ((Document) node).getDocumentElement().getTextContent()
                    : node.getTextContent();
            return single("text_content", params.bool("trim", false) && text != null ? text.strip() : text);
        }));
        ops.put("get_node_value", (params, ctx) -> onNode(target(params), ctx,
                (doc, node) -> single("value", node.getNodeValue())));
        ops.put("create_element", (params, ctx) -> onNode(params.requireText("document_id"), ctx, (doc, node) -> {
            Element element;
            try {
                element = doc.document().createElement(params.requireNonBlank("tag_name"));
            } catch (DOMException e) {
                throw BridgeException.validation("invalid tag name: " + params.requireText("tag_name"));
            }
            return single("node_id", doc.reference(element));
        }));
        ops.put("create_text_node", (params, ctx) -> onNode(params.requireText("document_id"), ctx, (doc, node) ->
                single("node_id", doc.reference(doc.document().createTextNode(params.firstText("data", "text"))))));
        ops.put("append_child", (params, ctx) -> {
            String parentId = params.requireText("parent_id");
            String childId = params.requireText("child_id");
            return onNode(parentId, ctx, (doc, parent) -> {
                Node child = sameDocument(doc, parentId, childId);
                mutate(() -> parent.appendChild(child));
                return single("node_id", childId);
            });
        });
        ops.put("remove_child", (params, ctx) -> {
            String parentId = params.requireText("parent_id");
            String childId = params.requireText("child_id");
            return onNode(parentId, ctx, (doc, parent) -> {
                Node child = sameDocument(doc, parentId, childId);
                mutate(() -> parent.removeChild(child));
                return single("node_id", childId);
            });
        });
        ops.put("insert_before", (params, ctx) -> {
            String parentId = params.requireText("parent_id");
            String newChildId = params.requireText("new_child_id");
            String refChildId = params.text("ref_child_id", null);
            return onNode(parentId, ctx, (doc, parent) -> {
                Node newChild = sameDocument(doc, parentId, newChildId);
                Node refChild = refChildId == null ? null : sameDocument(doc, parentId, refChildId);
                mutate(() -> parent.insertBefore(newChild, refChild));
                return single("node_id", newChildId);
            });
        });
        ops.put("replace_child", (params, ctx) -> {
            String parentId = params.requireText("parent_id");
            String newChildId = params.requireText("new_child_id");
            String oldChildId = params.requireText("old_child_id");
            return onNode(parentId, ctx, (doc, parent) -> {
                Node newChild = sameDocument(doc, parentId, newChildId);
                Node oldChild = sameDocument(doc, parentId, oldChildId);
                mutate(() -> parent.replaceChild(newChild, oldChild));
                return single("node_id", oldChildId);
            });
        });
        ops.put("clone_node", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            if (node instanceof Document) {
                throw BridgeException.validation("clone_node does not accept a document");
            }
            return single("node_id", doc.reference(node.cloneNode(params.bool("deep", false))));
        }));
        ops.put("to_string", (params, ctx) -> onNode(target(params), ctx,
                (doc, node) -> single("xml", serialize(node, params.bool("indent", false)))));
        ops.put("xql_find_nodes", (params, ctx) -> onNode(target(params), ctx, (doc, node) ->
                nodeList(doc, (NodeList) xpath(params, node, XPathConstants.NODESET))));
        ops.put("xql_find_value", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            NodeList found = (NodeList) xpath(params, node, XPathConstants.NODESET);
            String value = found.getLength() == 0 ? null : found.item(0).getTextContent();
            ObjectNode out = single("value", value);
            out.put("found", found.getLength() > 0);
            return out;
        }));
        ops.put("xql_exists", (params, ctx) -> onNode(target(params), ctx, (doc, node) -> {
            ObjectNode out = Jsons.object();
            out.put("exists", (Boolean) xpath(params, node, XPathConstants.BOOLEAN));
            return out;
        }));
        ops.put("dispose_document", this::dispose);
        return ops;
    }

    private ObjectNode parseFile(Params params, InvocationContext ctx) throws IOException {
        Path file = Path.of(params.requireNonBlank("filename"));
        if (!Files.isRegularFile(file)) {
            throw BridgeException.execution("File not found: " + file);
        }
        InputSource source = new InputSource(file.toUri().toString());
        try (InputStream in = Files.newInputStream(file)) {
            source.setByteStream(in);
            return parse(source, file.toString(), ctx);
        }
    }

    private ObjectNode parse(InputSource input, String origin, InvocationContext ctx) throws IOException {
        Document document;
        try {
            DocumentBuilder builder = secureBuilderFactory().newDocumentBuilder();
            builder.setErrorHandler(new QuietErrorHandler());
            document = builder.parse(input);
        } catch (ParserConfigurationException e) {
            throw BridgeException.internal("XML parser configuration failed: " + e.getMessage(), e);
        } catch (SAXException e) {
            LOG.debug("Rejected XML from {}: {}", origin, e.getMessage());
            throw BridgeException.execution("XML parsing failed: " + e.getMessage(), e);
        }
        DomDocument state = new DomDocument(document);
        String documentId = ctx.pool().create(HandleKind.DOM_DOCUMENT, state, ctx.exchangeId());
        state.bind(documentId);
        ObjectNode out = Jsons.object();
        out.put("document_id", documentId);
        // not yet visible to any other exchange
        out.put("root_node_id", state.reference(document.getDocumentElement()));
        return out;
    }

    private ObjectNode dispose(Params params, InvocationContext ctx) {
        String documentId = params.requireText("document_id");
        ctx.pool().removeExpected(documentId, HandleKind.DOM_DOCUMENT);
        ObjectNode out = Jsons.object();
        out.put("document_id", documentId);
        out.put("disposed", true);
        return out;
    }

    private ObjectNode onNode(String reference, InvocationContext ctx, NodeCall call) throws Exception {
        return ctx.pool().withHandle(documentIdOf(reference), HandleKind.DOM_DOCUMENT, h -> {
            DomDocument doc = h.state(DomDocument.class);
            return call.apply(doc, doc.resolve(reference));
        });
    }

    static String documentIdOf(String reference) {
        int colon = reference.indexOf(':');
        return colon < 0 ? reference : reference.substring(0, colon);
    }

    private static String target(Params params) {
        return params.firstText("node_id", "document_id");
    }

    private static Node sameDocument(DomDocument doc, String parentRef, String otherRef) {
        if (!documentIdOf(otherRef).equals(doc.documentId())) {
            throw BridgeException.validation("nodes " + parentRef + " and " + otherRef + " belong to different documents");
        }
        return doc.resolve(otherRef);
    }

    private static void mutate(Runnable change) {
        try {
            change.run();
        } catch (DOMException e) {
            throw BridgeException.execution("DOM operation failed: " + e.getMessage(), e);
        }
    }

    private static Element asElement(Node node, String operation) {
        if (node.getNodeType() != Node.ELEMENT_NODE) {
            throw BridgeException.validation(operation + " requires an element node");
        }
        return (Element) node;
    }

    private static ObjectNode single(String key, String value) {
        ObjectNode out = Jsons.object();
        out.put(key, value);
        return out;
    }

    private static ObjectNode nodeList(DomDocument doc, NodeList nodes) {
        ObjectNode out = Jsons.object();
        ArrayNode ids = out.putArray("node_ids");
        for (int i = 0; i < nodes.getLength(); i++) {
            ids.add(doc.reference(nodes.item(i)));
        }
        out.put("length", nodes.getLength());
        return out;
    }

    private static Object xpath(Params params, Node context, QName returnType) {
        String expression = params.firstText("xpath", "query");
        XPath xpath = XPathFactory.newInstance().newXPath();
        try {
            return xpath.evaluate(expression, context, returnType);
        } catch (XPathExpressionException e) {
            throw BridgeException.validation("invalid XPath expression '" + expression + "'");
        }
    }

    static String serialize(Node node, boolean indent) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, node instanceof Document ? "no" : "yes");
            if (indent) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            }
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw BridgeException.execution("XML serialization failed: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilderFactory secureBuilderFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException e) {
            throw BridgeException.internal("Failed to configure XML parser: " + e.getMessage(), e);
        }
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    @FunctionalInterface
    private interface NodeCall {
        ObjectNode apply(DomDocument doc, Node node);
    }

    private static final class QuietErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            LOG.debug("XML parser warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
