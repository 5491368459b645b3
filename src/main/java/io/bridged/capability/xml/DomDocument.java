package io.bridged.capability.xml;

import io.bridged.model.BridgeException;
import org.w3c.dom.Document;
import org.w3c.dom.Node;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * A parsed document plus the node references handed out for it. References are
 * {@code <documentId>:n<k>} and stay stable for the life of the document.
 */
final class DomDocument implements AutoCloseable {
    private Document document;
    private String documentId;
    private final Map<Node, String> idsByNode = new IdentityHashMap<>();
    private final Map<String, Node> nodesById = new HashMap<>();
    private long nextNode = 1;

    DomDocument(Document document) {
        this.document = document;
    }

    void bind(String documentId) {
        this.documentId = documentId;
    }

    Document document() {
        return document;
    }

    String documentId() {
        return documentId;
    }

    String reference(Node node) {
        if (node == null) {
            return null;
        }
        if (node == document) {
            return documentId;
        }
        return idsByNode.computeIfAbsent(node, n -> {
            String id = documentId + ":n" + nextNode++;
            nodesById.put(id, n);
            return id;
        });
    }

    Node resolve(String reference) {
        if (reference.equals(documentId)) {
            return document;
        }
        Node node = nodesById.get(reference);
        if (node == null) {
            throw BridgeException.handleNotFound(reference);
        }
        return node;
    }

    @Override
    public void close() {
        idsByNode.clear();
        nodesById.clear();
        document = null;
    }
}
