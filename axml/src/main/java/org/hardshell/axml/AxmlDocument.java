package org.hardshell.axml;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An Android binary xml document, held as the flat list of tree chunks the format stores.
 * <p>
 * Parsing resolves every pool index to its string, so nodes can be edited freely; {@link #toByteArray()}
 * rebuilds the string pool and resource map from scratch.
 */
public final class AxmlDocument {

    private final List<Node> nodes;
    private boolean utf8;

    AxmlDocument(List<Node> nodes, boolean utf8) {
        this.nodes = new ArrayList<>(nodes);
        this.utf8 = utf8;
    }

    public AxmlDocument() {
        this(Collections.emptyList(), false);
    }

    public static AxmlDocument parse(byte[] bytes) throws IOException {
        return AxmlReader.read(bytes);
    }

    public byte[] toByteArray() {
        return AxmlWriter.write(this);
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public boolean isUtf8() {
        return utf8;
    }

    public void setUtf8(boolean utf8) {
        this.utf8 = utf8;
    }

    public void append(Node node) {
        nodes.add(node);
    }

    /**
     * @return the document element, or {@code null} for an empty document
     */
    public StartElement root() {
        for (Node node : nodes) {
            if (node instanceof StartElement) return (StartElement) node;
        }
        return null;
    }

    public List<StartElement> elements(String name) {
        List<StartElement> out = new ArrayList<>();
        for (Node node : nodes) {
            if (node instanceof StartElement && ((StartElement) node).name().equals(name)) out.add((StartElement) node);
        }
        return out;
    }

    public StartElement firstElement(String name) {
        for (Node node : nodes) {
            if (node instanceof StartElement && ((StartElement) node).name().equals(name)) return (StartElement) node;
        }
        return null;
    }

    /**
     * Direct children of {@code parent} with the given name.
     */
    public List<StartElement> children(StartElement parent, String name) {
        List<StartElement> out = new ArrayList<>();
        int depth = 0;
        for (int i = indexOf(parent) + 1; i < nodes.size(); i++) {
            var node = nodes.get(i);
            if (node instanceof StartElement) {
                if (depth == 0 && ((StartElement) node).name().equals(name)) out.add((StartElement) node);
                depth++;
            } else if (node instanceof EndElement) {
                if (depth == 0) break;
                depth--;
            }
        }
        return out;
    }

    /**
     * Inserts {@code child} and its end tag as the last child of {@code parent}.
     */
    public void appendChild(StartElement parent, StartElement child) {
        int end = endIndexOf(parent);
        child.setLineNumber(nodes.get(end).lineNumber());
        nodes.add(end, new EndElement(child.lineNumber(), null, child.namespace(), child.name()));
        nodes.add(end, child);
    }

    private int indexOf(StartElement element) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == element) return i;
        }
        throw new IllegalArgumentException("element not in document: " + element);
    }

    private int endIndexOf(StartElement element) {
        int depth = 0;
        for (int i = indexOf(element) + 1; i < nodes.size(); i++) {
            var node = nodes.get(i);
            if (node instanceof StartElement) {
                depth++;
            } else if (node instanceof EndElement) {
                if (depth == 0) return i;
                depth--;
            }
        }
        throw new IllegalStateException("unterminated element " + element.name());
    }
}
