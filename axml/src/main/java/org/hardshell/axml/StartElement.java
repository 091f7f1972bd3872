package org.hardshell.axml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class StartElement extends Node {

    private final String namespace;
    private final String name;
    private final List<Attribute> attributes = new ArrayList<>();
    // id, class and style attributes are tracked by identity so edits keep them pointing at the right slot
    private Attribute idAttribute;
    private Attribute classAttribute;
    private Attribute styleAttribute;

    public StartElement(int lineNumber, String comment, String namespace, String name) {
        super(lineNumber, comment);
        this.namespace = namespace;
        this.name = Objects.requireNonNull(name, "name");
    }

    public StartElement(String name) {
        this(0, null, null, name);
    }

    @Override
    public int chunkType() {
        return ChunkType.START_ELEMENT;
    }

    public String namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }

    public List<Attribute> attributes() {
        return Collections.unmodifiableList(attributes);
    }

    public Attribute attribute(int resourceId) {
        for (Attribute attribute : attributes) {
            if (attribute.resourceId() == resourceId) return attribute;
        }
        return null;
    }

    /**
     * Looks up an attribute by name, regardless of whether it carries a resource id.
     */
    public Attribute attribute(String namespace, String name) {
        for (Attribute attribute : attributes) {
            if (attribute.name().equals(name) && Objects.equals(attribute.namespace(), namespace)) return attribute;
        }
        return null;
    }

    /**
     * Replaces the attribute occupying the same slot, or inserts a new one keeping resource ids ascending.
     */
    public StartElement setAttribute(Attribute attribute) {
        for (int i = 0; i < attributes.size(); i++) {
            var existing = attributes.get(i);
            if (existing.sameSlot(attribute)) {
                attributes.set(i, attribute);
                if (idAttribute == existing) idAttribute = attribute;
                if (classAttribute == existing) classAttribute = attribute;
                if (styleAttribute == existing) styleAttribute = attribute;
                return this;
            }
        }
        int at = attributes.size();
        if (attribute.resourceId() != 0) {
            for (int i = 0; i < attributes.size(); i++) {
                int id = attributes.get(i).resourceId();
                if (id == 0 || Integer.compareUnsigned(id, attribute.resourceId()) > 0) {
                    at = i;
                    break;
                }
            }
        }
        attributes.add(at, attribute);
        return this;
    }

    public boolean removeAttribute(int resourceId) {
        var existing = attribute(resourceId);
        if (existing == null) return false;
        attributes.remove(existing);
        if (idAttribute == existing) idAttribute = null;
        if (classAttribute == existing) classAttribute = null;
        if (styleAttribute == existing) styleAttribute = null;
        return true;
    }

    void addParsed(Attribute attribute) {
        attributes.add(attribute);
    }

    void markSpecial(int idIndex, int classIndex, int styleIndex) {
        idAttribute = byOneBasedIndex(idIndex);
        classAttribute = byOneBasedIndex(classIndex);
        styleAttribute = byOneBasedIndex(styleIndex);
    }

    private Attribute byOneBasedIndex(int index) {
        return index > 0 && index <= attributes.size() ? attributes.get(index - 1) : null;
    }

    int idIndex() {
        return oneBasedIndexOf(idAttribute);
    }

    int classIndex() {
        return oneBasedIndexOf(classAttribute);
    }

    int styleIndex() {
        return oneBasedIndexOf(styleAttribute);
    }

    private int oneBasedIndexOf(Attribute attribute) {
        if (attribute == null) return 0;
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i) == attribute) return i + 1;
        }
        return 0;
    }

    @Override
    public String toString() {
        return "<" + name + " " + attributes + ">";
    }
}
