package org.hardshell.axml;

public final class EndElement extends Node {

    private final String namespace;
    private final String name;

    public EndElement(int lineNumber, String comment, String namespace, String name) {
        super(lineNumber, comment);
        this.namespace = namespace;
        this.name = name;
    }

    @Override
    public int chunkType() {
        return ChunkType.END_ELEMENT;
    }

    public String namespace() {
        return namespace;
    }

    public String name() {
        return name;
    }
}
