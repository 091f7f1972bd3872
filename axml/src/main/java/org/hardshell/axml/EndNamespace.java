package org.hardshell.axml;

public final class EndNamespace extends Node {

    private final String prefix;
    private final String uri;

    public EndNamespace(int lineNumber, String comment, String prefix, String uri) {
        super(lineNumber, comment);
        this.prefix = prefix;
        this.uri = uri;
    }

    @Override
    public int chunkType() {
        return ChunkType.END_NAMESPACE;
    }

    public String prefix() {
        return prefix;
    }

    public String uri() {
        return uri;
    }
}
