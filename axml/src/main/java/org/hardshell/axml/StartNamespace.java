package org.hardshell.axml;

public final class StartNamespace extends Node {

    private final String prefix;
    private final String uri;

    public StartNamespace(int lineNumber, String comment, String prefix, String uri) {
        super(lineNumber, comment);
        this.prefix = prefix;
        this.uri = uri;
    }

    @Override
    public int chunkType() {
        return ChunkType.START_NAMESPACE;
    }

    public String prefix() {
        return prefix;
    }

    public String uri() {
        return uri;
    }
}
