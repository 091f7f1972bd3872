package org.hardshell.axml;

public final class CData extends Node {

    private final String text;
    private final int type;
    private final int data;

    public CData(int lineNumber, String comment, String text, int type, int data) {
        super(lineNumber, comment);
        this.text = text;
        this.type = type;
        this.data = data;
    }

    @Override
    public int chunkType() {
        return ChunkType.CDATA;
    }

    public String text() {
        return text;
    }

    public int type() {
        return type;
    }

    public int data() {
        return data;
    }
}
