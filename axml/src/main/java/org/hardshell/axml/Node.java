package org.hardshell.axml;

/**
 * A tree chunk of a binary xml document. Documents are kept flat, the way the format stores them.
 */
public abstract class Node {

    private int lineNumber;
    private String comment;

    Node(int lineNumber, String comment) {
        this.lineNumber = lineNumber;
        this.comment = comment;
    }

    public abstract int chunkType();

    public int lineNumber() {
        return lineNumber;
    }

    public void setLineNumber(int lineNumber) {
        this.lineNumber = lineNumber;
    }

    public String comment() {
        return comment;
    }
}
