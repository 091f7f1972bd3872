package org.hardshell.loader;

import java.nio.ByteBuffer;

/**
 * A decrypted and verified code unit, named after its entry ({@code classes2.dex}).
 */
public final class CodeUnit {

    private final String name;
    private final byte[] bytes;

    public CodeUnit(String name, byte[] bytes) {
        this.name = name;
        this.bytes = bytes;
    }

    public String name() {
        return name;
    }

    public byte[] bytes() {
        return bytes;
    }

    public ByteBuffer buffer() {
        return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    }

    @Override
    public String toString() {
        return name + " (" + bytes.length + " bytes)";
    }
}
