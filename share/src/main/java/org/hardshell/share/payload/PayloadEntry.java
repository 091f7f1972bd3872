package org.hardshell.share.payload;

import org.hardshell.share.crypto.AeadEngine;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One encrypted blob and the metadata needed to find and verify it.
 * <p>
 * Code units are named by their dex file name ({@code classes2.dex}), native libraries by their file name
 * ({@code libexample.so}) plus ABI, assets by their full entry path.
 */
public final class PayloadEntry {

    public static final int DIGEST_LENGTH = 32;

    private final EntryKind kind;
    private final String path;
    private final String abi;
    private final byte[] nonce;
    private final byte[] tag;
    private final byte[] digest;
    private final ByteBuffer ciphertext;

    public PayloadEntry(EntryKind kind, String path, String abi, byte[] nonce, byte[] tag, byte[] digest, ByteBuffer ciphertext) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.path = Objects.requireNonNull(path, "path");
        this.abi = abi == null ? "" : abi;
        if (kind != EntryKind.NATIVE_LIB && !this.abi.isEmpty())
            throw new IllegalArgumentException("only native libraries carry an abi: " + path);
        if (kind == EntryKind.NATIVE_LIB && this.abi.isEmpty())
            throw new IllegalArgumentException("native library without abi: " + path);
        if (path.isEmpty() || path.getBytes(StandardCharsets.UTF_8).length > 0xffff)
            throw new IllegalArgumentException("bad entry path length: " + path);
        if (this.abi.getBytes(StandardCharsets.UTF_8).length > 0xff)
            throw new IllegalArgumentException("bad abi length: " + this.abi);
        this.nonce = check(nonce, AeadEngine.NONCE_LENGTH, "nonce");
        this.tag = check(tag, AeadEngine.TAG_LENGTH, "tag");
        this.digest = check(digest, DIGEST_LENGTH, "digest");
        this.ciphertext = ciphertext.asReadOnlyBuffer();
    }

    private static byte[] check(byte[] value, int length, String name) {
        if (value == null || value.length != length)
            throw new IllegalArgumentException(name + " must be " + length + " bytes");
        return value.clone();
    }

    public EntryKind kind() {
        return kind;
    }

    public String path() {
        return path;
    }

    public String abi() {
        return abi;
    }

    public byte[] nonce() {
        return nonce.clone();
    }

    public byte[] tag() {
        return tag.clone();
    }

    public byte[] digest() {
        return digest.clone();
    }

    public int ciphertextLength() {
        return ciphertext.remaining();
    }

    public ByteBuffer ciphertext() {
        return ciphertext.duplicate();
    }

    public byte[] ciphertextBytes() {
        byte[] out = new byte[ciphertext.remaining()];
        ciphertext.duplicate().get(out);
        return out;
    }

    /**
     * Binds a ciphertext to its declared identity: kind, path and abi.
     */
    public byte[] associatedData() {
        return associatedData(kind, path, abi);
    }

    public static byte[] associatedData(EntryKind kind, String path, String abi) {
        byte[] pathBytes = path.getBytes(StandardCharsets.UTF_8);
        byte[] abiBytes = (abi == null ? "" : abi).getBytes(StandardCharsets.UTF_8);
        var os = new ByteArrayOutputStream(4 + pathBytes.length + abiBytes.length);
        os.write(kind.id);
        os.write(pathBytes.length & 0xff);
        os.write((pathBytes.length >>> 8) & 0xff);
        os.write(pathBytes, 0, pathBytes.length);
        os.write(abiBytes.length);
        os.write(abiBytes, 0, abiBytes.length);
        return os.toByteArray();
    }

    @Override
    public String toString() {
        return kind + ":" + (abi.isEmpty() ? "" : abi + "/") + path;
    }
}
