package org.hardshell.share.payload;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.CRC32;

/**
 * Serializes entries in the order they were added: header, then metadata and ciphertext of each entry back to
 * back, then a CRC-32 over everything before it.
 */
public final class PayloadWriter {

    private final List<PayloadEntry> entries = new ArrayList<>();
    private final Set<String> identities = new HashSet<>();
    private final Set<String> nonces = new HashSet<>();

    public PayloadWriter add(PayloadEntry entry) {
        if (!identities.add(entry.toString()))
            throw new IllegalArgumentException("duplicate entry " + entry);
        if (!nonces.add(new String(entry.nonce(), StandardCharsets.ISO_8859_1)))
            throw new IllegalArgumentException("nonce reused by " + entry);
        entries.add(entry);
        return this;
    }

    public PayloadWriter addAll(Iterable<PayloadEntry> entries) {
        for (PayloadEntry entry : entries) add(entry);
        return this;
    }

    public int size() {
        return entries.size();
    }

    public byte[] toByteArray() {
        var os = new ByteArrayOutputStream();
        try {
            writeTo(os);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return os.toByteArray();
    }

    public void writeTo(OutputStream out) throws IOException {
        var crc = new CRC32();

        var header = ByteBuffer.allocate(PayloadFormat.HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(PayloadFormat.MAGIC);
        header.putShort((short) PayloadFormat.VERSION);
        header.putShort((short) 0);
        header.putInt(entries.size());
        write(out, crc, header.array());

        for (PayloadEntry entry : entries) {
            byte[] path = entry.path().getBytes(StandardCharsets.UTF_8);
            byte[] abi = entry.abi().getBytes(StandardCharsets.UTF_8);
            var meta = ByteBuffer.allocate(1 + 2 + path.length + 1 + abi.length
                    + entry.nonce().length + entry.tag().length + PayloadEntry.DIGEST_LENGTH + 4)
                    .order(ByteOrder.LITTLE_ENDIAN);
            meta.put((byte) entry.kind().id);
            meta.putShort((short) path.length);
            meta.put(path);
            meta.put((byte) abi.length);
            meta.put(abi);
            meta.put(entry.nonce());
            meta.put(entry.tag());
            meta.put(entry.digest());
            meta.putInt(entry.ciphertextLength());
            write(out, crc, meta.array());
            write(out, crc, entry.ciphertextBytes());
        }

        var trailer = ByteBuffer.allocate(PayloadFormat.TRAILER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        trailer.putInt((int) crc.getValue());
        out.write(trailer.array());
    }

    private static void write(OutputStream out, CRC32 crc, byte[] bytes) throws IOException {
        crc.update(bytes, 0, bytes.length);
        out.write(bytes);
    }
}
