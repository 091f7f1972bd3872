package org.hardshell.share.payload;

import org.hardshell.share.crypto.AeadEngine;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Read side of the payload format. The trailer checksum is verified before any entry is indexed, and indexing
 * only walks metadata: ciphertext stays in place as read-only views of the source array.
 */
public final class PayloadContainer {

    private final List<PayloadEntry> entries;
    private final Map<String, PayloadEntry> index;

    private PayloadContainer(List<PayloadEntry> entries, Map<String, PayloadEntry> index) {
        this.entries = Collections.unmodifiableList(entries);
        this.index = Collections.unmodifiableMap(index);
    }

    public static PayloadContainer read(byte[] bytes) throws PayloadCorruptException {
        int total = bytes.length;
        if (total < PayloadFormat.HEADER_SIZE + PayloadFormat.TRAILER_SIZE)
            throw new PayloadCorruptException("payload truncated: " + total + " bytes");

        int bodyLength = total - PayloadFormat.TRAILER_SIZE;
        var crc = new CRC32();
        crc.update(bytes, 0, bodyLength);
        var cursor = new Cursor(bytes, bodyLength);
        if ((int) crc.getValue() != new Cursor(bytes, total, bodyLength).u32())
            throw new PayloadCorruptException("payload checksum mismatch");

        if (cursor.u32() != PayloadFormat.MAGIC)
            throw new PayloadCorruptException("bad payload magic");
        int version = cursor.u16();
        if (version != PayloadFormat.VERSION)
            throw new PayloadCorruptException("unsupported payload version " + version);
        cursor.u16();
        long count = cursor.u32() & 0xffffffffL;

        List<PayloadEntry> entries = new ArrayList<>((int) Math.min(count, 1024));
        for (long i = 0; i < count; i++) {
            var kind = EntryKind.fromId(cursor.u8());
            String path = cursor.string(cursor.u16());
            String abi = cursor.string(cursor.u8());
            byte[] nonce = cursor.bytes(AeadEngine.NONCE_LENGTH);
            byte[] tag = cursor.bytes(AeadEngine.TAG_LENGTH);
            byte[] digest = cursor.bytes(PayloadEntry.DIGEST_LENGTH);
            long length = cursor.u32() & 0xffffffffL;
            int offset = cursor.skip(length, path);
            var ciphertext = ByteBuffer.wrap(bytes, offset, (int) length).slice();
            try {
                entries.add(new PayloadEntry(kind, path, abi, nonce, tag, digest, ciphertext));
            } catch (IllegalArgumentException e) {
                throw new PayloadCorruptException("invalid entry metadata", e);
            }
        }
        if (cursor.remaining() != 0)
            throw new PayloadCorruptException(cursor.remaining() + " trailing bytes after last entry");

        var index = new LinkedHashMap<String, PayloadEntry>();
        for (PayloadEntry entry : entries) {
            if (index.put(key(entry.kind(), entry.path(), entry.abi()), entry) != null)
                throw new PayloadCorruptException("duplicate entry " + entry);
        }
        return new PayloadContainer(entries, index);
    }

    private static String key(EntryKind kind, String path, String abi) {
        return kind.id + "\0" + (abi == null ? "" : abi) + "\0" + path;
    }

    public List<PayloadEntry> entries() {
        return entries;
    }

    public List<PayloadEntry> entries(EntryKind kind) {
        List<PayloadEntry> out = new ArrayList<>();
        for (PayloadEntry entry : entries) {
            if (entry.kind() == kind) out.add(entry);
        }
        return out;
    }

    /**
     * @return the entry, or {@code null} when the container has none with this identity
     */
    public PayloadEntry find(EntryKind kind, String path, String abi) {
        return index.get(key(kind, path, abi));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private static final class Cursor {
        private final byte[] bytes;
        private final int limit;
        private int position;

        Cursor(byte[] bytes, int limit) {
            this(bytes, limit, 0);
        }

        Cursor(byte[] bytes, int limit, int position) {
            this.bytes = bytes;
            this.limit = limit;
            this.position = position;
        }

        int remaining() {
            return limit - position;
        }

        private void require(long n) throws PayloadCorruptException {
            if (n > remaining()) throw new PayloadCorruptException("payload metadata truncated");
        }

        int u8() throws PayloadCorruptException {
            require(1);
            return bytes[position++] & 0xff;
        }

        int u16() throws PayloadCorruptException {
            require(2);
            int v = (bytes[position] & 0xff) | (bytes[position + 1] & 0xff) << 8;
            position += 2;
            return v;
        }

        int u32() throws PayloadCorruptException {
            require(4);
            int v = (bytes[position] & 0xff)
                    | (bytes[position + 1] & 0xff) << 8
                    | (bytes[position + 2] & 0xff) << 16
                    | (bytes[position + 3] & 0xff) << 24;
            position += 4;
            return v;
        }

        byte[] bytes(int n) throws PayloadCorruptException {
            require(n);
            byte[] out = new byte[n];
            System.arraycopy(bytes, position, out, 0, n);
            position += n;
            return out;
        }

        String string(int n) throws PayloadCorruptException {
            return new String(bytes(n), StandardCharsets.UTF_8);
        }

        int skip(long n, String what) throws PayloadCorruptException {
            if (n > remaining()) throw new PayloadCorruptException("entry " + what + " overruns payload");
            int start = position;
            position += (int) n;
            return start;
        }
    }
}
