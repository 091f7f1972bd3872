package org.hardshell.axml;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads and writes the string pool chunk. Both UTF-8 and UTF-16 encodings are understood; styled strings are
 * not, manifests never carry them.
 */
final class StringPool {

    private final List<String> strings;
    private final boolean utf8;

    StringPool(List<String> strings, boolean utf8) {
        this.strings = Collections.unmodifiableList(strings);
        this.utf8 = utf8;
    }

    boolean isUtf8() {
        return utf8;
    }

    int size() {
        return strings.size();
    }

    String get(int index) throws IOException {
        if (index == ChunkType.NO_INDEX) return null;
        if (index < 0 || index >= strings.size())
            throw new IOException("string index " + index + " out of range " + strings.size());
        return strings.get(index);
    }

    static StringPool read(ByteBuffer buf, int start, int headerSize, int chunkSize) throws IOException {
        int stringCount = buf.getInt(start + 8);
        int styleCount = buf.getInt(start + 12);
        int flags = buf.getInt(start + 16);
        int stringsStart = buf.getInt(start + 20);
        if (styleCount != 0) throw new IOException("styled strings are not supported");
        if (stringCount < 0 || headerSize + 4L * stringCount > chunkSize)
            throw new IOException("bad string count " + stringCount);

        boolean utf8 = (flags & ChunkType.UTF8_FLAG) != 0;
        List<String> strings = new ArrayList<>(stringCount);
        int end = start + chunkSize;
        for (int i = 0; i < stringCount; i++) {
            int offset = start + stringsStart + buf.getInt(start + headerSize + 4 * i);
            if (offset < start || offset >= end) throw new IOException("string " + i + " outside pool");
            strings.add(utf8 ? readUtf8(buf, offset, end) : readUtf16(buf, offset, end));
        }
        return new StringPool(strings, utf8);
    }

    private static String readUtf16(ByteBuffer buf, int offset, int end) throws IOException {
        int length = buf.getShort(offset) & 0xffff;
        offset += 2;
        if ((length & 0x8000) != 0) {
            length = ((length & 0x7fff) << 16) | (buf.getShort(offset) & 0xffff);
            offset += 2;
        }
        if (offset + 2L * length > end) throw new IOException("string overruns pool");
        byte[] bytes = new byte[length * 2];
        for (int i = 0; i < bytes.length; i++) bytes[i] = buf.get(offset + i);
        return new String(bytes, StandardCharsets.UTF_16LE);
    }

    private static String readUtf8(ByteBuffer buf, int offset, int end) throws IOException {
        // utf-16 length first, then the utf-8 byte length
        offset += (buf.get(offset) & 0x80) != 0 ? 2 : 1;
        int length = buf.get(offset) & 0xff;
        if ((length & 0x80) != 0) {
            length = ((length & 0x7f) << 8) | (buf.get(offset + 1) & 0xff);
            offset += 2;
        } else {
            offset += 1;
        }
        if (offset + (long) length > end) throw new IOException("string overruns pool");
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) bytes[i] = buf.get(offset + i);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    byte[] toChunk() {
        List<byte[]> encoded = new ArrayList<>(strings.size());
        int dataSize = 0;
        for (String s : strings) {
            byte[] e = utf8 ? encodeUtf8(s) : encodeUtf16(s);
            encoded.add(e);
            dataSize += e.length;
        }
        int padded = (dataSize + 3) & ~3;
        int stringsStart = ChunkType.STRING_POOL_HEADER_SIZE + 4 * strings.size();
        int size = stringsStart + padded;

        var buf = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        buf.putShort((short) ChunkType.STRING_POOL);
        buf.putShort((short) ChunkType.STRING_POOL_HEADER_SIZE);
        buf.putInt(size);
        buf.putInt(strings.size());
        buf.putInt(0);
        buf.putInt(utf8 ? ChunkType.UTF8_FLAG : 0);
        buf.putInt(strings.isEmpty() ? 0 : stringsStart);
        buf.putInt(0);
        int offset = 0;
        for (byte[] e : encoded) {
            buf.putInt(offset);
            offset += e.length;
        }
        for (byte[] e : encoded) buf.put(e);
        return buf.array();
    }

    private static byte[] encodeUtf16(String s) {
        int length = s.length();
        byte[] chars = s.getBytes(StandardCharsets.UTF_16LE);
        boolean wide = length > 0x7fff;
        var buf = ByteBuffer.allocate((wide ? 4 : 2) + chars.length + 2).order(ByteOrder.LITTLE_ENDIAN);
        if (wide) {
            buf.putShort((short) (0x8000 | (length >>> 16)));
            buf.putShort((short) length);
        } else {
            buf.putShort((short) length);
        }
        buf.put(chars);
        buf.putShort((short) 0);
        return buf.array();
    }

    private static byte[] encodeUtf8(String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        if (s.length() > 0x7fff || bytes.length > 0x7fff)
            throw new IllegalArgumentException("string too long for a utf-8 pool");
        var buf = ByteBuffer.allocate(lengthSize(s.length()) + lengthSize(bytes.length) + bytes.length + 1);
        putLength(buf, s.length());
        putLength(buf, bytes.length);
        buf.put(bytes);
        buf.put((byte) 0);
        return buf.array();
    }

    private static int lengthSize(int length) {
        return length > 0x7f ? 2 : 1;
    }

    private static void putLength(ByteBuffer buf, int length) {
        if (length > 0x7f) {
            buf.put((byte) (0x80 | (length >>> 8)));
            buf.put((byte) length);
        } else {
            buf.put((byte) length);
        }
    }
}
