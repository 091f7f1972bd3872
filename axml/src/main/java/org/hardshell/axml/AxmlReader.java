package org.hardshell.axml;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

final class AxmlReader {

    private final ByteBuffer buf;
    private StringPool pool;
    private int[] resourceMap = new int[0];

    private AxmlReader(byte[] bytes) {
        this.buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    static AxmlDocument read(byte[] bytes) throws IOException {
        try {
            return new AxmlReader(bytes).read();
        } catch (IndexOutOfBoundsException | BufferUnderflowException e) {
            throw new IOException("truncated binary xml", e);
        }
    }

    private AxmlDocument read() throws IOException {
        if (buf.capacity() < ChunkType.XML_HEADER_SIZE || (buf.getShort(0) & 0xffff) != ChunkType.XML)
            throw new IOException("not a binary xml document");
        int headerSize = buf.getShort(2) & 0xffff;
        int size = buf.getInt(4);
        if (size > buf.capacity() || size < headerSize)
            throw new IOException("document size " + size + " exceeds " + buf.capacity() + " bytes");

        List<Node> nodes = new ArrayList<>();
        int position = headerSize;
        while (position < size) {
            int type = buf.getShort(position) & 0xffff;
            int chunkHeaderSize = buf.getShort(position + 2) & 0xffff;
            int chunkSize = buf.getInt(position + 4);
            if (chunkSize < 8 || chunkHeaderSize > chunkSize || (long) position + chunkSize > size)
                throw new IOException(String.format("chunk 0x%04x at %d overruns document", type, position));
            switch (type) {
                case ChunkType.STRING_POOL:
                    pool = StringPool.read(buf, position, chunkHeaderSize, chunkSize);
                    break;
                case ChunkType.RESOURCE_MAP:
                    resourceMap = new int[(chunkSize - chunkHeaderSize) / 4];
                    for (int i = 0; i < resourceMap.length; i++) {
                        resourceMap[i] = buf.getInt(position + chunkHeaderSize + 4 * i);
                    }
                    break;
                case ChunkType.START_NAMESPACE:
                case ChunkType.END_NAMESPACE:
                case ChunkType.START_ELEMENT:
                case ChunkType.END_ELEMENT:
                case ChunkType.CDATA:
                    nodes.add(readNode(type, position, chunkHeaderSize));
                    break;
                default:
                    throw new IOException(String.format("unsupported chunk type 0x%04x", type));
            }
            position += chunkSize;
        }
        if (pool == null) throw new IOException("binary xml without string pool");
        return new AxmlDocument(nodes, pool.isUtf8());
    }

    private Node readNode(int type, int start, int headerSize) throws IOException {
        if (pool == null) throw new IOException("tree chunk before string pool");
        int line = buf.getInt(start + 8);
        String comment = pool.get(buf.getInt(start + 12));
        int ext = start + headerSize;
        switch (type) {
            case ChunkType.START_NAMESPACE:
                return new StartNamespace(line, comment, pool.get(buf.getInt(ext)), pool.get(buf.getInt(ext + 4)));
            case ChunkType.END_NAMESPACE:
                return new EndNamespace(line, comment, pool.get(buf.getInt(ext)), pool.get(buf.getInt(ext + 4)));
            case ChunkType.END_ELEMENT:
                return new EndElement(line, comment, pool.get(buf.getInt(ext)), pool.get(buf.getInt(ext + 4)));
            case ChunkType.CDATA: {
                String text = pool.get(buf.getInt(ext));
                int dataType = buf.get(ext + 7) & 0xff;
                int data = buf.getInt(ext + 8);
                return new CData(line, comment, text, dataType, data);
            }
            default:
                return readStartElement(line, comment, ext);
        }
    }

    private StartElement readStartElement(int line, String comment, int ext) throws IOException {
        var element = new StartElement(line, comment, pool.get(buf.getInt(ext)), pool.get(buf.getInt(ext + 4)));
        int attributeStart = buf.getShort(ext + 8) & 0xffff;
        int attributeSize = buf.getShort(ext + 10) & 0xffff;
        int attributeCount = buf.getShort(ext + 12) & 0xffff;
        int idIndex = buf.getShort(ext + 14) & 0xffff;
        int classIndex = buf.getShort(ext + 16) & 0xffff;
        int styleIndex = buf.getShort(ext + 18) & 0xffff;
        if (attributeSize < ChunkType.ATTRIBUTE_SIZE) throw new IOException("attribute size " + attributeSize);

        for (int i = 0; i < attributeCount; i++) {
            int at = ext + attributeStart + i * attributeSize;
            String namespace = pool.get(buf.getInt(at));
            int nameIndex = buf.getInt(at + 4);
            String name = pool.get(nameIndex);
            if (name == null) throw new IOException("attribute without name in <" + element.name() + ">");
            String raw = pool.get(buf.getInt(at + 8));
            int dataType = buf.get(at + 15) & 0xff;
            int data = buf.getInt(at + 16);
            String stringData = dataType == TypedValue.TYPE_STRING ? pool.get(data) : null;
            int resourceId = nameIndex >= 0 && nameIndex < resourceMap.length ? resourceMap[nameIndex] : 0;
            element.addParsed(new Attribute(namespace, name, resourceId, raw, dataType, data, stringData));
        }
        element.markSpecial(idIndex, classIndex, styleIndex);
        return element;
    }
}
