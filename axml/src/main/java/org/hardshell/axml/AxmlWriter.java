package org.hardshell.axml;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes a document with a freshly built string pool. Attribute names that carry a resource id occupy the
 * head of the pool, in ascending id order, so the resource map lines up with them index for index.
 */
final class AxmlWriter {

    private final List<String> strings = new ArrayList<>();
    private final Map<String, Integer> plain = new HashMap<>();
    private final Map<Integer, Integer> mapped = new HashMap<>();
    private final List<Integer> resourceIds = new ArrayList<>();

    static byte[] write(AxmlDocument document) {
        return new AxmlWriter().serialize(document);
    }

    private byte[] serialize(AxmlDocument document) {
        var ids = new TreeMap<Integer, String>((a, b) -> Integer.compareUnsigned(a, b));
        for (Node node : document.nodes()) {
            if (node instanceof StartElement) {
                for (Attribute attribute : ((StartElement) node).attributes()) {
                    if (attribute.resourceId() != 0) ids.putIfAbsent(attribute.resourceId(), attribute.name());
                }
            }
        }
        for (var e : ids.entrySet()) {
            mapped.put(e.getKey(), strings.size());
            strings.add(e.getValue());
            resourceIds.add(e.getKey());
        }

        var body = new ByteArrayOutputStream();
        for (Node node : document.nodes()) {
            byte[] chunk = chunk(node);
            body.write(chunk, 0, chunk.length);
        }

        byte[] pool = new StringPool(strings, document.isUtf8()).toChunk();
        int mapSize = resourceIds.isEmpty() ? 0 : 8 + 4 * resourceIds.size();
        int size = ChunkType.XML_HEADER_SIZE + pool.length + mapSize + body.size();

        var out = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort((short) ChunkType.XML);
        out.putShort((short) ChunkType.XML_HEADER_SIZE);
        out.putInt(size);
        out.put(pool);
        if (mapSize != 0) {
            out.putShort((short) ChunkType.RESOURCE_MAP);
            out.putShort((short) 8);
            out.putInt(mapSize);
            for (int id : resourceIds) out.putInt(id);
        }
        out.put(body.toByteArray());
        return out.array();
    }

    private int intern(String s) {
        if (s == null) return ChunkType.NO_INDEX;
        Integer index = plain.get(s);
        if (index == null) {
            index = strings.size();
            strings.add(s);
            plain.put(s, index);
        }
        return index;
    }

    private int nameIndex(Attribute attribute) {
        if (attribute.resourceId() != 0) return mapped.get(attribute.resourceId());
        return intern(attribute.name());
    }

    private ByteBuffer header(Node node, int size) {
        var buf = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        buf.putShort((short) node.chunkType());
        buf.putShort((short) ChunkType.NODE_HEADER_SIZE);
        buf.putInt(size);
        buf.putInt(node.lineNumber());
        buf.putInt(intern(node.comment()));
        return buf;
    }

    private byte[] chunk(Node node) {
        if (node instanceof StartNamespace) {
            var ns = (StartNamespace) node;
            return header(node, 24).putInt(intern(ns.prefix())).putInt(intern(ns.uri())).array();
        }
        if (node instanceof EndNamespace) {
            var ns = (EndNamespace) node;
            return header(node, 24).putInt(intern(ns.prefix())).putInt(intern(ns.uri())).array();
        }
        if (node instanceof EndElement) {
            var end = (EndElement) node;
            return header(node, 24).putInt(intern(end.namespace())).putInt(intern(end.name())).array();
        }
        if (node instanceof CData) {
            var cdata = (CData) node;
            int text = intern(cdata.text());
            int data = cdata.type() == TypedValue.TYPE_STRING ? text : cdata.data();
            return header(node, 28).putInt(text)
                    .putShort((short) 8).put((byte) 0).put((byte) cdata.type()).putInt(data)
                    .array();
        }
        var element = (StartElement) node;
        var attributes = element.attributes();
        var buf = header(node, 36 + ChunkType.ATTRIBUTE_SIZE * attributes.size());
        buf.putInt(intern(element.namespace()));
        buf.putInt(intern(element.name()));
        buf.putShort((short) 0x14);
        buf.putShort((short) ChunkType.ATTRIBUTE_SIZE);
        buf.putShort((short) attributes.size());
        buf.putShort((short) element.idIndex());
        buf.putShort((short) element.classIndex());
        buf.putShort((short) element.styleIndex());
        for (Attribute attribute : attributes) {
            buf.putInt(intern(attribute.namespace()));
            buf.putInt(nameIndex(attribute));
            buf.putInt(intern(attribute.rawValue()));
            buf.putShort((short) 8);
            buf.put((byte) 0);
            buf.put((byte) attribute.type());
            buf.putInt(attribute.type() == TypedValue.TYPE_STRING ? intern(attribute.stringValue()) : attribute.data());
        }
        return buf.array();
    }
}
