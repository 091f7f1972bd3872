package org.hardshell.axml;

/**
 * Chunk type tags of the binary xml format, as laid out in {@code ResourceTypes.h}.
 */
public final class ChunkType {

    public static final int STRING_POOL = 0x0001;
    public static final int XML = 0x0003;

    public static final int START_NAMESPACE = 0x0100;
    public static final int END_NAMESPACE = 0x0101;
    public static final int START_ELEMENT = 0x0102;
    public static final int END_ELEMENT = 0x0103;
    public static final int CDATA = 0x0104;
    public static final int RESOURCE_MAP = 0x0180;

    static final int XML_HEADER_SIZE = 8;
    static final int STRING_POOL_HEADER_SIZE = 28;
    static final int NODE_HEADER_SIZE = 16;
    static final int ATTRIBUTE_SIZE = 20;
    static final int UTF8_FLAG = 0x100;
    static final int NO_INDEX = -1;

    private ChunkType() {
    }
}
