package org.hardshell.share.payload;

final class PayloadFormat {

    static final int MAGIC = 0x4b505348; // "HSPK" little-endian
    static final int VERSION = 1;
    static final int HEADER_SIZE = 12;
    static final int TRAILER_SIZE = 4;

    private PayloadFormat() {
    }
}
