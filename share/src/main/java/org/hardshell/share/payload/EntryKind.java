package org.hardshell.share.payload;

public enum EntryKind {
    CODE(1),
    NATIVE_LIB(2),
    ASSET(3);

    final int id;

    EntryKind(int id) {
        this.id = id;
    }

    static EntryKind fromId(int id) throws PayloadCorruptException {
        for (EntryKind kind : values()) {
            if (kind.id == id) return kind;
        }
        throw new PayloadCorruptException("unknown entry kind " + id);
    }
}
