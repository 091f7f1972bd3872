package org.hardshell.patch;

/**
 * A problem that did not stop the build but changed what it produced.
 */
public final class PatchWarning {

    public enum Kind {
        /** The manifest declares no application class; the framework default is delegated to. */
        MANIFEST_INCOMPLETE,
        /** The output was left unsigned. */
        SIGNING_UNAVAILABLE,
        /** Native libraries under an ABI directory the loader cannot resolve were left in cleartext. */
        UNKNOWN_ABI
    }

    private final Kind kind;
    private final String message;

    public PatchWarning(Kind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public Kind kind() {
        return kind;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
