package org.hardshell.patch;

public class PatchError extends Exception {

    public PatchError(String message) {
        super(message);
    }

    public PatchError(String message, Throwable cause) {
        super(message, cause);
    }
}
