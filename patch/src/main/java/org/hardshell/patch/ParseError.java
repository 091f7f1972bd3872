package org.hardshell.patch;

/**
 * The input is not a readable apk or its manifest cannot be decoded.
 */
public class ParseError extends PatchError {

    public ParseError(String message) {
        super(message);
    }

    public ParseError(String message, Throwable cause) {
        super(message, cause);
    }
}
