package org.hardshell.loader.delegation;

public class ReferenceSwapException extends Exception {

    public ReferenceSwapException(String message) {
        super(message);
    }

    public ReferenceSwapException(String message, Throwable cause) {
        super(message, cause);
    }
}
