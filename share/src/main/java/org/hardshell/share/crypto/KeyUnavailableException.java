package org.hardshell.share.crypto;

public class KeyUnavailableException extends Exception {

    public KeyUnavailableException(String message) {
        super(message);
    }

    public KeyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
