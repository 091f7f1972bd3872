package org.hardshell.share.payload;

import java.io.IOException;

public class PayloadCorruptException extends IOException {

    public PayloadCorruptException(String message) {
        super(message);
    }

    public PayloadCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
