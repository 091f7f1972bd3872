package org.hardshell.share.crypto;

import java.security.GeneralSecurityException;

/**
 * The tag did not verify: ciphertext, tag, nonce, key or associated data differ from what was sealed.
 */
public class AuthenticationFailureException extends GeneralSecurityException {

    public AuthenticationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
