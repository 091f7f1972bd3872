package org.hardshell.share.crypto;

import java.security.GeneralSecurityException;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-GCM with the tag kept apart from the ciphertext.
 * <p>
 * {@link #open} only returns once the tag has verified; JCA buffers GCM plaintext until {@code doFinal},
 * so no unauthenticated bytes ever reach the caller.
 */
public final class AeadEngine {

    public static final int KEY_LENGTH = 32;
    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private AeadEngine() {
    }

    public static final class Sealed {
        public final byte[] ciphertext;
        public final byte[] tag;

        Sealed(byte[] ciphertext, byte[] tag) {
            this.ciphertext = ciphertext;
            this.tag = tag;
        }
    }

    public static Sealed seal(byte[] key, byte[] nonce, byte[] associatedData, byte[] plaintext) throws GeneralSecurityException {
        var cipher = init(Cipher.ENCRYPT_MODE, key, nonce, associatedData);
        byte[] out = cipher.doFinal(plaintext);
        int split = out.length - TAG_LENGTH;
        return new Sealed(Arrays.copyOfRange(out, 0, split), Arrays.copyOfRange(out, split, out.length));
    }

    public static byte[] open(byte[] key, byte[] nonce, byte[] associatedData, byte[] ciphertext, byte[] tag) throws GeneralSecurityException {
        if (tag == null || tag.length != TAG_LENGTH)
            throw new IllegalArgumentException("tag must be " + TAG_LENGTH + " bytes");
        var cipher = init(Cipher.DECRYPT_MODE, key, nonce, associatedData);
        byte[] joined = new byte[ciphertext.length + TAG_LENGTH];
        System.arraycopy(ciphertext, 0, joined, 0, ciphertext.length);
        System.arraycopy(tag, 0, joined, ciphertext.length, TAG_LENGTH);
        try {
            return cipher.doFinal(joined);
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailureException("authentication tag mismatch", e);
        }
    }

    private static Cipher init(int mode, byte[] key, byte[] nonce, byte[] associatedData) throws GeneralSecurityException {
        if (key == null || key.length != KEY_LENGTH)
            throw new IllegalArgumentException("key must be " + KEY_LENGTH + " bytes");
        if (nonce == null || nonce.length != NONCE_LENGTH)
            throw new IllegalArgumentException("nonce must be " + NONCE_LENGTH + " bytes");
        var cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, nonce));
        if (associatedData != null) cipher.updateAAD(associatedData);
        return cipher;
    }
}
