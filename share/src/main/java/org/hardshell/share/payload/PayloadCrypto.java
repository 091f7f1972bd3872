package org.hardshell.share.payload;

import org.hardshell.share.crypto.AeadEngine;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class PayloadCrypto {

    private PayloadCrypto() {
    }

    public static PayloadEntry seal(EntryKind kind, String path, String abi, byte[] plaintext, byte[] key, byte[] nonce) throws GeneralSecurityException {
        var sealed = AeadEngine.seal(key, nonce, PayloadEntry.associatedData(kind, path, abi), plaintext);
        return new PayloadEntry(kind, path, abi, nonce, sealed.tag, sha256(plaintext), ByteBuffer.wrap(sealed.ciphertext));
    }

    /**
     * Decrypts and verifies one entry. A tag mismatch surfaces as
     * {@link org.hardshell.share.crypto.AuthenticationFailureException}; a verified plaintext whose digest
     * disagrees with the metadata as {@link PayloadCorruptException}.
     */
    public static byte[] open(PayloadEntry entry, byte[] key) throws GeneralSecurityException, PayloadCorruptException {
        byte[] plaintext = AeadEngine.open(key, entry.nonce(), entry.associatedData(), entry.ciphertextBytes(), entry.tag());
        if (!MessageDigest.isEqual(sha256(plaintext), entry.digest()))
            throw new PayloadCorruptException("digest mismatch for " + entry);
        return plaintext;
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
