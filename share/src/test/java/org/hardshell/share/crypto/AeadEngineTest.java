package org.hardshell.share.crypto;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class AeadEngineTest {

    private byte[] key;
    private byte[] nonce;
    private final byte[] aad = "CODE:classes.dex".getBytes(StandardCharsets.UTF_8);
    private final byte[] plaintext = "dex\n035\0 some code".getBytes(StandardCharsets.UTF_8);

    @BeforeEach
    void setUp() {
        var random = new SecureRandom();
        key = new byte[AeadEngine.KEY_LENGTH];
        random.nextBytes(key);
        nonce = new NonceSequence().next();
    }

    @Test
    void sealThenOpenReturnsPlaintext() throws Exception {
        var sealed = AeadEngine.seal(key, nonce, aad, plaintext);

        assertEquals(plaintext.length, sealed.ciphertext.length);
        assertEquals(AeadEngine.TAG_LENGTH, sealed.tag.length);
        assertArrayEquals(plaintext, AeadEngine.open(key, nonce, aad, sealed.ciphertext, sealed.tag));
    }

    @Test
    void everyFlippedCiphertextBitIsRejected() throws Exception {
        var sealed = AeadEngine.seal(key, nonce, aad, plaintext);
        for (int bit = 0; bit < sealed.ciphertext.length * 8; bit++) {
            byte[] tampered = sealed.ciphertext.clone();
            tampered[bit / 8] ^= (byte) (1 << (bit % 8));
            assertThrows(AuthenticationFailureException.class,
                    () -> AeadEngine.open(key, nonce, aad, tampered, sealed.tag));
        }
    }

    @Test
    void everyFlippedTagBitIsRejected() throws Exception {
        var sealed = AeadEngine.seal(key, nonce, aad, plaintext);
        for (int bit = 0; bit < AeadEngine.TAG_LENGTH * 8; bit++) {
            byte[] tampered = sealed.tag.clone();
            tampered[bit / 8] ^= (byte) (1 << (bit % 8));
            assertThrows(AuthenticationFailureException.class,
                    () -> AeadEngine.open(key, nonce, aad, sealed.ciphertext, tampered));
        }
    }

    @Test
    void relabelledAssociatedDataIsRejected() throws Exception {
        var sealed = AeadEngine.seal(key, nonce, aad, plaintext);
        byte[] other = "CODE:classes2.dex".getBytes(StandardCharsets.UTF_8);

        assertThrows(AuthenticationFailureException.class,
                () -> AeadEngine.open(key, nonce, other, sealed.ciphertext, sealed.tag));
    }

    @Test
    void rejectsWrongKeyAndNonceLengths() {
        assertThrows(IllegalArgumentException.class, () -> AeadEngine.seal(new byte[16], nonce, aad, plaintext));
        assertThrows(IllegalArgumentException.class, () -> AeadEngine.seal(key, new byte[8], aad, plaintext));
    }

    @Test
    void emptyPlaintextStillCarriesTag() throws Exception {
        var sealed = AeadEngine.seal(key, nonce, aad, new byte[0]);

        assertEquals(0, sealed.ciphertext.length);
        assertArrayEquals(new byte[0], AeadEngine.open(key, nonce, aad, sealed.ciphertext, sealed.tag));
    }

    @Test
    void nonceSequenceNeverRepeats() {
        var sequence = new NonceSequence();
        byte[] first = sequence.next();
        byte[] second = sequence.next();

        assertEquals(AeadEngine.NONCE_LENGTH, first.length);
        assertFalse(java.util.Arrays.equals(first, second));
    }
}
