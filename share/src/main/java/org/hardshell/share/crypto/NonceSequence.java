package org.hardshell.share.crypto;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Per-build monotonic nonce counter. One sequence is used with exactly one key, so every nonce it hands out
 * is unique under that key.
 */
public final class NonceSequence {

    private long counter;

    public synchronized byte[] next() {
        if (counter == Long.MAX_VALUE) throw new IllegalStateException("nonce space exhausted");
        counter++;
        return ByteBuffer.allocate(AeadEngine.NONCE_LENGTH)
                .order(ByteOrder.BIG_ENDIAN)
                .putInt(0)
                .putLong(counter)
                .array();
    }
}
