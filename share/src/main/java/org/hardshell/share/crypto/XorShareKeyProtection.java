package org.hardshell.share.crypto;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the key into {@code n} shares that XOR back to the key. No single share reveals anything about it.
 */
public final class XorShareKeyProtection implements KeyProtection {

    public static final String SCHEME = "xor-shares";
    public static final int DEFAULT_SHARES = 3;

    private final int shareCount;
    private final SecureRandom random;

    public XorShareKeyProtection() {
        this(DEFAULT_SHARES, new SecureRandom());
    }

    public XorShareKeyProtection(int shareCount, SecureRandom random) {
        if (shareCount < 2) throw new IllegalArgumentException("need at least two shares");
        this.shareCount = shareCount;
        this.random = random;
    }

    @Override
    public String scheme() {
        return SCHEME;
    }

    @Override
    public List<String> seal(byte[] key) {
        byte[] last = key.clone();
        List<String> shares = new ArrayList<>(shareCount);
        for (int i = 0; i < shareCount - 1; i++) {
            byte[] share = new byte[key.length];
            random.nextBytes(share);
            xorInto(last, share);
            shares.add(toHex(share));
        }
        shares.add(toHex(last));
        return shares;
    }

    @Override
    public byte[] unseal(List<String> material) throws KeyUnavailableException {
        if (material == null || material.size() < 2)
            throw new KeyUnavailableException("key shares missing");
        byte[] key = null;
        for (String encoded : material) {
            byte[] share;
            try {
                share = fromHex(encoded);
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new KeyUnavailableException("malformed key share", e);
            }
            if (key == null) {
                key = share;
            } else if (share.length != key.length) {
                throw new KeyUnavailableException("key shares differ in length");
            } else {
                xorInto(key, share);
            }
        }
        if (key.length != AeadEngine.KEY_LENGTH)
            throw new KeyUnavailableException("unexpected key length " + key.length);
        return key;
    }

    // java.util.Base64 is missing below API 26
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[2 * i] = HEX[(bytes[i] >> 4) & 0xf];
            out[2 * i + 1] = HEX[bytes[i] & 0xf];
        }
        return new String(out);
    }

    static byte[] fromHex(String s) {
        if (s.length() % 2 != 0) throw new IllegalArgumentException("odd hex length");
        byte[] out = new byte[s.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(s.charAt(2 * i), 16);
            int lo = Character.digit(s.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) throw new IllegalArgumentException("not hex: " + s);
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    private static void xorInto(byte[] target, byte[] share) {
        for (int i = 0; i < target.length; i++) {
            target[i] ^= share[i];
        }
    }
}
