package org.hardshell.share.crypto;

public final class KeyProtections {

    private KeyProtections() {
    }

    public static KeyProtection forScheme(String scheme) throws KeyUnavailableException {
        if (XorShareKeyProtection.SCHEME.equals(scheme)) return new XorShareKeyProtection();
        throw new KeyUnavailableException("unknown key scheme " + scheme);
    }
}
