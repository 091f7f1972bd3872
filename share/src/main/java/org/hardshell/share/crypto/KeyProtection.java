package org.hardshell.share.crypto;

import java.util.List;

/**
 * How the protection key travels inside the hardened apk. The packer seals, the loader unseals.
 */
public interface KeyProtection {

    String scheme();

    List<String> seal(byte[] key);

    byte[] unseal(List<String> material) throws KeyUnavailableException;
}
