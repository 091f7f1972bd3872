package org.hardshell.share.payload;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.List;
import java.util.zip.CRC32;

import org.hardshell.share.crypto.AeadEngine;
import org.hardshell.share.crypto.AuthenticationFailureException;
import org.hardshell.share.crypto.NonceSequence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PayloadContainerTest {

    private byte[] key;
    private NonceSequence nonces;

    @BeforeEach
    void setUp() {
        key = new byte[AeadEngine.KEY_LENGTH];
        new SecureRandom().nextBytes(key);
        nonces = new NonceSequence();
    }

    private PayloadEntry seal(EntryKind kind, String path, String abi, String content) throws Exception {
        return PayloadCrypto.seal(kind, path, abi, content.getBytes(StandardCharsets.UTF_8), key, nonces.next());
    }

    private byte[] sample() throws Exception {
        return new PayloadWriter()
                .add(seal(EntryKind.CODE, "classes.dex", "", "first dex"))
                .add(seal(EntryKind.CODE, "classes2.dex", "", "second dex"))
                .add(seal(EntryKind.NATIVE_LIB, "libexample.so", "arm64-v8a", "arm64 elf"))
                .add(seal(EntryKind.NATIVE_LIB, "libexample.so", "x86_64", "x86_64 elf"))
                .add(seal(EntryKind.ASSET, "assets/secret.json", "", "{}"))
                .toByteArray();
    }

    @Test
    void keepsEntryOrderAndContent() throws Exception {
        var container = PayloadContainer.read(sample());

        List<PayloadEntry> code = container.entries(EntryKind.CODE);
        assertEquals(2, code.size());
        assertEquals("classes.dex", code.get(0).path());
        assertEquals("classes2.dex", code.get(1).path());
        assertEquals("second dex", new String(PayloadCrypto.open(code.get(1), key), StandardCharsets.UTF_8));
        assertEquals(5, container.entries().size());
    }

    @Test
    void findsOneLibraryPerAbi() throws Exception {
        var container = PayloadContainer.read(sample());

        var x86 = container.find(EntryKind.NATIVE_LIB, "libexample.so", "x86_64");
        assertNotNull(x86);
        assertEquals("x86_64 elf", new String(PayloadCrypto.open(x86, key), StandardCharsets.UTF_8));
        assertNull(container.find(EntryKind.NATIVE_LIB, "libexample.so", "armeabi-v7a"));
        assertNull(container.find(EntryKind.CODE, "libexample.so", ""));
    }

    @Test
    void emptyContainerRoundTrips() throws Exception {
        var container = PayloadContainer.read(new PayloadWriter().toByteArray());

        assertTrue(container.isEmpty());
    }

    @Test
    void checksumMismatchIsCorrupt() throws Exception {
        byte[] bytes = sample();
        bytes[bytes.length / 2] ^= 0x01;

        var e = assertThrows(PayloadCorruptException.class, () -> PayloadContainer.read(bytes));
        assertTrue(e.getMessage().contains("checksum"));
    }

    @Test
    void truncatedPayloadIsCorrupt() throws Exception {
        byte[] bytes = sample();
        byte[] truncated = java.util.Arrays.copyOf(bytes, 10);

        assertThrows(PayloadCorruptException.class, () -> PayloadContainer.read(truncated));
        assertThrows(PayloadCorruptException.class, () -> PayloadContainer.read(new byte[0]));
    }

    @Test
    void tamperedCiphertextFailsOnlyThatEntry() throws Exception {
        var container = PayloadContainer.read(sample());
        var victim = container.find(EntryKind.CODE, "classes2.dex", "");
        byte[] ciphertext = victim.ciphertextBytes();
        ciphertext[0] ^= 0x40;
        var tampered = new PayloadEntry(victim.kind(), victim.path(), victim.abi(), victim.nonce(), victim.tag(),
                victim.digest(), java.nio.ByteBuffer.wrap(ciphertext));

        assertThrows(AuthenticationFailureException.class, () -> PayloadCrypto.open(tampered, key));
        assertNotNull(PayloadCrypto.open(container.find(EntryKind.CODE, "classes.dex", ""), key));
    }

    @Test
    void relabelledEntryFailsAuthentication() throws Exception {
        var container = PayloadContainer.read(sample());
        var original = container.find(EntryKind.NATIVE_LIB, "libexample.so", "arm64-v8a");
        var relabelled = new PayloadEntry(original.kind(), original.path(), "x86_64", original.nonce(),
                original.tag(), original.digest(), original.ciphertext());

        assertThrows(AuthenticationFailureException.class, () -> PayloadCrypto.open(relabelled, key));
    }

    @Test
    void duplicateIdentityIsCorrupt() throws Exception {
        byte[] bytes = new PayloadWriter()
                .add(seal(EntryKind.CODE, "classes.dex", "", "first dex"))
                .add(seal(EntryKind.CODE, "classes.dey", "", "shadowing dex"))
                .toByteArray();
        // rename the second entry onto the first, then fix up the trailer
        byte[] alias = "classes.dey".getBytes(StandardCharsets.UTF_8);
        int at = indexOf(bytes, alias);
        assertTrue(at > 0);
        bytes[at + alias.length - 1] = 'x';
        int body = bytes.length - PayloadFormat.TRAILER_SIZE;
        var crc = new CRC32();
        crc.update(bytes, 0, body);
        ByteBuffer.wrap(bytes, body, 4).order(ByteOrder.LITTLE_ENDIAN).putInt((int) crc.getValue());

        var e = assertThrows(PayloadCorruptException.class, () -> PayloadContainer.read(bytes));
        assertTrue(e.getMessage().contains("duplicate"));
    }

    private static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i + needle.length <= haystack.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) continue outer;
            }
            return i;
        }
        return -1;
    }

    @Test
    void writerRejectsDuplicateIdentityAndReusedNonce() throws Exception {
        var writer = new PayloadWriter().add(seal(EntryKind.CODE, "classes.dex", "", "a"));

        assertThrows(IllegalArgumentException.class, () -> writer.add(seal(EntryKind.CODE, "classes.dex", "", "b")));

        byte[] nonce = nonces.next();
        var first = PayloadCrypto.seal(EntryKind.ASSET, "assets/a", "", new byte[1], key, nonce);
        var second = PayloadCrypto.seal(EntryKind.ASSET, "assets/b", "", new byte[1], key, nonce);
        writer.add(first);
        assertThrows(IllegalArgumentException.class, () -> writer.add(second));
    }

    @Test
    void entryRejectsAbiMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> seal(EntryKind.NATIVE_LIB, "libexample.so", "", "x"));
        assertThrows(IllegalArgumentException.class,
                () -> seal(EntryKind.CODE, "classes.dex", "arm64-v8a", "x"));
    }
}
