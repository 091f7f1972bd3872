package org.hardshell.patch.task;

import org.hardshell.patch.util.JavaLogger;
import org.hardshell.share.crypto.AeadEngine;
import org.hardshell.share.payload.EntryKind;
import org.hardshell.share.payload.PayloadCrypto;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EncryptTaskTest {

    @Test
    void keepsInputOrderAndUsesDistinctNonces() throws Exception {
        byte[] key = new byte[AeadEngine.KEY_LENGTH];
        new Random(7).nextBytes(key);
        List<EncryptTask.Item> items = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            // uneven sizes so workers finish out of order
            byte[] data = new byte[(i % 7) * 4096 + i];
            new Random(i).nextBytes(data);
            items.add(new EncryptTask.Item(EntryKind.CODE, "classes" + (i + 1) + ".dex", "", data));
        }

        var entries = new EncryptTask(8, new JavaLogger()).encrypt(items, key);

        assertEquals(items.size(), entries.size());
        Set<String> nonces = new HashSet<>();
        for (int i = 0; i < items.size(); i++) {
            assertEquals(items.get(i).path, entries.get(i).path());
            assertArrayEquals(items.get(i).plaintext, PayloadCrypto.open(entries.get(i), key));
            assertTrue(nonces.add(new String(entries.get(i).nonce(), StandardCharsets.ISO_8859_1)));
        }
    }

    @Test
    void encryptsNothingWhenThereIsNothingToProtect() throws Exception {
        assertTrue(new EncryptTask(2, new JavaLogger()).encrypt(List.of(), new byte[AeadEngine.KEY_LENGTH]).isEmpty());
    }
}
