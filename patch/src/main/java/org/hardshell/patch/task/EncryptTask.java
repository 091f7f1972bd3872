package org.hardshell.patch.task;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.hardshell.patch.PatchCancelledException;
import org.hardshell.patch.PatchError;
import org.hardshell.share.Logger;
import org.hardshell.share.crypto.NonceSequence;
import org.hardshell.share.payload.EntryKind;
import org.hardshell.share.payload.PayloadCrypto;
import org.hardshell.share.payload.PayloadEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;

/**
 * Seals every protected entry on a fixed pool. Nonces are handed out in input order before anything is submitted
 * and results are collected in that same order, so the output only depends on the key.
 */
public class EncryptTask {

    public static class Item {
        final EntryKind kind;
        final String path;
        final String abi;
        final byte[] plaintext;

        public Item(EntryKind kind, String path, String abi, byte[] plaintext) {
            this.kind = kind;
            this.path = path;
            this.abi = abi;
            this.plaintext = plaintext;
        }
    }

    private final int threads;
    private final Logger logger;

    public EncryptTask(int threads, Logger logger) {
        this.threads = Math.max(1, threads);
        this.logger = logger;
    }

    public List<PayloadEntry> encrypt(List<Item> items, byte[] key) throws PatchError {
        if (items.isEmpty()) return new ArrayList<>();
        var nonces = new NonceSequence();
        List<byte[]> assigned = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) assigned.add(nonces.next());

        ListeningExecutorService executor = MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("hardshell-encrypt-%d").setDaemon(true).build()));
        try {
            List<ListenableFuture<PayloadEntry>> futures = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                var item = items.get(i);
                var nonce = assigned.get(i);
                futures.add(executor.submit(() -> PayloadCrypto.seal(item.kind, item.path, item.abi, item.plaintext, key, nonce)));
            }
            var entries = Futures.allAsList(futures).get();
            logger.d("Encrypted " + entries.size() + " entries on " + threads + " threads");
            return new ArrayList<>(entries);
        } catch (ExecutionException e) {
            throw new PatchError("Encryption failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PatchCancelledException("encryption");
        } finally {
            executor.shutdownNow();
        }
    }
}
