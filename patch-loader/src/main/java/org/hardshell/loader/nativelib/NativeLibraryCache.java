package org.hardshell.loader.nativelib;

import org.hardshell.loader.LibraryLookup;
import org.hardshell.loader.LoaderFailure;
import org.hardshell.loader.util.PrivateFiles;
import org.hardshell.share.Logger;
import org.hardshell.share.crypto.AuthenticationFailureException;
import org.hardshell.share.payload.EntryKind;
import org.hardshell.share.payload.PayloadContainer;
import org.hardshell.share.payload.PayloadCorruptException;
import org.hardshell.share.payload.PayloadCrypto;
import org.hardshell.share.payload.PayloadEntry;

import java.io.File;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decrypts protected native libraries on first use into {@code <root>/<abi>/<file>}.
 * <p>
 * Each library name has its own lock: concurrent first callers block until one of them has produced the file,
 * then all share that path for the rest of the process. A file left by an earlier process is reused only when
 * its SHA-256 still matches the payload entry.
 */
public final class NativeLibraryCache implements LibraryLookup {

    private final PayloadContainer container;
    private final byte[] key;
    private final String abi;
    private final File root;
    private final Logger logger;

    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final Map<String, String> resolved = new ConcurrentHashMap<>();
    private final AtomicInteger decryptions = new AtomicInteger();

    public NativeLibraryCache(PayloadContainer container, byte[] key, String abi, File root, Logger logger) {
        this.container = container;
        this.key = key.clone();
        this.abi = abi;
        this.root = root;
        this.logger = logger;
    }

    /**
     * Maps {@code System.loadLibrary} style names to file names: {@code example} and {@code libexample.so} both
     * become {@code libexample.so}.
     */
    public static String fileName(String name) {
        if (name.endsWith(".so")) return name;
        return name.startsWith("lib") ? name + ".so" : "lib" + name + ".so";
    }

    @Override
    public String findLibrary(String name) {
        String file = fileName(name);
        String path = resolved.get(file);
        if (path != null) return path;

        PayloadEntry entry = container.find(EntryKind.NATIVE_LIB, file, abi);
        if (entry == null) {
            if (isProtectedElsewhere(file)) {
                throw new LoaderFailure(LoaderFailure.Reason.NATIVE_LIBRARY_MISSING_FOR_ABI,
                        file + " is protected but not for " + abi);
            }
            return null;
        }

        Object lock = locks.computeIfAbsent(file, k -> new Object());
        synchronized (lock) {
            path = resolved.get(file);
            if (path != null) return path;
            try {
                path = materialize(entry).getAbsolutePath();
            } catch (IOException e) {
                throw new LoaderFailure(LoaderFailure.Reason.NATIVE_LIBRARY_MISSING_FOR_ABI,
                        "cannot cache " + entry + " under " + root, e);
            }
            resolved.put(file, path);
            return path;
        }
    }

    private boolean isProtectedElsewhere(String file) {
        for (PayloadEntry entry : container.entries(EntryKind.NATIVE_LIB)) {
            if (entry.path().equals(file)) return true;
        }
        return false;
    }

    private File materialize(PayloadEntry entry) throws IOException {
        File dir = PrivateFiles.ensureDirectory(new File(PrivateFiles.ensureDirectory(root), abi));
        File cached = new File(dir, entry.path());
        if (cached.isFile() && MessageDigest.isEqual(PrivateFiles.sha256(cached), entry.digest())) {
            logger.d("Reusing cached " + entry);
            return cached;
        }
        if (cached.exists()) logger.w("Cached " + entry + " failed validation, decrypting again");

        byte[] plaintext;
        try {
            decryptions.incrementAndGet();
            plaintext = PayloadCrypto.open(entry, key);
        } catch (AuthenticationFailureException e) {
            throw new LoaderFailure(LoaderFailure.Reason.AUTHENTICATION_FAILURE, entry.toString(), e);
        } catch (PayloadCorruptException e) {
            throw new LoaderFailure(LoaderFailure.Reason.PAYLOAD_CORRUPT, entry.toString(), e);
        } catch (GeneralSecurityException e) {
            throw new LoaderFailure(LoaderFailure.Reason.AUTHENTICATION_FAILURE, "cannot decrypt " + entry, e);
        }
        logger.d("Decrypted " + entry);
        return PrivateFiles.writeAtomically(dir, entry.path(), plaintext, true);
    }

    public int decryptionCount() {
        return decryptions.get();
    }

    public File root() {
        return root;
    }
}
