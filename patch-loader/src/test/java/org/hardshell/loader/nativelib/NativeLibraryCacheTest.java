package org.hardshell.loader.nativelib;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.hardshell.loader.LoaderFailure;
import org.hardshell.loader.PayloadFixture;
import org.hardshell.loader.TestLogger;
import org.hardshell.share.payload.PayloadContainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

final class NativeLibraryCacheTest {

    private static final byte[] ELF = "\u007fELF arm64 payload".getBytes(StandardCharsets.UTF_8);

    @TempDir
    File root;

    private PayloadFixture fixture;
    private PayloadContainer container;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new PayloadFixture()
                .library("arm64-v8a", "libexample.so", ELF)
                .library("x86_64", "libother.so", ELF);
        container = PayloadContainer.read(fixture.payload());
    }

    private NativeLibraryCache cache(String abi) {
        return new NativeLibraryCache(container, fixture.key, abi, root, new TestLogger());
    }

    @Test
    void concurrentFirstUseDecryptsOnce() throws Exception {
        var cache = cache("arm64-v8a");
        int threads = 16;
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String name = i % 2 == 0 ? "example" : "libexample.so";
                results.add(pool.submit(() -> {
                    start.await();
                    return cache.findLibrary(name);
                }));
            }
            start.countDown();
            var paths = new HashSet<String>();
            for (Future<String> result : results) paths.add(result.get());

            assertEquals(1, paths.size());
            assertEquals(1, cache.decryptionCount());
            assertArrayEquals(ELF, Files.readAllBytes(new File(paths.iterator().next()).toPath()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void cacheLayoutIsPrivateAndStable() throws Exception {
        String path = cache("arm64-v8a").findLibrary("example");

        var expected = new File(new File(root, "arm64-v8a"), "libexample.so");
        assertEquals(expected.getAbsolutePath(), path);
        assertEquals("rwx------", PosixFilePermissions.toString(Files.getPosixFilePermissions(expected.getParentFile().toPath())));
        assertEquals("r--------", PosixFilePermissions.toString(Files.getPosixFilePermissions(expected.toPath())));
    }

    @Test
    void validFileFromEarlierProcessIsReused() {
        cache("arm64-v8a").findLibrary("example");

        var restarted = cache("arm64-v8a");
        restarted.findLibrary("example");

        assertEquals(0, restarted.decryptionCount());
    }

    @Test
    void damagedFileIsDecryptedAgain() throws Exception {
        var path = new File(cache("arm64-v8a").findLibrary("example"));
        assertTrue(path.delete());
        Files.write(path.toPath(), "tampered".getBytes(StandardCharsets.UTF_8));

        var restarted = cache("arm64-v8a");
        restarted.findLibrary("example");

        assertEquals(1, restarted.decryptionCount());
        assertArrayEquals(ELF, Files.readAllBytes(path.toPath()));
    }

    @Test
    void libraryProtectedOnlyForOtherAbis() {
        var failure = assertThrows(LoaderFailure.class, () -> cache("x86_64").findLibrary("example"));

        assertEquals(LoaderFailure.Reason.NATIVE_LIBRARY_MISSING_FOR_ABI, failure.getReason());
    }

    @Test
    void unprotectedLibraryFallsBackToPlatform() {
        assertNull(cache("arm64-v8a").findLibrary("c++_shared"));
    }

    @Test
    void mapsLoadLibraryNames() {
        assertEquals("libexample.so", NativeLibraryCache.fileName("example"));
        assertEquals("libexample.so", NativeLibraryCache.fileName("libexample"));
        assertEquals("libexample.so", NativeLibraryCache.fileName("libexample.so"));
        assertEquals("example.so", NativeLibraryCache.fileName("example.so"));
    }
}
