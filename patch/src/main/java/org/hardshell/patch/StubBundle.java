package org.hardshell.patch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.hardshell.patch.util.ApkEntry;
import org.hardshell.share.Constants;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The prebuilt loader injected into every hardened apk: dex files compiled from {@code meta-loader} and a native
 * library per ABI. Laid out as {@code classes*.dex} and {@code so/<abi>/libhardshell.so}.
 */
public final class StubBundle {

    public static final String CLASSPATH_ROOT = "assets/stub/";
    public static final List<String> ABIS = Arrays.asList("armeabi-v7a", "arm64-v8a", "x86", "x86_64");

    private final ImmutableList<byte[]> dexes;
    private final ImmutableSortedMap<String, byte[]> libraries;

    private StubBundle(List<byte[]> dexes, Map<String, byte[]> libraries) {
        this.dexes = ImmutableList.copyOf(dexes);
        this.libraries = ImmutableSortedMap.copyOf(libraries);
    }

    public static StubBundle load(File directory) throws PatchError {
        try {
            return directory == null ? fromClasspath(StubBundle.class.getClassLoader()) : fromDirectory(directory);
        } catch (IOException e) {
            throw new PatchError("Cannot read stub bundle", e);
        }
    }

    static StubBundle fromClasspath(ClassLoader loader) throws IOException, PatchError {
        List<byte[]> dexes = new ArrayList<>();
        for (int i = 1; ; i++) {
            try (InputStream is = loader.getResourceAsStream(CLASSPATH_ROOT + ApkEntry.dexName(i))) {
                if (is == null) break;
                dexes.add(IOUtils.toByteArray(is));
            }
        }
        Map<String, byte[]> libraries = new TreeMap<>();
        for (String abi : ABIS) {
            try (InputStream is = loader.getResourceAsStream(CLASSPATH_ROOT + "so/" + abi + "/" + Constants.STUB_NATIVE_LIBRARY)) {
                if (is != null) libraries.put(abi, IOUtils.toByteArray(is));
            }
        }
        return validated(dexes, libraries, "classpath " + CLASSPATH_ROOT);
    }

    static StubBundle fromDirectory(File directory) throws IOException, PatchError {
        List<byte[]> dexes = new ArrayList<>();
        for (int i = 1; ; i++) {
            var file = new File(directory, ApkEntry.dexName(i));
            if (!file.isFile()) break;
            dexes.add(FileUtils.readFileToByteArray(file));
        }
        Map<String, byte[]> libraries = new TreeMap<>();
        for (String abi : ABIS) {
            var file = new File(directory, "so" + File.separator + abi + File.separator + Constants.STUB_NATIVE_LIBRARY);
            if (file.isFile()) libraries.put(abi, FileUtils.readFileToByteArray(file));
        }
        return validated(dexes, libraries, directory.getPath());
    }

    private static StubBundle validated(List<byte[]> dexes, Map<String, byte[]> libraries, String source) throws PatchError {
        if (dexes.isEmpty()) throw new PatchError("No stub dex found in " + source);
        return new StubBundle(dexes, libraries);
    }

    public List<byte[]> dexes() {
        return dexes;
    }

    /**
     * Stub libraries keyed by ABI, in ABI name order.
     */
    public Map<String, byte[]> libraries() {
        return libraries;
    }
}
