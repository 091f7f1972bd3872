package org.hardshell.patch;

import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;
import org.hardshell.axml.AndroidAttrs;
import org.hardshell.axml.AxmlDocument;
import org.hardshell.loader.CodeLoader;
import org.hardshell.loader.CodeUnit;
import org.hardshell.loader.LibraryLookup;
import org.hardshell.loader.Platform;
import org.hardshell.loader.debug.DebuggerProbe;
import org.hardshell.loader.delegation.ApplicationContract;
import org.hardshell.loader.delegation.DeferredInitializer;
import org.hardshell.loader.delegation.DelegationStrategies;
import org.hardshell.loader.delegation.FieldSlot;
import org.hardshell.loader.delegation.ReferenceSwap;
import org.hardshell.loader.delegation.ReflectiveApplicationContract;
import org.hardshell.patch.util.JavaLogger;
import org.hardshell.share.Logger;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the loader against a hardened apk on the JVM: class files stand in for dex files and a plain field stands
 * in for the platform's reference to the running application.
 */
final class JvmPlatform implements Platform {

    /** Where the "platform" keeps the current application. */
    static final class ProcessRecord {
        Object application;
    }

    final ProcessRecord record = new ProcessRecord();
    final File dataDir;
    final int sdkInt;
    final String abi;
    private final Map<String, byte[]> apk = new HashMap<>();
    private final Map<String, String> metaData = new HashMap<>();
    private final Logger logger = new JavaLogger();

    JvmPlatform(File hardenedApk, File dataDir, int sdkInt, String abi) throws IOException {
        this.dataDir = dataDir;
        this.sdkInt = sdkInt;
        this.abi = abi;
        try (var zip = new ZipFile(hardenedApk)) {
            for (var e = zip.getEntries(); e.hasMoreElements(); ) {
                var entry = e.nextElement();
                try (InputStream is = zip.getInputStream(entry)) {
                    apk.put(entry.getName(), IOUtils.toByteArray(is));
                }
            }
        }
        var manifest = AxmlDocument.parse(apk.get(TargetBundle.ANDROID_MANIFEST_XML));
        for (var meta : manifest.children(manifest.firstElement("application"), "meta-data")) {
            metaData.put(meta.attribute(AndroidAttrs.NAME).stringValue(), meta.attribute(AndroidAttrs.VALUE).stringValue());
        }
    }

    @Override
    public int sdkInt() {
        return sdkInt;
    }

    @Override
    public String abi() {
        return abi;
    }

    @Override
    public File privateDir() {
        return dataDir;
    }

    @Override
    public InputStream openStubAsset(String path) {
        byte[] bytes = apk.get(path);
        return bytes == null ? null : new ByteArrayInputStream(bytes);
    }

    @Override
    public String metaData(String key) {
        return metaData.get(key);
    }

    @Override
    public CodeLoader codeLoader() {
        return new CodeLoader() {
            @Override
            public ClassLoader loadInMemory(List<CodeUnit> units, LibraryLookup libraries) {
                List<byte[]> classes = new ArrayList<>();
                for (CodeUnit unit : units) classes.add(unit.bytes());
                return new ClassFileLoader(classes, libraries);
            }

            @Override
            public ClassLoader loadFromFiles(List<File> files, File optimizedDirectory, LibraryLookup libraries) throws IOException {
                List<byte[]> classes = new ArrayList<>();
                for (File file : files) classes.add(Files.readAllBytes(file.toPath()));
                return new ClassFileLoader(classes, libraries);
            }
        };
    }

    @Override
    public DelegationStrategies delegationStrategies() {
        return new DelegationStrategies().register(24, 35,
                (stub, original) -> new ReferenceSwap().replace(FieldSlot.of(record, "application"), stub, original));
    }

    @Override
    public ApplicationContract applicationContract() {
        return new ReflectiveApplicationContract("attach", "onCreate");
    }

    @Override
    public List<DeferredInitializer> deferredInitializers() {
        return Collections.emptyList();
    }

    @Override
    public DebuggerProbe debuggerProbe() {
        return () -> false;
    }

    @Override
    public Logger logger() {
        return logger;
    }

    /**
     * Defines one class per code unit. Its parent is the platform loader, so the fixture classes on the test
     * classpath are invisible to it.
     */
    static final class ClassFileLoader extends ClassLoader {

        private final Map<String, Class<?>> defined = new HashMap<>();
        private final LibraryLookup libraries;

        ClassFileLoader(List<byte[]> classes, LibraryLookup libraries) {
            super(ClassLoader.getPlatformClassLoader());
            this.libraries = libraries;
            for (byte[] bytes : classes) {
                Class<?> clazz = defineClass(null, bytes, 0, bytes.length);
                defined.put(clazz.getName(), clazz);
            }
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            Class<?> clazz = defined.get(name);
            if (clazz == null) throw new ClassNotFoundException(name);
            return clazz;
        }

        @Override
        protected String findLibrary(String libname) {
            return libraries.findLibrary(libname);
        }
    }
}
