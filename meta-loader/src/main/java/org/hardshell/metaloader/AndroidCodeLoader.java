package org.hardshell.metaloader;

import android.os.Build;

import org.hardshell.loader.CodeLoader;
import org.hardshell.loader.CodeUnit;
import org.hardshell.loader.LibraryLookup;
import org.hardshell.loader.util.Reflection;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Array;
import java.nio.ByteBuffer;
import java.util.List;

class AndroidCodeLoader implements CodeLoader {

    private final ClassLoader parent;
    private final String nativeLibraryDir;

    AndroidCodeLoader(ClassLoader parent, String nativeLibraryDir) {
        this.parent = parent;
        this.nativeLibraryDir = nativeLibraryDir;
    }

    @Override
    public ClassLoader loadInMemory(List<CodeUnit> units, LibraryLookup libraries) throws IOException {
        if (units.isEmpty()) return parent;
        if (Build.VERSION.SDK_INT >= Build.VERSION_CODES.O_MR1) {
            var buffers = new ByteBuffer[units.size()];
            for (int i = 0; i < buffers.length; i++) {
                buffers[i] = units.get(i).buffer();
            }
            return new ShellInMemoryDexClassLoader(buffers, parent, libraries);
        }
        // 26 takes a single buffer: load the rest separately and append their dex elements in order
        var loader = new ShellInMemoryDexClassLoader(units.get(0).buffer(), parent, libraries);
        for (int i = 1; i < units.size(); i++) {
            var extra = new ShellInMemoryDexClassLoader(units.get(i).buffer(), parent, libraries);
            try {
                appendDexElements(loader, extra);
            } catch (ReflectiveOperationException e) {
                throw new IOException("Failed to register " + units.get(i).name(), e);
            }
        }
        return loader;
    }

    private static void appendDexElements(ClassLoader target, ClassLoader source) throws ReflectiveOperationException {
        Object targetPath = Reflection.getObjectField(target, "pathList");
        Object sourcePath = Reflection.getObjectField(source, "pathList");
        Object head = Reflection.getObjectField(targetPath, "dexElements");
        Object tail = Reflection.getObjectField(sourcePath, "dexElements");
        int headLength = Array.getLength(head);
        int tailLength = Array.getLength(tail);
        Object merged = Array.newInstance(head.getClass().getComponentType(), headLength + tailLength);
        System.arraycopy(head, 0, merged, 0, headLength);
        System.arraycopy(tail, 0, merged, headLength, tailLength);
        Reflection.setObjectField(targetPath, "dexElements", merged);
    }

    @Override
    public ClassLoader loadFromFiles(List<File> files, File optimizedDirectory, LibraryLookup libraries) throws IOException {
        if (files.isEmpty()) return parent;
        var dexPath = new StringBuilder();
        for (File file : files) {
            if (dexPath.length() > 0) dexPath.append(File.pathSeparatorChar);
            dexPath.append(file.getAbsolutePath());
        }
        return new ShellDexClassLoader(dexPath.toString(), optimizedDirectory.getAbsolutePath(), nativeLibraryDir,
                parent, libraries);
    }
}
