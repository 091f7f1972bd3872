package org.hardshell.metaloader;

import org.hardshell.loader.LibraryLookup;

import java.nio.ByteBuffer;

import dalvik.system.BaseDexClassLoader;
import dalvik.system.InMemoryDexClassLoader;

/**
 * In-memory dex loader whose library lookup goes to the decrypted library cache first, then to the stub
 * loader, which knows the apk's own native library directory.
 */
class ShellInMemoryDexClassLoader extends InMemoryDexClassLoader {

    private final LibraryLookup libraries;

    ShellInMemoryDexClassLoader(ByteBuffer[] dexBuffers, ClassLoader parent, LibraryLookup libraries) {
        super(dexBuffers, parent);
        this.libraries = libraries;
    }

    ShellInMemoryDexClassLoader(ByteBuffer dexBuffer, ClassLoader parent, LibraryLookup libraries) {
        super(dexBuffer, parent);
        this.libraries = libraries;
    }

    @Override
    public String findLibrary(String name) {
        String path = libraries.findLibrary(name);
        if (path != null) return path;
        path = super.findLibrary(name);
        if (path != null) return path;
        var parent = getParent();
        return parent instanceof BaseDexClassLoader ? ((BaseDexClassLoader) parent).findLibrary(name) : null;
    }
}
