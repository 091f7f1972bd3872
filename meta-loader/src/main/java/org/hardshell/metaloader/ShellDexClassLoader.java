package org.hardshell.metaloader;

import org.hardshell.loader.LibraryLookup;

import dalvik.system.DexClassLoader;

class ShellDexClassLoader extends DexClassLoader {

    private final LibraryLookup libraries;

    ShellDexClassLoader(String dexPath, String optimizedDirectory, String librarySearchPath, ClassLoader parent,
                        LibraryLookup libraries) {
        super(dexPath, optimizedDirectory, librarySearchPath, parent);
        this.libraries = libraries;
    }

    @Override
    public String findLibrary(String name) {
        String path = libraries.findLibrary(name);
        return path != null ? path : super.findLibrary(name);
    }
}
