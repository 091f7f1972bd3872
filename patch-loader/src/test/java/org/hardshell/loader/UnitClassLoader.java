package org.hardshell.loader;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JVM stand-in for a dex class loader: each code unit holds one class file. The parent is the platform loader,
 * so test classes are only reachable through the units.
 */
final class UnitClassLoader extends ClassLoader {

    private final Map<String, Class<?>> defined = new HashMap<>();
    private final LibraryLookup libraries;

    UnitClassLoader(List<byte[]> units, LibraryLookup libraries) {
        super(ClassLoader.getPlatformClassLoader());
        this.libraries = libraries;
        for (byte[] unit : units) {
            Class<?> clazz = defineClass(null, unit, 0, unit.length);
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
