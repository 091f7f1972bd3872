package org.hardshell.loader;

/**
 * Hook for {@code ClassLoader#findLibrary}: absolute path of a library, or {@code null} to let the platform
 * search its own paths.
 */
public interface LibraryLookup {

    String findLibrary(String name);
}
