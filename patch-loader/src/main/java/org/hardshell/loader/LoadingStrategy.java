package org.hardshell.loader;

public enum LoadingStrategy {
    /**
     * Code units are handed to the platform as memory buffers.
     */
    IN_MEMORY,
    /**
     * Code units are written read-only into a private directory and loaded from there.
     */
    FILE_BASED
}
