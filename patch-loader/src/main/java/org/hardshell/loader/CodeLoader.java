package org.hardshell.loader;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Registers decrypted code with the platform's dynamic loader. Units are always given in their stored order.
 */
public interface CodeLoader {

    ClassLoader loadInMemory(List<CodeUnit> units, LibraryLookup libraries) throws IOException;

    ClassLoader loadFromFiles(List<File> files, File optimizedDirectory, LibraryLookup libraries) throws IOException;
}
