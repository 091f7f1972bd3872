package org.hardshell.loader;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

final class RecordingCodeLoader implements CodeLoader {

    LoadingStrategy used;
    final List<String> registered = new ArrayList<>();
    final List<File> files = new ArrayList<>();
    int calls;

    @Override
    public ClassLoader loadInMemory(List<CodeUnit> units, LibraryLookup libraries) {
        calls++;
        used = LoadingStrategy.IN_MEMORY;
        List<byte[]> bytes = new ArrayList<>();
        for (CodeUnit unit : units) {
            registered.add(unit.name());
            bytes.add(unit.bytes());
        }
        return new UnitClassLoader(bytes, libraries);
    }

    @Override
    public ClassLoader loadFromFiles(List<File> files, File optimizedDirectory, LibraryLookup libraries) throws IOException {
        calls++;
        used = LoadingStrategy.FILE_BASED;
        List<byte[]> bytes = new ArrayList<>();
        for (File file : files) {
            this.files.add(file);
            registered.add(file.getName());
            bytes.add(Files.readAllBytes(file.toPath()));
        }
        return new UnitClassLoader(bytes, libraries);
    }
}
