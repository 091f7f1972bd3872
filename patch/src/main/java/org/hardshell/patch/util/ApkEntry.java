package org.hardshell.patch.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One zip entry held in memory, with the compression it should be written with.
 */
public final class ApkEntry {

    private static final Pattern DEX = Pattern.compile("classes(\\d*)\\.dex");
    private static final Pattern NATIVE_LIB = Pattern.compile("lib/([^/]+)/([^/]+\\.so)");

    private final String name;
    private final byte[] data;
    private final boolean compressed;

    public ApkEntry(String name, byte[] data, boolean compressed) {
        this.name = name;
        this.data = data;
        this.compressed = compressed;
    }

    public String name() {
        return name;
    }

    public byte[] data() {
        return data;
    }

    public boolean compressed() {
        return compressed;
    }

    public ApkEntry renamed(String newName) {
        return new ApkEntry(newName, data, compressed);
    }

    /**
     * @return the 1-based index of a top-level dex file ({@code classes.dex} is 1), or 0 for anything else
     */
    public static int dexIndex(String name) {
        Matcher m = DEX.matcher(name);
        if (!m.matches()) return 0;
        return m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
    }

    public static String dexName(int index) {
        return index == 1 ? "classes.dex" : "classes" + index + ".dex";
    }

    /**
     * @return the ABI directory of a native library entry, or {@code null}
     */
    public static String libraryAbi(String name) {
        Matcher m = NATIVE_LIB.matcher(name);
        return m.matches() ? m.group(1) : null;
    }

    public static String libraryFileName(String name) {
        return name.substring(name.lastIndexOf('/') + 1);
    }

    @Override
    public String toString() {
        return name + " (" + data.length + " bytes" + (compressed ? "" : ", stored") + ")";
    }
}
