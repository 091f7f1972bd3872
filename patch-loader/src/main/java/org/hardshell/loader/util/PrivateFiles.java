package org.hardshell.loader.util;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Owner-only directories and files under the app's private storage.
 */
public final class PrivateFiles {

    private PrivateFiles() {
    }

    /**
     * Creates {@code dir} and its missing parents, leaving {@code dir} itself {@code rwx------}.
     */
    public static File ensureDirectory(File dir) throws IOException {
        if (!dir.isDirectory() && !dir.mkdirs() && !dir.isDirectory())
            throw new IOException("Failed to create " + dir);
        ownerOnly(dir, true, true, true);
        return dir;
    }

    /**
     * Writes {@code bytes} to a temp file in {@code dir} and renames it to {@code name}, so readers never see a
     * partially written file.
     */
    public static File writeAtomically(File dir, String name, byte[] bytes, boolean readOnly) throws IOException {
        File target = new File(dir, name);
        File temp = File.createTempFile(name, ".tmp", dir);
        try {
            try (var os = new FileOutputStream(temp)) {
                os.write(bytes);
                os.getFD().sync();
            }
            ownerOnly(temp, true, !readOnly, false);
            if (target.exists() && !target.delete())
                throw new IOException("Failed to replace " + target);
            if (!temp.renameTo(target))
                throw new IOException("Failed to move " + temp + " to " + target);
            return target;
        } finally {
            if (temp.exists() && !temp.delete()) temp.deleteOnExit();
        }
    }

    private static void ownerOnly(File file, boolean read, boolean write, boolean execute) throws IOException {
        boolean ok = file.setReadable(false, false) & file.setWritable(false, false) & file.setExecutable(false, false);
        ok &= !read || file.setReadable(true, true);
        ok &= !write || file.setWritable(true, true);
        ok &= !execute || file.setExecutable(true, true);
        if (!ok) throw new IOException("Failed to restrict permissions of " + file);
    }

    public static byte[] sha256(File file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
        try (var is = new FileInputStream(file)) {
            byte[] buffer = new byte[8192];
            int n;
            while ((n = is.read(buffer)) != -1) {
                digest.update(buffer, 0, n);
            }
        }
        return digest.digest();
    }
}
