package org.hardshell.share;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Stream and file helpers that also run on the device, where {@code java.nio.file} is missing before API 26.
 */
public class FileUtils {

    public static byte[] readAllBytes(InputStream is) throws IOException {
        try (var os = new ByteArrayOutputStream()) {
            byte[] buffer = new byte[8192];
            int n;
            while (-1 != (n = is.read(buffer))) {
                os.write(buffer, 0, n);
            }
            return os.toByteArray();
        }
    }

    public static void deleteFolderIfExists(File target) throws IOException {
        if (!target.exists()) return;
        var children = target.listFiles();
        if (children != null) {
            for (File child : children) {
                deleteFolderIfExists(child);
            }
        }
        if (!target.delete() && target.exists()) {
            throw new IOException("Failed to delete " + target);
        }
    }
}
