package org.hardshell.patch.util;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.hardshell.share.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Finds or creates the Android debug keystore, the same one the SDK build tools use.
 */
public class DebugKeystoreProvider {

    public static final String STORE_PASSWORD = "android";
    public static final String KEY_ALIAS = "androiddebugkey";
    public static final String KEY_PASSWORD = "android";

    private final Logger logger;

    public DebugKeystoreProvider(Logger logger) {
        this.logger = logger;
    }

    /**
     * @param preferred where to look first, or {@code null} for {@code ~/.android/debug.keystore}
     */
    public File provide(File preferred) throws IOException {
        var primary = preferred != null ? preferred
                : new File(FileUtils.getUserDirectory(), ".android" + File.separator + "debug.keystore");
        if (primary.isFile()) return primary;
        try {
            FileUtils.forceMkdirParent(primary);
            generate(primary);
            return primary;
        } catch (IOException e) {
            logger.d("Cannot create " + primary + ": " + e.getMessage());
        }
        var fallback = new File(FileUtils.getTempDirectory(), "hardshell-debug.keystore");
        if (!fallback.isFile()) generate(fallback);
        return fallback;
    }

    private void generate(File keystore) throws IOException {
        logger.i("Creating debug keystore " + keystore);
        var keytool = new File(System.getProperty("java.home"), "bin" + File.separator + "keytool");
        List<String> command = Arrays.asList(
                keytool.isFile() ? keytool.getPath() : "keytool",
                "-genkeypair", "-noprompt",
                "-keystore", keystore.getPath(),
                "-storepass", STORE_PASSWORD,
                "-alias", KEY_ALIAS,
                "-keypass", KEY_PASSWORD,
                "-keyalg", "RSA", "-keysize", "2048", "-validity", "10000",
                "-dname", "CN=Android Debug,O=Android,C=US");
        var process = new ProcessBuilder(command).redirectErrorStream(true).start();
        String output = IOUtils.toString(process.getInputStream(), StandardCharsets.UTF_8);
        try {
            if (process.waitFor() != 0 || !keystore.isFile())
                throw new IOException("keytool failed: " + output.trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while running keytool", e);
        }
    }
}
