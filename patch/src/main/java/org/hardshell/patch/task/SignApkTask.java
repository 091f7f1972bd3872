package org.hardshell.patch.task;

import org.apache.commons.io.IOUtils;
import org.hardshell.patch.util.DebugKeystoreProvider;
import org.hardshell.share.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Signs with the SDK's {@code apksigner}, run as a separate process.
 */
public class SignApkTask {

    private static final String APKSIGNER = isWindows() ? "apksigner.bat" : "apksigner";

    private final File apksigner;
    private final File keystore;
    private final String keystorePassword;
    private final String keyAlias;
    private final String keyPassword;
    private final File debugKeystore;
    private final Logger logger;

    /**
     * @param keystore {@code null} signs with the debug keystore
     */
    public SignApkTask(File apksigner, File keystore, String keystorePassword, String keyAlias, String keyPassword,
                       File debugKeystore, Logger logger) {
        this.apksigner = apksigner;
        this.keystore = keystore;
        this.keystorePassword = keystorePassword;
        this.keyAlias = keyAlias;
        this.keyPassword = keyPassword;
        this.debugKeystore = debugKeystore;
        this.logger = logger;
    }

    public void sign(File unsigned, File signed) throws IOException {
        var tool = locateApksigner();

        File ks = keystore;
        String ksPass = keystorePassword;
        String alias = keyAlias;
        String keyPass = keyPassword;
        if (ks == null) {
            ks = new DebugKeystoreProvider(logger).provide(debugKeystore);
            ksPass = DebugKeystoreProvider.STORE_PASSWORD;
            alias = DebugKeystoreProvider.KEY_ALIAS;
            keyPass = DebugKeystoreProvider.KEY_PASSWORD;
        }
        if (ksPass == null) throw new IOException("No keystore password given for " + ks);

        List<String> command = new ArrayList<>(Arrays.asList(tool, "sign",
                "--ks", ks.getPath(),
                "--ks-pass", "pass:" + ksPass,
                "--key-pass", "pass:" + (keyPass != null ? keyPass : ksPass)));
        if (alias != null) command.addAll(Arrays.asList("--ks-key-alias", alias));
        command.addAll(Arrays.asList("--out", signed.getPath(), unsigned.getPath()));

        logger.d("Signing with " + tool + " and " + ks);
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new IOException("Cannot run " + tool, e);
        }
        String output = IOUtils.toString(process.getInputStream(), StandardCharsets.UTF_8);
        try {
            if (process.waitFor() != 0 || !signed.isFile())
                throw new IOException("apksigner failed: " + output.trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while signing", e);
        }
    }

    String locateApksigner() throws IOException {
        if (apksigner != null) {
            if (!apksigner.isFile()) throw new IOException("apksigner not found at " + apksigner);
            return apksigner.getPath();
        }
        for (String variable : new String[]{"ANDROID_HOME", "ANDROID_SDK_ROOT"}) {
            var sdk = System.getenv(variable);
            if (sdk == null) continue;
            var buildTools = new File(sdk, "build-tools").listFiles(File::isDirectory);
            if (buildTools == null) continue;
            // newest build-tools first
            Arrays.sort(buildTools, (a, b) -> b.getName().compareTo(a.getName()));
            for (File dir : buildTools) {
                var candidate = new File(dir, APKSIGNER);
                if (candidate.isFile()) return candidate.getPath();
            }
        }
        var path = System.getenv("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator)) {
                var candidate = new File(dir, APKSIGNER);
                if (candidate.isFile() && candidate.canExecute()) return candidate.getPath();
            }
        }
        throw new IOException("apksigner not found in ANDROID_HOME, ANDROID_SDK_ROOT or PATH");
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("windows");
    }
}
