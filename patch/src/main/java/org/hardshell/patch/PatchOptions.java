package org.hardshell.patch;

import org.hardshell.share.DebuggerPolicy;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one packer run needs. Plain data: the command line fills it in, tests build it directly.
 */
public class PatchOptions {

    public File target;
    public File output;
    public boolean forceOverwrite = false;

    /** Classes whose dex file stays in cleartext, e.g. {@code com.example.Foo}. */
    public List<String> keepClasses = new ArrayList<>();
    /** Packages whose dex files stay in cleartext, e.g. {@code com.example}. */
    public List<String> keepPackages = new ArrayList<>();
    /** Native libraries left in cleartext, as {@code foo}, {@code libfoo.so} or {@code foo.so}. */
    public List<String> keepLibraries = new ArrayList<>();
    /** Wildcard patterns ({@code *}, {@code ?}) of entries under {@code assets/} to protect. */
    public List<String> assetPatterns = new ArrayList<>();

    public boolean debuggable = false;
    public DebuggerPolicy debuggerPolicy = DebuggerPolicy.LOG_ONLY;
    public int threads = Runtime.getRuntime().availableProcessors();

    /** Directory laid out like {@code assets/stub/}; {@code null} loads the stub from the classpath. */
    public File stubBundle;

    public boolean skipSigning = false;
    public File keystore;
    public String keystorePassword;
    public String keyAlias;
    public String keyPassword;
    /** Explicit {@code apksigner} executable; {@code null} searches the Android SDK and {@code PATH}. */
    public File apksigner;
    /** Where a debug keystore is created when no keystore is given; {@code null} uses {@code ~/.android}. */
    public File debugKeystore;
}
