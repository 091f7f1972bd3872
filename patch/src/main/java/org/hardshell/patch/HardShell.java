package org.hardshell.patch;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import org.hardshell.patch.util.JavaLogger;
import org.hardshell.share.DebuggerPolicy;
import org.hardshell.share.Logger;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

public class HardShell {

    @Parameter(description = "apk")
    private List<String> apkPaths = new ArrayList<>();

    @Parameter(names = {"-h", "--help"}, help = true, order = 0, description = "Print this message")
    private boolean help = false;

    @Parameter(names = {"-o", "--output"}, description = "Output apk")
    private String outputPath;

    @Parameter(names = {"-f", "--force"}, description = "Force overwrite exists output file")
    private boolean forceOverwrite = false;

    @Parameter(names = {"-d", "--debuggable"}, description = "Keep the app debuggable")
    private boolean debuggableFlag = false;

    @Parameter(names = {"--keep-class"}, description = "Leave the dex containing this class in cleartext")
    private List<String> keepClasses = new ArrayList<>();

    @Parameter(names = {"--keep-package"}, description = "Leave dex files containing classes of this package in cleartext")
    private List<String> keepPackages = new ArrayList<>();

    @Parameter(names = {"--keep-lib"}, description = "Leave this native library in cleartext")
    private List<String> keepLibraries = new ArrayList<>();

    @Parameter(names = {"--encrypt-assets"}, description = "Also protect assets matching this wildcard pattern, e.g. assets/*.json")
    private List<String> assetPatterns = new ArrayList<>();

    @Parameter(names = {"--debugger-policy"}, description = "What the loader does when a debugger is attached: IGNORE, LOG_ONLY or ABORT")
    private String debuggerPolicy = DebuggerPolicy.LOG_ONLY.name();

    @Parameter(names = {"-j", "--threads"}, description = "Encryption worker threads")
    private int threads = Runtime.getRuntime().availableProcessors();

    @Parameter(names = {"--stub"}, description = "Directory holding the stub dex and libraries, instead of the bundled ones")
    private String stubPath;

    @Parameter(names = {"--skip-sign"}, description = "Leave the output unsigned")
    private boolean skipSigning = false;

    @Parameter(names = {"--ks"}, description = "Keystore to sign with; the debug keystore when omitted")
    private String keystore;

    @Parameter(names = {"--ks-pass"}, description = "Keystore password")
    private String keystorePassword;

    @Parameter(names = {"--ks-key-alias"}, description = "Key alias in the keystore")
    private String keyAlias;

    @Parameter(names = {"--key-pass"}, description = "Key password, defaults to the keystore password")
    private String keyPassword;

    @Parameter(names = {"--apksigner"}, description = "apksigner executable to use")
    private String apksigner;

    @Parameter(names = {"-v", "--verbose"}, description = "Verbose output")
    private boolean verbose = false;

    private final JCommander jCommander;

    private final Logger logger;

    public HardShell(Logger logger, String... args) {
        jCommander = JCommander.newBuilder()
                .addObject(this)
                .build();
        jCommander.parse(args);
        this.logger = logger;
        logger.verbose = verbose;
    }

    public static void main(String... args) {
        var logger = new JavaLogger();
        try {
            new HardShell(logger, args).doCommandLine();
        } catch (ParameterException e) {
            logger.e(e.getMessage());
            System.exit(2);
        } catch (PatchError e) {
            logger.e("Error: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    public PatchResult doCommandLine() throws PatchError {
        if (help || apkPaths.size() != 1 || outputPath == null) {
            jCommander.usage();
            return null;
        }
        var result = new Packer(logger).patch(toOptions());
        for (PatchWarning warning : result.warnings()) {
            logger.w(warning.toString());
        }
        return result;
    }

    PatchOptions toOptions() {
        var options = new PatchOptions();
        options.target = new File(apkPaths.get(0)).getAbsoluteFile();
        options.output = new File(outputPath).getAbsoluteFile();
        options.forceOverwrite = forceOverwrite;
        options.debuggable = debuggableFlag;
        options.keepClasses = keepClasses;
        options.keepPackages = keepPackages;
        options.keepLibraries = keepLibraries;
        options.assetPatterns = assetPatterns;
        options.debuggerPolicy = DebuggerPolicy.fromName(debuggerPolicy, null);
        if (options.debuggerPolicy == null)
            throw new ParameterException("Unknown debugger policy " + debuggerPolicy);
        options.threads = threads;
        options.stubBundle = stubPath == null ? null : new File(stubPath);
        options.skipSigning = skipSigning;
        options.keystore = keystore == null ? null : new File(keystore);
        options.keystorePassword = keystorePassword;
        options.keyAlias = keyAlias;
        options.keyPassword = keyPassword;
        options.apksigner = apksigner == null ? null : new File(apksigner);
        return options;
    }
}
