package org.hardshell.loader;

import org.hardshell.loader.delegation.DeferredInitializer;
import org.hardshell.loader.delegation.ReferenceSwapException;
import org.hardshell.loader.nativelib.NativeLibraryCache;
import org.hardshell.loader.util.PrivateFiles;
import org.hardshell.share.BootstrapConfig;
import org.hardshell.share.Constants;
import org.hardshell.share.DebuggerPolicy;
import org.hardshell.share.FileUtils;
import org.hardshell.share.Logger;
import org.hardshell.share.crypto.AuthenticationFailureException;
import org.hardshell.share.crypto.KeyProtections;
import org.hardshell.share.crypto.KeyUnavailableException;
import org.hardshell.share.payload.EntryKind;
import org.hardshell.share.payload.PayloadContainer;
import org.hardshell.share.payload.PayloadCorruptException;
import org.hardshell.share.payload.PayloadCrypto;
import org.hardshell.share.payload.PayloadEntry;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;

import static org.hardshell.loader.LoaderFailure.Reason.AUTHENTICATION_FAILURE;
import static org.hardshell.loader.LoaderFailure.Reason.DEBUGGER_DETECTED;
import static org.hardshell.loader.LoaderFailure.Reason.KEY_UNAVAILABLE;
import static org.hardshell.loader.LoaderFailure.Reason.ORIGINAL_APPLICATION_CONSTRUCTION_FAILED;
import static org.hardshell.loader.LoaderFailure.Reason.PAYLOAD_CORRUPT;
import static org.hardshell.loader.LoaderFailure.Reason.UNSUPPORTED_PLATFORM_CAPABILITY;

/**
 * Drives a {@link LoaderSession} from {@code INIT} to {@code RUNNING}.
 * <p>
 * The run is split the way the platform starts an application, and each phase may be triggered by whichever
 * hook reaches it first:
 * <ul>
 * <li>{@link #prepare()} gets as far as {@code NATIVE_READY};</li>
 * <li>{@link #attachOriginal(Object)} constructs the original application and attaches it to the base context,
 * while the stub itself is still attaching;</li>
 * <li>{@link #swapReferences(Object, Object)} points the process at the original ({@code DELEGATED}) before any
 * content provider of the app is created;</li>
 * <li>{@link #delegate(Object, Object)} starts the original ({@code RUNNING}).</li>
 * </ul>
 * Every phase runs the ones before it and is idempotent.
 */
public final class ShellLoader {

    public static final String CODE_DIR = "hardshell/code";
    public static final String OPTIMIZED_DIR = "hardshell/oat";
    public static final String NATIVE_DIR = "hardshell/lib";
    public static final String ASSET_DIR = "assets/";

    private final Platform platform;
    private final Logger logger;
    private final OnceGuard<LoaderSession> prepared = new OnceGuard<>();
    private final OnceGuard<LoaderSession> attached = new OnceGuard<>();
    private final OnceGuard<LoaderSession> swapped = new OnceGuard<>();
    private final OnceGuard<LoaderSession> delegated = new OnceGuard<>();
    private DebuggerPolicy debuggerPolicy = DebuggerPolicy.IGNORE;

    public ShellLoader(Platform platform) {
        this.platform = platform;
        this.logger = platform.logger();
    }

    public LoaderSession prepare() {
        return prepared.get(() -> {
            var session = new LoaderSession(logger);
            run(session, () -> runToNativeReady(session));
            return session;
        });
    }

    public LoaderSession attachOriginal(Object baseContext) {
        return attached.get(() -> {
            var session = prepare();
            run(session, () -> constructOriginal(session, baseContext));
            return session;
        });
    }

    public LoaderSession swapReferences(Object stubApplication, Object baseContext) {
        return swapped.get(() -> {
            var session = attachOriginal(baseContext);
            run(session, () -> swapToOriginal(session, stubApplication, baseContext));
            return session;
        });
    }

    public LoaderSession delegate(Object stubApplication, Object baseContext) {
        return delegated.get(() -> {
            var session = swapReferences(stubApplication, baseContext);
            run(session, () -> startOriginal(session));
            return session;
        });
    }

    public boolean isPrepared() {
        return prepared.isDone();
    }

    /**
     * Opens an asset the way {@code AssetManager.open} would, decrypting it when it was protected.
     *
     * @param name      asset name relative to {@code assets/}
     * @param fallback  opens assets that were left in the package
     */
    public InputStream openAsset(String name, AssetSource fallback) throws IOException {
        var protectedAsset = prepare().openAsset(ASSET_DIR + name);
        return protectedAsset != null ? protectedAsset : fallback.open(name);
    }

    /**
     * Records any failure of {@code step} on the session, so no exception leaves a phase without the session
     * being {@code FAILED}.
     */
    private static void run(LoaderSession session, Runnable step) {
        try {
            step.run();
        } catch (LoaderFailure e) {
            throw session.fail(e);
        } catch (RuntimeException | LinkageError e) {
            throw session.fail(UNSUPPORTED_PLATFORM_CAPABILITY, "unexpected loader error", e);
        }
    }

    private void runToNativeReady(LoaderSession session) {
        session.sdkInt = platform.sdkInt();

        BootstrapConfig config;
        try (InputStream is = platform.openStubAsset(Constants.BOOTSTRAP_CONFIG_ASSET_PATH)) {
            config = BootstrapConfig.fromJson(is);
            session.key = KeyProtections.forScheme(config.keyScheme).unseal(config.keyShares);
        } catch (IOException | KeyUnavailableException e) {
            throw new LoaderFailure(KEY_UNAVAILABLE, "cannot resolve protection key", e);
        }
        debuggerPolicy = DebuggerPolicy.fromName(config.debuggerPolicy, DebuggerPolicy.LOG_ONLY);
        session.advance(LoaderState.KEY_RESOLVED);
        checkDebugger();

        session.strategy = StrategySelector.select(session.sdkInt);
        logger.i("Platform " + session.sdkInt + ", loading " + session.strategy);
        session.advance(LoaderState.STRATEGY_SELECTED);

        try (InputStream is = platform.openStubAsset(Constants.PAYLOAD_ASSET_PATH)) {
            if (is == null) throw new IOException("payload asset missing");
            session.container = PayloadContainer.read(FileUtils.readAllBytes(is));
        } catch (IOException e) {
            throw new LoaderFailure(PAYLOAD_CORRUPT, "cannot read payload", e);
        }
        var units = decryptCode(session);
        session.classLoader = loadCode(session, units);
        session.advance(LoaderState.CODE_LOADED);

        var nativeRoot = new File(platform.privateDir(), NATIVE_DIR);
        session.nativeLibraries = new NativeLibraryCache(session.container, session.key, platform.abi(), nativeRoot, logger);
        session.advance(LoaderState.NATIVE_READY);

        session.originalApplication = firstNonEmpty(
                platform.metaData(Constants.META_ORIGINAL_APPLICATION), config.originalApplication,
                Constants.DEFAULT_APPLICATION);
        session.originalAppComponentFactory = firstNonEmpty(
                platform.metaData(Constants.META_ORIGINAL_FACTORY), config.originalAppComponentFactory, null);
        logger.i("Original application " + session.originalApplication
                + (session.originalAppComponentFactory == null ? "" : ", factory " + session.originalAppComponentFactory));
    }

    /**
     * Every unit is verified before any of them reaches the platform loader.
     */
    private List<CodeUnit> decryptCode(LoaderSession session) {
        List<CodeUnit> units = new ArrayList<>();
        for (PayloadEntry entry : session.container.entries(EntryKind.CODE)) {
            try {
                units.add(new CodeUnit(entry.path(), PayloadCrypto.open(entry, session.key)));
            } catch (AuthenticationFailureException e) {
                throw new LoaderFailure(AUTHENTICATION_FAILURE, entry.toString(), e);
            } catch (PayloadCorruptException e) {
                throw new LoaderFailure(PAYLOAD_CORRUPT, entry.toString(), e);
            } catch (GeneralSecurityException e) {
                throw new LoaderFailure(AUTHENTICATION_FAILURE, "cannot decrypt " + entry, e);
            }
        }
        logger.d("Decrypted " + units.size() + " code units");
        return units;
    }

    private ClassLoader loadCode(LoaderSession session, List<CodeUnit> units) {
        var codeLoader = platform.codeLoader();
        try {
            switch (session.strategy) {
                case IN_MEMORY:
                    return codeLoader.loadInMemory(units, session);
                case FILE_BASED:
                    return codeLoader.loadFromFiles(writeCodeFiles(units),
                            PrivateFiles.ensureDirectory(new File(platform.privateDir(), OPTIMIZED_DIR)), session);
                default:
                    throw new AssertionError(session.strategy);
            }
        } catch (IOException e) {
            throw new LoaderFailure(UNSUPPORTED_PLATFORM_CAPABILITY, "cannot register code with " + session.strategy, e);
        }
    }

    private List<File> writeCodeFiles(List<CodeUnit> units) throws IOException {
        var dir = new File(platform.privateDir(), CODE_DIR);
        FileUtils.deleteFolderIfExists(dir);
        PrivateFiles.ensureDirectory(dir);
        List<File> files = new ArrayList<>(units.size());
        for (CodeUnit unit : units) {
            files.add(PrivateFiles.writeAtomically(dir, unit.name(), unit.bytes(), true));
        }
        return files;
    }

    private void constructOriginal(LoaderSession session, Object baseContext) {
        session.delegation = platform.delegationStrategies().forSdk(session.sdkInt);
        if (session.delegation == null)
            throw new LoaderFailure(UNSUPPORTED_PLATFORM_CAPABILITY, "no delegation strategy for platform " + session.sdkInt);

        var contract = platform.applicationContract();
        try {
            session.original = contract.construct(session.classLoader, session.originalApplication);
            contract.attach(session.original, baseContext);
        } catch (ReflectiveOperationException | LinkageError | RuntimeException e) {
            throw new LoaderFailure(ORIGINAL_APPLICATION_CONSTRUCTION_FAILED, session.originalApplication, e);
        }
        logger.d("Attached " + session.originalApplication);
    }

    private void swapToOriginal(LoaderSession session, Object stubApplication, Object baseContext) {
        var original = session.original;
        try {
            session.delegation.prepareSwap(stubApplication, original).commit();
        } catch (ReflectiveOperationException | ReferenceSwapException | RuntimeException e) {
            throw new LoaderFailure(UNSUPPORTED_PLATFORM_CAPABILITY, "cannot swap application references", e);
        }
        session.application = original;
        session.advance(LoaderState.DELEGATED);

        var contract = platform.applicationContract();
        for (DeferredInitializer initializer : platform.deferredInitializers()) {
            if (!contract.probe(original, initializer.capability())) {
                logger.d("Application does not provide " + initializer.capability());
                continue;
            }
            try {
                initializer.initialize(original, baseContext);
                logger.i("Initialized " + initializer.capability() + " provider");
            } catch (Exception e) {
                logger.w("Deferred initialization of " + initializer.capability() + " failed: " + e);
            }
        }
    }

    private void startOriginal(LoaderSession session) {
        checkDebugger();
        try {
            platform.applicationContract().start(session.application);
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new LoaderFailure(ORIGINAL_APPLICATION_CONSTRUCTION_FAILED, "cannot start " + session.originalApplication, e);
        }
        session.advance(LoaderState.RUNNING);
    }

    private void checkDebugger() {
        if (debuggerPolicy == DebuggerPolicy.IGNORE) return;
        boolean attached;
        try {
            attached = platform.debuggerProbe().isDebuggerAttached();
        } catch (IOException e) {
            logger.w("Debugger probe unavailable: " + e.getMessage());
            return;
        }
        if (!attached) return;
        if (debuggerPolicy == DebuggerPolicy.ABORT)
            throw new LoaderFailure(DEBUGGER_DETECTED, "debugger attached");
        logger.w("Debugger attached");
    }

    private static String firstNonEmpty(String first, String second, String fallback) {
        if (first != null && !first.isEmpty()) return first;
        if (second != null && !second.isEmpty()) return second;
        return fallback;
    }
}
