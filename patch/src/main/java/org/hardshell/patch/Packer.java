package org.hardshell.patch;

import org.apache.commons.io.FileUtils;
import org.hardshell.patch.task.ClassifyTask;
import org.hardshell.patch.task.EncryptTask;
import org.hardshell.patch.task.ManifestPatchTask;
import org.hardshell.patch.task.SignApkTask;
import org.hardshell.patch.task.WriteApkTask;
import org.hardshell.patch.util.ApkEntry;
import org.hardshell.share.BootstrapConfig;
import org.hardshell.share.Constants;
import org.hardshell.share.Logger;
import org.hardshell.share.crypto.AeadEngine;
import org.hardshell.share.crypto.XorShareKeyProtection;
import org.hardshell.share.payload.EntryKind;
import org.hardshell.share.payload.PayloadEntry;
import org.hardshell.share.payload.PayloadWriter;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Turns a target apk into a hardened one.
 * <p>
 * Work happens in a temporary file next to the output, which is only moved into place once every stage has
 * succeeded; a failed or cancelled run leaves the output path untouched.
 */
public class Packer {

    private final Logger logger;
    private final SecureRandom random;

    public Packer(Logger logger) {
        this(logger, new SecureRandom());
    }

    Packer(Logger logger, SecureRandom random) {
        this.logger = logger;
        this.random = random;
    }

    public PatchResult patch(PatchOptions options) throws PatchError {
        return patch(options, () -> false);
    }

    public PatchResult patch(PatchOptions options, BooleanSupplier cancelled) throws PatchError {
        if (options.target == null || options.output == null) throw new PatchError("Target and output are required");
        var output = options.output.getAbsoluteFile();
        if (output.exists() && !options.forceOverwrite)
            throw new PatchError(output + " exists. Use --force to overwrite");
        List<PatchWarning> warnings = new ArrayList<>();

        checkpoint(cancelled, "parsing");
        logger.i("Parsing " + options.target);
        var target = TargetBundle.parse(options.target);
        var info = target.info();
        var stub = StubBundle.load(options.stubBundle);

        String originalApplication = info.applicationClass;
        if (originalApplication == null) {
            originalApplication = Constants.DEFAULT_APPLICATION;
            warnings.add(new PatchWarning(PatchWarning.Kind.MANIFEST_INCOMPLETE,
                    "No application class declared, delegating to " + originalApplication));
        }
        logger.d("Original application " + originalApplication + ", factory " + info.appComponentFactory);

        checkpoint(cancelled, "classification");
        var classification = new ClassifyTask(options.keepClasses, options.keepPackages, options.keepLibraries,
                options.assetPatterns, logger).classify(target.entries());
        for (String abi : classification.unknownAbis) {
            warnings.add(new PatchWarning(PatchWarning.Kind.UNKNOWN_ABI, "Libraries under lib/" + abi + " left in cleartext"));
        }

        checkpoint(cancelled, "encryption");
        byte[] key = new byte[AeadEngine.KEY_LENGTH];
        random.nextBytes(key);
        List<PayloadEntry> sealed = new EncryptTask(options.threads, logger).encrypt(encryptionItems(classification), key);
        byte[] payload = new PayloadWriter().addAll(sealed).toByteArray();
        var shares = new XorShareKeyProtection(XorShareKeyProtection.DEFAULT_SHARES, random).seal(key);
        // the key only leaves this method split into shares
        Arrays.fill(key, (byte) 0);
        var bootstrap = new BootstrapConfig(originalApplication, info.appComponentFactory, info.minSdkVersion,
                info.targetSdkVersion, XorShareKeyProtection.SCHEME, shares, options.debuggerPolicy.name());

        checkpoint(cancelled, "manifest patching");
        byte[] manifest = new ManifestPatchTask(options.debuggable)
                .patch(target.manifest(), originalApplication, info.appComponentFactory);

        var entries = assemble(target, classification, stub, manifest, payload, bootstrap.toJson());

        checkpoint(cancelled, "writing");
        var dir = output.getParentFile();
        File unsigned = null;
        File signedFile = null;
        try {
            FileUtils.forceMkdir(dir);
            unsigned = File.createTempFile(".hardshell-", ".apk.tmp", dir);
            logger.i("Writing " + entries.size() + " entries");
            new WriteApkTask(logger).write(unsigned, entries);

            checkpoint(cancelled, "signing");
            var result = unsigned;
            boolean signed = false;
            if (options.skipSigning) {
                logger.i("Skipping signing");
            } else {
                signedFile = File.createTempFile(".hardshell-", ".signed.tmp", dir);
                try {
                    new SignApkTask(options.apksigner, options.keystore, options.keystorePassword, options.keyAlias,
                            options.keyPassword, options.debugKeystore, logger).sign(unsigned, signedFile);
                    result = signedFile;
                    signed = true;
                } catch (IOException e) {
                    logger.w("Output left unsigned: " + e.getMessage());
                    warnings.add(new PatchWarning(PatchWarning.Kind.SIGNING_UNAVAILABLE, e.getMessage()));
                }
            }

            checkpoint(cancelled, "publishing");
            moveIntoPlace(result, output);
            logger.i("Done. Output APK: " + output);
            return new PatchResult(output, warnings, classification.protectedCode.size(),
                    classification.protectedLibraries.size(), classification.protectedAssets.size(), signed);
        } catch (IOException e) {
            throw new PatchError("Failed to write " + output, e);
        } finally {
            FileUtils.deleteQuietly(unsigned);
            FileUtils.deleteQuietly(signedFile);
        }
    }

    private static List<EncryptTask.Item> encryptionItems(ClassifyTask.Classification classification) {
        List<EncryptTask.Item> items = new ArrayList<>();
        for (ApkEntry dex : classification.protectedCode) {
            items.add(new EncryptTask.Item(EntryKind.CODE, dex.name(), "", dex.data()));
        }
        for (ApkEntry lib : classification.protectedLibraries) {
            items.add(new EncryptTask.Item(EntryKind.NATIVE_LIB, ApkEntry.libraryFileName(lib.name()),
                    ApkEntry.libraryAbi(lib.name()), lib.data()));
        }
        for (ApkEntry asset : classification.protectedAssets) {
            items.add(new EncryptTask.Item(EntryKind.ASSET, asset.name(), "", asset.data()));
        }
        return items;
    }

    /**
     * Manifest, dex files, remaining original entries, stub libraries, then the hardened assets.
     */
    private List<ApkEntry> assemble(TargetBundle target, ClassifyTask.Classification classification, StubBundle stub,
                                    byte[] manifest, byte[] payload, byte[] bootstrap) {
        List<ApkEntry> out = new ArrayList<>();
        out.add(new ApkEntry(TargetBundle.ANDROID_MANIFEST_XML, manifest, true));

        int index = 1;
        for (byte[] dex : stub.dexes()) {
            out.add(new ApkEntry(ApkEntry.dexName(index++), dex, true));
        }
        for (ApkEntry kept : classification.keptCode) {
            out.add(kept.renamed(ApkEntry.dexName(index++)));
        }

        for (ApkEntry entry : target.entries()) {
            var name = entry.name();
            if (name.equals(TargetBundle.ANDROID_MANIFEST_XML) || ApkEntry.dexIndex(name) > 0) continue;
            if (classification.isProtected(entry) || isSignatureFile(name)) continue;
            out.add(entry);
        }

        // stub libraries only for ABIs the app already ships, so the installer picks the same ABI as before
        for (var lib : stub.libraries().entrySet()) {
            var abi = lib.getKey();
            if (!classification.abis.isEmpty() && !classification.abis.contains(abi)) continue;
            out.add(new ApkEntry("lib/" + abi + "/" + Constants.STUB_NATIVE_LIBRARY, lib.getValue(), false));
        }

        out.add(new ApkEntry(Constants.PAYLOAD_ASSET_PATH, payload, false));
        out.add(new ApkEntry(Constants.BOOTSTRAP_CONFIG_ASSET_PATH, bootstrap, true));
        return out;
    }

    private static boolean isSignatureFile(String name) {
        if (!name.startsWith("META-INF/") || name.indexOf('/', "META-INF/".length()) >= 0) return false;
        return name.endsWith(".SF") || name.endsWith(".MF") || name.endsWith(".RSA")
                || name.endsWith(".DSA") || name.endsWith(".EC");
    }

    private static void moveIntoPlace(File from, File to) throws IOException {
        try {
            Files.move(from.toPath(), to.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from.toPath(), to.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void checkpoint(BooleanSupplier cancelled, String stage) throws PatchCancelledException {
        if (cancelled.getAsBoolean()) throw new PatchCancelledException(stage);
    }
}
