package org.hardshell.patch.task;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Bytes;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.hardshell.patch.util.ApkEntry;
import org.hardshell.share.Constants;
import org.hardshell.share.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which entries of the target get protected and which stay in cleartext.
 */
public class ClassifyTask {

    /** ABIs the loader maps the running instruction set to. */
    public static final Set<String> PROTECTABLE_ABIS = ImmutableSet.of("armeabi-v7a", "arm64-v8a", "x86", "x86_64");

    public static class Classification {
        /** Protected dex files in dex index order. */
        public final List<ApkEntry> protectedCode = new ArrayList<>();
        /** Kept dex files in dex index order. */
        public final List<ApkEntry> keptCode = new ArrayList<>();
        public final List<ApkEntry> protectedLibraries = new ArrayList<>();
        public final List<ApkEntry> protectedAssets = new ArrayList<>();
        /** ABI directories whose libraries were left in cleartext because the loader cannot resolve them. */
        public final Set<String> unknownAbis = new LinkedHashSet<>();
        /** Every ABI that has native libraries in the target. */
        public final Set<String> abis = new LinkedHashSet<>();

        public boolean isProtected(ApkEntry entry) {
            return protectedCode.contains(entry) || protectedLibraries.contains(entry) || protectedAssets.contains(entry);
        }
    }

    private final List<byte[]> keepDescriptors = new ArrayList<>();
    private final Set<String> keepLibraries = new LinkedHashSet<>();
    private final List<String> assetPatterns;
    private final Logger logger;

    public ClassifyTask(List<String> keepClasses, List<String> keepPackages, List<String> keepLibraries,
                        List<String> assetPatterns, Logger logger) {
        for (String name : keepClasses) {
            keepDescriptors.add(("L" + name.trim().replace('.', '/') + ";").getBytes(StandardCharsets.UTF_8));
        }
        for (String name : keepPackages) {
            var prefix = name.trim();
            while (prefix.endsWith(".")) prefix = prefix.substring(0, prefix.length() - 1);
            keepDescriptors.add(("L" + prefix.replace('.', '/') + "/").getBytes(StandardCharsets.UTF_8));
        }
        for (String name : keepLibraries) {
            var n = name.trim();
            this.keepLibraries.add(n);
            this.keepLibraries.add("lib" + n + ".so");
            this.keepLibraries.add(n + ".so");
        }
        this.assetPatterns = assetPatterns;
        this.logger = logger;
    }

    public Classification classify(List<ApkEntry> entries) {
        var result = new Classification();
        List<ApkEntry> dexes = new ArrayList<>();
        for (ApkEntry entry : entries) {
            var name = entry.name();
            if (ApkEntry.dexIndex(name) > 0) {
                dexes.add(entry);
                continue;
            }
            var abi = ApkEntry.libraryAbi(name);
            if (abi != null) {
                result.abis.add(abi);
                if (!PROTECTABLE_ABIS.contains(abi)) {
                    if (result.unknownAbis.add(abi)) logger.w("Libraries under unknown ABI " + abi + " are kept in cleartext");
                } else if (keepLibraries.contains(ApkEntry.libraryFileName(name))) {
                    logger.d("Keeping library " + name);
                } else {
                    result.protectedLibraries.add(entry);
                }
                continue;
            }
            if (isProtectedAsset(name)) result.protectedAssets.add(entry);
        }

        dexes.sort(Comparator.comparingInt(e -> ApkEntry.dexIndex(e.name())));
        for (ApkEntry dex : dexes) {
            if (isKept(dex.data())) {
                logger.d("Keeping " + dex.name() + " in cleartext");
                result.keptCode.add(dex);
            } else {
                result.protectedCode.add(dex);
            }
        }
        logger.i("Protecting " + result.protectedCode.size() + " dex, " + result.protectedLibraries.size()
                + " libraries, " + result.protectedAssets.size() + " assets");
        return result;
    }

    private boolean isKept(byte[] dex) {
        for (byte[] descriptor : keepDescriptors) {
            if (Bytes.indexOf(dex, descriptor) >= 0) return true;
        }
        return false;
    }

    private boolean isProtectedAsset(String name) {
        if (!name.startsWith("assets/") || name.startsWith(Constants.HARDSHELL_ASSET_DIR)) return false;
        for (String pattern : assetPatterns) {
            if (FilenameUtils.wildcardMatch(name, pattern, IOCase.SENSITIVE)) return true;
        }
        return false;
    }
}
