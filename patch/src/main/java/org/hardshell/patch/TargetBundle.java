package org.hardshell.patch;

import com.google.common.collect.ImmutableList;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;
import org.hardshell.axml.AxmlDocument;
import org.hardshell.patch.util.ApkEntry;
import org.hardshell.patch.util.ManifestParser;
import org.hardshell.share.Constants;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;

/**
 * The input apk, read fully into memory with its entries in central directory order.
 */
public final class TargetBundle {

    public static final String ANDROID_MANIFEST_XML = "AndroidManifest.xml";

    private final ImmutableList<ApkEntry> entries;
    private final AxmlDocument manifest;
    private final ManifestParser.Manifest info;

    private TargetBundle(List<ApkEntry> entries, AxmlDocument manifest, ManifestParser.Manifest info) {
        this.entries = ImmutableList.copyOf(entries);
        this.manifest = manifest;
        this.info = info;
    }

    public static TargetBundle parse(File file) throws ParseError, UnsupportedSplitConfigurationError {
        if (!file.isFile()) throw new ParseError("The target apk does not exist: " + file);
        List<ApkEntry> entries = new ArrayList<>();
        try (var zip = new ZipFile(file)) {
            for (Enumeration<ZipArchiveEntry> e = zip.getEntries(); e.hasMoreElements(); ) {
                ZipArchiveEntry entry = e.nextElement();
                if (entry.isDirectory()) continue;
                try (InputStream is = zip.getInputStream(entry)) {
                    entries.add(new ApkEntry(entry.getName(), IOUtils.toByteArray(is),
                            entry.getMethod() != ZipArchiveEntry.STORED));
                }
            }
        } catch (IOException e) {
            throw new ParseError("Not a readable apk: " + file, e);
        }

        for (ApkEntry entry : entries) {
            var name = entry.name();
            if (name.equals("BundleConfig.pb") || name.endsWith("/BundleConfig.pb"))
                throw new UnsupportedSplitConfigurationError("App bundles are not supported: " + file);
            if (name.equals("toc.pb") || (name.endsWith(".apk") && !name.startsWith("assets/")))
                throw new UnsupportedSplitConfigurationError("APK sets are not supported: " + file);
            if (name.equals(Constants.PAYLOAD_ASSET_PATH))
                throw new ParseError("The target apk is already hardened: " + file);
        }

        var manifestEntry = entries.stream().filter(e -> e.name().equals(ANDROID_MANIFEST_XML)).findFirst();
        if (manifestEntry.isEmpty()) throw new ParseError("Provided file is not a valid apk: no " + ANDROID_MANIFEST_XML);
        AxmlDocument manifest;
        try {
            manifest = AxmlDocument.parse(manifestEntry.get().data());
        } catch (IOException e) {
            throw new ParseError("Failed to parse " + ANDROID_MANIFEST_XML, e);
        }
        var info = ManifestParser.parse(manifest);
        if (info == null) throw new ParseError(ANDROID_MANIFEST_XML + " has no manifest element");
        if (info.splitReason != null)
            throw new UnsupportedSplitConfigurationError("Split apks are not supported: " + info.splitReason);
        return new TargetBundle(entries, manifest, info);
    }

    public List<ApkEntry> entries() {
        return entries;
    }

    public AxmlDocument manifest() {
        return manifest;
    }

    public ManifestParser.Manifest info() {
        return info;
    }
}
