package org.hardshell.patch;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;
import org.hardshell.axml.AndroidAttrs;
import org.hardshell.axml.Attribute;
import org.hardshell.axml.AxmlDocument;
import org.hardshell.axml.EndElement;
import org.hardshell.axml.EndNamespace;
import org.hardshell.axml.StartElement;
import org.hardshell.axml.StartNamespace;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;

import static org.hardshell.axml.AndroidAttrs.NAMESPACE;

/**
 * Builds small apks for packer tests.
 */
final class FixtureApk {

    static final String PACKAGE = "com.example.app";

    String application = ".App";
    String appComponentFactory;
    boolean debuggable = true;
    boolean splitRequired;
    final Map<String, byte[]> entries = new LinkedHashMap<>();

    static FixtureApk standard() {
        var apk = new FixtureApk();
        apk.put("classes.dex", fakeDex("Lcom/example/app/App;", "Lcom/example/app/MainActivity;"));
        apk.put("classes2.dex", fakeDex("Lcom/example/lib/Util;", "Lokhttp3/Call;"));
        apk.put("lib/arm64-v8a/libexample.so", text("ELF arm64 example"));
        apk.put("lib/x86_64/libexample.so", text("ELF x86_64 example"));
        apk.put("lib/arm64-v8a/libkeep.so", text("ELF arm64 keep"));
        apk.put("assets/config.json", text("{\"endpoint\":\"https://api.example.com\"}"));
        apk.put("assets/fonts/body.ttf", text("font bytes"));
        apk.put("res/layout/main.xml", text("layout"));
        apk.put("resources.arsc", text("resource table"));
        apk.put("META-INF/CERT.SF", text("old signature"));
        apk.put("META-INF/CERT.RSA", text("old signature block"));
        return apk;
    }

    FixtureApk put(String name, byte[] data) {
        entries.put(name, data);
        return this;
    }

    static byte[] text(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Just enough of a dex file for descriptor search: the magic followed by the type descriptors.
     */
    static byte[] fakeDex(String... descriptors) {
        var sb = new StringBuilder("dex\n035\0");
        for (String d : descriptors) sb.append((char) d.length()).append(d).append('\0');
        return text(sb.toString());
    }

    byte[] manifest() {
        var doc = new AxmlDocument();
        doc.append(new StartNamespace(1, null, "android", NAMESPACE));
        doc.append(new StartElement(1, null, null, "manifest")
                .setAttribute(Attribute.string(null, "package", 0, PACKAGE)));
        doc.append(new StartElement(2, null, null, "uses-sdk")
                .setAttribute(Attribute.integer(NAMESPACE, "minSdkVersion", AndroidAttrs.MIN_SDK_VERSION, 24))
                .setAttribute(Attribute.integer(NAMESPACE, "targetSdkVersion", AndroidAttrs.TARGET_SDK_VERSION, 34)));
        doc.append(new EndElement(2, null, null, "uses-sdk"));
        var app = new StartElement(3, null, null, "application");
        if (application != null)
            app.setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, application));
        if (appComponentFactory != null)
            app.setAttribute(Attribute.string(NAMESPACE, "appComponentFactory", AndroidAttrs.APP_COMPONENT_FACTORY, appComponentFactory));
        if (debuggable)
            app.setAttribute(Attribute.bool(NAMESPACE, "debuggable", AndroidAttrs.DEBUGGABLE, true));
        if (splitRequired)
            app.setAttribute(Attribute.bool(NAMESPACE, "isSplitRequired", AndroidAttrs.IS_SPLIT_REQUIRED, true));
        doc.append(app);
        doc.append(new StartElement(4, null, null, "activity")
                .setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, ".MainActivity")));
        doc.append(new EndElement(4, null, null, "activity"));
        doc.append(new EndElement(5, null, null, "application"));
        doc.append(new EndElement(6, null, null, "manifest"));
        doc.append(new EndNamespace(6, null, "android", NAMESPACE));
        return doc.toByteArray();
    }

    File writeTo(File file) throws IOException {
        try (var zip = new ZipArchiveOutputStream(file)) {
            write(zip, TargetBundle.ANDROID_MANIFEST_XML, manifest());
            for (var e : entries.entrySet()) write(zip, e.getKey(), e.getValue());
        }
        return file;
    }

    private static void write(ZipArchiveOutputStream zip, String name, byte[] data) throws IOException {
        var entry = new ZipArchiveEntry(name);
        if (name.endsWith(".so") || name.equals("resources.arsc")) {
            var crc = new CRC32();
            crc.update(data);
            entry.setMethod(ZipArchiveEntry.STORED);
            entry.setSize(data.length);
            entry.setCrc(crc.getValue());
        }
        zip.putArchiveEntry(entry);
        zip.write(data);
        zip.closeArchiveEntry();
    }

    /**
     * Every entry of an apk, in central directory order.
     */
    static Map<String, byte[]> read(File apk) throws IOException {
        Map<String, byte[]> out = new LinkedHashMap<>();
        try (var zip = new ZipFile(apk)) {
            for (var e = zip.getEntries(); e.hasMoreElements(); ) {
                var entry = e.nextElement();
                try (InputStream is = zip.getInputStream(entry)) {
                    out.put(entry.getName(), IOUtils.toByteArray(is));
                }
            }
        }
        return out;
    }
}
