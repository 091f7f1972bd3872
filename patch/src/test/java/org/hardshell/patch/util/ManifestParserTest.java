package org.hardshell.patch.util;

import org.hardshell.axml.AndroidAttrs;
import org.hardshell.axml.Attribute;
import org.hardshell.axml.AxmlDocument;
import org.hardshell.axml.EndElement;
import org.hardshell.axml.StartElement;
import org.junit.jupiter.api.Test;

import static org.hardshell.axml.AndroidAttrs.NAMESPACE;
import static org.junit.jupiter.api.Assertions.*;

class ManifestParserTest {

    private static AxmlDocument manifest(StartElement application, StartElement... appChildren) {
        var doc = new AxmlDocument();
        var root = new StartElement("manifest").setAttribute(Attribute.string(null, "package", 0, "com.example"));
        doc.append(root);
        doc.append(application);
        for (StartElement child : appChildren) {
            doc.append(child);
            doc.append(new EndElement(0, null, null, child.name()));
        }
        doc.append(new EndElement(0, null, null, "application"));
        doc.append(new EndElement(0, null, null, "manifest"));
        return doc;
    }

    @Test
    void resolvesClassNamesAgainstThePackage() {
        assertEquals("com.example.App", ManifestParser.className("com.example", ".App"));
        assertEquals("com.example.App", ManifestParser.className("com.example", "App"));
        assertEquals("org.other.App", ManifestParser.className("com.example", "org.other.App"));
        assertNull(ManifestParser.className("com.example", ""));
    }

    @Test
    void readsEntryPointsAndSdkLevels() {
        var app = new StartElement("application")
                .setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, ".App"))
                .setAttribute(Attribute.string(NAMESPACE, "appComponentFactory", AndroidAttrs.APP_COMPONENT_FACTORY, ".Factory"));

        var info = ManifestParser.parse(manifest(app));

        assertEquals("com.example", info.packageName);
        assertEquals("com.example.App", info.applicationClass);
        assertEquals("com.example.Factory", info.appComponentFactory);
        assertEquals(1, info.minSdkVersion);
        assertNull(info.splitReason);
    }

    @Test
    void detectsSplitMarkers() {
        var required = new StartElement("application")
                .setAttribute(Attribute.bool(NAMESPACE, "isSplitRequired", AndroidAttrs.IS_SPLIT_REQUIRED, true));
        assertNotNull(ManifestParser.parse(manifest(required)).splitReason);

        var meta = new StartElement("meta-data")
                .setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, ManifestParser.SPLITS_REQUIRED_META))
                .setAttribute(Attribute.bool(NAMESPACE, "value", AndroidAttrs.VALUE, true));
        assertEquals(ManifestParser.SPLITS_REQUIRED_META,
                ManifestParser.parse(manifest(new StartElement("application"), meta)).splitReason);

        var doc = manifest(new StartElement("application"));
        doc.root().setAttribute(Attribute.string(null, "split", 0, "config.arm64_v8a"));
        assertNotNull(ManifestParser.parse(doc).splitReason);
    }
}
