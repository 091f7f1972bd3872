package org.hardshell.axml;

import java.io.IOException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.hardshell.axml.AndroidAttrs.NAMESPACE;
import static org.junit.jupiter.api.Assertions.*;

final class AxmlDocumentTest {

    static AxmlDocument sampleManifest() {
        var doc = new AxmlDocument();
        doc.append(new StartNamespace(1, null, "android", NAMESPACE));
        var manifest = new StartElement(1, null, null, "manifest")
                .setAttribute(Attribute.string(null, "package", 0, "com.example.app"));
        doc.append(manifest);
        doc.append(new StartElement(2, null, null, "uses-sdk")
                .setAttribute(Attribute.integer(NAMESPACE, "targetSdkVersion", AndroidAttrs.TARGET_SDK_VERSION, 34))
                .setAttribute(Attribute.integer(NAMESPACE, "minSdkVersion", AndroidAttrs.MIN_SDK_VERSION, 24)));
        doc.append(new EndElement(2, null, null, "uses-sdk"));
        var application = new StartElement(3, null, null, "application")
                .setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, ".App"))
                .setAttribute(Attribute.bool(NAMESPACE, "debuggable", AndroidAttrs.DEBUGGABLE, true));
        doc.append(application);
        doc.append(new StartElement(4, null, null, "activity")
                .setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, ".MainActivity")));
        doc.append(new EndElement(4, null, null, "activity"));
        doc.append(new EndElement(5, null, null, "application"));
        doc.append(new EndElement(6, null, null, "manifest"));
        doc.append(new EndNamespace(6, null, "android", NAMESPACE));
        return doc;
    }

    @Test
    void keepsStructureThroughSerialization() throws IOException {
        var parsed = AxmlDocument.parse(sampleManifest().toByteArray());

        assertEquals("manifest", parsed.root().name());
        assertEquals("com.example.app", parsed.root().attribute(null, "package").stringValue());
        var application = parsed.firstElement("application");
        assertEquals(".App", application.attribute(AndroidAttrs.NAME).stringValue());
        assertTrue(application.attribute(AndroidAttrs.DEBUGGABLE).booleanValue());
        assertEquals(NAMESPACE, application.attribute(AndroidAttrs.NAME).namespace());
        var sdk = parsed.firstElement("uses-sdk");
        assertEquals(24, sdk.attribute(AndroidAttrs.MIN_SDK_VERSION).intValue(0));
        assertEquals(34, sdk.attribute(NAMESPACE, "targetSdkVersion").intValue(0));
        assertEquals(10, parsed.nodes().size());
    }

    @Test
    void serializationIsStable() throws IOException {
        byte[] first = sampleManifest().toByteArray();
        byte[] second = AxmlDocument.parse(first).toByteArray();

        assertArrayEquals(first, second);
    }

    @Test
    void attributesStayOrderedByResourceId() {
        var sdk = sampleManifest().firstElement("uses-sdk");

        assertEquals(AndroidAttrs.MIN_SDK_VERSION, sdk.attributes().get(0).resourceId());
        assertEquals(AndroidAttrs.TARGET_SDK_VERSION, sdk.attributes().get(1).resourceId());
    }

    @Test
    void editsSurviveSerialization() throws IOException {
        var doc = sampleManifest();
        var application = doc.firstElement("application");
        application.setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, "org.example.Stub"));
        application.setAttribute(Attribute.string(NAMESPACE, "appComponentFactory",
                AndroidAttrs.APP_COMPONENT_FACTORY, "org.example.Factory"));
        assertTrue(application.removeAttribute(AndroidAttrs.DEBUGGABLE));
        assertFalse(application.removeAttribute(AndroidAttrs.DEBUGGABLE));
        doc.appendChild(application, new StartElement(0, null, null, "meta-data")
                .setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, "original"))
                .setAttribute(Attribute.string(NAMESPACE, "value", AndroidAttrs.VALUE, "com.example.app.App")));

        var parsed = AxmlDocument.parse(doc.toByteArray());
        var patched = parsed.firstElement("application");

        assertEquals("org.example.Stub", patched.attribute(AndroidAttrs.NAME).stringValue());
        assertEquals("org.example.Factory", patched.attribute(AndroidAttrs.APP_COMPONENT_FACTORY).stringValue());
        assertNull(patched.attribute(AndroidAttrs.DEBUGGABLE));
        var meta = parsed.children(patched, "meta-data");
        assertEquals(1, meta.size());
        assertEquals("com.example.app.App", meta.get(0).attribute(AndroidAttrs.VALUE).stringValue());
        assertEquals(1, parsed.children(patched, "activity").size());
        assertTrue(parsed.children(parsed.root(), "meta-data").isEmpty());
    }

    @Test
    void utf8PoolRoundTrips() throws IOException {
        var doc = sampleManifest();
        doc.setUtf8(true);
        doc.firstElement("activity").setAttribute(Attribute.string(null, "label", 0, "Größe été"));

        var parsed = AxmlDocument.parse(doc.toByteArray());

        assertTrue(parsed.isUtf8());
        assertEquals("Größe été", parsed.firstElement("activity").attribute(null, "label").stringValue());
    }

    @Test
    void rejectsGarbageAndTruncation() {
        byte[] bytes = sampleManifest().toByteArray();

        assertThrows(IOException.class, () -> AxmlDocument.parse(new byte[]{1, 2, 3}));
        assertThrows(IOException.class, () -> AxmlDocument.parse(Arrays.copyOf(bytes, bytes.length / 2)));
        assertThrows(IOException.class, () -> AxmlDocument.parse("<manifest/>".getBytes()));
    }
}
