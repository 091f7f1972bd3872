package org.hardshell.patch.task;

import org.hardshell.axml.AndroidAttrs;
import org.hardshell.axml.Attribute;
import org.hardshell.axml.AxmlDocument;
import org.hardshell.axml.StartElement;
import org.hardshell.patch.util.ManifestParser;
import org.hardshell.share.Constants;

import static org.hardshell.axml.AndroidAttrs.NAMESPACE;

/**
 * Points the manifest at the stub, records where the original entry points went and declares the bootstrap
 * provider.
 */
public class ManifestPatchTask {

    private final boolean debuggable;

    public ManifestPatchTask(boolean debuggable) {
        this.debuggable = debuggable;
    }

    /**
     * @param originalApplication fully qualified original application class, never {@code null}
     * @param originalFactory     fully qualified original component factory, or {@code null}
     */
    public byte[] patch(AxmlDocument doc, String originalApplication, String originalFactory) {
        var root = doc.root();
        var apps = doc.children(root, "application");
        StartElement app;
        if (apps.isEmpty()) {
            app = new StartElement("application");
            doc.appendChild(root, app);
        } else {
            app = apps.get(0);
        }

        app.setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, Constants.STUB_APPLICATION));
        app.setAttribute(Attribute.string(NAMESPACE, "appComponentFactory", AndroidAttrs.APP_COMPONENT_FACTORY,
                Constants.STUB_APP_COMPONENT_FACTORY));
        if (debuggable) {
            app.setAttribute(Attribute.bool(NAMESPACE, "debuggable", AndroidAttrs.DEBUGGABLE, true));
        } else {
            app.removeAttribute(AndroidAttrs.DEBUGGABLE);
        }

        putMetaData(doc, app, Constants.META_ORIGINAL_APPLICATION, originalApplication);
        if (originalFactory != null) putMetaData(doc, app, Constants.META_ORIGINAL_FACTORY, originalFactory);
        putBootstrapProvider(doc, app, root.attribute(null, "package"));
        return doc.toByteArray();
    }

    private static void putBootstrapProvider(AxmlDocument doc, StartElement app, Attribute packageName) {
        for (StartElement provider : doc.children(app, "provider")) {
            var n = ManifestParser.attr(provider, AndroidAttrs.NAME, "name");
            if (n != null && Constants.STUB_BOOTSTRAP_PROVIDER.equals(n.stringValue())) return;
        }
        String pkg = packageName == null ? null : packageName.stringValue();
        String authority = pkg == null || pkg.isEmpty()
                ? Constants.BOOTSTRAP_PROVIDER_AUTHORITY_SUFFIX.substring(1)
                : pkg + Constants.BOOTSTRAP_PROVIDER_AUTHORITY_SUFFIX;
        doc.appendChild(app, new StartElement("provider")
                .setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, Constants.STUB_BOOTSTRAP_PROVIDER))
                .setAttribute(Attribute.bool(NAMESPACE, "exported", AndroidAttrs.EXPORTED, false))
                .setAttribute(Attribute.string(NAMESPACE, "authorities", AndroidAttrs.AUTHORITIES, authority))
                .setAttribute(Attribute.integer(NAMESPACE, "initOrder", AndroidAttrs.INIT_ORDER,
                        Constants.BOOTSTRAP_PROVIDER_INIT_ORDER)));
    }

    private static void putMetaData(AxmlDocument doc, StartElement app, String name, String value) {
        for (StartElement meta : doc.children(app, "meta-data")) {
            var n = ManifestParser.attr(meta, AndroidAttrs.NAME, "name");
            if (n != null && name.equals(n.stringValue())) {
                meta.setAttribute(Attribute.string(NAMESPACE, "value", AndroidAttrs.VALUE, value));
                return;
            }
        }
        doc.appendChild(app, new StartElement("meta-data")
                .setAttribute(Attribute.string(NAMESPACE, "name", AndroidAttrs.NAME, name))
                .setAttribute(Attribute.string(NAMESPACE, "value", AndroidAttrs.VALUE, value)));
    }
}
