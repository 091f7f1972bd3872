package org.hardshell.patch.util;

import org.hardshell.axml.AndroidAttrs;
import org.hardshell.axml.Attribute;
import org.hardshell.axml.AxmlDocument;
import org.hardshell.axml.StartElement;

/**
 * Reads what the packer needs out of a decoded {@code AndroidManifest.xml}.
 */
public class ManifestParser {

    public static final String SPLITS_REQUIRED_META = "com.android.vending.splits.required";

    public static class Manifest {
        public final String packageName;
        /** Fully qualified, or {@code null} when the manifest declares none. */
        public final String applicationClass;
        public final String appComponentFactory;
        public final int minSdkVersion;
        public final int targetSdkVersion;
        /** Non-null when the manifest marks this apk as part of a split installation. */
        public final String splitReason;

        Manifest(String packageName, String applicationClass, String appComponentFactory,
                 int minSdkVersion, int targetSdkVersion, String splitReason) {
            this.packageName = packageName;
            this.applicationClass = applicationClass;
            this.appComponentFactory = appComponentFactory;
            this.minSdkVersion = minSdkVersion;
            this.targetSdkVersion = targetSdkVersion;
            this.splitReason = splitReason;
        }
    }

    public static Manifest parse(AxmlDocument doc) {
        StartElement root = doc.root();
        if (root == null || !"manifest".equals(root.name())) return null;
        String packageName = stringAttr(root.attribute(null, "package"));

        int minSdk = 1;
        int targetSdk = 0;
        var sdk = doc.children(root, "uses-sdk");
        if (!sdk.isEmpty()) {
            minSdk = intAttr(sdk.get(0), AndroidAttrs.MIN_SDK_VERSION, "minSdkVersion", 1);
            targetSdk = intAttr(sdk.get(0), AndroidAttrs.TARGET_SDK_VERSION, "targetSdkVersion", minSdk);
        }

        String splitReason = null;
        if (stringAttr(root.attribute(null, "split")) != null) {
            splitReason = "manifest declares split " + stringAttr(root.attribute(null, "split"));
        }

        String application = null;
        String factory = null;
        var apps = doc.children(root, "application");
        if (!apps.isEmpty()) {
            var app = apps.get(0);
            application = className(packageName, stringAttr(attr(app, AndroidAttrs.NAME, "name")));
            factory = className(packageName, stringAttr(attr(app, AndroidAttrs.APP_COMPONENT_FACTORY, "appComponentFactory")));
            var splitRequired = attr(app, AndroidAttrs.IS_SPLIT_REQUIRED, "isSplitRequired");
            if (splitRequired != null && splitRequired.booleanValue()) {
                splitReason = "application requires splits";
            }
            for (StartElement meta : doc.children(app, "meta-data")) {
                var name = stringAttr(attr(meta, AndroidAttrs.NAME, "name"));
                var value = attr(meta, AndroidAttrs.VALUE, "value");
                if (SPLITS_REQUIRED_META.equals(name) && value != null && value.booleanValue()) {
                    splitReason = SPLITS_REQUIRED_META;
                }
            }
        }
        return new Manifest(packageName, application, factory, minSdk, targetSdk, splitReason);
    }

    /**
     * Resolves {@code .Foo} and bare {@code Foo} against the package like the framework does.
     */
    static String className(String packageName, String name) {
        if (name == null || name.isEmpty()) return null;
        if (name.charAt(0) == '.') return packageName + name;
        if (name.indexOf('.') < 0 && packageName != null) return packageName + "." + name;
        return name;
    }

    public static Attribute attr(StartElement element, int resourceId, String name) {
        var a = element.attribute(resourceId);
        return a != null ? a : element.attribute(AndroidAttrs.NAMESPACE, name);
    }

    private static int intAttr(StartElement element, int resourceId, String name, int fallback) {
        var a = attr(element, resourceId, name);
        return a == null ? fallback : a.intValue(fallback);
    }

    private static String stringAttr(Attribute attribute) {
        if (attribute == null) return null;
        var value = attribute.stringValue();
        return value == null || value.isEmpty() ? null : value;
    }
}
