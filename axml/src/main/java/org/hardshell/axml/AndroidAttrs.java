package org.hardshell.axml;

/**
 * Framework attribute resource ids used when reading and patching manifests.
 */
public final class AndroidAttrs {

    public static final String NAMESPACE = "http://schemas.android.com/apk/res/android";

    public static final int NAME = 0x01010003;
    public static final int DEBUGGABLE = 0x0101000f;
    public static final int EXPORTED = 0x01010010;
    public static final int AUTHORITIES = 0x01010018;
    public static final int INIT_ORDER = 0x0101001a;
    public static final int VALUE = 0x01010024;
    public static final int MIN_SDK_VERSION = 0x0101020c;
    public static final int TARGET_SDK_VERSION = 0x01010270;
    public static final int APP_COMPONENT_FACTORY = 0x0101057a;
    public static final int IS_SPLIT_REQUIRED = 0x01010591;

    private AndroidAttrs() {
    }
}
