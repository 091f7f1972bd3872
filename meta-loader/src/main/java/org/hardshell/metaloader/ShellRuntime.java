package org.hardshell.metaloader;

import android.content.Context;
import android.content.pm.ApplicationInfo;

import org.hardshell.loader.LoaderSession;
import org.hardshell.loader.ShellLoader;
import org.hardshell.loader.delegation.FieldSlot;
import org.hardshell.loader.delegation.ReferenceSwap;
import org.hardshell.loader.delegation.ReferenceSwapException;
import org.hardshell.loader.util.Reflection;

/**
 * The process-wide loader. Whichever stub hook runs first creates it; every later hook gets the same one.
 */
final class ShellRuntime {

    private static final AndroidLogger logger = new AndroidLogger();
    private static ShellLoader loader;

    private ShellRuntime() {
    }

    static synchronized ShellLoader loader(ApplicationInfo appInfo) {
        if (loader == null) {
            logger.verbose = (appInfo.flags & ApplicationInfo.FLAG_DEBUGGABLE) != 0;
            loader = new ShellLoader(new AndroidPlatform(appInfo, ShellRuntime.class.getClassLoader(), logger));
        }
        return loader;
    }

    static AndroidLogger logger() {
        return logger;
    }

    /**
     * Makes {@code LoadedApk} hand out the decrypted code's loader. Needed below API 28, where no component
     * factory gets the chance to replace it.
     */
    static void installClassLoader(Context base, LoaderSession session) {
        var decrypted = session.classLoader();
        try {
            Object loadedApk = Reflection.getObjectField(base, "mPackageInfo");
            var slot = FieldSlot.of(loadedApk, "mClassLoader");
            Object current = slot.get();
            if (current == decrypted) return;
            new ReferenceSwap().replace(slot, current, decrypted).commit();
            logger.d("Replaced LoadedApk class loader");
        } catch (ReflectiveOperationException | ReferenceSwapException e) {
            throw new IllegalStateException("Cannot install decrypted class loader", e);
        }
    }
}
