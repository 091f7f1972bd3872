package org.hardshell.metaloader;

import android.app.Application;
import android.content.Context;

/**
 * Declared as the application in hardened manifests. Loads the protected code and attaches the original
 * application while attaching itself, then starts the original in {@link #onCreate()}. References are normally
 * swapped earlier, by {@link ShellBootstrapProvider}.
 */
public class ShellApplication extends Application {

    @Override
    protected void attachBaseContext(Context base) {
        super.attachBaseContext(base);
        var loader = ShellRuntime.loader(base.getApplicationInfo());
        var session = loader.prepare();
        ShellRuntime.installClassLoader(base, session);
        loader.attachOriginal(base);
    }

    @Override
    public void onCreate() {
        super.onCreate();
        var loader = ShellRuntime.loader(getApplicationInfo());
        loader.delegate(this, getBaseContext());
    }
}
