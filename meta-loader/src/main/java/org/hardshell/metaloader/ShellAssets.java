package org.hardshell.metaloader;

import android.content.Context;

import java.io.IOException;
import java.io.InputStream;

/**
 * Entry point for assets that were encrypted into the payload. They are no longer in the package, so
 * {@code AssetManager} cannot find them; code that reads them opens them here instead.
 */
public final class ShellAssets {

    private ShellAssets() {
    }

    /**
     * Same contract as {@code context.getAssets().open(name)}, for protected and plain assets alike.
     *
     * @param name asset name relative to {@code assets/}
     */
    public static InputStream open(Context context, String name) throws IOException {
        var assets = context.getAssets();
        return ShellRuntime.loader(context.getApplicationInfo()).openAsset(name, assets::open);
    }
}
