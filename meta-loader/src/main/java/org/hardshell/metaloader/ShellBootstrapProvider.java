package org.hardshell.metaloader;

import android.content.ContentProvider;
import android.content.ContentValues;
import android.content.Context;
import android.database.Cursor;
import android.net.Uri;

/**
 * Injected with a high {@code initOrder}, so the platform creates it before the original app's own providers.
 * By then the platform already holds the stub as the process application. This provider moves those
 * references to the original, so the app's providers see it from {@code getContext()} onward.
 */
public class ShellBootstrapProvider extends ContentProvider {

    @Override
    public boolean onCreate() {
        Context context = getContext();
        if (!(context instanceof ShellApplication)) {
            ShellRuntime.logger().w("Bootstrap provider created outside the shell application: " + context);
            return true;
        }
        var stub = (ShellApplication) context;
        ShellRuntime.loader(stub.getApplicationInfo()).swapReferences(stub, stub.getBaseContext());
        return true;
    }

    @Override
    public Cursor query(Uri uri, String[] projection, String selection, String[] selectionArgs, String sortOrder) {
        return null;
    }

    @Override
    public String getType(Uri uri) {
        return null;
    }

    @Override
    public Uri insert(Uri uri, ContentValues values) {
        return null;
    }

    @Override
    public int delete(Uri uri, String selection, String[] selectionArgs) {
        return 0;
    }

    @Override
    public int update(Uri uri, ContentValues values, String selection, String[] selectionArgs) {
        return 0;
    }
}
