package org.hardshell.metaloader;

import android.util.Log;

import org.hardshell.share.Logger;

public class AndroidLogger extends Logger {

    public static final String TAG = "HardShell";

    @Override
    public void d(String msg) {
        if (verbose) Log.d(TAG, msg);
    }

    @Override
    public void i(String msg) {
        Log.i(TAG, msg);
    }

    @Override
    public void w(String msg) {
        Log.w(TAG, msg);
    }

    @Override
    public void e(String msg) {
        Log.e(TAG, msg);
    }

    @Override
    public void e(String msg, Throwable tr) {
        Log.e(TAG, msg, tr);
    }
}
