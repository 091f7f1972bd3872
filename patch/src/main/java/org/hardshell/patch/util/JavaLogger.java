package org.hardshell.patch.util;

import org.hardshell.share.Logger;

public class JavaLogger extends Logger {

    @Override
    public void d(String msg) {
        if (verbose) System.out.println(msg);
    }

    @Override
    public void i(String msg) {
        System.out.println(msg);
    }

    @Override
    public void w(String msg) {
        System.err.println("Warning: " + msg);
    }

    @Override
    public void e(String msg) {
        System.err.println(msg);
    }

    @Override
    public void e(String msg, Throwable tr) {
        System.err.println(msg);
        if (verbose) tr.printStackTrace(System.err);
        else System.err.println("  " + tr);
    }
}
