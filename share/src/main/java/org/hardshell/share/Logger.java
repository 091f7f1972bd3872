package org.hardshell.share;

public abstract class Logger {

    public boolean verbose = false;

    abstract public void d(String msg);

    abstract public void i(String msg);

    abstract public void w(String msg);

    abstract public void e(String msg);

    abstract public void e(String msg, Throwable tr);
}
