package org.hardshell.loader;

import java.util.function.Supplier;

/**
 * Runs an initializer at most once per guard and hands every caller the same result. A failed initialization
 * is remembered and rethrown; a nested call from inside the initializer is rejected.
 */
public final class OnceGuard<T> {

    private final Object lock = new Object();
    private volatile T value;
    private RuntimeException failure;
    private Thread initializing;

    public T get(Supplier<T> initializer) {
        T result = value;
        if (result != null) return result;
        synchronized (lock) {
            if (value != null) return value;
            if (failure != null) throw failure;
            if (initializing == Thread.currentThread())
                throw new IllegalStateException("re-entrant initialization");
            initializing = Thread.currentThread();
            try {
                result = initializer.get();
                if (result == null) throw new IllegalStateException("initializer returned null");
                value = result;
                return result;
            } catch (RuntimeException e) {
                failure = e;
                throw e;
            } finally {
                initializing = null;
            }
        }
    }

    public boolean isDone() {
        return value != null;
    }
}
