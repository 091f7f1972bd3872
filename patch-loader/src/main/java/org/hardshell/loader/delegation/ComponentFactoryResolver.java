package org.hardshell.loader.delegation;

import org.hardshell.share.Logger;

/**
 * Resolves the original component factory the first time a component is instantiated. An absent or unloadable
 * factory resolves to {@code null}, which callers treat as default instantiation.
 */
public final class ComponentFactoryResolver<T> {

    private final Class<T> type;
    private final String className;
    private final Logger logger;
    private volatile boolean resolved;
    private T factory;

    public ComponentFactoryResolver(Class<T> type, String className, Logger logger) {
        this.type = type;
        this.className = className;
        this.logger = logger;
    }

    public T resolve(ClassLoader loader) {
        if (resolved) return factory;
        synchronized (this) {
            if (resolved) return factory;
            if (className == null || className.isEmpty()) {
                logger.d("No original component factory, using default instantiation");
            } else {
                try {
                    Class<?> clazz = Class.forName(className, true, loader);
                    var constructor = clazz.getDeclaredConstructor();
                    constructor.setAccessible(true);
                    factory = type.cast(constructor.newInstance());
                    logger.i("Forwarding components to " + className);
                } catch (ReflectiveOperationException | ClassCastException | LinkageError e) {
                    logger.e("Original component factory " + className + " unavailable, using default instantiation", e);
                }
            }
            resolved = true;
            return factory;
        }
    }
}
