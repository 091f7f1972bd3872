package org.hardshell.loader.delegation;

/**
 * The only way the loader touches the original application, whose classes it was never compiled against.
 */
public interface ApplicationContract {

    Object construct(ClassLoader loader, String className) throws ReflectiveOperationException;

    /**
     * Runs the platform's attach sequence with the process base context.
     */
    void attach(Object application, Object baseContext) throws ReflectiveOperationException;

    /**
     * Invokes the application's own startup callback.
     */
    void start(Object application) throws ReflectiveOperationException;

    /**
     * @param capability fully qualified interface name
     */
    boolean probe(Object application, String capability);
}
