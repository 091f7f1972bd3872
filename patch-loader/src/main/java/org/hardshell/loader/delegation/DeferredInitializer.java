package org.hardshell.loader.delegation;

/**
 * Completes initialization of a subsystem that waits for configuration from the application, such as a
 * background work scheduler.
 */
public interface DeferredInitializer {

    /**
     * Fully qualified name of the interface the application implements to provide the configuration.
     */
    String capability();

    void initialize(Object application, Object baseContext) throws Exception;
}
