package org.hardshell.loader.delegation;

/**
 * One place where the platform keeps a reference to the application object.
 */
public interface ReferenceSlot {

    Object get() throws ReflectiveOperationException;

    void set(Object value) throws ReflectiveOperationException;
}
