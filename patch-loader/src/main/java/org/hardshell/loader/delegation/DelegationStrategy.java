package org.hardshell.loader.delegation;

/**
 * Knows where one range of platform versions keeps references to the running application.
 */
public interface DelegationStrategy {

    /**
     * Collects every slot that currently holds {@code stub} and should hold {@code original} afterwards.
     */
    ReferenceSwap prepareSwap(Object stub, Object original) throws ReflectiveOperationException;
}
