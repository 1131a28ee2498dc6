// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime;

/**
 * A producer of the value of an instance-local slot that may fail. It
 * is given the context in which the slot is being accessed, and may use
 * it (for example, to read other slots of the same instance).
 *
 * @param <C> type of context
 * @param <T> type of value produced
 * @param <E> type of exception signalling failure
 */
@FunctionalInterface
public interface Initialiser<C extends Context, T, E extends Exception> {

    /**
     * Produce the initial value of a slot.
     *
     * @param cx the context in which the slot is accessed
     * @return the value (not {@code null})
     * @throws E on failure, leaving the slot uninitialised
     */
    T initialise(C cx) throws E;
}
