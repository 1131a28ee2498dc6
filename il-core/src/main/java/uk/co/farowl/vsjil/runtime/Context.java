// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime;

/**
 * A handle on the execution context of one instance, passed to every
 * access to a {@link Local}. The storage offered by {@link #locals()}
 * belongs to that instance, and is the only thing a {@code Local} asks
 * of the context.
 * <p>
 * A host may make a new {@code Context} for every call into an
 * instance: values fetched through it belong to the instance, not the
 * handle, and remain valid after the handle is discarded.
 */
public interface Context {

    /**
     * The instance-local storage of the instance this context belongs
     * to.
     *
     * @return the storage of the instance
     */
    LocalStore locals();
}
