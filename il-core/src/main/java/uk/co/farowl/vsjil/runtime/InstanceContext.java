// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime;

/**
 * A {@link Context} bound to an {@link Instance}. These are cheap to
 * make and may be discarded freely.
 */
public final class InstanceContext implements Context {

    private final Instance instance;

    /**
     * Create a context of the given instance.
     *
     * @param instance to which this context belongs
     */
    InstanceContext(Instance instance) { this.instance = instance; }

    @Override
    public LocalStore locals() { return instance.locals(); }

    /**
     * The instance to which this context belongs.
     *
     * @return the instance
     */
    public Instance getInstance() { return instance; }

    @Override
    public String toString() { return "Context of " + instance; }
}
