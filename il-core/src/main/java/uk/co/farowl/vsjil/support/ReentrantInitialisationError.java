// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.support;

/**
 * Thrown when the initialiser of a slot, directly or indirectly, asks
 * to initialise that same slot in the same instance. The thread that
 * would have to wait for the answer is the one that must produce it, so
 * the call fails rather than deadlock or return a value not yet made.
 * <p>
 * This is a programming error in the initialiser. It is not retried and
 * should not be caught except to report it.
 */
public class ReentrantInitialisationError extends InstanceError {
    private static final long serialVersionUID = 1L;

    /** The identity of the slot being initialised. */
    private final long slot;

    /**
     * Create an error reporting reentrant initialisation of a slot.
     *
     * @param slot identity of the slot
     * @param instance description of the instance (for the message)
     */
    public ReentrantInitialisationError(long slot, Object instance) {
        super("slot %d of %s is already being initialised by this thread",
                slot, instance);
        this.slot = slot;
    }

    /**
     * The identity of the slot being initialised when the error arose.
     *
     * @return slot identity
     */
    public long getSlot() { return slot; }
}
