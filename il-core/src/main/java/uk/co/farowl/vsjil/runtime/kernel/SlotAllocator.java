// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime.kernel;

import java.util.concurrent.atomic.AtomicLong;

/**
 * The source of slot identities, unique across the process. Identities
 * are allocated in increasing order from zero and never reused.
 */
public final class SlotAllocator {

    private SlotAllocator() {} // no instances

    /** The next identity to allocate. */
    private static final AtomicLong counter = new AtomicLong();

    /**
     * Allocate a new slot identity. Each call returns a different
     * value, even when called concurrently.
     *
     * @return a new slot identity
     */
    public static long nextId() { return counter.getAndIncrement(); }

    /**
     * The number of identities allocated so far (which is also the
     * next to be allocated).
     *
     * @return number of identities allocated
     */
    static long allocated() { return counter.get(); }
}
