// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime.kernel;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjil.runtime.Context;
import uk.co.farowl.vsjil.runtime.Initialiser;
import uk.co.farowl.vsjil.runtime.LocalStore;
import uk.co.farowl.vsjil.support.InstanceError;
import uk.co.farowl.vsjil.support.ReentrantInitialisationError;

/**
 * The storage of instance-local values for one instance. There is one
 * {@code InstanceLocals} for each instance, created and closed with it.
 * <p>
 * <b>Concurrency:</b> Published values are held in a concurrent map,
 * from which they are read without locking. A value is only added to
 * that map by the thread that has claimed the slot for initialisation,
 * and is never replaced, so each slot publishes exactly one value.
 * <p>
 * A claim is made and released while holding the lock of the store,
 * but the lock is not held while the initialiser runs. An initialiser
 * may therefore use other slots of the same instance, and other threads
 * may initialise other slots meanwhile. A thread that wants a slot
 * another thread has claimed waits until the claim is released. A
 * thread that wants a slot it has claimed itself has re-entered the
 * initialisation, and that is an error.
 */
public class InstanceLocals implements LocalStore {

    /** Logger for instance-local storage. */
    static final Logger logger =
            LoggerFactory.getLogger(InstanceLocals.class);

    /** The owning instance, for messages only. */
    private final Object owner;

    /**
     * The published values. A value appears here only once the
     * initialiser has completed successfully.
     */
    private final Map<Long, Object> values = new ConcurrentHashMap<>();

    /**
     * Slots being initialised, mapped to the thread initialising them.
     * This is guarded by {@link #lock}.
     */
    private final Map<Long, Thread> initialising = new HashMap<>();

    /** Guards {@link #initialising} and the publication of values. */
    private final ReentrantLock lock = new ReentrantLock();

    /** Signalled when a claim on a slot is released. */
    private final Condition released = lock.newCondition();

    /** Set when the instance closes. Written only under the lock. */
    private volatile boolean closed;

    /**
     * Create the storage for one instance.
     *
     * @param owner the instance (used to describe it in messages)
     */
    public InstanceLocals(Object owner) { this.owner = owner; }

    @Override
    public Object lookup(Context cx, long id) {
        checkOpen();
        return values.get(id);
    }

    @Override
    public Object getOrInit(Context cx, long id, Object value) {
        Objects.requireNonNull(value, "value of Local");
        return this.<Context, RuntimeException> getOrTryInit(cx, id,
                c -> value);
    }

    @Override
    public Object getOrInitWith(Context cx, long id,
            Supplier<?> producer) {
        return this.<Context, RuntimeException> getOrTryInit(cx, id,
                c -> producer.get());
    }

    @Override
    public <C extends Context, E extends Exception> Object getOrTryInit(
            C cx, long id, Initialiser<? super C, ?, E> f) throws E {

        // Fast path: published values never change.
        Object value = values.get(id);
        if (value != null) { return value; }

        // Slow path: publish a value or wait while another thread does.
        if ((value = claim(id)) != null) { return value; }

        /*
         * This thread has claimed the slot. No other thread will run an
         * initialiser for it until we release the claim, and a call from
         * this thread to initialise it again will be refused.
         */
        boolean succeeded = false;
        try {
            logger.atDebug().setMessage("Initialising slot {} in {}")
                    .addArgument(id).addArgument(owner).log();
            value = f.initialise(cx);
            Objects.requireNonNull(value, "initialiser of Local");
            succeeded = true;
        } finally {
            if (!succeeded) {
                // Whatever f threw is on its way to the caller.
                logger.atDebug()
                        .setMessage("Initialiser of slot {} in {} failed")
                        .addArgument(id).addArgument(owner).log();
                release(id, null);
            }
        }
        release(id, value);
        return value;
    }

    /**
     * Claim the slot for initialisation by the current thread, or
     * return the value if it has been published (perhaps while we
     * waited for the claim of another thread).
     *
     * @param id identity of the slot
     * @return published value or {@code null} if the claim was granted
     * @throws ReentrantInitialisationError if this thread holds the
     *     claim already
     * @throws InstanceError if the instance has closed
     */
    private Object claim(long id) {
        Thread current = Thread.currentThread();
        lock.lock();
        try {
            while (true) {
                checkOpen();
                Object value = values.get(id);
                if (value != null) { return value; }
                Thread holder = initialising.get(id);
                if (holder == null) {
                    initialising.put(id, current);
                    return null;
                } else if (holder == current) {
                    logger.atWarn().setMessage(
                            "Re-entrant initialisation of slot {} in {}")
                            .addArgument(id).addArgument(owner).log();
                    throw new ReentrantInitialisationError(id, owner);
                }
                // Some other thread is initialising the slot.
                released.awaitUninterruptibly();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release the claim of the current thread on the slot, publishing
     * the value if not {@code null}, and wake any threads waiting on
     * claims.
     *
     * @param id identity of the slot
     * @param value to publish or {@code null} to publish nothing
     */
    private void release(long id, Object value) {
        lock.lock();
        try {
            assert initialising.get(id) == Thread.currentThread();
            initialising.remove(id);
            // If the instance closed meanwhile, the value dies with it.
            if (value != null && !closed) { values.put(id, value); }
            released.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discard all the values and refuse further access. Threads waiting
     * for a claim on a slot will wake and throw {@link InstanceError}.
     *
     * @return {@code true} if this call closed the store, {@code false}
     *     if it was already closed
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) { return false; }
            closed = true;
            values.clear();
            released.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether {@link #close()} has been called.
     *
     * @return {@code true} if closed
     */
    public boolean isClosed() { return closed; }

    /**
     * The number of slots that have published values.
     *
     * @return number of initialised slots
     */
    public int size() { return values.size(); }

    private void checkOpen() {
        if (closed) { throw new InstanceError("%s is closed", owner); }
    }

    @Override
    public String toString() {
        return String.format("InstanceLocals[%s, %d slots]", owner,
                values.size());
    }
}
