// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime;

import java.util.function.Supplier;

import uk.co.farowl.vsjil.support.ReentrantInitialisationError;

/**
 * The storage behind the {@link Local}s of one instance: a mapping from
 * slot identity to a value of any type. A {@code Local} is responsible
 * for recovering the type of the values it stores. A store knows
 * nothing of the types.
 * <p>
 * Implementations must guarantee that:
 * <ul>
 * <li>A value once stored for a slot is never replaced, so every
 * request for that slot returns the same object.</li>
 * <li>Concurrent first requests for a slot result in a single stored
 * value, whichever thread produced it.</li>
 * <li>A request to initialise a slot, made by the thread already
 * initialising it, throws {@link ReentrantInitialisationError}.</li>
 * <li>A failed initialiser stores nothing.</li>
 * </ul>
 */
public interface LocalStore {

    /**
     * Return the value stored for the slot or {@code null} if it has
     * not (yet) been initialised. This never waits for an initialiser
     * running in another thread.
     *
     * @param cx context of the access
     * @param id identity of the slot
     * @return value stored or {@code null}
     */
    Object lookup(Context cx, long id);

    /**
     * Return the value stored for the slot, first storing the one given
     * if the slot is uninitialised.
     *
     * @param cx context of the access
     * @param id identity of the slot
     * @param value to store if the slot is uninitialised
     * @return value now stored
     */
    Object getOrInit(Context cx, long id, Object value);

    /**
     * Return the value stored for the slot, first storing the result of
     * the producer if the slot is uninitialised.
     *
     * @param cx context of the access
     * @param id identity of the slot
     * @param producer of the value if needed
     * @return value now stored
     */
    Object getOrInitWith(Context cx, long id, Supplier<?> producer);

    /**
     * Return the value stored for the slot, first storing the result of
     * the initialiser if the slot is uninitialised. If the initialiser
     * throws, nothing is stored and the exception reaches the caller.
     *
     * @param <C> type of context
     * @param <E> type of exception the initialiser may throw
     * @param cx context of the access (passed to the initialiser)
     * @param id identity of the slot
     * @param f initialiser of the value if needed
     * @return value now stored
     * @throws E from the initialiser
     */
    <C extends Context, E extends Exception> Object getOrTryInit(C cx,
            long id, Initialiser<? super C, ?, E> f) throws E;
}
