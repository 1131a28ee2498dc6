// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime;

import java.lang.invoke.MethodType;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjil.runtime.kernel.DefaultValues;
import uk.co.farowl.vsjil.runtime.kernel.SlotAllocator;
import uk.co.farowl.vsjil.support.InstanceError;
import uk.co.farowl.vsjil.support.ReentrantInitialisationError;

/**
 * A slot for data local to each instance of the run-time. A
 * {@code Local} is normally declared as a {@code static final} field of
 * a client class, but holds no value itself: each {@link Instance}
 * holds its own value, reached through the {@link Context} given to
 * every accessor. For example, to remember in each instance the thread
 * that first used it:
 * <pre>{@code
 * static final Local<Thread> FIRST = new Local<>(Thread.class);
 *
 * static Thread firstThread(Context cx) {
 *     return FIRST.getOrInitWith(cx, Thread::currentThread);
 * }
 * }</pre>
 * Constructing a {@code Local} has no side effects, so it is safe in
 * the static initialisation of any class. The slot identity by which
 * instances know it is allocated on first use, exactly once, however
 * many threads race to use it.
 * <p>
 * The value of a slot in an instance is created at most once. Once
 * stored, every access in that instance returns the same object, until
 * the instance is closed. A reference obtained through one context
 * remains good after that context is discarded: it belongs to the
 * instance. Values should be immutable or thread-safe if the instance
 * may be entered by more than one thread.
 *
 * @param <T> type of value held in each instance
 */
public final class Local<T> {

    /** Logger for slot identity allocation. */
    private static final Logger logger =
            LoggerFactory.getLogger(Local.class);

    /** Value of {@link #id} before it has been allocated. */
    private static final long UNRESOLVED = -1L;

    /**
     * Type of value this slot holds, used to check values recovered
     * from the store and to find a default. May be {@code null}.
     */
    private final Class<T> type;

    /** Supplies the default value of the slot. May be {@code null}. */
    private final Supplier<? extends T> initial;

    /** Guards allocation of {@link #id}. */
    private final Object lock = new Object();

    /** Identity of this slot or {@link #UNRESOLVED}. */
    private volatile long id = UNRESOLVED;

    /**
     * Default rule derived from {@link #type} or {@link #initial}. This
     * is computed when first needed. A race to compute it is harmless.
     */
    private volatile Supplier<? extends T> defaultRule;

    /**
     * Create a slot with no check on the type of the values recovered
     * and no default value.
     */
    public Local() { this(null, null); }

    /**
     * Create a slot for values of a given class. Values recovered from
     * instances are checked to be of this class, and the default value
     * (see {@link #getOrInitDefault(Context)}) is derived from it.
     *
     * @param type of value held in each instance
     */
    public Local(Class<T> type) { this(type, null); }

    /**
     * Create a slot with a rule for the default value (see
     * {@link #getOrInitDefault(Context)}).
     *
     * @param initial supplies the default value
     */
    public Local(Supplier<? extends T> initial) { this(null, initial); }

    /**
     * Create a slot for values of a given class, with a rule for the
     * default value (see {@link #getOrInitDefault(Context)}).
     *
     * A primitive class stands for its wrapper, so that
     * {@code new Local<>(int.class)} holds {@code Integer} values.
     *
     * @param type of value held in each instance (or {@code null})
     * @param initial supplies the default value (or {@code null})
     */
    public Local(Class<T> type, Supplier<? extends T> initial) {
        this.type = wrap(type);
        this.initial = initial;
    }

    /**
     * Return the value of this slot in the instance of the context, or
     * {@code null} if it has not been initialised there. This does not
     * initialise the slot.
     *
     * @param cx context of the access
     * @return the value or {@code null}
     */
    public T get(Context cx) {
        return recover(cx.locals().lookup(cx, id()));
    }

    /**
     * Return the value of this slot in the instance of the context,
     * first storing the given value if it has not been initialised
     * there. If there is already a value, the one given is discarded.
     *
     * @param cx context of the access
     * @param value to store if the slot is uninitialised
     * @return the value (perhaps the one given)
     * @throws ReentrantInitialisationError if called by an initialiser
     *     of this slot in the same instance
     */
    public T getOrInit(Context cx, T value) {
        Objects.requireNonNull(value, "value of Local");
        return recover(cx.locals().getOrInit(cx, id(), value));
    }

    /**
     * Return the value of this slot in the instance of the context,
     * first storing the result of {@code f} if it has not been
     * initialised there. {@code f} is not called if there is already a
     * value.
     *
     * @param cx context of the access
     * @param f produces the value if needed
     * @return the value
     * @throws ReentrantInitialisationError if called by an initialiser
     *     of this slot in the same instance
     */
    public T getOrInitWith(Context cx, Supplier<? extends T> f) {
        return recover(cx.locals().getOrInitWith(cx, id(), f));
    }

    /**
     * Return the value of this slot in the instance of the context,
     * first storing the result of {@code f} if it has not been
     * initialised there. {@code f} is not called if there is already a
     * value. If {@code f} throws, nothing is stored, the exception
     * reaches the caller, and a later call may try again.
     * <p>
     * During the execution of {@code f}, any call that would initialise
     * this slot in the same instance, from the thread executing
     * {@code f}, throws {@link ReentrantInitialisationError}. Another
     * thread making such a call waits for {@code f} to finish.
     *
     * @param <C> type of context
     * @param <E> type of exception {@code f} may throw
     * @param cx context of the access (passed to {@code f})
     * @param f produces the value if needed
     * @return the value
     * @throws E from {@code f}
     * @throws ReentrantInitialisationError if called by an initialiser
     *     of this slot in the same instance
     */
    public <C extends Context, E extends Exception> T getOrTryInit(C cx,
            Initialiser<? super C, ? extends T, E> f) throws E {
        return recover(cx.locals().getOrTryInit(cx, id(), f));
    }

    /**
     * Return the value of this slot in the instance of the context,
     * first storing the default value if it has not been initialised
     * there. The default value is given by the supplier passed to the
     * constructor, if there was one. Otherwise, it is derived from the
     * type given to the constructor: zero or {@code false} for the
     * wrapper of a primitive type, the empty string for
     * {@code String}, or else a new object made by the public
     * constructor taking no arguments.
     *
     * @param cx context of the access
     * @return the value
     * @throws InstanceError if the slot is not initialised and there is
     *     no way to make a default value
     * @throws ReentrantInitialisationError if called by an initialiser
     *     of this slot in the same instance
     */
    public T getOrInitDefault(Context cx) {
        // The rule is needed only if this call initialises the slot.
        return getOrInitWith(cx, () -> defaultRule().get());
    }

    /**
     * The identity of this slot, allocated on the first call.
     *
     * @return identity of this slot
     */
    long id() {
        long i = id;
        if (i == UNRESOLVED) {
            synchronized (lock) {
                if ((i = id) == UNRESOLVED) {
                    id = i = SlotAllocator.nextId();
                    logger.atDebug().setMessage("Allocated slot {} to {}")
                            .addArgument(i).addArgument(this::typeName)
                            .log();
                }
            }
        }
        return i;
    }

    /**
     * Cast a value obtained from the store to the type of this slot.
     * Only this {@code Local} stores values under its identity, and
     * only values of type {@code T}, so the cast is safe. When we know
     * the class we check it anyway.
     *
     * @param value from the store (or {@code null})
     * @return {@code value} as a {@code T}
     */
    @SuppressWarnings("unchecked")
    private T recover(Object value) {
        if (type != null && value != null && !type.isInstance(value)) {
            throw new InstanceError("slot %d holds %s where %s expected",
                    id, value.getClass().getName(), type.getName());
        }
        return (T)value;
    }

    /** The wrapper class of a primitive type, or the class itself. */
    @SuppressWarnings("unchecked")
    private static <T> Class<T> wrap(Class<T> type) {
        if (type == null || !type.isPrimitive()) { return type; }
        return (Class<T>)MethodType.methodType(type).wrap().returnType();
    }

    /**
     * Find the rule for the default value of the slot, which is the
     * supplier given to the constructor, or derived from the type.
     *
     * @return supplier of the default value
     * @throws InstanceError if there is no way to make a default value
     */
    private Supplier<? extends T> defaultRule() {
        Supplier<? extends T> rule = defaultRule;
        if (rule == null) {
            if (initial != null) {
                rule = initial;
            } else if (type != null) {
                rule = DefaultValues.forClass(type);
            } else {
                throw new InstanceError("no default for %s", this);
            }
            defaultRule = rule;
        }
        return rule;
    }

    private String typeName() {
        return type == null ? "?" : type.getSimpleName();
    }

    @Override
    public String toString() {
        long i = id;
        return String.format("Local<%s>[%s]", typeName(),
                i == UNRESOLVED ? "unresolved" : Long.toString(i));
    }
}
