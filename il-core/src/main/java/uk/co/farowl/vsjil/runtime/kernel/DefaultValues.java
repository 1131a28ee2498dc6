// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime.kernel;

import static java.lang.invoke.MethodType.methodType;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.util.Map;
import java.util.function.Supplier;

import uk.co.farowl.vsjil.support.InstanceError;

/**
 * Rules for making the default value of a class, where a slot is asked
 * for one without having been given a rule of its own.
 */
public final class DefaultValues {

    private DefaultValues() {} // no instances

    /** Immutable defaults for the wrappers of primitives and string. */
    private static final Map<Class<?>, Object> ZEROS = Map.of( //
            Boolean.class, Boolean.FALSE, //
            Byte.class, (byte)0, //
            Short.class, (short)0, //
            Character.class, '\0', //
            Integer.class, 0, //
            Long.class, 0L, //
            Float.class, 0.0f, //
            Double.class, 0.0, //
            String.class, "");

    /**
     * Return a supplier of the default value of the given class. For
     * the wrapper of a primitive type, this is zero (or {@code false}).
     * For {@code String} it is the empty string. For other classes it
     * calls the public constructor that takes no arguments.
     *
     * @param <T> type of value
     * @param c class of value
     * @return supplier of the default value
     * @throws InstanceError if there is no such rule
     */
    public static <T> Supplier<T> forClass(Class<T> c) {
        Object zero = ZEROS.get(c);
        if (zero != null) {
            T value = c.cast(zero);
            return () -> value;
        }

        MethodHandle cons;
        try {
            cons = MethodHandles.publicLookup().findConstructor(c,
                    methodType(void.class));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new InstanceError(e, "no default value for class %s",
                    c.getName());
        }

        return () -> {
            try {
                return c.cast(cons.invoke());
            } catch (RuntimeException | Error e) {
                throw e;
            } catch (Throwable t) {
                throw new InstanceError(t, "constructing default %s",
                        c.getName());
            }
        };
    }
}
