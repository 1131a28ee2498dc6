package uk.co.farowl.vsjilc.app;

import java.util.concurrent.atomic.AtomicInteger;

import uk.co.farowl.vsjil.runtime.Context;
import uk.co.farowl.vsjil.runtime.InstanceContext;
import uk.co.farowl.vsjil.runtime.Local;

/**
 * An extension written by the application author, keeping state for
 * each instance in static {@link Local} slots. Nothing here knows how
 * many instances there are.
 */
class Extension {

    private Extension() {} // static members only

    /** Thread id of the worker that first called in each instance. */
    private static final Local<Long> THREAD_ID = new Local<>(Long.class);

    /** Calls made into each instance. */
    private static final Local<AtomicInteger> CALLS =
            new Local<>(AtomicInteger.class);

    /** Signals the initialiser of {@link #THREAD_ID} declined to run. */
    static class NotReady extends Exception {
        private static final long serialVersionUID = 1L;

        NotReady(String msg) { super(msg); }
    }

    /**
     * Greet the caller, counting the call and naming the thread the
     * instance belongs to. The first call into an instance is refused
     * (to show that a failed initialiser may be retried).
     *
     * @param cx context of the call
     * @return a greeting
     * @throws NotReady on the first call into an instance
     */
    static String greet(InstanceContext cx) throws NotReady {
        int n = CALLS.getOrInitDefault(cx).incrementAndGet();
        long id = THREAD_ID.getOrTryInit(cx, c -> {
            if (n == 1) { throw new NotReady("warming up"); }
            return Thread.currentThread().getId();
        });
        return String.format("hello from thread %d in %s (call %d)", id,
                cx.getInstance().getName(), n);
    }

    /**
     * The thread id recorded in the instance, without initialising it.
     *
     * @param cx context of the call
     * @return the thread id or {@code null}
     */
    static Long threadIdIfKnown(Context cx) { return THREAD_ID.get(cx); }

    /**
     * The number of calls made into the instance.
     *
     * @param cx context of the call
     * @return number of calls
     */
    static int calls(Context cx) {
        return CALLS.getOrInitDefault(cx).get();
    }
}
