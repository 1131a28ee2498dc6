package uk.co.farowl.vsjilc.app;

import java.util.ArrayList;
import java.util.List;

import uk.co.farowl.vsjil.runtime.Instance;
import uk.co.farowl.vsjil.runtime.InstanceContext;

/**
 * An application hosting several instances of the run-time, one on each
 * of a few worker threads, as a process might if each worker ran its
 * own interpreter. Each worker makes calls into its instance, and the
 * instance-local state in {@link Extension} is kept separately for each.
 */
public class ClientApp {

    /** Number of worker threads (and instances). */
    static final int WORKERS = 3;

    /** Calls each worker makes into its instance. */
    static final int CALLS = 4;

    public static void main(String[] args) throws InterruptedException {

        List<Instance> instances = new ArrayList<>();
        List<Thread> workers = new ArrayList<>();

        for (int i = 0; i < WORKERS; i++) {
            Instance instance = new Instance("worker-" + i);
            instances.add(instance);
            workers.add(new Thread(() -> work(instance), instance.getName()));
        }

        for (Thread t : workers) { t.start(); }
        for (Thread t : workers) { t.join(); }

        /*
         * The main thread may look at each instance too. It finds the
         * values the worker left there, not values of its own.
         */
        for (Instance instance : instances) {
            InstanceContext cx = instance.context();
            System.out.printf("%s: thread id %s, %d calls%n", instance,
                    Extension.threadIdIfKnown(cx), Extension.calls(cx));
            instance.close();
        }
    }

    /**
     * The work of one thread: a few calls into its own instance, each
     * with a fresh context, as a host might make them.
     *
     * @param instance belonging to this thread
     */
    static void work(Instance instance) {
        for (int i = 0; i < CALLS; i++) {
            InstanceContext cx = instance.context();
            try {
                String greeting = Extension.greet(cx);
                System.out.printf("%s call %d: %s%n", instance, i, greeting);
            } catch (Extension.NotReady e) {
                System.out.printf("%s call %d failed: %s%n", instance, i,
                        e.getMessage());
            }
        }
    }
}
