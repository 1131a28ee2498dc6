// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.runtime;

import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjil.runtime.kernel.InstanceLocals;
import uk.co.farowl.vsjil.support.InstanceError;

/**
 * One isolated instance of the run-time, with its own value for every
 * {@link Local} used in it. Several instances may exist in the same
 * process, typically one for each thread that hosts one, but nothing
 * prevents several threads entering the same instance.
 * <p>
 * Code running in the instance reaches its values through a
 * {@link Context} obtained from {@link #context()}. When the instance
 * is closed its values are discarded and further access fails with an
 * {@link InstanceError}.
 */
public class Instance implements AutoCloseable {

    /** Logger for instance life-cycle events. */
    static final Logger logger = LoggerFactory.getLogger(Instance.class);

    /** Source of serial numbers for instances. */
    private static final AtomicLong serial = new AtomicLong();

    /** Serial number of this instance in the process. */
    private final long number;

    /** Name of the instance (for messages). */
    private final String name;

    /** The instance-local storage of this instance. */
    private final InstanceLocals locals;

    /**
     * Create an instance with the given name. The name need not be
     * unique: each instance also has a serial number.
     *
     * @param name of the instance
     */
    public Instance(String name) {
        this.number = serial.incrementAndGet();
        this.name = name;
        this.locals = new InstanceLocals(this);
        logger.atInfo().setMessage("Created {}").addArgument(this).log();
    }

    /**
     * Return a handle through which code running in this instance may
     * access its instance-local values.
     *
     * @return a context of this instance
     */
    public InstanceContext context() { return new InstanceContext(this); }

    /**
     * The storage of this instance.
     *
     * @return the storage of this instance
     */
    LocalStore locals() { return locals; }

    /**
     * The number of slots initialised in this instance.
     *
     * @return number of initialised slots
     */
    public int size() { return locals.size(); }

    /**
     * The name given to this instance when it was created.
     *
     * @return name of the instance
     */
    public String getName() { return name; }

    /**
     * Whether {@link #close()} has been called.
     *
     * @return {@code true} if closed
     */
    public boolean isClosed() { return locals.isClosed(); }

    /**
     * Close this instance, discarding all its instance-local values.
     * Closing an instance that is already closed has no effect.
     */
    @Override
    public void close() {
        if (locals.close()) {
            logger.atInfo().setMessage("Closed {}").addArgument(this)
                    .log();
        }
    }

    @Override
    public String toString() {
        return String.format("Instance '%s' #%d", name, number);
    }
}
