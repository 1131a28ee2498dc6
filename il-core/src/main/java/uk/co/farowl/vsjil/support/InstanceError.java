// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjil.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when instance-local storage cannot be relied on
 * to work. It is not the error of an initialiser supplied by a client
 * (those reach the caller unchanged) but signals a broken invariant or
 * a misuse of the API: a stored value of the wrong type, a slot with no
 * default, or access to an instance that has been closed.
 */
public class InstanceError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for instance errors. Some of these are thrown during the
     * static initialisation of a client class, where they tend to
     * surface only as an {@code ExceptionInInitializerError} far from
     * the cause: this gives us a second chance to notice.
     */
    static final Logger logger =
            LoggerFactory.getLogger(InstanceError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InstanceError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atDebug().log(getMessage());
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the instance error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InstanceError(Throwable cause, String msg, Object... args) {
        super(String.format(msg, args), cause);
        logger.atDebug().log(getMessage());
        logger.atDebug().log(notNull(cause.getMessage(), "(no message)"));
    }

    /**
     * @param msg a string or {@code null}
     * @param defaultMsg a string or {@code null}
     * @return non-{@code null} {@code msg} or {@code defaultMsg}
     */
    private static String notNull(String msg, String defaultMsg) {
        return msg != null ? msg : defaultMsg;
    }
}
