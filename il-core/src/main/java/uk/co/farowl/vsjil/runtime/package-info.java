/**
 * The {@code runtime} package provides instance-local storage: static
 * declarations of {@link uk.co.farowl.vsjil.runtime.Local} slots whose
 * values are held separately by each {@link
 * uk.co.farowl.vsjil.runtime.Instance} of the run-time hosted in the
 * process.
 * <p>
 * A slot is declared once, typically as a {@code static final} field,
 * and costs nothing until first used. Each instance then holds at most
 * one value for it, created at most once and kept until the instance is
 * closed. Instances never see each other's values.
 * <pre>{@code
 * static final Local<Long> THREAD_ID = new Local<>(Long.class);
 *
 * static long threadId(Context cx) {
 *     return THREAD_ID.getOrInitWith(cx,
 *             () -> Thread.currentThread().getId());
 * }
 * }</pre>
 * Classes {@code public} in this package are accessible to a client
 * application that {@code requires} the module in its module
 * declaration.
 */
package uk.co.farowl.vsjil.runtime;
