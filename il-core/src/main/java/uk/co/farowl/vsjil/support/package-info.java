/**
 * The {@code support} package contains API classes that support the
 * instance-local storage without belonging to it, chiefly the errors
 * it throws when an invariant is broken.
 * <p>
 * Classes {@code public} in this package are accessible to a client
 * application that {@code requires} the module in its module
 * declaration.
 */
package uk.co.farowl.vsjil.support;
