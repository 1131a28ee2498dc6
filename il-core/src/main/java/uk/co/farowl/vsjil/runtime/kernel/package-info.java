/**
 * The {@code runtime.kernel} package contains internal parts that
 * allocate slot identities and provide the storage of each instance.
 * <p>
 * This package is not exported. Classes {@code public} in this package
 * are accessible across the module, but not to client programs.
 */
package uk.co.farowl.vsjil.runtime.kernel;
