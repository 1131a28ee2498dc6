// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
/** Instance-local storage for a run-time hosting several instances. */
module uk.co.farowl.ilcore {
    exports uk.co.farowl.vsjil.runtime;
    exports uk.co.farowl.vsjil.support;

    requires transitive org.slf4j;
}
