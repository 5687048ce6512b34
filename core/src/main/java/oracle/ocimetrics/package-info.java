/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Authentication against Oracle Cloud Infrastructure and dispatch of calls
 * over signed REST or the <code>oci</code> command line.
 * <p>
 * {@link oracle.ocimetrics.AuthenticationManager} is the entry point. It is
 * built from an {@link oracle.ocimetrics.AuthConfig} and owns everything it
 * uses, so separate instances do not share state. Errors are reported with
 * the unchecked exceptions of this package, all extending
 * {@link oracle.ocimetrics.OciAuthException}.
 */
package oracle.ocimetrics;
