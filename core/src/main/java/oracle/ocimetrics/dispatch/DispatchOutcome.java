/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

/**
 * The path that produced the result of a successful call.
 */
public enum DispatchOutcome {
    /** the signed REST request succeeded */
    REST,
    /** the command line tool succeeded */
    CLI
}
