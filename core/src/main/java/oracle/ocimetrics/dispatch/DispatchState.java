/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

/**
 * The states one call goes through in {@link DispatchArbiter}. SUCCESS and
 * FAILURE are terminal.
 */
public enum DispatchState {
    START,
    REST_ATTEMPT,
    CLI_FALLBACK,
    SUCCESS,
    FAILURE
}
