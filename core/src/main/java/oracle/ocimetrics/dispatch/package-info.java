/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Choice between the signed REST path and the command line for each
 * outbound call, see {@link oracle.ocimetrics.dispatch.DispatchArbiter}.
 */
package oracle.ocimetrics.dispatch;
