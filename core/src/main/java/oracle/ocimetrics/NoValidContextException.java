/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

/**
 * Thrown when a call cannot start because no usable credential context is
 * available: the registry is empty, every context is invalid, or the
 * explicitly requested context is unknown or invalid.
 */
public class NoValidContextException extends OciAuthException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public NoValidContextException(String msg) {
        super(msg);
    }
}
