/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

/**
 * Thrown when a request cannot be signed: the credential context is not a
 * user principal, one of its secret fields is missing, or its private key
 * file cannot be read or decoded. Only the call that needed the signature
 * fails, other contexts are unaffected.
 */
public class SigningException extends OciAuthException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public SigningException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     * @param msg the message
     * @param cause the cause
     */
    public SigningException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
