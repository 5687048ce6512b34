/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam.pki;

/**
 * Thrown when PEM content cannot be decoded into a private key.
 */
public class PemException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    PemException(final String message) {
        this(message, null);
    }

    PemException(final Throwable cause) {
        this(null, cause);
    }

    PemException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
