/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam.pki;

/**
 * Thrown when an encrypted private key cannot be decrypted, usually because
 * the passphrase is wrong.
 */
public class PemEncryptionException extends PemException {

    private static final long serialVersionUID = 1L;

    PemEncryptionException(Throwable cause) {
        super("Unable to decrypt private key", cause);
    }

    PemEncryptionException(final String message) {
        super(message);
    }
}
