/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam.pki;

public class PemEncryptedKeyException extends PemEncryptionException {

    private static final long serialVersionUID = 1L;

    PemEncryptedKeyException() {
        super("Private Key is encrypted, but no passphrase configured");
    }
}
