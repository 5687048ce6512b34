/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

/**
 * Thrown when the provider rejects the signature or the credential used for
 * a call. The context that was used is marked invalid; it is not replaced by
 * another context automatically.
 */
public class AuthenticationRejectedException extends OciAuthException {

    private static final long serialVersionUID = 1L;

    private final String identifier;

    /**
     * @hidden
     * @param identifier the identifier of the rejected context
     * @param msg the message
     */
    public AuthenticationRejectedException(String identifier, String msg) {
        super(msg);
        this.identifier = identifier;
    }

    /**
     * Returns the identifier of the context whose credential was rejected.
     *
     * @return the identifier
     */
    public String getIdentifier() {
        return identifier;
    }
}
