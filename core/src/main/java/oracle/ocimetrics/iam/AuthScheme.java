/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

/**
 * The two mutually exclusive ways a credential context authenticates.
 */
public enum AuthScheme {

    /**
     * Bound to the compute instance the process runs on; obtained from the
     * instance metadata service, no stored secret.
     */
    PLATFORM_IDENTITY("instance_principal"),

    /**
     * Bound to a user; an API signing key and a profile of the OCI
     * configuration file.
     */
    USER_PRINCIPAL("config_file");

    private final String method;

    AuthScheme(String method) {
        this.method = method;
    }

    /**
     * Returns the short name of the authentication method used in reports,
     * exports and probe results.
     *
     * @return the method name
     */
    public String getMethod() {
        return method;
    }

    /**
     * Returns the scheme with the given method name or enum name.
     *
     * @param name the name, case insensitive
     * @return the scheme, or null if the name is unknown
     */
    public static AuthScheme fromName(String name) {
        if (name == null) {
            return null;
        }
        for (AuthScheme scheme : values()) {
            if (scheme.method.equalsIgnoreCase(name) ||
                scheme.name().equalsIgnoreCase(name)) {
                return scheme;
            }
        }
        return null;
    }
}
