/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

/**
 * The OCI services the built-in operations call, with the format of their
 * regional endpoints.
 */
public enum Service {

    IDENTITY("https://identity.%s.oci.oraclecloud.com"),

    /** Monitoring, which serves metrics */
    TELEMETRY("https://telemetry.%s.oraclecloud.com"),

    /** Core services, which serve compute instances */
    CORE("https://iaas.%s.oraclecloud.com");

    private final String endpointFormat;

    Service(String endpointFormat) {
        this.endpointFormat = endpointFormat;
    }

    /**
     * Returns the endpoint of the service in a region.
     *
     * @param region the region identifier, e.g. us-ashburn-1
     * @return the endpoint URL, without a trailing slash
     */
    public String endpoint(String region) {
        return String.format(endpointFormat, region);
    }
}
