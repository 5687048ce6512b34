/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.util;

/**
 * This class has constants for the HTTP headers and values used when talking
 * to OCI services and the instance metadata service.
 */
public class HttpConstants {

    /**
     * Content type
     */
    public static final String CONTENT_TYPE = "Content-Type";

    /**
     * Content length
     */
    public static final String CONTENT_LENGTH = "Content-Length";

    /**
     * Date header, part of the signing string
     */
    public static final String DATE = "date";

    /**
     * The pseudo header naming the method and target of a signed request
     */
    public static final String REQUEST_TARGET = "(request-target)";

    /**
     * Host header, part of the signing string
     */
    public static final String HOST = "host";

    /**
     * SHA-256 digest of the request body, part of the signing string
     */
    public static final String CONTENT_SHA = "x-content-sha256";

    public static final String ACCEPT = "Accept";

    public static final String USER_AGENT = "User-Agent";

    public static final String AUTHORIZATION = "Authorization";

    public static final String APPLICATION_JSON =
        "application/json; charset=UTF-8";

    /**
     * The header a caller can use to correlate a request with service logs
     */
    public static final String OPC_REQUEST_ID = "opc-request-id";

    public static final String userAgent = makeUserAgent();

    private static String makeUserAgent() {
        String os = System.getProperty("os.name");
        String osVersion = System.getProperty("os.version");
        String javaVersion = System.getProperty("java.version");
        String javaVmName = System.getProperty("java.vm.name");
        StringBuilder sb = new StringBuilder();
        sb.append("ocimetrics-java/1.0.0 (")
          .append(os).append("/").append(osVersion)
          .append("; ")
          .append(javaVersion).append("/").append(javaVmName)
          .append(")");
        return sb.toString();
    }
}
