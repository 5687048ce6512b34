/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.Signature;
import java.text.SimpleDateFormat;
import java.util.Base64;
import java.util.Locale;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * @hidden
 * Internal use only
 */
class Utils {
    /* Signing algorithm only rsa-sha256 is allowed */
    static final String RSA = "rsa-sha256";
    static final String RSA_JVM_NAME = "SHA256withRSA";

    /* OCI signature version only version 1 is allowed */
    static final int SIGNATURE_VERSION = 1;

    /* Constants used to build signature */
    static final String HEADER_DELIMITER = ": ";
    static final String SIGNATURE_HEADER_FORMAT =
        "Signature version=\"%s\",keyId=\"%s\",algorithm=\"%s\"," +
        "headers=\"%s\",signature=\"%s\"";
    static final String DATE_FORMAT = "EEE, dd MMM yyyy HH:mm:ss 'GMT'";

    /* a compartment id that is the root compartment names the tenancy */
    private static final Pattern TENANCY_PATTERN =
        Pattern.compile("^ocid1\\.tenancy\\.oc1\\.\\.([^.]+)");

    /**
     * Creates a keyId from the individual components.
     * @param tenantId
     * @param userId
     * @param fingerprint
     * @return The keyId used to sign requests
     */
    static String createKeyId(String tenantId,
                              String userId,
                              String fingerprint) {
        return String.format("%s/%s/%s", tenantId, userId, fingerprint);
    }

    /**
     * Attempts to expand paths that may contain unix-style home shorthand.
     */
    static String expandUserHome(final String path) {
        /* If the home (~) shortcut is used, then attempt to determine correct
         * path. Otherwise, leave as is to allow users to always be able to
         * specify a path without modifying it.
         */
        if (path.startsWith("~/") || path.startsWith("~\\")) {
            return System.getProperty("user.home") +
                   correctPath(isWindows(), path.substring(1));
        }
        return path;
    }

    private static boolean isWindows() {
        String os = System.getProperty("os.name");
        return (os.indexOf("Windows") != -1);
    }

    /*
     * Handle the case where somebody is copying the config file
     * between platforms (or copying examples without changing values)
     */
    private static String correctPath(boolean isWindows, String path) {
        if (isWindows) {
            /* forward slash is reserved, replace with back slash */
            path = path.replace('/', '\\');
        }
        return path;
    }

    static SimpleDateFormat createFormatter() {
        SimpleDateFormat dateFormat = new SimpleDateFormat(DATE_FORMAT,
                                                           Locale.US);
        dateFormat.setTimeZone(TimeZone.getTimeZone("GMT"));
        return dateFormat;
    }

    static String sign(String signingContent, PrivateKey key)
        throws Exception {

        Signature signature = Signature.getInstance(RSA_JVM_NAME);
        signature.initSign(key);
        signature.update(signingContent.getBytes(StandardCharsets.UTF_8));
        byte[] bytes = signature.sign();
        return new String(Base64.getEncoder().encode(bytes),
                          StandardCharsets.UTF_8);
    }

    static String computeBodySHA256(byte[] body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(body == null ? new byte[0] : body);
            byte[] hash = digest.digest();
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Algorithm SHA-256 unavailable", e);
        }
    }

    /**
     * Returns the value of the host header for a URI: the host, followed by
     * the port when the URI names one that is not the default of its scheme.
     */
    static String hostHeader(URI uri) {
        String host = uri.getHost();
        int port = uri.getPort();
        if (port == -1 ||
            ("https".equalsIgnoreCase(uri.getScheme()) && port == 443) ||
            ("http".equalsIgnoreCase(uri.getScheme()) && port == 80)) {
            return host;
        }
        return host + ":" + port;
    }

    /**
     * Returns the path and query of a URI as sent in the request line.
     */
    static String requestTarget(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        String query = uri.getRawQuery();
        return query == null ? path : path + "?" + query;
    }

    /**
     * Derives the tenancy OCID from a compartment OCID, which only works
     * when the compartment is the root compartment.
     *
     * @return the tenancy OCID, or null if the id does not have the form of
     * a tenancy OCID
     */
    static String tenancyFromCompartment(String compartmentId) {
        if (compartmentId == null) {
            return null;
        }
        Matcher m = TENANCY_PATTERN.matcher(compartmentId);
        return m.find() ? m.group(0) : null;
    }
}
