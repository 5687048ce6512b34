/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static oracle.ocimetrics.util.CheckNull.requireNonBlankIAE;
import static oracle.ocimetrics.util.CheckNull.requireNonNullIAE;

import java.net.URI;
import java.util.Date;
import java.util.Locale;

/**
 * An outbound request to be signed: method, target, body and the time of
 * signing. It is consumed by one call to {@link RequestSigner#sign}.
 */
public class SigningRequest {

    private final String method;
    private final URI uri;
    private final byte[] body;
    private final Date timestamp;

    /**
     * Creates a request signed with the current time.
     *
     * @param method the HTTP method
     * @param uri the absolute target URI
     * @param body the body, null for none
     */
    public SigningRequest(String method, URI uri, byte[] body) {
        this(method, uri, body, new Date());
    }

    /**
     * Creates a request signed with the given time.
     *
     * @param method the HTTP method
     * @param uri the absolute target URI
     * @param body the body, null for none
     * @param timestamp the time that goes in the date header
     */
    public SigningRequest(String method, URI uri, byte[] body,
                          Date timestamp) {
        requireNonBlankIAE(method, "method must be non-empty");
        requireNonNullIAE(uri, "uri must be non-null");
        requireNonNullIAE(timestamp, "timestamp must be non-null");
        if (uri.getHost() == null) {
            throw new IllegalArgumentException(
                "uri must be absolute: " + uri);
        }
        this.method = method.toUpperCase(Locale.ROOT);
        this.uri = uri;
        this.body = (body == null) ? new byte[0] : body;
        this.timestamp = new Date(timestamp.getTime());
    }

    public String getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    public byte[] getBody() {
        return body;
    }

    public Date getTimestamp() {
        return new Date(timestamp.getTime());
    }
}
