/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import java.net.URI;

import oracle.ocimetrics.RequestTimeoutException;
import oracle.ocimetrics.util.HttpRequestUtil.HttpResponse;

import io.netty.handler.codec.http.HttpHeaders;

/**
 * Sends one HTTP request, exactly once.
 */
public interface RestTransport {

    /**
     * Sends a request and returns the response, whatever its status.
     *
     * @param method the HTTP method
     * @param uri the absolute target
     * @param headers the request headers, including the signature
     * @param body the body, or null
     * @param timeoutMs request timeout in milliseconds
     * @return the response
     * @throws RequestTimeoutException if no response arrives in time; the
     * request may have reached the service
     * @throws IllegalStateException if the request cannot be sent or the
     * connection fails
     */
    HttpResponse send(String method,
                      URI uri,
                      HttpHeaders headers,
                      byte[] body,
                      int timeoutMs);

    /**
     * Releases the resources of the transport.
     */
    default void close() {
    }
}
