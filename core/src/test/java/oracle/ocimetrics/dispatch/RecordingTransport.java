/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import oracle.ocimetrics.util.HttpRequestUtil.HttpResponse;

import io.netty.handler.codec.http.HttpHeaders;

/**
 * A {@link RestTransport} that records its calls and answers with a fixed
 * response or failure.
 */
public class RecordingTransport implements RestTransport {

    private final List<String> events;
    private final List<URI> uris = new ArrayList<>();
    private final List<HttpHeaders> headers = new ArrayList<>();
    private volatile HttpResponse response = new HttpResponse(200, "[]");
    private volatile RuntimeException failure;
    private volatile boolean closed;

    /**
     * @param events shared call log, "REST" is appended for each call
     */
    public RecordingTransport(List<String> events) {
        this.events = events;
    }

    public RecordingTransport respond(int status, String body) {
        this.response = new HttpResponse(status, body);
        this.failure = null;
        return this;
    }

    public RecordingTransport fail(RuntimeException e) {
        this.failure = e;
        return this;
    }

    public synchronized List<URI> getUris() {
        return Collections.unmodifiableList(new ArrayList<>(uris));
    }

    public synchronized List<HttpHeaders> getHeaders() {
        return Collections.unmodifiableList(new ArrayList<>(headers));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized HttpResponse send(String method,
                                          URI uri,
                                          HttpHeaders requestHeaders,
                                          byte[] body,
                                          int timeoutMs) {
        events.add("REST");
        uris.add(uri);
        headers.add(requestHeaders);
        if (failure != null) {
            throw failure;
        }
        return response;
    }

    @Override
    public void close() {
        closed = true;
    }
}
