/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.util;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;
import static oracle.ocimetrics.util.HttpConstants.CONTENT_LENGTH;
import static oracle.ocimetrics.util.LogUtil.logFine;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import oracle.ocimetrics.RequestTimeoutException;
import oracle.ocimetrics.httpclient.HttpClient;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Utility to issue HTTP requests using {@link HttpClient}.
 * <p>
 * Requests are issued exactly once. A signed request must never be replayed
 * silently, so unlike a general purpose client this utility does not retry
 * on I/O errors or server errors; any retry policy belongs to the caller.
 */
public class HttpRequestUtil {
    private static final Charset utf8 = StandardCharsets.UTF_8;

    /**
     * Issue an HTTP GET request.
     *
     * @param httpClient a HTTP client
     * @param uri the request URI, the path and query of the target
     * @param headers HTTP headers of this request
     * @param timeoutMs request timeout in milliseconds
     * @param logger logger
     * @return HTTP response, a object encapsulate status code and response
     */
    public static HttpResponse doGetRequest(HttpClient httpClient,
                                            String uri,
                                            HttpHeaders headers,
                                            int timeoutMs,
                                            Logger logger) {

        return doRequest(httpClient, uri, headers, HttpMethod.GET,
                         null /* no payload */, timeoutMs, logger);
    }

    /**
     * Issue an HTTP request with the given method.
     *
     * @param httpClient a HTTP client
     * @param uri the request URI, the path and query of the target
     * @param headers HTTP headers of this request
     * @param method the HTTP method
     * @param payload payload in byte array, or null for no body
     * @param timeoutMs request timeout in milliseconds
     * @param logger logger
     * @return HTTP response, a object encapsulate status code and response
     * @throws RequestTimeoutException if the request does not complete in
     * time
     * @throws IllegalStateException if the request fails for any other
     * reason, such as a refused connection
     */
    public static HttpResponse doRequest(HttpClient httpClient,
                                         String uri,
                                         HttpHeaders headers,
                                         HttpMethod method,
                                         byte[] payload,
                                         int timeoutMs,
                                         Logger logger) {

        FullHttpRequest request = buildRequest(uri, headers, method, payload);
        addRequiredHeaders(httpClient, request);
        logFine(logger, method + " " + httpClient.getHost() + uri);

        CompletableFuture<HttpResponse> httpResponse =
            httpClient.runRequest(request, timeoutMs)
            .thenApply(fhr -> {
                if (fhr.status() == null) {
                    throw new IllegalStateException("Invalid null response");
                }
                try {
                    return processResponse(fhr.status().code(),
                                           fhr.content());
                } finally {
                    fhr.release();
                }
            });
        try {
            return httpResponse.get();
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof TimeoutException) {
                throw new RequestTimeoutException(timeoutMs,
                    "Timeout exception: host=" + httpClient.getHost() +
                    " port=" + httpClient.getPort() + " uri=" + uri,
                    cause);
            }
            logFine(logger, "Client execute exception, name: " +
                    (cause == null ? null : cause.getClass().getName()) +
                    ", message: " +
                    (cause == null ? null : cause.getMessage()));
            throw new IllegalStateException(
                "Unable to execute request: " + method + " " +
                httpClient.getHost() + uri +
                (cause == null ? "" : ", " + cause), cause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(
                "Client interrupted exception: ", ie);
        }
    }

    private static FullHttpRequest buildRequest(String requestURI,
                                                HttpHeaders headers,
                                                HttpMethod method,
                                                byte[] payload) {
        final FullHttpRequest request;
        if (payload == null) {
            request = new DefaultFullHttpRequest(HTTP_1_1, method, requestURI);
        } else {
            final ByteBuf buffer = Unpooled.wrappedBuffer(payload);
            request = new DefaultFullHttpRequest(HTTP_1_1, method, requestURI,
                                                 buffer);
            request.headers().setInt(CONTENT_LENGTH, buffer.readableBytes());
        }
        if (headers != null) {
            request.headers().add(headers);
        }
        return request;
    }

    /*
     * Add host and user-agent headers unless the caller already set them.
     * A signed request carries its own host header, which must not change.
     */
    private static void addRequiredHeaders(HttpClient client,
                                           FullHttpRequest request) {
        if (!request.headers().contains(HttpHeaderNames.HOST)) {
            request.headers().set(HttpHeaderNames.HOST, client.getHost());
        }
        if (!request.headers().contains(HttpConstants.USER_AGENT)) {
            request.headers().set(HttpConstants.USER_AGENT,
                                  HttpConstants.userAgent);
        }
    }

    /*
     * A simple response processing method, just return response content
     * in String with its status code.
     */
    private static HttpResponse processResponse(int status, ByteBuf content) {
        String output = null;
        if (content != null) {
            output = content.toString(utf8);
        }
        return new HttpResponse(status, output);
    }

    /**
     * Class to package HTTP response output and status code.
     */
    public static class HttpResponse {
        private final int statusCode;
        private final String output;

        public HttpResponse(int statusCode, String output) {
            this.statusCode = statusCode;
            this.output = output;
        }

        public int getStatusCode() {
            return statusCode;
        }

        public String getOutput() {
            return output;
        }

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }

        @Override
        public String toString() {
            return "HttpResponse [statusCode=" + statusCode + "," +
                   "output=" + output + "]";
        }
    }
}
