/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import java.net.URI;
import java.util.logging.Logger;

import javax.net.ssl.SSLException;

import oracle.ocimetrics.httpclient.HttpClient;
import oracle.ocimetrics.util.HttpRequestUtil;
import oracle.ocimetrics.util.HttpRequestUtil.HttpResponse;

import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

/**
 * {@link RestTransport} on top of the Netty {@link HttpClient}. Every call
 * uses its own client and connection, which are closed when it returns.
 */
public class NettyRestTransport implements RestTransport {

    private final String proxyHost;
    private final int proxyPort;
    private final Logger logger;

    /* created on the first https request */
    private volatile SslContext sslCtx;

    /**
     * @param proxyHost HTTP proxy host, or null
     * @param proxyPort HTTP proxy port, 0 if there is no proxy
     * @param logger logger
     */
    public NettyRestTransport(String proxyHost, int proxyPort, Logger logger) {
        this.proxyHost = proxyHost;
        this.proxyPort = proxyPort;
        this.logger = logger;
    }

    @Override
    public HttpResponse send(String method,
                             URI uri,
                             HttpHeaders headers,
                             byte[] body,
                             int timeoutMs) {
        boolean https = "https".equalsIgnoreCase(uri.getScheme());
        int port = uri.getPort();
        if (port == -1) {
            port = https ? 443 : 80;
        }
        String target = uri.getRawPath();
        if (target == null || target.isEmpty()) {
            target = "/";
        }
        if (uri.getRawQuery() != null) {
            target = target + "?" + uri.getRawQuery();
        }

        HttpClient client = HttpClient.createMinimalClient(
            uri.getHost(), port, https ? sslContext() : null, 0,
            "RestClient", logger);
        try {
            if (proxyHost != null) {
                client.configureProxy(proxyHost, proxyPort);
            }
            return HttpRequestUtil.doRequest(client, target, headers,
                                             HttpMethod.valueOf(method),
                                             body, timeoutMs, logger);
        } finally {
            client.shutdown();
        }
    }

    private SslContext sslContext() {
        if (sslCtx == null) {
            synchronized (this) {
                if (sslCtx == null) {
                    try {
                        sslCtx = SslContextBuilder.forClient().build();
                    } catch (SSLException se) {
                        throw new IllegalStateException(
                            "Unable to create SSL context", se);
                    }
                }
            }
        }
        return sslCtx;
    }
}
