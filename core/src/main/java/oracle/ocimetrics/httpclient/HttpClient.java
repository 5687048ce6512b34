/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.httpclient;

import static oracle.ocimetrics.util.LogUtil.logFine;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.proxy.HttpProxyHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.AttributeKey;
import io.netty.util.ReferenceCountUtil;

/**
 * Netty HTTP client used for the instance metadata probe and for signed
 * REST calls. Initialization process:
 * <ol>
 *   <li>create an event loop for handling the connection and the request,
 * with a single thread.</li>
 *   <li>bootstrap a client, setting the event loop group, socket options,
 * remote address and a channel initializer that installs the optional proxy
 * and SSL handlers, the HTTP codec, an aggregator that delivers only
 * FullHttpResponse instances and the response handler.</li>
 * </ol>
 * <p>
 * Each call to {@link #runRequest} opens its own connection and closes it
 * when the response future completes; no connection state survives a call.
 * The returned future completes with {@link TimeoutException} if the
 * connection, the write or the read does not finish in time.
 * <p>
 * The caller must release the response by calling
 * {@link FullHttpResponse#release()}.
 */
public class HttpClient {

    static final int DEFAULT_MAX_CONTENT_LENGTH = 32 * 1024 * 1024; // 32MB
    static final int DEFAULT_MAX_CHUNK_SIZE = 65536;
    static final int DEFAULT_HANDSHAKE_TIMEOUT_MS = 3000;

    private static final String CODEC_HANDLER_NAME = "http-codec";
    private static final String AGG_HANDLER_NAME = "http-aggregator";
    private static final String HTTP_HANDLER_NAME = "http-response-handler";

    /* AttributeKey to attach a CompletableFuture to the Channel,
     * allowing the HttpClientHandler to signal completion.
     */
    public static final AttributeKey<CompletableFuture<FullHttpResponse>>
        STATE_KEY = AttributeKey.valueOf("rqstate");

    private final String host;
    private final int port;
    private final String name;
    private final Logger logger;

    /*
     * Non-null if using SSL
     */
    private final SslContext sslCtx;
    private final int handshakeTimeoutMs;

    private String proxyHost;
    private int proxyPort;

    private final NioEventLoopGroup workerGroup;
    private final Bootstrap bootstrap;

    /**
     * Creates a minimal HttpClient instance that is configured for
     * single-use or minimal use without concurrency.
     *
     * @param host the hostname for the HTTP server
     * @param port the port for the HTTP server
     * @param sslCtx if non-null, SSL context to use for connections.
     * @param handshakeTimeoutMs if not zero, timeout to use for SSL handshake
     * @param name A name to use in logging messages for this client.
     * @param logger A logger to use for logging messages.
     * @return the client
     */
    public static HttpClient createMinimalClient(String host,
                                                 int port,
                                                 SslContext sslCtx,
                                                 int handshakeTimeoutMs,
                                                 String name,
                                                 Logger logger) {
        return new HttpClient(host, port, sslCtx, handshakeTimeoutMs,
                              name, logger);
    }

    private HttpClient(String host,
                       int port,
                       SslContext sslCtx,
                       int handshakeTimeoutMs,
                       String name,
                       Logger logger) {
        this.host = host;
        this.port = port;
        this.sslCtx = sslCtx;
        this.handshakeTimeoutMs = (handshakeTimeoutMs == 0 ?
            DEFAULT_HANDSHAKE_TIMEOUT_MS : handshakeTimeoutMs);
        this.name = name;
        this.logger = logger;

        workerGroup = new NioEventLoopGroup(1);
        bootstrap = new Bootstrap();
        bootstrap.group(workerGroup);
        bootstrap.channel(NioSocketChannel.class);
        bootstrap.option(ChannelOption.SO_KEEPALIVE, true);
        bootstrap.option(ChannelOption.TCP_NODELAY, true);
        bootstrap.remoteAddress(host, port);
        bootstrap.handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                initPipeline(ch);
            }
        });
    }

    /**
     * Routes the requests of this client through an HTTP proxy.
     *
     * @param proxyHost the proxy host
     * @param proxyPort the proxy port
     */
    public void configureProxy(String proxyHost, int proxyPort) {
        if ((proxyHost != null && proxyPort == 0) ||
            (proxyHost == null && proxyPort != 0)) {
            throw new IllegalArgumentException(
                "To configure an HTTP proxy, both host and port are required");
        }
        this.proxyHost = proxyHost;
        this.proxyPort = proxyPort;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    String getName() {
        return name;
    }

    /*
     * Handlers, in order: optional proxy, optional SSL, HTTP codec,
     * aggregation of chunked responses into a FullHttpResponse, and the
     * response handler itself.
     */
    private void initPipeline(Channel ch) {
        logFine(logger, "HttpClient " + name + ", channel created: " + ch);
        ChannelPipeline p = ch.pipeline();
        if (sslCtx != null) {
            final SslHandler sslHandler =
                sslCtx.newHandler(ch.alloc(), host, port);
            final SSLEngine sslEngine = sslHandler.engine();
            final SSLParameters sslParameters = sslEngine.getSSLParameters();
            sslParameters.setEndpointIdentificationAlgorithm("HTTPS");
            sslEngine.setSSLParameters(sslParameters);
            sslHandler.setHandshakeTimeoutMillis(handshakeTimeoutMs);
            p.addLast(sslHandler);
        }
        p.addLast(CODEC_HANDLER_NAME, new HttpClientCodec
                  (4096, // initial line
                   8192, // header size
                   DEFAULT_MAX_CHUNK_SIZE));
        p.addLast(AGG_HANDLER_NAME,
                  new HttpObjectAggregator(DEFAULT_MAX_CONTENT_LENGTH));
        p.addLast(HTTP_HANDLER_NAME, new HttpClientHandler(logger));

        if (proxyHost != null) {
            p.addFirst("proxyServer", new HttpProxyHandler(
                new InetSocketAddress(proxyHost, proxyPort)));
        }
    }

    /**
     * Cleanly shut down the client.
     */
    public void shutdown() {
        /*
         * 0 means no quiet period, 5000ms is the total time to wait for
         * shutdown (should never take this long)
         */
        workerGroup.shutdownGracefully(0, 5000, TimeUnit.MILLISECONDS).
            syncUninterruptibly();
    }

    /**
     * Sends an HttpRequest to the server on a new connection.
     *
     * @param request HttpRequest
     * @param timeoutMs Time to wait for the connection and the response from
     * the server. Returned future completes with {@link TimeoutException}
     * in case of timeout
     * @return {@link CompletableFuture} holding the response from the server.
     */
    public CompletableFuture<FullHttpResponse> runRequest(HttpRequest request,
                                                          int timeoutMs) {
        final CompletableFuture<FullHttpResponse> responseFuture =
            new CompletableFuture<>();

        final ChannelFuture connectFuture = bootstrap.clone()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
            .connect();

        connectFuture.addListener((ChannelFutureListener) cf -> {
            if (!cf.isSuccess()) {
                ReferenceCountUtil.release(request);
                responseFuture.completeExceptionally(cf.cause());
                return;
            }
            final Channel channel = cf.channel();
            channel.attr(STATE_KEY).set(responseFuture);
            channel.pipeline().addFirst(
                new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS));
            channel.writeAndFlush(request).addListener(
                (ChannelFutureListener) writeFuture -> {
                    if (!writeFuture.isSuccess()) {
                        channel.attr(STATE_KEY).set(null);
                        responseFuture.completeExceptionally(
                            writeFuture.cause());
                    }
                });
        });

        /* a backstop for a stalled proxy or handshake */
        responseFuture.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        responseFuture.whenComplete((response, err) -> {
            Channel channel = connectFuture.channel();
            if (channel != null) {
                channel.close();
            }
        });
        return responseFuture;
    }
}
