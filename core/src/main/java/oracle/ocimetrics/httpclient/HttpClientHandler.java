/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.httpclient;

import static oracle.ocimetrics.httpclient.HttpClient.STATE_KEY;
import static oracle.ocimetrics.util.HttpConstants.OPC_REQUEST_ID;
import static oracle.ocimetrics.util.LogUtil.isFineEnabled;
import static oracle.ocimetrics.util.LogUtil.logFine;
import static oracle.ocimetrics.util.LogUtil.logWarning;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.ReferenceCountUtil;

/**
 * Completes the response future attached to the channel with the
 * aggregated response, or exceptionally if the channel fails first.
 */
public class HttpClientHandler extends ChannelInboundHandlerAdapter {

    private final Logger logger;

    HttpClientHandler(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        final CompletableFuture<FullHttpResponse> responseFuture =
            ctx.channel().attr(STATE_KEY).getAndSet(null);

        /* Remove timeout handler upon response arrival */
        if (ctx.pipeline().get(ReadTimeoutHandler.class) != null) {
            ctx.pipeline().remove(ReadTimeoutHandler.class);
        }

        if (msg instanceof FullHttpResponse) {
            FullHttpResponse fhr = (FullHttpResponse) msg;

            if (responseFuture == null || !responseFuture.complete(fhr)) {
                /*
                 * The caller timed out waiting for this message. Discard it
                 * by releasing it.
                 */
                if (isFineEnabled(logger)) {
                    String requestId = fhr.headers().get(OPC_REQUEST_ID);
                    logFine(logger, "Discarding message with no response " +
                            "handler. requestId=" +
                            (requestId == null ? "(none)" : requestId));
                }
                fhr.release();
            }
            return;
        }
        logWarning(logger,
                   "HttpClientHandler, response not FullHttpResponse: " +
                   msg.getClass());
        ReferenceCountUtil.release(msg);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        final CompletableFuture<FullHttpResponse> responseFuture =
            ctx.channel().attr(STATE_KEY).getAndSet(null);
        if (responseFuture != null) {
            logFine(logger, "HttpClientHandler read failed, cause: " + cause);
            Throwable err = cause;
            if (err instanceof ReadTimeoutException) {
                err = new TimeoutException("Request timed out while waiting " +
                    "for the response from the server");
            }
            responseFuture.completeExceptionally(err);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        final CompletableFuture<FullHttpResponse> responseFuture =
            ctx.channel().attr(STATE_KEY).getAndSet(null);
        if (responseFuture != null && !responseFuture.isDone()) {
            String msg = "Channel is inactive: " + ctx.channel();
            logFine(logger, msg);
            responseFuture.completeExceptionally(new IOException(msg));
        }
        ctx.close();
    }
}
