/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import static oracle.ocimetrics.util.LogUtil.logFine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import oracle.ocimetrics.RequestTimeoutException;

/**
 * {@link CliRunner} that starts an operating system process. The command is
 * passed as an argument list, never through a shell. Standard output and
 * standard error are drained concurrently so a chatty command cannot block
 * on a full pipe.
 */
public class ProcessCliRunner implements CliRunner {

    /* output readers block, so they get their own threads */
    private static final ExecutorService readers =
        Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cli-output-reader");
            t.setDaemon(true);
            return t;
        });

    private final Logger logger;

    public ProcessCliRunner(Logger logger) {
        this.logger = logger;
    }

    @Override
    public CliResult run(List<String> command, int timeoutMs)
        throws IOException {

        logFine(logger, "Running " + String.join(" ", command.subList(
            0, Math.min(command.size(), 4))) + " ...");
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new RequestTimeoutException(timeoutMs,
                    "Command " + command.get(0) + " did not complete");
            }
            return new CliResult(process.exitValue(),
                                 stdout.get(), stderr.get());
        } catch (InterruptedException ie) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException(
                "Interrupted waiting for " + command.get(0), ie);
        } catch (ExecutionException ee) {
            throw new IOException("Error reading output of " +
                                  command.get(0), ee.getCause());
        }
    }

    private static CompletableFuture<String> drain(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream is = in) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                byte[] buf = new byte[4096];
                int n;
                while ((n = is.read(buf)) != -1) {
                    out.write(buf, 0, n);
                }
                return new String(out.toByteArray(), StandardCharsets.UTF_8);
            } catch (IOException ioe) {
                throw new UncheckedIOException(ioe);
            }
        }, readers);
    }
}
