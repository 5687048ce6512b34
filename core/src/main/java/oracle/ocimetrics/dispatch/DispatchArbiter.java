/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import static oracle.ocimetrics.util.CheckNull.requireNonNullIAE;
import static oracle.ocimetrics.util.HttpConstants.ACCEPT;
import static oracle.ocimetrics.util.HttpConstants.APPLICATION_JSON;
import static oracle.ocimetrics.util.HttpConstants.CONTENT_TYPE;
import static oracle.ocimetrics.util.LogUtil.logFine;
import static oracle.ocimetrics.util.LogUtil.logInfo;
import static oracle.ocimetrics.util.LogUtil.logWarning;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

import oracle.ocimetrics.AuthConfig;
import oracle.ocimetrics.AuthenticationRejectedException;
import oracle.ocimetrics.DispatchExhaustedException;
import oracle.ocimetrics.NoValidContextException;
import oracle.ocimetrics.OciAuthException;
import oracle.ocimetrics.RequestTimeoutException;
import oracle.ocimetrics.iam.CredentialContext;
import oracle.ocimetrics.iam.CredentialRegistry;
import oracle.ocimetrics.iam.RequestSigner;
import oracle.ocimetrics.iam.SignedHeaderSet;
import oracle.ocimetrics.iam.SigningRequest;
import oracle.ocimetrics.util.HttpRequestUtil.HttpResponse;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;

/**
 * Runs operations through the signed REST path or the <code>oci</code>
 * command line, one call at a time.
 * <p>
 * Each call is a small state machine:
 * <pre>
 * START --(REST enabled)--&gt; REST_ATTEMPT --(2xx)--&gt; SUCCESS
 *   |                          |
 *   |                          +--(any failure)--&gt; CLI_FALLBACK
 *   +--(REST disabled)--------------------------&gt; CLI_FALLBACK
 * CLI_FALLBACK --(exit 0)--&gt; SUCCESS
 *              --(failure)--&gt; FAILURE
 * </pre>
 * REST is attempted at most once and always before the command line; it is
 * never retried. A REST attempt that timed out may have reached the service,
 * so for a mutating operation that timeout ends the call with
 * {@link RequestTimeoutException} instead of falling back: running the
 * command line as well could apply the change twice.
 * <p>
 * The platform identity cannot sign REST requests, so its REST attempt
 * fails in the signer, without I/O, and the call goes to the command line,
 * which performs the instance principal token exchange itself.
 */
public class DispatchArbiter {

    /* command line options */
    static final String AUTH_OPTION = "--auth";
    static final String INSTANCE_PRINCIPAL = "instance_principal";
    static final String PROFILE_OPTION = "--profile";
    static final String CONFIG_FILE_OPTION = "--config-file";
    static final String REGION_OPTION = "--region";
    static final String OUTPUT_OPTION = "--output";
    static final String OUTPUT_JSON = "json";

    /* fragments of command line errors that mean the credential was refused */
    private static final String[] AUTH_REJECTED_MARKERS = {
        "notauthenticated", "401", "authentication"
    };

    private final CredentialRegistry registry;
    private final RequestSigner signer;
    private final RestTransport transport;
    private final CliRunner cliRunner;

    private final boolean restEnabled;
    private final String cliExecutable;
    private final String configFile;
    private final int requestTimeout;
    private final int cliTimeout;
    private final Logger logger;

    /**
     * @param config the configuration
     * @param registry the contexts to choose from
     * @param signer the request signer
     * @param transport the REST transport
     * @param cliRunner the command line runner
     */
    public DispatchArbiter(AuthConfig config,
                           CredentialRegistry registry,
                           RequestSigner signer,
                           RestTransport transport,
                           CliRunner cliRunner) {
        requireNonNullIAE(config, "config must be non-null");
        requireNonNullIAE(registry, "registry must be non-null");
        requireNonNullIAE(signer, "signer must be non-null");
        requireNonNullIAE(transport, "transport must be non-null");
        requireNonNullIAE(cliRunner, "cliRunner must be non-null");
        this.registry = registry;
        this.signer = signer;
        this.transport = transport;
        this.cliRunner = cliRunner;
        this.restEnabled = config.isRestEnabled();
        this.cliExecutable = config.getCliExecutable();
        this.configFile =
            config.isCustomConfigFile() ? config.getConfigFile() : null;
        this.requestTimeout = config.getRequestTimeout();
        this.cliTimeout = config.getCliTimeout();
        this.logger = config.getLogger();
    }

    public boolean isRestEnabled() {
        return restEnabled;
    }

    /**
     * Runs an operation with the preferred context of the registry.
     *
     * @param op the operation
     * @return the result
     * @throws NoValidContextException if no context is usable
     * @throws DispatchExhaustedException if both paths failed
     * @throws RequestTimeoutException if the command line timed out, or a
     * mutating REST request timed out
     */
    public DispatchResult execute(Operation op) {
        Optional<CredentialContext> ctx = registry.getPreferred();
        if (!ctx.isPresent()) {
            throw new NoValidContextException(
                "No valid OCI authentication context is available. " +
                "Configure ~/.oci/config or run on an OCI instance, then " +
                "refresh the authentication contexts");
        }
        return executeWith(op, ctx.get());
    }

    /**
     * Runs an operation with the named context.
     *
     * @param op the operation
     * @param identifier the context identifier
     * @return the result
     * @throws NoValidContextException if the context does not exist or is
     * not usable
     * @throws DispatchExhaustedException if both paths failed
     * @throws RequestTimeoutException if the command line timed out, or a
     * mutating REST request timed out
     */
    public DispatchResult execute(Operation op, String identifier) {
        CredentialContext ctx = registry.get(identifier);
        if (ctx == null) {
            throw new NoValidContextException(
                "Authentication context not found: " + identifier);
        }
        if (!ctx.isUsable()) {
            throw new NoValidContextException(
                "Authentication context " + identifier + " is not valid" +
                (ctx.isComplete() ? "" : ", it is missing required fields") +
                "; test or refresh it first");
        }
        return executeWith(op, ctx);
    }

    /**
     * Runs an operation with the given context, whatever its validity flag.
     * This is how a context is probed.
     *
     * @param op the operation
     * @param ctx the context
     * @return the result
     * @throws DispatchExhaustedException if both paths failed
     * @throws RequestTimeoutException if the command line timed out, or a
     * mutating REST request timed out
     */
    public DispatchResult executeWith(Operation op, CredentialContext ctx) {
        requireNonNullIAE(op, "operation must be non-null");
        requireNonNullIAE(ctx, "context must be non-null");

        List<DispatchState> states = new ArrayList<>();
        DispatchState state = DispatchState.START;
        Throwable restFailure = null;
        Throwable cliFailure = null;
        DispatchResult result = null;

        while (true) {
            states.add(state);
            switch (state) {
            case START:
                state = (restEnabled && op.hasRestForm()) ?
                    DispatchState.REST_ATTEMPT : DispatchState.CLI_FALLBACK;
                break;

            case REST_ATTEMPT:
                try {
                    HttpResponse response = attemptRest(op, ctx);
                    if (response.isSuccess()) {
                        result = new DispatchResult(
                            op.getName(), ctx.getIdentifier(),
                            DispatchOutcome.REST, response.getOutput(), "",
                            response.getStatusCode(), states, null);
                        state = DispatchState.SUCCESS;
                        break;
                    }
                    restFailure = restStatusFailure(ctx, response);
                } catch (RequestTimeoutException rte) {
                    if (op.isMutating()) {
                        logWarning(logger, "REST request for " +
                                   op.getName() + " timed out, the change " +
                                   "may have been applied; not falling " +
                                   "back to the command line");
                        states.add(DispatchState.FAILURE);
                        throw new RequestTimeoutException(
                            rte.getTimeoutMs(),
                            "REST request for " + op.getName() +
                            " timed out, the change may have been applied",
                            rte, true);
                    }
                    restFailure = rte;
                } catch (OciAuthException | IllegalStateException |
                         IllegalArgumentException e) {
                    /* signing, connection and request failures */
                    restFailure = e;
                }
                logInfo(logger, "REST call " + op.getName() +
                        " failed, falling back to the command line: " +
                        restFailure.getMessage());
                state = DispatchState.CLI_FALLBACK;
                break;

            case CLI_FALLBACK:
                List<String> command = buildCommand(op, ctx);
                int timeout = op.getCliTimeoutMs() > 0 ?
                    op.getCliTimeoutMs() : cliTimeout;
                CliResult cli;
                try {
                    cli = cliRunner.run(command, timeout);
                } catch (RequestTimeoutException rte) {
                    states.add(DispatchState.FAILURE);
                    throw rte;
                } catch (IOException ioe) {
                    cliFailure = new IllegalStateException(
                        "Unable to run " + cliExecutable + ": " +
                        ioe.getMessage(), ioe);
                    state = DispatchState.FAILURE;
                    break;
                }
                if (cli.isSuccess()) {
                    result = new DispatchResult(
                        op.getName(), ctx.getIdentifier(),
                        DispatchOutcome.CLI, cli.getStdout(),
                        cli.getStderr(), cli.getExitCode(), states,
                        restFailure == null ? null : restFailure.getMessage());
                    state = DispatchState.SUCCESS;
                    break;
                }
                cliFailure = cliFailure(ctx, cli);
                state = DispatchState.FAILURE;
                break;

            case SUCCESS:
                logFine(logger, op.getName() + " succeeded via " +
                        result.getOutcome() + " with " + ctx.getIdentifier());
                return result;

            case FAILURE:
            default:
                if (restFailure instanceof AuthenticationRejectedException) {
                    markRejected(ctx);
                }
                throw new DispatchExhaustedException(op.getName(),
                                                     restFailure, cliFailure);
            }
        }
    }

    private HttpResponse attemptRest(Operation op, CredentialContext ctx) {
        URI uri = op.buildUri(ctx.getRegion());
        byte[] body = op.getBody();
        SignedHeaderSet signed = signer.sign(
            new SigningRequest(op.getMethod(), uri, body), ctx);

        HttpHeaders headers = new DefaultHttpHeaders();
        signed.applyTo(headers);
        headers.set(ACCEPT, "application/json");
        if (body != null) {
            headers.set(CONTENT_TYPE, APPLICATION_JSON);
        }
        return transport.send(op.getMethod(), uri, headers, body,
                              requestTimeout);
    }

    private static OciAuthException restStatusFailure(CredentialContext ctx,
                                                      HttpResponse response) {
        String msg = "HTTP " + response.getStatusCode() +
            firstLine(response.getOutput());
        if (response.getStatusCode() == 401) {
            return new AuthenticationRejectedException(ctx.getIdentifier(),
                                                       msg);
        }
        return new OciAuthException(msg);
    }

    private OciAuthException cliFailure(CredentialContext ctx, CliResult cli) {
        String stderr = cli.getStderr();
        String lower = stderr.toLowerCase(Locale.ROOT);
        for (String marker : AUTH_REJECTED_MARKERS) {
            if (lower.contains(marker)) {
                markRejected(ctx);
                return new AuthenticationRejectedException(
                    ctx.getIdentifier(),
                    "Credential rejected by the provider (exit code " +
                    cli.getExitCode() + ")" + firstLine(stderr));
            }
        }
        return new OciAuthException(
            cliExecutable + " exited with code " + cli.getExitCode() +
            firstLine(stderr));
    }

    private void markRejected(CredentialContext ctx) {
        if (ctx.isValid()) {
            ctx.setValid(false);
            logWarning(logger, "Credential of context " +
                       ctx.getIdentifier() + " was rejected, marked " +
                       "invalid");
        }
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        int nl = trimmed.indexOf('\n');
        return ": " + (nl < 0 ? trimmed : trimmed.substring(0, nl).trim());
    }

    /**
     * Builds the full command line of an operation for a context.
     *
     * @param op the operation
     * @param ctx the context
     * @return the executable followed by its arguments
     */
    public List<String> buildCommand(Operation op, CredentialContext ctx) {
        List<String> command = new ArrayList<>();
        command.add(cliExecutable);
        command.addAll(op.getCliArgs());
        addAuthOptions(command, ctx);
        command.add(OUTPUT_OPTION);
        command.add(OUTPUT_JSON);
        return command;
    }

    /**
     * Returns the command line prefix that authenticates as a context: the
     * executable, the authentication options and the region.
     *
     * @param identifier the context identifier
     * @return the prefix
     * @throws NoValidContextException if the context does not exist
     */
    public List<String> commandPrefix(String identifier) {
        CredentialContext ctx = registry.get(identifier);
        if (ctx == null) {
            throw new NoValidContextException(
                "Authentication context not found: " + identifier);
        }
        List<String> command = new ArrayList<>();
        command.add(cliExecutable);
        addAuthOptions(command, ctx);
        return command;
    }

    private void addAuthOptions(List<String> command, CredentialContext ctx) {
        if (ctx.isPlatformIdentity()) {
            command.add(AUTH_OPTION);
            command.add(INSTANCE_PRINCIPAL);
        } else {
            command.add(PROFILE_OPTION);
            command.add(ctx.getProfileName() == null ?
                        ctx.getIdentifier() : ctx.getProfileName());
            if (configFile != null) {
                command.add(CONFIG_FILE_OPTION);
                command.add(configFile);
            }
        }
        command.add(REGION_OPTION);
        command.add(ctx.getRegion());
    }
}
