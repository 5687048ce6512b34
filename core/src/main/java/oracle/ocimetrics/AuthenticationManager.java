/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

import static oracle.ocimetrics.util.CheckNull.isBlank;
import static oracle.ocimetrics.util.CheckNull.requireNonNullIAE;
import static oracle.ocimetrics.util.LogUtil.logFine;
import static oracle.ocimetrics.util.LogUtil.logWarning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import oracle.ocimetrics.dispatch.CliRunner;
import oracle.ocimetrics.dispatch.DispatchArbiter;
import oracle.ocimetrics.dispatch.DispatchResult;
import oracle.ocimetrics.dispatch.NettyRestTransport;
import oracle.ocimetrics.dispatch.Operation;
import oracle.ocimetrics.dispatch.Operations;
import oracle.ocimetrics.dispatch.ProbeResult;
import oracle.ocimetrics.dispatch.ProcessCliRunner;
import oracle.ocimetrics.dispatch.RestTransport;
import oracle.ocimetrics.dispatch.ValidityProber;
import oracle.ocimetrics.iam.AuthReport;
import oracle.ocimetrics.iam.ContextConfig;
import oracle.ocimetrics.iam.CredentialContext;
import oracle.ocimetrics.iam.CredentialRegistry;
import oracle.ocimetrics.iam.PlatformIdentityProber;
import oracle.ocimetrics.iam.PlatformIdentitySnapshot;
import oracle.ocimetrics.iam.RequestSigner;
import oracle.ocimetrics.iam.SignedHeaderSet;
import oracle.ocimetrics.iam.SigningRequest;
import oracle.ocimetrics.util.JsonUtil;

/**
 * Entry point to OCI authentication and dispatch. An instance owns one
 * credential registry, one request signer, one dispatch arbiter and one
 * validity prober, all built from a single {@link AuthConfig}. Several
 * instances can coexist in a process.
 * <p>
 * Typical use:
 * <pre>
 *    AuthConfig config = AuthConfig.fromEnvironment();
 *    try (AuthenticationManager auth = new AuthenticationManager(config)) {
 *        auth.initialize();
 *        DispatchResult r = auth.execute(Operations.listRegions());
 *        ...
 *    }
 * </pre>
 * Instances are thread-safe.
 */
public class AuthenticationManager implements AutoCloseable {

    private final AuthConfig config;
    private final CredentialRegistry registry;
    private final RequestSigner signer;
    private final RestTransport transport;
    private final DispatchArbiter arbiter;
    private final ValidityProber prober;
    private final Logger logger;

    /**
     * Creates a manager that talks to the real metadata service, OCI
     * endpoints and command line.
     *
     * @param config the configuration
     */
    public AuthenticationManager(AuthConfig config) {
        this(config,
             createIdentityProber(config),
             new NettyRestTransport(config.getProxyHost(),
                                    config.getProxyPort(),
                                    config.getLogger()),
             new ProcessCliRunner(config.getLogger()));
    }

    /**
     * Creates a manager with the given collaborators.
     *
     * @param config the configuration
     * @param identityProber the metadata service prober, or null to never
     * look for a platform identity
     * @param transport the REST transport
     * @param cliRunner the command line runner
     */
    public AuthenticationManager(AuthConfig config,
                                 PlatformIdentityProber identityProber,
                                 RestTransport transport,
                                 CliRunner cliRunner) {
        requireNonNullIAE(config, "config must be non-null");
        this.config = config;
        this.logger = config.getLogger();
        this.registry = new CredentialRegistry(config, identityProber);
        this.signer = new RequestSigner(logger);
        this.transport = transport;
        this.arbiter = new DispatchArbiter(config, registry, signer,
                                           transport, cliRunner);
        this.prober = new ValidityProber(registry, arbiter, logger);
        registry.setValidator(prober);
    }

    private static PlatformIdentityProber createIdentityProber(
        AuthConfig config) {
        requireNonNullIAE(config, "config must be non-null");
        if (!config.getProbePlatformIdentity()) {
            return null;
        }
        return new PlatformIdentityProber(config.getMetadataBaseURL(),
                                          config.getMetadataTimeout(),
                                          config.getLogger());
    }

    public AuthConfig getConfig() {
        return config;
    }

    /**
     * Discovers the platform identity and loads the configuration file.
     *
     * @return the outcome; unsuccessful if no context is usable
     */
    public OperationResult initialize() {
        registry.initialize();
        return summarize("Authentication initialized");
    }

    /**
     * Reloads the configuration file, keeping a known platform identity.
     *
     * @return the outcome; unsuccessful if no context is usable
     */
    public OperationResult refresh() {
        registry.refresh();
        return summarize("Authentication refreshed");
    }

    private OperationResult summarize(String prefix) {
        AuthReport report = registry.report();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalContexts", report.getTotalContexts());
        details.put("validContexts", report.getValidContexts());
        details.put("instancePrincipal",
                    report.isPlatformIdentityAvailable());
        details.put("preferred", report.getPreferredIdentifier());
        details.put("warnings", report.getWarnings().size());
        boolean ok = report.getPreferredIdentifier() != null;
        return new OperationResult(ok,
            prefix + ": " + report.getValidContexts() + " of " +
            report.getTotalContexts() + " context(s) valid", details);
    }

    public Optional<CredentialContext> getPreferred() {
        return registry.getPreferred();
    }

    /**
     * Returns a context by identifier.
     *
     * @param identifier the identifier
     * @return the context, or null if there is none
     */
    public CredentialContext get(String identifier) {
        return registry.get(identifier);
    }

    public List<CredentialContext> list() {
        return registry.list();
    }

    /**
     * Adds or replaces a user principal context and probes it.
     *
     * @param identifier the identifier
     * @param contextConfig the context attributes
     * @return the probe outcome of the new context
     * @throws IllegalArgumentException if the identifier is reserved or the
     * attributes are invalid
     */
    public ProbeResult add(String identifier, ContextConfig contextConfig) {
        registry.add(identifier, contextConfig);
        return prober.testOne(identifier);
    }

    /**
     * Removes a context.
     *
     * @param identifier the identifier
     * @return the outcome; unsuccessful if there was no such context
     */
    public OperationResult remove(String identifier) {
        if (registry.remove(identifier)) {
            return OperationResult.success(
                "Removed authentication context " + identifier);
        }
        return OperationResult.failure(
            "Authentication context not found: " + identifier);
    }

    public AuthReport report() {
        return registry.report();
    }

    /**
     * @see CredentialRegistry#export(boolean)
     */
    public Map<String, Map<String, Object>> export(boolean includeSecrets) {
        return registry.export(includeSecrets);
    }

    /**
     * @see CredentialRegistry#exportJson(boolean)
     */
    public String exportJson(boolean includeSecrets) {
        return registry.exportJson(includeSecrets);
    }

    /**
     * Imports contexts exported by {@link #exportJson(boolean)}. Malformed
     * input is reported as an unsuccessful result.
     *
     * @param json the JSON text
     * @return the outcome
     */
    public OperationResult importJson(String json) {
        try {
            return registry.importJson(json);
        } catch (IllegalArgumentException iae) {
            logFine(logger, "Import failed: " + iae.getMessage());
            return OperationResult.failure(
                "Import failed: " + iae.getMessage());
        }
    }

    public ProbeResult testOne(String identifier) {
        return prober.testOne(identifier);
    }

    public List<ProbeResult> testAll() {
        return prober.testAll();
    }

    /**
     * Probes every context and renders the result.
     *
     * @return the text
     */
    public String capabilityReport() {
        return prober.capabilityReport();
    }

    /**
     * @see DispatchArbiter#execute(Operation)
     */
    public DispatchResult execute(Operation op) {
        return arbiter.execute(op);
    }

    /**
     * @see DispatchArbiter#execute(Operation, String)
     */
    public DispatchResult execute(Operation op, String identifier) {
        return arbiter.execute(op, identifier);
    }

    /**
     * Lists the OCIDs of the compartments a context can access, nested ones
     * included. The search starts at the tenancy of a user principal, and
     * at the instance's compartment for a platform identity whose tenancy
     * is not known.
     *
     * @param identifier the context identifier, or null for the preferred
     * context
     * @return the compartment OCIDs; empty if there is no usable context or
     * the listing failed
     */
    public List<String> compartmentAccess(String identifier) {
        CredentialContext ctx = (identifier == null) ?
            registry.getPreferred().orElse(null) : registry.get(identifier);
        if (ctx == null) {
            logFine(logger, "No context to list compartments with: " +
                    identifier);
            return Collections.emptyList();
        }
        String root = ctx.getTenancyId();
        if (ctx.isPlatformIdentity() &&
            PlatformIdentitySnapshot.AUTO_DETECTED.equals(root)) {
            root = ctx.getMetadata().get("compartmentId");
        }
        if (isBlank(root)) {
            logFine(logger, "Context " + ctx.getIdentifier() +
                    " has no tenancy to list compartments under");
            return Collections.emptyList();
        }
        try {
            DispatchResult result = arbiter.execute(
                Operations.listCompartments(root), ctx.getIdentifier());
            return JsonUtil.collectDataField(result.getOutput(), "id");
        } catch (OciAuthException | IllegalArgumentException e) {
            logWarning(logger, "Unable to list compartments with context " +
                       ctx.getIdentifier() + ": " + e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Signs a request with the named context.
     *
     * @param request the request
     * @param identifier the context identifier
     * @return the headers to send
     * @throws NoValidContextException if there is no such context
     * @throws SigningException if the context cannot sign
     */
    public SignedHeaderSet sign(SigningRequest request, String identifier) {
        CredentialContext ctx = registry.get(identifier);
        if (ctx == null) {
            throw new NoValidContextException(
                "Authentication context not found: " + identifier);
        }
        return signer.sign(request, ctx);
    }

    /**
     * @see DispatchArbiter#commandPrefix(String)
     */
    public List<String> commandPrefix(String identifier) {
        return arbiter.commandPrefix(identifier);
    }

    @Override
    public void close() {
        transport.close();
    }
}
