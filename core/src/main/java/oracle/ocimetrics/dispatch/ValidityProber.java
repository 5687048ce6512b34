/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import static oracle.ocimetrics.util.CheckNull.requireNonNullIAE;
import static oracle.ocimetrics.util.LogUtil.logFine;
import static oracle.ocimetrics.util.LogUtil.logInfo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import oracle.ocimetrics.OciAuthException;
import oracle.ocimetrics.iam.AuthReport;
import oracle.ocimetrics.iam.ContextValidator;
import oracle.ocimetrics.iam.CredentialContext;
import oracle.ocimetrics.iam.CredentialRegistry;
import oracle.ocimetrics.util.JsonUtil;
import oracle.ocimetrics.util.LogUtil;

/**
 * Finds out whether credential contexts work by listing the regions with
 * each of them, and records the answer in their validity flag.
 * <p>
 * Probes are made on demand only. The registry uses this class as its
 * {@link ContextValidator} for loaded and imported contexts.
 */
public class ValidityProber implements ContextValidator {

    private final CredentialRegistry registry;
    private final DispatchArbiter arbiter;
    private final Logger logger;

    public ValidityProber(CredentialRegistry registry,
                          DispatchArbiter arbiter,
                          Logger logger) {
        requireNonNullIAE(registry, "registry must be non-null");
        requireNonNullIAE(arbiter, "arbiter must be non-null");
        this.registry = registry;
        this.arbiter = arbiter;
        this.logger = logger;
    }

    @Override
    public boolean probe(CredentialContext context) {
        return run(context).isSuccess();
    }

    /**
     * Probes one context and updates its validity flag.
     *
     * @param identifier the context identifier
     * @return the result; unsuccessful if the context does not exist
     */
    public ProbeResult testOne(String identifier) {
        CredentialContext ctx = registry.get(identifier);
        if (ctx == null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put(ProbeResult.IDENTIFIER, identifier);
            return new ProbeResult(identifier, false,
                "Authentication context not found: " + identifier, details);
        }
        ProbeResult result = run(ctx);
        ctx.setValid(result.isSuccess());
        logInfo(logger, "Authentication context " + identifier +
                (result.isSuccess() ? " is valid" : " is not valid"));
        return result;
    }

    /**
     * Probes every context of the registry. A failing context does not stop
     * the others.
     *
     * @return one result per context, in registry order
     */
    public List<ProbeResult> testAll() {
        List<ProbeResult> results = new ArrayList<>();
        for (CredentialContext ctx : registry.list()) {
            results.add(testOne(ctx.getIdentifier()));
        }
        return results;
    }

    /**
     * Probes every context and renders the registry report followed by the
     * status of each context.
     *
     * @return the text
     */
    public String capabilityReport() {
        List<ProbeResult> results = testAll();
        AuthReport report = registry.report();
        StringBuilder sb = new StringBuilder(report.format());
        sb.append("Context status:\n");
        if (results.isEmpty()) {
            sb.append("  none\n");
        }
        for (ProbeResult r : results) {
            sb.append("  ").append(r.getIdentifier()).append(": ")
              .append(r.isSuccess() ? "OK" : "FAILED");
            Object region = r.getDetails().get(ProbeResult.REGION);
            if (region != null) {
                sb.append(" (").append(region).append(")");
            }
            if (r.isSuccess()) {
                sb.append(", ").append(r.getRegionsAvailable())
                  .append(" regions available");
            } else {
                sb.append(", ").append(r.getMessage());
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    private ProbeResult run(CredentialContext ctx) {
        String method = ctx.getScheme().getMethod();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(ProbeResult.IDENTIFIER, ctx.getIdentifier());
        details.put(ProbeResult.METHOD, method);
        details.put(ProbeResult.TENANCY, LogUtil.truncate(ctx.getTenancyId()));
        details.put(ProbeResult.REGION, ctx.getRegion());

        if (!ctx.isComplete()) {
            return new ProbeResult(ctx.getIdentifier(), false,
                "Authentication failed: context is missing required fields",
                details);
        }
        try {
            DispatchResult dr =
                arbiter.executeWith(Operations.listRegions(), ctx);
            details.put(ProbeResult.REGIONS_AVAILABLE,
                        JsonUtil.countDataElements(dr.getOutput()));
            details.put(ProbeResult.OUTCOME, dr.getOutcome().name());
            return new ProbeResult(ctx.getIdentifier(), true,
                "Authentication successful for " + method, details);
        } catch (OciAuthException | IllegalArgumentException |
                 IllegalStateException e) {
            logFine(logger, "Probe of " + ctx.getIdentifier() +
                    " failed: " + e.getMessage());
            return new ProbeResult(ctx.getIdentifier(), false,
                "Authentication failed: " + e.getMessage(), details);
        }
    }
}
