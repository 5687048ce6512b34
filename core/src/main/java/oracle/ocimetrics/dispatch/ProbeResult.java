/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import java.util.Map;

import oracle.ocimetrics.OperationResult;

/**
 * The outcome of probing one credential context.
 */
public class ProbeResult extends OperationResult {

    static final String IDENTIFIER = "identifier";
    static final String METHOD = "method";
    static final String TENANCY = "tenancy";
    static final String REGION = "region";
    static final String REGIONS_AVAILABLE = "regionsAvailable";
    static final String OUTCOME = "outcome";

    private final String identifier;

    ProbeResult(String identifier,
                boolean success,
                String message,
                Map<String, Object> details) {
        super(success, message, details);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * Returns the number of regions the probe listed.
     *
     * @return the count, or -1 if the probe failed
     */
    public int getRegionsAvailable() {
        Object n = getDetails().get(REGIONS_AVAILABLE);
        return n instanceof Integer ? (Integer) n : -1;
    }
}
