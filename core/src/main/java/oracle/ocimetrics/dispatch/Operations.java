/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import static oracle.ocimetrics.util.CheckNull.requireNonBlankIAE;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import oracle.ocimetrics.util.JsonUtil;

/**
 * Factory of the operations used by the metric tools.
 */
public final class Operations {

    static final String MONITORING_API = "/20180401";
    static final String IDENTITY_API = "/20160918";
    static final String CORE_API = "/20160918";

    /* one page; tenancies with more compartments need paging */
    static final String COMPARTMENT_LIMIT = "1000";

    private Operations() {}

    /**
     * Lists the regions. This is the cheapest authenticated call, used to
     * find out whether a credential works.
     *
     * @return the operation
     */
    public static Operation listRegions() {
        return Operation.builder("listRegions")
            .kind(Operation.Kind.LIST)
            .rest(Service.IDENTITY, "GET", IDENTITY_API + "/regions")
            .cli("iam", "region", "list")
            .build();
    }

    /**
     * Lists the compartments the caller can access under a compartment,
     * including nested ones.
     *
     * @param compartmentId the parent compartment, usually the tenancy
     * @return the operation
     */
    public static Operation listCompartments(String compartmentId) {
        requireNonBlankIAE(compartmentId, "compartmentId must be non-empty");
        return Operation.builder("listCompartments")
            .kind(Operation.Kind.LIST)
            .rest(Service.IDENTITY, "GET", IDENTITY_API + "/compartments")
            .query("compartmentId", compartmentId)
            .query("compartmentIdInSubtree", "true")
            .query("accessLevel", "ACCESSIBLE")
            .query("limit", COMPARTMENT_LIMIT)
            .cli("iam", "compartment", "list")
            .cliOption("--compartment-id", compartmentId)
            .cliOption("--compartment-id-in-subtree", "true")
            .cliOption("--access-level", "ACCESSIBLE")
            .cliOption("--limit", COMPARTMENT_LIMIT)
            .build();
    }

    /**
     * Lists the metric definitions of a compartment.
     *
     * @param compartmentId the compartment OCID
     * @param namespace the metric namespace, or null for every namespace
     * @return the operation
     */
    public static Operation listMetrics(String compartmentId,
                                        String namespace) {
        requireNonBlankIAE(compartmentId, "compartmentId must be non-empty");
        Map<String, Object> details = new LinkedHashMap<>();
        if (namespace != null) {
            details.put("namespace", namespace);
        }
        return Operation.builder("listMetrics")
            .kind(Operation.Kind.LIST)
            .rest(Service.TELEMETRY, "POST",
                  MONITORING_API + "/metrics/actions/listMetrics")
            .query("compartmentId", compartmentId)
            .body(JsonUtil.toJson(details, false))
            .cli("monitoring", "metric", "list")
            .cliOption("--compartment-id", compartmentId)
            .cliOption("--namespace", namespace)
            .build();
    }

    /**
     * Queries aggregated metric data.
     *
     * @param compartmentId the compartment OCID
     * @param namespace the metric namespace
     * @param query the MQL expression, e.g. CpuUtilization[1m].mean()
     * @param startTime start of the window, RFC 3339
     * @param endTime end of the window, RFC 3339
     * @param resolution the resolution, e.g. 1m, or null for the default
     * @return the operation
     */
    public static Operation summarizeMetricsData(String compartmentId,
                                                 String namespace,
                                                 String query,
                                                 String startTime,
                                                 String endTime,
                                                 String resolution) {
        requireNonBlankIAE(compartmentId, "compartmentId must be non-empty");
        requireNonBlankIAE(namespace, "namespace must be non-empty");
        requireNonBlankIAE(query, "query must be non-empty");
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("namespace", namespace);
        details.put("query", query);
        if (startTime != null) {
            details.put("startTime", startTime);
        }
        if (endTime != null) {
            details.put("endTime", endTime);
        }
        if (resolution != null) {
            details.put("resolution", resolution);
        }
        return Operation.builder("summarizeMetricsData")
            .kind(Operation.Kind.QUERY)
            .rest(Service.TELEMETRY, "POST",
                  MONITORING_API + "/metrics/actions/summarizeMetricsData")
            .query("compartmentId", compartmentId)
            .body(JsonUtil.toJson(details, false))
            .cli("monitoring", "metric-data", "summarize-metrics-data")
            .cliOption("--compartment-id", compartmentId)
            .cliOption("--namespace", namespace)
            .cliOption("--query-text", query)
            .cliOption("--start-time", startTime)
            .cliOption("--end-time", endTime)
            .cliOption("--resolution", resolution)
            .build();
    }

    /**
     * Performs a power action on a compute instance.
     *
     * @param instanceId the instance OCID
     * @param action the action, e.g. START, STOP, SOFTRESET
     * @return the operation
     */
    public static Operation instanceAction(String instanceId, String action) {
        requireNonBlankIAE(instanceId, "instanceId must be non-empty");
        requireNonBlankIAE(action, "action must be non-empty");
        String act = action.toUpperCase(Locale.ROOT);
        return Operation.builder("instanceAction")
            .kind(Operation.Kind.MUTATE)
            .rest(Service.CORE, "POST", CORE_API + "/instances/" + instanceId)
            .query("action", act)
            .cli("compute", "instance", "action")
            .cliOption("--instance-id", instanceId)
            .cliOption("--action", act)
            .build();
    }
}
