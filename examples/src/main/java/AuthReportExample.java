/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

import oracle.ocimetrics.AuthConfig;
import oracle.ocimetrics.AuthenticationManager;
import oracle.ocimetrics.DispatchExhaustedException;
import oracle.ocimetrics.NoValidContextException;
import oracle.ocimetrics.OperationResult;
import oracle.ocimetrics.dispatch.DispatchResult;
import oracle.ocimetrics.dispatch.Operations;

/**
 * Discovers the OCI credentials available on this host, prints their
 * status and lists the metrics of a compartment with the preferred one.
 * <p>
 * Usage:
 * <pre>
 *   java -cp ... AuthReportExample [-rest] [-configFile path]
 *       [-profile name] [-compartment ocid]
 * </pre>
 * The environment variables OCI_CONFIG_FILE, OCI_CONFIG_PROFILE,
 * OCI_REGION, OCI_CLI_PATH and OCI_USE_REST_API are honored; the flags
 * override them.
 */
public class AuthReportExample {

    private static final String REST_FLAG = "-rest";
    private static final String CONFIG_FLAG = "-configFile";
    private static final String PROFILE_FLAG = "-profile";
    private static final String COMPARTMENT_FLAG = "-compartment";

    public static void main(String[] args) throws Exception {

        AuthConfig config = AuthConfig.fromEnvironment();
        String compartment = null;

        int currentArg = 0;
        while (currentArg < args.length) {
            String nextArg = args[currentArg++];
            if (nextArg.equals(REST_FLAG)) {
                config.setRestEnabled(true);
            } else if (nextArg.equals(CONFIG_FLAG) &&
                       currentArg < args.length) {
                config.setConfigFile(args[currentArg++]);
            } else if (nextArg.equals(PROFILE_FLAG) &&
                       currentArg < args.length) {
                config.setDefaultProfile(args[currentArg++]);
            } else if (nextArg.equals(COMPARTMENT_FLAG) &&
                       currentArg < args.length) {
                compartment = args[currentArg++];
            } else {
                usage("Unknown argument: " + nextArg);
            }
        }

        try (AuthenticationManager auth = new AuthenticationManager(config)) {
            OperationResult init = auth.initialize();
            System.out.println(init.getMessage());

            /* probes each context again and shows the outcome */
            System.out.println(auth.capabilityReport());

            if (!init.isSuccess()) {
                System.out.println("No usable credentials, nothing to run");
                return;
            }

            /* default to the tenancy, the root compartment */
            if (compartment == null) {
                compartment = auth.getPreferred().get().getTenancyId();
            }
            try {
                DispatchResult result = auth.execute(
                    Operations.listMetrics(compartment, null));
                System.out.println("Listed metrics via " +
                                   result.getOutcome() + " with " +
                                   result.getIdentifier());
                System.out.println(result.getOutput());
            } catch (NoValidContextException | DispatchExhaustedException e) {
                System.err.println("Unable to list metrics: " +
                                   e.getMessage());
            }
        }
    }

    private static void usage(String message) {
        System.err.println(message);
        System.err.println("Usage: java -cp ... AuthReportExample " +
                           "[-rest] [-configFile path] [-profile name] " +
                           "[-compartment ocid]");
        System.exit(1);
    }
}
