/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

/**
 * Thrown when both the signed REST path and the command line path failed
 * for one call. The message lists both failure reasons; the individual
 * failures are available from {@link #getRestFailure()} and
 * {@link #getCliFailure()}. The REST failure is null when REST mode is
 * disabled.
 */
public class DispatchExhaustedException extends OciAuthException {

    private static final long serialVersionUID = 1L;

    private final Throwable restFailure;
    private final Throwable cliFailure;

    /**
     * @hidden
     * @param operation the name of the operation that failed
     * @param restFailure the reason the REST attempt failed, or null if no
     * REST attempt was made
     * @param cliFailure the reason the command line attempt failed
     */
    public DispatchExhaustedException(String operation,
                                      Throwable restFailure,
                                      Throwable cliFailure) {
        super(buildMessage(operation, restFailure, cliFailure), cliFailure);
        this.restFailure = restFailure;
        this.cliFailure = cliFailure;
    }

    private static String buildMessage(String operation,
                                       Throwable restFailure,
                                       Throwable cliFailure) {
        StringBuilder sb = new StringBuilder();
        sb.append("Operation ").append(operation).append(" failed");
        if (restFailure != null) {
            sb.append("; REST: ").append(restFailure.getMessage());
        } else {
            sb.append("; REST: not attempted");
        }
        sb.append("; CLI: ")
          .append(cliFailure == null ? null : cliFailure.getMessage());
        return sb.toString();
    }

    public Throwable getRestFailure() {
        return restFailure;
    }

    public Throwable getCliFailure() {
        return cliFailure;
    }

    /**
     * Returns true if either failure shows that the provider
     * rejected the credential, as opposed to a network or tool problem.
     *
     * @return true if the credential was rejected
     */
    public boolean isAuthenticationRejected() {
        return restFailure instanceof AuthenticationRejectedException ||
            cliFailure instanceof AuthenticationRejectedException;
    }
}
