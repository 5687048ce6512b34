/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import java.util.Collections;
import java.util.List;

/**
 * The result of a successful call through {@link DispatchArbiter}. The
 * output is handed back unparsed: the REST response body or the standard
 * output of the command line tool.
 */
public class DispatchResult {

    private final String operation;
    private final String identifier;
    private final DispatchOutcome outcome;
    private final String output;
    private final String stderr;
    private final int statusCode;
    private final List<DispatchState> states;
    private final String restFailure;

    DispatchResult(String operation,
                   String identifier,
                   DispatchOutcome outcome,
                   String output,
                   String stderr,
                   int statusCode,
                   List<DispatchState> states,
                   String restFailure) {
        this.operation = operation;
        this.identifier = identifier;
        this.outcome = outcome;
        this.output = output;
        this.stderr = stderr;
        this.statusCode = statusCode;
        this.states = Collections.unmodifiableList(states);
        this.restFailure = restFailure;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Returns the identifier of the credential context that was used.
     *
     * @return the identifier
     */
    public String getIdentifier() {
        return identifier;
    }

    public DispatchOutcome getOutcome() {
        return outcome;
    }

    public String getOutput() {
        return output;
    }

    /**
     * Returns the standard error of the command line tool, empty for a
     * REST result.
     *
     * @return the text
     */
    public String getStderr() {
        return stderr;
    }

    /**
     * Returns the HTTP status of a REST result or the exit code of a
     * command line result.
     *
     * @return the status or exit code
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the states the call went through, ending with SUCCESS.
     *
     * @return the states in order
     */
    public List<DispatchState> getStates() {
        return states;
    }

    /**
     * Returns why the REST attempt failed before the command line succeeded.
     *
     * @return the reason, or null if REST succeeded or was not attempted
     */
    public String getRestFailure() {
        return restFailure;
    }

    @Override
    public String toString() {
        return "DispatchResult[operation=" + operation +
            ", identifier=" + identifier +
            ", outcome=" + outcome +
            ", status=" + statusCode +
            ", states=" + states + "]";
    }
}
