/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import java.io.IOException;
import java.util.List;

import oracle.ocimetrics.RequestTimeoutException;

/**
 * Runs a command line and captures its output.
 */
public interface CliRunner {

    /**
     * Runs a command and waits for it to exit.
     *
     * @param command the executable followed by its arguments
     * @param timeoutMs the time to wait for the command, in milliseconds
     * @return the exit code and output
     * @throws IOException if the command cannot be started
     * @throws RequestTimeoutException if the command does not exit in time;
     * it is killed
     */
    CliResult run(List<String> command, int timeoutMs) throws IOException;
}
