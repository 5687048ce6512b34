/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

/**
 * Thrown when an HTTP request or a command line invocation does not complete
 * within its timeout.
 * <p>
 * A timed out request may still have reached the service. When the request
 * was a mutation, {@link #mayHaveApplied()} returns true and the call must
 * not be repeated blindly.
 */
public class RequestTimeoutException extends OciAuthException {

    private static final long serialVersionUID = 1L;

    private final int timeoutMs;
    private final boolean mayHaveApplied;

    /**
     * @hidden
     *
     * @param timeoutMs the timeout that was in effect, in milliseconds
     * @param msg the message
     */
    public RequestTimeoutException(int timeoutMs, String msg) {
        this(timeoutMs, msg, null, false);
    }

    /**
     * @hidden
     *
     * @param timeoutMs the timeout that was in effect, in milliseconds
     * @param msg the message
     * @param cause the cause
     */
    public RequestTimeoutException(int timeoutMs,
                                   String msg,
                                   Throwable cause) {
        this(timeoutMs, msg, cause, false);
    }

    /**
     * @hidden
     *
     * @param timeoutMs the timeout that was in effect, in milliseconds
     * @param msg the message
     * @param cause the cause
     * @param mayHaveApplied true if a mutation may have been applied
     */
    public RequestTimeoutException(int timeoutMs,
                                   String msg,
                                   Throwable cause,
                                   boolean mayHaveApplied) {
        super(msg, cause);
        this.timeoutMs = timeoutMs;
        this.mayHaveApplied = mayHaveApplied;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (timeoutMs > 0) {
            sb.append(" (timeout ").append(timeoutMs).append("ms)");
        }
        Throwable cause = getCause();
        if (cause != null && cause.getMessage() != null) {
            sb.append("\nCaused by: ").append(cause.getClass().getName())
              .append(": ").append(cause.getMessage());
        }
        return sb.toString();
    }

    /**
     * A timeout is transient unless a mutation may have been applied.
     */
    @Override
    public boolean okToRetry() {
        return !mayHaveApplied;
    }

    /**
     * Returns true if the request was a mutation that may have been applied
     * before the timeout.
     *
     * @return true if the outcome of the mutation is unknown
     */
    public boolean mayHaveApplied() {
        return mayHaveApplied;
    }

    /**
     * Returns the timeout that was in effect.
     *
     * @return the timeout in milliseconds, 0 if unknown
     */
    public int getTimeoutMs() {
        return timeoutMs;
    }
}
