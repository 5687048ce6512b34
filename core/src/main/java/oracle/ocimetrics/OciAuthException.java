/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

/**
 * The base class for the unchecked exceptions thrown by this library.
 * Discovery problems (a missing configuration file, no instance metadata
 * service, an incomplete profile) are not reported this way; they degrade
 * to an empty or partial registry. Exceptions of this class are thrown by
 * the calls that need a credential: signing and dispatch.
 */
public class OciAuthException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public OciAuthException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     *
     * @param msg the message
     * @param cause the cause
     */
    public OciAuthException(String msg, Throwable cause) {
        super(msg, cause);
    }

    /**
     * Returns whether the operation that failed might succeed if it is
     * retried unchanged. This library never retries on its own, the
     * decision belongs to the caller.
     *
     * @return true if this exception indicates a transient condition
     */
    public boolean okToRetry() {
        return false;
    }
}
