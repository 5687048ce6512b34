/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of a public operation that reports success or failure instead
 * of throwing: a flag, a human readable message and optional details.
 * Details never contain key material or full identifiers.
 */
public class OperationResult {

    private final boolean success;
    private final String message;
    private final Map<String, Object> details;

    public OperationResult(boolean success,
                           String message,
                           Map<String, Object> details) {
        this.success = success;
        this.message = message;
        this.details = (details == null) ?
            Collections.emptyMap() :
            Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static OperationResult success(String message) {
        return new OperationResult(true, message, null);
    }

    public static OperationResult failure(String message) {
        return new OperationResult(false, message, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Returns the details of the result, empty if there are none.
     *
     * @return an unmodifiable map
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[success=" + success +
            ", message=" + message +
            (details.isEmpty() ? "" : ", details=" + details) + "]";
    }
}
