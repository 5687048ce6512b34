/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam.pki;

/**
 * Denotes a type which holds sensitive data and must be erased once it has
 * been used. Use try-with-resources so the data is erased after use.
 */
interface Sensitive extends AutoCloseable {
    /** Must erase the contents */
    @Override
    void close();
}
