/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

/**
 * Decides whether a credential context is accepted by the provider, usually
 * by making a cheap authenticated call with it.
 */
@FunctionalInterface
public interface ContextValidator {

    /**
     * Probes a context. Implementations must not throw; a failure to probe
     * is an invalid context.
     *
     * @param context the context
     * @return true if the context works
     */
    boolean probe(CredentialContext context);
}
