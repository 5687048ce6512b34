/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Credential discovery and request signing.
 * <p>
 * Two credential schemes are supported. The platform identity, also known
 * as the instance principal, is found by querying the instance metadata
 * service of the host. User principals are read from the profiles of the
 * OCI configuration file, by default <code>~/.oci/config</code>, each
 * naming a tenancy, a user, the fingerprint of an API signing key and the
 * path of its private key.
 * <p>
 * Requests made with a user principal are signed by
 * {@link oracle.ocimetrics.iam.RequestSigner} using version 1 of the OCI
 * HTTP signature. The signed headers are:
 * <ol>
 * <li>(request-target)</li>
 * <li>date</li>
 * <li>host</li>
 * <li>x-content-sha256</li>
 * </ol>
 * Example:
 * <pre>Signature version="1",keyId="tenancy/user/fingerprint",algorithm="rsa-sha256",headers="(request-target) date host x-content-sha256",signature="Base64(RSA-SHA256(signing_string))"</pre>
 * The platform identity cannot sign requests here; calls made with it go
 * through the command line.
 * <p>
 * Private keys are read from disk for each signature and are not cached.
 */
package oracle.ocimetrics.iam;
