/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static oracle.ocimetrics.iam.Utils.HEADER_DELIMITER;
import static oracle.ocimetrics.iam.Utils.RSA;
import static oracle.ocimetrics.iam.Utils.SIGNATURE_HEADER_FORMAT;
import static oracle.ocimetrics.iam.Utils.SIGNATURE_VERSION;
import static oracle.ocimetrics.iam.Utils.computeBodySHA256;
import static oracle.ocimetrics.iam.Utils.createFormatter;
import static oracle.ocimetrics.iam.Utils.createKeyId;
import static oracle.ocimetrics.util.CheckNull.isBlank;
import static oracle.ocimetrics.util.CheckNull.requireNonNullIAE;
import static oracle.ocimetrics.util.HttpConstants.CONTENT_SHA;
import static oracle.ocimetrics.util.HttpConstants.DATE;
import static oracle.ocimetrics.util.HttpConstants.HOST;
import static oracle.ocimetrics.util.HttpConstants.REQUEST_TARGET;
import static oracle.ocimetrics.util.LogUtil.logFine;

import java.security.interfaces.RSAPrivateKey;
import java.util.Locale;
import java.util.logging.Logger;

import oracle.ocimetrics.SigningException;
import oracle.ocimetrics.iam.CredentialContext.SecretRef;
import oracle.ocimetrics.util.LogUtil;

/**
 * Signs requests with the API key of a user principal, following version 1
 * of the OCI request signature scheme.
 * <p>
 * The signing string is made of these headers, in this order:
 * <pre>
 * (request-target): get /20160918/regions
 * date: Thu, 05 Jan 2014 21:31:40 GMT
 * host: identity.us-phoenix-1.oci.oraclecloud.com
 * x-content-sha256: 47DEQpj8HBSa+/TImW+5JCeuQeRkm5NMpJWZG3hSuFU=
 * </pre>
 * and the result is sent as
 * <pre>Signature version="1",keyId="tenancy/user/fingerprint",algorithm="rsa-sha256",headers="(request-target) date host x-content-sha256",signature="Base64(RSA-SHA256(signing_string))"</pre>
 * <p>
 * The private key file is read for every signature; no key material is
 * kept by this class. Only user principal contexts can sign: the platform
 * identity needs a token exchange this library does not implement, so it is
 * rejected before any file or network access.
 */
public class RequestSigner {

    /* the signed headers, in signing order */
    static final String SIGNING_HEADERS =
        REQUEST_TARGET + " " + DATE + " " + HOST + " " + CONTENT_SHA;

    private final Logger logger;

    public RequestSigner(Logger logger) {
        this.logger = logger;
    }

    /**
     * Signs a request.
     *
     * @param request the request
     * @param context the credential to sign with
     * @return the headers to attach to the request
     * @throws SigningException if the context is not a user principal, is
     * missing one of its secret fields, or its key cannot be read
     */
    public SignedHeaderSet sign(SigningRequest request,
                                CredentialContext context) {
        requireNonNullIAE(request, "request must be non-null");
        requireNonNullIAE(context, "context must be non-null");

        if (context.getScheme() != AuthScheme.USER_PRINCIPAL) {
            throw new SigningException(
                "Context " + context.getIdentifier() + " uses " +
                context.getScheme() + ", only user principal contexts " +
                "can sign requests");
        }
        SecretRef secret = context.getSecretRef();
        String missing = missingField(context, secret);
        if (missing != null) {
            throw new SigningException(
                "Context " + context.getIdentifier() +
                " cannot sign requests, " + missing + " is missing");
        }

        String date = createFormatter().format(request.getTimestamp());
        String host = Utils.hostHeader(request.getUri());
        String sha256 = computeBodySHA256(request.getBody());
        String signingContent = signingContent(request, date, host, sha256);

        RSAPrivateKey key = loadKey(context, secret);
        String signature;
        try {
            signature = Utils.sign(signingContent, key);
        } catch (Exception e) {
            throw new SigningException(
                "Error signing request with context " +
                context.getIdentifier() + ": " + e.getMessage(), e);
        }

        String keyId = createKeyId(context.getTenancyId(),
                                   secret.getUserId(),
                                   secret.getFingerprint());
        String authorization = String.format(SIGNATURE_HEADER_FORMAT,
                                             SIGNATURE_VERSION,
                                             keyId,
                                             RSA,
                                             SIGNING_HEADERS,
                                             signature);
        logFine(logger, "Signed " + request.getMethod() + " " + host +
                " with user " + LogUtil.truncate(secret.getUserId()));
        return new SignedHeaderSet(authorization, date, host, sha256);
    }

    /**
     * Returns the string that is signed for a request.
     */
    static String signingContent(SigningRequest request,
                                 String date,
                                 String host,
                                 String sha256) {
        StringBuilder sb = new StringBuilder();
        /* Must be in this order */
        sb.append(REQUEST_TARGET).append(HEADER_DELIMITER)
          .append(request.getMethod().toLowerCase(Locale.ROOT)).append(" ")
          .append(Utils.requestTarget(request.getUri())).append("\n")
          .append(DATE).append(HEADER_DELIMITER).append(date).append("\n")
          .append(HOST).append(HEADER_DELIMITER).append(host).append("\n")
          .append(CONTENT_SHA).append(HEADER_DELIMITER).append(sha256);
        return sb.toString();
    }

    private static String missingField(CredentialContext context,
                                       SecretRef secret) {
        if (isBlank(context.getTenancyId())) {
            return "the tenancy";
        }
        if (secret == null || isBlank(secret.getUserId())) {
            return "the user";
        }
        if (isBlank(secret.getFingerprint())) {
            return "the fingerprint";
        }
        if (isBlank(secret.getKeyFilePath())) {
            return "the key file";
        }
        return null;
    }

    private static RSAPrivateKey loadKey(CredentialContext context,
                                         SecretRef secret) {
        try {
            return new PrivateKeyProvider(secret.getKeyFilePath(),
                                          secret.getPassphraseCharacters())
                .getKey();
        } catch (IllegalArgumentException iae) {
            throw new SigningException(
                "Unable to load the private key of context " +
                context.getIdentifier() + ": " + iae.getMessage(), iae);
        }
    }
}
