/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static oracle.ocimetrics.util.HttpConstants.ACCEPT;
import static oracle.ocimetrics.util.HttpConstants.APPLICATION_JSON;
import static oracle.ocimetrics.util.HttpConstants.AUTHORIZATION;
import static oracle.ocimetrics.util.LogUtil.logFine;
import static oracle.ocimetrics.util.LogUtil.logTrace;

import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import oracle.ocimetrics.httpclient.HttpClient;
import oracle.ocimetrics.util.HttpRequestUtil;
import oracle.ocimetrics.util.JsonUtil;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;

/**
 * Detects whether the process runs on an OCI compute instance by querying
 * the instance metadata service, and reads the instance identity if it does.
 * <p>
 * The v2 endpoint is tried first; a 404 from it falls back once to v1. Any
 * failure means the process is not on an instance, so
 * {@link #probePlatformIdentity()} returns an empty result instead of
 * throwing.
 */
public class PlatformIdentityProber {

    /* The authorization header required by the metadata service since V2 */
    static final String AUTHORIZATION_HEADER_VALUE = "Bearer Oracle";

    private static final String V2 = "v2/";
    private static final String V1 = "v1/";

    private final URI baseURI;
    private final int timeoutMs;
    private final Logger logger;

    /**
     * @param baseURL base URL of the metadata service, e.g.
     * <code>http://169.254.169.254/opc/</code>
     * @param timeoutMs timeout of each request in milliseconds
     * @param logger logger
     */
    public PlatformIdentityProber(String baseURL, int timeoutMs,
                                  Logger logger) {
        this.baseURI = URI.create(baseURL.endsWith("/") ?
                                  baseURL : baseURL + "/");
        if (baseURI.getHost() == null) {
            throw new IllegalArgumentException(
                "Invalid metadata service URL: " + baseURL);
        }
        this.timeoutMs = timeoutMs;
        this.logger = logger;
    }

    static String getInstanceMetadataPath(String basePath, String version) {
        return basePath + version + "instance/";
    }

    /**
     * Probes the metadata service with the configured timeout.
     *
     * @return the instance identity, or empty if the process does not run
     * on an OCI instance
     */
    public Optional<PlatformIdentitySnapshot> probePlatformIdentity() {
        return probePlatformIdentity(timeoutMs);
    }

    /**
     * Probes the metadata service.
     *
     * @param timeout request timeout in milliseconds
     * @return the instance identity, or empty if the process does not run
     * on an OCI instance
     */
    public Optional<PlatformIdentitySnapshot> probePlatformIdentity(
        int timeout) {

        String basePath = baseURI.getRawPath();
        if (basePath == null || basePath.isEmpty()) {
            basePath = "/";
        }
        int port = baseURI.getPort() == -1 ? 80 : baseURI.getPort();
        String path = getInstanceMetadataPath(basePath, V2);
        logTrace(logger, "Fetch instance metadata using " + path);

        HttpClient client = null;
        try {
            client = HttpClient.createMinimalClient(baseURI.getHost(),
                                                    port,
                                                    null,
                                                    0,
                                                    "InstanceMDClient",
                                                    logger);

            HttpRequestUtil.HttpResponse response =
                HttpRequestUtil.doGetRequest(client, path, headers(),
                                             timeout, logger);
            if (response.getStatusCode() == 404) {
                logTrace(logger, "Falling back to v1 metadata URL, " +
                         "resource not found from v2");
                path = getInstanceMetadataPath(basePath, V1);
                response = HttpRequestUtil.doGetRequest(
                    client, path, headers(), timeout, logger);
            }
            if (response.getStatusCode() != 200) {
                logFine(logger, "Instance metadata not available, " +
                        "status code: " + response.getStatusCode());
                return Optional.empty();
            }

            Map<String, String> fields =
                JsonUtil.parseScalarFields(response.getOutput());
            if (fields.get("id") == null) {
                logFine(logger, "Instance metadata has no instance id");
                return Optional.empty();
            }
            PlatformIdentitySnapshot snapshot =
                new PlatformIdentitySnapshot(fields);
            if (snapshot.getRegion() == null) {
                logFine(logger, "Instance metadata has no region");
                return Optional.empty();
            }
            logFine(logger, "Running on an OCI instance: " + snapshot);
            return Optional.of(snapshot);
        } catch (RuntimeException re) {
            /* timeouts, refused connections, malformed bodies */
            logFine(logger, "Instance metadata not available: " +
                    re.getMessage());
            return Optional.empty();
        } finally {
            if (client != null) {
                client.shutdown();
            }
        }
    }

    private static HttpHeaders headers() {
        return new DefaultHttpHeaders()
            .set(ACCEPT, APPLICATION_JSON)
            .set(AUTHORIZATION, AUTHORIZATION_HEADER_VALUE);
    }
}
