/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static oracle.ocimetrics.util.HttpConstants.AUTHORIZATION;
import static oracle.ocimetrics.util.HttpConstants.CONTENT_SHA;
import static oracle.ocimetrics.util.HttpConstants.DATE;
import static oracle.ocimetrics.util.HttpConstants.HOST;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.netty.handler.codec.http.HttpHeaders;

/**
 * The four headers that authenticate one signed request. All of them must
 * be sent; the service re-derives the signature from the last three.
 */
public class SignedHeaderSet {

    private final String authorization;
    private final String date;
    private final String host;
    private final String contentSha256;

    SignedHeaderSet(String authorization,
                    String date,
                    String host,
                    String contentSha256) {
        this.authorization = authorization;
        this.date = date;
        this.host = host;
        this.contentSha256 = contentSha256;
    }

    public String getAuthorization() {
        return authorization;
    }

    public String getDate() {
        return date;
    }

    public String getHost() {
        return host;
    }

    public String getContentSha256() {
        return contentSha256;
    }

    /**
     * Sets the four headers, replacing any existing values.
     *
     * @param headers the request headers
     */
    public void applyTo(HttpHeaders headers) {
        headers.set(AUTHORIZATION, authorization);
        headers.set(DATE, date);
        headers.set(HOST, host);
        headers.set(CONTENT_SHA, contentSha256);
    }

    /**
     * Returns the headers by name, in signing order after the
     * authorization header.
     *
     * @return a new map
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(AUTHORIZATION, authorization);
        map.put(DATE, date);
        map.put(HOST, host);
        map.put(CONTENT_SHA, contentSha256);
        return map;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SignedHeaderSet)) {
            return false;
        }
        SignedHeaderSet other = (SignedHeaderSet) obj;
        return authorization.equals(other.authorization) &&
            date.equals(other.date) &&
            host.equals(other.host) &&
            contentSha256.equals(other.contentSha256);
    }

    @Override
    public int hashCode() {
        return Objects.hash(authorization, date, host, contentSha256);
    }

    @Override
    public String toString() {
        return "SignedHeaderSet[date=" + date + ", host=" + host + "]";
    }
}
