/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import static oracle.ocimetrics.util.CheckNull.requireNonBlankIAE;
import static oracle.ocimetrics.util.CheckNull.requireNonNullIAE;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One logical call that can be made either as a signed REST request or as
 * an <code>oci</code> command line invocation. The two forms describe the
 * same effect; {@link DispatchArbiter} picks the form at call time.
 * <p>
 * Instances are immutable and built with {@link #builder(String)}.
 */
public class Operation {

    /**
     * What a call does to the service. Only mutating calls change state,
     * which limits when a call may be repeated on the other path.
     */
    public enum Kind {
        /** lists resources or data */
        LIST,
        /** queries data */
        QUERY,
        /** changes a resource */
        MUTATE
    }

    private final String name;
    private final Kind kind;
    private final Service service;
    private final String method;
    private final String path;
    private final Map<String, String> queryParams;
    private final byte[] body;
    private final List<String> cliArgs;
    private final int cliTimeoutMs;

    private Operation(Builder builder) {
        this.name = builder.name;
        this.kind = builder.kind;
        this.service = builder.service;
        this.method = builder.method;
        this.path = builder.path;
        this.queryParams = Collections.unmodifiableMap(
            new LinkedHashMap<>(builder.queryParams));
        this.body = builder.body;
        this.cliArgs = Collections.unmodifiableList(
            new ArrayList<>(builder.cliArgs));
        this.cliTimeoutMs = builder.cliTimeoutMs;
    }

    /**
     * Starts building an operation.
     *
     * @param name the name used in logs and errors
     * @return the builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isMutating() {
        return kind == Kind.MUTATE;
    }

    /**
     * Returns true if the operation has a REST form.
     *
     * @return true if a service and a path are set
     */
    public boolean hasRestForm() {
        return service != null && path != null;
    }

    public Service getService() {
        return service;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public Map<String, String> getQueryParams() {
        return queryParams;
    }

    /**
     * Returns a copy of the request body.
     *
     * @return the body, or null if the request has none
     */
    public byte[] getBody() {
        return body == null ? null : body.clone();
    }

    /**
     * Returns the command line arguments naming the command and its
     * parameters, without the executable and without the authentication,
     * region and output options.
     *
     * @return the arguments
     */
    public List<String> getCliArgs() {
        return cliArgs;
    }

    /**
     * Returns the command line timeout of this operation.
     *
     * @return the timeout in milliseconds, 0 to use the configured default
     */
    public int getCliTimeoutMs() {
        return cliTimeoutMs;
    }

    /**
     * Builds the REST target of this operation in a region.
     *
     * @param region the region
     * @return the absolute URI
     * @throws IllegalStateException if the operation has no REST form
     */
    public URI buildUri(String region) {
        if (!hasRestForm()) {
            throw new IllegalStateException(
                "Operation " + name + " has no REST form");
        }
        StringBuilder sb = new StringBuilder(service.endpoint(region));
        sb.append(path);
        char sep = '?';
        for (Map.Entry<String, String> e : queryParams.entrySet()) {
            sb.append(sep).append(encode(e.getKey()))
              .append('=').append(encode(e.getValue()));
            sep = '&';
        }
        return URI.create(sb.toString());
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8)
            .replace("+", "%20");
    }

    @Override
    public String toString() {
        return "Operation[" + name + ", " + kind + "]";
    }

    /**
     * Builder of {@link Operation}. The name and the command line arguments
     * are required; the REST form is optional.
     */
    public static class Builder {
        private final String name;
        private Kind kind = Kind.LIST;
        private Service service;
        private String method = "GET";
        private String path;
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private byte[] body;
        private final List<String> cliArgs = new ArrayList<>();
        private int cliTimeoutMs;

        private Builder(String name) {
            requireNonBlankIAE(name, "name must be non-empty");
            this.name = name;
        }

        public Builder kind(Kind k) {
            requireNonNullIAE(k, "kind must be non-null");
            this.kind = k;
            return this;
        }

        /**
         * Sets the REST form of the operation.
         *
         * @param svc the service
         * @param httpMethod the HTTP method
         * @param requestPath the path, starting with "/"
         * @return this
         */
        public Builder rest(Service svc, String httpMethod,
                            String requestPath) {
            requireNonNullIAE(svc, "service must be non-null");
            requireNonBlankIAE(httpMethod, "method must be non-empty");
            requireNonBlankIAE(requestPath, "path must be non-empty");
            if (!requestPath.startsWith("/")) {
                throw new IllegalArgumentException(
                    "path must start with /: " + requestPath);
            }
            this.service = svc;
            this.method = httpMethod.toUpperCase(Locale.ROOT);
            this.path = requestPath;
            return this;
        }

        /**
         * Adds a query parameter; null values are ignored.
         *
         * @param key the parameter name
         * @param value the value, unencoded
         * @return this
         */
        public Builder query(String key, String value) {
            if (value != null) {
                queryParams.put(key, value);
            }
            return this;
        }

        public Builder body(byte[] content) {
            this.body = content == null ? null : content.clone();
            return this;
        }

        public Builder body(String json) {
            this.body = json == null ?
                null : json.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        /**
         * Appends command line arguments.
         *
         * @param args the arguments
         * @return this
         */
        public Builder cli(String... args) {
            for (String arg : args) {
                cliArgs.add(arg);
            }
            return this;
        }

        /**
         * Appends an option and its value unless the value is null.
         *
         * @param option the option, e.g. --compartment-id
         * @param value the value
         * @return this
         */
        public Builder cliOption(String option, String value) {
            if (value != null) {
                cliArgs.add(option);
                cliArgs.add(value);
            }
            return this;
        }

        public Builder cliTimeout(int timeoutMs) {
            if (timeoutMs < 0) {
                throw new IllegalArgumentException(
                    "cliTimeout must be >= 0: " + timeoutMs);
            }
            this.cliTimeoutMs = timeoutMs;
            return this;
        }

        public Operation build() {
            if (cliArgs.isEmpty()) {
                throw new IllegalArgumentException(
                    "Operation " + name + " has no command line form");
            }
            return new Operation(this);
        }
    }
}
