/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

import java.io.File;
import java.util.logging.Logger;

/**
 * An AuthConfig instance holds the configuration of an
 * {@link AuthenticationManager}: where the OCI configuration file lives,
 * which profile is preferred, the timeouts of the blocking operations, the
 * command line tool to fall back to and whether the signed REST path is
 * used at all.
 * <p>
 * All setters return this instance so calls can be chained. Defaults:
 * <ul>
 * <li>configuration file: <code>~/.oci/config</code></li>
 * <li>default profile: <code>DEFAULT</code></li>
 * <li>fallback region: <code>us-ashburn-1</code></li>
 * <li>instance metadata probe timeout: 2 seconds</li>
 * <li>HTTP request timeout: 30 seconds</li>
 * <li>command line timeout: 30 seconds</li>
 * <li>command line executable: <code>oci</code></li>
 * <li>REST mode: disabled</li>
 * </ul>
 * {@link #fromEnvironment()} applies the standard OCI environment variables
 * on top of the defaults.
 */
public class AuthConfig {

    /**
     * Default configuration file at <code>~/.oci/config</code>
     */
    public static final String DEFAULT_CONFIG_FILE =
        System.getProperty("user.home") + File.separator +
            ".oci" + File.separator + "config";

    public static final String DEFAULT_PROFILE_NAME = "DEFAULT";

    public static final String DEFAULT_REGION = "us-ashburn-1";

    public static final String DEFAULT_CLI_EXECUTABLE = "oci";

    public static final String DEFAULT_METADATA_BASE_URL =
        "http://169.254.169.254/opc/";

    private static final int DEFAULT_METADATA_TIMEOUT = 2000;
    private static final int DEFAULT_REQUEST_TIMEOUT = 30000;
    private static final int DEFAULT_CLI_TIMEOUT = 30000;

    /* environment variables read by fromEnvironment() */
    static final String CONFIG_FILE_ENV = "OCI_CONFIG_FILE";
    static final String CONFIG_PROFILE_ENV = "OCI_CONFIG_PROFILE";
    static final String REGION_ENV = "OCI_REGION";
    static final String CLI_PATH_ENV = "OCI_CLI_PATH";
    static final String USE_REST_ENV = "OCI_USE_REST_API";

    private String configFile = DEFAULT_CONFIG_FILE;
    private String defaultProfile = DEFAULT_PROFILE_NAME;
    private String fallbackRegion = DEFAULT_REGION;
    private String cliExecutable = DEFAULT_CLI_EXECUTABLE;
    private String metadataBaseURL = DEFAULT_METADATA_BASE_URL;
    private int metadataTimeout = DEFAULT_METADATA_TIMEOUT;
    private int requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private int cliTimeout = DEFAULT_CLI_TIMEOUT;
    private boolean restEnabled;
    private boolean probePlatformIdentity = true;

    private String proxyHost;
    private int proxyPort;

    private Logger logger;

    /**
     * Creates a configuration with default values.
     */
    public AuthConfig() {
    }

    /**
     * Creates a configuration with default values overridden by the
     * environment variables <code>OCI_CONFIG_FILE</code>,
     * <code>OCI_CONFIG_PROFILE</code>, <code>OCI_REGION</code>,
     * <code>OCI_CLI_PATH</code> and <code>OCI_USE_REST_API</code>, where set.
     *
     * @return the configuration
     */
    public static AuthConfig fromEnvironment() {
        AuthConfig config = new AuthConfig();
        String value = System.getenv(CONFIG_FILE_ENV);
        if (notEmpty(value)) {
            config.setConfigFile(value);
        }
        value = System.getenv(CONFIG_PROFILE_ENV);
        if (notEmpty(value)) {
            config.setDefaultProfile(value);
        }
        value = System.getenv(REGION_ENV);
        if (notEmpty(value)) {
            config.setFallbackRegion(value);
        }
        value = System.getenv(CLI_PATH_ENV);
        if (notEmpty(value)) {
            config.setCliExecutable(value);
        }
        value = System.getenv(USE_REST_ENV);
        if (notEmpty(value)) {
            config.setRestEnabled(Boolean.parseBoolean(value.trim()));
        }
        return config;
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.trim().isEmpty();
    }

    /**
     * Sets the path of the OCI configuration file. A leading
     * <code>~/</code> is expanded to the user's home directory when the
     * file is read.
     *
     * @param configFile the path
     * @return this
     */
    public AuthConfig setConfigFile(String configFile) {
        requireValue(configFile, "configFile");
        this.configFile = configFile;
        return this;
    }

    public String getConfigFile() {
        return configFile;
    }

    /**
     * Returns true if the configuration file is not the default one, in which
     * case it is passed to the command line tool explicitly.
     *
     * @return true if a non-default file is configured
     */
    public boolean isCustomConfigFile() {
        return !DEFAULT_CONFIG_FILE.equals(configFile);
    }

    /**
     * Sets the name of the profile preferred after the platform identity.
     *
     * @param defaultProfile the profile name
     * @return this
     */
    public AuthConfig setDefaultProfile(String defaultProfile) {
        requireValue(defaultProfile, "defaultProfile");
        this.defaultProfile = defaultProfile;
        return this;
    }

    public String getDefaultProfile() {
        return defaultProfile;
    }

    /**
     * Sets the region used for profiles that do not name one.
     *
     * @param fallbackRegion the region identifier, e.g. us-ashburn-1
     * @return this
     */
    public AuthConfig setFallbackRegion(String fallbackRegion) {
        requireValue(fallbackRegion, "fallbackRegion");
        this.fallbackRegion = fallbackRegion;
        return this;
    }

    public String getFallbackRegion() {
        return fallbackRegion;
    }

    /**
     * Sets the command line executable used on the fallback path.
     *
     * @param cliExecutable the executable name or path
     * @return this
     */
    public AuthConfig setCliExecutable(String cliExecutable) {
        requireValue(cliExecutable, "cliExecutable");
        this.cliExecutable = cliExecutable;
        return this;
    }

    public String getCliExecutable() {
        return cliExecutable;
    }

    /**
     * Sets the base URL of the instance metadata service. The default is
     * the link-local address of the OCI metadata service.
     *
     * @param metadataBaseURL the base URL, ending with "/"
     * @return this
     */
    public AuthConfig setMetadataBaseURL(String metadataBaseURL) {
        requireValue(metadataBaseURL, "metadataBaseURL");
        this.metadataBaseURL = metadataBaseURL.endsWith("/") ?
            metadataBaseURL : metadataBaseURL + "/";
        return this;
    }

    public String getMetadataBaseURL() {
        return metadataBaseURL;
    }

    /**
     * Sets the timeout of the instance metadata probe in milliseconds.
     *
     * @param timeout the timeout
     * @return this
     */
    public AuthConfig setMetadataTimeout(int timeout) {
        requirePositive(timeout, "metadataTimeout");
        this.metadataTimeout = timeout;
        return this;
    }

    public int getMetadataTimeout() {
        return metadataTimeout;
    }

    /**
     * Sets the timeout of signed REST requests in milliseconds.
     *
     * @param timeout the timeout
     * @return this
     */
    public AuthConfig setRequestTimeout(int timeout) {
        requirePositive(timeout, "requestTimeout");
        this.requestTimeout = timeout;
        return this;
    }

    public int getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Sets the default timeout of command line invocations in milliseconds.
     *
     * @param timeout the timeout
     * @return this
     */
    public AuthConfig setCliTimeout(int timeout) {
        requirePositive(timeout, "cliTimeout");
        this.cliTimeout = timeout;
        return this;
    }

    public int getCliTimeout() {
        return cliTimeout;
    }

    /**
     * Enables or disables the signed REST path. When disabled every call
     * goes straight to the command line tool.
     *
     * @param enable true to try REST first
     * @return this
     */
    public AuthConfig setRestEnabled(boolean enable) {
        this.restEnabled = enable;
        return this;
    }

    public boolean isRestEnabled() {
        return restEnabled;
    }

    /**
     * Controls whether the instance metadata service is probed during
     * initialization. Disabling the probe avoids the probe timeout on hosts
     * that are known not to run in OCI.
     *
     * @param probe false to skip the probe
     * @return this
     */
    public AuthConfig setProbePlatformIdentity(boolean probe) {
        this.probePlatformIdentity = probe;
        return this;
    }

    public boolean getProbePlatformIdentity() {
        return probePlatformIdentity;
    }

    /**
     * Sets an HTTP proxy host for signed REST requests. The port must be
     * set as well.
     *
     * @param proxyHost the proxy host
     * @return this
     */
    public AuthConfig setProxyHost(String proxyHost) {
        this.proxyHost = proxyHost;
        return this;
    }

    public String getProxyHost() {
        return proxyHost;
    }

    /**
     * Sets the port of the HTTP proxy.
     *
     * @param proxyPort the proxy port
     * @return this
     */
    public AuthConfig setProxyPort(int proxyPort) {
        this.proxyPort = proxyPort;
        return this;
    }

    public int getProxyPort() {
        return proxyPort;
    }

    /**
     * Sets the logger used by every component. If not set, the logger named
     * <code>oracle.ocimetrics</code> is used.
     *
     * @param logger the logger
     * @return this
     */
    public AuthConfig setLogger(Logger logger) {
        this.logger = logger;
        return this;
    }

    public Logger getLogger() {
        if (logger == null) {
            logger = Logger.getLogger("oracle.ocimetrics");
        }
        return logger;
    }

    private static void requireValue(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(
                name + " must be a non-empty string");
        }
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(
                name + " must be greater than 0: " + value);
        }
    }

    @Override
    public String toString() {
        return "AuthConfig[configFile=" + configFile +
            ", defaultProfile=" + defaultProfile +
            ", fallbackRegion=" + fallbackRegion +
            ", cliExecutable=" + cliExecutable +
            ", restEnabled=" + restEnabled +
            ", metadataTimeout=" + metadataTimeout +
            ", requestTimeout=" + requestTimeout +
            ", cliTimeout=" + cliTimeout + "]";
    }
}
