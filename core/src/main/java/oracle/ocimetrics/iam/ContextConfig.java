/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

/**
 * The attributes of a user principal context added to a registry at run
 * time, outside the configuration file. Setters return this instance.
 */
public class ContextConfig {

    private String profileName;
    private String tenancyId;
    private String userId;
    private String fingerprint;
    private String keyFilePath;
    private String passphrase;
    private String region;

    public ContextConfig setProfileName(String profileName) {
        this.profileName = profileName;
        return this;
    }

    public String getProfileName() {
        return profileName;
    }

    public ContextConfig setTenancyId(String tenancyId) {
        this.tenancyId = tenancyId;
        return this;
    }

    public String getTenancyId() {
        return tenancyId;
    }

    public ContextConfig setUserId(String userId) {
        this.userId = userId;
        return this;
    }

    public String getUserId() {
        return userId;
    }

    public ContextConfig setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
        return this;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    /**
     * Sets the path of the PEM private key. A leading <code>~/</code> is
     * expanded.
     *
     * @param keyFilePath the path
     * @return this
     */
    public ContextConfig setKeyFilePath(String keyFilePath) {
        this.keyFilePath = keyFilePath;
        return this;
    }

    public String getKeyFilePath() {
        return keyFilePath;
    }

    public ContextConfig setPassphrase(String passphrase) {
        this.passphrase = passphrase;
        return this;
    }

    String getPassphrase() {
        return passphrase;
    }

    /**
     * Sets the region. If not set, the fallback region of the registry is
     * used.
     *
     * @param region the region
     * @return this
     */
    public ContextConfig setRegion(String region) {
        this.region = region;
        return this;
    }

    public String getRegion() {
        return region;
    }

    CredentialContext toContext(String identifier, String fallbackRegion) {
        String keyFile = (keyFilePath == null) ?
            null : Utils.expandUserHome(keyFilePath);
        return CredentialContext.userPrincipal(
            identifier,
            profileName == null ? identifier : profileName,
            tenancyId,
            region == null ? fallbackRegion : region,
            new CredentialContext.SecretRef(userId, fingerprint,
                                            keyFile, passphrase),
            false);
    }
}
