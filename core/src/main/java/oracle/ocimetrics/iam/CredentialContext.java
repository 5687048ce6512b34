/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static oracle.ocimetrics.util.CheckNull.isBlank;
import static oracle.ocimetrics.util.CheckNull.requireNonBlankIAE;
import static oracle.ocimetrics.util.CheckNull.requireNonNullIAE;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import oracle.ocimetrics.util.LogUtil;

/**
 * One independently usable credential: a scheme, a tenancy, a region and,
 * for a user principal, a reference to the signing key.
 * <p>
 * Everything but the validity flag is immutable. The flag caches the result
 * of the last validity probe; it is not a guarantee that a call made with
 * the context will be accepted.
 * <p>
 * At most one platform identity context exists in a registry, under the
 * identifier {@link #PLATFORM_IDENTITY_ID}.
 */
public class CredentialContext {

    /**
     * The reserved identifier of the platform identity context
     */
    public static final String PLATFORM_IDENTITY_ID = "instance_principal";

    private final String identifier;
    private final AuthScheme scheme;
    private final String tenancyId;
    private final String region;
    private final String profileName;
    private final SecretRef secretRef;
    private final Map<String, String> metadata;

    private volatile boolean valid;

    private CredentialContext(String identifier,
                              AuthScheme scheme,
                              String tenancyId,
                              String region,
                              String profileName,
                              SecretRef secretRef,
                              Map<String, String> metadata,
                              boolean valid) {
        this.identifier = identifier;
        this.scheme = scheme;
        this.tenancyId = tenancyId;
        this.region = region;
        this.profileName = profileName;
        this.secretRef = secretRef;
        this.metadata = (metadata == null) ? Collections.emptyMap() :
            Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.valid = valid;
    }

    /**
     * Creates the platform identity context of an instance. It is valid
     * from the start.
     *
     * @param snapshot the instance identity
     * @return the context
     * @throws IllegalArgumentException if the snapshot has no region
     */
    public static CredentialContext platformIdentity(
        PlatformIdentitySnapshot snapshot) {

        requireNonNullIAE(snapshot, "snapshot must be non-null");
        requireNonBlankIAE(snapshot.getRegion(),
                           "instance region must be non-empty");
        return new CredentialContext(PLATFORM_IDENTITY_ID,
                                     AuthScheme.PLATFORM_IDENTITY,
                                     snapshot.getTenancyId(),
                                     snapshot.getRegion(),
                                     null,
                                     null,
                                     snapshot.toMetadata(),
                                     true);
    }

    /**
     * Creates a user principal context from a profile of the configuration
     * file. The context is created invalid; it must be probed before use.
     *
     * @param profile the profile
     * @return the context
     */
    public static CredentialContext userPrincipal(ProfileRecord profile) {
        requireNonNullIAE(profile, "profile must be non-null");
        return userPrincipal(profile.getName(),
                             profile.getName(),
                             profile.getTenancy(),
                             profile.getRegion(),
                             new SecretRef(profile.getUser(),
                                           profile.getFingerprint(),
                                           profile.getKeyFile(),
                                           profile.getPassPhrase()),
                             false);
    }

    /**
     * Creates a user principal context.
     *
     * @param identifier the registry identifier, not the reserved platform
     * identity identifier
     * @param profileName the profile name
     * @param tenancyId the tenancy OCID
     * @param region the region
     * @param secretRef the signing key reference
     * @param valid the initial validity
     * @return the context
     */
    public static CredentialContext userPrincipal(String identifier,
                                                  String profileName,
                                                  String tenancyId,
                                                  String region,
                                                  SecretRef secretRef,
                                                  boolean valid) {
        requireNonBlankIAE(identifier, "identifier must be non-empty");
        if (PLATFORM_IDENTITY_ID.equals(identifier)) {
            throw new IllegalArgumentException(
                "The identifier " + PLATFORM_IDENTITY_ID +
                " is reserved for the platform identity");
        }
        requireNonBlankIAE(region, "region must be non-empty");
        return new CredentialContext(identifier,
                                     AuthScheme.USER_PRINCIPAL,
                                     tenancyId,
                                     region,
                                     profileName,
                                     secretRef == null ?
                                         new SecretRef(null, null, null, null) :
                                         secretRef,
                                     null,
                                     valid);
    }

    public String getIdentifier() {
        return identifier;
    }

    public AuthScheme getScheme() {
        return scheme;
    }

    public boolean isPlatformIdentity() {
        return scheme == AuthScheme.PLATFORM_IDENTITY;
    }

    public String getTenancyId() {
        return tenancyId;
    }

    /**
     * Returns true unless the tenancy is the placeholder of a platform
     * identity whose tenancy could not be derived.
     *
     * @return true if the tenancy is an OCID
     */
    public boolean isTenancyResolved() {
        return !isBlank(tenancyId) &&
            !PlatformIdentitySnapshot.AUTO_DETECTED.equals(tenancyId);
    }

    public String getRegion() {
        return region;
    }

    /**
     * Returns the profile name of a user principal, null for the platform
     * identity.
     *
     * @return the profile name or null
     */
    public String getProfileName() {
        return profileName;
    }

    /**
     * Returns the signing key reference of a user principal, null for the
     * platform identity.
     *
     * @return the reference or null
     */
    public SecretRef getSecretRef() {
        return secretRef;
    }

    /**
     * Returns the instance attributes of the platform identity, empty for a
     * user principal.
     *
     * @return an unmodifiable map
     */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    /**
     * Returns true if the context has everything a call needs. A user
     * principal needs the tenancy, the user, the fingerprint and the key
     * file; the platform identity always has what it needs.
     *
     * @return true if the context is complete
     */
    public boolean isComplete() {
        if (isPlatformIdentity()) {
            return true;
        }
        return !isBlank(tenancyId) && secretRef.isComplete();
    }

    /**
     * Returns true if the context may be selected for a call: it is
     * complete and its last probe succeeded.
     *
     * @return true if usable
     */
    public boolean isUsable() {
        return valid && isComplete();
    }

    @Override
    public String toString() {
        return "CredentialContext[id=" + identifier +
            ", scheme=" + scheme +
            ", tenancy=" + LogUtil.truncate(tenancyId) +
            ", region=" + region +
            ", valid=" + valid + "]";
    }

    /**
     * The signing key reference of a user principal. The key itself is
     * never held here, only the path of its file.
     */
    public static final class SecretRef {
        private final String userId;
        private final String fingerprint;
        private final String keyFilePath;
        private final String passphrase;

        /**
         * @param userId the user OCID
         * @param fingerprint the fingerprint of the public key
         * @param keyFilePath the path of the PEM private key
         * @param passphrase the passphrase of the key, null if the key is
         * not encrypted
         */
        public SecretRef(String userId,
                         String fingerprint,
                         String keyFilePath,
                         String passphrase) {
            this.userId = userId;
            this.fingerprint = fingerprint;
            this.keyFilePath = keyFilePath;
            this.passphrase = passphrase;
        }

        public String getUserId() {
            return userId;
        }

        public String getFingerprint() {
            return fingerprint;
        }

        public String getKeyFilePath() {
            return keyFilePath;
        }

        /**
         * Returns a new copy of the passphrase characters, which the caller
         * should erase after use.
         *
         * @return the characters, or null if there is no passphrase
         */
        public char[] getPassphraseCharacters() {
            return isBlank(passphrase) ? null : passphrase.toCharArray();
        }

        public boolean hasPassphrase() {
            return !isBlank(passphrase);
        }

        boolean isComplete() {
            return !isBlank(userId) && !isBlank(fingerprint) &&
                !isBlank(keyFilePath);
        }

        @Override
        public String toString() {
            return "SecretRef[user=" + LogUtil.truncate(userId) + "]";
        }
    }
}
