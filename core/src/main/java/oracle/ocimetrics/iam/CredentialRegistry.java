/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static oracle.ocimetrics.util.CheckNull.requireNonBlankIAE;
import static oracle.ocimetrics.util.CheckNull.requireNonNullIAE;
import static oracle.ocimetrics.util.LogUtil.logFine;
import static oracle.ocimetrics.util.LogUtil.logInfo;
import static oracle.ocimetrics.util.LogUtil.logWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import oracle.ocimetrics.AuthConfig;
import oracle.ocimetrics.OperationResult;
import oracle.ocimetrics.util.JsonUtil;

/**
 * The credential contexts known to one process, by identifier.
 * <p>
 * The registry is populated by {@link #initialize()}: the instance metadata
 * service is probed for a platform identity, then every complete profile of
 * the OCI configuration file becomes a user principal context whose
 * validity is set by the {@link ContextValidator}. Profiles missing a
 * required field are skipped and reported by {@link #warnings()}.
 * <p>
 * Reads run concurrently; add, remove, refresh and import are serialized.
 * Discovery and validation calls are made outside the lock, so readers are
 * not blocked by a slow probe. Contexts are kept in insertion order, which
 * {@link #getPreferred()} relies on.
 */
public class CredentialRegistry {

    /* export keys */
    static final String METHOD = "method";
    static final String TENANCY_ID = "tenancyId";
    static final String REGION = "region";
    static final String PROFILE_NAME = "profileName";
    static final String VALID = "valid";
    static final String METADATA = "metadata";
    static final String USER_ID = "userId";
    static final String FINGERPRINT = "fingerprint";
    static final String KEY_FILE_PATH = "keyFilePath";

    private final Map<String, CredentialContext> contexts =
        new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    private final String configFile;
    private final String defaultProfile;
    private final String fallbackRegion;
    private final PlatformIdentityProber identityProber;
    private final Logger logger;

    private volatile ContextValidator validator;
    private volatile List<ProfileWarning> warnings = Collections.emptyList();

    /**
     * @param config the configuration
     * @param identityProber the metadata service prober, or null to never
     * look for a platform identity
     */
    public CredentialRegistry(AuthConfig config,
                              PlatformIdentityProber identityProber) {
        requireNonNullIAE(config, "config must be non-null");
        this.configFile = config.getConfigFile();
        this.defaultProfile = config.getDefaultProfile();
        this.fallbackRegion = config.getFallbackRegion();
        this.identityProber = identityProber;
        this.logger = config.getLogger();
    }

    /**
     * Sets the validator used for loaded and imported user principal
     * contexts. Without one they are loaded invalid.
     *
     * @param validator the validator
     */
    public void setValidator(ContextValidator validator) {
        this.validator = validator;
    }

    /**
     * Discovers the platform identity and loads the configuration file,
     * replacing any existing content.
     */
    public void initialize() {
        CredentialContext platform = probePlatform();
        List<CredentialContext> profiles = loadUserPrincipals();
        replaceAll(platform, profiles);
        logInfo(logger, "Authentication initialized, " + size() +
                " context(s), instance principal " +
                (platform == null ? "not available" : "available"));
    }

    /**
     * Rebuilds every user principal context from the configuration file.
     * An existing platform identity context is kept as is; it is probed for
     * only when there is none.
     */
    public void refresh() {
        CredentialContext platform = get(CredentialContext.PLATFORM_IDENTITY_ID);
        if (platform == null) {
            platform = probePlatform();
        }
        List<CredentialContext> profiles = loadUserPrincipals();
        replaceAll(platform, profiles);
        logInfo(logger, "Authentication refreshed, " + size() +
                " context(s)");
    }

    private void replaceAll(CredentialContext platform,
                            List<CredentialContext> profiles) {
        writeLock.lock();
        try {
            contexts.clear();
            if (platform != null) {
                contexts.put(platform.getIdentifier(), platform);
            }
            for (CredentialContext ctx : profiles) {
                contexts.put(ctx.getIdentifier(), ctx);
            }
        } finally {
            writeLock.unlock();
        }
    }

    private CredentialContext probePlatform() {
        if (identityProber == null) {
            return null;
        }
        Optional<PlatformIdentitySnapshot> snapshot =
            identityProber.probePlatformIdentity();
        if (!snapshot.isPresent()) {
            return null;
        }
        if (snapshot.get().getRegion() == null) {
            logWarning(logger, "Ignoring platform identity without a region");
            return null;
        }
        return CredentialContext.platformIdentity(snapshot.get());
    }

    private List<CredentialContext> loadUserPrincipals() {
        List<ProfileRecord> records =
            OCIConfigFileReader.loadProfiles(configFile, fallbackRegion,
                                             logger);
        List<CredentialContext> loaded = new ArrayList<>();
        List<ProfileWarning> skipped = new ArrayList<>();
        for (ProfileRecord record : records) {
            if (CredentialContext.PLATFORM_IDENTITY_ID.equals(
                    record.getName())) {
                logWarning(logger, "Profile " + record.getName() +
                           " skipped, the name is reserved");
                continue;
            }
            if (!record.isComplete()) {
                ProfileWarning w = new ProfileWarning(
                    record.getName(), record.missingRequiredFields());
                logWarning(logger, w.getMessage());
                skipped.add(w);
                continue;
            }
            CredentialContext ctx = CredentialContext.userPrincipal(record);
            ctx.setValid(validate(ctx));
            loaded.add(ctx);
        }
        warnings = Collections.unmodifiableList(skipped);
        return loaded;
    }

    private boolean validate(CredentialContext ctx) {
        ContextValidator v = validator;
        if (v == null || !ctx.isComplete()) {
            return false;
        }
        try {
            return v.probe(ctx);
        } catch (RuntimeException re) {
            logFine(logger, "Validation of " + ctx.getIdentifier() +
                    " failed: " + re.getMessage());
            return false;
        }
    }

    /**
     * Returns the context with the given identifier.
     *
     * @param identifier the identifier
     * @return the context, or null if there is none
     */
    public CredentialContext get(String identifier) {
        readLock.lock();
        try {
            return contexts.get(identifier);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Returns the context calls should use when none is named. In order of
     * preference:
     * <ol>
     * <li>the platform identity, if valid</li>
     * <li>the default profile, if valid and complete</li>
     * <li>the first valid and complete context, in insertion order</li>
     * </ol>
     *
     * @return the context, or empty if none is usable
     */
    public Optional<CredentialContext> getPreferred() {
        readLock.lock();
        try {
            CredentialContext ctx =
                contexts.get(CredentialContext.PLATFORM_IDENTITY_ID);
            if (ctx != null && ctx.isUsable()) {
                return Optional.of(ctx);
            }
            ctx = contexts.get(defaultProfile);
            if (ctx != null && ctx.isUsable()) {
                return Optional.of(ctx);
            }
            for (CredentialContext c : contexts.values()) {
                if (c.isUsable()) {
                    return Optional.of(c);
                }
            }
            return Optional.empty();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Returns the identifier of the preferred context.
     *
     * @return the identifier, or null if no context is usable
     */
    public String preferredIdentifier() {
        Optional<CredentialContext> ctx = getPreferred();
        return ctx.isPresent() ? ctx.get().getIdentifier() : null;
    }

    /**
     * Adds a user principal context, invalid until it is probed. An
     * existing context with the same identifier is replaced.
     *
     * @param identifier the identifier
     * @param config the attributes of the context
     * @return the new context
     * @throws IllegalArgumentException if the identifier is the reserved
     * platform identity identifier
     */
    public CredentialContext add(String identifier, ContextConfig config) {
        requireNonBlankIAE(identifier, "identifier must be non-empty");
        requireNonNullIAE(config, "config must be non-null");
        CredentialContext ctx = config.toContext(identifier, fallbackRegion);
        writeLock.lock();
        try {
            contexts.put(identifier, ctx);
        } finally {
            writeLock.unlock();
        }
        logFine(logger, "Added context " + ctx);
        return ctx;
    }

    /**
     * Removes a context.
     *
     * @param identifier the identifier
     * @return true if a context was removed
     */
    public boolean remove(String identifier) {
        writeLock.lock();
        try {
            return contexts.remove(identifier) != null;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns a snapshot of the contexts in insertion order.
     *
     * @return a new list
     */
    public List<CredentialContext> list() {
        readLock.lock();
        try {
            return new ArrayList<>(contexts.values());
        } finally {
            readLock.unlock();
        }
    }

    public int size() {
        readLock.lock();
        try {
            return contexts.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Returns the profiles skipped by the last initialize or refresh.
     *
     * @return the warnings
     */
    public List<ProfileWarning> warnings() {
        return warnings;
    }

    /**
     * Summarizes the registry.
     *
     * @return the report
     */
    public AuthReport report() {
        List<CredentialContext> snapshot;
        String preferred;
        readLock.lock();
        try {
            snapshot = new ArrayList<>(contexts.values());
            preferred = preferredIdentifier();
        } finally {
            readLock.unlock();
        }
        return new AuthReport(snapshot, preferred, warnings);
    }

    /**
     * Exports the contexts. The user, fingerprint and key file path are
     * included only when requested; the key itself and the passphrase never
     * are.
     *
     * @param includeSecrets true to include the signing key references
     * @return identifier to attributes, in insertion order
     */
    public Map<String, Map<String, Object>> export(boolean includeSecrets) {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (CredentialContext ctx : list()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(METHOD, ctx.getScheme().getMethod());
            entry.put(TENANCY_ID, ctx.getTenancyId());
            entry.put(REGION, ctx.getRegion());
            if (ctx.getProfileName() != null) {
                entry.put(PROFILE_NAME, ctx.getProfileName());
            }
            entry.put(VALID, ctx.isValid());
            if (!ctx.getMetadata().isEmpty()) {
                entry.put(METADATA, new LinkedHashMap<>(ctx.getMetadata()));
            }
            CredentialContext.SecretRef secret = ctx.getSecretRef();
            if (includeSecrets && secret != null) {
                entry.put(USER_ID, secret.getUserId());
                entry.put(FINGERPRINT, secret.getFingerprint());
                entry.put(KEY_FILE_PATH, secret.getKeyFilePath());
            }
            result.put(ctx.getIdentifier(), entry);
        }
        return result;
    }

    /**
     * Exports the contexts as JSON.
     *
     * @param includeSecrets true to include the signing key references
     * @return the JSON text
     * @see #export(boolean)
     */
    public String exportJson(boolean includeSecrets) {
        return JsonUtil.toJson(export(includeSecrets), true);
    }

    /**
     * Imports user principal contexts from an export. Each imported context
     * is probed before it is marked valid; an exported validity flag is
     * ignored. Platform identity entries are skipped, that identity is only
     * discovered from the metadata service. Imported contexts replace
     * existing ones with the same identifier.
     *
     * @param data identifier to attributes
     * @return the outcome, with the imported, skipped and valid counts in
     * its details
     */
    public OperationResult importContexts(
        Map<String, ? extends Map<String, ?>> data) {

        requireNonNullIAE(data, "data must be non-null");
        List<CredentialContext> imported = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Map.Entry<String, ? extends Map<String, ?>> e : data.entrySet()) {
            String id = e.getKey();
            Map<String, ?> attrs = e.getValue();
            AuthScheme scheme = AuthScheme.fromName(str(attrs, METHOD));
            if (scheme != AuthScheme.USER_PRINCIPAL ||
                CredentialContext.PLATFORM_IDENTITY_ID.equals(id)) {
                skipped.add(id);
                continue;
            }
            String region = str(attrs, REGION);
            ContextConfig config = new ContextConfig()
                .setProfileName(str(attrs, PROFILE_NAME))
                .setTenancyId(str(attrs, TENANCY_ID))
                .setUserId(str(attrs, USER_ID))
                .setFingerprint(str(attrs, FINGERPRINT))
                .setKeyFilePath(str(attrs, KEY_FILE_PATH))
                .setRegion(region == null || region.isEmpty() ?
                           null : region);
            CredentialContext ctx = config.toContext(id, fallbackRegion);
            ctx.setValid(validate(ctx));
            imported.add(ctx);
        }

        int valid = 0;
        writeLock.lock();
        try {
            for (CredentialContext ctx : imported) {
                contexts.put(ctx.getIdentifier(), ctx);
                if (ctx.isValid()) {
                    valid++;
                }
            }
        } finally {
            writeLock.unlock();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("imported", imported.size());
        details.put("skipped", skipped.size());
        details.put("valid", valid);
        if (!skipped.isEmpty()) {
            logFine(logger, "Import skipped " + skipped);
        }
        return new OperationResult(true,
            "Imported " + imported.size() + " context(s), " + valid +
            " valid", details);
    }

    /**
     * Imports contexts from JSON produced by {@link #exportJson}.
     *
     * @param json the JSON text
     * @return the outcome
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public OperationResult importJson(String json) {
        requireNonNullIAE(json, "json must be non-null");
        return importContexts(JsonUtil.parseObjectOfObjects(json));
    }

    private static String str(Map<String, ?> attrs, String key) {
        Object v = attrs.get(key);
        return v == null ? null : v.toString();
    }
}
