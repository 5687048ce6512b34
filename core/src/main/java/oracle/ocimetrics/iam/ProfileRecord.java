/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static oracle.ocimetrics.iam.OCIConfigFileReader.FINGERPRINT_PROP;
import static oracle.ocimetrics.iam.OCIConfigFileReader.KEY_FILE_PROP;
import static oracle.ocimetrics.iam.OCIConfigFileReader.PASSPHRASE_PROP;
import static oracle.ocimetrics.iam.OCIConfigFileReader.REGION_PROP;
import static oracle.ocimetrics.iam.OCIConfigFileReader.TENANCY_PROP;
import static oracle.ocimetrics.iam.OCIConfigFileReader.USER_PROP;
import static oracle.ocimetrics.util.CheckNull.isBlank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One profile section of an OCI configuration file. Every field is optional
 * at this stage; {@link #isComplete()} tells whether the four fields needed
 * for request signing are present. Keys this class does not know about are
 * kept in {@link #properties()}.
 */
public class ProfileRecord {

    static final String[] REQUIRED_FIELDS = {
        TENANCY_PROP, USER_PROP, FINGERPRINT_PROP, KEY_FILE_PROP
    };

    private final String name;
    private final Map<String, String> properties;
    private final String fallbackRegion;

    /**
     * @param name the profile name
     * @param properties the key value pairs of the section, in file order
     * @param fallbackRegion region used when the section has none
     */
    public ProfileRecord(String name,
                         Map<String, String> properties,
                         String fallbackRegion) {
        this.name = name;
        this.properties =
            Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.fallbackRegion = fallbackRegion;
    }

    public String getName() {
        return name;
    }

    public String getTenancy() {
        return value(TENANCY_PROP);
    }

    public String getUser() {
        return value(USER_PROP);
    }

    public String getFingerprint() {
        return value(FINGERPRINT_PROP);
    }

    /**
     * Returns the private key path with a leading <code>~/</code> expanded.
     *
     * @return the path or null
     */
    public String getKeyFile() {
        String keyFile = value(KEY_FILE_PROP);
        return keyFile == null ? null : Utils.expandUserHome(keyFile);
    }

    public String getPassPhrase() {
        return value(PASSPHRASE_PROP);
    }

    /**
     * Returns the region of the profile, or the fallback region if the
     * profile does not name one.
     *
     * @return the region
     */
    public String getRegion() {
        String region = value(REGION_PROP);
        return region == null ? fallbackRegion : region;
    }

    /**
     * Returns true if the profile names its own region.
     *
     * @return true if a region key is present
     */
    public boolean hasRegion() {
        return value(REGION_PROP) != null;
    }

    /**
     * Returns every key of the section, including the ones this class has
     * typed accessors for.
     *
     * @return an unmodifiable map
     */
    public Map<String, String> properties() {
        return properties;
    }

    /**
     * Returns the required keys that are absent or blank.
     *
     * @return the missing keys, empty if the profile is complete
     */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (value(field) == null) {
                missing.add(field);
            }
        }
        return missing;
    }

    public boolean isComplete() {
        return missingRequiredFields().isEmpty();
    }

    private String value(String key) {
        String v = properties.get(key);
        return isBlank(v) ? null : v;
    }

    @Override
    public String toString() {
        return "ProfileRecord[name=" + name +
            ", region=" + getRegion() +
            ", complete=" + isComplete() + "]";
    }
}
