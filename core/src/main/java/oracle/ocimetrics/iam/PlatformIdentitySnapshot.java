/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The identity of the compute instance the process runs on, as reported by
 * the instance metadata service.
 * <p>
 * The tenancy can only be derived when the instance lives in the root
 * compartment. Otherwise {@link #getTenancyId()} returns
 * {@link #AUTO_DETECTED} and {@link #isTenancyResolved()} returns false; the
 * placeholder is usable for calls made with the instance's own identity but
 * is not a tenancy OCID.
 */
public class PlatformIdentitySnapshot {

    /**
     * Placeholder tenancy of an instance outside the root compartment
     */
    public static final String AUTO_DETECTED = "auto-detected";

    static final String DEFAULT_FAULT_DOMAIN = "FAULT-DOMAIN-1";

    private final String instanceId;
    private final String compartmentId;
    private final String tenancyId;
    private final String availabilityDomain;
    private final String faultDomain;
    private final String region;
    private final String shape;
    private final String displayName;
    private final String timeCreated;
    private final String lifecycleState;

    PlatformIdentitySnapshot(Map<String, String> fields) {
        instanceId = fields.get("id");
        compartmentId = fields.get("compartmentId");
        availabilityDomain = fields.get("availabilityDomain");
        String fd = fields.get("faultDomain");
        faultDomain = (fd == null || fd.isEmpty()) ? DEFAULT_FAULT_DOMAIN : fd;
        String canonical = fields.get("canonicalRegionName");
        String shortName = fields.get("region");
        if (canonical != null && !canonical.isEmpty()) {
            region = canonical;
        } else if (shortName != null && !shortName.isEmpty()) {
            region = shortName;
        } else {
            region = null;
        }
        shape = fields.get("shape");
        displayName = fields.get("displayName");
        timeCreated = fields.get("timeCreated");
        lifecycleState = fields.get("lifecycleState");

        String tenancy = Utils.tenancyFromCompartment(compartmentId);
        tenancyId = (tenancy == null) ? AUTO_DETECTED : tenancy;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getCompartmentId() {
        return compartmentId;
    }

    /**
     * Returns the tenancy OCID, or {@link #AUTO_DETECTED}.
     *
     * @return the tenancy
     */
    public String getTenancyId() {
        return tenancyId;
    }

    /**
     * Returns true if the tenancy is a real OCID rather than the
     * {@link #AUTO_DETECTED} placeholder.
     *
     * @return true if the tenancy was derived
     */
    public boolean isTenancyResolved() {
        return !AUTO_DETECTED.equals(tenancyId);
    }

    public String getAvailabilityDomain() {
        return availabilityDomain;
    }

    public String getFaultDomain() {
        return faultDomain;
    }

    /**
     * Returns the region, preferring the canonical name.
     *
     * @return the region, or null if the metadata names none
     */
    public String getRegion() {
        return region;
    }

    public String getShape() {
        return shape;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getTimeCreated() {
        return timeCreated;
    }

    public String getLifecycleState() {
        return lifecycleState;
    }

    /**
     * Returns the instance attributes kept as the metadata of the platform
     * identity context. Absent attributes are left out.
     *
     * @return an unmodifiable map
     */
    public Map<String, String> toMetadata() {
        Map<String, String> map = new LinkedHashMap<>();
        put(map, "instanceId", instanceId);
        put(map, "compartmentId", compartmentId);
        put(map, "availabilityDomain", availabilityDomain);
        put(map, "faultDomain", faultDomain);
        put(map, "shape", shape);
        put(map, "displayName", displayName);
        put(map, "timeCreated", timeCreated);
        put(map, "lifecycleState", lifecycleState);
        return Collections.unmodifiableMap(map);
    }

    private static void put(Map<String, String> map, String k, String v) {
        if (v != null) {
            map.put(k, v);
        }
    }

    @Override
    public String toString() {
        return "PlatformIdentitySnapshot[region=" + region +
            ", shape=" + shape +
            ", tenancyResolved=" + isTenancyResolved() + "]";
    }
}
