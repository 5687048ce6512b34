/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import oracle.ocimetrics.util.LogUtil;

/**
 * A point in time summary of a {@link CredentialRegistry}.
 */
public class AuthReport {

    private final int totalContexts;
    private final int validContexts;
    private final boolean platformIdentityAvailable;
    private final String platformRegion;
    private final String platformTenancy;
    private final List<String> profileNames;
    private final List<String> validIdentifiers;
    private final String preferredIdentifier;
    private final List<ProfileWarning> warnings;

    AuthReport(List<CredentialContext> contexts,
               String preferredIdentifier,
               List<ProfileWarning> warnings) {
        int valid = 0;
        CredentialContext platform = null;
        List<String> profiles = new ArrayList<>();
        List<String> validIds = new ArrayList<>();
        for (CredentialContext ctx : contexts) {
            if (ctx.isValid()) {
                valid++;
                validIds.add(ctx.getIdentifier());
            }
            if (ctx.isPlatformIdentity()) {
                platform = ctx;
            } else {
                profiles.add(ctx.getIdentifier());
            }
        }
        this.totalContexts = contexts.size();
        this.validContexts = valid;
        this.platformIdentityAvailable = platform != null;
        this.platformRegion = platform == null ? null : platform.getRegion();
        this.platformTenancy =
            platform == null ? null : platform.getTenancyId();
        this.profileNames = Collections.unmodifiableList(profiles);
        this.validIdentifiers = Collections.unmodifiableList(validIds);
        this.preferredIdentifier = preferredIdentifier;
        this.warnings = Collections.unmodifiableList(
            new ArrayList<>(warnings));
    }

    public int getTotalContexts() {
        return totalContexts;
    }

    public int getValidContexts() {
        return validContexts;
    }

    public int getInvalidContexts() {
        return totalContexts - validContexts;
    }

    public boolean isPlatformIdentityAvailable() {
        return platformIdentityAvailable;
    }

    /**
     * Returns the identifiers of the user principal contexts.
     *
     * @return the identifiers in registry order
     */
    public List<String> getProfileNames() {
        return profileNames;
    }

    public List<String> getValidIdentifiers() {
        return validIdentifiers;
    }

    /**
     * Returns the identifier of the context {@link
     * CredentialRegistry#getPreferred()} selected, or null.
     *
     * @return the identifier or null
     */
    public String getPreferredIdentifier() {
        return preferredIdentifier;
    }

    public List<ProfileWarning> getWarnings() {
        return warnings;
    }

    /**
     * Renders the report for display. Tenancy identifiers are truncated.
     *
     * @return the text
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("OCI Authentication Status\n");
        sb.append("  Total contexts: ").append(totalContexts).append("\n");
        sb.append("  Valid: ").append(validContexts)
          .append(", invalid: ").append(getInvalidContexts()).append("\n");
        sb.append("  Instance principal: ");
        if (platformIdentityAvailable) {
            sb.append("available (region ").append(platformRegion)
              .append(", tenancy ")
              .append(LogUtil.truncate(platformTenancy)).append(")");
        } else {
            sb.append("not available");
        }
        sb.append("\n");
        sb.append("  Config profiles: ")
          .append(profileNames.isEmpty() ?
                  "none" : String.join(", ", profileNames))
          .append("\n");
        sb.append("  Preferred: ")
          .append(preferredIdentifier == null ? "none" : preferredIdentifier)
          .append("\n");
        for (ProfileWarning w : warnings) {
            sb.append("  Warning: ").append(w.getMessage()).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
