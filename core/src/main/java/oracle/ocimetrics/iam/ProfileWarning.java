/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import java.util.Collections;
import java.util.List;

/**
 * Records a profile of the configuration file that was not turned into a
 * credential context, and the required fields it lacks.
 */
public class ProfileWarning {

    private final String profileName;
    private final List<String> missingFields;

    public ProfileWarning(String profileName, List<String> missingFields) {
        this.profileName = profileName;
        this.missingFields = Collections.unmodifiableList(missingFields);
    }

    public String getProfileName() {
        return profileName;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }

    public String getMessage() {
        return "Profile " + profileName +
            " skipped, missing required fields: " +
            String.join(", ", missingFields);
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
