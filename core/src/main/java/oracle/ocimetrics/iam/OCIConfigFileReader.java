/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static oracle.ocimetrics.util.LogUtil.logFine;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads an Oracle Cloud Infrastructure (OCI) configuration file.
 * <p>
 * The file is made of profile sections:
 * <pre>
 * [DEFAULT]
 * user=ocid1.user.oc1..aaa...
 * fingerprint=20:3b:97:13:55:1c:...
 * key_file=~/.oci/oci_api_key.pem
 * tenancy=ocid1.tenancy.oc1..aaa...
 * region=us-phoenix-1
 * </pre>
 * Two ways of reading are provided. {@link #loadProfiles} is lenient: it
 * never throws, skips lines it cannot interpret and returns every section as
 * a {@link ProfileRecord}. {@link #parse(String, String)} is strict: a
 * malformed line or an unknown profile is an error, and keys missing from
 * the selected profile are looked up in the DEFAULT profile.
 */
public class OCIConfigFileReader {

    public static final String DEFAULT_PROFILE_NAME = "DEFAULT";

    static final String FINGERPRINT_PROP = "fingerprint";
    static final String TENANCY_PROP = "tenancy";
    static final String USER_PROP = "user";
    static final String KEY_FILE_PROP = "key_file";
    static final String PASSPHRASE_PROP = "pass_phrase";
    static final String REGION_PROP = "region";

    private static final String INVALID_LINE_MSG =
        "Invalid line in OCI configuration file, expected " +
        "\"key=value\" or \"[profile-name]\", found ";

    /**
     * Loads every profile of the file at the given path. A missing or
     * unreadable file yields an empty list.
     *
     * @param configFilePath the path, <code>~/</code> is expanded
     * @param fallbackRegion region of profiles that do not name one
     * @param logger logger, may be null
     * @return the profiles in file order
     */
    public static List<ProfileRecord> loadProfiles(String configFilePath,
                                                   String fallbackRegion,
                                                   Logger logger) {
        File file = new File(Utils.expandUserHome(configFilePath));
        if (!file.isFile()) {
            logFine(logger, "OCI configuration file not found: " + file);
            return Collections.emptyList();
        }

        OCIConfigAccumulator accumulator = new OCIConfigAccumulator(false);
        try {
            accumulate(new FileInputStream(file), accumulator);
        } catch (IOException ioe) {
            logFine(logger, "Unable to read OCI configuration file " + file +
                    ": " + ioe.getMessage());
            return Collections.emptyList();
        }
        for (String skipped : accumulator.skippedLines) {
            logFine(logger, "Ignored malformed " + skipped + " in " + file);
        }

        List<ProfileRecord> profiles = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> entry :
                 accumulator.configs.entrySet()) {
            profiles.add(new ProfileRecord(entry.getKey(), entry.getValue(),
                                           fallbackRegion));
        }
        return profiles;
    }

    /**
     * Create a new instance using a file at a given location.
     *
     * @param configFilePath The path to the config file.
     * @param profile The profile name to load, or null if you want to load the
     * "DEFAULT" profile.
     * @return A new OCIConfigFile instance.
     * @throws IOException if the file could not be read.
     */
    public static OCIConfigFile parse(String configFilePath, String profile)
        throws IOException {

        return parse(new FileInputStream(
            new File(Utils.expandUserHome(configFilePath))), profile);
    }

    /**
     * Create a new instance using an UTF-8 input stream.
     *
     * @param configStream The config file content.
     * @param profile The profile name to load, or null if you want to load the
     * "DEFAULT" profile.
     * @return A new OCIConfigFile instance.
     * @throws IOException if the stream could not be read.
     */
    public static OCIConfigFile parse(InputStream configStream, String profile)
        throws IOException {

        OCIConfigAccumulator accumulator = new OCIConfigAccumulator(true);
        accumulate(configStream, accumulator);
        if (profile != null &&
            !accumulator.configs.containsKey(profile)) {

            throw new IllegalArgumentException(
                "No profile named " + profile +
                " exists in the OCI configuration file");
        }

        return new OCIConfigFile(accumulator, profile);
    }

    private static void accumulate(InputStream configStream,
                                   OCIConfigAccumulator accumulator)
        throws IOException {

        try (BufferedReader reader = new BufferedReader(
                 new InputStreamReader(configStream, StandardCharsets.UTF_8))) {

            String line = null;
            while ((line = reader.readLine()) != null) {
                accumulator.accept(line);
            }
        }
    }

    static String missing(String propertyName) {
        return "Required property " + propertyName +
            " is missing from OCI configuration file." +
            " For more information about OCI configuration file and" +
            " how to get required information," +
            " see https://docs.oracle.com" +
            "/en-us/iaas/Content/API/Concepts/sdkconfig.htm";
    }

    private OCIConfigFileReader() {}

    /**
     * OCIConfigFile represents a simple lookup mechanism for one profile of
     * an OCI config file.
     */
    public static final class OCIConfigFile {
        private final OCIConfigAccumulator accumulator;
        private final String profile;

        private OCIConfigFile(OCIConfigAccumulator accumulator,
                              String profile) {
            this.accumulator = accumulator;
            this.profile = profile;
        }

        /**
         * Gets the value associated with a given key. The value returned will
         * be the one for the selected profile (if available), else the value in
         * the DEFAULT profile (if specified), else null.
         *
         * @param key the key
         * @return the value
         */
        public String get(String key) {
            if (profile != null &&
                (accumulator.configs.get(profile).containsKey(key))) {
                return accumulator.configs.get(profile).get(key);
            }
            return accumulator.foundDefaultProfile ?
                accumulator.configs.get(DEFAULT_PROFILE_NAME).get(key) :
                null;
        }

        /**
         * Returns the value of a required key.
         *
         * @param key the key
         * @return the value
         * @throws IllegalArgumentException if the key has no value
         */
        public String require(String key) {
            String value = get(key);
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException(missing(key));
            }
            return value;
        }
    }

    private static final class OCIConfigAccumulator {
        final Map<String, Map<String, String>> configs = new LinkedHashMap<>();
        final List<String> skippedLines = new ArrayList<>();
        private final boolean strict;
        private String currentProfile = null;
        private boolean foundDefaultProfile = false;
        private int lineNumber;

        OCIConfigAccumulator(boolean strict) {
            this.strict = strict;
        }

        private void accept(String line) {
            lineNumber++;
            final String trimmedLine = line.trim();

            /* no blank lines */
            if (trimmedLine.isEmpty()) {
                return;
            }

            /* skip comments */
            if (trimmedLine.charAt(0) == '#' || trimmedLine.charAt(0) == ';') {
                return;
            }

            if (trimmedLine.charAt(0) == '[' &&
                trimmedLine.charAt(trimmedLine.length() - 1) == ']') {
                String name = trimmedLine
                    .substring(1, trimmedLine.length() - 1).trim();

                if (name.isEmpty()) {
                    invalid(INVALID_LINE_MSG + "[]");
                    currentProfile = null;
                    return;
                }
                currentProfile = name;
                if (currentProfile.equals(DEFAULT_PROFILE_NAME)) {
                    foundDefaultProfile = true;
                }
                if (!configs.containsKey(currentProfile)) {
                    configs.put(currentProfile,
                                new LinkedHashMap<String, String>());
                }
                return;
            }

            final int splitIndex = trimmedLine.indexOf('=');
            if (splitIndex == -1) {
                invalid(INVALID_LINE_MSG + line);
                return;
            }

            final String key = trimmedLine.substring(0, splitIndex).trim();
            final String value = trimmedLine.substring(splitIndex + 1).trim();
            if (key.isEmpty()) {
                invalid(INVALID_LINE_MSG + line);
                return;
            }

            if (currentProfile == null) {
                invalid("Invalid OCI configuration file: " +
                        "no profile specified");
                return;
            }

            configs.get(currentProfile).put(key, value);
        }

        private void invalid(String msg) {
            if (strict) {
                throw new IllegalArgumentException(msg);
            }
            /* the content is not kept, it may be a secret */
            skippedLines.add("line " + lineNumber);
        }
    }
}
