/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods to facilitate Logging.
 */
public class LogUtil {

    /* number of leading characters kept when an identifier is displayed */
    public static final int DISPLAY_PREFIX_LENGTH = 20;

    public static boolean isFineEnabled(Logger logger) {
        return logger != null && logger.isLoggable(Level.FINE);
    }

    public static void logWarning(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.WARNING, msg);
        }
    }

    public static void logInfo(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.INFO, msg);
        }
    }

    public static void logFine(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.FINE, msg);
        }
    }

    /**
     * Trace == FINE
     */
    public static void logTrace(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.FINE, msg);
        }
    }

    /**
     * Shortens an identifier such as a tenancy or user OCID so that it can
     * appear in logs and reports without exposing the full value.
     *
     * @param id the identifier, may be null
     * @return the first {@value #DISPLAY_PREFIX_LENGTH} characters followed
     * by "...", or the identifier itself if it is short enough
     */
    public static String truncate(String id) {
        if (id == null) {
            return null;
        }
        if (id.length() <= DISPLAY_PREFIX_LENGTH) {
            return id;
        }
        return id.substring(0, DISPLAY_PREFIX_LENGTH) + "...";
    }
}
