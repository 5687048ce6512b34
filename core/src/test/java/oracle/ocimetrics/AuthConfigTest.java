/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.logging.Logger;

import org.junit.Test;

public class AuthConfigTest {

    @Test
    public void testDefaults() {
        AuthConfig config = new AuthConfig();
        assertEquals(AuthConfig.DEFAULT_CONFIG_FILE, config.getConfigFile());
        assertFalse(config.isCustomConfigFile());
        assertEquals("DEFAULT", config.getDefaultProfile());
        assertEquals("us-ashburn-1", config.getFallbackRegion());
        assertEquals("oci", config.getCliExecutable());
        assertEquals("http://169.254.169.254/opc/",
                     config.getMetadataBaseURL());
        assertFalse(config.isRestEnabled());
        assertTrue(config.getProbePlatformIdentity());
        assertTrue(config.getMetadataTimeout() > 0);
        assertTrue(config.getRequestTimeout() > 0);
        assertTrue(config.getCliTimeout() > 0);
        assertNotNull(config.getLogger());
        assertEquals("oracle.ocimetrics", config.getLogger().getName());
    }

    @Test
    public void testSetters() {
        Logger logger = Logger.getLogger("test.auth");
        AuthConfig config = new AuthConfig()
            .setConfigFile("/etc/oci/config")
            .setDefaultProfile("ops")
            .setFallbackRegion("eu-frankfurt-1")
            .setCliExecutable("/opt/oci/bin/oci")
            .setMetadataBaseURL("http://localhost:8080/opc")
            .setMetadataTimeout(500)
            .setRequestTimeout(1000)
            .setCliTimeout(2000)
            .setRestEnabled(true)
            .setProbePlatformIdentity(false)
            .setProxyHost("proxy")
            .setProxyPort(3128)
            .setLogger(logger);

        assertTrue(config.isCustomConfigFile());
        assertEquals("ops", config.getDefaultProfile());
        assertEquals("eu-frankfurt-1", config.getFallbackRegion());
        assertEquals("/opt/oci/bin/oci", config.getCliExecutable());
        /* a trailing slash is added */
        assertEquals("http://localhost:8080/opc/",
                     config.getMetadataBaseURL());
        assertEquals(500, config.getMetadataTimeout());
        assertEquals(1000, config.getRequestTimeout());
        assertEquals(2000, config.getCliTimeout());
        assertTrue(config.isRestEnabled());
        assertFalse(config.getProbePlatformIdentity());
        assertEquals("proxy", config.getProxyHost());
        assertEquals(3128, config.getProxyPort());
        assertSame(logger, config.getLogger());
        assertTrue(config.toString().contains("fallbackRegion=eu-frankfurt-1"));
    }

    @Test
    public void testInvalidValues() {
        AuthConfig config = new AuthConfig();
        try {
            config.setConfigFile(" ");
            fail("expected");
        } catch (IllegalArgumentException iae) {
            assertTrue(iae.getMessage().contains("configFile"));
        }
        try {
            config.setFallbackRegion(null);
            fail("expected");
        } catch (IllegalArgumentException iae) {
            /* success */
        }
        try {
            config.setCliTimeout(0);
            fail("expected");
        } catch (IllegalArgumentException iae) {
            assertTrue(iae.getMessage().contains("cliTimeout"));
        }
        try {
            config.setMetadataTimeout(-5);
            fail("expected");
        } catch (IllegalArgumentException iae) {
            /* success */
        }
        /* failed setters leave the values alone */
        assertEquals("us-ashburn-1", config.getFallbackRegion());
    }

    @Test
    public void testFromEnvironment() {
        AuthConfig config = AuthConfig.fromEnvironment();
        String region = System.getenv("OCI_REGION");
        if (region == null || region.trim().isEmpty()) {
            assertEquals(AuthConfig.DEFAULT_REGION,
                         config.getFallbackRegion());
        } else {
            assertEquals(region, config.getFallbackRegion());
        }
        String useRest = System.getenv("OCI_USE_REST_API");
        if (useRest == null || useRest.trim().isEmpty()) {
            assertFalse(config.isRestEnabled());
        }
    }
}
