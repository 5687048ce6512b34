/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.dispatch;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import oracle.ocimetrics.AuthConfig;
import oracle.ocimetrics.AuthTestBase;
import oracle.ocimetrics.iam.ContextConfig;
import oracle.ocimetrics.iam.CredentialRegistry;
import oracle.ocimetrics.iam.RequestSigner;
import oracle.ocimetrics.iam.StaticIdentityProber;

import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

public class ValidityProberTest extends AuthTestBase {

    private static File configFile;

    private List<String> events;
    private RecordingTransport transport;

    @BeforeClass
    public static void staticSetUp() throws Exception {
        clearTestDirectory();
        String keyFile = generatePrivateKeyFile("probe_key.pem",
                                                generateKeyPair());
        configFile = writeConfigFile("probe_config",
            "[DEFAULT]",
            "tenancy=ocid1.tenancy.oc1..aaaaaaaaprobetenancy",
            "user=ocid1.user.oc1..user",
            "fingerprint=12:34:56",
            "key_file=" + keyFile,
            "region=us-phoenix-1",
            "[dev]",
            "tenancy=ocid1.tenancy.oc1..aaaaaaaaprobetenancy",
            "user=ocid1.user.oc1..dev",
            "fingerprint=ab:cd:ef",
            "key_file=" + keyFile,
            "region=eu-frankfurt-1");
    }

    @AfterClass
    public static void staticTearDown() {
        clearTestDirectory();
    }

    @Before
    public void setUp() {
        events = Collections.synchronizedList(new ArrayList<>());
        transport = new RecordingTransport(events);
    }

    /*
     * Builds a registry that uses the prober as its validator, the way
     * AuthenticationManager wires them.
     */
    private ValidityProber prober(boolean rest, CliRunner cli,
                                  CredentialRegistry[] registryOut) {
        AuthConfig config = new AuthConfig()
            .setConfigFile(configFile.getPath())
            .setRestEnabled(rest);
        CredentialRegistry registry = new CredentialRegistry(config, null);
        DispatchArbiter arbiter = new DispatchArbiter(
            config, registry, new RequestSigner(null), transport, cli);
        ValidityProber prober = new ValidityProber(registry, arbiter, null);
        registry.setValidator(prober);
        registryOut[0] = registry;
        return prober;
    }

    @Test
    public void testOneSuccessCli() {
        RecordingCliRunner cli = new RecordingCliRunner(events)
            .respond(0, "{\"data\": [{\"name\": \"a\"}, {\"name\": \"b\"}]}",
                     "");
        CredentialRegistry[] reg = new CredentialRegistry[1];
        ValidityProber prober = prober(false, cli, reg);
        reg[0].initialize();
        /* both profiles were probed while loading */
        assertEquals(Arrays.asList("CLI", "CLI"), events);
        assertTrue(reg[0].get("DEFAULT").isValid());

        ProbeResult result = prober.testOne("DEFAULT");
        assertTrue(result.isSuccess());
        assertEquals("DEFAULT", result.getIdentifier());
        assertEquals("Authentication successful for config_file",
                     result.getMessage());
        assertEquals(2, result.getRegionsAvailable());
        assertEquals("CLI", result.getDetails().get("outcome"));
        assertEquals("us-phoenix-1", result.getDetails().get("region"));
        assertEquals("ocid1.tenancy.oc1..a...",
                     result.getDetails().get("tenancy"));
    }

    @Test
    public void testOneSuccessRest() {
        transport.respond(200, "[{}, {}, {}]");
        RecordingCliRunner cli = new RecordingCliRunner(events);
        CredentialRegistry[] reg = new CredentialRegistry[1];
        ValidityProber prober = prober(true, cli, reg);
        reg[0].initialize();

        ProbeResult result = prober.testOne("dev");
        assertTrue(result.isSuccess());
        assertEquals(3, result.getRegionsAvailable());
        assertEquals("REST", result.getDetails().get("outcome"));
        assertTrue(cli.getCommands().isEmpty());
        List<URI> uris = transport.getUris();
        /* one probe per profile while loading, then dev again */
        assertEquals(3, uris.size());
        assertEquals("identity.eu-frankfurt-1.oci.oraclecloud.com",
                     uris.get(uris.size() - 1).getHost());
    }

    @Test
    public void testOneFailure() {
        RecordingCliRunner cli = new RecordingCliRunner(events)
            .respond(1, "", "ServiceError: NotAuthenticated");
        CredentialRegistry[] reg = new CredentialRegistry[1];
        ValidityProber prober = prober(false, cli, reg);
        reg[0].initialize();
        assertFalse(reg[0].get("DEFAULT").isValid());
        assertFalse(reg[0].getPreferred().isPresent());

        /* a probe recovers the context once the credential works */
        cli.respond(0, "{\"data\": []}", "");
        ProbeResult result = prober.testOne("DEFAULT");
        assertTrue(result.isSuccess());
        assertEquals(0, result.getRegionsAvailable());
        assertTrue(reg[0].get("DEFAULT").isValid());

        cli.respond(1, "", "ServiceError: NotAuthenticated");
        result = prober.testOne("DEFAULT");
        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().startsWith("Authentication failed: "));
        assertTrue(result.getMessage().contains("NotAuthenticated"));
        assertEquals(-1, result.getRegionsAvailable());
        assertFalse(reg[0].get("DEFAULT").isValid());
    }

    @Test
    public void testOneMalformedOutput() {
        RecordingCliRunner cli = new RecordingCliRunner(events);
        CredentialRegistry[] reg = new CredentialRegistry[1];
        ValidityProber prober = prober(false, cli, reg);
        reg[0].initialize();

        cli.respond(0, "not json at all", "");
        ProbeResult result = prober.testOne("dev");
        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("Error parsing JSON"));
        assertFalse(reg[0].get("dev").isValid());
    }

    @Test
    public void testOneNotFound() {
        CredentialRegistry[] reg = new CredentialRegistry[1];
        ValidityProber prober =
            prober(false, new RecordingCliRunner(events), reg);
        ProbeResult result = prober.testOne("missing");
        assertFalse(result.isSuccess());
        assertEquals("Authentication context not found: missing",
                     result.getMessage());
        assertEquals("missing", result.getDetails().get("identifier"));
        assertTrue(events.isEmpty());
    }

    @Test
    public void testOneIncomplete() {
        CredentialRegistry[] reg = new CredentialRegistry[1];
        ValidityProber prober =
            prober(false, new RecordingCliRunner(events), reg);
        reg[0].add("partial", new ContextConfig()
                   .setTenancyId("ocid1.tenancy.oc1..t")
                   .setUserId("ocid1.user.oc1..u"));

        ProbeResult result = prober.testOne("partial");
        assertFalse(result.isSuccess());
        assertEquals("Authentication failed: context is missing required " +
                     "fields", result.getMessage());
        /* nothing is run for an incomplete context */
        assertTrue(events.isEmpty());
    }

    @Test
    public void testAllAndCapabilityReport() {
        CliRunner cli = (command, timeoutMs) -> {
            events.add("CLI");
            if (command.contains("dev")) {
                return new CliResult(1, "", "ServiceError: status 401");
            }
            return new CliResult(0, "{\"data\": [{}, {}, {}, {}]}", "");
        };
        CredentialRegistry[] reg = new CredentialRegistry[1];
        ValidityProber prober = prober(false, cli, reg);
        reg[0].initialize();
        events.clear();

        List<ProbeResult> results = prober.testAll();
        assertEquals(2, results.size());
        assertEquals("DEFAULT", results.get(0).getIdentifier());
        assertTrue(results.get(0).isSuccess());
        assertEquals("dev", results.get(1).getIdentifier());
        assertFalse(results.get(1).isSuccess());
        /* a failure does not stop the others */
        assertEquals(Arrays.asList("CLI", "CLI"), events);

        String report = prober.capabilityReport();
        assertThat(report, "OCI Authentication Status");
        assertThat(report, "Total contexts: 2");
        assertThat(report, "Valid: 1, invalid: 1");
        assertThat(report, "Context status:");
        assertThat(report, "DEFAULT: OK (us-phoenix-1), 4 regions available");
        assertThat(report, "dev: FAILED (eu-frankfurt-1), Authentication " +
                   "failed");
    }

    @Test
    public void testCapabilityReportEmpty() {
        AuthConfig config = new AuthConfig()
            .setConfigFile(new File(getTestDir(), "absent").getPath());
        CredentialRegistry registry =
            new CredentialRegistry(config, new StaticIdentityProber(false));
        DispatchArbiter arbiter = new DispatchArbiter(
            config, registry, new RequestSigner(null), transport,
            new RecordingCliRunner(events));
        ValidityProber prober = new ValidityProber(registry, arbiter, null);
        registry.setValidator(prober);
        registry.initialize();

        assertTrue(prober.testAll().isEmpty());
        String report = prober.capabilityReport();
        assertThat(report, "Instance principal: not available");
        assertThat(report, "Context status:\n  none");
    }
}
