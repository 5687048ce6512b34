/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import oracle.ocimetrics.AuthTestBase;

import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

public class PlatformIdentityProberTest extends AuthTestBase {

    private static final String INSTANCE_ROOT =
        "{" +
        "\"id\": \"ocid1.instance.oc1.phx.instance\"," +
        "\"compartmentId\": \"ocid1.tenancy.oc1..aaaatenancy\"," +
        "\"availabilityDomain\": \"Uocm:PHX-AD-1\"," +
        "\"region\": \"phx\"," +
        "\"canonicalRegionName\": \"us-phoenix-1\"," +
        "\"shape\": \"VM.Standard.E4.Flex\"," +
        "\"displayName\": \"metrics-host\"," +
        "\"timeCreated\": 1700000000000," +
        "\"lifecycleState\": \"RUNNING\"," +
        "\"metadata\": {\"ssh_authorized_keys\": \"ssh-rsa AAAA\"}," +
        "\"definedTags\": {}" +
        "}";

    private static final String INSTANCE_CHILD =
        "{" +
        "\"id\": \"ocid1.instance.oc1.iad.instance\"," +
        "\"compartmentId\": \"ocid1.compartment.oc1..aaaacompartment\"," +
        "\"region\": \"iad\"," +
        "\"faultDomain\": \"FAULT-DOMAIN-3\"" +
        "}";

    private static HttpServer server;
    private static ExecutorService executor;
    private static String base;
    private static final AtomicInteger v2Requests = new AtomicInteger();
    private static volatile boolean badAuthorization;

    @BeforeClass
    public static void staticSetUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        /* the slow handler must not hold up the others */
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        base = "http://localhost:" + server.getAddress().getPort();
        configHttpServer();
    }

    @AfterClass
    public static void staticTearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    @Before
    public void setUp() {
        v2Requests.set(0);
        badAuthorization = false;
    }

    private static void configHttpServer() {
        /* v2 is served */
        server.createContext("/root/v2/instance/", exchange -> {
            v2Requests.incrementAndGet();
            if (!authorized(exchange)) {
                writeResponse(exchange, HttpURLConnection.HTTP_UNAUTHORIZED,
                              "{}");
                return;
            }
            writeResponse(exchange, INSTANCE_ROOT);
        });

        /* only v1 is served */
        server.createContext("/legacy/v2/instance/", exchange -> {
            v2Requests.incrementAndGet();
            writeResponse(exchange, HttpURLConnection.HTTP_NOT_FOUND, "{}");
        });
        server.createContext("/legacy/v1/instance/", exchange ->
            writeResponse(exchange, INSTANCE_CHILD));

        /* neither version is served */
        server.createContext("/none/", exchange ->
            writeResponse(exchange, HttpURLConnection.HTTP_NOT_FOUND, "{}"));

        server.createContext("/garbage/v2/instance/", exchange ->
            writeResponse(exchange, "<html>not json</html>"));

        server.createContext("/noid/v2/instance/", exchange ->
            writeResponse(exchange, "{\"region\": \"phx\"}"));

        server.createContext("/noregion/v2/instance/", exchange ->
            writeResponse(exchange,
                          "{\"id\": \"ocid1.instance.oc1..x\", " +
                          "\"compartmentId\": \"ocid1.compartment.oc1..c\", " +
                          "\"region\": \"\"}"));

        server.createContext("/slow/v2/instance/", exchange -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, INSTANCE_ROOT);
        });
    }

    private static boolean authorized(HttpExchange exchange)
        throws IOException {

        String auth = exchange.getRequestHeaders().getFirst("Authorization");
        return !badAuthorization && "Bearer Oracle".equals(auth);
    }

    @Test
    public void testProbeV2()
        throws Exception {

        PlatformIdentityProber prober =
            new PlatformIdentityProber(base + "/root/", 2000, null);
        Optional<PlatformIdentitySnapshot> snapshot =
            prober.probePlatformIdentity();
        assertTrue(snapshot.isPresent());
        assertEquals(1, v2Requests.get());

        PlatformIdentitySnapshot s = snapshot.get();
        assertEquals("ocid1.instance.oc1.phx.instance", s.getInstanceId());
        /* the canonical name wins over the short code */
        assertEquals("us-phoenix-1", s.getRegion());
        assertEquals("ocid1.tenancy.oc1..aaaatenancy", s.getTenancyId());
        assertTrue(s.isTenancyResolved());
        assertEquals("FAULT-DOMAIN-1", s.getFaultDomain());
        assertEquals("VM.Standard.E4.Flex", s.getShape());
        assertEquals("1700000000000", s.getTimeCreated());
        assertEquals("metrics-host", s.toMetadata().get("displayName"));
        assertFalse(s.toMetadata().containsKey("ssh_authorized_keys"));

        CredentialContext ctx = CredentialContext.platformIdentity(s);
        assertEquals(CredentialContext.PLATFORM_IDENTITY_ID,
                     ctx.getIdentifier());
        assertTrue(ctx.isPlatformIdentity());
        assertTrue(ctx.isValid());
        assertTrue(ctx.isComplete());
        assertEquals("us-phoenix-1", ctx.getRegion());
        assertEquals("ocid1.instance.oc1.phx.instance",
                     ctx.getMetadata().get("instanceId"));
    }

    @Test
    public void testFallbackToV1()
        throws Exception {

        PlatformIdentityProber prober =
            new PlatformIdentityProber(base + "/legacy", 2000, null);
        Optional<PlatformIdentitySnapshot> snapshot =
            prober.probePlatformIdentity();
        assertTrue(snapshot.isPresent());
        assertEquals(1, v2Requests.get());

        PlatformIdentitySnapshot s = snapshot.get();
        assertEquals("iad", s.getRegion());
        assertEquals("FAULT-DOMAIN-3", s.getFaultDomain());
        /* not the root compartment, the tenancy cannot be derived */
        assertEquals(PlatformIdentitySnapshot.AUTO_DETECTED,
                     s.getTenancyId());
        assertFalse(s.isTenancyResolved());
        assertFalse(CredentialContext.platformIdentity(s)
                    .isTenancyResolved());
    }

    @Test
    public void testNotAnInstance()
        throws Exception {

        assertFalse(new PlatformIdentityProber(base + "/none/", 2000, null)
                    .probePlatformIdentity().isPresent());
        assertFalse(new PlatformIdentityProber(base + "/garbage/", 2000, null)
                    .probePlatformIdentity().isPresent());
        assertFalse(new PlatformIdentityProber(base + "/noid/", 2000, null)
                    .probePlatformIdentity().isPresent());

        badAuthorization = true;
        assertFalse(new PlatformIdentityProber(base + "/root/", 2000, null)
                    .probePlatformIdentity().isPresent());
    }

    @Test
    public void testNoRegion()
        throws Exception {

        PlatformIdentityProber prober =
            new PlatformIdentityProber(base + "/noregion/", 2000, null);
        assertFalse(prober.probePlatformIdentity().isPresent());

        Map<String, String> fields = new HashMap<>();
        fields.put("id", "ocid1.instance.oc1..x");
        PlatformIdentitySnapshot snapshot =
            new PlatformIdentitySnapshot(fields);
        assertNull(snapshot.getRegion());
        try {
            CredentialContext.platformIdentity(snapshot);
            fail("expected");
        } catch (IllegalArgumentException iae) {
            assertThat(iae.getMessage(), "region");
        }
    }

    @Test
    public void testUnreachable()
        throws Exception {

        int port;
        try (ServerSocket ss = new ServerSocket(0)) {
            port = ss.getLocalPort();
        }
        PlatformIdentityProber prober = new PlatformIdentityProber(
            "http://localhost:" + port + "/opc/", 1000, null);
        assertFalse(prober.probePlatformIdentity().isPresent());
    }

    @Test
    public void testTimeout()
        throws Exception {

        PlatformIdentityProber prober =
            new PlatformIdentityProber(base + "/slow/", 5000, null);
        long start = System.currentTimeMillis();
        assertFalse(prober.probePlatformIdentity(500).isPresent());
        assertTrue(System.currentTimeMillis() - start < 2500);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidURL() {
        new PlatformIdentityProber("not a url", 1000, null);
    }
}
