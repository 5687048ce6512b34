/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.Signature;
import java.util.Base64;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import oracle.ocimetrics.AuthTestBase;
import oracle.ocimetrics.SigningException;
import oracle.ocimetrics.iam.CredentialContext.SecretRef;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;

public class RequestSignerTest extends AuthTestBase {

    private static final String TENANCY = "ocid1.tenancy.oc1..tenancy";
    private static final String USER = "ocid1.user.oc1..user";
    private static final String FINGERPRINT = "12:34:56:78:90:ab:cd:ef";

    /* Tue, 14 Nov 2023 22:13:20 GMT */
    private static final Date FROZEN = new Date(1700000000000L);

    private static final Pattern SIGNATURE =
        Pattern.compile("signature=\"([^\"]+)\"");

    private static KeyPair keypair;
    private static String keyFile;
    private final RequestSigner signer = new RequestSigner(null);

    @BeforeClass
    public static void staticSetUp() throws Exception {
        keypair = generateKeyPair();
        keyFile = generatePrivateKeyFile("signer_key.pem", keypair);
    }

    @AfterClass
    public static void staticTearDown() {
        clearTestDirectory();
    }

    private static CredentialContext userContext(String keyPath) {
        return CredentialContext.userPrincipal(
            "dev", "dev", TENANCY, "us-phoenix-1",
            new SecretRef(USER, FINGERPRINT, keyPath, null), true);
    }

    @Test
    public void testSignatureHeader()
        throws Exception {

        URI uri = URI.create("https://identity.us-phoenix-1.oci." +
                             "oraclecloud.com/20160918/regions");
        SignedHeaderSet headers = signer.sign(
            new SigningRequest("GET", uri, null, FROZEN),
            userContext(keyFile));

        assertEquals("Tue, 14 Nov 2023 22:13:20 GMT", headers.getDate());
        assertEquals("identity.us-phoenix-1.oci.oraclecloud.com",
                     headers.getHost());
        /* SHA-256 of the empty body */
        assertEquals("47DEQpj8HBSa+/TImW+5JCeuQeRkm5NMpJWZG3hSuFU=",
                     headers.getContentSha256());

        String auth = headers.getAuthorization();
        assertTrue(auth.startsWith("Signature version=\"1\",keyId=\"" +
                                   TENANCY + "/" + USER + "/" +
                                   FINGERPRINT + "\",algorithm=\"rsa-sha256\"," +
                                   "headers=\"(request-target) date host " +
                                   "x-content-sha256\",signature=\""));

        String expected =
            "(request-target): get /20160918/regions\n" +
            "date: Tue, 14 Nov 2023 22:13:20 GMT\n" +
            "host: identity.us-phoenix-1.oci.oraclecloud.com\n" +
            "x-content-sha256: 47DEQpj8HBSa+/TImW+5JCeuQeRkm5NMpJWZG3hSuFU=";
        assertTrue(verify(expected, auth));
    }

    @Test
    public void testDeterministic()
        throws Exception {

        URI uri = URI.create("https://telemetry.us-ashburn-1.oraclecloud.com" +
                             "/20180401/metrics/actions/listMetrics" +
                             "?compartmentId=ocid1.compartment.oc1..c");
        byte[] body = "{\"namespace\":\"oci_computeagent\"}"
            .getBytes(StandardCharsets.UTF_8);
        SigningRequest request =
            new SigningRequest("post", uri, body, FROZEN);

        SignedHeaderSet first = signer.sign(request, userContext(keyFile));
        SignedHeaderSet second = signer.sign(request, userContext(keyFile));
        /* PKCS#1 v1.5 signatures are deterministic */
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());

        String content = RequestSigner.signingContent(
            request, first.getDate(), first.getHost(),
            first.getContentSha256());
        assertTrue(content.startsWith(
            "(request-target): post /20180401/metrics/actions/listMetrics" +
            "?compartmentId=ocid1.compartment.oc1..c\n"));
        assertTrue(verify(content, first.getAuthorization()));
    }

    @Test
    public void testTamperedRequest()
        throws Exception {

        URI uri = URI.create("https://iaas.us-ashburn-1.oraclecloud.com" +
                             "/20160918/instances/ocid1.instance?action=STOP");
        SigningRequest request = new SigningRequest(
            "POST", uri, "{}".getBytes(StandardCharsets.UTF_8), FROZEN);
        SignedHeaderSet headers = signer.sign(request, userContext(keyFile));

        /* each signed element changes the signature */
        SigningRequest otherBody = new SigningRequest(
            "POST", uri, "{ }".getBytes(StandardCharsets.UTF_8), FROZEN);
        SigningRequest otherMethod = new SigningRequest(
            "PUT", uri, "{}".getBytes(StandardCharsets.UTF_8), FROZEN);
        SigningRequest otherTarget = new SigningRequest(
            "POST", URI.create(uri.toString().replace("STOP", "START")),
            "{}".getBytes(StandardCharsets.UTF_8), FROZEN);
        SigningRequest otherDate = new SigningRequest(
            "POST", uri, "{}".getBytes(StandardCharsets.UTF_8),
            new Date(FROZEN.getTime() + 1000));

        for (SigningRequest other : new SigningRequest[] {
                otherBody, otherMethod, otherTarget, otherDate}) {
            SignedHeaderSet h = signer.sign(other, userContext(keyFile));
            assertNotEquals(signature(headers.getAuthorization()),
                            signature(h.getAuthorization()));
            /* the original signature does not verify the altered request */
            String altered = RequestSigner.signingContent(
                other, h.getDate(), h.getHost(), h.getContentSha256());
            assertFalse(verify(altered, headers.getAuthorization()));
        }
    }

    @Test
    public void testHostPort()
        throws Exception {

        SignedHeaderSet headers = signer.sign(
            new SigningRequest("GET",
                               URI.create("http://localhost:8080/a?b=c"),
                               null, FROZEN),
            userContext(keyFile));
        assertEquals("localhost:8080", headers.getHost());

        headers = signer.sign(
            new SigningRequest("GET",
                               URI.create("https://localhost:443/a"),
                               null, FROZEN),
            userContext(keyFile));
        assertEquals("localhost", headers.getHost());

        HttpHeaders http = new DefaultHttpHeaders();
        headers.applyTo(http);
        assertEquals("localhost", http.get("host"));
        assertEquals(headers.getAuthorization(), http.get("Authorization"));
        assertEquals(headers.getContentSha256(),
                     http.get("x-content-sha256"));
        assertEquals(4, headers.toMap().size());
    }

    @Test
    public void testPkcs1Key()
        throws Exception {

        String pkcs1 = generatePkcs1KeyFile("signer_pkcs1.pem", keypair);
        URI uri = URI.create("https://identity.us-phoenix-1.oci." +
                             "oraclecloud.com/20160918/regions");
        SigningRequest request = new SigningRequest("GET", uri, null, FROZEN);
        assertEquals(signer.sign(request, userContext(keyFile)),
                     signer.sign(request, userContext(pkcs1)));
    }

    @Test
    public void testEncryptedKey()
        throws Exception {

        String plain = getKeyResource("rsa_plain.pem");
        String path = getKeyResource("rsa_encrypted.pem");

        ContextConfig config = new ContextConfig()
            .setTenancyId(TENANCY)
            .setUserId(USER)
            .setFingerprint(FINGERPRINT)
            .setKeyFilePath(path)
            .setPassphrase(KEY_PASSPHRASE);
        CredentialContext secure = config.toContext("secure", "us-phoenix-1");
        assertTrue(secure.getSecretRef().hasPassphrase());

        URI uri = URI.create("https://identity.us-phoenix-1.oci." +
                             "oraclecloud.com/20160918/regions");
        SigningRequest request = new SigningRequest("GET", uri, null, FROZEN);
        assertEquals(signer.sign(request, userContext(plain)),
                     signer.sign(request, secure));
        /* the passphrase is reused for every signature */
        assertEquals(signer.sign(request, userContext(plain)),
                     signer.sign(request, secure));

        try {
            signer.sign(request, userContext(path));
            fail("expected");
        } catch (SigningException e) {
            assertThat(e.getMessage(), "no passphrase");
        }
        try {
            signer.sign(request,
                        config.setPassphrase("wrong").toContext(
                            "secure", "us-phoenix-1"));
            fail("expected");
        } catch (SigningException e) {
            assertThat(e.getMessage(), "passphrase is incorrect");
        }
    }

    @Test
    public void testPlatformIdentityCannotSign() {
        Map<String, String> fields = new HashMap<>();
        fields.put("id", "ocid1.instance.oc1..i");
        fields.put("region", "us-ashburn-1");
        PlatformIdentitySnapshot snapshot =
            new PlatformIdentitySnapshot(fields);
        CredentialContext ctx = CredentialContext.platformIdentity(snapshot);
        assertEquals("us-ashburn-1", ctx.getRegion());
        assertEquals(PlatformIdentitySnapshot.AUTO_DETECTED,
                     ctx.getTenancyId());
        try {
            signer.sign(new SigningRequest(
                "GET", URI.create("https://example.com/"), null), ctx);
            fail("expected");
        } catch (SigningException e) {
            assertThat(e.getMessage(), "only user principal");
        }
    }

    @Test
    public void testIncompleteContext() {
        CredentialContext noKey = CredentialContext.userPrincipal(
            "dev", "dev", TENANCY, "us-phoenix-1",
            new SecretRef(USER, FINGERPRINT, null, null), true);
        try {
            signer.sign(new SigningRequest(
                "GET", URI.create("https://example.com/"), null), noKey);
            fail("expected");
        } catch (SigningException e) {
            assertThat(e.getMessage(), "key file is missing");
        }

        CredentialContext noTenancy = CredentialContext.userPrincipal(
            "dev", "dev", null, "us-phoenix-1",
            new SecretRef(USER, FINGERPRINT, keyFile, null), true);
        try {
            signer.sign(new SigningRequest(
                "GET", URI.create("https://example.com/"), null), noTenancy);
            fail("expected");
        } catch (SigningException e) {
            assertThat(e.getMessage(), "tenancy is missing");
        }
    }

    @Test
    public void testBadKeyFile()
        throws Exception {

        try {
            signer.sign(new SigningRequest(
                "GET", URI.create("https://example.com/"), null),
                userContext(getTestDir() + "/absent.pem"));
            fail("expected");
        } catch (SigningException e) {
            assertThat(e.getMessage(), "Unable to load the private key");
        }

        String garbage = writeConfigFile("garbage.pem", "not a key")
            .getAbsolutePath();
        try {
            signer.sign(new SigningRequest(
                "GET", URI.create("https://example.com/"), null),
                userContext(garbage));
            fail("expected");
        } catch (SigningException e) {
            assertThat(e.getMessage(), "PEM format");
        }
    }

    @Test
    public void testInvalidRequest() {
        try {
            new SigningRequest("GET", URI.create("/relative"), null);
            fail("expected");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), "absolute");
        }
    }

    private static String signature(String authorization) {
        Matcher m = SIGNATURE.matcher(authorization);
        assertTrue(m.find());
        return m.group(1);
    }

    private static boolean verify(String content, String authorization)
        throws Exception {

        Signature verifier = Signature.getInstance("SHA256withRSA");
        verifier.initVerify(keypair.getPublic());
        verifier.update(content.getBytes(StandardCharsets.UTF_8));
        return verifier.verify(
            Base64.getDecoder().decode(signature(authorization)));
    }
}
