/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.net.HttpURLConnection;
import java.nio.charset.StandardCharsets;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Arrays;
import java.util.Base64;

import com.sun.net.httpserver.HttpExchange;

public class AuthTestBase {

    protected static final String KEY_PASSPHRASE = "s3cret";

    private static File testDir;

    /*
     * A directory private to this JVM, created on first use
     */
    protected static synchronized String getTestDir() {
        if (testDir == null) {
            try {
                testDir = Files.createTempDirectory("ocimetrics").toFile();
            } catch (IOException ioe) {
                throw new IllegalStateException(ioe);
            }
            testDir.deleteOnExit();
        }
        return testDir.getAbsolutePath();
    }

    protected static void clearTestDirectory() {
        File dir = new File(getTestDir());
        if (!dir.exists()) {
            return;
        }
        clearDirectory(dir);
    }

    private static void clearDirectory(File dir) {
        if (dir.listFiles() == null) {
            return;
        }
        for (File file : dir.listFiles()) {
            if (file.isDirectory()) {
                clearDirectory(file);
            }
            boolean deleteDone = file.delete();
            assert deleteDone: "Couldn't delete " + file;
        }
    }

    public static void writeResponse(HttpExchange exchange, String msg)
        throws IOException {

        writeResponse(exchange, HttpURLConnection.HTTP_OK, msg);
    }

    public static void writeResponse(HttpExchange exchange,
                                     int status,
                                     String msg)
        throws IOException {

        byte[] bytes = msg.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type",
                                          "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    protected static KeyPair generateKeyPair()
        throws Exception {

        KeyPairGenerator keygen = KeyPairGenerator.getInstance("RSA");
        keygen.initialize(2048);
        return keygen.generateKeyPair();
    }

    /**
     * Writes the private key of the pair as an unencrypted PKCS#8 PEM file
     * and returns its absolute path.
     */
    protected static String generatePrivateKeyFile(String name,
                                                   KeyPair keypair)
        throws Exception {

        return writePem(name, "PRIVATE KEY", null,
                        keypair.getPrivate().getEncoded());
    }

    /**
     * Writes the private key of the pair as an unencrypted PKCS#1 PEM file
     * and returns its absolute path.
     */
    protected static String generatePkcs1KeyFile(String name,
                                                 KeyPair keypair)
        throws Exception {

        return writePem(name, "RSA PRIVATE KEY", null,
                        toPkcs1(keypair.getPrivate().getEncoded()));
    }

    /**
     * Returns the absolute path of a key file shipped under the keys test
     * resource directory. rsa_encrypted.pem is rsa_plain.pem encrypted by
     * openssl pkcs8 -topk8 -v2 aes-256-cbc with the passphrase
     * {@link #KEY_PASSPHRASE}.
     */
    protected static String getKeyResource(String name) {
        URL url = AuthTestBase.class.getResource("/keys/" + name);
        if (url == null) {
            throw new IllegalStateException("Missing test key " + name);
        }
        try {
            return Paths.get(url.toURI()).toString();
        } catch (URISyntaxException use) {
            throw new IllegalStateException(use);
        }
    }

    protected static String writePem(String name,
                                     String type,
                                     String[] headers,
                                     byte[] der)
        throws Exception {

        File keyFile = new File(getTestDir(), name);
        try (PrintWriter writer = new PrintWriter(keyFile, "US-ASCII")) {
            writer.println("-----BEGIN " + type + "-----");
            if (headers != null) {
                for (String header : headers) {
                    writer.println(header);
                }
                writer.println();
            }
            String b64 = Base64.getMimeEncoder(
                64, new byte[] {'\n'}).encodeToString(der);
            writer.println(b64);
            writer.println("-----END " + type + "-----");
        }
        return keyFile.getAbsolutePath();
    }

    /*
     * Extracts the RSAPrivateKey structure from a PKCS#8 PrivateKeyInfo:
     * SEQUENCE { INTEGER 0, AlgorithmIdentifier, OCTET STRING }
     */
    protected static byte[] toPkcs1(byte[] pkcs8) {
        int[] pos = {0};
        readHeader(pkcs8, pos, 0x30);
        int versionLen = readHeader(pkcs8, pos, 0x02);
        pos[0] += versionLen;
        int algLen = readHeader(pkcs8, pos, 0x30);
        pos[0] += algLen;
        int keyLen = readHeader(pkcs8, pos, 0x04);
        return Arrays.copyOfRange(pkcs8, pos[0], pos[0] + keyLen);
    }

    private static int readHeader(byte[] der, int[] pos, int tag) {
        if ((der[pos[0]++] & 0xff) != tag) {
            throw new IllegalArgumentException("Unexpected DER tag");
        }
        int len = der[pos[0]++] & 0xff;
        if (len < 0x80) {
            return len;
        }
        int numBytes = len & 0x7f;
        len = 0;
        for (int i = 0; i < numBytes; i++) {
            len = (len << 8) | (der[pos[0]++] & 0xff);
        }
        return len;
    }

    protected static File writeConfigFile(String name, String... lines)
        throws Exception {

        File config = new File(getTestDir(), name);
        try (PrintWriter writer = new PrintWriter(config, "UTF-8")) {
            for (String line : lines) {
                writer.println(line);
            }
        }
        return config;
    }

    protected static void assertThat(String content, String expected) {
        if (!content.toLowerCase().contains(expected.toLowerCase())) {
            throw new IllegalArgumentException(
                content + " doesn't contains " + expected);
        }
    }
}
