/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam.pki;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import javax.crypto.Cipher;
import javax.crypto.EncryptedPrivateKeyInfo;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Decoding of RSA private keys in PEM format. The supported encodings are
 * those produced by the OCI console and by <code>openssl</code>:
 * <ul>
 * <li><code>PRIVATE KEY</code>: unencrypted PKCS#8</li>
 * <li><code>RSA PRIVATE KEY</code>: PKCS#1, optionally encrypted with the
 * legacy OpenSSL <code>Proc-Type</code>/<code>DEK-Info</code> headers</li>
 * <li><code>ENCRYPTED PRIVATE KEY</code>: encrypted PKCS#8, for the PBE
 * algorithms the JDK provides</li>
 * </ul>
 * Usage:
 * <pre>
 * try (Pem.Passphrase passphrase = Pem.Passphrase.of(chars)) {
 *     PrivateKey key = Pem.decoder().with(passphrase).decodePrivateKey(ch);
 * }
 * </pre>
 */
public final class Pem {

    private static final String BEGIN = "-----BEGIN ";
    private static final String END = "-----END ";
    private static final String DASHES = "-----";

    private static final String PKCS8 = "PRIVATE KEY";
    private static final String PKCS1 = "RSA PRIVATE KEY";
    private static final String ENCRYPTED_PKCS8 = "ENCRYPTED PRIVATE KEY";

    private static final String PROC_TYPE = "Proc-Type";
    private static final String DEK_INFO = "DEK-Info";

    /* AlgorithmIdentifier of rsaEncryption, 1.2.840.113549.1.1.1, NULL */
    private static final byte[] RSA_ALGORITHM_ID = {
        0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86,
        (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private static final String PBES2_OID = "1.2.840.113549.1.5.13";

    /* legacy OpenSSL ciphers: transformation and key length */
    private static final Map<String, LegacyCipher> LEGACY_CIPHERS =
        new HashMap<>();
    static {
        LEGACY_CIPHERS.put("AES-128-CBC",
            new LegacyCipher("AES/CBC/PKCS5Padding", "AES", 16));
        LEGACY_CIPHERS.put("AES-192-CBC",
            new LegacyCipher("AES/CBC/PKCS5Padding", "AES", 24));
        LEGACY_CIPHERS.put("AES-256-CBC",
            new LegacyCipher("AES/CBC/PKCS5Padding", "AES", 32));
        LEGACY_CIPHERS.put("DES-EDE3-CBC",
            new LegacyCipher("DESede/CBC/PKCS5Padding", "DESede", 24));
    }

    private Pem() {}

    /**
     * Returns a decoder with no passphrase.
     *
     * @return the decoder
     */
    public static Decoder decoder() {
        return new Decoder(null);
    }

    /**
     * Decodes PEM encoded private keys. Instances are immutable.
     */
    public static final class Decoder {
        private final Passphrase passphrase;

        private Decoder(Passphrase passphrase) {
            this.passphrase = passphrase;
        }

        /**
         * Returns a decoder that uses the given passphrase for encrypted
         * keys. The passphrase is not copied; it must stay open until the
         * key is decoded.
         *
         * @param pass the passphrase, may be null
         * @return the decoder
         */
        public Decoder with(Passphrase pass) {
            return new Decoder(pass);
        }

        /**
         * Reads the channel to its end and decodes the first private key
         * block found.
         *
         * @param channel the channel holding PEM content
         * @return the private key
         * @throws IOException if the channel cannot be read
         * @throws PemEncryptedKeyException if the key is encrypted and no
         * passphrase is set
         * @throws PemEncryptionException if the key cannot be decrypted
         * @throws PemException if the content is not a supported PEM key
         */
        public PrivateKey decodePrivateKey(ReadableByteChannel channel)
            throws IOException {

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteBuffer buf = ByteBuffer.allocate(4096);
            while (channel.read(buf) >= 0) {
                buf.flip();
                out.write(buf.array(), 0, buf.limit());
                buf.clear();
            }
            byte[] bytes = out.toByteArray();
            try {
                return decodePrivateKey(bytes);
            } finally {
                Arrays.fill(bytes, (byte) 0);
            }
        }

        /**
         * Decodes the first private key block found in the given content.
         *
         * @param pemBytes PEM content, US-ASCII
         * @return the private key
         */
        public PrivateKey decodePrivateKey(byte[] pemBytes) {
            Block block = Block.parse(
                new String(pemBytes, StandardCharsets.US_ASCII));
            switch (block.type) {
            case PKCS8:
                return toRsaKey(block.der);
            case PKCS1:
                byte[] pkcs1 = block.isEncrypted() ?
                    decryptLegacy(block) : block.der;
                return toRsaKey(wrapPkcs1(pkcs1), block.isEncrypted());
            case ENCRYPTED_PKCS8:
                return toRsaKey(decryptPkcs8(block.der), true);
            default:
                throw new PemException(
                    "Unsupported PEM type: " + block.type);
            }
        }

        private char[] requirePassphrase() {
            if (passphrase == null || passphrase.chars == null ||
                passphrase.chars.length == 0) {
                throw new PemEncryptedKeyException();
            }
            return passphrase.chars;
        }

        private byte[] decryptLegacy(Block block) {
            char[] pass = requirePassphrase();
            String dekInfo = block.headers.get(DEK_INFO);
            if (dekInfo == null) {
                throw new PemException("Encrypted key has no DEK-Info header");
            }
            int comma = dekInfo.indexOf(',');
            if (comma < 0) {
                throw new PemException("Malformed DEK-Info: " + dekInfo);
            }
            String cipherName =
                dekInfo.substring(0, comma).trim().toUpperCase(Locale.ROOT);
            LegacyCipher lc = LEGACY_CIPHERS.get(cipherName);
            if (lc == null) {
                throw new PemException(
                    "Unsupported key encryption: " + cipherName);
            }
            byte[] iv = Hex.decode(dekInfo.substring(comma + 1).trim());
            byte[] passBytes = toBytes(pass);
            byte[] key = null;
            try {
                key = deriveLegacyKey(passBytes,
                                      Arrays.copyOf(iv, 8), lc.keyLength);
                Cipher cipher = Cipher.getInstance(lc.transformation);
                cipher.init(Cipher.DECRYPT_MODE,
                            new SecretKeySpec(key, lc.keyAlgorithm),
                            new IvParameterSpec(iv));
                return cipher.doFinal(block.der);
            } catch (GeneralSecurityException e) {
                throw new PemEncryptionException(e);
            } finally {
                Arrays.fill(passBytes, (byte) 0);
                if (key != null) {
                    Arrays.fill(key, (byte) 0);
                }
            }
        }

        private byte[] decryptPkcs8(byte[] der) {
            char[] pass = requirePassphrase();
            try {
                EncryptedPrivateKeyInfo info = new EncryptedPrivateKeyInfo(der);
                String algName = info.getAlgName();
                if ("PBES2".equalsIgnoreCase(algName) ||
                    PBES2_OID.equals(algName)) {
                    /* the parameters name the full PBES2 scheme */
                    algName = info.getAlgParameters().toString();
                }
                PBEKeySpec spec = new PBEKeySpec(pass);
                try {
                    SecretKey key =
                        SecretKeyFactory.getInstance(algName)
                        .generateSecret(spec);
                    Cipher cipher = Cipher.getInstance(algName);
                    cipher.init(Cipher.DECRYPT_MODE, key,
                                info.getAlgParameters());
                    return info.getKeySpec(cipher).getEncoded();
                } finally {
                    spec.clearPassword();
                }
            } catch (IOException e) {
                throw new PemException("Malformed encrypted private key", e);
            } catch (GeneralSecurityException e) {
                throw new PemEncryptionException(e);
            }
        }
    }

    /**
     * A passphrase that is erased when closed.
     */
    public static final class Passphrase implements Sensitive {
        private final char[] chars;

        private Passphrase(char[] chars) {
            this.chars = chars;
        }

        /**
         * Wraps the given characters; they are erased by {@link #close()}.
         *
         * @param chars the passphrase, may be null
         * @return the passphrase
         */
        public static Passphrase of(char[] chars) {
            return new Passphrase(chars);
        }

        @Override
        public void close() {
            if (chars != null) {
                Arrays.fill(chars, ' ');
            }
        }
    }

    private static PrivateKey toRsaKey(byte[] pkcs8) {
        return toRsaKey(pkcs8, false);
    }

    /*
     * A decryption with the wrong passphrase can pass the padding check and
     * still produce garbage, so a key spec failure after decryption is
     * reported as an encryption problem.
     */
    private static PrivateKey toRsaKey(byte[] pkcs8, boolean decrypted) {
        try {
            return KeyFactory.getInstance("RSA")
                .generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
        } catch (InvalidKeySpecException e) {
            if (decrypted) {
                throw new PemEncryptionException(e);
            }
            throw new PemException("Invalid RSA private key", e);
        } catch (GeneralSecurityException e) {
            throw new PemException("RSA key factory unavailable", e);
        } finally {
            Arrays.fill(pkcs8, (byte) 0);
        }
    }

    /*
     * PrivateKeyInfo ::= SEQUENCE { version INTEGER (0),
     *   algorithm AlgorithmIdentifier, privateKey OCTET STRING }
     */
    static byte[] wrapPkcs1(byte[] pkcs1) {
        byte[] version = {0x02, 0x01, 0x00};
        byte[] octets = derEncode(0x04, pkcs1);
        int contentLength = version.length + RSA_ALGORITHM_ID.length +
            octets.length;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x30);
        writeDerLength(out, contentLength);
        out.write(version, 0, version.length);
        out.write(RSA_ALGORITHM_ID, 0, RSA_ALGORITHM_ID.length);
        out.write(octets, 0, octets.length);
        Arrays.fill(octets, (byte) 0);
        return out.toByteArray();
    }

    private static byte[] derEncode(int tag, byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(tag);
        writeDerLength(out, content.length);
        out.write(content, 0, content.length);
        return out.toByteArray();
    }

    private static void writeDerLength(ByteArrayOutputStream out, int len) {
        if (len < 0x80) {
            out.write(len);
            return;
        }
        int numBytes = 0;
        for (int l = len; l > 0; l >>>= 8) {
            numBytes++;
        }
        out.write(0x80 | numBytes);
        for (int i = numBytes - 1; i >= 0; i--) {
            out.write((len >>> (8 * i)) & 0xff);
        }
    }

    /*
     * OpenSSL EVP_BytesToKey with MD5 and one iteration:
     * D_i = MD5(D_(i-1) || passphrase || salt)
     */
    static byte[] deriveLegacyKey(byte[] pass, byte[] salt, int keyLength)
        throws GeneralSecurityException {

        MessageDigest md5 = MessageDigest.getInstance("MD5");
        byte[] key = new byte[keyLength];
        byte[] prev = new byte[0];
        int offset = 0;
        while (offset < keyLength) {
            md5.update(prev);
            md5.update(pass);
            md5.update(salt);
            prev = md5.digest();
            int n = Math.min(prev.length, keyLength - offset);
            System.arraycopy(prev, 0, key, offset, n);
            offset += n;
        }
        Arrays.fill(prev, (byte) 0);
        return key;
    }

    private static byte[] toBytes(char[] chars) {
        ByteBuffer bb = StandardCharsets.UTF_8.encode(
            CharBuffer.wrap(chars));
        byte[] bytes = new byte[bb.remaining()];
        bb.get(bytes);
        if (bb.hasArray()) {
            Arrays.fill(bb.array(), (byte) 0);
        }
        return bytes;
    }

    private static final class LegacyCipher {
        final String transformation;
        final String keyAlgorithm;
        final int keyLength;

        LegacyCipher(String transformation, String keyAlgorithm,
                     int keyLength) {
            this.transformation = transformation;
            this.keyAlgorithm = keyAlgorithm;
            this.keyLength = keyLength;
        }
    }

    /* one BEGIN/END block with its optional RFC 1421 headers */
    private static final class Block {
        final String type;
        final Map<String, String> headers;
        final byte[] der;

        private Block(String type, Map<String, String> headers, byte[] der) {
            this.type = type;
            this.headers = headers;
            this.der = der;
        }

        boolean isEncrypted() {
            String proc = headers.get(PROC_TYPE);
            return proc != null && proc.contains("ENCRYPTED");
        }

        static Block parse(String text) {
            int begin = text.indexOf(BEGIN);
            if (begin < 0) {
                throw new PemException("No PEM BEGIN line found");
            }
            int typeEnd = text.indexOf(DASHES, begin + BEGIN.length());
            if (typeEnd < 0) {
                throw new PemException("Malformed PEM BEGIN line");
            }
            String type = text.substring(begin + BEGIN.length(), typeEnd);
            String endLine = END + type + DASHES;
            int bodyStart = typeEnd + DASHES.length();
            int end = text.indexOf(endLine, bodyStart);
            if (end < 0) {
                throw new PemException("No PEM END line for " + type);
            }

            Map<String, String> headers = new HashMap<>();
            StringBuilder base64 = new StringBuilder();
            for (String line : text.substring(bodyStart, end).split("\r?\n")) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                int colon = trimmed.indexOf(':');
                if (colon > 0) {
                    headers.put(trimmed.substring(0, colon).trim(),
                                trimmed.substring(colon + 1).trim());
                    continue;
                }
                base64.append(trimmed);
            }
            try {
                return new Block(type, headers,
                    Base64.getDecoder().decode(base64.toString()));
            } catch (IllegalArgumentException e) {
                throw new PemException("Invalid base64 in PEM " + type, e);
            }
        }
    }
}
