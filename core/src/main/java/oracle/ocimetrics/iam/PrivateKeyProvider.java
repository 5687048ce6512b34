/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateKey;
import java.util.Arrays;

import oracle.ocimetrics.iam.pki.Pem;
import oracle.ocimetrics.iam.pki.PemEncryptedKeyException;
import oracle.ocimetrics.iam.pki.PemEncryptionException;
import oracle.ocimetrics.iam.pki.PemException;

/**
 * @hidden
 * Internal use only
 * <p>
 * Loads an RSA private key from a PEM input stream. An instance lives for
 * one signature; nothing is cached across instances.
 */
class PrivateKeyProvider {
    private RSAPrivateKey key = null;

    /**
     * Build private key provider from a PEM key file.
     *
     * @throws IllegalArgumentException if the file cannot be read or the
     * key cannot be decoded
     */
    PrivateKeyProvider(String keyFilePath, char[] passphrase) {
        this(open(keyFilePath), passphrase);
    }

    /**
     * Build private key provider from given input stream. The stream is
     * closed and the passphrase erased before this returns.
     */
    PrivateKeyProvider(InputStream keyInputStream, char[] passphrase) {
        getKeyInternal(keyInputStream, passphrase);
    }

    /**
     * Get the RSAPrivateKey
     */
    RSAPrivateKey getKey() {
        return key;
    }

    private static InputStream open(String keyFilePath) {
        try {
            return new FileInputStream(Utils.expandUserHome(keyFilePath));
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException(
                "Unable to read private key file " + keyFilePath, e);
        }
    }

    private void getKeyInternal(InputStream keyInputStream,
                                char[] passphrase) {
        try (ReadableByteChannel channel = Channels.newChannel(keyInputStream);
             Pem.Passphrase pemPassphrase = Pem.Passphrase.of(passphrase)) {
            PrivateKey privateKey =
                Pem.decoder().with(pemPassphrase).decodePrivateKey(channel);
            if (privateKey instanceof RSAPrivateKey) {
                key = (RSAPrivateKey) privateKey;
            } else {
                throw new IllegalArgumentException(
                    "Must be RSA private key, but " +
                    privateKey.getAlgorithm());
            }
        } catch (PemEncryptedKeyException e) {
            throw new IllegalArgumentException(
                "The private key is encrypted, but no passphrase is " +
                "configured", e);
        } catch (PemEncryptionException e) {
            throw new IllegalArgumentException(
                "The provided passphrase is incorrect.", e);
        } catch (PemException e) {
            throw new IllegalArgumentException(
                "Private key must be in PEM format", e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Error reading private key", e);
        } finally {
            if (passphrase != null) {
                Arrays.fill(passphrase, ' ');
            }
        }
    }
}
