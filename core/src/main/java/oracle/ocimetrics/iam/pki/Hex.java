/*-
 * Copyright (c) 2024, 2026 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.ocimetrics.iam.pki;

/* decodes the IV of a DEK-Info header */
abstract class Hex {
    private Hex() {}

    static byte[] decode(final CharSequence hex) {
        final int length = hex.length();
        if (length % 2 != 0) {
            throw new PemException("Odd number of hex digits: " + hex);
        }
        byte[] bytes = new byte[length / 2];
        for (int i = 0; i < length; i += 2) {
            final int highNibble = Character.digit(hex.charAt(i), 16);
            final int lowNibble = Character.digit(hex.charAt(i + 1), 16);
            if (highNibble < 0 || lowNibble < 0) {
                throw new PemException("Invalid hex digits: " + hex);
            }
            bytes[i / 2] = (byte) ((highNibble << 4) + lowNibble);
        }
        return bytes;
    }
}
