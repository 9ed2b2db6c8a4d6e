package com.example.agencyworkflow.validation;

import com.google.common.base.Splitter;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Ints;

import java.util.Arrays;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Textual principal format used for canister ids: lowercase base32 (no padding) of a
 * 4-byte big-endian CRC32 followed by at most 29 id bytes, grouped by dashes every five
 * characters. Only the canonical spelling is accepted.
 */
public final class CanisterIdFormat {

    private static final BaseEncoding BASE32 = BaseEncoding.base32().lowerCase().omitPadding();
    private static final int CHECKSUM_BYTES = 4;
    private static final int MAX_ID_BYTES = 29;

    private CanisterIdFormat() {
    }

    public static boolean isValid(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        byte[] decoded;
        try {
            decoded = BASE32.decode(text.toLowerCase(Locale.ROOT).replace("-", ""));
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (decoded.length < CHECKSUM_BYTES || decoded.length - CHECKSUM_BYTES > MAX_ID_BYTES) {
            return false;
        }
        byte[] id = Arrays.copyOfRange(decoded, CHECKSUM_BYTES, decoded.length);
        if (!Arrays.equals(checksum(id), Arrays.copyOfRange(decoded, 0, CHECKSUM_BYTES))) {
            return false;
        }
        return toText(id).equals(text);
    }

    /**
     * Canonical text for raw id bytes.
     */
    public static String toText(byte[] id) {
        if (id.length > MAX_ID_BYTES) {
            throw new IllegalArgumentException("principal is longer than " + MAX_ID_BYTES + " bytes");
        }
        byte[] bytes = new byte[CHECKSUM_BYTES + id.length];
        System.arraycopy(checksum(id), 0, bytes, 0, CHECKSUM_BYTES);
        System.arraycopy(id, 0, bytes, CHECKSUM_BYTES, id.length);
        return String.join("-", Splitter.fixedLength(5).split(BASE32.encode(bytes)));
    }

    private static byte[] checksum(byte[] id) {
        CRC32 crc = new CRC32();
        crc.update(id);
        return Ints.toByteArray((int) crc.getValue());
    }
}
