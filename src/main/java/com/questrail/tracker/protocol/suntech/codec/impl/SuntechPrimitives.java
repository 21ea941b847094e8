package com.questrail.tracker.protocol.suntech.codec.impl;

import java.util.Objects;

/**
 * SuntechPrimitives
 * -----------------------------------------------------------------------------
 * Field-level decoding rules shared by every Suntech report type.
 *
 * <p><strong>BCD fallback:</strong> some firmware variants emit plain hex in
 * fields documented as BCD. When any nibble of a BCD field exceeds 9 the whole
 * field is re-read as a hexadecimal digit string instead. Dates and times
 * apply the same rule byte by byte.</p>
 */
final class SuntechPrimitives
{
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final int MAX_BCD_BYTES = 8;

    private SuntechPrimitives() {}

    /**
     * Decodes packed BCD, two decimal digits per byte.
     *
     * @throws IllegalArgumentException for sequences longer than 8 bytes
     */
    static long decodeBcd(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return decodeBcd(bytes, 0, bytes.length);
    }

    static long decodeBcd(byte[] bytes, int offset, int length) {
        if (length > MAX_BCD_BYTES) {
            throw new IllegalArgumentException("BCD field longer than " + MAX_BCD_BYTES + " bytes: " + length);
        }

        long result = 0;
        for (int i = offset; i < offset + length; i++) {
            int high = (bytes[i] >> 4) & 0x0F;
            int low = bytes[i] & 0x0F;
            if (high > 9 || low > 9) {
                return Long.parseUnsignedLong(toHex(bytes, offset, length), 16);
            }
            result = result * 100 + (high * 10 + low);
        }
        return result;
    }

    /**
     * Decodes {@code YY MM DD} into {@code YYYYMMDD}. Missing bytes read as zero.
     */
    static String decodeDate(byte[] date) {
        int year = 2000 + digitPair(date, 0);
        int month = digitPair(date, 1);
        int day = digitPair(date, 2);
        return String.format("%04d%02d%02d", year, month, day);
    }

    /**
     * Decodes {@code HH MM SS} into {@code HH:MM:SS}. Missing bytes read as zero.
     */
    static String decodeTime(byte[] time) {
        return String.format("%02d:%02d:%02d", digitPair(time, 0), digitPair(time, 1), digitPair(time, 2));
    }

    /**
     * Decodes a 4-byte big-endian signed coordinate in microdegrees.
     */
    static double decodeCoordinate(byte[] coordinate) {
        if (coordinate.length != 4) {
            throw new IllegalArgumentException("coordinate must be 4 bytes: " + coordinate.length);
        }
        return decodeCoordinate(new FrameReader(coordinate).s32(0));
    }

    /**
     * Big-endian signed 32-bit microdegrees to decimal degrees.
     */
    static double decodeCoordinate(int microdegrees) {
        return microdegrees / 1_000_000.0;
    }

    /**
     * Big-endian unsigned 16-bit hundredths (speed in km/h, course in degrees).
     */
    static double decodeHundredths(int raw) {
        return raw / 100.0;
    }

    /**
     * Renders the 3-byte version field as {@code major.minor.patchhex}: the
     * first hex digit, the second hex digit, then the remaining four.
     */
    static String formatSoftwareVersion(byte[] version) {
        String hex = toHex(version);
        if (hex.length() < 3) {
            return hex;
        }
        return hex.charAt(0) + "." + hex.charAt(1) + "." + hex.substring(2);
    }

    static String toHex(byte[] bytes) {
        return toHex(bytes, 0, bytes.length);
    }

    static String toHex(byte[] bytes, int offset, int length) {
        char[] out = new char[length * 2];
        for (int i = 0; i < length; i++) {
            int b = bytes[offset + i] & 0xFF;
            out[i * 2] = HEX[b >>> 4];
            out[i * 2 + 1] = HEX[b & 0x0F];
        }
        return new String(out);
    }

    private static int digitPair(byte[] bytes, int index) {
        if (bytes == null || index >= bytes.length) {
            return 0;
        }
        return (int) decodeBcd(bytes, index, 1);
    }
}
