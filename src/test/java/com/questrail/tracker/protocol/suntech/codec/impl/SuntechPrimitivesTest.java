package com.questrail.tracker.protocol.suntech.codec.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SuntechPrimitivesTest
{
    @Test
    void decodesPackedBcd()
    {
        assertEquals(1234, SuntechPrimitives.decodeBcd(new byte[] { 0x12, 0x34 }));
        assertEquals(1_990_000_910L,
                SuntechPrimitives.decodeBcd(new byte[] { 0x19, (byte) 0x90, 0x00, 0x09, 0x10 }));
        assertEquals(0, SuntechPrimitives.decodeBcd(new byte[0]));
    }

    @Test
    void bcdEncodingOfAnyDecimalDecodesBackToIt()
    {
        long[] samples = { 0, 7, 42, 99, 100, 310, 2025, 123_456, 99_999_999, 1_990_000_910L };
        for (long n : samples) {
            assertEquals(n, SuntechPrimitives.decodeBcd(toBcd(n, 5)), "value " + n);
        }
    }

    @Test
    void invalidNibbleFallsBackToHexForWholeField()
    {
        assertEquals(0x1A, SuntechPrimitives.decodeBcd(new byte[] { 0x1A }));
        assertEquals(0x0B13, SuntechPrimitives.decodeBcd(new byte[] { 0x0B, 0x13 }));
        assertEquals(0x12F4, SuntechPrimitives.decodeBcd(new byte[] { 0x12, (byte) 0xF4 }));
    }

    @Test
    void rejectsBcdLongerThanEightBytes()
    {
        assertThrows(IllegalArgumentException.class, () -> SuntechPrimitives.decodeBcd(new byte[9]));
    }

    @Test
    void decodesDateAndTime()
    {
        assertEquals("20250314", SuntechPrimitives.decodeDate(new byte[] { 0x25, 0x03, 0x14 }));
        assertEquals("12:30:45", SuntechPrimitives.decodeTime(new byte[] { 0x12, 0x30, 0x45 }));
    }

    @Test
    void dateAndTimeFallBackPerByte()
    {
        // 0x0B is not BCD and reads as 11; its neighbours still read as BCD.
        assertEquals("20191113", SuntechPrimitives.decodeDate(new byte[] { 0x19, 0x0B, 0x13 }));
        assertEquals("15:34:15", SuntechPrimitives.decodeTime(new byte[] { 0x15, 0x34, 0x0F }));
    }

    @Test
    void missingDateBytesReadAsZero()
    {
        assertEquals("20250000", SuntechPrimitives.decodeDate(new byte[] { 0x25 }));
        assertEquals("00:00:00", SuntechPrimitives.decodeTime(new byte[0]));
    }

    @Test
    void decodesSignedMicrodegrees()
    {
        assertEquals(49.148988, SuntechPrimitives.decodeCoordinate(new byte[] { 0x02, (byte) 0xED, (byte) 0xF4, 0x3C }), 1e-9);
        assertEquals(-123.116226, SuntechPrimitives.decodeCoordinate(-123_116_226), 1e-9);
        assertEquals(0.0, SuntechPrimitives.decodeCoordinate(0));
    }

    @Test
    void coordinateSurvivesMicrodegreeRoundTrip()
    {
        int[] samples = { 1, -1, 49_148_988, -123_116_226, 90_000_000, -180_000_000, Integer.MAX_VALUE };
        for (int micro : samples) {
            double degrees = SuntechPrimitives.decodeCoordinate(micro);
            assertEquals(micro, Math.round(degrees * 1_000_000.0), "microdegrees " + micro);
        }
    }

    @Test
    void rejectsCoordinateOfWrongWidth()
    {
        assertThrows(IllegalArgumentException.class, () -> SuntechPrimitives.decodeCoordinate(new byte[3]));
    }

    @Test
    void decodesHundredths()
    {
        assertEquals(50.0, SuntechPrimitives.decodeHundredths(5000));
        assertEquals(655.35, SuntechPrimitives.decodeHundredths(0xFFFF), 1e-9);
    }

    @Test
    void formatsSoftwareVersion()
    {
        assertEquals("0.1.010C", SuntechPrimitives.formatSoftwareVersion(new byte[] { 0x01, 0x01, 0x0C }));
        assertEquals("1.2.3456", SuntechPrimitives.formatSoftwareVersion(new byte[] { 0x12, 0x34, 0x56 }));
    }

    @Test
    void rendersUpperCaseHex()
    {
        assertEquals("AC233F", SuntechPrimitives.toHex(new byte[] { (byte) 0xAC, 0x23, 0x3F }));
        assertEquals("233F", SuntechPrimitives.toHex(new byte[] { (byte) 0xAC, 0x23, 0x3F }, 1, 2));
    }

    private static byte[] toBcd(long value, int width)
    {
        byte[] out = new byte[width];
        for (int i = width - 1; i >= 0; i--) {
            int low = (int) (value % 10);
            value /= 10;
            int high = (int) (value % 10);
            value /= 10;
            out[i] = (byte) ((high << 4) | low);
        }
        return out;
    }
}
