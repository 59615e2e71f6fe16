package com.aska.ghostpilot;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NalUnitsTest {

    @Test
    void detectsStartCodes() {
        assertTrue(NalUnits.startsWithStartCode(new byte[]{0, 0, 1, 0x67}));
        assertTrue(NalUnits.startsWithStartCode(new byte[]{0, 0, 0, 1, 0x67}));
        assertFalse(NalUnits.startsWithStartCode(new byte[]{0, 0, 2, 0x67}));
        assertFalse(NalUnits.startsWithStartCode(new byte[]{0, 0}));
        assertFalse(NalUnits.startsWithStartCode(null));
    }

    @Test
    void readsNalType() {
        assertEquals(NalUnits.TYPE_SPS, NalUnits.findNalUnitType(new byte[]{0, 0, 0, 1, 0x67, 0x42}));
        assertEquals(NalUnits.TYPE_PPS, NalUnits.findNalUnitType(new byte[]{0, 0, 1, 0x68}));
        assertEquals(5, NalUnits.findNalUnitType(new byte[]{0, 0, 0, 1, 0x65, (byte) 0x88}));
        assertEquals(-1, NalUnits.findNalUnitType(new byte[]{1, 2, 3, 4, 5}));
        assertEquals(-1, NalUnits.findNalUnitType(null));
    }

    @Test
    void convertsLengthPrefixedUnits() {
        byte[] avcc = {0, 0, 0, 2, 0x67, 0x42, 0, 0, 0, 1, 0x68};
        byte[] expected = {0, 0, 0, 1, 0x67, 0x42, 0, 0, 0, 1, 0x68};
        byte[] converted = NalUnits.maybeConvertFraming(avcc);
        assertArrayEquals(expected, converted);
        assertSame(converted, NalUnits.maybeConvertFraming(converted));
    }

    @Test
    void invalidLengthIsLeftAlone() {
        byte[] truncated = {0, 0, 0, 9, 1, 2};
        assertSame(truncated, NalUnits.maybeConvertFraming(truncated));

        byte[] trailing = {0, 0, 0, 2, 0x41, 7, 9};
        assertSame(trailing, NalUnits.maybeConvertFraming(trailing));

        byte[] shortInput = {1, 2};
        assertSame(shortInput, NalUnits.maybeConvertFraming(shortInput));
    }

    @Test
    void splitsOnStartCodes() {
        byte[] data = {0, 0, 0, 1, 0x67, 0x42, 0, 0, 0, 1, 0x68, (byte) 0xCE, 0, 0, 1, 0x65, (byte) 0x88};
        List<byte[]> units = NalUnits.split(data);
        assertEquals(3, units.size());
        assertArrayEquals(new byte[]{0, 0, 0, 1, 0x67, 0x42}, units.get(0));
        assertArrayEquals(new byte[]{0, 0, 0, 1, 0x68, (byte) 0xCE}, units.get(1));
        assertArrayEquals(new byte[]{0, 0, 1, 0x65, (byte) 0x88}, units.get(2));
    }

    @Test
    void dataWithoutLeadingStartCodeIsOneUnit() {
        byte[] data = {5, 6, 0, 0, 1, 0x65};
        List<byte[]> units = NalUnits.split(data);
        assertEquals(1, units.size());
        assertSame(data, units.get(0));
    }
}
