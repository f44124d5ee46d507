/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("fast")
class ParameterLayoutTest {

    @Test
    @DisplayName("Masks cover every value below the range")
    void masks() {
        assertEquals(1023L, ParameterLayout.maskForRange(1024, 16));
        assertEquals(1023L, ParameterLayout.maskForRange(1000, 16));
        assertEquals(0xffffL, ParameterLayout.maskForRange(0, 16));
        assertEquals(0xffL, ParameterLayout.maskForRange(100000, 8));
        assertEquals(0xffffffL, ParameterLayout.maskForRange(16777216, 24));
        assertEquals(-1L, ParameterLayout.maskForRange(0, 64));
        assertEquals(1L, ParameterLayout.maskForRange(2, 16));
    }


    @Test
    @DisplayName("Wide integers need doubles")
    void needsDouble() {
        assertFalse(new ParameterLayout(FcsDataType.INTEGER, 16, 1024).needsDouble());
        assertFalse(new ParameterLayout(FcsDataType.INTEGER, 32, 262144).needsDouble());
        assertTrue(new ParameterLayout(FcsDataType.INTEGER, 32, 0).needsDouble());
        assertTrue(new ParameterLayout(FcsDataType.INTEGER, 32, 1L << 30).needsDouble());
        assertTrue(new ParameterLayout(FcsDataType.INTEGER, 64, 1024).needsDouble());
        assertFalse(new ParameterLayout(FcsDataType.FLOAT, 32, 1024).needsDouble());
        assertTrue(new ParameterLayout(FcsDataType.DOUBLE, 64, 1024).needsDouble());
    }


    @Test
    @DisplayName("Event size and uniformity")
    void eventBytes() {
        ParameterLayout[] mixed = {
            new ParameterLayout(FcsDataType.INTEGER, 8, 256),
            new ParameterLayout(FcsDataType.INTEGER, 24, 0)
        };
        assertEquals(4L, ParameterLayout.eventBytes(mixed));
        assertFalse(ParameterLayout.isUniform(mixed));
        assertFalse(ParameterLayout.tableNeedsDouble(mixed));

        ParameterLayout[] same = {
            new ParameterLayout(FcsDataType.INTEGER, 16, 1024),
            new ParameterLayout(FcsDataType.INTEGER, 16, 4096)
        };
        assertTrue(ParameterLayout.isUniform(same));
    }


    @Test
    @DisplayName("Unsigned 64-bit values convert to double")
    void unsignedToDouble() {
        assertEquals(18446744073709551615.0, DataSegmentCodec.unsignedToDouble(-1L));
        assertEquals(5.0, DataSegmentCodec.unsignedToDouble(5L));
    }
}
