/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

@Tag("fast")
class FcsHeaderTest {

    private static ByteBuffer ascii(String s) {
        return ByteBuffer.wrap(s.getBytes(StandardCharsets.US_ASCII));
    }


    @Test
    @DisplayName("Right-justified and zero-padded offsets are read")
    void readHeader() throws FcsException {
        FcsHeader h = FcsHeader.readHeader(ascii(
                "FCS3.0    " + "      58" + "00001000" + "1001    " + "    2000" + "       0" + "        "));
        assertEquals(FcsVersion.FCS3_0, h.getVersion());
        assertEquals(58L, h.getTextBegin());
        assertEquals(1000L, h.getTextEnd());
        assertEquals(1001L, h.getDataBegin());
        assertEquals(2000L, h.getDataEnd());
        assertEquals(0L, h.getAnalysisBegin());
        assertEquals(0L, h.getAnalysisEnd());
    }


    @Test
    @DisplayName("A short header is truncated")
    void truncated() {
        FcsException e = assertThrows(FcsException.class, () -> FcsHeader.readHeader(ascii("FCS3.1    58")));
        assertEquals(FcsError.TRUNCATED, e.getError());
    }


    @Test
    @DisplayName("Unknown versions and bad offsets are rejected")
    void badHeaders() {
        String offsets = "      58" + "     100" + "       0" + "       0" + "       0" + "       0";
        FcsException e = assertThrows(FcsException.class,
                () -> FcsHeader.readHeader(ascii("FCS4.0    " + offsets)));
        assertEquals(FcsError.UNSUPPORTED, e.getError());

        e = assertThrows(FcsException.class,
                () -> FcsHeader.readHeader(ascii("FCS3.1    " + "     5x8" + offsets.substring(8))));
        assertEquals(FcsError.MALFORMED, e.getError());

        e = assertThrows(FcsException.class,
                () -> FcsHeader.readHeader(ascii("FCS3.1    " + "  5  8  " + offsets.substring(8))));
        assertEquals(FcsError.MALFORMED, e.getError());
    }


    @Test
    @DisplayName("Offsets too large for the header are written as zero")
    void writeLargeDataOffsets() throws FcsException {
        FcsHeader h = new FcsHeader(FcsVersion.FCS3_1, 58L, 999L, 1000L, 200000000L, 0L, 0L);
        ByteBuffer b = ByteBuffer.allocate(FcsHeader.HEADER_SIZE_BYTES);
        h.writeHeader(b);
        b.flip();

        FcsHeader back = FcsHeader.readHeader(b);
        assertEquals(FcsVersion.FCS3_1, back.getVersion());
        assertEquals(999L, back.getTextEnd());
        assertEquals(0L, back.getDataBegin());
        assertEquals(0L, back.getDataEnd());
    }
}
