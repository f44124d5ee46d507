/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs.events;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jlab.coda.jfcs.FcsError;
import org.jlab.coda.jfcs.FcsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

@Tag("fast")
class EventTableTest {

    private static EventTable table() throws FcsException {
        EventTable t = new EventTable(false, 3);
        t.appendParameter("FSC");
        t.appendParameter("SSC");
        for (int e = 0; e < 3; e++) {
            t.setValue(0, e, e + 1);
            t.setValue(1, e, 10 * (e + 1));
        }
        return t;
    }


    @Test
    @DisplayName("Parameters are found by name and index")
    void names() throws FcsException {
        EventTable t = table();
        assertEquals(Arrays.asList("FSC", "SSC"), t.getParameterNames());
        assertEquals(1, t.getParameterIndex("SSC"));
        assertEquals(-1, t.findParameter("FL1"));

        FcsException e = assertThrows(FcsException.class, () -> t.getParameterIndex("FL1"));
        assertEquals(FcsError.NAME_NOT_FOUND, e.getError());
        e = assertThrows(FcsException.class, () -> t.appendParameter("FSC"));
        assertEquals(FcsError.DUPLICATE_NAME, e.getError());
        e = assertThrows(FcsException.class, () -> t.setParameterName(0, "SSC"));
        assertEquals(FcsError.DUPLICATE_NAME, e.getError());
        assertThrows(IllegalArgumentException.class, () -> t.appendParameter(""));
        assertThrows(IndexOutOfBoundsException.class, () -> t.getParameterName(2));

        t.setParameterName(0, "FSC-A");
        assertEquals("FSC-A", t.getParameterName(0));
        assertEquals("", t.getParameterLongName(0));
    }


    @Test
    @DisplayName("The wrong value kind is refused")
    void valueKind() throws FcsException {
        EventTable t = table();
        assertTrue(t.isFloat());
        assertThrows(IllegalStateException.class, () -> t.getParameterDoubles(0));
        assertEquals(20.0, t.getValue(1, 1), 0.0);
    }


    @Test
    @DisplayName("Best range prefers the specified range unless data exceeds it")
    void bestRange() throws FcsException {
        EventTable t = table();
        t.computeDataMinimumMaximum();
        assertEquals(1.0, t.getParameterBestMinimum(0), 0.0);
        assertEquals(3.0, t.getParameterBestMaximum(0), 0.0);

        t.setParameterMinimum(0, 0.0);
        t.setParameterMaximum(0, 1024.0);
        assertEquals(0.0, t.getParameterBestMinimum(0), 0.0);
        assertEquals(1024.0, t.getParameterBestMaximum(0), 0.0);

        t.setParameterMaximum(1, 20.0);
        assertEquals(30.0, t.getParameterBestMaximum(1), 0.0);
    }


    @Test
    @DisplayName("Resize truncates or zero-extends every parameter")
    void resize() throws FcsException {
        EventTable t = table();
        t.resize(5);
        assertArrayEquals(new float[] {1f, 2f, 3f, 0f, 0f}, t.getParameterFloats(0));
        t.resize(1);
        assertEquals(1, t.getNumberOfEvents());
        assertArrayEquals(new float[] {10f}, t.getParameterFloats(1));
    }


    @Test
    @DisplayName("Copies are independent and may change value kind")
    void copy() throws FcsException {
        EventTable t = table();
        t.setParameterLongName(0, "forward scatter");
        t.setNumberOfOriginalEvents(100L);

        EventTable same = new EventTable(t);
        same.setValue(0, 0, 99.0);
        assertEquals(1.0, t.getValue(0, 0), 0.0);
        assertEquals(100L, same.getNumberOfOriginalEvents());
        assertEquals("forward scatter", same.getParameterLongName(0));

        EventTable wide = new EventTable(true);
        wide.copy(t);
        assertTrue(wide.isDouble());
        assertArrayEquals(new double[] {10.0, 20.0, 30.0}, wide.getParameterDoubles(1));

        EventTable other = new EventTable(false, 3);
        other.appendParameter("X");
        other.copyValues(t, 1, 0);
        assertArrayEquals(new float[] {10f, 20f, 30f}, other.getParameterFloats(0));
    }


    @Test
    @DisplayName("Removing parameters")
    void remove() throws FcsException {
        EventTable t = table();
        t.removeParameter("FSC");
        assertEquals(1, t.getNumberOfParameters());
        assertEquals("SSC", t.getParameterName(0));
        t.removeParameter(0);
        assertEquals(0, t.getNumberOfParameters());
    }


    @Test
    @DisplayName("Clearing zeroes values and keeps parameters and events")
    void clear() throws FcsException {
        EventTable t = table();
        t.setParameterMaximum(1, 1024.0);
        t.setNumberOfOriginalEvents(7L);
        t.computeDataMinimumMaximum();

        t.clear();
        assertEquals(Arrays.asList("FSC", "SSC"), t.getParameterNames());
        assertEquals(3, t.getNumberOfEvents());
        assertEquals(7L, t.getNumberOfOriginalEvents());
        assertArrayEquals(new float[] {0f, 0f, 0f}, t.getParameterFloats(0));
        assertArrayEquals(new float[] {0f, 0f, 0f}, t.getParameterFloats(1));
        assertEquals(1024.0, t.getParameterMaximum(1), 0.0);
        assertEquals(0.0, t.getParameterDataMaximum(1), 0.0);
    }
}
