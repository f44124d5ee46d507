/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs.events;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jlab.coda.jfcs.FcsError;
import org.jlab.coda.jfcs.FcsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

@Tag("fast")
class CompensationTest {

    private static final List<String> NAMES = Arrays.asList("FL1", "FL2");

    private static EventTable table(boolean useDouble, int events) throws FcsException {
        EventTable t = new EventTable(useDouble, events);
        t.appendParameter("FSC");
        t.appendParameter("FL1");
        t.appendParameter("FL2");
        for (int e = 0; e < events; e++) {
            t.setValue(0, e, e);
            t.setValue(1, e, 10 + e % 100);
            t.setValue(2, e, 20 + e % 37);
        }
        return t;
    }


    @Test
    @DisplayName("The identity matrix leaves values bit-identical")
    void identity() throws FcsException {
        EventTable t = table(false, 10);
        float[] fl1 = t.getParameterFloats(1).clone();
        float[] fl2 = t.getParameterFloats(2).clone();

        t.compensate(NAMES, new double[] {1, 0, 0, 1});
        assertArrayEquals(fl1, t.getParameterFloats(1));
        assertArrayEquals(fl2, t.getParameterFloats(2));
    }


    @Test
    @DisplayName("Compensated values are the row vector times the inverse")
    void twoByTwo() throws FcsException {
        EventTable t = table(true, 1);
        double[] m = {1.0, 0.5, 0.25, 1.0};

        t.compensate(NAMES, m);
        assertEquals(5.0 / 0.875, t.getValue(1, 0), 1e-12);
        assertEquals(15.0 / 0.875, t.getValue(2, 0), 1e-12);
        assertEquals(0.0, t.getValue(0, 0), 0.0);
        assertEquals(15.0 / 0.875, t.getParameterDataMaximum(2), 1e-12);
    }


    @Test
    @DisplayName("Compensation in parallel undoes the spillover")
    void manyEvents() throws FcsException {
        int events = 3 * Compensation.EVENTS_PER_TASK + 17;
        EventTable t = table(true, events);
        EventTable original = new EventTable(t);
        double[] m = {1.0, 0.2, 0.1, 1.0};

        t.compensate(NAMES, m);

        for (int e = 0; e < events; e += 97) {
            double a = t.getValue(1, e), b = t.getValue(2, e);
            assertEquals(original.getValue(1, e), a * m[0] + b * m[2], 1e-9);
            assertEquals(original.getValue(2, e), a * m[1] + b * m[3], 1e-9);
        }
        assertArrayEquals(original.getParameterDoubles(0), t.getParameterDoubles(0));
    }


    @Test
    @DisplayName("Compensating twice applies the inverse twice")
    void twice() throws FcsException {
        EventTable t = table(true, 50);
        EventTable original = new EventTable(t);
        double[] m = {1.0, 0.3, 0.2, 1.0};
        double[] inv = Compensation.invert(m, 2);

        t.compensate(NAMES, m);
        t.compensate(NAMES, m);

        for (int e = 0; e < 50; e++) {
            double a = original.getValue(1, e), b = original.getValue(2, e);
            double a1 = a * inv[0] + b * inv[2], b1 = a * inv[1] + b * inv[3];
            assertEquals(a1 * inv[0] + b1 * inv[2], t.getValue(1, e), 1e-9);
            assertEquals(a1 * inv[1] + b1 * inv[3], t.getValue(2, e), 1e-9);
        }
    }


    @Test
    @DisplayName("A zero on the diagonal is singular and nothing changes")
    void singular() throws FcsException {
        EventTable t = table(false, 5);
        float[] fl1 = t.getParameterFloats(1).clone();

        FcsException e = assertThrows(FcsException.class,
                () -> t.compensate(NAMES, new double[] {0, 1, 1, 1}));
        assertEquals(FcsError.SINGULAR_MATRIX, e.getError());
        assertArrayEquals(fl1, t.getParameterFloats(1));

        e = assertThrows(FcsException.class,
                () -> Compensation.invert(new double[] {1, 2, 2, 4}, 2));
        assertEquals(FcsError.SINGULAR_MATRIX, e.getError());
    }


    @Test
    @DisplayName("Bad shapes and unknown names are rejected")
    void malformed() throws FcsException {
        EventTable t = table(false, 2);
        assertEquals(FcsError.MALFORMED, assertThrows(FcsException.class,
                () -> t.compensate(Arrays.asList("FL1"), new double[] {1})).getError());
        assertEquals(FcsError.MALFORMED, assertThrows(FcsException.class,
                () -> t.compensate(NAMES, new double[] {1, 0, 1})).getError());
        assertEquals(FcsError.MALFORMED, assertThrows(FcsException.class,
                () -> t.compensate(Arrays.asList("FL1", "FL1"), new double[] {1, 0, 0, 1})).getError());
        assertEquals(FcsError.UNKNOWN_PARAMETER, assertThrows(FcsException.class,
                () -> t.compensate(Arrays.asList("FL1", "FL9"), new double[] {1, 0, 0, 1})).getError());
    }


    @Test
    @DisplayName("Identity detection")
    void isIdentity() {
        assertTrue(Compensation.isIdentity(new double[] {1, 0, 0, 1}, 2));
        assertFalse(Compensation.isIdentity(new double[] {1, 0, 0.01, 1}, 2));
    }
}
