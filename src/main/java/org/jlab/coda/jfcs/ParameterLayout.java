/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

/**
 * How one parameter is stored in the DATA segment: element type, width
 * and, for integers, the mask that discards bits above the declared range.
 */
final class ParameterLayout {

    /** Integers needing more significant bits than this are loaded as doubles. */
    static final int FLOAT_SIGNIFICANT_BITS = 24;

    /** Element type. */
    final FcsDataType type;
    /** Width in bits. */
    final int bits;
    /** Width in bytes. */
    final int bytes;
    /** Declared range, $PnR, or 0 if absent. */
    final double range;
    /** Mask applied to integer values. */
    final long mask;


    /**
     * Constructor.
     * @param type  element type, INTEGER, FLOAT or DOUBLE.
     * @param bits  width in bits, a multiple of 8.
     * @param range declared range, or 0 if absent.
     */
    ParameterLayout(FcsDataType type, int bits, double range) {
        this.type  = type;
        this.bits  = bits;
        this.bytes = bits / 8;
        this.range = range;
        this.mask  = (type == FcsDataType.INTEGER) ? maskForRange(range, bits) : -1L;
    }


    /**
     * Get the smallest mask of the form 2<sup>k</sup>-1 that covers
     * every value below the range. The full element mask is returned if
     * the range is absent, at most 1, or wider than the element.
     *
     * @param range declared range.
     * @param bits  element width in bits.
     * @return mask.
     */
    static long maskForRange(double range, int bits) {
        long full = (bits >= 64) ? -1L : (1L << bits) - 1L;
        if (!(range > 1.0)) return full;
        if (bits >= 64 && range > 0x1.0p62) return full;
        if (bits < 64 && range > (double) full + 1.0) return full;

        long top = (long) Math.ceil(range) - 1L;
        long mask = 1L;
        while (mask < top) {
            mask = (mask << 1) | 1L;
        }
        return mask & full;
    }


    /**
     * Does this parameter need double precision in memory?
     * @return <code>true</code> for doubles, 64-bit integers, and 32-bit
     *         integers whose range needs more than 24 significant bits.
     */
    boolean needsDouble() {
        switch (type) {
            case DOUBLE:
                return true;
            case INTEGER:
                if (bits == 64) return true;
                if (bits == 32) {
                    return Long.bitCount(mask) > FLOAT_SIGNIFICANT_BITS;
                }
                return false;
            default:
                return false;
        }
    }


    /**
     * Does any parameter need double precision?
     * @param layouts all parameters.
     * @return <code>true</code> if the table must hold doubles.
     */
    static boolean tableNeedsDouble(ParameterLayout[] layouts) {
        for (ParameterLayout p : layouts) {
            if (p.needsDouble()) return true;
        }
        return false;
    }


    /**
     * Get the number of bytes in one event.
     * @param layouts all parameters.
     * @return bytes per event.
     */
    static long eventBytes(ParameterLayout[] layouts) {
        long sum = 0L;
        for (ParameterLayout p : layouts) {
            sum += p.bytes;
        }
        return sum;
    }


    /**
     * Do all parameters share one type and width?
     * @param layouts all parameters.
     * @return <code>true</code> if uniform (or empty).
     */
    static boolean isUniform(ParameterLayout[] layouts) {
        for (int i = 1; i < layouts.length; i++) {
            if (layouts[i].bits != layouts[0].bits || layouts[i].type != layouts[0].type) {
                return false;
            }
        }
        return true;
    }


    /** {@inheritDoc} */
    @Override
    public String toString() {
        return type + "/" + bits + " range " + range + " mask 0x" + Long.toHexString(mask);
    }
}
