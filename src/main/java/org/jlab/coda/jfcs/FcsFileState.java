/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import java.nio.ByteOrder;

/**
 * Scalar state that only has meaning during one load or save.
 * Reset before each operation.
 */
final class FcsFileState {

    /** TEXT segment delimiter. */
    byte delimiter = '|';

    /** Byte order of the DATA segment. */
    ByteOrder byteOrder = ByteOrder.nativeOrder();

    /** Declared element type. */
    FcsDataType dataType = FcsDataType.FLOAT;

    /** Return every field to its default. */
    void reset() {
        delimiter = '|';
        byteOrder = ByteOrder.nativeOrder();
        dataType  = FcsDataType.FLOAT;
    }

    /**
     * Get the $BYTEORD value for a byte order.
     * @param order byte order.
     * @return "1,2,3,4" or "4,3,2,1".
     */
    static String byteOrderKeywordValue(ByteOrder order) {
        return (order == ByteOrder.LITTLE_ENDIAN) ? "1,2,3,4" : "4,3,2,1";
    }

    /**
     * Parse a $BYTEORD value.
     * @param value keyword value.
     * @return byte order, or <code>null</code> if not one of the
     *         four supported forms.
     */
    static ByteOrder parseByteOrder(String value) {
        if (value == null) return null;
        String v = value.replace(" ", "");
        switch (v) {
            case "1,2,3,4":
            case "1,2":
                return ByteOrder.LITTLE_ENDIAN;
            case "4,3,2,1":
            case "2,1":
                return ByteOrder.BIG_ENDIAN;
            default:
                return null;
        }
    }
}
