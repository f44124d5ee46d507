/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

/**
 * This an enum used to convert the <code>$DATATYPE</code> keyword value
 * into the element type of values in the DATA segment.
 */
public enum FcsDataType {

    /** Unsigned binary integers of 8, 16, 24, 32 or 64 bits. */
    INTEGER("I"),
    /** 32-bit IEEE floating point. */
    FLOAT("F"),
    /** 64-bit IEEE floating point. */
    DOUBLE("D"),
    /** ASCII encoded numbers. Recognized but not supported. */
    ASCII("A");

    /** Value of the $DATATYPE keyword. */
    private final String keywordValue;

    FcsDataType(String keywordValue) {
        this.keywordValue = keywordValue;
    }

    /**
     * Get the value written into the $DATATYPE keyword.
     * @return keyword value.
     */
    public String getKeywordValue() {return keywordValue;}

    /**
     * Is this a floating point type?
     * @return <code>true</code> for {@link #FLOAT} and {@link #DOUBLE}.
     */
    public boolean isFloatingPoint() {
        return this == FLOAT || this == DOUBLE;
    }

    /**
     * Obtain the enum from a $DATATYPE keyword value (case-independent).
     *
     * @param value the value to match.
     * @return the matching enum, or <code>null</code>.
     */
    public static FcsDataType getDataType(String value) {
        if (value == null) return null;
        String v = value.trim();
        for (FcsDataType t : values()) {
            if (t.keywordValue.equalsIgnoreCase(v)) return t;
        }
        return null;
    }
}
