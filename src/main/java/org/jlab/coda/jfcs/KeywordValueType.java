/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

/**
 * Expected type of a keyword's value.
 */
public enum KeywordValueType {
    /** Free text. */
    STRING,
    /** Integer number. */
    INTEGER,
    /** Floating point number. */
    FLOAT,
    /** Comma-separated list of values. */
    MULTI_VALUE;

    /**
     * Is this a numeric type?
     * @return <code>true</code> for {@link #INTEGER} and {@link #FLOAT}.
     */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
