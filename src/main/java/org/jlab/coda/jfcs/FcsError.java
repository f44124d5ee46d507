/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

/**
 * This <code>enum</code> denotes the kind of problem carried by an {@link FcsException}.
 */
public enum FcsError {
    /** File ends before a required field. */
    TRUNCATED("Truncated"),
    /** Field is present but cannot be parsed. */
    MALFORMED("Malformed"),
    /** Recognized but intentionally unimplemented feature. */
    UNSUPPORTED("Unsupported"),
    /** Compensation matrix cannot be inverted. */
    SINGULAR_MATRIX("Singular matrix"),
    /** Range, gain, decades or offset of a parameter cannot be used for scaling. */
    MALFORMED_SCALE("Malformed scale"),
    /** A matrix names a parameter the event table does not have. */
    UNKNOWN_PARAMETER("Unknown parameter"),
    /** A parameter name is already in use. */
    DUPLICATE_NAME("Duplicate name"),
    /** A parameter name was not found. */
    NAME_NOT_FOUND("Name not found"),
    /** A keyword is not in the vocabulary. */
    UNKNOWN_KEYWORD("Unknown keyword"),
    /** A keyword is derived from the event table and cannot be set directly. */
    PROTECTED_KEYWORD("Protected keyword"),
    /** Underlying open, read or write failure. */
    IO_ERROR("I/O error");

    /** Short text used when printing. */
    private final String description;

    FcsError(String description) {
        this.description = description;
    }

    /**
     * Get the description.
     * @return description.
     */
    public String getDescription() {return description;}
}
