/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

/**
 * States of the {@link TextSegmentParser} automaton.
 */
enum TokenizerState {
    /** Between pairs. Skipping blanks and stray delimiters. */
    READY_FOR_KEYWORD,
    /** Collecting keyword bytes. */
    START_OF_KEYWORD,
    /** Just past the delimiter that ends a keyword. */
    DELIMITER_AFTER_KEYWORD,
    /** First byte of a value. */
    START_OF_VALUE,
    /** Collecting value bytes. */
    MIDDLE_OF_VALUE,
    /** Just past a delimiter inside or ending a value. */
    DELIMITER_AFTER_VALUE,
    /** A complete pair is ready to store. */
    SAVE_KEYWORD_VALUE
}
