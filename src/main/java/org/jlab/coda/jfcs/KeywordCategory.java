/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

/**
 * Groups of FCS keywords. Mostly used for printing.
 */
public enum KeywordCategory {
    /** Segment offsets and other structural keywords. */
    STRUCTURE,
    /** Description of the DATA segment. */
    DATA_SEGMENT,
    /** Description of the ANALYSIS segment. */
    ANALYSIS_SEGMENT,
    /** Per-parameter keywords. */
    PARAMETER,
    /** Acquisition times and counts. */
    ACQUISITION,
    /** Sample, specimen, and experiment description. */
    SAMPLE,
    /** Cytometer and acquisition software. */
    INSTRUMENT,
    /** Fluorescence compensation. */
    COMPENSATION,
    /** Acquisition-time gates. */
    GATING,
    /** Cell subsets in the ANALYSIS segment. */
    CELL_SUBSET,
    /** Histogram and correlated data modes. */
    HISTOGRAM,
    /** Vendor and application keywords outside the standard. */
    VENDOR
}
