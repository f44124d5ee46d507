/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import java.util.HashMap;

/**
 * Versions of the FCS format which can be read. Each version has the
 * 6-character tag found at the start of a file's header and a bit used in
 * keyword version masks.
 */
public enum FcsVersion {
    /** FCS 1.0 (1984). */
    FCS1_0("FCS1.0", 0x1),
    /** FCS 2.0 (1990). */
    FCS2_0("FCS2.0", 0x2),
    /** FCS 3.0 (1997). */
    FCS3_0("FCS3.0", 0x4),
    /** FCS 3.1 (2010). */
    FCS3_1("FCS3.1", 0x8);

    /** Mask with every version bit set. */
    public static final int ALL_VERSIONS = 0xf;
    /** Mask for versions 3.0 and later. */
    public static final int VERSIONS_3 = 0xc;
    /** Mask for versions 2.0 and later. */
    public static final int VERSIONS_2_3 = 0xe;

    /** Header tag such as "FCS3.1". */
    private final String tag;

    /** Bit used in version masks. */
    private final int mask;

    /** Fast way to convert header tags into versions. */
    private static final HashMap<String, FcsVersion> tags = new HashMap<String, FcsVersion>(8);

    static {
        for (FcsVersion v : values()) {
            tags.put(v.tag, v);
        }
    }

    FcsVersion(String tag, int mask) {
        this.tag  = tag;
        this.mask = mask;
    }

    /**
     * Get the 6-character header tag.
     * @return header tag.
     */
    public String getTag() {return tag;}

    /**
     * Get the bit for this version in a version mask.
     * @return version bit.
     */
    public int getMask() {return mask;}

    /**
     * Is this version at least 3.0?
     * @return <code>true</code> if version is 3.0 or 3.1.
     */
    public boolean isVersion3() {return (mask & VERSIONS_3) != 0;}

    /**
     * Obtain the version from a header tag.
     *
     * @param tag the tag to match.
     * @return the matching enum, or <code>null</code>.
     */
    public static FcsVersion getVersion(String tag) {
        if (tag == null) return null;
        return tags.get(tag);
    }
}
