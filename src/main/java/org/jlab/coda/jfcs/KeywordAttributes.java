/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

/**
 * Immutable description of one FCS keyword or keyword template.
 * A template contains a lowercase <code>n</code> at {@link #getIndexOffset()}
 * that stands for a 1-based index, as in <code>$PnN</code>. Templates
 * match keywords such as <code>$P12N</code>.
 */
public final class KeywordAttributes {

    // Bits in the flags word

    /** Keyword is defined by an FCS version. */
    public static final int STANDARD               = 0x01;
    /** Keyword must be present in a file. */
    public static final int REQUIRED               = 0x02;
    /** Keyword is deprecated by the latest FCS version. */
    public static final int DEPRECATED             = 0x04;
    /** Keyword describes one parameter. */
    public static final int PARAMETER              = 0x08;
    /** Keyword describes one gate. */
    public static final int GATE                   = 0x10;
    /** Keyword value contains a date or time. */
    public static final int CONTAINS_DATE          = 0x20;
    /** Keyword value may identify a patient or operator. */
    public static final int CONTAINS_PERSONAL_INFO = 0x40;
    /** Keyword value may contain arbitrary user-entered text. */
    public static final int CONTAINS_USER_INFO     = 0x80;

    /** Flags that mark a keyword as unsafe to keep in a de-identified file. */
    public static final int PRIVATE_FLAGS =
            CONTAINS_DATE | CONTAINS_PERSONAL_INFO | CONTAINS_USER_INFO;


    /** Keyword or template, uppercase except for any index placeholder. */
    private final String keyword;
    /** Human-readable description. */
    private final String description;
    /** Category. */
    private final KeywordCategory category;
    /** Expected value type. */
    private final KeywordValueType valueType;
    /** Bitmask of {@link FcsVersion#getMask()} values defining the keyword. */
    private final int versions;
    /** Flag bits. */
    private final int flags;
    /** Character offset of the index placeholder, or 0 if none. */
    private final int indexOffset;

    /** Prefix before the index placeholder. */
    private final String prefix;
    /** Suffix after the index placeholder. */
    private final String suffix;


    /**
     * Constructor.
     *
     * @param keyword     keyword, or template with a lowercase "n" placeholder.
     * @param description description.
     * @param category    category.
     * @param valueType   expected value type.
     * @param versions    mask of versions defining the keyword.
     * @param flags       flag bits.
     */
    public KeywordAttributes(String keyword, String description, KeywordCategory category,
                             KeywordValueType valueType, int versions, int flags) {
        this.keyword     = keyword;
        this.description = description;
        this.category    = category;
        this.valueType   = valueType;
        this.versions    = versions;
        this.flags       = flags;

        // Only a lowercase 'n' after the first character is a placeholder
        int n = keyword.indexOf('n', 1);
        indexOffset = (n < 0) ? 0 : n;
        if (indexOffset > 0) {
            prefix = keyword.substring(0, indexOffset);
            suffix = keyword.substring(indexOffset + 1);
        }
        else {
            prefix = keyword;
            suffix = "";
        }
    }

    /**
     * Get the keyword or template.
     * @return keyword.
     */
    public String getKeyword() {return keyword;}

    /**
     * Get the description.
     * @return description.
     */
    public String getDescription() {return description;}

    /**
     * Get the category.
     * @return category.
     */
    public KeywordCategory getCategory() {return category;}

    /**
     * Get the expected value type.
     * @return value type.
     */
    public KeywordValueType getValueType() {return valueType;}

    /**
     * Get the mask of FCS versions defining this keyword.
     * @return version mask.
     */
    public int getVersions() {return versions;}

    /**
     * Get the flag bits.
     * @return flags.
     */
    public int getFlags() {return flags;}

    /**
     * Get the character offset of the index placeholder.
     * @return offset, or 0 if the keyword has no embedded index.
     */
    public int getIndexOffset() {return indexOffset;}

    /**
     * Is this keyword defined in the given version?
     * @param version FCS version.
     * @return <code>true</code> if defined.
     */
    public boolean isInVersion(FcsVersion version) {return (versions & version.getMask()) != 0;}

    /**
     * Are any of the given flags set?
     * @param mask flag bits.
     * @return <code>true</code> if at least one is set.
     */
    public boolean hasAnyFlag(int mask) {return (flags & mask) != 0;}

    /** @return <code>true</code> if standard. */
    public boolean isStandard() {return (flags & STANDARD) != 0;}

    /** @return <code>true</code> if required. */
    public boolean isRequired() {return (flags & REQUIRED) != 0;}

    /** @return <code>true</code> if deprecated. */
    public boolean isDeprecated() {return (flags & DEPRECATED) != 0;}

    /** @return <code>true</code> if a parameter keyword. */
    public boolean isParameter() {return (flags & PARAMETER) != 0;}

    /** @return <code>true</code> if a gate keyword. */
    public boolean isGate() {return (flags & GATE) != 0;}

    /** @return <code>true</code> if the value has a date or time. */
    public boolean containsDate() {return (flags & CONTAINS_DATE) != 0;}

    /** @return <code>true</code> if the value may identify a person. */
    public boolean containsPersonalInfo() {return (flags & CONTAINS_PERSONAL_INFO) != 0;}

    /** @return <code>true</code> if the value may have user-entered text. */
    public boolean containsUserInfo() {return (flags & CONTAINS_USER_INFO) != 0;}


    /**
     * Does the given uppercase keyword match this template? The keyword must
     * have this template's prefix, then one or more decimal digits, then
     * this template's suffix. Keywords without an index never match here.
     *
     * @param candidate uppercase keyword.
     * @return <code>true</code> if it matches.
     */
    public boolean matchesTemplate(String candidate) {
        if (indexOffset == 0 || candidate.length() <= indexOffset) return false;
        if (!candidate.startsWith(prefix)) return false;

        int i = indexOffset;
        int len = candidate.length();
        while (i < len && Character.isDigit(candidate.charAt(i)) && candidate.charAt(i) < 0x80) {
            i++;
        }
        if (i == indexOffset) return false;

        return candidate.length() - i == suffix.length() &&
               candidate.regionMatches(i, suffix, 0, suffix.length());
    }

    /**
     * Build the keyword for the given index, such as <code>$P3N</code>
     * from <code>$PnN</code>.
     *
     * @param index 1-based index.
     * @return keyword.
     * @throws IllegalStateException if this keyword has no index.
     */
    public String keywordForIndex(int index) {
        if (indexOffset == 0) {
            throw new IllegalStateException(keyword + " has no index");
        }
        return prefix + index + suffix;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return keyword + " (" + category + ", " + valueType + ")";
    }
}
