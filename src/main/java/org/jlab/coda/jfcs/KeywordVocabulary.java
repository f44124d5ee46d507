/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;

import static org.jlab.coda.jfcs.KeywordAttributes.CONTAINS_DATE;
import static org.jlab.coda.jfcs.KeywordAttributes.CONTAINS_PERSONAL_INFO;
import static org.jlab.coda.jfcs.KeywordAttributes.CONTAINS_USER_INFO;
import static org.jlab.coda.jfcs.KeywordAttributes.DEPRECATED;
import static org.jlab.coda.jfcs.KeywordAttributes.GATE;
import static org.jlab.coda.jfcs.KeywordAttributes.PARAMETER;
import static org.jlab.coda.jfcs.KeywordAttributes.REQUIRED;
import static org.jlab.coda.jfcs.KeywordAttributes.STANDARD;
import static org.jlab.coda.jfcs.KeywordCategory.*;
import static org.jlab.coda.jfcs.KeywordValueType.*;

/**
 * Registry of known FCS keywords. Holds every keyword of FCS 1.0 through 3.1
 * that carries at most one embedded index, plus keywords commonly written
 * by acquisition and analysis software.<p>
 *
 * Lookups first try an exact match, then each template with an embedded
 * index. The registry is built on first use and never changes afterwards,
 * so it may be read from any number of threads.
 */
public final class KeywordVocabulary {

    /** Versions 1.0 through 3.1. */
    private static final int ALL = FcsVersion.ALL_VERSIONS;
    /** Versions 2.0 through 3.1. */
    private static final int V2 = FcsVersion.VERSIONS_2_3;
    /** Versions 3.0 and 3.1. */
    private static final int V3 = FcsVersion.VERSIONS_3;
    /** Version 3.1 only. */
    private static final int V31 = FcsVersion.FCS3_1.getMask();
    /** Versions 1.0 and 2.0. */
    private static final int V12 = FcsVersion.FCS1_0.getMask() | FcsVersion.FCS2_0.getMask();
    /** Not part of any version. */
    private static final int NONE = 0;

    /** Standard and required. */
    private static final int SR = STANDARD | REQUIRED;
    /** Standard, required, per-parameter. */
    private static final int SRP = STANDARD | REQUIRED | PARAMETER;
    /** Standard, per-parameter. */
    private static final int SP = STANDARD | PARAMETER;
    /** Standard, per-gate. */
    private static final int SG = STANDARD | GATE;


    /** Built on first access of {@link Registry#TABLE}, guarded by class initialization. */
    private static final class Registry {
        static final KeywordVocabulary TABLE = new KeywordVocabulary();
    }

    /** Keywords without an index. */
    private final HashMap<String, KeywordAttributes> exact = new HashMap<String, KeywordAttributes>(256);

    /** Keywords with an embedded index. */
    private final ArrayList<KeywordAttributes> templates = new ArrayList<KeywordAttributes>(64);

    /** Every entry in registration order. */
    private final List<KeywordAttributes> all;


    private KeywordVocabulary() {
        ArrayList<KeywordAttributes> list = new ArrayList<KeywordAttributes>(160);

        // Structure
        add(list, "$BEGINANALYSIS", "Byte offset to the beginning of the ANALYSIS segment", STRUCTURE, INTEGER, V3, SR);
        add(list, "$ENDANALYSIS", "Byte offset to the last byte of the ANALYSIS segment", STRUCTURE, INTEGER, V3, SR);
        add(list, "$BEGINDATA", "Byte offset to the beginning of the DATA segment", STRUCTURE, INTEGER, V3, SR);
        add(list, "$ENDDATA", "Byte offset to the last byte of the DATA segment", STRUCTURE, INTEGER, V3, SR);
        add(list, "$BEGINSTEXT", "Byte offset to the beginning of the supplemental TEXT segment", STRUCTURE, INTEGER, V3, SR);
        add(list, "$ENDSTEXT", "Byte offset to the last byte of the supplemental TEXT segment", STRUCTURE, INTEGER, V3, SR);
        add(list, "$NEXTDATA", "Byte offset to the next data set in the file", STRUCTURE, INTEGER, ALL, SR);
        add(list, "$UNICODE", "Keywords with values in Unicode", STRUCTURE, MULTI_VALUE, V3, STANDARD | DEPRECATED);

        // Data segment
        add(list, "$BYTEORD", "Byte order for data acquisition computer", DATA_SEGMENT, MULTI_VALUE, ALL, SR);
        add(list, "$DATATYPE", "Type of data in DATA segment (ASCII, integer, floating point)", DATA_SEGMENT, STRING, ALL, SR);
        add(list, "$MODE", "Data mode (list mode, or histogram)", DATA_SEGMENT, STRING, ALL, SR);
        add(list, "$PAR", "Number of parameters in an event", DATA_SEGMENT, INTEGER, ALL, SR);
        add(list, "$TOT", "Total number of events in the data set", DATA_SEGMENT, INTEGER, ALL, SR);
        add(list, "$ABRT", "Events lost due to data acquisition electronic coincidence", ACQUISITION, INTEGER, ALL, STANDARD);
        add(list, "$LOST", "Number of events lost due to computer busy", ACQUISITION, INTEGER, ALL, STANDARD);

        // Parameters
        add(list, "$PnB", "Number of bits reserved for parameter number n", KeywordCategory.PARAMETER, INTEGER, ALL, SRP);
        add(list, "$PnE", "Amplification type for parameter n", KeywordCategory.PARAMETER, MULTI_VALUE, ALL, SRP);
        add(list, "$PnN", "Short name for parameter n", KeywordCategory.PARAMETER, STRING, ALL, SRP);
        add(list, "$PnR", "Range for parameter number n", KeywordCategory.PARAMETER, FLOAT, ALL, SRP);
        add(list, "$PnCALIBRATION", "Conversion of parameter values to well defined units", KeywordCategory.PARAMETER, MULTI_VALUE, V31, SP);
        add(list, "$PnD", "Suggested visualization scale for parameter n", KeywordCategory.PARAMETER, MULTI_VALUE, V31, SP);
        add(list, "$PnF", "Name of optical filter for parameter n", KeywordCategory.PARAMETER, STRING, ALL, SP);
        add(list, "$PnG", "Amplifier gain used for acquisition of parameter n", KeywordCategory.PARAMETER, FLOAT, V3, SP);
        add(list, "$PnL", "Excitation wavelength(s) for parameter n", KeywordCategory.PARAMETER, MULTI_VALUE, ALL, SP);
        add(list, "$PnO", "Excitation power for parameter n", KeywordCategory.PARAMETER, FLOAT, ALL, SP);
        add(list, "$PnP", "Percent of emitted light collected by parameter n", KeywordCategory.PARAMETER, FLOAT, ALL, SP);
        add(list, "$PnS", "Name used for parameter n", KeywordCategory.PARAMETER, STRING, ALL, SP);
        add(list, "$PnT", "Detector type for parameter n", KeywordCategory.PARAMETER, STRING, ALL, SP);
        add(list, "$PnV", "Detector voltage for parameter n", KeywordCategory.PARAMETER, FLOAT, ALL, SP);

        // Acquisition
        add(list, "$BTIM", "Clock time at beginning of data acquisition", ACQUISITION, STRING, ALL, STANDARD | CONTAINS_DATE);
        add(list, "$ETIM", "Clock time at end of data acquisition", ACQUISITION, STRING, ALL, STANDARD | CONTAINS_DATE);
        add(list, "$DATE", "Date of data set acquisition", ACQUISITION, STRING, ALL, STANDARD | CONTAINS_DATE);
        add(list, "$TIMESTEP", "Time step for time parameter", ACQUISITION, FLOAT, V3, STANDARD);
        add(list, "$TIMEBASE", "Time base for time parameter", ACQUISITION, STRING, V12, STANDARD | DEPRECATED);
        add(list, "$TR", "Trigger parameter and its threshold", ACQUISITION, MULTI_VALUE, ALL, STANDARD);
        add(list, "$VOL", "Volume of sample run during data acquisition", ACQUISITION, FLOAT, V31, STANDARD);
        add(list, "$ORIGINALITY", "Information whether the FCS data set has been modified", ACQUISITION, STRING, V31, STANDARD);
        add(list, "$LAST_MODIFIED", "Timestamp of the last modification of the data set", ACQUISITION, STRING, V31, STANDARD | CONTAINS_DATE);
        add(list, "$LAST_MODIFIER", "Name of the person performing last modification", ACQUISITION, STRING, V31, STANDARD | CONTAINS_PERSONAL_INFO);

        // Sample
        add(list, "$CELLS", "Type of cells or other objects measured", SAMPLE, STRING, ALL, STANDARD | CONTAINS_USER_INFO);
        add(list, "$COM", "Comment", SAMPLE, STRING, ALL, STANDARD | CONTAINS_USER_INFO);
        add(list, "$EXP", "Name of investigator initiating the experiment", SAMPLE, STRING, ALL, STANDARD | CONTAINS_PERSONAL_INFO);
        add(list, "$FIL", "Name of the data file containing the data set", SAMPLE, STRING, ALL, STANDARD | CONTAINS_USER_INFO);
        add(list, "$INST", "Institution at which data was acquired", SAMPLE, STRING, ALL, STANDARD | CONTAINS_USER_INFO);
        add(list, "$OP", "Name of flow cytometry operator", SAMPLE, STRING, ALL, STANDARD | CONTAINS_PERSONAL_INFO);
        add(list, "$PROJ", "Name of the project", SAMPLE, STRING, ALL, STANDARD | CONTAINS_USER_INFO);
        add(list, "$SMNO", "Specimen (e.g., tube) label", SAMPLE, STRING, ALL, STANDARD | CONTAINS_PERSONAL_INFO);
        add(list, "$SRC", "Source of the specimen (patient name, cell types)", SAMPLE, STRING, ALL, STANDARD | CONTAINS_PERSONAL_INFO);
        add(list, "$PLATEID", "Plate identifier", SAMPLE, STRING, V31, STANDARD | CONTAINS_USER_INFO);
        add(list, "$PLATENAME", "Plate name", SAMPLE, STRING, V31, STANDARD | CONTAINS_USER_INFO);
        add(list, "$WELLID", "Well identifier", SAMPLE, STRING, V31, STANDARD | CONTAINS_USER_INFO);

        // Instrument
        add(list, "$CYT", "Type of flow cytometer", INSTRUMENT, STRING, ALL, STANDARD);
        add(list, "$CYTSN", "Flow cytometer serial number", INSTRUMENT, STRING, V3, STANDARD);
        add(list, "$SYS", "Type of computer and its operating system", INSTRUMENT, STRING, ALL, STANDARD);

        // Compensation
        add(list, "$COMP", "Fluorescence compensation matrix", COMPENSATION, MULTI_VALUE, V2, STANDARD | DEPRECATED);
        add(list, "$SPILLOVER", "Fluorescence spillover matrix", COMPENSATION, MULTI_VALUE, V31, STANDARD);

        // Gating
        add(list, "$GATE", "Number of gating parameters", GATING, INTEGER, ALL, STANDARD | DEPRECATED);
        add(list, "$GATING", "Specifies region combinations used for gating", GATING, STRING, V3, STANDARD | DEPRECATED);
        add(list, "$GnE", "Amplification type for gating parameter number n", GATING, MULTI_VALUE, ALL, SG | DEPRECATED);
        add(list, "$GnF", "Optical filter used for gating parameter number n", GATING, STRING, ALL, SG | DEPRECATED);
        add(list, "$GnN", "Name of gating parameter number n", GATING, STRING, ALL, SG | DEPRECATED);
        add(list, "$GnP", "Percent of emitted light collected by gating parameter n", GATING, FLOAT, ALL, SG | DEPRECATED);
        add(list, "$GnR", "Range of gating parameter n", GATING, INTEGER, ALL, SG | DEPRECATED);
        add(list, "$GnS", "Name used for gating parameter n", GATING, STRING, ALL, SG | DEPRECATED);
        add(list, "$GnT", "Detector type for gating parameter n", GATING, STRING, ALL, SG | DEPRECATED);
        add(list, "$GnV", "Detector voltage for gating parameter n", GATING, FLOAT, ALL, SG | DEPRECATED);
        add(list, "$RnI", "Gating region for parameter number n", GATING, MULTI_VALUE, V3, SG | DEPRECATED);
        add(list, "$RnW", "Window settings for gating region n", GATING, MULTI_VALUE, V3, SG | DEPRECATED);

        // Cell subsets
        add(list, "$CSMODE", "Number of subsets to which each event may belong", CELL_SUBSET, INTEGER, V3, STANDARD | DEPRECATED);
        add(list, "$CSVBITS", "Number of bits used to encode a cell subset identifier", CELL_SUBSET, INTEGER, V3, STANDARD | DEPRECATED);
        add(list, "$CSVnFLAG", "Bit set as a flag for subset n", CELL_SUBSET, INTEGER, V3, STANDARD | DEPRECATED);

        // Histograms
        add(list, "$PKn", "Peak channel number of univariate histogram for parameter n", HISTOGRAM, INTEGER, ALL, SP | DEPRECATED);
        add(list, "$PKNn", "Count in peak channel of univariate histogram for parameter n", HISTOGRAM, INTEGER, ALL, SP | DEPRECATED);
        add(list, "$PLOTS", "Number of data sets in the file", HISTOGRAM, INTEGER, V12, STANDARD | DEPRECATED);

        // Common vendor and application keywords
        add(list, "SPILL", "Fluorescence spillover matrix (BD FACSDiva)", COMPENSATION, MULTI_VALUE, NONE, 0);
        add(list, "SPILLOVER", "Fluorescence spillover matrix", COMPENSATION, MULTI_VALUE, NONE, 0);
        add(list, "APPLY COMPENSATION", "Whether compensation was applied during acquisition", COMPENSATION, STRING, NONE, 0);
        add(list, "CREATOR", "Software that wrote the file", INSTRUMENT, STRING, NONE, 0);
        add(list, "FILENAME", "Original file name", SAMPLE, STRING, NONE, CONTAINS_USER_INFO);
        add(list, "GUID", "Globally unique identifier of the data set", SAMPLE, STRING, NONE, CONTAINS_USER_INFO);
        add(list, "EXPERIMENT NAME", "Name of the experiment", SAMPLE, STRING, NONE, CONTAINS_USER_INFO);
        add(list, "TUBE NAME", "Name of the tube", SAMPLE, STRING, NONE, CONTAINS_USER_INFO);
        add(list, "SAMPLE ID", "Sample identifier", SAMPLE, STRING, NONE, CONTAINS_PERSONAL_INFO);
        add(list, "PATIENT ID", "Patient identifier", SAMPLE, STRING, NONE, CONTAINS_PERSONAL_INFO);
        add(list, "EXPORT USER NAME", "Name of the user that exported the file", SAMPLE, STRING, NONE, CONTAINS_PERSONAL_INFO);
        add(list, "EXPORT TIME", "Time the file was exported", ACQUISITION, STRING, NONE, CONTAINS_DATE);
        add(list, "WINDOW EXTENSION", "Window extension used during acquisition", ACQUISITION, FLOAT, NONE, 0);
        add(list, "THRESHOLD", "Acquisition threshold", ACQUISITION, MULTI_VALUE, NONE, 0);
        add(list, "CYTOMETER CONFIG NAME", "Name of the cytometer configuration", INSTRUMENT, STRING, NONE, 0);
        add(list, "CYTOMETER CONFIG CREATE DATE", "Creation date of the cytometer configuration", INSTRUMENT, STRING, NONE, CONTAINS_DATE);
        add(list, "CST SETUP STATUS", "Cytometer setup and tracking status", INSTRUMENT, STRING, NONE, 0);
        add(list, "CST BEADS LOT ID", "Cytometer setup and tracking bead lot", INSTRUMENT, STRING, NONE, 0);
        add(list, "FJ_$PAR", "Parameter count recorded by FlowJo", VENDOR, INTEGER, NONE, 0);
        add(list, "PnDISPLAY", "Suggested display scale for parameter n (LIN or LOG)", KeywordCategory.PARAMETER, STRING, NONE, PARAMETER);
        add(list, "PnBS", "Parameter n binning setting", KeywordCategory.PARAMETER, INTEGER, NONE, PARAMETER);
        add(list, "PnMS", "Parameter n measurement setting", KeywordCategory.PARAMETER, INTEGER, NONE, PARAMETER);
        add(list, "LASERnNAME", "Name of laser n", INSTRUMENT, STRING, NONE, 0);
        add(list, "LASERnDELAY", "Delay of laser n", INSTRUMENT, FLOAT, NONE, 0);
        add(list, "LASERnASF", "Area scaling factor of laser n", INSTRUMENT, FLOAT, NONE, 0);

        all = Collections.unmodifiableList(list);
    }


    private void add(ArrayList<KeywordAttributes> list, String keyword, String description,
                     KeywordCategory category, KeywordValueType type, int versions, int flags) {
        KeywordAttributes attributes =
                new KeywordAttributes(keyword, description, category, type, versions, flags);
        list.add(attributes);
        if (attributes.getIndexOffset() > 0) {
            templates.add(attributes);
        }
        else {
            exact.put(keyword, attributes);
        }
    }


    /**
     * Normalize a keyword the way the dictionary stores it.
     * @param keyword keyword.
     * @return trimmed, uppercase keyword.
     */
    static String normalize(String keyword) {
        return keyword.trim().toUpperCase(Locale.ROOT);
    }


    /**
     * Find the attributes of a keyword, or <code>null</code> if the keyword
     * is unknown. This is the lookup to use when absence is expected.
     *
     * @param keyword keyword such as <code>$P3N</code>, any case.
     * @return attributes, or <code>null</code>.
     */
    public static KeywordAttributes lookup(String keyword) {
        if (keyword == null) return null;
        KeywordVocabulary v = Registry.TABLE;
        String key = normalize(keyword);

        KeywordAttributes a = v.exact.get(key);
        if (a != null) return a;

        for (KeywordAttributes t : v.templates) {
            if (t.matchesTemplate(key)) return t;
        }
        return null;
    }


    /**
     * Find the attributes of a keyword.
     *
     * @param keyword keyword such as <code>$P3N</code>, any case.
     * @return attributes.
     * @throws FcsException with {@link FcsError#UNKNOWN_KEYWORD} if not known.
     */
    public static KeywordAttributes find(String keyword) throws FcsException {
        KeywordAttributes a = lookup(keyword);
        if (a == null) {
            throw new FcsException(FcsError.UNKNOWN_KEYWORD, "unknown keyword \"" + keyword + "\"");
        }
        return a;
    }


    /**
     * Is this keyword known?
     * @param keyword keyword.
     * @return <code>true</code> if known.
     */
    public static boolean isKnown(String keyword) {return lookup(keyword) != null;}


    /**
     * Is this a standard keyword?
     * @param keyword keyword.
     * @return <code>true</code> if known and standard.
     */
    public static boolean isStandard(String keyword) {
        KeywordAttributes a = lookup(keyword);
        return a != null && a.isStandard();
    }


    /**
     * Get every registered keyword and template.
     * @return unmodifiable list.
     */
    public static List<KeywordAttributes> getAll() {return Registry.TABLE.all;}


    /**
     * Extract the first run of decimal digits in a keyword as an integer.
     * <code>$P12N</code> gives 12.
     *
     * @param keyword keyword.
     * @return index, or 0 if there are no digits.
     */
    public static int parameterIndexFromKeyword(String keyword) {
        if (keyword == null) return 0;
        int len = keyword.length();
        int i = 0;
        while (i < len && !isAsciiDigit(keyword.charAt(i))) i++;
        if (i == len) return 0;

        long value = 0;
        while (i < len && isAsciiDigit(keyword.charAt(i))) {
            value = value * 10 + (keyword.charAt(i) - '0');
            if (value > Integer.MAX_VALUE) return 0;
            i++;
        }
        return (int) value;
    }


    /**
     * Build a parameter keyword for an index, such as <code>$P3R</code>
     * from the suffix <code>"R"</code>.
     *
     * @param index  1-based parameter index.
     * @param suffix suffix after the index.
     * @return keyword.
     */
    public static String parameterKeyword(int index, String suffix) {
        return "$P" + index + suffix;
    }


    private static boolean isAsciiDigit(char c) {return c >= '0' && c <= '9';}
}
