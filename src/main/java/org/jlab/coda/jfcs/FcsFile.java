/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import org.jlab.coda.jfcs.events.EventTable;
import org.jlab.coda.jfcs.events.IEventTable;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * This is the class to use to load, inspect, change and save an FCS file.
 * It holds the file's keyword dictionary, its event table, and a log of
 * the problems found by the last load or save.<p>
 *
 * A file object may share its event table with other owners, in which case
 * changes made through any owner are seen by all. Objects of this class
 * are not thread-safe.
 *
 * <pre><code>
 *   FcsFile file = new FcsFile("sample.fcs");
 *   IEventTable table = file.getEventTable();
 *   if (file.isCompensationRequired()) file.compensate();
 *   file.deidentify();
 *   file.save("clean.fcs");
 * </code></pre>
 */
public class FcsFile {

    private static final Logger logger = Logger.getLogger(FcsFile.class.getName());

    /** File name extensions of FCS files, lower case, without the dot. */
    private static final List<String> FILE_NAME_EXTENSIONS =
            Collections.unmodifiableList(Arrays.asList("fcs", "lmd"));

    /** Keyword to value map. */
    private final FcsDictionary dictionary = new FcsDictionary();

    /** Load and save scoped state. */
    private final FcsFileState state = new FcsFileState();

    /** Problems found by the last load or save. */
    private final FileLog fileLog = new FileLog();

    /** Events, possibly shared. */
    private IEventTable eventTable;

    /** Header of the last file loaded, or <code>null</code>. */
    private FcsHeader header;

    /** Path of the last file loaded or saved, or <code>null</code>. */
    private String path;

    /** Scale integer channel values after load. */
    private boolean autoScaling;


    /** Constructor of an empty file with an empty float table. */
    public FcsFile() {
        eventTable = new EventTable(false);
    }

    /**
     * Constructor that loads a file.
     * @param path file to load.
     * @throws FcsException if loading fails.
     */
    public FcsFile(String path) throws FcsException {
        this();
        load(path);
    }

    /**
     * Constructor that shares an existing event table. Changes made to the
     * table through this object are seen by every other owner.
     * @param table table to share.
     * @throws IllegalArgumentException if table is null.
     */
    public FcsFile(IEventTable table) {
        if (table == null) {
            throw new IllegalArgumentException("null table");
        }
        eventTable = table;
    }


    //-----------------------------------------------------------------
    // File name extensions
    //-----------------------------------------------------------------

    /**
     * Get the usual file name extensions of FCS files.
     * @return unmodifiable list of lower case extensions without the dot.
     */
    public static List<String> getFileNameExtensions() {return FILE_NAME_EXTENSIONS;}

    /**
     * Is this a usual FCS file name extension?
     * @param extension extension, with or without the dot, any case.
     * @return <code>true</code> if it is.
     */
    public static boolean isFileNameExtension(String extension) {
        if (extension == null) return false;
        String e = extension.trim().toLowerCase(Locale.ROOT);
        if (e.startsWith(".")) e = e.substring(1);
        return FILE_NAME_EXTENSIONS.contains(e);
    }


    //-----------------------------------------------------------------
    // Load and save
    //-----------------------------------------------------------------

    /**
     * Clear the dictionary, log and header and replace the event table
     * with an empty one. The auto-scaling setting is kept.
     */
    public void reset() {
        dictionary.clear();
        fileLog.clear();
        state.reset();
        header = null;
        path = null;
        eventTable = new EventTable(false);
    }


    /**
     * Enable or disable scaling of integer channel values after load.
     * Floating point data are already scale values and are never scaled.
     * @param autoScaling <code>true</code> to scale.
     */
    public void setAutoScaling(boolean autoScaling) {this.autoScaling = autoScaling;}

    /** @return <code>true</code> if integer data are scaled after load. */
    public boolean isAutoScaling() {return autoScaling;}


    /**
     * Load every event of a file.
     * @param path file to load.
     * @throws FcsException if loading fails.
     */
    public void load(String path) throws FcsException {
        load(path, -1);
    }


    /**
     * Load a file. The dictionary, log and event table are replaced.
     * On failure the object is left empty and the log holds the reason.
     *
     * @param path          file to load.
     * @param maximumEvents most events to load, -1 for all. The table's
     *                      original event count is always the file's.
     * @throws FcsException if loading fails.
     */
    public void load(String path, int maximumEvents) throws FcsException {
        reset();
        FcsFileReader reader = new FcsFileReader(dictionary, state, fileLog);

        try {
            EventTable table = reader.read(toPath(path), maximumEvents);
            if (autoScaling && state.dataType == FcsDataType.INTEGER) {
                try {
                    ChannelScaler.scale(dictionary, table);
                }
                catch (FcsException e) {
                    throw fileLog.error(e);
                }
            }
            eventTable = table;
            header = reader.getHeader();
            this.path = path;
        }
        catch (FcsException e) {
            dictionary.clear();
            header = null;
            throw e;
        }
    }


    /**
     * Save the dictionary and event table as an FCS 3.1 file. Keywords
     * derived from the table are regenerated first.
     *
     * @param path file to write.
     * @throws FcsException if saving fails. No partial file is left behind.
     */
    public void save(String path) throws FcsException {
        fileLog.clear();
        state.reset();
        FcsFileWriter writer = new FcsFileWriter(dictionary, state, fileLog);
        writer.write(toPath(path), eventTable);
        this.path = path;
    }


    private Path toPath(String path) throws FcsException {
        if (path == null) {
            throw new IllegalArgumentException("null path");
        }
        try {
            return Paths.get(path);
        }
        catch (InvalidPathException e) {
            throw fileLog.error(new FcsException(FcsError.IO_ERROR,
                    "invalid path " + path + ": " + e.getMessage(), e));
        }
    }


    //-----------------------------------------------------------------
    // Getters
    //-----------------------------------------------------------------

    /** @return path of the last file loaded or saved, or <code>null</code>. */
    public String getPath() {return path;}

    /** @return version of the last file loaded, or <code>null</code>. */
    public FcsVersion getVersion() {return (header == null) ? null : header.getVersion();}

    /** @return header of the last file loaded, or <code>null</code>. */
    public FcsHeader getHeader() {return header;}

    /**
     * Get the keywords in file order. Use {@link #setDictionaryString(String, String)}
     * and {@link #removeDictionaryString(String)} to change them.
     * @return read-only view of the dictionary.
     */
    public Map<String, String> getDictionary() {return dictionary.asMap();}

    /** @return the log of the last load or save. */
    public FileLog getFileLog() {return fileLog;}

    /** Empty the file log. */
    public void clearFileLog() {fileLog.clear();}

    /** @return the event table. */
    public IEventTable getEventTable() {return eventTable;}

    /**
     * Replace the event table. The table is shared, not copied.
     * @param table new table.
     * @throws IllegalArgumentException if table is null.
     */
    public void setEventTable(IEventTable table) {
        if (table == null) {
            throw new IllegalArgumentException("null table");
        }
        eventTable = table;
    }

    /** @return number of parameters in the event table. */
    public int getNumberOfParameters() {return eventTable.getNumberOfParameters();}

    /** @return number of events in the event table. */
    public int getNumberOfEvents() {return eventTable.getNumberOfEvents();}

    /** @return number of events in the file before any limit on loading. */
    public long getNumberOfOriginalEvents() {return eventTable.getNumberOfOriginalEvents();}


    //-----------------------------------------------------------------
    // Dictionary
    //-----------------------------------------------------------------

    /** @return dictionary keywords in insertion order. */
    public List<String> getDictionaryKeywords() {return dictionary.getKeywords();}

    /**
     * Get a keyword's value.
     * @param keyword keyword, any case.
     * @return value, or <code>null</code> if absent.
     */
    public String getDictionaryString(String keyword) {return dictionary.get(keyword);}


    /**
     * Is this keyword derived from the event table and so not settable?
     * @param keyword normalized keyword.
     */
    private static boolean isProtected(String keyword) {
        if (keyword.equals("$TOT") || keyword.equals("$PAR")) return true;
        KeywordAttributes a = KeywordVocabulary.lookup(keyword);
        return a != null && a.getKeyword().equals("$PnN");
    }


    /**
     * Set a keyword's value.
     *
     * @param keyword keyword, any case.
     * @param value   value.
     * @throws FcsException if the keyword is $TOT, $PAR or $PnN, which
     *                      follow the event table.
     */
    public void setDictionaryString(String keyword, String value) throws FcsException {
        if (keyword == null || value == null) {
            throw new IllegalArgumentException("null arg(s)");
        }
        String key = KeywordVocabulary.normalize(keyword);
        if (isProtected(key)) {
            throw new FcsException(FcsError.PROTECTED_KEYWORD,
                    key + " is derived from the event table and cannot be set");
        }
        dictionary.put(key, value);
    }


    /**
     * Remove a keyword.
     *
     * @param keyword keyword, any case.
     * @return removed value, or <code>null</code> if absent.
     * @throws FcsException if the keyword is $TOT, $PAR or $PnN.
     */
    public String removeDictionaryString(String keyword) throws FcsException {
        if (keyword == null) return null;
        String key = KeywordVocabulary.normalize(keyword);
        if (isProtected(key)) {
            throw new FcsException(FcsError.PROTECTED_KEYWORD,
                    key + " is derived from the event table and cannot be removed");
        }
        return dictionary.remove(key);
    }


    /**
     * Remove every keyword that may identify a person or hold a date or
     * free text, and every keyword that is not known. Applying this twice
     * has the same effect as applying it once.
     *
     * @return number of keywords removed.
     */
    public int deidentify() {
        int removed = 0;
        for (Iterator<Map.Entry<String, String>> it = dictionary.iterator(); it.hasNext(); ) {
            KeywordAttributes a = KeywordVocabulary.lookup(it.next().getKey());
            if (a == null || a.hasAnyFlag(KeywordAttributes.PRIVATE_FLAGS)) {
                it.remove();
                removed++;
            }
        }
        logger.log(Level.FINE, "de-identification removed " + removed + " keywords");
        return removed;
    }


    /**
     * Remove every known keyword that has any of the given flags.
     *
     * @param flags mask of {@link KeywordAttributes} flags.
     * @return removed keywords.
     */
    public List<String> cleanByFlags(int flags) {
        List<String> removed = new ArrayList<String>();
        for (Iterator<Map.Entry<String, String>> it = dictionary.iterator(); it.hasNext(); ) {
            String key = it.next().getKey();
            KeywordAttributes a = KeywordVocabulary.lookup(key);
            if (a != null && a.hasAnyFlag(flags)) {
                it.remove();
                removed.add(key);
            }
        }
        return removed;
    }


    //-----------------------------------------------------------------
    // Compensation
    //-----------------------------------------------------------------

    /**
     * Get the spillover matrix from the dictionary, with names resolved
     * against the event table.
     *
     * @return matrix, or <code>null</code> if the file has none.
     * @throws FcsException if the matrix is malformed or names unknown parameters.
     */
    public SpilloverMatrix getSpilloverMatrix() throws FcsException {
        SpilloverMatrix m = SpilloverMatrix.fromDictionary(dictionary);
        return (m == null) ? null : m.resolveNames(eventTable);
    }


    /**
     * Does the file carry a spillover matrix that is not the identity?
     * @return <code>true</code> if compensation would change values.
     * @throws FcsException if the matrix is malformed.
     */
    public boolean isCompensationRequired() throws FcsException {
        SpilloverMatrix m = SpilloverMatrix.fromDictionary(dictionary);
        return m != null && !m.isIdentity();
    }


    /**
     * Compensate the event table with the file's own spillover matrix.
     *
     * @return <code>true</code> if a matrix was applied.
     * @throws FcsException if the matrix is malformed or singular, or names
     *                      unknown parameters. The table is then unchanged.
     */
    public boolean compensate() throws FcsException {
        SpilloverMatrix m = getSpilloverMatrix();
        if (m == null) return false;
        compensate(m);
        return true;
    }


    /**
     * Compensate the event table with a given matrix.
     *
     * @param matrix spillover matrix.
     * @throws FcsException if the matrix is malformed or singular, or names
     *                      unknown parameters. The table is then unchanged.
     */
    public void compensate(SpilloverMatrix matrix) throws FcsException {
        eventTable.compensate(matrix.getNames(), matrix.getValues());
    }


    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "FcsFile[" + (path == null ? "" : path + ", ") +
               (header == null ? "" : header.getVersion().getTag() + ", ") +
               eventTable.getNumberOfParameters() + " parameters, " +
               eventTable.getNumberOfEvents() + " events]";
    }
}
