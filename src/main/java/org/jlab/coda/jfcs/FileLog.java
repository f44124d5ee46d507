/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory log of problems found while loading or saving a file.
 * Errors are appended just before the corresponding {@link FcsException}
 * is thrown. Warnings report deviations from the FCS standard that
 * were recovered from. Each entry is also passed on to
 * <code>java.util.logging</code>.
 */
public class FileLog {

    /** Category of entries describing a failure. */
    public static final String ERROR = "error";
    /** Category of entries describing a recovered deviation. */
    public static final String WARNING = "warning";

    private static final Logger logger = Logger.getLogger(FileLog.class.getName());

    /** One log entry. */
    public static final class Entry {
        private final String category;
        private final String message;

        Entry(String category, String message) {
            this.category = category;
            this.message  = message;
        }

        /**
         * Get the category, {@link #ERROR} or {@link #WARNING}.
         * @return category.
         */
        public String getCategory() {return category;}

        /**
         * Get the message.
         * @return message.
         */
        public String getMessage() {return message;}

        /** {@inheritDoc} */
        @Override
        public String toString() {return category + ": " + message;}
    }

    private final ArrayList<Entry> entries = new ArrayList<Entry>();

    /** Remove all entries. */
    public void clear() {entries.clear();}

    /**
     * Append an entry.
     * @param category entry category.
     * @param message  entry message.
     */
    public void append(String category, String message) {
        entries.add(new Entry(category, message));
        if (ERROR.equals(category)) {
            logger.log(Level.WARNING, message);
        }
        else {
            logger.log(Level.FINE, message);
        }
    }

    /**
     * Append a warning.
     * @param message warning text.
     */
    public void warning(String message) {append(WARNING, message);}

    /**
     * Append an error and return the exception to be thrown for it.
     *
     * @param error   kind of error.
     * @param message error text.
     * @return exception carrying the same message.
     */
    public FcsException error(FcsError error, String message) {
        append(ERROR, message);
        return new FcsException(error, message);
    }

    /**
     * Record an exception thrown elsewhere as an error entry.
     * @param e exception.
     * @return the same exception.
     */
    public FcsException error(FcsException e) {
        append(ERROR, e.getMessage());
        return e;
    }

    /**
     * Get all entries in the order they were added.
     * @return unmodifiable list of entries.
     */
    public List<Entry> getEntries() {return Collections.unmodifiableList(entries);}

    /**
     * Is there at least one entry of the given category?
     * @param category category to look for.
     * @return <code>true</code> if found.
     */
    public boolean hasCategory(String category) {
        for (Entry e : entries) {
            if (e.category.equals(category)) return true;
        }
        return false;
    }

    /**
     * Get the number of entries.
     * @return number of entries.
     */
    public int size() {return entries.size();}
}
