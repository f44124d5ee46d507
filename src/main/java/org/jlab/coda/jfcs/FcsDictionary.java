/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered keyword to value map read from, or written to, the TEXT segments
 * of an FCS file. Keywords are stored trimmed and uppercase. Values are
 * stored trimmed and unescaped. Iteration follows insertion order.<p>
 *
 * Typed getters return <code>null</code> when a keyword is absent and throw
 * only when a present value cannot be parsed.
 */
public class FcsDictionary implements Iterable<Map.Entry<String, String>> {

    /** Keyword to value. */
    private final LinkedHashMap<String, String> entries = new LinkedHashMap<String, String>(256);

    /** Create an empty dictionary. */
    public FcsDictionary() {}

    /**
     * Create a copy of another dictionary.
     * @param other dictionary to copy.
     */
    public FcsDictionary(FcsDictionary other) {
        entries.putAll(other.entries);
    }

    /**
     * Set a keyword's value, replacing any earlier value.
     *
     * @param keyword keyword, any case.
     * @param value   value.
     * @return previous value or <code>null</code>.
     * @throws IllegalArgumentException if the keyword is empty or either arg is null.
     */
    public String put(String keyword, String value) {
        if (keyword == null || value == null) {
            throw new IllegalArgumentException("null arg(s)");
        }
        String key = KeywordVocabulary.normalize(keyword);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("empty keyword");
        }
        return entries.put(key, value.trim());
    }

    /**
     * Get a keyword's value.
     * @param keyword keyword, any case.
     * @return value, or <code>null</code> if absent.
     */
    public String get(String keyword) {
        if (keyword == null) return null;
        return entries.get(KeywordVocabulary.normalize(keyword));
    }

    /**
     * Is the keyword present?
     * @param keyword keyword, any case.
     * @return <code>true</code> if present.
     */
    public boolean contains(String keyword) {
        return keyword != null && entries.containsKey(KeywordVocabulary.normalize(keyword));
    }

    /**
     * Remove a keyword.
     * @param keyword keyword, any case.
     * @return removed value, or <code>null</code> if absent.
     */
    public String remove(String keyword) {
        if (keyword == null) return null;
        return entries.remove(KeywordVocabulary.normalize(keyword));
    }

    /** Remove every keyword. */
    public void clear() {entries.clear();}

    /**
     * Get the number of keywords.
     * @return number of keywords.
     */
    public int size() {return entries.size();}

    /**
     * Is the dictionary empty?
     * @return <code>true</code> if empty.
     */
    public boolean isEmpty() {return entries.isEmpty();}

    /**
     * Get the keywords in insertion order.
     * @return new list of keywords.
     */
    public List<String> getKeywords() {return new ArrayList<String>(entries.keySet());}

    /**
     * Get an unmodifiable view of the entries.
     * @return map view.
     */
    public Map<String, String> asMap() {return Collections.unmodifiableMap(entries);}

    /** {@inheritDoc} Removal through the iterator is supported. */
    @Override
    public Iterator<Map.Entry<String, String>> iterator() {return entries.entrySet().iterator();}


    /**
     * Get a keyword's value as a long integer. Values written as floating
     * point with no fraction, such as "1024.0", are accepted.
     *
     * @param keyword keyword.
     * @return value, or <code>null</code> if absent or blank.
     * @throws FcsException if the value is not an integer.
     */
    public Long getLong(String keyword) throws FcsException {
        String v = get(keyword);
        if (v == null || v.isEmpty()) return null;
        try {
            return Long.parseLong(v);
        }
        catch (NumberFormatException e) {
            double d;
            try {
                d = Double.parseDouble(v);
            }
            catch (NumberFormatException e2) {
                d = Double.NaN;
            }
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return (long) d;
            }
            throw new FcsException(FcsError.MALFORMED,
                    "keyword " + KeywordVocabulary.normalize(keyword) +
                    " value \"" + v + "\" is not an integer");
        }
    }

    /**
     * Get a keyword's value as a long integer.
     *
     * @param keyword      keyword.
     * @param defaultValue value returned if absent, blank, or not an integer.
     * @return value.
     */
    public long getLong(String keyword, long defaultValue) {
        try {
            Long v = getLong(keyword);
            return (v == null) ? defaultValue : v;
        }
        catch (FcsException e) {
            return defaultValue;
        }
    }

    /**
     * Get a keyword's value as a double.
     *
     * @param keyword keyword.
     * @return value, or <code>null</code> if absent or blank.
     * @throws FcsException if the value is not a number.
     */
    public Double getDouble(String keyword) throws FcsException {
        String v = get(keyword);
        if (v == null || v.isEmpty()) return null;
        try {
            return Double.parseDouble(v);
        }
        catch (NumberFormatException e) {
            throw new FcsException(FcsError.MALFORMED,
                    "keyword " + KeywordVocabulary.normalize(keyword) +
                    " value \"" + v + "\" is not a number");
        }
    }

    /**
     * Get a comma-separated value split into trimmed fields.
     * @param keyword keyword.
     * @return fields, or <code>null</code> if absent.
     */
    public String[] getList(String keyword) {
        String v = get(keyword);
        if (v == null) return null;
        String[] fields = v.split(",", -1);
        for (int i = 0; i < fields.length; i++) {
            fields[i] = fields[i].trim();
        }
        return fields;
    }

    /**
     * Get the value of a parameter keyword such as <code>$P3N</code>.
     *
     * @param index  1-based parameter index.
     * @param suffix keyword suffix after the index, such as "N".
     * @return value, or <code>null</code> if absent.
     */
    public String getParameter(int index, String suffix) {
        return get(KeywordVocabulary.parameterKeyword(index, suffix));
    }

    /**
     * Set the value of a parameter keyword such as <code>$P3N</code>.
     *
     * @param index  1-based parameter index.
     * @param suffix keyword suffix after the index, such as "N".
     * @param value  value.
     */
    public void putParameter(int index, String suffix, String value) {
        put(KeywordVocabulary.parameterKeyword(index, suffix), value);
    }

    /**
     * Remove a parameter keyword such as <code>$P3G</code>.
     *
     * @param index  1-based parameter index.
     * @param suffix keyword suffix after the index, such as "G".
     * @return removed value, or <code>null</code>.
     */
    public String removeParameter(int index, String suffix) {
        return remove(KeywordVocabulary.parameterKeyword(index, suffix));
    }

    /**
     * Format a number for a keyword value. Whole numbers are written
     * without a fraction.
     * @param value number.
     * @return text.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1.0e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(entries.size() * 24);
        for (Map.Entry<String, String> e : entries.entrySet()) {
            sb.append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
        }
        return sb.toString();
    }
}
