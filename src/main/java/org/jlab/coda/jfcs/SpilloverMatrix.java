/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import org.jlab.coda.jfcs.events.Compensation;
import org.jlab.coda.jfcs.events.IEventTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Spillover matrix stored in a file's dictionary. The value is
 * <pre>   n,name<sub>1</sub>,...,name<sub>n</sub>,m<sub>11</sub>,m<sub>12</sub>,...,m<sub>nn</sub></pre>
 * with the matrix in row-major order.
 */
public final class SpilloverMatrix {

    /** Keywords that may hold the matrix, in order of preference. */
    public static final String[] KEYWORDS = {"$SPILLOVER", "SPILL", "SPILLOVER"};

    /** Parameter names. */
    private final List<String> names;
    /** Row-major values. */
    private final double[] values;


    /**
     * Constructor.
     * @param names  parameter names.
     * @param values row-major n x n values, copied.
     * @throws FcsException if the number of values is not n x n.
     */
    public SpilloverMatrix(List<String> names, double[] values) throws FcsException {
        int n = names.size();
        if (values.length != n * n) {
            throw new FcsException(FcsError.MALFORMED, "spillover matrix for " + n +
                    " parameters needs " + (n * n) + " values, got " + values.length);
        }
        this.names  = Collections.unmodifiableList(new ArrayList<String>(names));
        this.values = values.clone();
    }


    /**
     * Parse a keyword value.
     * @param value keyword value.
     * @return matrix.
     * @throws FcsException if the value is not a well-formed matrix.
     */
    public static SpilloverMatrix parse(String value) throws FcsException {
        String[] f = value.split(",", -1);
        int n;
        try {
            n = Integer.parseInt(f[0].trim());
        }
        catch (NumberFormatException e) {
            throw new FcsException(FcsError.MALFORMED,
                    "spillover matrix size \"" + f[0].trim() + "\" is not an integer");
        }
        if (n < 1) {
            throw new FcsException(FcsError.MALFORMED, "spillover matrix size " + n + " is too small");
        }
        if (f.length != 1 + n + n * n) {
            throw new FcsException(FcsError.MALFORMED, "spillover matrix of size " + n +
                    " needs " + (1 + n + n * n) + " fields, got " + f.length);
        }

        List<String> names = new ArrayList<String>(n);
        for (int i = 0; i < n; i++) {
            names.add(f[1 + i].trim());
        }

        double[] values = new double[n * n];
        for (int i = 0; i < n * n; i++) {
            String s = f[1 + n + i].trim();
            try {
                values[i] = Double.parseDouble(s);
            }
            catch (NumberFormatException e) {
                throw new FcsException(FcsError.MALFORMED,
                        "spillover matrix value \"" + s + "\" is not a number");
            }
        }
        return new SpilloverMatrix(names, values);
    }


    /**
     * Find and parse the matrix in a dictionary.
     * @param dictionary dictionary.
     * @return matrix, or <code>null</code> if no keyword holds one.
     * @throws FcsException if the value is not a well-formed matrix.
     */
    public static SpilloverMatrix fromDictionary(FcsDictionary dictionary) throws FcsException {
        for (String key : KEYWORDS) {
            String v = dictionary.get(key);
            if (v != null && !v.isEmpty()) {
                return parse(v);
            }
        }
        return null;
    }


    /**
     * Return a matrix whose names all refer to parameters of a table.
     * A name that is not a parameter but is a number is taken as a
     * 1-based parameter index.
     *
     * @param table table.
     * @return this matrix, or a copy with resolved names.
     * @throws FcsException if a name cannot be resolved.
     */
    public SpilloverMatrix resolveNames(IEventTable table) throws FcsException {
        List<String> resolved = new ArrayList<String>(names.size());
        boolean changed = false;

        for (String name : names) {
            if (table.findParameter(name) >= 0) {
                resolved.add(name);
                continue;
            }
            int index;
            try {
                index = Integer.parseInt(name);
            }
            catch (NumberFormatException e) {
                throw new FcsException(FcsError.UNKNOWN_PARAMETER,
                        "spillover parameter " + name + " is not in the event table");
            }
            if (index < 1 || index > table.getNumberOfParameters()) {
                throw new FcsException(FcsError.UNKNOWN_PARAMETER,
                        "spillover parameter index " + index + " is out of range");
            }
            resolved.add(table.getParameterName(index - 1));
            changed = true;
        }
        return changed ? new SpilloverMatrix(resolved, values) : this;
    }


    /** @return dimension. */
    public int size() {return names.size();}

    /** @return unmodifiable parameter names. */
    public List<String> getNames() {return names;}

    /** @return copy of the row-major values. */
    public double[] getValues() {return values.clone();}

    /**
     * Get one value.
     * @param row    0-based row.
     * @param column 0-based column.
     * @return value.
     */
    public double get(int row, int column) {return values[row * names.size() + column];}

    /** @return <code>true</code> if this is the identity matrix. */
    public boolean isIdentity() {return Compensation.isIdentity(values, names.size());}

    /**
     * Format as a keyword value.
     * @return keyword value.
     */
    public String toKeywordValue() {
        StringBuilder sb = new StringBuilder();
        sb.append(names.size());
        for (String n : names) sb.append(',').append(n);
        for (double v : values) sb.append(',').append(FcsDictionary.formatNumber(v));
        return sb.toString();
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {return toKeywordValue();}
}
