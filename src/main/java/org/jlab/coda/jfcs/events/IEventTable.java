/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs.events;

import org.jlab.coda.jfcs.FcsException;

import java.util.List;

/**
 * This is an interface for a columnar table of flow cytometry events.
 * Each column holds the values of one parameter for every event. All
 * columns have the same length and all hold either floats or doubles,
 * fixed when the table is created.<p>
 *
 * Parameter indexes are 0-based. Methods taking an index throw
 * {@link IndexOutOfBoundsException} if it is out of range.
 */
public interface IEventTable {

    /**
     * Does this table store single precision values?
     * @return <code>true</code> if floats.
     */
    boolean isFloat();

    /**
     * Does this table store double precision values?
     * @return <code>true</code> if doubles.
     */
    boolean isDouble();

    /**
     * Get the number of parameters (columns).
     * @return number of parameters.
     */
    int getNumberOfParameters();

    /**
     * Get the number of events (rows).
     * @return number of events.
     */
    int getNumberOfEvents();

    /**
     * Get the number of events in the source before any truncation.
     * Equal to {@link #getNumberOfEvents()} unless only part of a file
     * was loaded.
     * @return original number of events.
     */
    long getNumberOfOriginalEvents();

    /**
     * Set the number of events in the source.
     * @param count original number of events.
     */
    void setNumberOfOriginalEvents(long count);

    /**
     * Get all short names in column order.
     * @return new list of names.
     */
    List<String> getParameterNames();

    /**
     * Get a parameter's short name.
     * @param index parameter index.
     * @return short name.
     */
    String getParameterName(int index);

    /**
     * Rename a parameter.
     * @param index parameter index.
     * @param name  new short name.
     * @throws FcsException if another parameter already has the name.
     * @throws IllegalArgumentException if the name is null or empty.
     */
    void setParameterName(int index, String name) throws FcsException;

    /**
     * Get a parameter's long name.
     * @param index parameter index.
     * @return long name, or an empty string.
     */
    String getParameterLongName(int index);

    /**
     * Set a parameter's long name.
     * @param index    parameter index.
     * @param longName long name, may be null.
     */
    void setParameterLongName(int index, String longName);

    /**
     * Find a parameter by short name.
     * @param name short name.
     * @return index, or -1 if not found.
     */
    int findParameter(String name);

    /**
     * Get the index of a parameter by short name.
     * @param name short name.
     * @return index.
     * @throws FcsException if not found.
     */
    int getParameterIndex(String name) throws FcsException;

    /**
     * Get the column object of a parameter.
     * @param index parameter index.
     * @return column.
     */
    ParameterColumn getParameter(int index);

    /**
     * Get the backing float values of a parameter.
     * @param index parameter index.
     * @return values; changes write through.
     * @throws IllegalStateException if the table holds doubles.
     */
    float[] getParameterFloats(int index);

    /**
     * Get the backing double values of a parameter.
     * @param index parameter index.
     * @return values; changes write through.
     * @throws IllegalStateException if the table holds floats.
     */
    double[] getParameterDoubles(int index);

    /**
     * Get one value widened to double.
     * @param index parameter index.
     * @param event event index.
     * @return value.
     */
    double getValue(int index, int event);

    /**
     * Set one value.
     * @param index parameter index.
     * @param event event index.
     * @param value value, narrowed to float if needed.
     */
    void setValue(int index, int event, double value);

    /**
     * @param index parameter index.
     * @return specified minimum.
     */
    double getParameterMinimum(int index);

    /**
     * Set the specified minimum.
     * @param index   parameter index.
     * @param minimum minimum.
     */
    void setParameterMinimum(int index, double minimum);

    /**
     * @param index parameter index.
     * @return specified maximum.
     */
    double getParameterMaximum(int index);

    /**
     * Set the specified maximum.
     * @param index   parameter index.
     * @param maximum maximum.
     */
    void setParameterMaximum(int index, double maximum);

    /**
     * @param index parameter index.
     * @return minimum found in the data.
     */
    double getParameterDataMinimum(int index);

    /**
     * @param index parameter index.
     * @return maximum found in the data.
     */
    double getParameterDataMaximum(int index);

    /**
     * @param index parameter index.
     * @return specified minimum unless the data goes below it.
     */
    double getParameterBestMinimum(int index);

    /**
     * @param index parameter index.
     * @return specified maximum unless the data goes above it.
     */
    double getParameterBestMaximum(int index);

    /**
     * Recompute the data minimum and maximum of one parameter.
     * @param index parameter index.
     */
    void computeParameterDataMinimumMaximum(int index);

    /** Recompute the data minimum and maximum of every parameter. */
    void computeDataMinimumMaximum();

    /**
     * Append a parameter with zero values.
     * @param name short name.
     * @return index of the new parameter.
     * @throws FcsException if the name is already used.
     * @throws IllegalArgumentException if the name is null or empty.
     */
    int appendParameter(String name) throws FcsException;

    /**
     * Remove a parameter by name.
     * @param name short name.
     * @throws FcsException if not found.
     */
    void removeParameter(String name) throws FcsException;

    /**
     * Remove a parameter by index.
     * @param index parameter index.
     */
    void removeParameter(int index);

    /**
     * Truncate or zero-extend every parameter.
     * @param numberOfEvents new number of events.
     * @throws IllegalArgumentException if negative.
     */
    void resize(int numberOfEvents);

    /**
     * Set every value to zero. Parameters and the number of events are kept.
     */
    void clear();

    /**
     * Replace this table's content with a deep copy of another's,
     * converting values to this table's kind.
     * @param source table to copy.
     */
    void copy(IEventTable source);

    /**
     * Overwrite one parameter's values with those of a source parameter.
     * Names and other parameters are untouched.
     * @param source      table to copy from.
     * @param sourceIndex parameter index in the source.
     * @param index       parameter index in this table.
     * @throws IllegalArgumentException if the event counts differ.
     */
    void copyValues(IEventTable source, int sourceIndex, int index);

    /**
     * Apply a spillover matrix to the named parameters.
     * @param names  parameter names of the matrix rows and columns.
     * @param matrix row-major n x n matrix.
     * @throws FcsException if the matrix is malformed or singular, or a
     *                      name is not a parameter.
     */
    void compensate(List<String> names, double[] matrix) throws FcsException;
}
