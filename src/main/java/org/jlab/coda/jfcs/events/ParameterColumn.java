/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs.events;

import java.util.Arrays;

/**
 * One parameter of an {@link EventTable}: names, value array and ranges.
 * Exactly one of the float and double arrays is in use, chosen when the
 * column is created.
 */
public final class ParameterColumn {

    /** Short name, unique within a table. */
    private String name;
    /** Long name, never null. */
    private String longName = "";

    /** Values if the table holds floats. */
    private float[] floats;
    /** Values if the table holds doubles. */
    private double[] doubles;

    /** Specified minimum, usually 0. */
    private double minimum;
    /** Specified maximum, usually the declared range. */
    private double maximum;
    /** Smallest value found in the data. */
    private double dataMinimum;
    /** Largest value found in the data. */
    private double dataMaximum;


    /**
     * Constructor.
     * @param name           short name.
     * @param useDouble      store doubles if <code>true</code>, else floats.
     * @param numberOfEvents initial number of (zero) values.
     */
    ParameterColumn(String name, boolean useDouble, int numberOfEvents) {
        this.name = name;
        if (useDouble) doubles = new double[numberOfEvents];
        else           floats  = new float[numberOfEvents];
    }

    /**
     * Copy constructor. Values are copied, not shared.
     * @param other column to copy.
     */
    ParameterColumn(ParameterColumn other) {
        name        = other.name;
        longName    = other.longName;
        floats      = (other.floats  == null) ? null : other.floats.clone();
        doubles     = (other.doubles == null) ? null : other.doubles.clone();
        minimum     = other.minimum;
        maximum     = other.maximum;
        dataMinimum = other.dataMinimum;
        dataMaximum = other.dataMaximum;
    }

    /** @return short name. */
    public String getName() {return name;}

    void setName(String name) {this.name = name;}

    /** @return long name, or an empty string. */
    public String getLongName() {return longName;}

    void setLongName(String longName) {this.longName = (longName == null) ? "" : longName;}

    /** @return <code>true</code> if values are doubles. */
    public boolean isDouble() {return doubles != null;}

    /** @return number of values. */
    public int size() {return (doubles != null) ? doubles.length : floats.length;}

    /**
     * Get the backing float array. Changes write through to the table.
     * @return values.
     * @throws IllegalStateException if the column holds doubles.
     */
    public float[] getFloats() {
        if (floats == null) throw new IllegalStateException("column " + name + " holds doubles");
        return floats;
    }

    /**
     * Get the backing double array. Changes write through to the table.
     * @return values.
     * @throws IllegalStateException if the column holds floats.
     */
    public double[] getDoubles() {
        if (doubles == null) throw new IllegalStateException("column " + name + " holds floats");
        return doubles;
    }

    /**
     * Get one value widened to double.
     * @param event event index.
     * @return value.
     */
    public double getValue(int event) {
        return (doubles != null) ? doubles[event] : floats[event];
    }

    /**
     * Set one value, narrowed to float if the column holds floats.
     * @param event event index.
     * @param value value.
     */
    public void setValue(int event, double value) {
        if (doubles != null) doubles[event] = value;
        else floats[event] = (float) value;
    }

    /** @return specified minimum. */
    public double getMinimum() {return minimum;}

    void setMinimum(double minimum) {this.minimum = minimum;}

    /** @return specified maximum. */
    public double getMaximum() {return maximum;}

    void setMaximum(double maximum) {this.maximum = maximum;}

    /** @return data minimum from the last sweep. */
    public double getDataMinimum() {return dataMinimum;}

    /** @return data maximum from the last sweep. */
    public double getDataMaximum() {return dataMaximum;}

    /**
     * Get the lower bound to display. The specified minimum is used unless
     * the data goes below it. A column with no specified range reports its
     * data range.
     * @return best minimum.
     */
    public double getBestMinimum() {
        if (minimum == maximum) return dataMinimum;
        return Math.min(minimum, dataMinimum);
    }

    /**
     * Get the upper bound to display. The specified maximum is used unless
     * the data goes above it. A column with no specified range reports its
     * data range.
     * @return best maximum.
     */
    public double getBestMaximum() {
        if (minimum == maximum) return dataMaximum;
        return Math.max(maximum, dataMaximum);
    }

    /** Sweep the values and cache their minimum and maximum. NaNs are skipped. */
    void computeDataMinimumMaximum() {
        double lo = Double.POSITIVE_INFINITY, hi = Double.NEGATIVE_INFINITY;
        if (doubles != null) {
            for (double v : doubles) {
                if (v < lo) lo = v;
                if (v > hi) hi = v;
            }
        }
        else {
            for (float v : floats) {
                if (v < lo) lo = v;
                if (v > hi) hi = v;
            }
        }
        if (lo > hi) {
            lo = hi = 0.0;
        }
        dataMinimum = lo;
        dataMaximum = hi;
    }

    /** Set every value and the cached data range to zero. */
    void zero() {
        if (doubles != null) Arrays.fill(doubles, 0.0);
        else Arrays.fill(floats, 0.0f);
        dataMinimum = dataMaximum = 0.0;
    }

    /**
     * Truncate or zero-extend the values.
     * @param numberOfEvents new length.
     */
    void resize(int numberOfEvents) {
        if (doubles != null) doubles = Arrays.copyOf(doubles, numberOfEvents);
        else floats = Arrays.copyOf(floats, numberOfEvents);
    }

    /**
     * Overwrite the values with those of another column, converting between
     * float and double as needed. Lengths must already agree.
     * @param source column to copy from.
     */
    void copyValues(ParameterColumn source) {
        int n = size();
        if (doubles != null) {
            if (source.doubles != null) System.arraycopy(source.doubles, 0, doubles, 0, n);
            else for (int i = 0; i < n; i++) doubles[i] = source.floats[i];
        }
        else {
            if (source.floats != null) System.arraycopy(source.floats, 0, floats, 0, n);
            else for (int i = 0; i < n; i++) floats[i] = (float) source.doubles[i];
        }
    }

    /**
     * Copy the long name and every range from another column.
     * @param source column to copy from.
     */
    void copyMetadata(ParameterColumn source) {
        longName    = source.longName;
        minimum     = source.minimum;
        maximum     = source.maximum;
        dataMinimum = source.dataMinimum;
        dataMaximum = source.dataMaximum;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return name + (longName.isEmpty() ? "" : " (" + longName + ")") +
               " [" + minimum + ", " + maximum + "]";
    }
}
