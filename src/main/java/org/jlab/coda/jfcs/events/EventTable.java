/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs.events;

import org.jlab.coda.jfcs.FcsError;
import org.jlab.coda.jfcs.FcsException;

import java.util.ArrayList;
import java.util.List;

/**
 * Columnar event table held in memory. Parameters are stored as
 * {@link ParameterColumn}s of equal length. Whether values are floats or
 * doubles is chosen when the table is constructed and never changes.<p>
 *
 * This class is not thread-safe. A table shared by several owners must be
 * synchronized externally.
 */
public class EventTable implements IEventTable {

    /** Columns in parameter order. */
    private final ArrayList<ParameterColumn> columns = new ArrayList<ParameterColumn>();

    /** Store doubles if <code>true</code>, else floats. */
    private final boolean useDouble;

    /** Length of every column. */
    private int numberOfEvents;

    /** Number of events in the source, before truncation. */
    private long numberOfOriginalEvents;


    /**
     * Constructor of an empty table.
     * @param useDouble store doubles if <code>true</code>, else floats.
     */
    public EventTable(boolean useDouble) {
        this(useDouble, 0);
    }

    /**
     * Constructor of a table with no parameters and the given number of events.
     * @param useDouble      store doubles if <code>true</code>, else floats.
     * @param numberOfEvents number of events each appended parameter has.
     * @throws IllegalArgumentException if numberOfEvents is negative.
     */
    public EventTable(boolean useDouble, int numberOfEvents) {
        if (numberOfEvents < 0) {
            throw new IllegalArgumentException("negative number of events");
        }
        this.useDouble = useDouble;
        this.numberOfEvents = numberOfEvents;
        this.numberOfOriginalEvents = numberOfEvents;
    }

    /**
     * Copy constructor. The copy has the same value kind as the source.
     * @param source table to copy.
     */
    public EventTable(IEventTable source) {
        this(source.isDouble(), 0);
        copy(source);
    }


    private ParameterColumn column(int index) {
        if (index < 0 || index >= columns.size()) {
            throw new IndexOutOfBoundsException("parameter index " + index +
                    " out of range [0, " + columns.size() + ")");
        }
        return columns.get(index);
    }

    private static void checkName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("parameter name is null or empty");
        }
    }


    /** {@inheritDoc} */
    @Override
    public boolean isFloat() {return !useDouble;}

    /** {@inheritDoc} */
    @Override
    public boolean isDouble() {return useDouble;}

    /** {@inheritDoc} */
    @Override
    public int getNumberOfParameters() {return columns.size();}

    /** {@inheritDoc} */
    @Override
    public int getNumberOfEvents() {return numberOfEvents;}

    /** {@inheritDoc} */
    @Override
    public long getNumberOfOriginalEvents() {return numberOfOriginalEvents;}

    /** {@inheritDoc} */
    @Override
    public void setNumberOfOriginalEvents(long count) {numberOfOriginalEvents = count;}

    /** {@inheritDoc} */
    @Override
    public List<String> getParameterNames() {
        List<String> names = new ArrayList<String>(columns.size());
        for (ParameterColumn c : columns) {
            names.add(c.getName());
        }
        return names;
    }

    /** {@inheritDoc} */
    @Override
    public String getParameterName(int index) {return column(index).getName();}

    /** {@inheritDoc} */
    @Override
    public void setParameterName(int index, String name) throws FcsException {
        checkName(name);
        ParameterColumn c = column(index);
        int existing = findParameter(name);
        if (existing >= 0 && existing != index) {
            throw new FcsException(FcsError.DUPLICATE_NAME,
                    "parameter name " + name + " is already used");
        }
        c.setName(name);
    }

    /** {@inheritDoc} */
    @Override
    public String getParameterLongName(int index) {return column(index).getLongName();}

    /** {@inheritDoc} */
    @Override
    public void setParameterLongName(int index, String longName) {column(index).setLongName(longName);}

    /** {@inheritDoc} */
    @Override
    public int findParameter(String name) {
        if (name == null) return -1;
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getName().equals(name)) return i;
        }
        return -1;
    }

    /** {@inheritDoc} */
    @Override
    public int getParameterIndex(String name) throws FcsException {
        int i = findParameter(name);
        if (i < 0) {
            throw new FcsException(FcsError.NAME_NOT_FOUND, "no parameter named " + name);
        }
        return i;
    }

    /** {@inheritDoc} */
    @Override
    public ParameterColumn getParameter(int index) {return column(index);}

    /** {@inheritDoc} */
    @Override
    public float[] getParameterFloats(int index) {return column(index).getFloats();}

    /** {@inheritDoc} */
    @Override
    public double[] getParameterDoubles(int index) {return column(index).getDoubles();}

    /** {@inheritDoc} */
    @Override
    public double getValue(int index, int event) {return column(index).getValue(event);}

    /** {@inheritDoc} */
    @Override
    public void setValue(int index, int event, double value) {column(index).setValue(event, value);}

    /** {@inheritDoc} */
    @Override
    public double getParameterMinimum(int index) {return column(index).getMinimum();}

    /** {@inheritDoc} */
    @Override
    public void setParameterMinimum(int index, double minimum) {column(index).setMinimum(minimum);}

    /** {@inheritDoc} */
    @Override
    public double getParameterMaximum(int index) {return column(index).getMaximum();}

    /** {@inheritDoc} */
    @Override
    public void setParameterMaximum(int index, double maximum) {column(index).setMaximum(maximum);}

    /** {@inheritDoc} */
    @Override
    public double getParameterDataMinimum(int index) {return column(index).getDataMinimum();}

    /** {@inheritDoc} */
    @Override
    public double getParameterDataMaximum(int index) {return column(index).getDataMaximum();}

    /** {@inheritDoc} */
    @Override
    public double getParameterBestMinimum(int index) {return column(index).getBestMinimum();}

    /** {@inheritDoc} */
    @Override
    public double getParameterBestMaximum(int index) {return column(index).getBestMaximum();}

    /** {@inheritDoc} */
    @Override
    public void computeParameterDataMinimumMaximum(int index) {column(index).computeDataMinimumMaximum();}

    /** {@inheritDoc} */
    @Override
    public void computeDataMinimumMaximum() {
        for (ParameterColumn c : columns) {
            c.computeDataMinimumMaximum();
        }
    }

    /** {@inheritDoc} */
    @Override
    public int appendParameter(String name) throws FcsException {
        checkName(name);
        if (findParameter(name) >= 0) {
            throw new FcsException(FcsError.DUPLICATE_NAME,
                    "parameter name " + name + " is already used");
        }
        columns.add(new ParameterColumn(name, useDouble, numberOfEvents));
        return columns.size() - 1;
    }

    /** {@inheritDoc} */
    @Override
    public void removeParameter(String name) throws FcsException {
        columns.remove(getParameterIndex(name));
    }

    /** {@inheritDoc} */
    @Override
    public void removeParameter(int index) {
        column(index);
        columns.remove(index);
    }

    /** {@inheritDoc} */
    @Override
    public void resize(int numberOfEvents) {
        if (numberOfEvents < 0) {
            throw new IllegalArgumentException("negative number of events");
        }
        if (numberOfEvents == this.numberOfEvents) return;
        for (ParameterColumn c : columns) {
            c.resize(numberOfEvents);
        }
        this.numberOfEvents = numberOfEvents;
    }

    /** {@inheritDoc} */
    @Override
    public void clear() {
        for (ParameterColumn c : columns) {
            c.zero();
        }
    }

    /** {@inheritDoc} */
    @Override
    public void copy(IEventTable source) {
        if (source == this) return;

        int n = source.getNumberOfEvents();
        ArrayList<ParameterColumn> copies = new ArrayList<ParameterColumn>(source.getNumberOfParameters());
        for (int i = 0; i < source.getNumberOfParameters(); i++) {
            ParameterColumn from = source.getParameter(i);
            ParameterColumn to;
            if (from.isDouble() == useDouble) {
                to = new ParameterColumn(from);
            }
            else {
                to = new ParameterColumn(from.getName(), useDouble, n);
                to.copyValues(from);
                to.copyMetadata(from);
            }
            copies.add(to);
        }

        columns.clear();
        columns.addAll(copies);
        numberOfEvents = n;
        numberOfOriginalEvents = source.getNumberOfOriginalEvents();
    }

    /** {@inheritDoc} */
    @Override
    public void copyValues(IEventTable source, int sourceIndex, int index) {
        ParameterColumn from = source.getParameter(sourceIndex);
        ParameterColumn to = column(index);
        if (from.size() != to.size()) {
            throw new IllegalArgumentException("source has " + from.size() +
                    " events, this table has " + to.size());
        }
        to.copyValues(from);
    }

    /** {@inheritDoc} */
    @Override
    public void compensate(List<String> names, double[] matrix) throws FcsException {
        Compensation.apply(this, names, matrix);
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "EventTable[" + (useDouble ? "double" : "float") + ", " +
               columns.size() + " parameters, " + numberOfEvents + " events]";
    }
}
