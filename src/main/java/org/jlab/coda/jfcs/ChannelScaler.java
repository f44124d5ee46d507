/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import org.jlab.coda.jfcs.events.IEventTable;
import org.jlab.coda.jfcs.events.WorkerPool;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts channel values, as acquired, into scale values.<p>
 *
 * A parameter with $PnE = "d,o" and d &gt; 0 is logarithmic:
 * <pre>   scale = 10^(d * channel / range) * o</pre>
 * where range is $PnR and an offset o of 0 is taken as 1.
 * Otherwise it is linear:
 * <pre>   scale = channel / gain</pre>
 * where gain is $PnG, or 1 if absent.<p>
 *
 * Afterwards the dictionary describes scale values: $PnG is removed,
 * $PnE is "0,0" and $PnR is the scaled range. Scaling the dictionary again
 * is harmless. Scaling the values again is not.
 */
public final class ChannelScaler {

    private static final Logger logger = Logger.getLogger(ChannelScaler.class.getName());

    private ChannelScaler() {}

    /** Scaling of one parameter read from the dictionary. */
    private static final class Scale {
        final int index;
        final double range, decades, offset, gain;

        Scale(int index, double range, double decades, double offset, double gain) {
            this.index   = index;
            this.range   = range;
            this.decades = decades;
            this.offset  = (offset == 0.0) ? 1.0 : offset;
            this.gain    = (gain == 0.0) ? 1.0 : gain;
        }

        boolean isLog() {return decades > 0.0;}

        double apply(double channel) {
            if (isLog()) return Math.pow(10.0, decades * channel / range) * offset;
            return channel / gain;
        }
    }


    /**
     * Read and check the scaling of one parameter.
     * @param index 0-based parameter index.
     */
    private static Scale readScale(FcsDictionary dictionary, int index) throws FcsException {
        int n = index + 1;
        String rangeKey = KeywordVocabulary.parameterKeyword(n, "R");

        Double range;
        try {
            range = dictionary.getDouble(rangeKey);
        }
        catch (FcsException e) {
            throw new FcsException(FcsError.MALFORMED_SCALE, e.getMessage(), e);
        }
        if (range == null || !(range > 0.0)) {
            throw new FcsException(FcsError.MALFORMED_SCALE,
                    rangeKey + " must be positive to scale parameter " + n);
        }

        double decades = 0.0, offset = 0.0;
        String[] e = dictionary.getList(KeywordVocabulary.parameterKeyword(n, "E"));
        if (e != null) {
            try {
                decades = Double.parseDouble(e[0]);
                offset  = (e.length > 1) ? Double.parseDouble(e[1]) : 0.0;
            }
            catch (NumberFormatException ex) {
                throw new FcsException(FcsError.MALFORMED_SCALE,
                        KeywordVocabulary.parameterKeyword(n, "E") + " is not \"decades,offset\"", ex);
            }
        }

        double gain = 1.0;
        String gainKey = KeywordVocabulary.parameterKeyword(n, "G");
        try {
            Double g = dictionary.getDouble(gainKey);
            if (g != null) gain = g;
        }
        catch (FcsException ex) {
            throw new FcsException(FcsError.MALFORMED_SCALE, ex.getMessage(), ex);
        }

        if (decades < 0.0 || offset < 0.0 || gain < 0.0) {
            throw new FcsException(FcsError.MALFORMED_SCALE,
                    "negative gain, decades or offset for parameter " + n);
        }
        return new Scale(index, range, decades, offset, gain);
    }


    /**
     * Scale every parameter. All parameters are checked before any value
     * changes.
     *
     * @param dictionary dictionary holding $PnE, $PnG and $PnR.
     * @param table      table to scale in place.
     * @throws FcsException if a parameter has a bad range, gain, decades or offset.
     */
    public static void scale(FcsDictionary dictionary, IEventTable table) throws FcsException {
        int nParams = table.getNumberOfParameters();
        final Scale[] scales = new Scale[nParams];
        for (int i = 0; i < nParams; i++) {
            scales[i] = readScale(dictionary, i);
        }

        final IEventTable t = table;
        WorkerPool.parallelFor(nParams, 1, new WorkerPool.RangeTask() {
            @Override
            public void run(int begin, int end) {
                for (int i = begin; i < end; i++) {
                    scaleValues(t, scales[i]);
                }
            }
        });

        for (Scale s : scales) {
            updateParameter(dictionary, table, s);
        }
        logger.log(Level.FINE, "scaled " + nParams + " parameters");
    }


    /**
     * Scale one parameter.
     *
     * @param dictionary dictionary holding $PnE, $PnG and $PnR.
     * @param table      table to scale in place.
     * @param index      0-based parameter index.
     * @throws FcsException if the parameter has a bad range, gain, decades or offset.
     */
    public static void scaleParameter(FcsDictionary dictionary, IEventTable table, int index)
            throws FcsException {
        if (index < 0 || index >= table.getNumberOfParameters()) {
            throw new IndexOutOfBoundsException("parameter index " + index);
        }
        Scale s = readScale(dictionary, index);
        scaleValues(table, s);
        updateParameter(dictionary, table, s);
    }


    /**
     * Scale a single channel value of a parameter without changing anything.
     *
     * @param dictionary dictionary holding $PnE, $PnG and $PnR.
     * @param index      0-based parameter index.
     * @param channel    channel value.
     * @return scale value.
     * @throws FcsException if the parameter has a bad range, gain, decades or offset.
     */
    public static double scaleValue(FcsDictionary dictionary, int index, double channel)
            throws FcsException {
        return readScale(dictionary, index).apply(channel);
    }


    private static void scaleValues(IEventTable table, Scale s) {
        if (!s.isLog() && s.gain == 1.0) return;

        int n = table.getNumberOfEvents();
        if (table.isDouble()) {
            double[] v = table.getParameterDoubles(s.index);
            for (int e = 0; e < n; e++) v[e] = s.apply(v[e]);
        }
        else {
            float[] v = table.getParameterFloats(s.index);
            for (int e = 0; e < n; e++) v[e] = (float) s.apply(v[e]);
        }
    }


    private static void updateParameter(FcsDictionary dictionary, IEventTable table, Scale s) {
        int n = s.index + 1;
        double min = s.apply(0.0);
        double max = s.apply(s.range);

        dictionary.removeParameter(n, "G");
        dictionary.putParameter(n, "E", "0,0");
        dictionary.putParameter(n, "R", FcsDictionary.formatNumber(max));

        table.setParameterMinimum(s.index, min);
        table.setParameterMaximum(s.index, max);
        table.computeParameterDataMinimumMaximum(s.index);
    }
}
