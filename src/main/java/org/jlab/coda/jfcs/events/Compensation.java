/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs.events;

import org.jlab.coda.jfcs.FcsError;
import org.jlab.coda.jfcs.FcsException;

import java.util.List;

/**
 * Fluorescence compensation. A spillover matrix M relates the measured
 * values of n parameters to their true values. Each event's sub-vector v
 * of those parameters is replaced by v&middot;M<sup>-1</sup>. Other
 * parameters are not touched.<p>
 *
 * Matrices are n x n, row-major. Row and column i belong to the i'th name,
 * which need not follow table order.
 */
public final class Compensation {

    /** Smallest number of events handed to one worker. */
    public static final int EVENTS_PER_TASK = 4096;

    private Compensation() {}


    /**
     * Is the matrix the identity?
     * @param matrix row-major n x n matrix.
     * @param n      dimension.
     * @return <code>true</code> if identity.
     */
    public static boolean isIdentity(double[] matrix, int n) {
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                if (matrix[r * n + c] != ((r == c) ? 1.0 : 0.0)) return false;
            }
        }
        return true;
    }


    /**
     * Check the shape and diagonal of a matrix.
     *
     * @param n      dimension from the name list.
     * @param matrix row-major matrix.
     * @throws FcsException if n &lt; 2 or the matrix has the wrong size
     *                      ({@link FcsError#MALFORMED}), or has a zero
     *                      on its diagonal ({@link FcsError#SINGULAR_MATRIX}).
     */
    public static void validate(int n, double[] matrix) throws FcsException {
        if (n < 2) {
            throw new FcsException(FcsError.MALFORMED,
                    "compensation needs at least 2 parameters, got " + n);
        }
        if (matrix.length != n * n) {
            throw new FcsException(FcsError.MALFORMED, "compensation matrix for " + n +
                    " parameters needs " + (n * n) + " values, got " + matrix.length);
        }
        for (int i = 0; i < n; i++) {
            if (matrix[i * n + i] == 0.0) {
                throw new FcsException(FcsError.SINGULAR_MATRIX,
                        "compensation matrix has a zero on its diagonal at row " + (i + 1));
            }
        }
    }


    /**
     * Invert a matrix by Gauss-Jordan elimination on the augmented
     * n x 2n matrix [M | I]. Rows are not exchanged.
     *
     * @param matrix row-major n x n matrix.
     * @param n      dimension.
     * @return row-major inverse.
     * @throws FcsException if a pivot is zero.
     */
    public static double[] invert(double[] matrix, int n) throws FcsException {
        int w = 2 * n;
        double[][] a = new double[n][w];
        for (int r = 0; r < n; r++) {
            System.arraycopy(matrix, r * n, a[r], 0, n);
            a[r][n + r] = 1.0;
        }

        // Clear everything off the diagonal, one column at a time
        for (int c = 0; c < n; c++) {
            double pivot = a[c][c];
            if (pivot == 0.0) {
                throw new FcsException(FcsError.SINGULAR_MATRIX,
                        "compensation matrix is singular at column " + (c + 1));
            }
            for (int r = 0; r < n; r++) {
                if (r == c) continue;
                double f = a[r][c] / pivot;
                if (f == 0.0) continue;
                for (int k = 0; k < w; k++) {
                    a[r][k] -= f * a[c][k];
                }
            }
        }

        double[] inverse = new double[n * n];
        for (int r = 0; r < n; r++) {
            double d = a[r][r];
            for (int c = 0; c < n; c++) {
                inverse[r * n + c] = a[r][n + c] / d;
            }
        }
        return inverse;
    }


    /**
     * Compensate a table in place. Everything is validated before any value
     * changes. An identity matrix returns immediately.
     *
     * @param table  table to change.
     * @param names  parameter names of the matrix rows and columns.
     * @param matrix row-major n x n spillover matrix.
     * @throws FcsException if the matrix is malformed or singular, or a name
     *                      is not a parameter ({@link FcsError#UNKNOWN_PARAMETER}).
     * @throws IllegalArgumentException if an arg is null.
     */
    public static void apply(IEventTable table, List<String> names, double[] matrix)
            throws FcsException {

        if (table == null || names == null || matrix == null) {
            throw new IllegalArgumentException("null arg(s)");
        }

        final int n = names.size();
        validate(n, matrix);

        final int[] index = new int[n];
        for (int i = 0; i < n; i++) {
            index[i] = table.findParameter(names.get(i));
            if (index[i] < 0) {
                throw new FcsException(FcsError.UNKNOWN_PARAMETER,
                        "compensation parameter " + names.get(i) + " is not in the event table");
            }
            for (int j = 0; j < i; j++) {
                if (index[j] == index[i]) {
                    throw new FcsException(FcsError.MALFORMED,
                            "compensation parameter " + names.get(i) + " is listed twice");
                }
            }
        }

        if (isIdentity(matrix, n)) return;

        final double[] inverse = invert(matrix, n);

        if (table.isDouble()) {
            final double[][] cols = new double[n][];
            for (int i = 0; i < n; i++) cols[i] = table.getParameterDoubles(index[i]);

            WorkerPool.parallelFor(table.getNumberOfEvents(), EVENTS_PER_TASK, new WorkerPool.RangeTask() {
                @Override
                public void run(int begin, int end) {
                    double[] v = new double[n];
                    for (int e = begin; e < end; e++) {
                        for (int k = 0; k < n; k++) v[k] = cols[k][e];
                        for (int j = 0; j < n; j++) {
                            double sum = 0.0;
                            for (int k = 0; k < n; k++) sum += v[k] * inverse[k * n + j];
                            cols[j][e] = sum;
                        }
                    }
                }
            });
        }
        else {
            final float[][] cols = new float[n][];
            for (int i = 0; i < n; i++) cols[i] = table.getParameterFloats(index[i]);

            WorkerPool.parallelFor(table.getNumberOfEvents(), EVENTS_PER_TASK, new WorkerPool.RangeTask() {
                @Override
                public void run(int begin, int end) {
                    double[] v = new double[n];
                    for (int e = begin; e < end; e++) {
                        for (int k = 0; k < n; k++) v[k] = cols[k][e];
                        for (int j = 0; j < n; j++) {
                            double sum = 0.0;
                            for (int k = 0; k < n; k++) sum += v[k] * inverse[k * n + j];
                            cols[j][e] = (float) sum;
                        }
                    }
                }
            });
        }

        for (int i = 0; i < n; i++) {
            table.computeParameterDataMinimumMaximum(index[i]);
        }
    }
}
