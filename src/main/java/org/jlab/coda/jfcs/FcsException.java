/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

/**
 * This is a general exception used to indicate a problem in the FCS package.
 * Every exception carries an {@link FcsError} so callers can tell a truncated
 * file from a corrupt one or from an unsupported feature.
 */
@SuppressWarnings("serial")
public class FcsException extends Exception {

    /** Kind of problem. */
    private final FcsError error;

    /**
     * Create an FCS Exception of the given kind.
     *
     * @param error   kind of problem.
     * @param message the detail message. The detail message is saved for
     *                later retrieval by the {@link #getMessage()} method.
     */
    public FcsException(FcsError error, String message) {
        super(message);
        this.error = error;
    }

    /**
     * Create an FCS Exception of the given kind with the specified message and cause.
     *
     * @param  error   kind of problem.
     * @param  message the detail message. The detail message is saved for
     *         later retrieval by the {@link #getMessage()} method.
     * @param  cause the cause (which is saved for later retrieval by the
     *         {@link #getCause()} method).  (A <tt>null</tt> value is
     *         permitted, and indicates that the cause is nonexistent or
     *         unknown.)
     */
    public FcsException(FcsError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    /**
     * Get the kind of problem this exception reports.
     * @return kind of problem.
     */
    public FcsError getError() {return error;}

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return "FcsException[" + error.getDescription() + "]: " + getMessage();
    }
}
