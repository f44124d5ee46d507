/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import org.jlab.coda.jfcs.events.IEventTable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.channels.WritableByteChannel;

/**
 * Reads and writes the DATA segment. On disk events are stored one after
 * another, each holding one value per parameter. In memory each parameter
 * is a column. Data moves between the two in blocks of
 * {@link #EVENTS_PER_BLOCK} events through one reused buffer whose byte
 * order is set to that of the file, so the buffer does any swapping.<p>
 *
 * Integer values are unsigned and masked to the declared range. They are
 * widened to float or double to match the table.
 */
public final class DataSegmentCodec {

    /** Number of events moved per read or write. */
    public static final int EVENTS_PER_BLOCK = 8192;

    private DataSegmentCodec() {}


    /**
     * Decode events into a table whose columns already exist and have the
     * right length.
     *
     * @param channel        file to read.
     * @param dataBegin      file offset of the first event.
     * @param layouts        storage of each parameter, in column order.
     * @param order          byte order of the file.
     * @param table          table to fill.
     * @param numberOfEvents number of events to decode.
     * @throws IOException   if reading fails.
     * @throws FcsException  if the file ends early.
     */
    static void decode(FileChannel channel, long dataBegin, ParameterLayout[] layouts,
                       ByteOrder order, IEventTable table, int numberOfEvents)
            throws IOException, FcsException {

        int nParams = layouts.length;
        if (nParams == 0 || numberOfEvents == 0) return;

        int eventBytes = (int) ParameterLayout.eventBytes(layouts);
        int blockEvents = Math.min(EVENTS_PER_BLOCK, numberOfEvents);
        ByteBuffer buffer = ByteBuffer.allocate(blockEvents * eventBytes).order(order);

        float[][]  floats  = null;
        double[][] doubles = null;
        if (table.isDouble()) {
            doubles = new double[nParams][];
            for (int p = 0; p < nParams; p++) doubles[p] = table.getParameterDoubles(p);
        }
        else {
            floats = new float[nParams][];
            for (int p = 0; p < nParams; p++) floats[p] = table.getParameterFloats(p);
        }

        boolean uniform = ParameterLayout.isUniform(layouts);
        long position = dataBegin;
        int event = 0;

        while (event < numberOfEvents) {
            int count = Math.min(blockEvents, numberOfEvents - event);
            buffer.clear();
            buffer.limit(count * eventBytes);
            readFully(channel, buffer, position);
            position += (long) count * eventBytes;
            buffer.flip();

            if (uniform) {
                decodeUniform(buffer, layouts, count, event, floats, doubles);
            }
            else {
                decodeMixed(buffer, layouts, count, event, floats, doubles);
            }
            event += count;
        }
    }


    /** All parameters have one type and width. */
    private static void decodeUniform(ByteBuffer buf, ParameterLayout[] layouts, int count,
                                      int firstEvent, float[][] floats, double[][] doubles) {
        int nParams = layouts.length;
        ParameterLayout first = layouts[0];
        int pos = 0;

        if (first.type == FcsDataType.FLOAT) {
            for (int e = firstEvent; e < firstEvent + count; e++) {
                for (int p = 0; p < nParams; p++, pos += 4) {
                    float v = buf.getFloat(pos);
                    if (floats != null) floats[p][e] = v;
                    else doubles[p][e] = v;
                }
            }
            return;
        }

        if (first.type == FcsDataType.DOUBLE) {
            for (int e = firstEvent; e < firstEvent + count; e++) {
                for (int p = 0; p < nParams; p++, pos += 8) {
                    double v = buf.getDouble(pos);
                    if (floats != null) floats[p][e] = (float) v;
                    else doubles[p][e] = v;
                }
            }
            return;
        }

        switch (first.bits) {
            case 8:
                for (int e = firstEvent; e < firstEvent + count; e++) {
                    for (int p = 0; p < nParams; p++, pos++) {
                        store(floats, doubles, p, e, (buf.get(pos) & 0xffL) & layouts[p].mask);
                    }
                }
                break;
            case 16:
                for (int e = firstEvent; e < firstEvent + count; e++) {
                    for (int p = 0; p < nParams; p++, pos += 2) {
                        store(floats, doubles, p, e, (buf.getShort(pos) & 0xffffL) & layouts[p].mask);
                    }
                }
                break;
            case 32:
                for (int e = firstEvent; e < firstEvent + count; e++) {
                    for (int p = 0; p < nParams; p++, pos += 4) {
                        store(floats, doubles, p, e, (buf.getInt(pos) & 0xffffffffL) & layouts[p].mask);
                    }
                }
                break;
            default:
                decodeMixed(buf, layouts, count, firstEvent, floats, doubles);
        }
    }


    /** Parameters differ in type or width, or are 3 bytes wide. */
    private static void decodeMixed(ByteBuffer buf, ParameterLayout[] layouts, int count,
                                    int firstEvent, float[][] floats, double[][] doubles) {
        int nParams = layouts.length;
        boolean little = (buf.order() == ByteOrder.LITTLE_ENDIAN);
        int pos = 0;

        for (int e = firstEvent; e < firstEvent + count; e++) {
            for (int p = 0; p < nParams; p++) {
                ParameterLayout lay = layouts[p];

                if (lay.type == FcsDataType.FLOAT) {
                    float v = buf.getFloat(pos);
                    if (floats != null) floats[p][e] = v;
                    else doubles[p][e] = v;
                }
                else if (lay.type == FcsDataType.DOUBLE) {
                    double v = buf.getDouble(pos);
                    if (floats != null) floats[p][e] = (float) v;
                    else doubles[p][e] = v;
                }
                else {
                    long raw;
                    switch (lay.bytes) {
                        case 1:  raw = buf.get(pos) & 0xffL; break;
                        case 2:  raw = buf.getShort(pos) & 0xffffL; break;
                        case 3:
                            int b0 = buf.get(pos) & 0xff, b1 = buf.get(pos + 1) & 0xff,
                                b2 = buf.get(pos + 2) & 0xff;
                            raw = little ? (b0 | (b1 << 8) | (b2 << 16)) :
                                           ((b0 << 16) | (b1 << 8) | b2);
                            break;
                        case 4:  raw = buf.getInt(pos) & 0xffffffffL; break;
                        default: raw = buf.getLong(pos);
                    }
                    store(floats, doubles, p, e, raw & lay.mask);
                }
                pos += lay.bytes;
            }
        }
    }


    private static void store(float[][] floats, double[][] doubles, int p, int e, long unsigned) {
        double v = unsignedToDouble(unsigned);
        if (floats != null) floats[p][e] = (float) v;
        else doubles[p][e] = v;
    }


    /**
     * Convert a 64-bit unsigned integer to double.
     * @param v unsigned value.
     * @return value as a double.
     */
    static double unsignedToDouble(long v) {
        if (v >= 0L) return (double) v;
        return ((double) (v >>> 1)) * 2.0 + (v & 1L);
    }


    /**
     * Fill the buffer from the channel starting at the given file offset.
     *
     * @param channel  file.
     * @param buffer   buffer to fill up to its limit.
     * @param position file offset.
     * @throws IOException  if reading fails.
     * @throws FcsException if the file ends first.
     */
    static void readFully(FileChannel channel, ByteBuffer buffer, long position)
            throws IOException, FcsException {
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, position);
            if (n < 0) {
                throw new FcsException(FcsError.TRUNCATED,
                        "file ends early at offset " + position);
            }
            position += n;
        }
    }


    /**
     * Get the number of bytes {@link #encode} writes for a table.
     * @param table table.
     * @return DATA segment size in bytes.
     */
    static long encodedSize(IEventTable table) {
        return (long) table.getNumberOfEvents() * table.getNumberOfParameters() *
               (table.isDouble() ? 8 : 4);
    }


    /**
     * Encode every event of a table as floats or doubles, matching the
     * table, in the host byte order.
     *
     * @param channel where to write.
     * @param table   table to write.
     * @return number of bytes written.
     * @throws IOException if writing fails.
     */
    static long encode(WritableByteChannel channel, IEventTable table) throws IOException {
        int nParams = table.getNumberOfParameters();
        int nEvents = table.getNumberOfEvents();
        if (nParams == 0 || nEvents == 0) return 0L;

        boolean useDouble = table.isDouble();
        int eventBytes = nParams * (useDouble ? 8 : 4);
        int blockEvents = Math.min(EVENTS_PER_BLOCK, nEvents);
        ByteBuffer buffer = ByteBuffer.allocate(blockEvents * eventBytes).order(ByteOrder.nativeOrder());

        float[][]  floats  = new float[nParams][];
        double[][] doubles = new double[nParams][];
        for (int p = 0; p < nParams; p++) {
            if (useDouble) doubles[p] = table.getParameterDoubles(p);
            else floats[p] = table.getParameterFloats(p);
        }

        long written = 0L;
        for (int event = 0; event < nEvents; event += blockEvents) {
            int end = Math.min(nEvents, event + blockEvents);
            buffer.clear();
            for (int e = event; e < end; e++) {
                for (int p = 0; p < nParams; p++) {
                    if (useDouble) buffer.putDouble(doubles[p][e]);
                    else buffer.putFloat(floats[p][e]);
                }
            }
            buffer.flip();
            while (buffer.hasRemaining()) {
                written += channel.write(buffer);
            }
        }
        return written;
    }
}
