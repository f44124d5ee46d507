/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds small FCS files byte by byte for tests.
 */
final class FcsTestHelper {

    private FcsTestHelper() {}


    /**
     * Build a TEXT segment.
     * @param delimiter delimiter.
     * @param keywords  keyword and value pairs, written as given.
     * @return bytes.
     */
    static byte[] text(char delimiter, Map<String, String> keywords) {
        StringBuilder sb = new StringBuilder();
        sb.append(delimiter);
        for (Map.Entry<String, String> e : keywords.entrySet()) {
            sb.append(e.getKey()).append(delimiter).append(e.getValue()).append(delimiter);
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }


    /**
     * Assemble a file of header, TEXT and DATA. DATA offsets go into the header.
     *
     * @param version version tag.
     * @param text    TEXT segment.
     * @param data    DATA segment, may be empty.
     * @return file bytes.
     * @throws FcsException if the header cannot be written.
     */
    static byte[] file(FcsVersion version, byte[] text, byte[] data) throws FcsException {
        long textEnd = FcsHeader.HEADER_SIZE_BYTES + text.length - 1;
        if (data.length == 0) return file(version, text, data, 0L, 0L);
        return file(version, text, data, textEnd + 1, textEnd + data.length);
    }


    /**
     * Assemble a file of header, TEXT and DATA with the given header DATA
     * offsets. DATA always follows TEXT.
     *
     * @param version   version tag.
     * @param text      TEXT segment.
     * @param data      DATA segment, may be empty.
     * @param dataBegin header DATA begin.
     * @param dataEnd   header DATA end.
     * @return file bytes.
     * @throws FcsException if the header cannot be written.
     */
    static byte[] file(FcsVersion version, byte[] text, byte[] data,
                       long dataBegin, long dataEnd) throws FcsException {
        long textBegin = FcsHeader.HEADER_SIZE_BYTES;
        long textEnd   = textBegin + text.length - 1;

        FcsHeader header = new FcsHeader(version, textBegin, textEnd, dataBegin, dataEnd, 0L, 0L);
        ByteBuffer hb = ByteBuffer.allocate(FcsHeader.HEADER_SIZE_BYTES);
        header.writeHeader(hb);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(hb.array(), 0, FcsHeader.HEADER_SIZE_BYTES);
        out.write(text, 0, text.length);
        out.write(data, 0, data.length);
        return out.toByteArray();
    }


    /**
     * Keywords of a list mode file with integer parameters of one width.
     *
     * @param bits     bits per value.
     * @param ranges   $PnR of each parameter.
     * @param events   $TOT.
     * @param byteOrd  $BYTEORD.
     * @return keywords in writing order.
     */
    static Map<String, String> integerKeywords(int bits, long[] ranges, int events, String byteOrd) {
        Map<String, String> k = new LinkedHashMap<String, String>();
        k.put("$BEGINANALYSIS", "0");
        k.put("$ENDANALYSIS", "0");
        k.put("$BEGINSTEXT", "0");
        k.put("$ENDSTEXT", "0");
        k.put("$BEGINDATA", "0");
        k.put("$ENDDATA", "0");
        k.put("$BYTEORD", byteOrd);
        k.put("$DATATYPE", "I");
        k.put("$MODE", "L");
        k.put("$NEXTDATA", "0");
        k.put("$PAR", Integer.toString(ranges.length));
        k.put("$TOT", Integer.toString(events));
        for (int p = 0; p < ranges.length; p++) {
            int n = p + 1;
            k.put("$P" + n + "N", "FL" + n);
            k.put("$P" + n + "B", Integer.toString(bits));
            k.put("$P" + n + "E", "0,0");
            k.put("$P" + n + "R", Long.toString(ranges[p]));
        }
        return k;
    }


    /**
     * Offset of the first byte after a TEXT segment written by
     * {@link #file(FcsVersion, byte[], byte[])}.
     * @param text TEXT segment.
     * @return DATA begin.
     */
    static long dataBegin(byte[] text) {
        return FcsHeader.HEADER_SIZE_BYTES + text.length;
    }


    /**
     * Encode integer events.
     *
     * @param bits   bits per value, 8, 16, 24, 32 or 64.
     * @param order  byte order.
     * @param values values in event order.
     * @return DATA bytes.
     */
    static byte[] integerData(int bits, ByteOrder order, long... values) {
        int bytes = bits / 8;
        byte[] out = new byte[values.length * bytes];
        boolean little = (order == ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < values.length; i++) {
            for (int b = 0; b < bytes; b++) {
                int shift = little ? 8 * b : 8 * (bytes - 1 - b);
                out[i * bytes + b] = (byte) (values[i] >>> shift);
            }
        }
        return out;
    }


    /**
     * Write bytes to a file.
     * @param dir   directory.
     * @param name  file name.
     * @param bytes content.
     * @return path as a string.
     * @throws IOException if writing fails.
     */
    static String write(Path dir, String name, byte[] bytes) throws IOException {
        Path p = dir.resolve(name);
        Files.write(p, bytes);
        return p.toString();
    }
}
