/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import org.jlab.coda.jfcs.events.IEventTable;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a dictionary and event table as an FCS 3.1 file.
 *
 * <pre><code>
 *
 * FILE LAYOUT
 *
 *    +----------------------------------+
 *    |  Header                          | // 58 bytes, "FCS3.1"
 *    +----------------------------------+
 *    |  TEXT                            | // starts with the delimiter
 *    +----------------------------------+
 *    |  SUPPLEMENTAL TEXT               | // only if TEXT would end past
 *    +----------------------------------+ // offset 99,999,999
 *    |  DATA                            | // float or double, host order
 *    +----------------------------------+
 *    |  "00000000"                      | // CRC placeholder
 *    +----------------------------------+
 *
 * </code></pre>
 *
 * Keywords derived from the table are regenerated before writing, so the
 * dictionary afterwards describes the written file. Keywords go into TEXT
 * in three tiers: structural keywords, then standard keywords that are
 * required, describe a parameter or hold a number, then all others. The
 * last tiers move to SUPPLEMENTAL TEXT only when TEXT would otherwise end
 * past the largest offset the header can hold.
 */
public final class FcsFileWriter {

    private static final Logger logger = Logger.getLogger(FcsFileWriter.class.getName());

    /** Delimiter of the TEXT segments. */
    public static final char DELIMITER = '|';

    /** Written where a CRC would go. */
    static final String CRC_PLACEHOLDER = "00000000";

    /** Keywords always written first, into TEXT. */
    static final List<String> STRUCTURE_KEYWORDS = Arrays.asList(
            "$BEGINANALYSIS", "$ENDANALYSIS", "$BEGINDATA", "$ENDDATA",
            "$BEGINSTEXT", "$ENDSTEXT", "$BYTEORD", "$DATATYPE",
            "$MODE", "$NEXTDATA", "$PAR", "$TOT");

    /** Offset resolution gives up after this many passes. */
    private static final int MAX_LAYOUT_PASSES = 16;

    private final FcsDictionary dictionary;
    private final FcsFileState state;
    private final FileLog log;

    /** TEXT may not end past this offset. */
    long maximumTextEnd = FcsHeader.MAX_HEADER_OFFSET;

    /** Result of laying out the segments. */
    private static final class Layout {
        byte[] text, stext;
        long textEnd, stextBegin, stextEnd, dataBegin, dataEnd;
    }


    /**
     * Constructor.
     * @param dictionary dictionary to write; regenerated keywords are changed in place.
     * @param state      state to fill.
     * @param log        log for warnings and errors.
     */
    FcsFileWriter(FcsDictionary dictionary, FcsFileState state, FileLog log) {
        this.dictionary = dictionary;
        this.state = state;
        this.log = log;
    }


    /**
     * Write a file, replacing any existing one. A partial file is removed
     * if writing fails.
     *
     * @param path  file to write.
     * @param table events to write.
     * @throws FcsException on any failure.
     */
    void write(Path path, IEventTable table) throws FcsException {
        // Keywords have no escape, so a delimiter would end the keyword early
        for (String key : dictionary.getKeywords()) {
            if (key.indexOf(DELIMITER) >= 0) {
                throw log.error(FcsError.MALFORMED, "keyword \"" + FcsHeader.printable(key) +
                        "\" contains the delimiter '" + DELIMITER + "'");
            }
        }

        state.delimiter = (byte) DELIMITER;
        state.byteOrder = ByteOrder.nativeOrder();
        state.dataType  = table.isDouble() ? FcsDataType.DOUBLE : FcsDataType.FLOAT;

        regenerateKeywords(table);
        long dataLength = DataSegmentCodec.encodedSize(table);
        Layout layout = layOut(dataLength);

        FcsHeader header = new FcsHeader(FcsVersion.FCS3_1,
                FcsHeader.HEADER_SIZE_BYTES, layout.textEnd,
                layout.dataBegin, layout.dataEnd, 0L, 0L);

        boolean opened = false, done = false;
        try {
            try (FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                opened = true;

                ByteBuffer hb = ByteBuffer.allocate(FcsHeader.HEADER_SIZE_BYTES);
                header.writeHeader(hb);
                hb.flip();
                writeFully(channel, hb);
                writeFully(channel, ByteBuffer.wrap(layout.text));
                if (layout.stext.length > 0) {
                    writeFully(channel, ByteBuffer.wrap(layout.stext));
                }

                long written = DataSegmentCodec.encode(channel, table);
                if (written != dataLength) {
                    throw new IOException("wrote " + written + " DATA bytes, expected " + dataLength);
                }
                writeFully(channel, ByteBuffer.wrap(CRC_PLACEHOLDER.getBytes(StandardCharsets.US_ASCII)));
            }
            done = true;
        }
        catch (IOException e) {
            throw log.error(new FcsException(FcsError.IO_ERROR,
                    "cannot write " + path + ": " + e.getMessage(), e));
        }
        catch (FcsException e) {
            throw log.error(e);
        }
        finally {
            if (opened && !done) {
                deletePartial(path);
            }
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("wrote " + path + ": " + table.getNumberOfParameters() + " parameters, " +
                        table.getNumberOfEvents() + " events");
        }
    }


    private void deletePartial(Path path) {
        try {
            Files.deleteIfExists(path);
        }
        catch (IOException e) {
            log.warning("cannot remove partial file " + path + ": " + e.getMessage());
        }
    }


    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }


    /**
     * Replace every keyword derived from the table and drop parameter
     * keywords of parameters the table no longer has.
     */
    void regenerateKeywords(IEventTable table) {
        int nParams = table.getNumberOfParameters();

        for (Iterator<Map.Entry<String, String>> it = dictionary.iterator(); it.hasNext(); ) {
            String key = it.next().getKey();
            KeywordAttributes attr = KeywordVocabulary.lookup(key);
            if (attr != null && attr.isParameter() && attr.getIndexOffset() > 0 &&
                KeywordVocabulary.parameterIndexFromKeyword(key) > nParams) {
                it.remove();
            }
        }

        String bits = table.isDouble() ? "64" : "32";

        dictionary.put("$TOT", Integer.toString(table.getNumberOfEvents()));
        dictionary.put("$PAR", Integer.toString(nParams));

        for (int p = 0; p < nParams; p++) {
            int n = p + 1;
            dictionary.putParameter(n, "N", table.getParameterName(p));

            String longName = table.getParameterLongName(p);
            if (longName == null || longName.isEmpty()) dictionary.removeParameter(n, "S");
            else dictionary.putParameter(n, "S", longName);

            dictionary.putParameter(n, "B", bits);
            dictionary.putParameter(n, "E", "0,0");

            long range = (long) Math.ceil(table.getParameterBestMaximum(p));
            if (range < 1L) range = 1L;
            dictionary.putParameter(n, "R", Long.toString(range));
        }

        dictionary.put("$MODE", "L");
        dictionary.put("$NEXTDATA", "0");
        dictionary.put("$BYTEORD", FcsFileState.byteOrderKeywordValue(state.byteOrder));
        dictionary.put("$DATATYPE", state.dataType.getKeywordValue());
    }


    /** 0 = structure, 1 = important standard keywords, 2 = the rest. */
    static int tierOf(String keyword) {
        if (STRUCTURE_KEYWORDS.contains(keyword)) return 0;
        KeywordAttributes attr = KeywordVocabulary.lookup(keyword);
        if (attr != null && attr.isStandard() &&
            (attr.isRequired() || attr.isParameter() || attr.getValueType().isNumeric())) {
            return 1;
        }
        return 2;
    }


    /**
     * Serialize the TEXT segments, repeating until the offsets written into
     * them match the positions they produce.
     */
    private Layout layOut(long dataLength) throws FcsException {
        long stextBegin = 0L, stextEnd = 0L, dataBegin = 0L, dataEnd = 0L;
        int spill = 0;

        for (int pass = 0; pass < MAX_LAYOUT_PASSES; pass++) {
            putOffsets(stextBegin, stextEnd, dataBegin, dataEnd);

            List<String> textKeys = new ArrayList<String>(STRUCTURE_KEYWORDS);
            List<String> stextKeys = new ArrayList<String>();
            for (String key : dictionary.getKeywords()) {
                int tier = tierOf(key);
                if (tier == 0) continue;
                if (tier > 2 - spill) stextKeys.add(key);
                else textKeys.add(key);
            }

            byte[] text  = serialize(textKeys, true);
            byte[] stext = stextKeys.isEmpty() ? new byte[0] : serialize(stextKeys, false);
            long textEnd = FcsHeader.HEADER_SIZE_BYTES + text.length - 1;

            if (textEnd > maximumTextEnd) {
                if (spill < 2) {
                    spill++;
                    continue;
                }
                throw log.error(FcsError.MALFORMED, "required keywords do not fit into the TEXT segment");
            }

            long sb = 0L, se = 0L, next = textEnd + 1;
            if (stext.length > 0) {
                sb = next;
                se = sb + stext.length - 1;
                next = se + 1;
            }
            long db = 0L, de = 0L;
            if (dataLength > 0L) {
                db = next;
                de = db + dataLength - 1;
            }

            if (sb == stextBegin && se == stextEnd && db == dataBegin && de == dataEnd) {
                Layout layout = new Layout();
                layout.text = text;
                layout.stext = stext;
                layout.textEnd = textEnd;
                layout.stextBegin = sb;
                layout.stextEnd = se;
                layout.dataBegin = db;
                layout.dataEnd = de;
                return layout;
            }
            stextBegin = sb;
            stextEnd = se;
            dataBegin = db;
            dataEnd = de;
        }

        throw log.error(FcsError.MALFORMED, "segment offsets did not settle");
    }


    private void putOffsets(long stextBegin, long stextEnd, long dataBegin, long dataEnd) {
        dictionary.put("$BEGINANALYSIS", "0");
        dictionary.put("$ENDANALYSIS", "0");
        dictionary.put("$BEGINDATA", Long.toString(dataBegin));
        dictionary.put("$ENDDATA", Long.toString(dataEnd));
        dictionary.put("$BEGINSTEXT", Long.toString(stextBegin));
        dictionary.put("$ENDSTEXT", Long.toString(stextEnd));
    }


    /**
     * Serialize keyword and value pairs. Keywords are written as they are,
     * delimiters inside values are doubled. An empty value is written as
     * one blank.
     *
     * @param keys            keywords to write, in order.
     * @param leadingDelimiter start with a delimiter, as TEXT does.
     * @return bytes.
     */
    byte[] serialize(List<String> keys, boolean leadingDelimiter) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(keys.size() * 24);
        if (leadingDelimiter) out.write(DELIMITER);

        for (String key : keys) {
            String value = dictionary.get(key);
            if (value == null) continue;

            byte[] k = key.getBytes(StandardCharsets.UTF_8);
            out.write(k, 0, k.length);
            out.write(DELIMITER);

            if (value.isEmpty()) {
                out.write(' ');
            }
            else {
                // A leading delimiter would read as an empty value
                if (value.charAt(0) == DELIMITER) out.write(' ');
                writeEscaped(out, value);
            }
            out.write(DELIMITER);
        }
        return out.toByteArray();
    }


    private static void writeEscaped(ByteArrayOutputStream out, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        for (byte b : bytes) {
            out.write(b);
            if (b == DELIMITER) out.write(b);
        }
    }
}
