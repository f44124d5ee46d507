/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * This class represents the header of an FCS format file.
 *
 * <pre><code>
 *
 * FILE HEADER STRUCTURE ( 58 bytes, all ASCII )
 *
 *    +--------------------------------+
 *  0 |  Version tag ("FCS3.1")        | // 6 bytes
 *    +--------------------------------+
 *  6 |  Blanks                        | // 4 bytes
 *    +--------------------------------+
 * 10 |  TEXT begin offset             | // 8 bytes each, right-justified
 *    +--------------------------------+ // decimal digits
 * 18 |  TEXT end offset               |
 *    +--------------------------------+
 * 26 |  DATA begin offset             | // 0 = see $BEGINDATA
 *    +--------------------------------+
 * 34 |  DATA end offset               | // 0 = see $ENDDATA
 *    +--------------------------------+
 * 42 |  ANALYSIS begin offset         | // 0 = see $BEGINANALYSIS
 *    +--------------------------------+
 * 50 |  ANALYSIS end offset           | // 0 = see $ENDANALYSIS
 *    +--------------------------------+
 *
 * </code></pre>
 *
 * Offsets are byte positions from the start of the file. End offsets are
 * inclusive. A segment with begin and end of zero is empty.
 */
public class FcsHeader {

    /** Number of bytes in the header. */
    public final static int   HEADER_SIZE_BYTES = 58;
    /** Number of characters in each offset field. */
    public final static int   OFFSET_FIELD_BYTES = 8;
    /** Largest offset that fits in an 8-character field. */
    public final static long  MAX_HEADER_OFFSET = 99999999L;

    // Byte offset to header fields

    /** Byte offset from beginning of header to the version tag. */
    public final static int   VERSION_OFFSET = 0;
    /** Byte offset from beginning of header to the TEXT begin field. */
    public final static int   TEXT_BEGIN_OFFSET = 10;
    /** Byte offset from beginning of header to the TEXT end field. */
    public final static int   TEXT_END_OFFSET = 18;
    /** Byte offset from beginning of header to the DATA begin field. */
    public final static int   DATA_BEGIN_OFFSET = 26;
    /** Byte offset from beginning of header to the DATA end field. */
    public final static int   DATA_END_OFFSET = 34;
    /** Byte offset from beginning of header to the ANALYSIS begin field. */
    public final static int   ANALYSIS_BEGIN_OFFSET = 42;
    /** Byte offset from beginning of header to the ANALYSIS end field. */
    public final static int   ANALYSIS_END_OFFSET = 50;

    /** Length of version tag in bytes. */
    private final static int  VERSION_BYTES = 6;


    /** Format version. */
    private FcsVersion version = FcsVersion.FCS3_1;

    /** Offset to first byte of TEXT segment. */
    private long textBegin;
    /** Offset to last byte of TEXT segment. */
    private long textEnd;
    /** Offset to first byte of DATA segment. */
    private long dataBegin;
    /** Offset to last byte of DATA segment. */
    private long dataEnd;
    /** Offset to first byte of ANALYSIS segment. */
    private long analysisBegin;
    /** Offset to last byte of ANALYSIS segment. */
    private long analysisEnd;


    /** Default, no-arg constructor. Version is 3.1 and all offsets zero. */
    public FcsHeader() {}

    /**
     * Constructor with every field.
     * @param version       format version.
     * @param textBegin     TEXT begin offset.
     * @param textEnd       TEXT end offset.
     * @param dataBegin     DATA begin offset.
     * @param dataEnd       DATA end offset.
     * @param analysisBegin ANALYSIS begin offset.
     * @param analysisEnd   ANALYSIS end offset.
     */
    public FcsHeader(FcsVersion version, long textBegin, long textEnd,
                     long dataBegin, long dataEnd,
                     long analysisBegin, long analysisEnd) {
        this.version       = version;
        this.textBegin     = textBegin;
        this.textEnd       = textEnd;
        this.dataBegin     = dataBegin;
        this.dataEnd       = dataEnd;
        this.analysisBegin = analysisBegin;
        this.analysisEnd   = analysisEnd;
    }

    /** Set every offset to zero and the version to 3.1. */
    public void reset() {
        version = FcsVersion.FCS3_1;
        textBegin = textEnd = 0L;
        dataBegin = dataEnd = 0L;
        analysisBegin = analysisEnd = 0L;
    }

    /**
     * Get the format version.
     * @return format version.
     */
    public FcsVersion getVersion() {return version;}

    /**
     * Get the offset to the first byte of the TEXT segment.
     * @return TEXT begin offset.
     */
    public long getTextBegin() {return textBegin;}

    /**
     * Get the offset to the last byte of the TEXT segment.
     * @return TEXT end offset.
     */
    public long getTextEnd() {return textEnd;}

    /**
     * Get the offset to the first byte of the DATA segment.
     * @return DATA begin offset, 0 if it must be read from the dictionary.
     */
    public long getDataBegin() {return dataBegin;}

    /**
     * Get the offset to the last byte of the DATA segment.
     * @return DATA end offset, 0 if it must be read from the dictionary.
     */
    public long getDataEnd() {return dataEnd;}

    /**
     * Get the offset to the first byte of the ANALYSIS segment.
     * @return ANALYSIS begin offset.
     */
    public long getAnalysisBegin() {return analysisBegin;}

    /**
     * Get the offset to the last byte of the ANALYSIS segment.
     * @return ANALYSIS end offset.
     */
    public long getAnalysisEnd() {return analysisEnd;}


    /**
     * Reads the header from a buffer starting at its current position.
     * The buffer's position is advanced past the header.
     *
     * @param buffer buffer containing at least the header bytes.
     * @return the header.
     * @throws FcsException if the buffer is too small ({@link FcsError#TRUNCATED});
     *                      if the version tag is unknown ({@link FcsError#UNSUPPORTED});
     *                      if an offset field contains non-digits ({@link FcsError#MALFORMED}).
     */
    public static FcsHeader readHeader(ByteBuffer buffer) throws FcsException {
        if (buffer == null || buffer.remaining() < HEADER_SIZE_BYTES) {
            throw new FcsException(FcsError.TRUNCATED,
                    "file is too short to contain the " + HEADER_SIZE_BYTES + "-byte header");
        }

        byte[] bytes = new byte[HEADER_SIZE_BYTES];
        buffer.get(bytes);

        String tag = new String(bytes, VERSION_OFFSET, VERSION_BYTES, StandardCharsets.US_ASCII);
        FcsVersion version = FcsVersion.getVersion(tag);
        if (version == null) {
            throw new FcsException(FcsError.UNSUPPORTED,
                    "unrecognized file format version \"" + printable(tag) + "\"");
        }

        FcsHeader header = new FcsHeader();
        header.version       = version;
        header.textBegin     = parseOffset(bytes, TEXT_BEGIN_OFFSET, "TEXT begin");
        header.textEnd       = parseOffset(bytes, TEXT_END_OFFSET, "TEXT end");
        header.dataBegin     = parseOffset(bytes, DATA_BEGIN_OFFSET, "DATA begin");
        header.dataEnd       = parseOffset(bytes, DATA_END_OFFSET, "DATA end");
        header.analysisBegin = parseOffset(bytes, ANALYSIS_BEGIN_OFFSET, "ANALYSIS begin");
        header.analysisEnd   = parseOffset(bytes, ANALYSIS_END_OFFSET, "ANALYSIS end");
        return header;
    }


    /**
     * Writes this header into a buffer at its current position.
     * Offsets too large for the 8-character field are written as zero
     * (the real values must then be in the dictionary).
     *
     * @param buffer buffer with at least {@link #HEADER_SIZE_BYTES} remaining.
     * @throws FcsException if the TEXT offsets do not fit into the header.
     */
    public void writeHeader(ByteBuffer buffer) throws FcsException {
        if (textEnd > MAX_HEADER_OFFSET) {
            throw new FcsException(FcsError.MALFORMED,
                    "TEXT segment ends beyond the largest offset a header can hold");
        }

        StringBuilder sb = new StringBuilder(HEADER_SIZE_BYTES);
        sb.append(version.getTag()).append("    ");
        appendOffset(sb, textBegin);
        appendOffset(sb, textEnd);
        boolean dataFits = dataEnd <= MAX_HEADER_OFFSET;
        appendOffset(sb, dataFits ? dataBegin : 0L);
        appendOffset(sb, dataFits ? dataEnd : 0L);
        boolean analysisFits = analysisEnd <= MAX_HEADER_OFFSET;
        appendOffset(sb, analysisFits ? analysisBegin : 0L);
        appendOffset(sb, analysisFits ? analysisEnd : 0L);

        buffer.put(sb.toString().getBytes(StandardCharsets.US_ASCII));
    }


    private static void appendOffset(StringBuilder sb, long offset) {
        String s = Long.toString(offset);
        for (int i = s.length(); i < OFFSET_FIELD_BYTES; i++) {
            sb.append(' ');
        }
        sb.append(s);
    }


    /**
     * Parse one 8-character offset field. Fields are right-justified with
     * leading blanks, but left-justified and zero-padded fields are seen too.
     * An all-blank field is zero.
     */
    private static long parseOffset(byte[] bytes, int offset, String name) throws FcsException {
        long value = 0L;
        boolean inDigits = false, afterDigits = false;

        for (int i = offset; i < offset + OFFSET_FIELD_BYTES; i++) {
            byte b = bytes[i];
            if (b >= '0' && b <= '9') {
                if (afterDigits) {
                    throw new FcsException(FcsError.MALFORMED,
                            "header " + name + " offset field has embedded blanks");
                }
                inDigits = true;
                value = value * 10 + (b - '0');
            }
            else if (b == ' ' || b == 0) {
                if (inDigits) afterDigits = true;
            }
            else {
                throw new FcsException(FcsError.MALFORMED,
                        "header " + name + " offset field is not a number: \"" +
                        printable(new String(bytes, offset, OFFSET_FIELD_BYTES,
                                             StandardCharsets.ISO_8859_1)) + "\"");
            }
        }
        return value;
    }


    /** Replace non-printing characters for use in messages. */
    static String printable(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            sb.append((c < 0x20 || c > 0x7e) ? '?' : c);
        }
        return sb.toString();
    }


    /** {@inheritDoc} */
    @Override
    public String toString() {
        return version.getTag() + " text [" + textBegin + ", " + textEnd +
               "], data [" + dataBegin + ", " + dataEnd +
               "], analysis [" + analysisBegin + ", " + analysisEnd + "]";
    }
}
