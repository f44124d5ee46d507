/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Splits a TEXT or SUPPLEMENTAL TEXT segment into keyword and value pairs.
 *
 * <pre><code>
 *   segment := delimiter (keyword delimiter value delimiter)*
 * </code></pre>
 *
 * A delimiter inside a value is written twice. The TEXT segment starts with
 * the delimiter. The SUPPLEMENTAL TEXT segment reuses it and starts directly
 * with a keyword.<p>
 *
 * Recoverable deviations are recorded as warnings in the {@link FileLog}:
 * <ul>
 * <li>blanks before the first keyword;</li>
 * <li>an empty value written as two adjacent delimiters;</li>
 * <li>no closing delimiter after the last value;</li>
 * <li>blanks or extra delimiters after the last value;</li>
 * <li>a delimiter at the start of the SUPPLEMENTAL TEXT segment.</li>
 * </ul>
 */
final class TextSegmentParser {

    /** Log for warnings and errors. */
    private final FileLog log;

    /** Dictionary filled by the parser. */
    private final FcsDictionary dictionary;

    /** Name of the segment, for messages. */
    private String segmentName;

    /** Value bytes with escapes folded. */
    private final ByteArrayOutputStream valueBytes = new ByteArrayOutputStream(256);


    /**
     * Constructor.
     * @param dictionary dictionary to add pairs to.
     * @param log        log for warnings and errors.
     */
    TextSegmentParser(FcsDictionary dictionary, FileLog log) {
        this.dictionary = dictionary;
        this.log = log;
    }


    /**
     * Check that a byte may be used as a delimiter.
     *
     * @param b   candidate.
     * @param log log for the error.
     * @return the byte.
     * @throws FcsException if it is NUL, a comma, or has the high bit set.
     */
    static byte checkDelimiter(byte b, FileLog log) throws FcsException {
        if (b == 0 || b == ',' || (b & 0x80) != 0) {
            throw log.error(FcsError.MALFORMED,
                    "invalid TEXT segment delimiter 0x" + Integer.toHexString(b & 0xff));
        }
        return b;
    }


    /**
     * Parse a TEXT segment. Its first byte is the delimiter.
     *
     * @param bytes  buffer.
     * @param offset index of the segment's first byte.
     * @param length segment length in bytes.
     * @return the delimiter.
     * @throws FcsException if the segment is empty, the delimiter is invalid,
     *                      a keyword has no value, or a value cannot be decoded.
     */
    byte parseText(byte[] bytes, int offset, int length) throws FcsException {
        segmentName = "TEXT";
        if (length < 1) {
            throw log.error(FcsError.TRUNCATED, "TEXT segment is empty");
        }
        byte delimiter = checkDelimiter(bytes[offset], log);
        tokenize(bytes, offset + 1, offset + length, delimiter);
        return delimiter;
    }


    /**
     * Parse a SUPPLEMENTAL TEXT segment using the TEXT delimiter.
     *
     * @param bytes     buffer.
     * @param offset    index of the segment's first byte.
     * @param length    segment length in bytes.
     * @param delimiter delimiter found at the start of TEXT.
     * @throws FcsException if a keyword has no value or a value cannot be decoded.
     */
    void parseSupplementalText(byte[] bytes, int offset, int length, byte delimiter)
            throws FcsException {
        segmentName = "SUPPLEMENTAL TEXT";
        if (length < 1) return;

        if (bytes[offset] == delimiter) {
            log.warning("SUPPLEMENTAL TEXT segment starts with a delimiter, skipped");
            offset++;
            length--;
        }
        tokenize(bytes, offset, offset + length, delimiter);
    }


    /**
     * Run the automaton over bytes[begin, end).
     */
    private void tokenize(byte[] bytes, int begin, int end, byte delim) throws FcsException {
        TokenizerState state = TokenizerState.READY_FOR_KEYWORD;
        boolean firstKeyword = true;
        int i = begin;
        int keyStart = begin, keyEnd = begin;

        while (true) {
            switch (state) {

                case READY_FOR_KEYWORD: {
                    int blanks = 0, delims = 0;
                    while (i < end) {
                        byte b = bytes[i];
                        if (isBlank(b)) blanks++;
                        else if (b == delim) delims++;
                        else break;
                        i++;
                    }

                    if (i >= end) {
                        if (blanks + delims > 0) {
                            log.warning(segmentName + " segment has " + (blanks + delims) +
                                        " trailing blank or delimiter bytes, ignored");
                        }
                        return;
                    }
                    if (blanks > 0 && firstKeyword) {
                        log.warning(segmentName + " segment has blanks before the first keyword, skipped");
                    }
                    if (delims > 0) {
                        log.warning(segmentName + " segment has " + delims +
                                    " stray delimiter(s) before a keyword, skipped");
                    }
                    keyStart = i;
                    state = TokenizerState.START_OF_KEYWORD;
                    break;
                }

                case START_OF_KEYWORD:
                    while (i < end && bytes[i] != delim) i++;
                    keyEnd = i;
                    if (i >= end) {
                        String key = decode(bytes, keyStart, keyEnd - keyStart, null).trim();
                        if (key.isEmpty()) return;
                        throw log.error(FcsError.TRUNCATED, segmentName +
                                " segment ends inside keyword \"" + FcsHeader.printable(key) + "\"");
                    }
                    i++;
                    state = TokenizerState.DELIMITER_AFTER_KEYWORD;
                    break;

                case DELIMITER_AFTER_KEYWORD:
                    valueBytes.reset();
                    if (i >= end) {
                        String key = decode(bytes, keyStart, keyEnd - keyStart, null).trim();
                        throw log.error(FcsError.TRUNCATED, segmentName +
                                " segment ends before the value of keyword \"" +
                                FcsHeader.printable(key) + "\"");
                    }
                    if (bytes[i] == delim) {
                        log.warning("keyword \"" + FcsHeader.printable(
                                decode(bytes, keyStart, keyEnd - keyStart, null).trim()) +
                                "\" has an empty value");
                        i++;
                        state = TokenizerState.SAVE_KEYWORD_VALUE;
                    }
                    else {
                        state = TokenizerState.START_OF_VALUE;
                    }
                    break;

                case START_OF_VALUE:
                    valueBytes.write(bytes[i++]);
                    state = TokenizerState.MIDDLE_OF_VALUE;
                    break;

                case MIDDLE_OF_VALUE: {
                    int start = i;
                    while (i < end && bytes[i] != delim) i++;
                    valueBytes.write(bytes, start, i - start);
                    if (i >= end) {
                        log.warning(segmentName + " segment is missing the delimiter after its last value");
                        state = TokenizerState.SAVE_KEYWORD_VALUE;
                    }
                    else {
                        i++;
                        state = TokenizerState.DELIMITER_AFTER_VALUE;
                    }
                    break;
                }

                case DELIMITER_AFTER_VALUE:
                    if (i < end && bytes[i] == delim) {
                        if (i + 1 >= end) {
                            log.warning(segmentName + " segment ends with a redundant delimiter");
                            i++;
                            state = TokenizerState.SAVE_KEYWORD_VALUE;
                        }
                        else {
                            // Escaped delimiter
                            valueBytes.write(delim);
                            i++;
                            state = TokenizerState.MIDDLE_OF_VALUE;
                        }
                    }
                    else {
                        state = TokenizerState.SAVE_KEYWORD_VALUE;
                    }
                    break;

                case SAVE_KEYWORD_VALUE: {
                    String key = KeywordVocabulary.normalize(decode(bytes, keyStart, keyEnd - keyStart, null));
                    byte[] v = valueBytes.toByteArray();
                    String value = decode(v, 0, v.length, key).trim();
                    firstKeyword = false;

                    if (key.isEmpty()) {
                        log.warning(segmentName + " segment has a value with no keyword, ignored");
                    }
                    else {
                        if (dictionary.contains(key)) {
                            log.warning("keyword " + FcsHeader.printable(key) +
                                        " appears more than once, last value used");
                        }
                        dictionary.put(key, value);
                    }
                    state = TokenizerState.READY_FOR_KEYWORD;
                    break;
                }
            }
        }
    }


    private static boolean isBlank(byte b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\n' || b == 0;
    }


    /**
     * Decode bytes as UTF-8. On failure, bytes with the high bit set are
     * replaced with '?' and decoding is tried once more.
     *
     * @param keyword keyword owning the value, or <code>null</code> if decoding a keyword.
     */
    private String decode(byte[] bytes, int offset, int length, String keyword) throws FcsException {
        String s = tryDecode(bytes, offset, length);
        if (s != null) return s;

        String what = (keyword == null) ? "a keyword" : "the value of keyword " +
                                                        FcsHeader.printable(keyword);
        log.warning(what + " is not valid UTF-8, non-ASCII bytes replaced with '?'");

        byte[] copy = new byte[length];
        for (int j = 0; j < length; j++) {
            byte b = bytes[offset + j];
            copy[j] = ((b & 0x80) != 0) ? (byte) '?' : b;
        }

        s = tryDecode(copy, 0, length);
        if (s == null) {
            throw log.error(FcsError.MALFORMED, what + " cannot be decoded");
        }
        return s;
    }


    /** Strict UTF-8 decode, <code>null</code> if the bytes are not valid. */
    private static String tryDecode(byte[] bytes, int offset, int length) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, offset, length)).toString();
        }
        catch (CharacterCodingException e) {
            return null;
        }
    }
}
