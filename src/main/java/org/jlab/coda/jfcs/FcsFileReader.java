/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import org.jlab.coda.jfcs.events.EventTable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads an FCS file: header, TEXT and SUPPLEMENTAL TEXT into the
 * dictionary, then the DATA segment into a new event table.
 * Every failure is recorded in the file log before it is thrown.
 */
final class FcsFileReader {

    private static final Logger logger = Logger.getLogger(FcsFileReader.class.getName());

    /** Integer widths that can be decoded. */
    private static final int[] INTEGER_BITS = {8, 16, 24, 32, 64};

    /** Largest segment read into one array. */
    private static final long MAX_TEXT_BYTES = Integer.MAX_VALUE - 8;

    private final FcsDictionary dictionary;
    private final FcsFileState state;
    private final FileLog log;

    /** Header of the last file read. */
    private FcsHeader header;


    /**
     * Constructor.
     * @param dictionary empty dictionary to fill.
     * @param state      state to fill.
     * @param log        log for warnings and errors.
     */
    FcsFileReader(FcsDictionary dictionary, FcsFileState state, FileLog log) {
        this.dictionary = dictionary;
        this.state = state;
        this.log = log;
    }

    /** @return header of the file read, or <code>null</code>. */
    FcsHeader getHeader() {return header;}


    /**
     * Read a file.
     *
     * @param path          file to read.
     * @param maximumEvents most events to load, or -1 for all.
     * @return new table holding the events.
     * @throws FcsException on any failure.
     */
    EventTable read(Path path, int maximumEvents) throws FcsException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long fileSize = channel.size();

            header = readHeader(channel, fileSize);
            readTextSegments(channel, fileSize);
            ParameterLayout[] layouts = checkKeywords();
            Long tot = totalEvents();
            long eventBytes = ParameterLayout.eventBytes(layouts);
            long[] data = findDataSegment(fileSize, tot, eventBytes);
            long numberOfEvents = countEvents(tot, eventBytes, data[1]);

            int toLoad = (int) ((maximumEvents < 0) ? numberOfEvents :
                                Math.min(maximumEvents, numberOfEvents));

            EventTable table = createTable(layouts, toLoad);
            try {
                DataSegmentCodec.decode(channel, data[0], layouts, state.byteOrder, table, toLoad);
            }
            catch (FcsException e) {
                throw log.error(e);
            }
            table.setNumberOfOriginalEvents(numberOfEvents);
            table.computeDataMinimumMaximum();

            for (int p = 0; p < layouts.length; p++) {
                if (!(layouts[p].range > 0.0)) {
                    table.setParameterMaximum(p, table.getParameterDataMaximum(p));
                }
            }

            if (logger.isLoggable(Level.FINE)) {
                logger.fine("read " + path + ": " + header.getVersion().getTag() + ", " +
                            layouts.length + " parameters, " + toLoad + " of " +
                            numberOfEvents + " events");
            }
            return table;
        }
        catch (IOException e) {
            throw log.error(new FcsException(FcsError.IO_ERROR,
                    "cannot read " + path + ": " + e.getMessage(), e));
        }
    }


    private FcsHeader readHeader(FileChannel channel, long fileSize)
            throws IOException, FcsException {
        if (fileSize < FcsHeader.HEADER_SIZE_BYTES) {
            throw log.error(FcsError.TRUNCATED, "file has " + fileSize +
                    " bytes, too short for the " + FcsHeader.HEADER_SIZE_BYTES + "-byte header");
        }
        ByteBuffer buffer = ByteBuffer.allocate(FcsHeader.HEADER_SIZE_BYTES);
        try {
            DataSegmentCodec.readFully(channel, buffer, 0L);
            buffer.flip();
            return FcsHeader.readHeader(buffer);
        }
        catch (FcsException e) {
            throw log.error(e);
        }
    }


    private byte[] readBytes(FileChannel channel, long begin, long end) throws IOException, FcsException {
        ByteBuffer buffer = ByteBuffer.allocate((int) (end - begin + 1));
        try {
            DataSegmentCodec.readFully(channel, buffer, begin);
        }
        catch (FcsException e) {
            throw log.error(e);
        }
        return buffer.array();
    }


    private void readTextSegments(FileChannel channel, long fileSize) throws IOException, FcsException {
        long begin = header.getTextBegin();
        long end   = header.getTextEnd();

        if (begin < FcsHeader.HEADER_SIZE_BYTES || end < begin) {
            throw log.error(FcsError.MALFORMED,
                    "TEXT segment offsets [" + begin + ", " + end + "] are invalid");
        }
        if (end >= fileSize) {
            throw log.error(FcsError.TRUNCATED, "TEXT segment ends at " + end +
                    ", beyond the end of the " + fileSize + "-byte file");
        }
        if (end - begin + 1 > MAX_TEXT_BYTES) {
            throw log.error(FcsError.UNSUPPORTED, "TEXT segment is too large");
        }

        TextSegmentParser parser = new TextSegmentParser(dictionary, log);
        byte[] text = readBytes(channel, begin, end);
        state.delimiter = parser.parseText(text, 0, text.length);

        long sBegin = optionalOffset("$BEGINSTEXT");
        long sEnd   = optionalOffset("$ENDSTEXT");
        if (sBegin == 0L && sEnd == 0L) return;

        if (sBegin < FcsHeader.HEADER_SIZE_BYTES || sEnd < sBegin || sEnd >= fileSize ||
            sEnd - sBegin + 1 > MAX_TEXT_BYTES) {
            log.warning("SUPPLEMENTAL TEXT offsets [" + sBegin + ", " + sEnd + "] are invalid, segment skipped");
            return;
        }
        if (sBegin <= end && sEnd >= begin) {
            log.warning("SUPPLEMENTAL TEXT segment overlaps TEXT segment, skipped");
            return;
        }

        byte[] stext = readBytes(channel, sBegin, sEnd);
        parser.parseSupplementalText(stext, 0, stext.length, state.delimiter);
    }


    /** Read an offset keyword, using 0 if absent or not a number. */
    private long optionalOffset(String keyword) {
        try {
            Long v = dictionary.getLong(keyword);
            return (v == null) ? 0L : v;
        }
        catch (FcsException e) {
            log.warning(e.getMessage() + ", ignored");
            return 0L;
        }
    }


    /** Non-zero beats zero. Two different non-zero values favor the dictionary. */
    private long reconcile(String name, long fromHeader, long fromDictionary) {
        if (fromHeader == 0L) return fromDictionary;
        if (fromDictionary == 0L) return fromHeader;
        if (fromHeader != fromDictionary) {
            log.warning(name + " offset is " + fromHeader + " in the header but " +
                        fromDictionary + " in the dictionary, dictionary used");
        }
        return fromDictionary;
    }


    /**
     * Reconcile the header and dictionary DATA offsets. An end that is
     * missing everywhere is derived from $TOT, or else from the file size.
     *
     * @param fileSize   bytes in the file.
     * @param tot        $TOT, or <code>null</code>.
     * @param eventBytes bytes per event.
     * @return {begin, length in bytes}.
     */
    private long[] findDataSegment(long fileSize, Long tot, long eventBytes) throws FcsException {
        long dBegin = optionalOffset("$BEGINDATA");
        long dEnd   = optionalOffset("$ENDDATA");
        if ((dBegin == 0L) != (dEnd == 0L)) {
            log.warning("dictionary DATA offsets $BEGINDATA=" + dBegin + " and $ENDDATA=" + dEnd +
                        " are inconsistent");
        }

        long begin = reconcile("DATA begin", header.getDataBegin(), dBegin);
        long end   = reconcile("DATA end", header.getDataEnd(), dEnd);

        if (begin == 0L && end == 0L) {
            if (eventBytes > 0L && (tot == null || tot > 0L)) {
                throw log.error(FcsError.MALFORMED, "DATA segment offsets are missing");
            }
            return new long[] {0L, 0L};
        }
        if (begin != 0L && end == 0L) {
            if (tot != null && tot > 0L && eventBytes > 0L && tot <= (fileSize - begin) / eventBytes + 1) {
                end = begin + tot * eventBytes - 1;
                log.warning("DATA segment end is missing, " + end + " derived from $TOT=" + tot);
            }
            else {
                end = Math.max(fileSize - 1, begin);
                log.warning("DATA segment end is missing, end of the file used");
            }
        }
        if (begin < FcsHeader.HEADER_SIZE_BYTES || end < begin) {
            throw log.error(FcsError.MALFORMED,
                    "DATA segment offsets [" + begin + ", " + end + "] are invalid");
        }
        if (begin >= fileSize) {
            log.warning("DATA segment starts at " + begin + ", beyond the end of the file");
            return new long[] {begin, 0L};
        }
        if (end >= fileSize) {
            log.warning("DATA segment ends at " + end + ", beyond the end of the file, clipped to " +
                        (fileSize - 1));
            end = fileSize - 1;
        }
        return new long[] {begin, end - begin + 1};
    }


    private Long requiredLong(String keyword) throws FcsException {
        if (!dictionary.contains(keyword) || dictionary.get(keyword).isEmpty()) {
            throw log.error(FcsError.MALFORMED, "required keyword " + keyword + " is missing");
        }
        try {
            return dictionary.getLong(keyword);
        }
        catch (FcsException e) {
            throw log.error(e);
        }
    }


    private String requiredString(String keyword) throws FcsException {
        String v = dictionary.get(keyword);
        if (v == null || v.isEmpty()) {
            throw log.error(FcsError.MALFORMED, "required keyword " + keyword + " is missing");
        }
        return v;
    }


    /**
     * Check the keywords needed to decode DATA and describe each parameter.
     */
    private ParameterLayout[] checkKeywords() throws FcsException {
        Long next;
        try {
            next = dictionary.getLong("$NEXTDATA");
        }
        catch (FcsException e) {
            throw log.error(e);
        }
        if (next != null && next != 0L) {
            throw log.error(FcsError.UNSUPPORTED,
                    "files with more than one data set ($NEXTDATA=" + next + ") are not supported");
        }

        String mode = dictionary.get("$MODE");
        if (mode == null || mode.isEmpty()) {
            log.warning("$MODE is missing, list mode assumed");
        }
        else if (!mode.equalsIgnoreCase("L")) {
            throw log.error(FcsError.UNSUPPORTED, "$MODE=" + mode + " is not supported, only list mode");
        }

        String dt = requiredString("$DATATYPE");
        FcsDataType type = FcsDataType.getDataType(dt);
        if (type == null) {
            throw log.error(FcsError.MALFORMED, "$DATATYPE=" + dt + " is not a known data type");
        }
        if (type == FcsDataType.ASCII) {
            throw log.error(FcsError.UNSUPPORTED, "ASCII data ($DATATYPE=A) is not supported");
        }
        state.dataType = type;

        String bo = requiredString("$BYTEORD");
        ByteOrder order = FcsFileState.parseByteOrder(bo);
        if (order == null) {
            throw log.error(FcsError.UNSUPPORTED, "$BYTEORD=" + bo + " is not supported");
        }
        state.byteOrder = order;

        long par = requiredLong("$PAR");
        if (par < 0L || par > Integer.MAX_VALUE) {
            throw log.error(FcsError.MALFORMED, "$PAR=" + par + " is not a valid parameter count");
        }

        ParameterLayout[] layouts = new ParameterLayout[(int) par];
        for (int n = 1; n <= par; n++) {
            requiredString(KeywordVocabulary.parameterKeyword(n, "N"));
            String bKey = KeywordVocabulary.parameterKeyword(n, "B");
            long bits = requiredLong(bKey);

            if (type == FcsDataType.INTEGER) {
                if (!isIntegerWidth(bits)) {
                    throw log.error(FcsError.UNSUPPORTED, bKey + "=" + bits +
                            " is not a supported integer width");
                }
            }
            else {
                int expected = (type == FcsDataType.FLOAT) ? 32 : 64;
                if (bits != expected) {
                    log.warning(bKey + "=" + bits + " disagrees with $DATATYPE=" +
                                type.getKeywordValue() + ", " + expected + " used");
                    bits = expected;
                }
            }

            String rKey = KeywordVocabulary.parameterKeyword(n, "R");
            double range = 0.0;
            try {
                Double r = dictionary.getDouble(rKey);
                if (r == null) {
                    log.warning(rKey + " is missing, range taken from the data");
                }
                else {
                    range = r;
                }
            }
            catch (FcsException e) {
                log.warning(e.getMessage() + ", range taken from the data");
            }

            layouts[n - 1] = new ParameterLayout(type, (int) bits, range);
        }
        return layouts;
    }


    private static boolean isIntegerWidth(long bits) {
        for (int b : INTEGER_BITS) {
            if (b == bits) return true;
        }
        return false;
    }


    /** @return $TOT, or <code>null</code> if absent. */
    private Long totalEvents() throws FcsException {
        Long tot;
        try {
            tot = dictionary.getLong("$TOT");
        }
        catch (FcsException e) {
            throw log.error(e);
        }
        if (tot != null && tot < 0L) {
            throw log.error(FcsError.MALFORMED, "$TOT=" + tot + " is negative");
        }
        return tot;
    }


    /**
     * Settle the number of events from $TOT and the DATA segment size.
     */
    private long countEvents(Long tot, long eventBytes, long dataBytes) throws FcsException {
        if (eventBytes == 0L) {
            return 0L;
        }

        long derived = dataBytes / eventBytes;
        long events;
        if (tot == null) {
            log.warning("$TOT is missing, " + derived + " events found in the DATA segment");
            events = derived;
        }
        else if (tot > derived) {
            log.warning("$TOT=" + tot + " but the DATA segment holds only " + derived +
                        " events, file is truncated");
            events = derived;
        }
        else {
            if (tot * eventBytes != dataBytes) {
                log.warning("DATA segment has " + (dataBytes - tot * eventBytes) +
                            " bytes more than $TOT=" + tot + " events need, ignored");
            }
            events = tot;
        }

        if (events > Integer.MAX_VALUE - 8) {
            throw log.error(FcsError.UNSUPPORTED, events + " events are too many to load");
        }
        return events;
    }


    /**
     * Create the table with one column per parameter. Duplicate short names
     * get a "_n" suffix, n being the 1-based parameter index.
     */
    private EventTable createTable(ParameterLayout[] layouts, int events) throws FcsException {
        EventTable table = new EventTable(ParameterLayout.tableNeedsDouble(layouts), events);

        for (int p = 0; p < layouts.length; p++) {
            int n = p + 1;
            String name = dictionary.getParameter(n, "N");
            if (table.findParameter(name) >= 0) {
                String unique = name + "_" + n;
                for (int k = 2; table.findParameter(unique) >= 0; k++) {
                    unique = name + "_" + n + "_" + k;
                }
                log.warning("parameter name " + name + " is used more than once, parameter " + n +
                            " renamed " + unique);
                dictionary.putParameter(n, "N", unique);
                name = unique;
            }

            try {
                table.appendParameter(name);
            }
            catch (FcsException e) {
                throw log.error(e);
            }

            String longName = dictionary.getParameter(n, "S");
            if (longName != null) table.setParameterLongName(p, longName);

            table.setParameterMinimum(p, 0.0);
            if (layouts[p].range > 0.0) table.setParameterMaximum(p, layouts[p].range);
        }
        return table;
    }
}
