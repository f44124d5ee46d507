/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jlab.coda.jfcs.events.EventTable;
import org.jlab.coda.jfcs.events.IEventTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

@Tag("fast")
class FcsFileTest {

    @TempDir
    Path dir;


    private String integerFile(String name, int bits, long[] ranges, ByteOrder order,
                               String byteOrd, Map<String, String> extra, long... values) throws Exception {
        int events = values.length / ranges.length;
        Map<String, String> k = FcsTestHelper.integerKeywords(bits, ranges, events, byteOrd);
        if (extra != null) k.putAll(extra);
        byte[] data = FcsTestHelper.integerData(bits, order, values);
        return FcsTestHelper.write(dir, name,
                FcsTestHelper.file(FcsVersion.FCS3_1, FcsTestHelper.text('/', k), data));
    }


    /**
     * TEXT with $BEGINDATA and $ENDDATA pointing at DATA that directly follows it.
     * The offsets are zero padded so their width does not depend on their value.
     */
    private static byte[] textWithDataOffsets(Map<String, String> k, int dataLength, boolean withEnd) {
        k.put("$BEGINDATA", "00000000");
        k.put("$ENDDATA", "00000000");
        long begin = FcsTestHelper.dataBegin(FcsTestHelper.text('/', k));
        k.put("$BEGINDATA", String.format("%08d", begin));
        if (withEnd) k.put("$ENDDATA", String.format("%08d", begin + dataLength - 1));
        return FcsTestHelper.text('/', k);
    }


    private static boolean logMentions(FcsFile f, String text) {
        for (FileLog.Entry e : f.getFileLog().getEntries()) {
            if (e.getMessage().contains(text)) return true;
        }
        return false;
    }


    @Test
    @DisplayName("16-bit little endian integers load as masked floats")
    void loadSixteenBitIntegers() throws Exception {
        String path = integerFile("a.fcs", 16, new long[] {1024, 1024},
                ByteOrder.LITTLE_ENDIAN, "1,2", null,
                1, 2,
                3, 4,
                2000, 1023);

        FcsFile f = new FcsFile(path);
        IEventTable t = f.getEventTable();

        assertEquals(FcsVersion.FCS3_1, f.getVersion());
        assertTrue(t.isFloat());
        assertEquals(2, t.getNumberOfParameters());
        assertEquals(3, t.getNumberOfEvents());
        assertEquals(3L, t.getNumberOfOriginalEvents());
        assertEquals("FL1", t.getParameterName(0));

        assertArrayEquals(new float[] {1f, 3f, 976f}, t.getParameterFloats(0));
        assertArrayEquals(new float[] {2f, 4f, 1023f}, t.getParameterFloats(1));
        assertEquals(0.0, t.getParameterMinimum(0));
        assertEquals(1024.0, t.getParameterMaximum(0));
        assertEquals(976.0, t.getParameterDataMaximum(0));
        assertFalse(f.getFileLog().hasCategory(FileLog.ERROR));
    }


    @Test
    @DisplayName("24-bit big endian integers are assembled in file byte order")
    void loadTwentyFourBitIntegers() throws Exception {
        String path = integerFile("b.fcs", 24, new long[] {16777216L},
                ByteOrder.BIG_ENDIAN, "4,3,2,1", null,
                0x123456L, 0xFFFFFFL);

        FcsFile f = new FcsFile(path);
        assertArrayEquals(new float[] {0x123456, 0xFFFFFF}, f.getEventTable().getParameterFloats(0));
    }


    @Test
    @DisplayName("32-bit integers with a wide range load as doubles")
    void wideIntegersLoadAsDoubles() throws Exception {
        String path = integerFile("c.fcs", 32, new long[] {4294967296L},
                ByteOrder.LITTLE_ENDIAN, "1,2,3,4", null,
                4294967295L, 16777217L);

        IEventTable t = new FcsFile(path).getEventTable();
        assertTrue(t.isDouble());
        assertArrayEquals(new double[] {4294967295.0, 16777217.0}, t.getParameterDoubles(0));
    }


    @Test
    @DisplayName("8-bit integers are masked by their range")
    void loadEightBitIntegers() throws Exception {
        String path = integerFile("i8.fcs", 8, new long[] {256, 100},
                ByteOrder.LITTLE_ENDIAN, "1,2", null,
                0, 200,
                255, 99);

        FcsFile f = new FcsFile(path);
        assertTrue(f.getEventTable().isFloat());
        assertArrayEquals(new float[] {0f, 255f}, f.getEventTable().getParameterFloats(0));
        assertArrayEquals(new float[] {72f, 99f}, f.getEventTable().getParameterFloats(1));
    }


    @Test
    @DisplayName("64-bit integers load as doubles")
    void loadSixtyFourBitIntegers() throws Exception {
        long range = 1L << 40;
        String path = integerFile("i64.fcs", 64, new long[] {range},
                ByteOrder.BIG_ENDIAN, "4,3,2,1", null,
                range - 1, range + 5, 3);

        IEventTable t = new FcsFile(path).getEventTable();
        assertTrue(t.isDouble());
        assertArrayEquals(new double[] {range - 1, 5.0, 3.0}, t.getParameterDoubles(0));
    }


    @Test
    @DisplayName("Parameters of different widths are read event by event")
    void loadMixedWidths() throws Exception {
        Map<String, String> k = FcsTestHelper.integerKeywords(8, new long[] {256, 65536}, 2, "1,2,3,4");
        k.put("$P2B", "16");
        byte[] data = {7, 0x34, 0x12, (byte) 255, (byte) 0xFF, (byte) 0xFF};
        String path = FcsTestHelper.write(dir, "mixed.fcs",
                FcsTestHelper.file(FcsVersion.FCS3_1, FcsTestHelper.text('/', k), data));

        FcsFile f = new FcsFile(path);
        IEventTable t = f.getEventTable();
        assertTrue(t.isFloat());
        assertEquals(2, t.getNumberOfEvents());
        assertArrayEquals(new float[] {7f, 255f}, t.getParameterFloats(0));
        assertArrayEquals(new float[] {0x1234, 65535f}, t.getParameterFloats(1));
        assertFalse(f.getFileLog().hasCategory(FileLog.ERROR));
    }


    @Test
    @DisplayName("Events without DATA offsets anywhere are an error")
    void missingDataOffsets() throws Exception {
        Map<String, String> k = FcsTestHelper.integerKeywords(16, new long[] {1024}, 3, "1,2");
        byte[] data = FcsTestHelper.integerData(16, ByteOrder.LITTLE_ENDIAN, 1, 2, 3);
        String path = FcsTestHelper.write(dir, "nodata.fcs",
                FcsTestHelper.file(FcsVersion.FCS3_1, FcsTestHelper.text('/', k), data, 0L, 0L));

        FcsFile f = new FcsFile();
        FcsException e = assertThrows(FcsException.class, () -> f.load(path));
        assertEquals(FcsError.MALFORMED, e.getError());
        assertTrue(f.getFileLog().hasCategory(FileLog.ERROR));

        k = FcsTestHelper.integerKeywords(16, new long[] {1024}, 0, "1,2");
        String empty = FcsTestHelper.write(dir, "empty.fcs",
                FcsTestHelper.file(FcsVersion.FCS3_1, FcsTestHelper.text('/', k), new byte[0]));
        f.load(empty);
        assertEquals(0, f.getNumberOfEvents());
        assertEquals(1, f.getNumberOfParameters());
    }


    @Test
    @DisplayName("A DATA end missing everywhere is derived with a warning")
    void missingDataEnd() throws Exception {
        byte[] data = FcsTestHelper.integerData(8, ByteOrder.LITTLE_ENDIAN, 4, 5, 6, 0, 0);

        Map<String, String> k = FcsTestHelper.integerKeywords(8, new long[] {256}, 3, "1,2");
        byte[] text = textWithDataOffsets(k, data.length, false);
        String path = FcsTestHelper.write(dir, "tot.fcs",
                FcsTestHelper.file(FcsVersion.FCS3_1, text, data, 0L, 0L));

        FcsFile f = new FcsFile(path);
        assertEquals(3, f.getNumberOfEvents());
        assertEquals(3L, f.getNumberOfOriginalEvents());
        assertArrayEquals(new float[] {4f, 5f, 6f}, f.getEventTable().getParameterFloats(0));
        assertTrue(f.getFileLog().hasCategory(FileLog.WARNING));
        assertFalse(f.getFileLog().hasCategory(FileLog.ERROR));
        assertTrue(logMentions(f, "derived from $TOT"));

        k = FcsTestHelper.integerKeywords(8, new long[] {256}, 3, "1,2");
        k.remove("$TOT");
        text = textWithDataOffsets(k, 3, false);
        path = FcsTestHelper.write(dir, "eof.fcs",
                FcsTestHelper.file(FcsVersion.FCS3_1, text,
                        FcsTestHelper.integerData(8, ByteOrder.LITTLE_ENDIAN, 4, 5, 6), 0L, 0L));

        f = new FcsFile(path);
        assertEquals(3, f.getNumberOfEvents());
        assertTrue(logMentions(f, "end of the file used"));
    }


    @Test
    @DisplayName("Dictionary DATA offsets fill in a zero header and win a conflict")
    void dataOffsetReconciliation() throws Exception {
        byte[] data = FcsTestHelper.integerData(8, ByteOrder.LITTLE_ENDIAN, 1, 2, 3, 9);

        Map<String, String> k = FcsTestHelper.integerKeywords(8, new long[] {256}, 3, "1,2");
        byte[] text = textWithDataOffsets(k, 3, true);
        String path = FcsTestHelper.write(dir, "zero.fcs",
                FcsTestHelper.file(FcsVersion.FCS3_1, text, data, 0L, 0L));

        FcsFile f = new FcsFile(path);
        assertArrayEquals(new float[] {1f, 2f, 3f}, f.getEventTable().getParameterFloats(0));
        assertFalse(logMentions(f, "dictionary used"));

        long begin = FcsTestHelper.dataBegin(text);
        path = FcsTestHelper.write(dir, "conflict.fcs",
                FcsTestHelper.file(FcsVersion.FCS3_1, text, data, begin + 1, begin + 3));

        f = new FcsFile(path);
        assertArrayEquals(new float[] {1f, 2f, 3f}, f.getEventTable().getParameterFloats(0));
        assertTrue(logMentions(f, "dictionary used"));
        assertFalse(f.getFileLog().hasCategory(FileLog.ERROR));
    }


    @Test
    @DisplayName("Limiting the events keeps the original event count")
    void maximumEvents() throws Exception {
        String path = integerFile("d.fcs", 8, new long[] {256},
                ByteOrder.LITTLE_ENDIAN, "1,2", null,
                5, 6, 7);

        FcsFile f = new FcsFile();
        f.load(path, 0);
        assertEquals(0, f.getNumberOfEvents());
        assertEquals(3L, f.getNumberOfOriginalEvents());
        assertEquals(1, f.getNumberOfParameters());

        f.load(path, 2);
        assertEquals(2, f.getNumberOfEvents());
        assertEquals(3L, f.getNumberOfOriginalEvents());

        f.load(path, 100);
        assertEquals(3, f.getNumberOfEvents());
        assertArrayEquals(new float[] {5f, 6f, 7f}, f.getEventTable().getParameterFloats(0));
    }


    @Test
    @DisplayName("Auto scaling applies $PnE to integer data")
    void autoScaling() throws Exception {
        Map<String, String> extra = new java.util.LinkedHashMap<String, String>();
        extra.put("$P1E", "2,1");
        String path = integerFile("e.fcs", 16, new long[] {1024, 1024},
                ByteOrder.LITTLE_ENDIAN, "1,2", extra,
                512, 512);

        FcsFile plain = new FcsFile(path);
        assertEquals(512f, plain.getEventTable().getParameterFloats(0)[0]);

        FcsFile scaled = new FcsFile();
        scaled.setAutoScaling(true);
        scaled.load(path);
        IEventTable t = scaled.getEventTable();
        assertEquals(10f, t.getParameterFloats(0)[0], 1e-5f);
        assertEquals(512f, t.getParameterFloats(1)[0]);
        assertEquals("0,0", scaled.getDictionaryString("$P1E"));
        assertEquals("100", scaled.getDictionaryString("$P1R"));
        assertEquals(1.0, t.getParameterMinimum(0), 1e-12);
        assertEquals(100.0, t.getParameterMaximum(0), 1e-9);
    }


    @Test
    @DisplayName("Float tables survive save and load unchanged")
    void floatRoundTrip() throws Exception {
        EventTable table = new EventTable(false, 3);
        table.appendParameter("FSC-A");
        table.appendParameter("SSC-A");
        table.setParameterLongName(1, "side | scatter");
        float[] a = table.getParameterFloats(0);
        float[] b = table.getParameterFloats(1);
        a[0] = 1.5f;  a[1] = -2.25f; a[2] = 499.5f;
        b[0] = 0f;    b[1] = 1e-7f;  b[2] = 3.4e38f;
        table.computeDataMinimumMaximum();

        FcsFile out = new FcsFile(table);
        out.setDictionaryString("$CYT", "Test|Cytometer");
        String path = dir.resolve("round.fcs").toString();
        out.save(path);

        assertEquals("2", out.getDictionaryString("$PAR"));
        assertEquals("3", out.getDictionaryString("$TOT"));
        assertEquals("F", out.getDictionaryString("$DATATYPE"));
        assertEquals("32", out.getDictionaryString("$P1B"));
        assertEquals("500", out.getDictionaryString("$P1R"));

        FcsFile in = new FcsFile(path);
        IEventTable t = in.getEventTable();
        assertTrue(t.isFloat());
        assertEquals(FcsVersion.FCS3_1, in.getVersion());
        assertArrayEquals(a, t.getParameterFloats(0));
        assertArrayEquals(b, t.getParameterFloats(1));
        assertEquals("side | scatter", t.getParameterLongName(1));
        assertEquals("Test|Cytometer", in.getDictionaryString("$CYT"));
        assertFalse(in.getFileLog().hasCategory(FileLog.WARNING), in.getFileLog().getEntries().toString());

        byte[] bytes = Files.readAllBytes(Paths.get(path));
        String tail = new String(bytes, bytes.length - 8, 8, "US-ASCII");
        assertEquals("00000000", tail);
    }


    @Test
    @DisplayName("Double tables survive save and load unchanged")
    void doubleRoundTrip() throws Exception {
        EventTable table = new EventTable(true, 2);
        table.appendParameter("Time");
        double[] v = table.getParameterDoubles(0);
        v[0] = Math.PI;
        v[1] = 1.0e300;

        FcsFile out = new FcsFile(table);
        String path = dir.resolve("double.fcs").toString();
        out.save(path);

        FcsFile in = new FcsFile(path);
        assertTrue(in.getEventTable().isDouble());
        assertEquals("D", in.getDictionaryString("$DATATYPE"));
        assertArrayEquals(v, in.getEventTable().getParameterDoubles(0));
    }


    @Test
    @DisplayName("Saving drops keywords of removed parameters")
    void staleParameterKeywords() throws Exception {
        EventTable table = new EventTable(false, 1);
        table.appendParameter("A");
        table.appendParameter("B");

        FcsFile f = new FcsFile(table);
        f.save(dir.resolve("two.fcs").toString());
        assertEquals("B", f.getDictionaryString("$P2N"));

        table.removeParameter("B");
        f.save(dir.resolve("one.fcs").toString());
        assertNull(f.getDictionaryString("$P2N"));
        assertNull(f.getDictionaryString("$P2B"));
        assertEquals("1", f.getDictionaryString("$PAR"));
    }


    @Test
    @DisplayName("De-identification removes private and unknown keywords, twice is once")
    void deidentify() throws Exception {
        FcsFile f = new FcsFile();
        f.setDictionaryString("$OP", "Operator");
        f.setDictionaryString("$DATE", "01-JAN-2026");
        f.setDictionaryString("MYLAB_KEY", "x");
        f.setDictionaryString("$CYT", "Cytometer");

        assertEquals(3, f.deidentify());
        assertEquals(0, f.deidentify());
        assertEquals("Cytometer", f.getDictionaryString("$CYT"));
        assertNull(f.getDictionaryString("$OP"));
        assertNull(f.getDictionaryString("$date"));
    }


    @Test
    @DisplayName("Keywords derived from the table cannot be set or removed")
    void protectedKeywords() {
        FcsFile f = new FcsFile();
        FcsException e = assertThrows(FcsException.class, () -> f.setDictionaryString("$tot", "5"));
        assertEquals(FcsError.PROTECTED_KEYWORD, e.getError());
        e = assertThrows(FcsException.class, () -> f.setDictionaryString("$P3N", "X"));
        assertEquals(FcsError.PROTECTED_KEYWORD, e.getError());
        e = assertThrows(FcsException.class, () -> f.removeDictionaryString("$PAR"));
        assertEquals(FcsError.PROTECTED_KEYWORD, e.getError());

        assertThrows(UnsupportedOperationException.class, () -> f.getDictionary().put("$TOT", "5"));
        assertThrows(UnsupportedOperationException.class, () -> f.getDictionary().remove("$PAR"));
    }


    @Test
    @DisplayName("A failed load leaves an empty object and logs the error")
    void failedLoad() throws Exception {
        String path = FcsTestHelper.write(dir, "short.fcs", "FCS3.1    ".getBytes("US-ASCII"));
        FcsFile f = new FcsFile();
        FcsException e = assertThrows(FcsException.class, () -> f.load(path));
        assertEquals(FcsError.TRUNCATED, e.getError());
        assertTrue(f.getFileLog().hasCategory(FileLog.ERROR));
        assertEquals(0, f.getDictionary().size());
        assertNull(f.getVersion());
    }


    @Test
    @DisplayName("Missing files raise IO_ERROR")
    void missingFile() {
        FcsFile f = new FcsFile();
        FcsException e = assertThrows(FcsException.class,
                () -> f.load(dir.resolve("none.fcs").toString()));
        assertEquals(FcsError.IO_ERROR, e.getError());
    }


    @Test
    @DisplayName("Non-list mode and multiple data sets are rejected")
    void unsupportedFiles() throws Exception {
        Map<String, String> extra = new java.util.LinkedHashMap<String, String>();
        extra.put("$MODE", "H");
        String h = integerFile("h.fcs", 8, new long[] {256}, ByteOrder.LITTLE_ENDIAN, "1,2", extra, 1);
        FcsException e = assertThrows(FcsException.class, () -> new FcsFile(h));
        assertEquals(FcsError.UNSUPPORTED, e.getError());

        extra.put("$MODE", "L");
        extra.put("$NEXTDATA", "1000");
        String n = integerFile("n.fcs", 8, new long[] {256}, ByteOrder.LITTLE_ENDIAN, "1,2", extra, 1);
        e = assertThrows(FcsException.class, () -> new FcsFile(n));
        assertEquals(FcsError.UNSUPPORTED, e.getError());
    }


    @Test
    @DisplayName("$TOT larger than the data gives a warning and the events present")
    void truncatedData() throws Exception {
        Map<String, String> k = FcsTestHelper.integerKeywords(8, new long[] {256}, 5, "1,2");
        byte[] data = FcsTestHelper.integerData(8, ByteOrder.LITTLE_ENDIAN, 9, 8);
        String path = FcsTestHelper.write(dir, "t.fcs",
                FcsTestHelper.file(FcsVersion.FCS3_0, FcsTestHelper.text('\\', k), data));

        FcsFile f = new FcsFile(path);
        assertEquals(FcsVersion.FCS3_0, f.getVersion());
        assertEquals(2, f.getNumberOfEvents());
        assertTrue(f.getFileLog().hasCategory(FileLog.WARNING));
    }


    @Test
    @DisplayName("Duplicate parameter names are made unique")
    void duplicateNames() throws Exception {
        Map<String, String> extra = new java.util.LinkedHashMap<String, String>();
        extra.put("$P2N", "FL1");
        String path = integerFile("dup.fcs", 8, new long[] {256, 256},
                ByteOrder.LITTLE_ENDIAN, "1,2", extra, 1, 2);

        FcsFile f = new FcsFile(path);
        assertEquals("FL1", f.getEventTable().getParameterName(0));
        assertEquals("FL1_2", f.getEventTable().getParameterName(1));
        assertEquals("FL1_2", f.getDictionaryString("$P2N"));
    }


    @Test
    @DisplayName("File name extensions")
    void extensions() {
        assertTrue(FcsFile.isFileNameExtension("fcs"));
        assertTrue(FcsFile.isFileNameExtension("LMD"));
        assertFalse(FcsFile.isFileNameExtension("txt"));
        assertEquals(2, FcsFile.getFileNameExtensions().size());
    }
}
