/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs.tools;

import org.jlab.coda.jfcs.FcsException;
import org.jlab.coda.jfcs.FcsFile;
import org.jlab.coda.jfcs.FileLog;
import org.jlab.coda.jfcs.events.IEventTable;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.PrintStream;
import java.io.StringWriter;
import java.util.Map;

/**
 * Print the contents of an FCS file: version, counts, parameters and
 * the keyword dictionary, as plain text or XML.
 */
public class FcsInfo {

    /** Output formats. */
    enum Format {TEXT, XML}

    private String fileName;
    private Format format = Format.TEXT;
    private boolean deidentify;
    private boolean showLog;


    /**
     * Decode the command line.
     * @param args command line arguments.
     * @return <code>true</code> if the program should run.
     */
    boolean decodeCommandLine(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if (args[i].equalsIgnoreCase("-h") || args[i].equalsIgnoreCase("--help")) {
                return false;
            }
            else if (args[i].equalsIgnoreCase("--format") || args[i].equalsIgnoreCase("-f")) {
                if (i + 1 >= args.length) return false;
                String f = args[++i];
                if (f.equalsIgnoreCase("text")) format = Format.TEXT;
                else if (f.equalsIgnoreCase("xml")) format = Format.XML;
                else return false;
            }
            else if (args[i].equalsIgnoreCase("--deidentify")) {
                deidentify = true;
            }
            else if (args[i].equalsIgnoreCase("--log")) {
                showLog = true;
            }
            else if (args[i].startsWith("-") || fileName != null) {
                return false;
            }
            else {
                fileName = args[i];
            }
        }
        return fileName != null;
    }


    /** Method to print out correct program command line usage. */
    private static void usage() {
        System.out.println("\nUsage:\n\n" +
            "   java org.jlab.coda.jfcs.tools.FcsInfo <file>\n" +
            "        [--format text|xml]   output format, text by default\n" +
            "        [--deidentify]        remove private keywords before printing\n" +
            "        [--log]               print the load warnings\n" +
            "        [-h]                  print this help\n");
    }


    /**
     * Print a loaded file as text.
     * @param file file.
     * @param out  where to print.
     */
    void printText(FcsFile file, PrintStream out) {
        IEventTable table = file.getEventTable();

        out.println("file:        " + fileName);
        out.println("version:     " + (file.getVersion() == null ? "?" : file.getVersion().getTag()));
        out.println("parameters:  " + table.getNumberOfParameters());
        out.println("events:      " + table.getNumberOfEvents() +
                    (table.getNumberOfOriginalEvents() != table.getNumberOfEvents() ?
                     " of " + table.getNumberOfOriginalEvents() : ""));
        out.println("values:      " + (table.isDouble() ? "double" : "float"));
        out.println();

        for (int p = 0; p < table.getNumberOfParameters(); p++) {
            out.printf("  %3d  %-16s %-24s [%g, %g]%n", p + 1,
                       table.getParameterName(p), table.getParameterLongName(p),
                       table.getParameterBestMinimum(p), table.getParameterBestMaximum(p));
        }
        out.println();

        for (Map.Entry<String, String> e : file.getDictionary().entrySet()) {
            out.println("  " + e.getKey() + " = " + e.getValue());
        }

        if (showLog) {
            out.println();
            for (FileLog.Entry entry : file.getFileLog().getEntries()) {
                out.println("  " + entry);
            }
        }
    }


    /**
     * Replace characters XML 1.0 cannot hold, such as NUL, with '?'.
     * @param s text, may be <code>null</code>.
     * @return text safe for element content and attributes.
     */
    static String xmlText(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean legal = (c >= 0x20 && c <= 0xd7ff) || c == '\t' || c == '\n' || c == '\r' ||
                            (c >= 0xe000 && c <= 0xfffd) || Character.isSurrogate(c);
            sb.append(legal ? c : '?');
        }
        return sb.toString();
    }


    /**
     * Format a loaded file as XML.
     * @param file file.
     * @return XML text.
     * @throws XMLStreamException if the XML cannot be written.
     */
    String toXml(FcsFile file) throws XMLStreamException {
        IEventTable table = file.getEventTable();
        StringWriter sWriter = new StringWriter();
        XMLStreamWriter xmlWriter = XMLOutputFactory.newInstance().createXMLStreamWriter(sWriter);

        xmlWriter.writeStartDocument();
        xmlWriter.writeCharacters("\n");
        xmlWriter.writeStartElement("fcs");
        xmlWriter.writeAttribute("file", xmlText(fileName));
        xmlWriter.writeAttribute("version", file.getVersion() == null ? "" : file.getVersion().getTag());
        xmlWriter.writeAttribute("parameters", "" + table.getNumberOfParameters());
        xmlWriter.writeAttribute("events", "" + table.getNumberOfEvents());
        xmlWriter.writeAttribute("originalEvents", "" + table.getNumberOfOriginalEvents());

        for (int p = 0; p < table.getNumberOfParameters(); p++) {
            xmlWriter.writeCharacters("\n   ");
            xmlWriter.writeEmptyElement("parameter");
            xmlWriter.writeAttribute("index", "" + (p + 1));
            xmlWriter.writeAttribute("name", xmlText(table.getParameterName(p)));
            xmlWriter.writeAttribute("longName", xmlText(table.getParameterLongName(p)));
            xmlWriter.writeAttribute("min", "" + table.getParameterBestMinimum(p));
            xmlWriter.writeAttribute("max", "" + table.getParameterBestMaximum(p));
        }

        for (Map.Entry<String, String> e : file.getDictionary().entrySet()) {
            xmlWriter.writeCharacters("\n   ");
            xmlWriter.writeStartElement("keyword");
            xmlWriter.writeAttribute("name", xmlText(e.getKey()));
            xmlWriter.writeCharacters(xmlText(e.getValue()));
            xmlWriter.writeEndElement();
        }

        if (showLog) {
            for (FileLog.Entry entry : file.getFileLog().getEntries()) {
                xmlWriter.writeCharacters("\n   ");
                xmlWriter.writeStartElement(entry.getCategory());
                xmlWriter.writeCharacters(xmlText(entry.getMessage()));
                xmlWriter.writeEndElement();
            }
        }

        xmlWriter.writeCharacters("\n");
        xmlWriter.writeEndElement();
        xmlWriter.writeEndDocument();
        xmlWriter.close();
        return sWriter.toString();
    }


    /**
     * Load the file and print it.
     * @param out where to print.
     * @return exit status.
     */
    int run(PrintStream out) {
        FcsFile file = new FcsFile();
        try {
            file.load(fileName);
        }
        catch (FcsException e) {
            System.err.println("FcsInfo: " + e.getMessage());
            return 1;
        }

        if (deidentify) {
            file.deidentify();
        }

        if (format == Format.XML) {
            try {
                out.println(toXml(file));
            }
            catch (XMLStreamException e) {
                System.err.println("FcsInfo: " + e.getMessage());
                return 1;
            }
        }
        else {
            printText(file, out);
        }
        return 0;
    }


    /**
     * Run the program.
     * @param args command line arguments.
     */
    public static void main(String[] args) {
        FcsInfo info = new FcsInfo();
        if (!info.decodeCommandLine(args)) {
            usage();
            System.exit(-1);
        }
        System.exit(info.run(System.out));
    }
}
