package de.bsommerfeld.sixdegrees.ingest;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Streams a tab-delimited dump row by row.
 *
 * <p>
 * The dumps are not CSV in the quoting sense: titles contain unbalanced
 * double quotes and backslashes, so quote and escape handling are switched
 * off and every tab is a field boundary. The first line is the header.
 * Without quoting every physical line is one record, so blank lines are
 * parsed and skipped here to keep row line numbers exact.
 */
public final class DumpReader implements Closeable, Iterable<DumpRow> {

    private static final CSVFormat DUMP_FORMAT = CSVFormat.DEFAULT.builder()
            .setDelimiter('\t')
            .setQuote(null)
            .setEscape(null)
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(false)
            .setIgnoreSurroundingSpaces(false)
            .build();

    private final Path file;
    private final CSVParser parser;

    private DumpReader(Path file, CSVParser parser) {
        this.file = file;
        this.parser = parser;
    }

    /**
     * Opens {@code file} and checks that its header names every required
     * column.
     *
     * @throws DumpFormatException if a required column is missing
     * @throws IOException         if the file cannot be opened
     */
    public static DumpReader open(Path file, String... requiredColumns) throws IOException {
        Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        CSVParser parser;
        try {
            parser = CSVParser.parse(reader, DUMP_FORMAT);
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }

        Map<String, Integer> header = parser.getHeaderMap();
        List<String> missing = new ArrayList<>();
        for (String column : requiredColumns) {
            if (header == null || !header.containsKey(column))
                missing.add(column);
        }
        if (!missing.isEmpty()) {
            parser.close();
            throw new DumpFormatException(file.getFileName() + ": missing columns " + missing);
        }
        return new DumpReader(file, parser);
    }

    @Override
    public Iterator<DumpRow> iterator() {
        Iterator<CSVRecord> records = parser.iterator();
        return new Iterator<>() {
            private long line = 1;
            private DumpRow pending;

            @Override
            public boolean hasNext() {
                while (pending == null && records.hasNext()) {
                    CSVRecord record = records.next();
                    line++;
                    if (!isBlank(record))
                        pending = new DumpRow(file, line, record);
                }
                return pending != null;
            }

            @Override
            public DumpRow next() {
                if (!hasNext())
                    throw new NoSuchElementException();
                DumpRow row = pending;
                pending = null;
                return row;
            }
        };
    }

    private static boolean isBlank(CSVRecord record) {
        return record.size() == 1 && record.get(0).isEmpty();
    }

    public Path file() {
        return file;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
