package de.bsommerfeld.sixdegrees.ingest;

import org.apache.commons.csv.CSVRecord;

import java.nio.file.Path;

/**
 * One data line of a dump, addressed by header column name.
 */
public final class DumpRow {

    private final Path file;
    private final long lineNumber;
    private final CSVRecord record;

    DumpRow(Path file, long lineNumber, CSVRecord record) {
        this.file = file;
        this.lineNumber = lineNumber;
        this.record = record;
    }

    /**
     * @throws DumpFormatException if the line has fewer fields than the header
     */
    public String get(String column) {
        if (!record.isSet(column)) {
            throw new DumpFormatException("no value for column '" + column + "'");
        }
        return record.get(column);
    }

    /** 1-based line number in the file, the header being line 1. */
    public long lineNumber() {
        return lineNumber;
    }

    public String location() {
        return file.getFileName() + ":" + lineNumber();
    }
}
