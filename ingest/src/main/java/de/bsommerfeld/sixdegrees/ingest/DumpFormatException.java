package de.bsommerfeld.sixdegrees.ingest;

/**
 * The dump does not match the expected format: a malformed identifier, an
 * unparseable number, a missing column. Aborts the load; the store is rebuilt
 * from scratch on the next run anyway.
 */
public class DumpFormatException extends RuntimeException {

    public DumpFormatException(String message) {
        super(message);
    }

    public DumpFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
