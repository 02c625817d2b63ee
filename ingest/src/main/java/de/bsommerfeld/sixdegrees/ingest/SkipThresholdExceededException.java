package de.bsommerfeld.sixdegrees.ingest;

import java.util.Locale;

/**
 * Thrown when a load skipped a larger share of its rows than
 * {@code ingest.max-skip-ratio} allows. The table keeps the rows that were
 * committed; the pipeline stops before cleaning.
 */
public class SkipThresholdExceededException extends RuntimeException {

    private final transient LoadReport report;

    public SkipThresholdExceededException(LoadReport report, double maxRatio) {
        super(String.format(Locale.ROOT, "%s: skipped %d of %d rows (%.4f > %.4f)",
                report.table().tableName(), report.skipped(), report.inserted() + report.skipped(),
                report.skipRatio(), maxRatio));
        this.report = report;
    }

    public LoadReport getReport() {
        return report;
    }
}
