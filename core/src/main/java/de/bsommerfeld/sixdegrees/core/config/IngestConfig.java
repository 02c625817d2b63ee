package de.bsommerfeld.sixdegrees.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Dump locations and bulk-load parameters. Values are read from
 * {@code config.toml}; setters exist for the command line and for tests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestConfig {

    @JsonProperty("dump-directory")
    private String dumpDirectory = ".";

    @JsonProperty("people-file")
    private String peopleFile = "name.basics.tsv";

    @JsonProperty("movies-file")
    private String moviesFile = "title.basics.tsv";

    @JsonProperty("ratings-file")
    private String ratingsFile = "title.ratings.tsv";

    @JsonProperty("appearances-file")
    private String appearancesFile = "title.principals.tsv";

    /** Rows per committed transaction. */
    @JsonProperty("batch-size")
    private int batchSize = 100_000;

    /** Raw token the dumps use for an absent value. */
    @JsonProperty("null-sentinel")
    private String nullSentinel = "\\N";

    /**
     * Largest tolerated fraction of skipped rows per table. 1.0 never fails a
     * load.
     */
    @JsonProperty("max-skip-ratio")
    private double maxSkipRatio = 1.0;

    public String getDumpDirectory() {
        return dumpDirectory;
    }

    public void setDumpDirectory(String dumpDirectory) {
        this.dumpDirectory = dumpDirectory;
    }

    public String getPeopleFile() {
        return peopleFile;
    }

    public String getMoviesFile() {
        return moviesFile;
    }

    public String getRatingsFile() {
        return ratingsFile;
    }

    public String getAppearancesFile() {
        return appearancesFile;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public String getNullSentinel() {
        return nullSentinel;
    }

    public double getMaxSkipRatio() {
        return maxSkipRatio;
    }

    public void setMaxSkipRatio(double maxSkipRatio) {
        this.maxSkipRatio = maxSkipRatio;
    }
}
