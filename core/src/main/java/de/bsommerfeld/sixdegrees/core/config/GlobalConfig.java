package de.bsommerfeld.sixdegrees.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to one stage of the
 * pipeline; missing keys keep the defaults declared on the section classes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("store")
    private StoreConfig store = new StoreConfig();

    @JsonProperty("ingest")
    private IngestConfig ingest = new IngestConfig();

    @JsonProperty("cleaning")
    private CleaningConfig cleaning = new CleaningConfig();

    @JsonProperty("search")
    private SearchConfig search = new SearchConfig();

    public StoreConfig getStore() {
        return store;
    }

    public IngestConfig getIngest() {
        return ingest;
    }

    public CleaningConfig getCleaning() {
        return cleaning;
    }

    public SearchConfig getSearch() {
        return search;
    }
}
