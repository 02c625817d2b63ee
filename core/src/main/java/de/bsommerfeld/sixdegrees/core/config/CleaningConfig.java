package de.bsommerfeld.sixdegrees.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Retention rules applied after the bulk load.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CleaningConfig {

    @JsonProperty("retained-title-types")
    private List<String> retainedTitleTypes = List.of("movie", "short", "tvSeries", "tvMiniSeries");

    @JsonProperty("min-votes")
    private int minVotes = 20;

    @JsonProperty("excluded-genres")
    private List<String> excludedGenres = List.of("News", "Talk-Show", "Reality-TV", "Adult");

    public List<String> getRetainedTitleTypes() {
        return retainedTitleTypes;
    }

    public void setRetainedTitleTypes(List<String> retainedTitleTypes) {
        this.retainedTitleTypes = retainedTitleTypes;
    }

    public int getMinVotes() {
        return minVotes;
    }

    public void setMinVotes(int minVotes) {
        this.minVotes = minVotes;
    }

    public List<String> getExcludedGenres() {
        return excludedGenres;
    }

    public void setExcludedGenres(List<String> excludedGenres) {
        this.excludedGenres = excludedGenres;
    }
}
