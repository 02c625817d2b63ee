package de.bsommerfeld.sixdegrees.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchConfig {

    /** Dequeued nodes after which a path search gives up as inconclusive. */
    @JsonProperty("max-nodes")
    private int maxNodes = 1_000_000;

    public int getMaxNodes() {
        return maxNodes;
    }

    public void setMaxNodes(int maxNodes) {
        this.maxNodes = maxNodes;
    }
}
