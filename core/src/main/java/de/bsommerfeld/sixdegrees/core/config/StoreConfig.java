package de.bsommerfeld.sixdegrees.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Location of the SQLite graph store. An empty path means the default file
 * inside the application data directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreConfig {

    @JsonProperty("database-file")
    private String databaseFile = "";

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }
}
