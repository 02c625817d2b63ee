package de.bsommerfeld.sixdegrees.app;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.event.IngestEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs ingest progress published on the application event bus.
 */
@Singleton
public class IngestProgressLogger {

    private static final Logger LOG = LoggerFactory.getLogger(IngestProgressLogger.class);

    @Subscribe
    public void onBatchCommitted(IngestEvents.BatchCommitted event) {
        LOG.info("[{}] {} rows committed", event.table(), event.rowsSoFar());
    }

    @Subscribe
    public void onTableLoaded(IngestEvents.TableLoaded event) {
        LOG.info("[{}] done: {} inserted, {} skipped", event.table(), event.inserted(), event.skipped());
    }

    @Subscribe
    public void onCleaningFinished(IngestEvents.CleaningFinished event) {
        LOG.info("Cleaning removed {} rows", event.deletedRows());
    }
}
