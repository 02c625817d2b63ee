package de.bsommerfeld.sixdegrees.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.sixdegrees.core.event.ApplicationEventBus;
import de.bsommerfeld.sixdegrees.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 */
public final class SixDegreesMain {

    static {
        // must be set before Logback initializes
        if (System.getProperty("sixdegrees.log.dir") == null)
            System.setProperty("sixdegrees.log.dir", StorageUtils.getLogsDir(StorageUtils.APP_NAME).toString());
    }

    private static final Logger LOG = LoggerFactory.getLogger(SixDegreesMain.class);

    private SixDegreesMain() {
    }

    public static void main(String[] args) {
        int code;
        try {
            Injector injector = Guice.createInjector(new AppModule());
            injector.getInstance(ApplicationEventBus.class)
                    .register(injector.getInstance(IngestProgressLogger.class));
            code = injector.getInstance(SixDegreesCli.class).run(System.out, args);
        } catch (RuntimeException e) {
            LOG.error("Startup failed", e);
            System.err.println("Error: " + e.getMessage());
            code = SixDegreesCli.EXIT_FATAL;
        }
        System.exit(code);
    }
}
