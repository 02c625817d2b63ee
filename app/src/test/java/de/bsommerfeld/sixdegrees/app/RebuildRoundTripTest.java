package de.bsommerfeld.sixdegrees.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.sixdegrees.core.config.GlobalConfig;
import de.bsommerfeld.sixdegrees.ingest.IngestPipeline;
import de.bsommerfeld.sixdegrees.ingest.IngestSummary;
import de.bsommerfeld.sixdegrees.search.PathResolver;
import de.bsommerfeld.sixdegrees.search.PersonResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full rebuild through the Guice graph, twice, against the fixture dumps.
 */
class RebuildRoundTripTest {

    @TempDir
    Path tempDir;

    @Test
    void rebuildTwice_shouldGiveIdenticalCountsAndPaths() throws URISyntaxException {
        Injector injector = injector();
        IngestPipeline pipeline = injector.getInstance(IngestPipeline.class);
        PathResolver paths = injector.getInstance(PathResolver.class);

        IngestSummary first = pipeline.run();
        List<Integer> firstPath = paths.findPath(2, 3).path();
        IngestSummary second = pipeline.run();
        List<Integer> secondPath = paths.findPath(2, 3).path();

        assertEquals(first.rowCounts(), second.rowCounts());
        assertEquals(List.of(2, 1, 3), firstPath);
        assertEquals(firstPath, secondPath);
    }

    @Test
    void cli_shouldLoadThenDescribePath() throws URISyntaxException {
        Injector injector = injector();
        SixDegreesCli cli = injector.getInstance(SixDegreesCli.class);
        var buffer = new ByteArrayOutputStream();
        var out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        assertEquals(SixDegreesCli.EXIT_OK, cli.run(out, "load"));
        assertEquals(SixDegreesCli.EXIT_OK, cli.run(out, "path", "Lithgow", "Sean Penn"));
        assertEquals(SixDegreesCli.EXIT_NO_RESULT, cli.run(out, "resolve", "Lonely Person"));

        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("John Lithgow was an actor in Footloose (1984) where Kevin Bacon was an actor."),
                text);
        assertTrue(text.contains("Kevin Bacon was an actor in Mystic River (2003) where Sean Penn was an actor."),
                text);
        assertEquals(3, injector.getInstance(PersonResolver.class).resolve("Hanks").person().id());
    }

    private Injector injector() throws URISyntaxException {
        GlobalConfig config = new GlobalConfig();
        config.getStore().setDatabaseFile(tempDir.resolve("graph.db").toString());
        config.getIngest().setDumpDirectory(fixtures().toString());
        return Guice.createInjector(new AppModule(config));
    }

    private static Path fixtures() throws URISyntaxException {
        return Paths.get(RebuildRoundTripTest.class.getResource("/fixtures/title.basics.tsv").toURI()).getParent();
    }
}
