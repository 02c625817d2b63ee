package de.bsommerfeld.sixdegrees.app;

import com.google.inject.Inject;
import de.bsommerfeld.sixdegrees.core.domain.ExternalId;
import de.bsommerfeld.sixdegrees.core.domain.Person;
import de.bsommerfeld.sixdegrees.db.GraphStore;
import de.bsommerfeld.sixdegrees.db.StoreTable;
import de.bsommerfeld.sixdegrees.ingest.IngestPipeline;
import de.bsommerfeld.sixdegrees.ingest.IngestSummary;
import de.bsommerfeld.sixdegrees.ingest.LoadReport;
import de.bsommerfeld.sixdegrees.ingest.RowOutcome;
import de.bsommerfeld.sixdegrees.search.Link;
import de.bsommerfeld.sixdegrees.search.PathDescriber;
import de.bsommerfeld.sixdegrees.search.PathResolver;
import de.bsommerfeld.sixdegrees.search.PathResult;
import de.bsommerfeld.sixdegrees.search.PersonResolver;
import de.bsommerfeld.sixdegrees.search.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command dispatch for {@code load}, {@code resolve} and {@code path}.
 *
 * <p>
 * Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_NO_RESULT} when a
 * person is not found or ambiguous or no path exists, {@value #EXIT_FATAL} on
 * usage errors and failures.
 */
public class SixDegreesCli {

    private static final Logger LOG = LoggerFactory.getLogger(SixDegreesCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_RESULT = 1;
    public static final int EXIT_FATAL = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  load [dumpDir]       rebuild the graph store from IMDb dumps",
            "  resolve <name|id>    look up a person",
            "  path <from> <to>     find a shortest chain of shared movies");

    private final GraphStore store;
    private final IngestPipeline pipeline;
    private final PersonResolver personResolver;
    private final PathResolver pathResolver;
    private final PathDescriber describer;

    @Inject
    public SixDegreesCli(GraphStore store, IngestPipeline pipeline, PersonResolver personResolver,
            PathResolver pathResolver, PathDescriber describer) {
        this.store = store;
        this.pipeline = pipeline;
        this.personResolver = personResolver;
        this.pathResolver = pathResolver;
        this.describer = describer;
    }

    public int run(PrintStream out, String... args) {
        if (args.length == 0) {
            out.println(USAGE);
            return EXIT_FATAL;
        }
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try {
            switch (args[0]) {
                case "load":
                    return load(out, rest);
                case "resolve":
                    return resolve(out, rest);
                case "path":
                    return path(out, rest);
                default:
                    out.println("Unknown command: " + args[0]);
                    out.println(USAGE);
                    return EXIT_FATAL;
            }
        } catch (RuntimeException e) {
            LOG.error("Command '{}' failed", args[0], e);
            out.println("Error: " + e.getMessage());
            return EXIT_FATAL;
        }
    }

    private int load(PrintStream out, String[] args) {
        if (args.length > 1) {
            out.println(USAGE);
            return EXIT_FATAL;
        }
        IngestSummary summary = args.length == 1 ? pipeline.run(Path.of(args[0])) : pipeline.run();

        for (LoadReport report : summary.loads()) {
            out.printf("%-8s %,d inserted, %,d skipped, %,d duplicates%n", report.table().tableName(),
                    report.inserted(), report.skipped(), report.dropped(RowOutcome.DUPLICATE_PAIR));
        }
        out.printf("Cleaning removed %,d rows%n", summary.cleaning().total());
        out.printf("Store ready: %,d people, %,d movies, %,d edges%n", summary.rowCount(StoreTable.PEOPLE),
                summary.rowCount(StoreTable.MOVIES), summary.rowCount(StoreTable.EDGES));
        return EXIT_OK;
    }

    private int resolve(PrintStream out, String[] args) {
        if (args.length == 0) {
            out.println(USAGE);
            return EXIT_FATAL;
        }
        store.verifyTables();
        String input = String.join(" ", args);
        Resolution resolution = personResolver.resolve(input);
        if (resolution.outcome() == Resolution.Outcome.EXACT_MATCH) {
            printPerson(out, resolution.person());
            return EXIT_OK;
        }
        printUnresolved(out, input, resolution);
        return EXIT_NO_RESULT;
    }

    private int path(PrintStream out, String[] args) {
        if (args.length != 2) {
            out.println(USAGE);
            return EXIT_FATAL;
        }
        store.verifyTables();

        Resolution from = personResolver.resolve(args[0]);
        Resolution to = personResolver.resolve(args[1]);
        boolean resolved = true;
        if (from.outcome() != Resolution.Outcome.EXACT_MATCH) {
            printUnresolved(out, args[0], from);
            resolved = false;
        }
        if (to.outcome() != Resolution.Outcome.EXACT_MATCH) {
            printUnresolved(out, args[1], to);
            resolved = false;
        }
        if (!resolved)
            return EXIT_NO_RESULT;

        Person start = from.person();
        Person target = to.person();
        out.println("Looking for a connection...");
        PathResult result = pathResolver.findPath(start.id(), target.id());
        if (!result.isFound()) {
            out.printf("%s and %s are not connected.%n", start.name(), target.name());
            return EXIT_NO_RESULT;
        }

        int hops = result.hops();
        out.printf("%s and %s are %d degree%s apart.%n", start.name(), target.name(), hops, hops == 1 ? "" : "s");
        for (Link link : describer.describe(result.path()))
            out.println(link.sentence());
        return EXIT_OK;
    }

    private void printPerson(PrintStream out, Person person) {
        out.println("Name: " + person.name());
        out.println("ID: " + person.id() + " (" + ExternalId.format(ExternalId.PERSON_PREFIX, person.id()) + ")");
        if (person.birth() != null)
            out.println("Born: " + person.birth());
        List<String> titles = personResolver.knownForTitles(person);
        if (!titles.isEmpty())
            out.println("Known for: " + String.join(", ", titles));
    }

    private void printUnresolved(PrintStream out, String input, Resolution resolution) {
        if (resolution.outcome() == Resolution.Outcome.NOT_FOUND) {
            out.printf("'%s' does not exist in the graph store.%n", input);
            return;
        }
        List<Person> shown = resolution.candidates().isEmpty() ? resolution.matches() : resolution.candidates();
        out.printf("'%s' matches %d people; repeat with a full name or an ID:%n", input,
                resolution.matches().size());
        for (Person person : shown) {
            out.println();
            printPerson(out, person);
        }
        out.println();
        out.println("The best known people are listed last.");
    }
}
