package de.bsommerfeld.sixdegrees.search;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.config.SearchConfig;
import de.bsommerfeld.sixdegrees.db.GraphStore;
import de.bsommerfeld.sixdegrees.db.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Breadth-first search for a shortest chain of co-appearances between two
 * people.
 *
 * <p>
 * The graph is never materialized; neighbors come from an
 * {@link AdjacencyLookup} one person at a time. Each discovered person
 * remembers the person it was discovered from, and the path is rebuilt from
 * those parent links once the target shows up among a person's neighbors.
 * The search is read-only and every call uses its own connection, so
 * concurrent calls are safe.
 */
@Singleton
public class PathResolver {

    private static final Logger LOG = LoggerFactory.getLogger(PathResolver.class);

    private final GraphStore store;
    private final SearchConfig config;

    @Inject
    public PathResolver(GraphStore store, SearchConfig config) {
        this.store = store;
        this.config = config;
    }

    /**
     * Searches the graph store.
     *
     * @throws SearchCeilingExceededException if the ceiling is hit first
     * @throws StoreException                 if the store cannot be queried
     */
    public PathResult findPath(int start, int target) {
        try (Connection conn = store.openConnection();
                SqlAdjacencyLookup lookup = new SqlAdjacencyLookup(conn)) {
            return search(start, target, lookup);
        } catch (SQLException e) {
            throw new StoreException("Path search failed", e);
        }
    }

    /**
     * Searches with the given lookup. Start equal to target is a path of
     * length zero.
     */
    public PathResult search(int start, int target, AdjacencyLookup lookup) {
        if (start == target)
            return PathResult.found(List.of(start), 0);

        int ceiling = config.getMaxNodes();
        Map<Integer, Integer> parents = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        parents.put(start, null);
        queue.add(start);
        int expanded = 0;

        while (!queue.isEmpty()) {
            int node = queue.poll();
            if (++expanded > ceiling)
                throw new SearchCeilingExceededException(ceiling);

            Set<Integer> neighbors = lookup.neighbors(node);
            if (neighbors.contains(target)) {
                parents.put(target, node);
                List<Integer> path = backtrace(parents, target);
                LOG.debug("Found {} hop path after expanding {} people", path.size() - 1, expanded);
                return PathResult.found(path, expanded);
            }
            for (int neighbor : neighbors) {
                if (!parents.containsKey(neighbor)) {
                    parents.put(neighbor, node);
                    queue.add(neighbor);
                }
            }
        }
        LOG.debug("No path from {} to {} after expanding {} people", start, target, expanded);
        return PathResult.noPath(expanded);
    }

    private static List<Integer> backtrace(Map<Integer, Integer> parents, int target) {
        List<Integer> path = new ArrayList<>();
        for (Integer node = target; node != null; node = parents.get(node))
            path.add(node);
        Collections.reverse(path);
        return path;
    }
}
