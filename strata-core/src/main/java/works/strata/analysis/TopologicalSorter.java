package works.strata.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Comparator.comparingInt;

/**
 * Classic depth-first topological sort, except that it doesn't give up on cycles.
 * <p>
 * The result contains every node exactly once.
 * For an acyclic graph, every node appears after all of its children.
 * For a cyclic graph, each cycle is broken at exactly one edge:
 * when a node is reached for the second time before all of its children are finished,
 * it's emitted anyway, and the edges leading back to it from those unfinished children
 * are ignored from then on.
 * <p>
 * Which edge gets ignored is a heuristic, not an optimum.
 * Nodes with many children are scheduled first,
 * so a cycle tends to be broken at the edge pointing to its largest node.
 * Downstream, that's the node whose references become indirect, and
 * indirection costs less when it's the large, rarely-nested types that pay for it
 * rather than the small ones that are referenced everywhere.
 * <p>
 * The traversal uses an explicit stack, so there's no recursion depth limit.
 */
public final class TopologicalSorter {
	private TopologicalSorter() { }

	/**
	 * @param children maps each node to the nodes it depends on; ties are broken by key order
	 * @throws IllegalArgumentException if some child is not itself a key of {@code children}
	 */
	public static <T extends Comparable<? super T>> List<T> sort(SortedMap<T, ? extends Set<T>> children) {
		// Seed: descending key order, then a stable sort by ascending out-degree.
		// We pop from the top, so the first node processed has the most children,
		// with ties going to the smallest key.
		List<T> seed = new ArrayList<>(children.keySet());
		Collections.reverse(seed);
		seed.sort(comparingInt(node -> children.get(node).size()));
		Deque<T> stack = new ArrayDeque<>();
		seed.forEach(stack::push);

		List<T> result = new ArrayList<>(children.size());
		Set<T> sorted = new HashSet<>();
		Set<T> seen = new HashSet<>();

		while (!stack.isEmpty()) {
			T node = stack.pop();
			if (sorted.contains(node)) {
				continue;
			}
			if (seen.contains(node)) {
				// Second visit. If the node is in no cycle, all its children are sorted by now.
				// Otherwise, some child that depends back on it isn't, and we emit the node
				// anyway: that's where the cycle gets broken.
				LOGGER.trace("Finish {}", node);
				sorted.add(node);
				result.add(node);
				continue;
			}

			// First visit: schedule the node for a second visit after its unseen children,
			// which get pushed in descending order so they pop in ascending order.
			LOGGER.trace("Begin {}", node);
			seen.add(node);
			stack.push(node);
			Iterator<T> iter = new TreeSet<>(children.get(node)).descendingIterator();
			while (iter.hasNext()) {
				T child = iter.next();
				if (!children.containsKey(child)) {
					throw new IllegalArgumentException("Node " + node + " has child " + child + " which is not a node");
				}
				if (!seen.contains(child)) {
					stack.push(child);
				}
			}
		}

		assert result.size() == children.size();
		return List.copyOf(result);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TopologicalSorter.class);
}
