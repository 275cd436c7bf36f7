package works.strata.layout;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.CompilerSettings;
import works.strata.exceptions.SchemaException;
import works.strata.schema.Registry;

/**
 * Decides, for every reference site, whether it can be stored by value
 * or needs an indirection to keep every type's size finite.
 * <p>
 * Scans the emission order left to right, keeping a set of names whose size is already known.
 * A reference to a known name can be stored by value; any other reference is indirect.
 * After a definition is processed, its own name becomes known.
 * <p>
 * This is exactly enough. A type can be referenced by value from anything emitted after it.
 * The only way to refer to a type that comes later is around a cycle,
 * and the indirection is placed at that reference, so each cycle is closed by
 * indirect back-edges while everything else stays by-value.
 * <p>
 * Sites under a sequence or map are treated like any other unless
 * {@link CompilerSettings#elideIndirectionInDynamicContainers()} says otherwise,
 * since some targets embed even those composites by value.
 */
public final class LayoutResolver {
	private final CompilerSettings settings;

	public LayoutResolver(CompilerSettings settings) {
		this.settings = settings;
	}

	/**
	 * @param order every name of {@code registry} exactly once, in emission order
	 * @param dependencyMap as computed by {@link works.strata.analysis.DependencyAnalyzer#dependencyMap}
	 * @throws IllegalArgumentException if {@code order} isn't a permutation of the registry's names
	 * @throws SchemaException if a definition is malformed
	 */
	public LayoutPlan resolve(Registry registry, List<String> order, SortedMap<String, SortedSet<String>> dependencyMap) {
		checkOrder(registry, order);

		// Both accumulators live only for the duration of this pass
		Set<String> knownSizes = new HashSet<>();
		Set<String> declared = new HashSet<>();
		List<DefinitionLayout> layouts = new ArrayList<>(order.size());

		for (String name : order) {
			List<String> forwardDeclarations = new ArrayList<>();
			for (String dependency : dependencyMap.get(name)) {
				if (declared.add(dependency)) {
					LOGGER.debug("Forward-declare {} before {}", dependency, name);
					forwardDeclarations.add(dependency);
				}
			}

			List<ReferenceSite> references;
			try {
				references = ReferenceCollector.collect(name, registry.get(name));
			} catch (SchemaException e) {
				throw SchemaException.wrap(e, name);
			}
			Set<ReferenceSite> indirect = new LinkedHashSet<>();
			for (ReferenceSite site : references) {
				if (needsIndirection(site, knownSizes)) {
					LOGGER.debug("Indirect: {}", site);
					indirect.add(site);
				}
			}

			layouts.add(new DefinitionLayout(name, registry.get(name), forwardDeclarations, references, indirect));
			knownSizes.add(name);
			declared.add(name);
		}

		return new LayoutPlan(registry, settings, dependencyMap, layouts, knownSizes);
	}

	private boolean needsIndirection(ReferenceSite site, Set<String> knownSizes) {
		if (knownSizes.contains(site.target())) {
			return false;
		}
		if (settings.elideIndirectionInDynamicContainers() && site.isUnderDynamicContainer()) {
			LOGGER.trace("Eliding indirection under dynamic container: {}", site);
			return false;
		}
		return true;
	}

	private static void checkOrder(Registry registry, List<String> order) {
		if (order.size() != registry.size() || !new HashSet<>(order).equals(registry.names())) {
			throw new IllegalArgumentException("Order " + order + " is not a permutation of the registry names " + registry.names());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LayoutResolver.class);
}
