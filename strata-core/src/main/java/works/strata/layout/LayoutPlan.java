package works.strata.layout;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import works.strata.CompilerSettings;
import works.strata.schema.Registry;

/**
 * The complete output of compiling one {@link Registry}:
 * an emission order, and for each definition, which of its references
 * need an indirection and which names need forward declarations.
 * <p>
 * Immutable. Backends consume it via {@link #replay} or by direct lookup.
 */
public final class LayoutPlan {
	private final Registry registry;
	private final CompilerSettings settings;
	private final SortedMap<String, SortedSet<String>> dependencyMap;
	private final Map<String, DefinitionLayout> definitions;
	private final Set<String> knownSizes;

	LayoutPlan(
		Registry registry,
		CompilerSettings settings,
		SortedMap<String, SortedSet<String>> dependencyMap,
		List<DefinitionLayout> definitions,
		Set<String> knownSizes
	) {
		this.registry = registry;
		this.settings = settings;
		this.dependencyMap = dependencyMap;
		var map = new LinkedHashMap<String, DefinitionLayout>();
		definitions.forEach(d -> map.put(d.name(), d));
		this.definitions = map;
		this.knownSizes = Set.copyOf(knownSizes);
	}

	public Registry registry() {
		return registry;
	}

	public CompilerSettings settings() {
		return settings;
	}

	public SortedMap<String, SortedSet<String>> dependencyMap() {
		return dependencyMap;
	}

	/**
	 * @return definitions in emission order
	 */
	public List<DefinitionLayout> definitions() {
		return List.copyOf(definitions.values());
	}

	/**
	 * @return definition names in emission order
	 */
	public List<String> order() {
		return List.copyOf(definitions.keySet());
	}

	/**
	 * @throws IllegalArgumentException if there's no such definition
	 */
	public DefinitionLayout definition(String name) {
		var result = definitions.get(name);
		if (result == null) {
			throw new IllegalArgumentException("No definition named \"" + name + "\"");
		}
		return result;
	}

	/**
	 * @return the names whose representation was fixed by the end of the pass;
	 * this is always every definition in the registry
	 */
	public Set<String> knownSizes() {
		return knownSizes;
	}

	public boolean requiresIndirection(String definition, List<PathStep> path) {
		return definition(definition).isIndirect(path);
	}

	public int indirectionCount() {
		return definitions.values().stream()
			.mapToInt(d -> d.indirectReferences().size())
			.sum();
	}

	/**
	 * Drives {@code consumer} through the plan in emission order.
	 */
	public void replay(LayoutConsumer consumer) {
		consumer.begin(this);
		for (DefinitionLayout layout : definitions.values()) {
			layout.forwardDeclarations().forEach(consumer::forwardDeclaration);
			consumer.definition(layout);
		}
		consumer.end();
	}

	@Override
	public String toString() {
		return "LayoutPlan" + order();
	}
}
