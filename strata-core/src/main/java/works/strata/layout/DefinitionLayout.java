package works.strata.layout;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import works.strata.schema.ContainerFormat;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * The layout decisions for one definition.
 *
 * @param forwardDeclarations names that must be declared, in this order,
 *                            before this definition is emitted
 * @param references every reference site in the definition, in declaration order
 * @param indirectReferences the sites that must be stored behind an indirection,
 *                           in declaration order; all others can be stored by value
 */
public record DefinitionLayout(
	String name,
	ContainerFormat container,
	List<String> forwardDeclarations,
	List<ReferenceSite> references,
	Set<ReferenceSite> indirectReferences
) {
	public DefinitionLayout {
		requireNonNull(name);
		requireNonNull(container);
		forwardDeclarations = List.copyOf(forwardDeclarations);
		references = List.copyOf(references);
		indirectReferences = unmodifiableSet(new LinkedHashSet<>(indirectReferences));
		assert references.containsAll(indirectReferences);
	}

	/**
	 * @throws IllegalArgumentException if there's no reference at {@code path}
	 */
	public boolean isIndirect(List<PathStep> path) {
		for (ReferenceSite site : references) {
			if (site.path().equals(path)) {
				return indirectReferences.contains(site);
			}
		}
		throw new IllegalArgumentException("No reference at " + path + " in " + name);
	}

	public boolean isIndirect(ReferenceSite site) {
		if (!references.contains(site)) {
			throw new IllegalArgumentException("No such reference in " + name + ": " + site);
		}
		return indirectReferences.contains(site);
	}

	public boolean hasIndirection() {
		return !indirectReferences.isEmpty();
	}
}
