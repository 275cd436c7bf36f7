package works.strata.layout;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A single occurrence of {@link works.strata.schema.Format.TypeName TypeName}
 * inside the definition named {@code definition}.
 * <p>
 * Indirection is decided per site, not per referenced type,
 * so a definition may refer to the same type both by value and indirectly.
 */
public record ReferenceSite(
	String definition,
	List<PathStep> path,
	String target
) {
	public ReferenceSite {
		requireNonNull(definition);
		path = List.copyOf(path);
		requireNonNull(target);
	}

	public boolean isSelfReference() {
		return definition.equals(target);
	}

	/**
	 * @return true if some step on the path is a sequence or map,
	 * whose content is sized dynamically
	 */
	public boolean isUnderDynamicContainer() {
		return path.stream().anyMatch(step ->
			step instanceof PathStep.Wrapper w && w.isDynamicallySized());
	}

	@Override
	public String toString() {
		return definition + path.stream().map(Object::toString).collect(joining()) + " -> " + target;
	}
}
