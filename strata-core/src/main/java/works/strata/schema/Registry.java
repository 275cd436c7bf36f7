package works.strata.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * An ordered collection of named type definitions forming one schema.
 * <p>
 * Built once by whoever extracts the schema, and immutable thereafter.
 * The compiler only ever derives auxiliary structures from it.
 */
public final class Registry {
	private final Map<String, ContainerFormat> entries;

	private Registry(Map<String, ContainerFormat> entries) {
		this.entries = Collections.unmodifiableMap(entries);
	}

	public static Registry of(Map<String, ContainerFormat> entries) {
		var builder = builder();
		entries.forEach(builder::add);
		return builder.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @throws IllegalArgumentException if there's no definition with the given name
	 */
	public ContainerFormat get(String name) {
		var result = entries.get(name);
		if (result == null) {
			throw new IllegalArgumentException("No definition named \"" + name + "\"");
		}
		return result;
	}

	public boolean contains(String name) {
		return entries.containsKey(name);
	}

	/**
	 * @return the definition names, in registry order
	 */
	public Set<String> names() {
		return entries.keySet();
	}

	public Map<String, ContainerFormat> asMap() {
		return entries;
	}

	public int size() {
		return entries.size();
	}

	public void forEach(BiConsumer<String, ContainerFormat> action) {
		entries.forEach(action);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Registry other && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.entrySet().stream()
			.map(e -> e.getKey() + " = " + e.getValue())
			.collect(joining(",\n\t", "Registry{\n\t", "\n}"));
	}

	public static final class Builder {
		private final Map<String, ContainerFormat> entries = new LinkedHashMap<>();

		private Builder() { }

		/**
		 * @throws IllegalArgumentException if {@code name} is already defined
		 */
		public Builder add(String name, ContainerFormat format) {
			requireNonNull(name);
			requireNonNull(format);
			if (entries.putIfAbsent(name, format) != null) {
				throw new IllegalArgumentException("Duplicate definition \"" + name + "\"");
			}
			return this;
		}

		public Registry build() {
			return new Registry(new LinkedHashMap<>(entries));
		}
	}
}
