package works.strata.analysis;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.exceptions.SchemaException;
import works.strata.exceptions.UndefinedTypeException;
import works.strata.schema.ContainerFormat;
import works.strata.schema.Format.TypeName;
import works.strata.schema.Registry;

/**
 * Finds which registry entries each definition refers to.
 * <p>
 * By definition, an entry {@code x} depends on {@code y} iff the container format of {@code x}
 * syntactically contains {@code TypeName(y)}, at any depth.
 * A definition that refers to itself depends on itself.
 */
public final class DependencyAnalyzer {
	private DependencyAnalyzer() { }

	/**
	 * @return every name referenced from {@code container}, in ascending order
	 * @throws SchemaException if {@code container} is malformed
	 */
	public static SortedSet<String> dependencies(ContainerFormat container) {
		var result = new TreeSet<String>();
		container.visit(format -> {
			if (format instanceof TypeName t) {
				result.add(t.name());
			}
		});
		return Collections.unmodifiableSortedSet(result);
	}

	/**
	 * @return the dependencies of every entry of {@code registry}, keyed by name in ascending order
	 * @throws SchemaException attributed to the offending definition
	 * if any definition is malformed or refers to a name that isn't in the registry
	 */
	public static SortedMap<String, SortedSet<String>> dependencyMap(Registry registry) {
		var result = new TreeMap<String, SortedSet<String>>();
		registry.forEach((name, container) -> {
			SortedSet<String> deps;
			try {
				deps = dependencies(container);
				for (String dep : deps) {
					if (!registry.contains(dep)) {
						throw new UndefinedTypeException(dep);
					}
				}
			} catch (SchemaException e) {
				throw SchemaException.wrap(e, name);
			}
			LOGGER.trace("{} depends on {}", name, deps);
			result.put(name, deps);
		});
		return Collections.unmodifiableSortedMap(result);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DependencyAnalyzer.class);
}
