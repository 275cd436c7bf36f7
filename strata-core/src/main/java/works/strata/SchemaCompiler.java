package works.strata;

import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.analysis.DependencyAnalyzer;
import works.strata.analysis.TopologicalSorter;
import works.strata.exceptions.SchemaException;
import works.strata.layout.LayoutPlan;
import works.strata.layout.LayoutResolver;
import works.strata.schema.Registry;

/**
 * Compiles a {@link Registry} into a {@link LayoutPlan}:
 * analyzes dependencies, orders the definitions,
 * and decides where indirection is needed.
 * <p>
 * Compilation is a pure function of the registry and the settings.
 * A compiler holds no state between calls, so one instance can compile
 * any number of registries, concurrently if desired.
 */
public final class SchemaCompiler {
	private final CompilerSettings settings;

	public SchemaCompiler(CompilerSettings settings) {
		this.settings = settings;
	}

	public SchemaCompiler() {
		this(CompilerSettings.DEFAULT);
	}

	public CompilerSettings settings() {
		return settings;
	}

	/**
	 * @throws SchemaException if the registry is malformed;
	 * in that case nothing is produced
	 */
	public LayoutPlan compile(Registry registry) {
		LOGGER.debug("Compiling {} definitions with {}", registry.size(), settings);
		SortedMap<String, SortedSet<String>> dependencyMap = DependencyAnalyzer.dependencyMap(registry);
		List<String> order = TopologicalSorter.sort(dependencyMap);
		LOGGER.debug("Emission order: {}", order);
		LayoutPlan plan = new LayoutResolver(settings).resolve(registry, order, dependencyMap);
		if (LOGGER.isInfoEnabled()) {
			LOGGER.info("Compiled {} definitions; {} indirect references", registry.size(), plan.indirectionCount());
		}
		return plan;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaCompiler.class);
}
