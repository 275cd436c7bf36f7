package works.strata.schema;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;
import works.strata.exceptions.VariantIndexException;

import static java.util.Objects.requireNonNull;

/**
 * The top-level shape of one named entry of a {@link Registry}.
 */
public sealed interface ContainerFormat {
	/**
	 * Visits every {@link Format} reachable from this container, in declaration order,
	 * each one in post-order.
	 *
	 * @throws works.strata.exceptions.SchemaException if the container is malformed
	 */
	void visit(Consumer<? super Format> visitor);

	record UnitStruct() implements ContainerFormat {
		@Override
		public void visit(Consumer<? super Format> visitor) { }
	}

	record NewTypeStruct(Format format) implements ContainerFormat {
		public NewTypeStruct {
			requireNonNull(format);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			format.visit(visitor);
		}
	}

	record TupleStruct(List<Format> formats) implements ContainerFormat {
		public TupleStruct {
			formats = List.copyOf(formats);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			formats.forEach(f -> f.visit(visitor));
		}
	}

	record Struct(List<Named<Format>> fields) implements ContainerFormat {
		public Struct {
			fields = List.copyOf(fields);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			fields.forEach(f -> f.value().visit(visitor));
		}
	}

	/**
	 * Variants keyed by their wire index.
	 * <p>
	 * Well-formed enumerations use the dense indices {@code 0..n-1}.
	 * That isn't checked here, because producers may build the map incrementally;
	 * it's checked by {@link #checkVariantIndices()}, which every traversal calls.
	 */
	record Enumeration(SortedMap<Integer, Named<VariantFormat>> variants) implements ContainerFormat {
		public Enumeration {
			variants = Collections.unmodifiableSortedMap(new TreeMap<>(variants));
		}

		public static Enumeration of(List<Named<VariantFormat>> variants) {
			var map = new TreeMap<Integer, Named<VariantFormat>>();
			for (int i = 0; i < variants.size(); i++) {
				map.put(i, variants.get(i));
			}
			return new Enumeration(map);
		}

		/**
		 * @throws VariantIndexException if the indices are not exactly {@code 0..n-1}
		 */
		public void checkVariantIndices() {
			int expected = 0;
			for (Integer index : variants.keySet()) {
				if (index != expected) {
					throw new VariantIndexException("Expected variant index " + expected + " but found " + index);
				}
				expected++;
			}
		}

		/**
		 * @throws IllegalArgumentException if there's no such variant
		 */
		public Named<VariantFormat> variant(int index) {
			var result = variants.get(index);
			if (result == null) {
				throw new IllegalArgumentException("No variant with index " + index);
			}
			return result;
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			checkVariantIndices();
			for (Map.Entry<Integer, Named<VariantFormat>> entry : variants.entrySet()) {
				entry.getValue().value().visit(visitor);
			}
		}
	}
}
