package works.strata.schema;

import java.util.List;
import java.util.function.Consumer;
import works.strata.exceptions.UnresolvedFormatException;

import static java.util.Objects.requireNonNull;

/**
 * The payload shape of one enum variant.
 */
public sealed interface VariantFormat {
	/**
	 * Visits every {@link Format} reachable from this variant.
	 *
	 * @throws UnresolvedFormatException if the variant, or any format within it, is unresolved
	 */
	void visit(Consumer<? super Format> visitor);

	record Unit() implements VariantFormat {
		@Override
		public void visit(Consumer<? super Format> visitor) { }
	}

	record NewType(Format format) implements VariantFormat {
		public NewType {
			requireNonNull(format);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			format.visit(visitor);
		}
	}

	record Tuple(List<Format> formats) implements VariantFormat {
		public Tuple {
			formats = List.copyOf(formats);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			formats.forEach(f -> f.visit(visitor));
		}
	}

	record Struct(List<Named<Format>> fields) implements VariantFormat {
		public Struct {
			fields = List.copyOf(fields);
		}

		@Override
		public void visit(Consumer<? super Format> visitor) {
			fields.forEach(f -> f.value().visit(visitor));
		}
	}

	record Unresolved() implements VariantFormat {
		@Override
		public void visit(Consumer<? super Format> visitor) {
			throw new UnresolvedFormatException("Unresolved variant placeholder");
		}
	}
}
