package works.strata.layout;

import static java.util.Objects.requireNonNull;

/**
 * One step on the way from the root of a {@link works.strata.schema.ContainerFormat ContainerFormat}
 * down to a nested {@link works.strata.schema.Format Format}.
 */
public sealed interface PathStep {
	/**
	 * A named field of a struct or struct variant.
	 */
	record Field(String name) implements PathStep {
		public Field {
			requireNonNull(name);
		}

		@Override
		public String toString() {
			return "." + name;
		}
	}

	/**
	 * A slot of a tuple, tuple struct, or tuple variant.
	 */
	record Position(int index) implements PathStep {
		@Override
		public String toString() {
			return "#" + index;
		}
	}

	record Variant(int index, String name) implements PathStep {
		public Variant {
			requireNonNull(name);
		}

		@Override
		public String toString() {
			return "::" + name + "(" + index + ")";
		}
	}

	/**
	 * Steps into the single content of a wrapper.
	 */
	enum Wrapper implements PathStep {
		NEWTYPE, OPTION, SEQ, MAP_KEY, MAP_VALUE, ARRAY;

		/**
		 * @return true for wrappers whose content is stored apart from the enclosing value
		 * in every reasonable target representation
		 */
		public boolean isDynamicallySized() {
			return this == SEQ || this == MAP_KEY || this == MAP_VALUE;
		}

		@Override
		public String toString() {
			return "/" + name().toLowerCase();
		}
	}
}
