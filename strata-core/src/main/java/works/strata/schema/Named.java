package works.strata.schema;

import static java.util.Objects.requireNonNull;

/**
 * A name paired with a value, used for struct fields and enum variants.
 * Wherever these appear in a list, the list order is the wire order.
 */
public record Named<T>(String name, T value) {
	public Named {
		requireNonNull(name);
		requireNonNull(value);
	}

	public static <T> Named<T> of(String name, T value) {
		return new Named<>(name, value);
	}

	@Override
	public String toString() {
		return name + ": " + value;
	}
}
