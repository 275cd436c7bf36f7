package works.strata.codec;

import java.util.List;

/**
 * The value of a struct, tuple struct, newtype struct, or unit struct:
 * its fields in declaration order.
 */
public record StructValue(List<Object> fields) {
	public StructValue {
		fields = List.copyOf(fields);
	}

	public static StructValue of(Object... fields) {
		return new StructValue(List.of(fields));
	}
}
