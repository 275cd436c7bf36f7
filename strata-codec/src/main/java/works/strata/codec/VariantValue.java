package works.strata.codec;

import java.util.List;

/**
 * The value of an enum: the index of its variant and the variant's fields in declaration order.
 * A unit variant has no fields, and a newtype variant has one.
 */
public record VariantValue(int index, List<Object> fields) {
	public VariantValue {
		fields = List.copyOf(fields);
	}

	public static VariantValue of(int index, Object... fields) {
		return new VariantValue(index, List.of(fields));
	}
}
