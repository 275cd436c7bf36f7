package works.strata.codec.interpreter;

import java.util.List;
import works.strata.exceptions.UnresolvedFormatException;
import works.strata.schema.ContainerFormat;
import works.strata.schema.Format;
import works.strata.schema.Named;
import works.strata.schema.VariantFormat;

/**
 * The field formats of each kind of container and variant, in declaration order.
 * Field names don't appear in the encoding, so that's all the interpreters need.
 */
final class Shapes {
	private Shapes() { }

	static List<Format> fieldFormats(ContainerFormat container) {
		if (container instanceof ContainerFormat.UnitStruct) {
			return List.of();
		} else if (container instanceof ContainerFormat.NewTypeStruct c) {
			return List.of(c.format());
		} else if (container instanceof ContainerFormat.TupleStruct c) {
			return c.formats();
		} else if (container instanceof ContainerFormat.Struct c) {
			return values(c.fields());
		} else {
			throw new IllegalArgumentException("Enumerations have no fields of their own: " + container);
		}
	}

	static List<Format> fieldFormats(VariantFormat variant) {
		if (variant instanceof VariantFormat.Unit) {
			return List.of();
		} else if (variant instanceof VariantFormat.NewType v) {
			return List.of(v.format());
		} else if (variant instanceof VariantFormat.Tuple v) {
			return v.formats();
		} else if (variant instanceof VariantFormat.Struct v) {
			return values(v.fields());
		} else if (variant instanceof VariantFormat.Unresolved) {
			throw new UnresolvedFormatException("Unresolved variant placeholder");
		} else {
			throw new AssertionError("Unexpected variant: " + variant);
		}
	}

	private static List<Format> values(List<Named<Format>> fields) {
		return fields.stream().map(Named::value).toList();
	}
}
