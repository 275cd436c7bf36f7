package works.strata.layout;

import java.util.ArrayList;
import java.util.List;
import works.strata.exceptions.UnresolvedFormatException;
import works.strata.schema.ContainerFormat;
import works.strata.schema.Format;
import works.strata.schema.Format.FixedArrayFormat;
import works.strata.schema.Format.MapFormat;
import works.strata.schema.Format.OptionFormat;
import works.strata.schema.Format.Primitive;
import works.strata.schema.Format.SeqFormat;
import works.strata.schema.Format.TupleFormat;
import works.strata.schema.Format.TypeName;
import works.strata.schema.Named;
import works.strata.schema.VariantFormat;

import static works.strata.layout.PathStep.Wrapper.ARRAY;
import static works.strata.layout.PathStep.Wrapper.MAP_KEY;
import static works.strata.layout.PathStep.Wrapper.MAP_VALUE;
import static works.strata.layout.PathStep.Wrapper.NEWTYPE;
import static works.strata.layout.PathStep.Wrapper.OPTION;
import static works.strata.layout.PathStep.Wrapper.SEQ;

/**
 * Lists every {@link ReferenceSite} of one definition, in declaration order.
 */
final class ReferenceCollector {
	private final String definition;
	private final List<ReferenceSite> sites = new ArrayList<>();
	private final List<PathStep> path = new ArrayList<>();

	private ReferenceCollector(String definition) {
		this.definition = definition;
	}

	static List<ReferenceSite> collect(String definition, ContainerFormat container) {
		var collector = new ReferenceCollector(definition);
		collector.walk(container);
		return List.copyOf(collector.sites);
	}

	private void walk(ContainerFormat container) {
		if (container instanceof ContainerFormat.UnitStruct) {
			return;
		} else if (container instanceof ContainerFormat.NewTypeStruct c) {
			walk(NEWTYPE, c.format());
		} else if (container instanceof ContainerFormat.TupleStruct c) {
			walkPositions(c.formats());
		} else if (container instanceof ContainerFormat.Struct c) {
			walkFields(c.fields());
		} else if (container instanceof ContainerFormat.Enumeration c) {
			c.checkVariantIndices();
			c.variants().forEach((index, variant) -> {
				path.add(new PathStep.Variant(index, variant.name()));
				walk(variant.value());
				path.remove(path.size() - 1);
			});
		} else {
			throw new AssertionError("Unexpected container: " + container);
		}
	}

	private void walk(VariantFormat variant) {
		if (variant instanceof VariantFormat.Unit) {
			return;
		} else if (variant instanceof VariantFormat.NewType v) {
			walk(NEWTYPE, v.format());
		} else if (variant instanceof VariantFormat.Tuple v) {
			walkPositions(v.formats());
		} else if (variant instanceof VariantFormat.Struct v) {
			walkFields(v.fields());
		} else if (variant instanceof VariantFormat.Unresolved) {
			throw new UnresolvedFormatException("Unresolved variant placeholder at " + path);
		} else {
			throw new AssertionError("Unexpected variant: " + variant);
		}
	}

	private void walk(Format format) {
		if (format instanceof TypeName t) {
			sites.add(new ReferenceSite(definition, path, t.name()));
		} else if (format instanceof Primitive) {
			return;
		} else if (format instanceof OptionFormat f) {
			walk(OPTION, f.content());
		} else if (format instanceof SeqFormat f) {
			walk(SEQ, f.content());
		} else if (format instanceof MapFormat f) {
			walk(MAP_KEY, f.key());
			walk(MAP_VALUE, f.value());
		} else if (format instanceof TupleFormat f) {
			walkPositions(f.formats());
		} else if (format instanceof FixedArrayFormat f) {
			walk(ARRAY, f.content());
		} else if (format instanceof Format.Unresolved) {
			throw new UnresolvedFormatException("Unresolved format placeholder at " + path);
		} else {
			throw new AssertionError("Unexpected format: " + format);
		}
	}

	private void walk(PathStep step, Format format) {
		path.add(step);
		walk(format);
		path.remove(path.size() - 1);
	}

	private void walkPositions(List<Format> formats) {
		for (int i = 0; i < formats.size(); i++) {
			walk(new PathStep.Position(i), formats.get(i));
		}
	}

	private void walkFields(List<Named<Format>> fields) {
		for (Named<Format> field : fields) {
			walk(new PathStep.Field(field.name()), field.value());
		}
	}
}
