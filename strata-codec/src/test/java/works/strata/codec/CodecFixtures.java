package works.strata.codec;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.strata.SchemaCompiler;
import works.strata.layout.LayoutPlan;
import works.strata.schema.ContainerFormat;
import works.strata.schema.ContainerFormat.Enumeration;
import works.strata.schema.ContainerFormat.Struct;
import works.strata.schema.Named;
import works.strata.schema.Registry;
import works.strata.schema.VariantFormat;

import static works.strata.schema.Format.Primitive.BOOL;
import static works.strata.schema.Format.Primitive.BYTES;
import static works.strata.schema.Format.Primitive.F32;
import static works.strata.schema.Format.Primitive.F64;
import static works.strata.schema.Format.Primitive.I128;
import static works.strata.schema.Format.Primitive.I16;
import static works.strata.schema.Format.Primitive.STR;
import static works.strata.schema.Format.Primitive.U128;
import static works.strata.schema.Format.Primitive.U16;
import static works.strata.schema.Format.Primitive.U32;
import static works.strata.schema.Format.Primitive.U64;
import static works.strata.schema.Format.Primitive.U8;
import static works.strata.schema.Format.Primitive.UNIT;
import static works.strata.schema.Format.array;
import static works.strata.schema.Format.map;
import static works.strata.schema.Format.option;
import static works.strata.schema.Format.seq;
import static works.strata.schema.Format.tuple;
import static works.strata.schema.Format.typeName;

/**
 * A registry with one of everything the codecs support, and some values of it.
 */
public final class CodecFixtures {
	private CodecFixtures() { }

	public static Registry registry() {
		return Registry.builder()
			.add("Color", Enumeration.of(List.of(
				Named.of("Red", new VariantFormat.Unit()),
				Named.of("Rgb", new VariantFormat.Tuple(List.of(U8, U8, U8))),
				Named.of("Named", new VariantFormat.NewType(STR)),
				Named.of("Custom", new VariantFormat.Struct(List.of(
					Named.of("name", STR),
					Named.of("alpha", option(U8))
				)))
			)))
			.add("Palette", new Struct(List.of(
				Named.of("colors", seq(typeName("Color"))),
				Named.of("index", map(STR, U32)),
				Named.of("tags", map(U64, UNIT)),
				Named.of("big", U128),
				Named.of("small", I128),
				Named.of("flags", array(BOOL, 2)),
				Named.of("pair", tuple(I16, U16)),
				Named.of("blob", BYTES),
				Named.of("nothing", typeName("Empty"))
			)))
			.add("Empty", new ContainerFormat.UnitStruct())
			.add("Node", new Struct(List.of(
				Named.of("value", U64),
				Named.of("next", option(typeName("Node")))
			)))
			.add("Tree", new Struct(List.of(
				Named.of("label", STR),
				Named.of("children", seq(typeName("Tree")))
			)))
			.add("Measure", new Struct(List.of(
				Named.of("single", F32),
				Named.of("double", F64)
			)))
			.build();
	}

	public static LayoutPlan plan() {
		return new SchemaCompiler().compile(registry());
	}

	public static Codec codec(Encoding encoding) {
		return CodecBuilder.using(plan()).encoding(encoding).build();
	}

	public static StructValue palette(Map<String, Integer> index) {
		var tags = new LinkedHashMap<Long, Unit>();
		tags.put(-1L, Unit.UNIT);
		tags.put(7L, Unit.UNIT);
		return StructValue.of(
			List.of(
				VariantValue.of(0),
				VariantValue.of(1, (byte) 1, (byte) 2, (byte) 0xFF),
				VariantValue.of(2, "ochre"),
				VariantValue.of(3, "glass", Optional.of((byte) 128)),
				VariantValue.of(3, "stone", Optional.empty())
			),
			index,
			tags,
			BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE),
			BigInteger.ONE.shiftLeft(127).negate(),
			List.of(true, false),
			List.of((short) -2, (short) 40000),
			Bytes.of((byte) 0, (byte) 0xAB, (byte) 0xFF),
			StructValue.of()
		);
	}

	public static StructValue palette() {
		var index = new LinkedHashMap<String, Integer>();
		index.put("zeta", 26);
		index.put("alpha", 1);
		index.put("", 0);
		index.put("été", 5);
		return palette(index);
	}

	/**
	 * @return {@code length} nodes linked through their {@code next} fields
	 */
	public static StructValue chain(int length) {
		Optional<Object> next = Optional.empty();
		for (int i = length; i >= 1; i--) {
			next = Optional.of(StructValue.of((long) i, next));
		}
		return (StructValue) next.orElseThrow();
	}

	public static StructValue tree(String label, StructValue... children) {
		return StructValue.of(label, List.of((Object[]) children));
	}
}
