package works.strata;

import java.util.List;
import works.strata.schema.ContainerFormat;
import works.strata.schema.ContainerFormat.Enumeration;
import works.strata.schema.ContainerFormat.NewTypeStruct;
import works.strata.schema.ContainerFormat.Struct;
import works.strata.schema.ContainerFormat.TupleStruct;
import works.strata.schema.ContainerFormat.UnitStruct;
import works.strata.schema.Format;
import works.strata.schema.Named;
import works.strata.schema.Registry;
import works.strata.schema.VariantFormat;

import static works.strata.schema.Format.Primitive.BOOL;
import static works.strata.schema.Format.Primitive.BYTES;
import static works.strata.schema.Format.Primitive.CHAR;
import static works.strata.schema.Format.Primitive.F32;
import static works.strata.schema.Format.Primitive.F64;
import static works.strata.schema.Format.Primitive.I128;
import static works.strata.schema.Format.Primitive.I16;
import static works.strata.schema.Format.Primitive.I32;
import static works.strata.schema.Format.Primitive.I64;
import static works.strata.schema.Format.Primitive.I8;
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
 * Registries shared by the tests.
 */
public final class SampleRegistries {
	private SampleRegistries() { }

	/**
	 * A schema exercising every shape, including a self-recursive type
	 * and two types that are mutually recursive with {@code SerdeData}.
	 */
	public static Registry serdeData() {
		return Registry.builder()
			.add("List", Enumeration.of(List.of(
				Named.of("Empty", new VariantFormat.Unit()),
				Named.of("Node", new VariantFormat.Tuple(List.of(typeName("SerdeData"), typeName("List"))))
			)))
			.add("NewTypeStruct", new NewTypeStruct(U64))
			.add("OtherTypes", struct(
				field("f_string", STR),
				field("f_bytes", BYTES),
				field("f_option", option(typeName("Struct"))),
				field("f_unit", UNIT),
				field("f_seq", seq(typeName("Struct"))),
				field("f_tuple", tuple(U8, U16)),
				field("f_stringmap", map(STR, U32)),
				field("f_intset", map(U64, UNIT))
			))
			.add("PrimitiveTypes", struct(
				field("f_bool", BOOL),
				field("f_u8", U8),
				field("f_u16", U16),
				field("f_u32", U32),
				field("f_u64", U64),
				field("f_u128", U128),
				field("f_i8", I8),
				field("f_i16", I16),
				field("f_i32", I32),
				field("f_i64", I64),
				field("f_i128", I128),
				field("f_f32", option(F32)),
				field("f_f64", option(F64)),
				field("f_char", option(CHAR))
			))
			.add("SerdeData", Enumeration.of(List.of(
				Named.of("PrimitiveTypes", new VariantFormat.NewType(typeName("PrimitiveTypes"))),
				Named.of("OtherTypes", new VariantFormat.NewType(typeName("OtherTypes"))),
				Named.of("UnitVariant", new VariantFormat.Unit()),
				Named.of("NewTypeVariant", new VariantFormat.NewType(STR)),
				Named.of("TupleVariant", new VariantFormat.Tuple(List.of(U32, U64))),
				Named.of("StructVariant", new VariantFormat.Struct(List.of(
					field("f0", typeName("UnitStruct")),
					field("f1", typeName("NewTypeStruct")),
					field("f2", typeName("TupleStruct")),
					field("f3", typeName("Struct"))
				))),
				Named.of("ListWithMutualRecursion", new VariantFormat.NewType(typeName("List"))),
				Named.of("TreeWithMutualRecursion", new VariantFormat.NewType(typeName("Tree"))),
				Named.of("TupleArray", new VariantFormat.NewType(array(U32, 3))),
				Named.of("UnitVector", new VariantFormat.NewType(seq(UNIT))),
				Named.of("SimpleList", new VariantFormat.NewType(typeName("SimpleList"))),
				Named.of("ComplexMap", new VariantFormat.NewType(map(tuple(array(U32, 2), array(U8, 4)), UNIT)))
			)))
			.add("SimpleList", new NewTypeStruct(option(typeName("SimpleList"))))
			.add("Struct", struct(
				field("x", U32),
				field("y", U64)
			))
			.add("Tree", struct(
				field("value", typeName("SerdeData")),
				field("children", seq(typeName("Tree")))
			))
			.add("TupleStruct", new TupleStruct(List.of(U32, U64)))
			.add("UnitStruct", new UnitStruct())
			.build();
	}

	/**
	 * {@code Node { value: u64, next: Option<Node> }}
	 */
	public static Registry linkedList() {
		return Registry.builder()
			.add("Node", struct(
				field("value", U64),
				field("next", option(typeName("Node")))
			))
			.build();
	}

	/**
	 * Three definitions, each referring only to ones declared earlier in the alphabet.
	 */
	public static Registry acyclic() {
		return Registry.builder()
			.add("Point", struct(field("x", I32), field("y", I32)))
			.add("Segment", new TupleStruct(List.of(typeName("Point"), typeName("Point"))))
			.add("Shape", Enumeration.of(List.of(
				Named.of("Dot", new VariantFormat.NewType(typeName("Point"))),
				Named.of("Polyline", new VariantFormat.NewType(seq(typeName("Segment")))),
				Named.of("Labeled", new VariantFormat.Struct(List.of(
					field("label", STR),
					field("anchor", option(typeName("Point"))),
					field("lookup", map(STR, typeName("Segment")))
				)))
			)))
			.build();
	}

	@SafeVarargs
	public static ContainerFormat struct(Named<Format>... fields) {
		return new Struct(List.of(fields));
	}

	public static Named<Format> field(String name, Format format) {
		return Named.of(name, format);
	}
}
