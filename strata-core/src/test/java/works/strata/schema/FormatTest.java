package works.strata.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import works.strata.exceptions.UnresolvedFormatException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.strata.schema.Format.Primitive.STR;
import static works.strata.schema.Format.Primitive.U16;
import static works.strata.schema.Format.Primitive.U32;
import static works.strata.schema.Format.Primitive.U8;
import static works.strata.schema.Format.array;
import static works.strata.schema.Format.map;
import static works.strata.schema.Format.option;
import static works.strata.schema.Format.seq;
import static works.strata.schema.Format.tuple;
import static works.strata.schema.Format.typeName;

class FormatTest {

	@Test
	void visitIsPostOrder() {
		var format = map(STR, seq(typeName("Foo")));
		List<Format> visited = new ArrayList<>();
		format.visit(visited::add);
		assertEquals(List.of(
			STR,
			typeName("Foo"),
			seq(typeName("Foo")),
			format
		), visited);
	}

	@Test
	void containerVisitFindsNestedNames() {
		var container = ContainerFormat.Enumeration.of(List.of(
			Named.of("foo", new VariantFormat.Tuple(List.of(
				typeName("foo"),
				typeName("bar"),
				seq(typeName("foo"))
			)))
		));
		Set<String> names = new HashSet<>();
		container.visit(f -> {
			if (f instanceof Format.TypeName t) {
				names.add(t.name());
			}
		});
		assertEquals(Set.of("foo", "bar"), names);
	}

	@Test
	void unresolvedFailsTraversal() {
		assertThrows(UnresolvedFormatException.class, () ->
			new Format.Unresolved().visit(f -> { }));
		assertThrows(UnresolvedFormatException.class, () ->
			option(new Format.Unresolved()).visit(f -> { }));
		assertThrows(UnresolvedFormatException.class, () ->
			new VariantFormat.Unresolved().visit(f -> { }));
		assertThrows(UnresolvedFormatException.class, () ->
			new ContainerFormat.NewTypeStruct(seq(new Format.Unresolved())).visit(f -> { }));
	}

	@ParameterizedTest
	@EnumSource(Format.Primitive.class)
	void primitiveMangledNames(Format.Primitive primitive) {
		assertEquals(primitive.name().toLowerCase(), primitive.mangledName());
	}

	@Test
	void compositeMangledNames() {
		assertEquals("option_str", option(STR).mangledName());
		assertEquals("vector_Foo", seq(typeName("Foo")).mangledName());
		assertEquals("map_str_to_u32", map(STR, U32).mangledName());
		assertEquals("tuple2_u8_u16", tuple(U8, U16).mangledName());
		assertEquals("array3_u32_array", array(U32, 3).mangledName());
		assertEquals("map_tuple2_array2_u32_array_array4_u8_array_to_unit",
			map(tuple(array(U32, 2), array(U8, 4)), Format.Primitive.UNIT).mangledName());
	}

	@Test
	void negativeArraySize() {
		assertThrows(IllegalArgumentException.class, () -> array(U8, -1));
	}
}
