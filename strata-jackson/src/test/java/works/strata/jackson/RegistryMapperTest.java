package works.strata.jackson;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.databind.JsonNode;
import tools.jackson.dataformat.yaml.YAMLMapper;
import works.strata.SchemaCompiler;
import works.strata.exceptions.UnresolvedFormatException;
import works.strata.exceptions.VariantIndexException;
import works.strata.schema.ContainerFormat.Enumeration;
import works.strata.schema.ContainerFormat.NewTypeStruct;
import works.strata.schema.ContainerFormat.Struct;
import works.strata.schema.ContainerFormat.TupleStruct;
import works.strata.schema.ContainerFormat.UnitStruct;
import works.strata.schema.Format;
import works.strata.schema.Named;
import works.strata.schema.Registry;
import works.strata.schema.VariantFormat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
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

class RegistryMapperTest {
	RegistryMapper mapper;

	@BeforeEach
	void setup() {
		mapper = new RegistryMapper();
	}

	@Test
	void readSerdeData() throws IOException {
		Registry registry = readResource();

		assertEquals(11, registry.size());
		assertEquals("CStyleEnum", registry.names().iterator().next(), "Document order is kept");
		assertEquals(new NewTypeStruct(U64), registry.get("NewTypeStruct"));
		assertEquals(new NewTypeStruct(option(typeName("SimpleList"))), registry.get("SimpleList"));
		assertEquals(new TupleStruct(List.of(U32, U64)), registry.get("TupleStruct"));
		assertEquals(new UnitStruct(), registry.get("UnitStruct"));
		assertEquals(new Struct(List.of(
			Named.of("value", typeName("SerdeData")),
			Named.of("children", seq(typeName("Tree")))
		)), registry.get("Tree"));

		var serdeData = assertInstanceOf(Enumeration.class, registry.get("SerdeData"));
		assertEquals(13, serdeData.variants().size());
		assertEquals(Named.of("UnitVariant", new VariantFormat.Unit()), serdeData.variant(2));
		assertEquals(Named.of("TupleArray", new VariantFormat.NewType(array(U32, 3))), serdeData.variant(8));
		assertEquals(
			new VariantFormat.NewType(map(tuple(array(U32, 2), array(U8, 4)), UNIT)),
			serdeData.variant(11).value());
	}

	@Test
	void compileSerdeData() throws IOException {
		var plan = new SchemaCompiler().compile(readResource());
		assertEquals(List.of(
			"CStyleEnum",
			"List",
			"NewTypeStruct",
			"Struct",
			"OtherTypes",
			"PrimitiveTypes",
			"SimpleList",
			"Tree",
			"TupleStruct",
			"UnitStruct",
			"SerdeData"
		), plan.order());
		assertEquals(5, plan.indirectionCount());
	}

	@Test
	void writeMatchesDocument() throws IOException {
		JsonNode expected;
		try (InputStream in = resource()) {
			expected = YAMLMapper.builder().build().readTree(in);
		}
		assertEquals(expected, mapper.write(readResource()));
	}

	@Test
	void yamlRoundTrip() throws IOException {
		Registry registry = readResource();
		assertEquals(registry, mapper.fromYaml(mapper.toYaml(registry)));
	}

	@Test
	void jsonRoundTrip() throws IOException {
		Registry registry = readResource();
		String json = mapper.toJson(registry);
		assertTrue(json.contains("\"NEWTYPESTRUCT\""), json);
		assertEquals(registry, mapper.fromJson(json));
	}

	@Test
	void writtenInNameOrder() {
		var registry = Registry.builder()
			.add("b", new UnitStruct())
			.add("a", new UnitStruct())
			.build();
		assertEquals("{\"a\":\"UNITSTRUCT\",\"b\":\"UNITSTRUCT\"}", mapper.write(registry).toString());
	}

	@Test
	void alternateContainerSpellings() {
		var registry = mapper.fromYaml("""
			Unit: UNIT
			NewType:
			  NEWTYPE: STR
			Tuple:
			  TUPLE:
			    - BOOL
			    - BYTES
			""");
		assertEquals(new UnitStruct(), registry.get("Unit"));
		assertEquals(new NewTypeStruct(Format.Primitive.STR), registry.get("NewType"));
		assertEquals(new TupleStruct(List.of(Format.Primitive.BOOL, Format.Primitive.BYTES)), registry.get("Tuple"));

		String written = mapper.toJson(registry);
		assertTrue(written.contains("UNITSTRUCT") && written.contains("NEWTYPESTRUCT") && written.contains("TUPLESTRUCT"), written);
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"Bad: STRUCTURE",
		"Bad: { NEWTYPESTRUCT: U65 }",
		"Bad: { NEWTYPESTRUCT: { OPTION: U8, SEQ: U8 } }",
		"Bad: { NEWTYPESTRUCT: { MAP: { KEY: U8 } } }",
		"Bad: { NEWTYPESTRUCT: { TUPLEARRAY: { CONTENT: U8, SIZE: -1 } } }",
		"Bad: { NEWTYPESTRUCT: { TUPLEARRAY: { CONTENT: U8, SIZE: many } } }",
		"Bad: { NEWTYPESTRUCT: { TYPENAME: [ x ] } }",
		"Bad: { TUPLESTRUCT: U8 }",
		"Bad: { STRUCT: { x: U8 } }",
		"Bad: { ENUM: { zero: { A: UNIT } } }",
		"Bad: { ENUM: { 0: { A: NOTHING } } }",
		"Bad: { ENUM: { 0: { A: UNIT, B: UNIT } } }",
	})
	void malformedDefinition(String document) {
		var e = assertThrows(RegistryDocumentException.class, () -> mapper.fromYaml("Good: UNITSTRUCT\n" + document));
		assertEquals("Bad", e.definitionName());
		assertTrue(e.getMessage().contains("Bad"), e.getMessage());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{\"0\": {\"A\": \"UNIT\"}, \"00\": {\"B\": \"UNIT\"}}",
		"{\"0\": {\"A\": \"UNIT\"}, \"+1\": {\"B\": \"UNIT\"}}",
		"{\"0\": {\"A\": \"UNIT\"}, \" 1\": {\"B\": \"UNIT\"}}",
	})
	void variantIndicesMustBeCanonicalAndDistinct(String variants) {
		var e = assertThrows(RegistryDocumentException.class, () -> mapper.fromJson("{\"Bad\": {\"ENUM\": " + variants + "}}"));
		assertEquals("Bad", e.definitionName());
	}

	@Test
	void duplicateKeysAreRejected() {
		assertThrows(RegistryDocumentException.class, () -> mapper.fromJson(
			"{\"E\": {\"ENUM\": {\"0\": {\"A\": \"UNIT\"}, \"0\": {\"B\": \"UNIT\"}}}}"));
		assertThrows(RegistryDocumentException.class, () -> mapper.fromYaml("""
			E: UNITSTRUCT
			E:
			  NEWTYPESTRUCT: U8
			"""));
	}

	@ParameterizedTest
	@ValueSource(strings = { "[]", "UNITSTRUCT", "{ unclosed" })
	void malformedDocument(String document) {
		var e = assertThrows(RegistryDocumentException.class, () -> mapper.fromJson(document));
		assertNull(e.definitionName());
	}

	@Test
	void sparseEnumIsReadButNotCompiled() {
		var registry = mapper.fromYaml("""
			Sparse:
			  ENUM:
			    0:
			      A: UNIT
			    2:
			      C: UNIT
			""");
		var e = assertThrows(VariantIndexException.class, () -> new SchemaCompiler().compile(registry));
		assertEquals("Sparse", e.definitionName());
	}

	@Test
	void unresolvedCannotBeWritten() {
		var registry = Registry.builder()
			.add("Incomplete", new NewTypeStruct(new Format.Unresolved()))
			.build();
		assertThrows(UnresolvedFormatException.class, () -> mapper.write(registry));
	}

	private Registry readResource() throws IOException {
		try (InputStream in = resource()) {
			return mapper.fromYaml(in);
		}
	}

	private InputStream resource() {
		return getClass().getResourceAsStream("/serde-data.yaml");
	}
}
