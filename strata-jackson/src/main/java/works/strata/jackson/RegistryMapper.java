package works.strata.jackson;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;
import tools.jackson.dataformat.yaml.YAMLMapper;
import works.strata.exceptions.UnresolvedFormatException;
import works.strata.schema.ContainerFormat;
import works.strata.schema.ContainerFormat.Enumeration;
import works.strata.schema.ContainerFormat.NewTypeStruct;
import works.strata.schema.ContainerFormat.Struct;
import works.strata.schema.ContainerFormat.TupleStruct;
import works.strata.schema.ContainerFormat.UnitStruct;
import works.strata.schema.Format;
import works.strata.schema.Format.FixedArrayFormat;
import works.strata.schema.Format.MapFormat;
import works.strata.schema.Format.OptionFormat;
import works.strata.schema.Format.Primitive;
import works.strata.schema.Format.SeqFormat;
import works.strata.schema.Format.TupleFormat;
import works.strata.schema.Format.TypeName;
import works.strata.schema.Named;
import works.strata.schema.Registry;
import works.strata.schema.VariantFormat;

/**
 * Reads and writes {@link Registry} interchange documents in JSON or YAML.
 * <p>
 * A document maps each definition name to its container.
 * Scalars are written as upper-case tags ({@code U64}, {@code UNITSTRUCT}),
 * and everything else as an object with a single upper-case key:
 * <pre>
 * Node:
 *   STRUCT:
 *     - value: U64
 *     - next:
 *         OPTION:
 *           TYPENAME: Node
 * </pre>
 * Definitions are written in name order, and read in document order.
 * Duplicate keys are rejected.
 * For containers, the reader also accepts {@code UNIT}, {@code NEWTYPE} and {@code TUPLE}
 * in place of {@code UNITSTRUCT}, {@code NEWTYPESTRUCT} and {@code TUPLESTRUCT}.
 */
public final class RegistryMapper {
	private final ObjectMapper json;
	private final ObjectMapper yaml;

	public RegistryMapper() {
		this(
			JsonMapper.builder().enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY).build(),
			YAMLMapper.builder().enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY).build());
	}

	public RegistryMapper(ObjectMapper json, ObjectMapper yaml) {
		this.json = json;
		this.yaml = yaml;
	}

	/**
	 * @throws RegistryDocumentException if {@code document} is not a valid registry
	 */
	public Registry fromJson(String document) {
		return read(parse(json, document));
	}

	/**
	 * @throws RegistryDocumentException if {@code document} is not a valid registry
	 */
	public Registry fromYaml(String document) {
		return read(parse(yaml, document));
	}

	/**
	 * @throws RegistryDocumentException if {@code document} is not a valid registry
	 */
	public Registry fromYaml(InputStream document) {
		JsonNode tree;
		try {
			tree = yaml.readTree(document);
		} catch (JacksonException e) {
			throw new RegistryDocumentException("Unable to parse document: " + e.getOriginalMessage(), e);
		}
		return read(tree);
	}

	public String toJson(Registry registry) {
		return json.writerWithDefaultPrettyPrinter().writeValueAsString(write(registry));
	}

	public String toYaml(Registry registry) {
		return yaml.writeValueAsString(write(registry));
	}

	public Registry read(JsonNode document) {
		if (document == null || !document.isObject()) {
			throw new RegistryDocumentException("Registry document must be a mapping from names to definitions");
		}
		var builder = Registry.builder();
		for (Map.Entry<String, JsonNode> entry : document.properties()) {
			String name = entry.getKey();
			ContainerFormat container;
			try {
				container = readContainer(entry.getValue());
			} catch (RegistryDocumentException e) {
				throw RegistryDocumentException.wrap(e, name);
			}
			LOGGER.trace("Read {} = {}", name, container);
			builder.add(name, container);
		}
		Registry result = builder.build();
		LOGGER.debug("Read {} definitions", result.size());
		return result;
	}

	/**
	 * @throws UnresolvedFormatException if the registry contains placeholders
	 */
	public ObjectNode write(Registry registry) {
		ObjectNode result = json.createObjectNode();
		new TreeMap<>(registry.asMap()).forEach((name, container) ->
			result.set(name, writeContainer(container)));
		return result;
	}

	private static JsonNode parse(ObjectMapper mapper, String document) {
		try {
			return mapper.readTree(document);
		} catch (JacksonException e) {
			throw new RegistryDocumentException("Unable to parse document: " + e.getOriginalMessage(), e);
		}
	}

	//
	// Reading
	//

	private ContainerFormat readContainer(JsonNode node) {
		if (node instanceof StringNode s) {
			String tag = s.asString();
			if (tag.equals("UNITSTRUCT") || tag.equals("UNIT")) {
				return new UnitStruct();
			}
			throw new RegistryDocumentException("Unknown container tag: " + tag);
		}
		Map.Entry<String, JsonNode> tagged = singleEntry(node, "container");
		JsonNode content = tagged.getValue();
		return switch (tagged.getKey()) {
			case "NEWTYPESTRUCT", "NEWTYPE" -> new NewTypeStruct(readFormat(content));
			case "TUPLESTRUCT", "TUPLE" -> new TupleStruct(readFormats(content));
			case "STRUCT" -> new Struct(readFields(content));
			case "ENUM" -> new Enumeration(readVariants(content));
			default -> throw new RegistryDocumentException("Unknown container tag: " + tagged.getKey());
		};
	}

	private TreeMap<Integer, Named<VariantFormat>> readVariants(JsonNode node) {
		if (!node.isObject()) {
			throw new RegistryDocumentException("ENUM must map variant indices to variants");
		}
		var result = new TreeMap<Integer, Named<VariantFormat>>();
		for (Map.Entry<String, JsonNode> entry : node.properties()) {
			int index;
			try {
				index = Integer.parseInt(entry.getKey());
			} catch (NumberFormatException e) {
				throw new RegistryDocumentException("Variant index is not an integer: " + entry.getKey(), e);
			}
			if (!String.valueOf(index).equals(entry.getKey())) {
				throw new RegistryDocumentException("Variant index is not in canonical decimal form: " + entry.getKey());
			}
			Map.Entry<String, JsonNode> variant = singleEntry(entry.getValue(), "variant " + index);
			var previous = result.put(index, Named.of(variant.getKey(), readVariant(variant.getValue())));
			if (previous != null) {
				throw new RegistryDocumentException("Duplicate variant index " + index + ": " + previous.name() + " and " + variant.getKey());
			}
		}
		return result;
	}

	private VariantFormat readVariant(JsonNode node) {
		if (node instanceof StringNode s) {
			if (s.asString().equals("UNIT")) {
				return new VariantFormat.Unit();
			}
			throw new RegistryDocumentException("Unknown variant tag: " + s.asString());
		}
		Map.Entry<String, JsonNode> tagged = singleEntry(node, "variant");
		JsonNode content = tagged.getValue();
		return switch (tagged.getKey()) {
			case "NEWTYPE" -> new VariantFormat.NewType(readFormat(content));
			case "TUPLE" -> new VariantFormat.Tuple(readFormats(content));
			case "STRUCT" -> new VariantFormat.Struct(readFields(content));
			default -> throw new RegistryDocumentException("Unknown variant tag: " + tagged.getKey());
		};
	}

	private List<Named<Format>> readFields(JsonNode node) {
		if (!node.isArray()) {
			throw new RegistryDocumentException("STRUCT must be a list of fields");
		}
		List<Named<Format>> result = new ArrayList<>(node.size());
		for (int i = 0; i < node.size(); i++) {
			Map.Entry<String, JsonNode> field = singleEntry(node.get(i), "field " + i);
			result.add(Named.of(field.getKey(), readFormat(field.getValue())));
		}
		return result;
	}

	private List<Format> readFormats(JsonNode node) {
		if (!node.isArray()) {
			throw new RegistryDocumentException("Expected a list of formats but got " + node.getNodeType());
		}
		List<Format> result = new ArrayList<>(node.size());
		for (int i = 0; i < node.size(); i++) {
			result.add(readFormat(node.get(i)));
		}
		return result;
	}

	private Format readFormat(JsonNode node) {
		if (node instanceof StringNode s) {
			try {
				return Primitive.valueOf(s.asString());
			} catch (IllegalArgumentException e) {
				throw new RegistryDocumentException("Unknown primitive format: " + s.asString(), e);
			}
		}
		Map.Entry<String, JsonNode> tagged = singleEntry(node, "format");
		JsonNode content = tagged.getValue();
		switch (tagged.getKey()) {
			case "TYPENAME":
				if (content instanceof StringNode name) {
					return new TypeName(name.asString());
				}
				throw new RegistryDocumentException("TYPENAME must be a string");
			case "OPTION":
				return new OptionFormat(readFormat(content));
			case "SEQ":
				return new SeqFormat(readFormat(content));
			case "MAP":
				return new MapFormat(
					readFormat(requiredMember(content, "MAP", "KEY")),
					readFormat(requiredMember(content, "MAP", "VALUE")));
			case "TUPLE":
				return new TupleFormat(readFormats(content));
			case "TUPLEARRAY":
				JsonNode size = requiredMember(content, "TUPLEARRAY", "SIZE");
				if (!size.isIntegralNumber() || !size.canConvertToInt() || size.intValue() < 0) {
					throw new RegistryDocumentException("TUPLEARRAY SIZE must be a non-negative integer");
				}
				return new FixedArrayFormat(readFormat(requiredMember(content, "TUPLEARRAY", "CONTENT")), size.intValue());
			default:
				throw new RegistryDocumentException("Unknown format tag: " + tagged.getKey());
		}
	}

	private static Map.Entry<String, JsonNode> singleEntry(JsonNode node, String what) {
		if (node == null || !node.isObject() || node.size() != 1) {
			throw new RegistryDocumentException("Expected " + what + " to be a single-key mapping");
		}
		return node.properties().iterator().next();
	}

	private static JsonNode requiredMember(JsonNode node, String tag, String member) {
		JsonNode result = (node == null || !node.isObject()) ? null : node.get(member);
		if (result == null) {
			throw new RegistryDocumentException(tag + " requires " + member);
		}
		return result;
	}

	//
	// Writing
	//

	private JsonNode writeContainer(ContainerFormat container) {
		if (container instanceof UnitStruct) {
			return StringNode.valueOf("UNITSTRUCT");
		}
		ObjectNode result = json.createObjectNode();
		if (container instanceof NewTypeStruct c) {
			result.set("NEWTYPESTRUCT", writeFormat(c.format()));
		} else if (container instanceof TupleStruct c) {
			result.set("TUPLESTRUCT", writeFormats(c.formats()));
		} else if (container instanceof Struct c) {
			result.set("STRUCT", writeFields(c.fields()));
		} else if (container instanceof Enumeration c) {
			ObjectNode variants = result.putObject("ENUM");
			c.variants().forEach((index, variant) -> {
				ObjectNode named = variants.putObject(index.toString());
				named.set(variant.name(), writeVariant(variant.value()));
			});
		} else {
			throw new AssertionError("Unexpected container: " + container);
		}
		return result;
	}

	private JsonNode writeVariant(VariantFormat variant) {
		if (variant instanceof VariantFormat.Unit) {
			return StringNode.valueOf("UNIT");
		}
		ObjectNode result = json.createObjectNode();
		if (variant instanceof VariantFormat.NewType v) {
			result.set("NEWTYPE", writeFormat(v.format()));
		} else if (variant instanceof VariantFormat.Tuple v) {
			result.set("TUPLE", writeFormats(v.formats()));
		} else if (variant instanceof VariantFormat.Struct v) {
			result.set("STRUCT", writeFields(v.fields()));
		} else if (variant instanceof VariantFormat.Unresolved) {
			throw new UnresolvedFormatException("Unresolved variant placeholder");
		} else {
			throw new AssertionError("Unexpected variant: " + variant);
		}
		return result;
	}

	private ArrayNode writeFields(List<Named<Format>> fields) {
		ArrayNode result = json.createArrayNode();
		for (Named<Format> field : fields) {
			result.addObject().set(field.name(), writeFormat(field.value()));
		}
		return result;
	}

	private ArrayNode writeFormats(List<Format> formats) {
		ArrayNode result = json.createArrayNode();
		formats.forEach(f -> result.add(writeFormat(f)));
		return result;
	}

	private JsonNode writeFormat(Format format) {
		if (format instanceof Primitive p) {
			return StringNode.valueOf(p.name());
		}
		ObjectNode result = json.createObjectNode();
		if (format instanceof TypeName t) {
			result.put("TYPENAME", t.name());
		} else if (format instanceof OptionFormat f) {
			result.set("OPTION", writeFormat(f.content()));
		} else if (format instanceof SeqFormat f) {
			result.set("SEQ", writeFormat(f.content()));
		} else if (format instanceof MapFormat f) {
			ObjectNode map = result.putObject("MAP");
			map.set("KEY", writeFormat(f.key()));
			map.set("VALUE", writeFormat(f.value()));
		} else if (format instanceof TupleFormat f) {
			result.set("TUPLE", writeFormats(f.formats()));
		} else if (format instanceof FixedArrayFormat f) {
			ObjectNode array = result.putObject("TUPLEARRAY");
			array.set("CONTENT", writeFormat(f.content()));
			array.put("SIZE", f.size());
		} else if (format instanceof Format.Unresolved) {
			throw new UnresolvedFormatException("Unresolved format placeholder");
		} else {
			throw new AssertionError("Unexpected format: " + format);
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RegistryMapper.class);
}
