package works.strata.codec.interpreter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.codec.Decoder;
import works.strata.codec.Deserializer;
import works.strata.codec.Encoding;
import works.strata.codec.Slice;
import works.strata.codec.StructValue;
import works.strata.codec.VariantValue;
import works.strata.codec.exceptions.CodecException;
import works.strata.codec.exceptions.DeserializationException;
import works.strata.exceptions.UnresolvedFormatException;
import works.strata.layout.LayoutPlan;
import works.strata.schema.ContainerFormat;
import works.strata.schema.ContainerFormat.Enumeration;
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

public class LayoutInterpretingDecoder implements Decoder {
	private final Format format;
	private final LayoutPlan plan;
	private final Encoding encoding;

	/**
	 * @param plan used to resolve {@link TypeName}s
	 */
	public LayoutInterpretingDecoder(Format format, LayoutPlan plan, Encoding encoding) {
		this.format = format;
		this.plan = plan;
		this.encoding = encoding;
	}

	@Override
	public Object decode(byte[] input) {
		LOGGER.debug("Decoding {} bytes as {} using {}", input.length, format, encoding);
		Deserializer in = encoding.newDeserializer(input);
		Object result;
		try {
			result = new Session(in, plan).decodeAny(format);
		} catch (DeserializationException e) {
			throw CodecException.wrap(e, "Unable to decode " + format + " at offset " + in.getBufferOffset());
		}
		if (in.remaining() != 0) {
			throw new DeserializationException("Some input bytes were not read: " + in.remaining() + " left after offset " + in.getBufferOffset());
		}
		return result;
	}

	static final class Session {
		final Deserializer in;
		final LayoutPlan plan;

		Session(Deserializer in, LayoutPlan plan) {
			this.in = in;
			this.plan = plan;
		}

		Object decodeAny(Format format) {
			if (format instanceof Primitive p) {
				return decodePrimitive(p);
			} else if (format instanceof TypeName t) {
				return decodeContainer(t.name(), plan.definition(t.name()).container());
			} else if (format instanceof OptionFormat f) {
				if (in.deserializeOptionTag()) {
					return Optional.of(decodeAny(f.content()));
				} else {
					return Optional.empty();
				}
			} else if (format instanceof SeqFormat f) {
				long len = in.deserializeLen();
				List<Object> result = new ArrayList<>((int) Math.min(len, in.remaining()));
				for (long i = 0; i < len; i++) {
					result.add(decodeAny(f.content()));
				}
				return result;
			} else if (format instanceof MapFormat f) {
				return decodeMap(f);
			} else if (format instanceof TupleFormat f) {
				return decodeElements(f.formats());
			} else if (format instanceof FixedArrayFormat f) {
				List<Object> result = new ArrayList<>(f.size());
				for (int i = 0; i < f.size(); i++) {
					result.add(decodeAny(f.content()));
				}
				return result;
			} else if (format instanceof Format.Unresolved) {
				throw new UnresolvedFormatException("Unresolved format placeholder");
			} else {
				throw new AssertionError("Unexpected format: " + format);
			}
		}

		private Object decodePrimitive(Primitive format) {
			return switch (format) {
				case UNIT -> in.deserializeUnit();
				case BOOL -> in.deserializeBool();
				case I8 -> in.deserializeI8();
				case I16 -> in.deserializeI16();
				case I32 -> in.deserializeI32();
				case I64 -> in.deserializeI64();
				case I128 -> in.deserializeI128();
				case U8 -> in.deserializeU8();
				case U16 -> in.deserializeU16();
				case U32 -> in.deserializeU32();
				case U64 -> in.deserializeU64();
				case U128 -> in.deserializeU128();
				case F32 -> in.deserializeF32();
				case F64 -> in.deserializeF64();
				case CHAR -> in.deserializeChar();
				case STR -> in.deserializeStr();
				case BYTES -> in.deserializeBytes();
			};
		}

		private Object decodeContainer(String name, ContainerFormat container) {
			if (container instanceof Enumeration e) {
				int index = in.deserializeVariantIndex();
				Named<VariantFormat> variant = e.variants().get(index);
				if (variant == null) {
					throw new DeserializationException("Unknown variant index for " + name + ": " + Integer.toUnsignedString(index));
				}
				in.increaseContainerDepth();
				List<Object> fields = decodeElements(Shapes.fieldFormats(variant.value()));
				in.decreaseContainerDepth();
				return new VariantValue(index, fields);
			} else {
				in.increaseContainerDepth();
				List<Object> fields = decodeElements(Shapes.fieldFormats(container));
				in.decreaseContainerDepth();
				return new StructValue(fields);
			}
		}

		private Map<Object, Object> decodeMap(MapFormat format) {
			long len = in.deserializeLen();
			Map<Object, Object> result = new LinkedHashMap<>();
			Slice previousKey = null;
			for (long i = 0; i < len; i++) {
				int keyStart = in.getBufferOffset();
				Object key = decodeAny(format.key());
				Slice keySlice = new Slice(keyStart, in.getBufferOffset());
				Object value = decodeAny(format.value());
				if (previousKey != null) {
					in.checkThatKeySlicesAreIncreasing(previousKey, keySlice);
				}
				previousKey = keySlice;
				if (result.putIfAbsent(key, value) != null) {
					throw new DeserializationException("Duplicate map key: " + key);
				}
			}
			return result;
		}

		private List<Object> decodeElements(List<Format> formats) {
			List<Object> result = new ArrayList<>(formats.size());
			for (Format f : formats) {
				result.add(decodeAny(f));
			}
			return result;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LayoutInterpretingDecoder.class);
}
