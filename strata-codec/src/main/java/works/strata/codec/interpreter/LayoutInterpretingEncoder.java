package works.strata.codec.interpreter;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.strata.codec.Bytes;
import works.strata.codec.Encoder;
import works.strata.codec.Encoding;
import works.strata.codec.Serializer;
import works.strata.codec.StructValue;
import works.strata.codec.Unit;
import works.strata.codec.VariantValue;
import works.strata.codec.exceptions.CodecException;
import works.strata.codec.exceptions.SerializationException;
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

public class LayoutInterpretingEncoder implements Encoder {
	private final Format format;
	private final LayoutPlan plan;
	private final Encoding encoding;

	/**
	 * @param plan used to resolve {@link TypeName}s
	 */
	public LayoutInterpretingEncoder(Format format, LayoutPlan plan, Encoding encoding) {
		this.format = format;
		this.plan = plan;
		this.encoding = encoding;
	}

	@Override
	public byte[] encode(Object value) {
		LOGGER.debug("Encoding value of {} as {} using {}", (value == null) ? "null" : value.getClass(), format, encoding);
		Serializer serializer = encoding.newSerializer();
		try {
			new Session(serializer, plan).encodeAny(format, value);
		} catch (SerializationException e) {
			throw CodecException.wrap(e, "Unable to encode " + format);
		}
		return serializer.getBytes();
	}

	static final class Session {
		final Serializer out;
		final LayoutPlan plan;

		Session(Serializer out, LayoutPlan plan) {
			this.out = out;
			this.plan = plan;
		}

		void encodeAny(Format format, Object value) {
			if (format instanceof Primitive p) {
				encodePrimitive(p, value);
			} else if (format instanceof TypeName t) {
				encodeContainer(t.name(), plan.definition(t.name()).container(), value);
			} else if (format instanceof OptionFormat f) {
				Optional<?> option = cast(Optional.class, value, format);
				out.serializeOptionTag(option.isPresent());
				if (option.isPresent()) {
					encodeAny(f.content(), option.get());
				}
			} else if (format instanceof SeqFormat f) {
				List<?> list = cast(List.class, value, format);
				out.serializeLen(list.size());
				for (Object element : list) {
					encodeAny(f.content(), element);
				}
			} else if (format instanceof MapFormat f) {
				encodeMap(f, cast(Map.class, value, format));
			} else if (format instanceof TupleFormat f) {
				encodeElements(f.formats(), cast(List.class, value, format), format);
			} else if (format instanceof FixedArrayFormat f) {
				List<?> list = cast(List.class, value, format);
				if (list.size() != f.size()) {
					throw new SerializationException("Expected " + f.size() + " elements for " + format + " but got " + list.size());
				}
				for (Object element : list) {
					encodeAny(f.content(), element);
				}
			} else if (format instanceof Format.Unresolved) {
				throw new UnresolvedFormatException("Unresolved format placeholder");
			} else {
				throw new AssertionError("Unexpected format: " + format);
			}
		}

		private void encodePrimitive(Primitive format, Object value) {
			switch (format) {
				case UNIT -> out.serializeUnit(cast(Unit.class, value, format));
				case BOOL -> out.serializeBool(cast(Boolean.class, value, format));
				case I8 -> out.serializeI8(cast(Byte.class, value, format));
				case I16 -> out.serializeI16(cast(Short.class, value, format));
				case I32 -> out.serializeI32(cast(Integer.class, value, format));
				case I64 -> out.serializeI64(cast(Long.class, value, format));
				case I128 -> out.serializeI128(cast(BigInteger.class, value, format));
				case U8 -> out.serializeU8(cast(Byte.class, value, format));
				case U16 -> out.serializeU16(cast(Short.class, value, format));
				case U32 -> out.serializeU32(cast(Integer.class, value, format));
				case U64 -> out.serializeU64(cast(Long.class, value, format));
				case U128 -> out.serializeU128(cast(BigInteger.class, value, format));
				case F32 -> out.serializeF32(cast(Float.class, value, format));
				case F64 -> out.serializeF64(cast(Double.class, value, format));
				case CHAR -> out.serializeChar(cast(Character.class, value, format));
				case STR -> out.serializeStr(cast(String.class, value, format));
				case BYTES -> out.serializeBytes(cast(Bytes.class, value, format));
			}
		}

		private void encodeContainer(String name, ContainerFormat container, Object value) {
			if (container instanceof Enumeration e) {
				VariantValue variantValue = cast(VariantValue.class, value, name);
				Named<VariantFormat> variant = e.variants().get(variantValue.index());
				if (variant == null) {
					throw new SerializationException("No variant of " + name + " has index " + variantValue.index());
				}
				out.serializeVariantIndex(variantValue.index());
				out.increaseContainerDepth();
				encodeElements(Shapes.fieldFormats(variant.value()), variantValue.fields(), name + "::" + variant.name());
				out.decreaseContainerDepth();
			} else {
				StructValue structValue = cast(StructValue.class, value, name);
				out.increaseContainerDepth();
				encodeElements(Shapes.fieldFormats(container), structValue.fields(), name);
				out.decreaseContainerDepth();
			}
		}

		private void encodeMap(MapFormat format, Map<?, ?> map) {
			out.serializeLen(map.size());
			int[] offsets = new int[map.size()];
			int i = 0;
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				offsets[i++] = out.getBufferOffset();
				encodeAny(format.key(), entry.getKey());
				encodeAny(format.value(), entry.getValue());
			}
			out.sortMapEntries(offsets);
		}

		private void encodeElements(List<Format> formats, List<?> values, Object context) {
			if (values.size() != formats.size()) {
				throw new SerializationException("Expected " + formats.size() + " fields for " + context + " but got " + values.size());
			}
			for (int i = 0; i < formats.size(); i++) {
				encodeAny(formats.get(i), values.get(i));
			}
		}

		private static <T> T cast(Class<T> type, Object value, Object context) {
			if (type.isInstance(value)) {
				return type.cast(value);
			} else {
				String actual = (value == null) ? "null" : value.getClass().getSimpleName();
				throw new SerializationException("Expected " + type.getSimpleName() + " for " + context + " but got " + actual);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LayoutInterpretingEncoder.class);
}
