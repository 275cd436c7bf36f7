package works.strata.codec;

import works.strata.schema.Format;

/**
 * A factory for encoders and decoders.
 * Accessible via {@link CodecBuilder}.
 * <p>
 * Usually you want one for a named definition of the compiled registry,
 * but any {@link Format} whose type names are defined in the registry will do.
 */
public interface Codec {
	Encoding encoding();

	Encoder encoderFor(Format format);

	Decoder decoderFor(Format format);

	default Encoder encoderFor(String definitionName) {
		return encoderFor(Format.typeName(definitionName));
	}

	default Decoder decoderFor(String definitionName) {
		return decoderFor(Format.typeName(definitionName));
	}
}
