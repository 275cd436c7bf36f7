package works.strata.codec;

/**
 * Recovers dynamic values of one format from their encoding.
 */
public interface Decoder {
	/**
	 * @throws works.strata.codec.exceptions.DeserializationException if {@code input} is not
	 * exactly one encoded value, with no bytes left over
	 */
	Object decode(byte[] input);
}
