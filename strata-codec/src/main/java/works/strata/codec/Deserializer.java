package works.strata.codec;

import java.math.BigInteger;
import works.strata.codec.exceptions.DeserializationException;

/**
 * Reads primitive values from an input buffer, the inverse of {@link Serializer}.
 * <p>
 * All methods throw {@link DeserializationException} on malformed or truncated input.
 */
public interface Deserializer {
	String deserializeStr();

	Bytes deserializeBytes();

	boolean deserializeBool();

	Unit deserializeUnit();

	char deserializeChar();

	float deserializeF32();

	double deserializeF64();

	byte deserializeU8();

	short deserializeU16();

	int deserializeU32();

	long deserializeU64();

	BigInteger deserializeU128();

	byte deserializeI8();

	short deserializeI16();

	int deserializeI32();

	long deserializeI64();

	BigInteger deserializeI128();

	long deserializeLen();

	int deserializeVariantIndex();

	boolean deserializeOptionTag();

	void increaseContainerDepth();

	void decreaseContainerDepth();

	int getBufferOffset();

	/**
	 * @return the number of input bytes not yet consumed
	 */
	int remaining();

	/**
	 * Called after each map key after the first, with the input ranges of the previous key and this one.
	 *
	 * @throws DeserializationException if the encoding is canonical and {@code key1} is not strictly less than {@code key2}
	 */
	void checkThatKeySlicesAreIncreasing(Slice key1, Slice key2);
}
