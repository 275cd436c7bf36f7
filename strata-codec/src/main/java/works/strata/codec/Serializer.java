package works.strata.codec;

import java.math.BigInteger;
import works.strata.codec.exceptions.SerializationException;

/**
 * Appends the encoding of primitive values to an output buffer.
 * <p>
 * Unsigned values are passed in the signed Java type of the same width,
 * reinterpreting the bits; {@code u128} and {@code i128} use {@link BigInteger}
 * and must be in range.
 * <p>
 * All methods throw {@link SerializationException} if the encoding can't represent the value.
 */
public interface Serializer {
	void serializeStr(String value);

	void serializeBytes(Bytes value);

	void serializeBool(boolean value);

	void serializeUnit(Unit value);

	void serializeChar(char value);

	void serializeF32(float value);

	void serializeF64(double value);

	void serializeU8(byte value);

	void serializeU16(short value);

	void serializeU32(int value);

	void serializeU64(long value);

	void serializeU128(BigInteger value);

	void serializeI8(byte value);

	void serializeI16(short value);

	void serializeI32(int value);

	void serializeI64(long value);

	void serializeI128(BigInteger value);

	/**
	 * The length of a sequence, string, byte string, or map.
	 */
	void serializeLen(long value);

	void serializeVariantIndex(int value);

	void serializeOptionTag(boolean value);

	/**
	 * Called on entry to each struct or enum variant.
	 *
	 * @throws SerializationException if the maximum depth, if any, would be exceeded
	 */
	void increaseContainerDepth();

	void decreaseContainerDepth();

	int getBufferOffset();

	/**
	 * Reorders the map entries written since {@code offsets[0]}, if the encoding requires a canonical order.
	 *
	 * @param offsets the buffer offset at which each entry starts, in the order written;
	 *                the last entry extends to the current end of the buffer
	 */
	void sortMapEntries(int[] offsets);

	/**
	 * @return a copy of everything written so far
	 */
	byte[] getBytes();
}
