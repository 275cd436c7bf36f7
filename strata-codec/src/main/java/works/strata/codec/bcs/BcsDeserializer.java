package works.strata.codec.bcs;

import works.strata.codec.BinaryDeserializer;
import works.strata.codec.Slice;
import works.strata.codec.exceptions.DeserializationException;

import static works.strata.codec.bcs.BcsSerializer.MAX_CONTAINER_DEPTH;
import static works.strata.codec.bcs.BcsSerializer.MAX_LENGTH;

/**
 * Accepts exactly the canonical encoding of each value:
 * minimal ULEB128 integers, and map keys in strictly increasing byte order.
 */
public class BcsDeserializer extends BinaryDeserializer {
	private final byte[] bytes;

	public BcsDeserializer(byte[] input) {
		super(input, MAX_CONTAINER_DEPTH);
		this.bytes = input;
	}

	@Override
	public long deserializeLen() {
		long value = Integer.toUnsignedLong(deserializeUleb128AsU32());
		if (value > MAX_LENGTH) {
			throw new DeserializationException("Incorrect length value: " + value);
		}
		return value;
	}

	@Override
	public int deserializeVariantIndex() {
		return deserializeUleb128AsU32();
	}

	@Override
	public void checkThatKeySlicesAreIncreasing(Slice key1, Slice key2) {
		if (Slice.compareBytes(bytes, key1, key2) >= 0) {
			throw new DeserializationException("Error while decoding map: keys are not serialized in the expected order");
		}
	}

	private int deserializeUleb128AsU32() {
		long value = 0;
		for (int shift = 0; shift < 32; shift += 7) {
			int b = getByte() & 0xFF;
			int digit = b & 0x7F;
			value |= ((long) digit) << shift;
			if (value > 0xFFFF_FFFFL) {
				throw new DeserializationException("Overflow while parsing uleb128-encoded uint32 value");
			}
			if (digit == b) {
				if (shift > 0 && digit == 0) {
					throw new DeserializationException("Invalid uleb128 number (unexpected zero digit)");
				}
				return (int) value;
			}
		}
		throw new DeserializationException("Overflow while parsing uleb128-encoded uint32 value");
	}
}
