package works.strata.codec.bincode;

import works.strata.codec.BinaryDeserializer;
import works.strata.codec.Slice;
import works.strata.codec.exceptions.DeserializationException;

import static works.strata.codec.bincode.BincodeSerializer.DEFAULT_MAX_CONTAINER_DEPTH;

public class BincodeDeserializer extends BinaryDeserializer {
	public BincodeDeserializer(byte[] input) {
		this(input, DEFAULT_MAX_CONTAINER_DEPTH);
	}

	public BincodeDeserializer(byte[] input, int maxContainerDepth) {
		super(input, maxContainerDepth);
	}

	@Override
	public long deserializeLen() {
		long value = getLong();
		if (value < 0 || value > Integer.MAX_VALUE) {
			throw new DeserializationException("Incorrect length value: " + Long.toUnsignedString(value));
		}
		return value;
	}

	@Override
	public int deserializeVariantIndex() {
		return getInt();
	}

	@Override
	public float deserializeF32() {
		return getFloat();
	}

	@Override
	public double deserializeF64() {
		return getDouble();
	}

	@Override
	public void checkThatKeySlicesAreIncreasing(Slice key1, Slice key2) {
		// Not required by the format
	}
}
