package works.strata.codec.bincode;

import works.strata.codec.BinarySerializer;
import works.strata.codec.exceptions.SerializationException;

/**
 * Bincode: lengths as {@code u64}, variant indices as {@code u32}, IEEE floats.
 * Not canonical: map entries are written in iteration order.
 * <p>
 * The format itself has no nesting limit, but encoding recurses once per
 * container, so the depth is capped at {@link #DEFAULT_MAX_CONTAINER_DEPTH}
 * unless the caller chooses otherwise.
 */
public class BincodeSerializer extends BinarySerializer {
	public static final int DEFAULT_MAX_CONTAINER_DEPTH = 500;

	public BincodeSerializer() {
		this(DEFAULT_MAX_CONTAINER_DEPTH);
	}

	public BincodeSerializer(int maxContainerDepth) {
		super(maxContainerDepth);
	}

	@Override
	public void serializeLen(long value) {
		if (value < 0) {
			throw new SerializationException("Negative length: " + value);
		}
		serializeU64(value);
	}

	@Override
	public void serializeVariantIndex(int value) {
		serializeU32(value);
	}

	@Override
	public void serializeF32(float value) {
		serializeU32(Float.floatToRawIntBits(value));
	}

	@Override
	public void serializeF64(double value) {
		serializeU64(Double.doubleToRawLongBits(value));
	}

	@Override
	public void sortMapEntries(int[] offsets) {
		// Not required by the format
	}
}
