package works.strata.codec.bcs;

import java.util.Arrays;
import works.strata.codec.BinarySerializer;
import works.strata.codec.Slice;
import works.strata.codec.exceptions.SerializationException;

/**
 * BCS, the canonical encoding: every value has exactly one encoding.
 * <p>
 * Lengths and variant indices are ULEB128-encoded 32-bit integers.
 * Map entries are sorted by their encoded bytes.
 * Floats are not supported, and containers nest at most {@link #MAX_CONTAINER_DEPTH} deep.
 */
public class BcsSerializer extends BinarySerializer {
	public static final long MAX_LENGTH = Integer.MAX_VALUE;
	public static final int MAX_CONTAINER_DEPTH = 500;

	public BcsSerializer() {
		super(MAX_CONTAINER_DEPTH);
	}

	@Override
	public void serializeLen(long value) {
		if (value < 0 || value > MAX_LENGTH) {
			throw new SerializationException("Incorrect length value: " + value);
		}
		serializeU32AsUleb128((int) value);
	}

	@Override
	public void serializeVariantIndex(int value) {
		serializeU32AsUleb128(value);
	}

	@Override
	public void sortMapEntries(int[] offsets) {
		if (offsets.length <= 1) {
			return;
		}
		int start = offsets[0];
		int end = getBufferOffset();
		byte[] data = buffer();
		Slice[] slices = new Slice[offsets.length];
		for (int i = 0; i < offsets.length; i++) {
			int sliceEnd = (i + 1 < offsets.length) ? offsets[i + 1] : end;
			slices[i] = new Slice(offsets[i], sliceEnd);
		}
		Arrays.sort(slices, (a, b) -> Slice.compareBytes(data, a, b));

		byte[] sorted = new byte[end - start];
		int position = 0;
		for (Slice slice : slices) {
			System.arraycopy(data, slice.start(), sorted, position, slice.length());
			position += slice.length();
		}
		System.arraycopy(sorted, 0, data, start, sorted.length);
	}

	/**
	 * {@code value} is treated as unsigned.
	 */
	private void serializeU32AsUleb128(int value) {
		while (Integer.compareUnsigned(value, 0x80) >= 0) {
			writeByte((value & 0x7f) | 0x80);
			value >>>= 7;
		}
		writeByte(value);
	}
}
