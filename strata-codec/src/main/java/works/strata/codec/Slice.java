package works.strata.codec;

import java.util.Arrays;

/**
 * A half-open range {@code [start, end)} of an input or output buffer.
 */
public record Slice(int start, int end) {
	public Slice {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("Invalid slice [" + start + ", " + end + ")");
		}
	}

	public int length() {
		return end - start;
	}

	/**
	 * Lexicographic comparison of the bytes of {@code data} covered by two slices,
	 * treating each byte as unsigned. A proper prefix compares less.
	 */
	public static int compareBytes(byte[] data, Slice a, Slice b) {
		return Arrays.compareUnsigned(data, a.start, a.end, data, b.start, b.end);
	}
}
