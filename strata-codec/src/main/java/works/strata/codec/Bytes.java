package works.strata.codec;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * An immutable byte string, the value of the {@code bytes} format.
 */
public final class Bytes {
	private final byte[] content;

	private Bytes(byte[] content) {
		this.content = content;
	}

	public static Bytes of(byte... content) {
		return new Bytes(content.clone());
	}

	public static Bytes empty() {
		return EMPTY;
	}

	/**
	 * @return a copy of the content
	 */
	public byte[] content() {
		return content.clone();
	}

	public int length() {
		return content.length;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Bytes other && Arrays.equals(content, other.content);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(content);
	}

	@Override
	public String toString() {
		return "Bytes[" + HexFormat.of().formatHex(content) + "]";
	}

	private static final Bytes EMPTY = new Bytes(new byte[0]);
}
