package works.strata.codec;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.Arrays;
import works.strata.codec.exceptions.SerializationException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The parts of a {@link Serializer} shared by the binary encodings:
 * little-endian fixed-width integers, one-byte booleans,
 * and length-prefixed strings and byte strings.
 * <p>
 * Subclasses decide how lengths and variant indices are written,
 * whether map entries are reordered, and whether floats are supported.
 */
public abstract class BinarySerializer implements Serializer {
	public static final int UNLIMITED_DEPTH = Integer.MAX_VALUE;

	private byte[] buffer = new byte[64];
	private int size = 0;
	private int containerDepthBudget;

	protected BinarySerializer(int maxContainerDepth) {
		if (maxContainerDepth < 0) {
			throw new IllegalArgumentException("Negative container depth: " + maxContainerDepth);
		}
		this.containerDepthBudget = maxContainerDepth;
	}

	@Override
	public void serializeStr(String value) {
		ByteBuffer encoded;
		try {
			encoded = UTF_8.newEncoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.encode(CharBuffer.wrap(value));
		} catch (CharacterCodingException e) {
			throw new SerializationException("String is not valid Unicode", e);
		}
		serializeLen(encoded.remaining());
		byte[] bytes = new byte[encoded.remaining()];
		encoded.get(bytes);
		write(bytes);
	}

	@Override
	public void serializeBytes(Bytes value) {
		serializeLen(value.length());
		write(value.content());
	}

	@Override
	public void serializeBool(boolean value) {
		writeByte(value ? 1 : 0);
	}

	@Override
	public void serializeUnit(Unit value) {
	}

	@Override
	public void serializeChar(char value) {
		throw new SerializationException("Not implemented: char");
	}

	@Override
	public void serializeF32(float value) {
		throw new SerializationException("Not implemented: f32");
	}

	@Override
	public void serializeF64(double value) {
		throw new SerializationException("Not implemented: f64");
	}

	@Override
	public void serializeU8(byte value) {
		writeByte(value);
	}

	@Override
	public void serializeU16(short value) {
		writeLittleEndian(value, 2);
	}

	@Override
	public void serializeU32(int value) {
		writeLittleEndian(value, 4);
	}

	@Override
	public void serializeU64(long value) {
		writeLittleEndian(value, 8);
	}

	@Override
	public void serializeU128(BigInteger value) {
		if (value.signum() < 0 || value.bitLength() > 128) {
			throw new SerializationException("Invalid value for an unsigned int128: " + value);
		}
		write128(value);
	}

	@Override
	public void serializeI8(byte value) {
		writeByte(value);
	}

	@Override
	public void serializeI16(short value) {
		writeLittleEndian(value, 2);
	}

	@Override
	public void serializeI32(int value) {
		writeLittleEndian(value, 4);
	}

	@Override
	public void serializeI64(long value) {
		writeLittleEndian(value, 8);
	}

	@Override
	public void serializeI128(BigInteger value) {
		if (value.bitLength() > 127) {
			throw new SerializationException("Invalid value for a signed int128: " + value);
		}
		write128(value);
	}

	@Override
	public void serializeOptionTag(boolean value) {
		serializeBool(value);
	}

	@Override
	public void increaseContainerDepth() {
		if (containerDepthBudget == 0) {
			throw new SerializationException("Exceeded maximum container depth");
		}
		if (containerDepthBudget != UNLIMITED_DEPTH) {
			containerDepthBudget--;
		}
	}

	@Override
	public void decreaseContainerDepth() {
		if (containerDepthBudget != UNLIMITED_DEPTH) {
			containerDepthBudget++;
		}
	}

	@Override
	public int getBufferOffset() {
		return size;
	}

	@Override
	public byte[] getBytes() {
		return Arrays.copyOf(buffer, size);
	}

	/**
	 * Direct access for subclasses that rearrange what's been written.
	 * Only the first {@link #getBufferOffset()} bytes are meaningful.
	 */
	protected byte[] buffer() {
		return buffer;
	}

	protected void writeByte(int value) {
		ensureCapacity(1);
		buffer[size++] = (byte) value;
	}

	protected void write(byte[] bytes) {
		ensureCapacity(bytes.length);
		System.arraycopy(bytes, 0, buffer, size, bytes.length);
		size += bytes.length;
	}

	private void writeLittleEndian(long value, int numBytes) {
		ensureCapacity(numBytes);
		for (int i = 0; i < numBytes; i++) {
			buffer[size++] = (byte) (value >>> (8 * i));
		}
	}

	/**
	 * Sixteen bytes of two's complement, little-endian.
	 * Unsigned values of 2^127 and above come out with the high bit set, as they should.
	 */
	private void write128(BigInteger value) {
		byte[] bigEndian = value.toByteArray();
		byte fill = (byte) (value.signum() < 0 ? 0xFF : 0);
		ensureCapacity(16);
		for (int i = 0; i < 16; i++) {
			int source = bigEndian.length - 1 - i;
			buffer[size++] = (source >= 0) ? bigEndian[source] : fill;
		}
	}

	private void ensureCapacity(int additional) {
		int required = size + additional;
		if (required < 0) {
			throw new SerializationException("Output too large");
		}
		if (required > buffer.length) {
			buffer = Arrays.copyOf(buffer, Math.max(required, 2 * buffer.length));
		}
	}
}
