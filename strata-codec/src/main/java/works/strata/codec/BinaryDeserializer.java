package works.strata.codec;

import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import works.strata.codec.exceptions.DeserializationException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Inverse of {@link BinarySerializer}.
 * <p>
 * Strict: booleans and option tags must be 0 or 1,
 * strings must be well-formed UTF-8,
 * and reading past the end of the input is an error rather than an exception of some other type.
 */
public abstract class BinaryDeserializer implements Deserializer {
	public static final int UNLIMITED_DEPTH = BinarySerializer.UNLIMITED_DEPTH;
	private static final BigInteger TWO_TO_THE_128 = BigInteger.ONE.shiftLeft(128);

	protected final ByteBuffer input;
	private int containerDepthBudget;

	protected BinaryDeserializer(byte[] input, int maxContainerDepth) {
		if (maxContainerDepth < 0) {
			throw new IllegalArgumentException("Negative container depth: " + maxContainerDepth);
		}
		this.input = ByteBuffer.wrap(input).order(ByteOrder.LITTLE_ENDIAN);
		this.containerDepthBudget = maxContainerDepth;
	}

	@Override
	public String deserializeStr() {
		byte[] content = readLengthPrefixed();
		try {
			return UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT)
				.decode(ByteBuffer.wrap(content))
				.toString();
		} catch (CharacterCodingException e) {
			throw new DeserializationException("Invalid UTF-8 string", e);
		}
	}

	@Override
	public Bytes deserializeBytes() {
		return Bytes.of(readLengthPrefixed());
	}

	@Override
	public boolean deserializeBool() {
		byte value = getByte();
		if (value == 0) {
			return false;
		} else if (value == 1) {
			return true;
		} else {
			throw new DeserializationException("Incorrect boolean value: " + value);
		}
	}

	@Override
	public Unit deserializeUnit() {
		return Unit.UNIT;
	}

	@Override
	public char deserializeChar() {
		throw new DeserializationException("Not implemented: char");
	}

	@Override
	public float deserializeF32() {
		throw new DeserializationException("Not implemented: f32");
	}

	@Override
	public double deserializeF64() {
		throw new DeserializationException("Not implemented: f64");
	}

	@Override
	public byte deserializeU8() {
		return getByte();
	}

	@Override
	public short deserializeU16() {
		return getShort();
	}

	@Override
	public int deserializeU32() {
		return getInt();
	}

	@Override
	public long deserializeU64() {
		return getLong();
	}

	@Override
	public BigInteger deserializeU128() {
		BigInteger signed = deserializeI128();
		return (signed.signum() >= 0) ? signed : signed.add(TWO_TO_THE_128);
	}

	@Override
	public byte deserializeI8() {
		return getByte();
	}

	@Override
	public short deserializeI16() {
		return getShort();
	}

	@Override
	public int deserializeI32() {
		return getInt();
	}

	@Override
	public long deserializeI64() {
		return getLong();
	}

	@Override
	public BigInteger deserializeI128() {
		byte[] content = new byte[16];
		get(content);
		byte[] bigEndian = new byte[16];
		for (int i = 0; i < 16; i++) {
			bigEndian[i] = content[15 - i];
		}
		return new BigInteger(bigEndian);
	}

	@Override
	public boolean deserializeOptionTag() {
		return deserializeBool();
	}

	@Override
	public void increaseContainerDepth() {
		if (containerDepthBudget == 0) {
			throw new DeserializationException("Exceeded maximum container depth");
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
		return input.position();
	}

	@Override
	public int remaining() {
		return input.remaining();
	}

	protected byte getByte() {
		try {
			return input.get();
		} catch (BufferUnderflowException e) {
			throw unexpectedEnd(e);
		}
	}

	protected short getShort() {
		try {
			return input.getShort();
		} catch (BufferUnderflowException e) {
			throw unexpectedEnd(e);
		}
	}

	protected int getInt() {
		try {
			return input.getInt();
		} catch (BufferUnderflowException e) {
			throw unexpectedEnd(e);
		}
	}

	protected long getLong() {
		try {
			return input.getLong();
		} catch (BufferUnderflowException e) {
			throw unexpectedEnd(e);
		}
	}

	protected float getFloat() {
		try {
			return input.getFloat();
		} catch (BufferUnderflowException e) {
			throw unexpectedEnd(e);
		}
	}

	protected double getDouble() {
		try {
			return input.getDouble();
		} catch (BufferUnderflowException e) {
			throw unexpectedEnd(e);
		}
	}

	private void get(byte[] destination) {
		try {
			input.get(destination);
		} catch (BufferUnderflowException e) {
			throw unexpectedEnd(e);
		}
	}

	private byte[] readLengthPrefixed() {
		long len = deserializeLen();
		if (len < 0 || len > Integer.MAX_VALUE) {
			throw new DeserializationException("The length of a Java array cannot exceed MAXINT");
		}
		if (len > input.remaining()) {
			// Before allocating
			throw new DeserializationException("Length " + len + " exceeds the " + input.remaining() + " bytes remaining");
		}
		byte[] content = new byte[(int) len];
		get(content);
		return content;
	}

	private DeserializationException unexpectedEnd(BufferUnderflowException e) {
		return new DeserializationException("Unexpected end of input at offset " + input.position(), e);
	}
}
