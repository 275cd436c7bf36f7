package works.strata.codec.exceptions;

/**
 * A value can't be encoded: it doesn't match its format,
 * or the encoding has no representation for it.
 */
public final class SerializationException extends CodecException {
	public SerializationException(String message) {
		super(message);
	}

	public SerializationException(Throwable cause) {
		super(cause);
	}

	public SerializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
