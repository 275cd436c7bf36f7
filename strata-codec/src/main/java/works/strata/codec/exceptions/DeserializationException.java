package works.strata.codec.exceptions;

/**
 * The input bytes are not a valid encoding of any value of the expected format.
 * For a canonical encoding, this includes valid-looking input that isn't the canonical one.
 */
public final class DeserializationException extends CodecException {
	public DeserializationException(String message) {
		super(message);
	}

	public DeserializationException(Throwable cause) {
		super(cause);
	}

	public DeserializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
