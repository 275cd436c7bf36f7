package works.strata.codec.exceptions;

public sealed abstract class CodecException extends RuntimeException permits SerializationException, DeserializationException {
	protected CodecException(String message) {
		super(message);
	}

	protected CodecException(Throwable cause) {
		super(cause);
	}

	protected CodecException(String message, Throwable cause) {
		super(message, cause);
	}

	@SuppressWarnings("unchecked")
	public static <T extends CodecException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof SerializationException e) {
			return (T) new SerializationException(newMessage, e);
		} else if (exception instanceof DeserializationException e) {
			return (T) new DeserializationException(newMessage, e);
		} else {
			throw new AssertionError("Unexpected exception type: " + exception.getClass());
		}
	}
}
