package works.strata.exceptions;

/**
 * The schema registry handed to the compiler is malformed.
 * <p>
 * These are producer errors: the registry cannot be compiled as given,
 * and compilation stops before any layout is produced.
 * When the offending definition is known, {@link #definitionName()} names it.
 */
public sealed abstract class SchemaException extends RuntimeException permits
	UnresolvedFormatException,
	VariantIndexException,
	UndefinedTypeException
{
	private final String definitionName;

	protected SchemaException(String message) {
		this(message, null, null);
	}

	protected SchemaException(String message, String definitionName, Throwable cause) {
		super(message, cause);
		this.definitionName = definitionName;
	}

	/**
	 * @return the name of the registry entry being processed when the problem was found,
	 * or null if the problem was found outside the context of any definition
	 */
	public String definitionName() {
		return definitionName;
	}

	/**
	 * @return an exception of the same type as {@code exception},
	 * attributed to the given definition, with {@code exception} as its cause
	 */
	@SuppressWarnings("unchecked")
	public static <T extends SchemaException> T wrap(T exception, String definitionName) {
		String newMessage = "In definition \"" + definitionName + "\": " + exception.getMessage();
		if (exception instanceof UnresolvedFormatException) {
			return (T) new UnresolvedFormatException(newMessage, definitionName, exception);
		} else if (exception instanceof VariantIndexException) {
			return (T) new VariantIndexException(newMessage, definitionName, exception);
		} else if (exception instanceof UndefinedTypeException e) {
			return (T) new UndefinedTypeException(newMessage, definitionName, e.missingName(), e);
		} else {
			throw new AssertionError("Unexpected exception type: " + exception.getClass());
		}
	}
}
