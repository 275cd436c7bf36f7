package works.strata.jackson;

/**
 * A registry document can't be read: it isn't valid JSON or YAML,
 * or it doesn't have the shape of a registry.
 * <p>
 * When the problem is inside one definition, {@link #definitionName()} names it.
 */
public class RegistryDocumentException extends RuntimeException {
	private final String definitionName;

	public RegistryDocumentException(String message) {
		this(message, null, null);
	}

	public RegistryDocumentException(String message, Throwable cause) {
		this(message, null, cause);
	}

	private RegistryDocumentException(String message, String definitionName, Throwable cause) {
		super(message, cause);
		this.definitionName = definitionName;
	}

	/**
	 * @return the name of the definition being read when the problem was found, or null
	 */
	public String definitionName() {
		return definitionName;
	}

	public static RegistryDocumentException wrap(RegistryDocumentException exception, String definitionName) {
		return new RegistryDocumentException(
			"In definition \"" + definitionName + "\": " + exception.getMessage(),
			definitionName,
			exception);
	}
}
