package works.strata.exceptions;

/**
 * A {@link works.strata.schema.Format.TypeName TypeName} refers to a name
 * that has no entry in the registry.
 */
public final class UndefinedTypeException extends SchemaException {
	private final String missingName;

	public UndefinedTypeException(String missingName) {
		super("Reference to undefined type \"" + missingName + "\"");
		this.missingName = missingName;
	}

	UndefinedTypeException(String message, String definitionName, String missingName, Throwable cause) {
		super(message, definitionName, cause);
		this.missingName = missingName;
	}

	public String missingName() {
		return missingName;
	}
}
