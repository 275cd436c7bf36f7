package works.strata.exceptions;

/**
 * The variant indices of an enumeration are not the dense sequence {@code 0..n}.
 */
public final class VariantIndexException extends SchemaException {
	public VariantIndexException(String message) {
		super(message);
	}

	VariantIndexException(String message, String definitionName, Throwable cause) {
		super(message, definitionName, cause);
	}
}
