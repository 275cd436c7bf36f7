package works.strata.exceptions;

/**
 * A {@link works.strata.schema.Format Format} or {@link works.strata.schema.VariantFormat VariantFormat}
 * placeholder was never resolved by the stage that produced the registry.
 */
public final class UnresolvedFormatException extends SchemaException {
	public UnresolvedFormatException(String message) {
		super(message);
	}

	UnresolvedFormatException(String message, String definitionName, Throwable cause) {
		super(message, definitionName, cause);
	}
}
