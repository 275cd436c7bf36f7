/**
 * Failures reported by the compiler.
 * All are unchecked and derive from {@link works.strata.exceptions.SchemaException}.
 */
package works.strata.exceptions;
