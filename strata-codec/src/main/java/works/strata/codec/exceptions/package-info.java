/**
 * Failures reported while encoding or decoding.
 * All are unchecked and derive from {@link works.strata.codec.exceptions.CodecException}.
 */
package works.strata.codec.exceptions;
