package works.strata.codec;

/**
 * Produces the encoding of dynamic values of one format.
 */
public interface Encoder {
	byte[] encode(Object value);
}
