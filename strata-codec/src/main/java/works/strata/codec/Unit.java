package works.strata.codec;

/**
 * The only value of the {@code unit} format.
 */
public enum Unit {
	UNIT;

	@Override
	public String toString() {
		return "()";
	}
}
