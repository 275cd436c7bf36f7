package works.strata;

/**
 * @param elideIndirectionInDynamicContainers when true, a reference nested inside a sequence or map
 *                                            is never marked indirect, on the assumption that the
 *                                            target stores those contents out of line anyway.
 *                                            This is a backend optimization; the default is false,
 *                                            which is correct even for targets that embed such composites by value.
 */
public record CompilerSettings(
	boolean elideIndirectionInDynamicContainers
) {
	public static final CompilerSettings DEFAULT = new CompilerSettings(false);

	public CompilerSettings withElideIndirectionInDynamicContainers(boolean elide) {
		return new CompilerSettings(elide);
	}
}
