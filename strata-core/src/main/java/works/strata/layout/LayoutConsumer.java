package works.strata.layout;

/**
 * What a code generator implements in order to be driven by a {@link LayoutPlan}.
 * <p>
 * Calls arrive in emission order: for each definition, its forward declarations
 * (if any) and then the definition itself.
 * By the time any call is made, the whole plan has been computed,
 * so the consumer may also consult {@code plan} for definitions it hasn't seen yet.
 */
public interface LayoutConsumer {
	default void begin(LayoutPlan plan) { }

	void forwardDeclaration(String name);

	void definition(DefinitionLayout layout);

	default void end() { }
}
