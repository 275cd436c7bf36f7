/**
 * Turns an emission order into per-reference layout decisions.
 * <p>
 * The {@link works.strata.layout.LayoutResolver} produces a {@link works.strata.layout.LayoutPlan},
 * which is the interface between the compiler and any code generator:
 * generators implement {@link works.strata.layout.LayoutConsumer}
 * and look up, for each {@link works.strata.layout.ReferenceSite}, whether it must be indirect.
 * <p>
 * In target languages where all composite types are already references, an indirect site
 * needs no special treatment; elsewhere it becomes a shared or heap-allocated pointer.
 */
package works.strata.layout;
