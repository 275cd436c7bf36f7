/**
 * Implements {@link works.strata.codec.Codec Codec} directly by walking the formats
 * of a compiled {@link works.strata.layout.LayoutPlan LayoutPlan}
 * and calling the corresponding {@link works.strata.codec.Serializer Serializer}
 * or {@link works.strata.codec.Deserializer Deserializer} operations.
 * <p>
 * Values are dynamic: structs are {@link works.strata.codec.StructValue}s,
 * enums are {@link works.strata.codec.VariantValue}s, and everything else
 * is a plain Java object as documented on {@link works.strata.codec.Serializer Serializer}.
 */
package works.strata.codec.interpreter;
