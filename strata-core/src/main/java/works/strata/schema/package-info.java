/**
 * The schema model: {@link works.strata.schema.Format type expressions},
 * the {@link works.strata.schema.ContainerFormat shapes} of named definitions,
 * and the {@link works.strata.schema.Registry} that holds them.
 * <p>
 * This is pure data. The only behaviour is traversal
 * ({@link works.strata.schema.Format#visit visit}) and the naming helper
 * {@link works.strata.schema.Format#mangledName mangledName}.
 * <p>
 * Cycles can only be formed through {@link works.strata.schema.Format.TypeName TypeName},
 * which refers to another registry entry by name.
 * Deciding how such references are laid out is the job of {@link works.strata.layout}.
 */
package works.strata.schema;
