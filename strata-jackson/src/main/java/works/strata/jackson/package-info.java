/**
 * Interchange documents for {@link works.strata.schema.Registry Registries},
 * so a registry extracted by one tool can be compiled by another.
 */
package works.strata.jackson;
