/**
 * The Binary Canonical Serialization encoding.
 * <p>
 * Because each value has exactly one encoding, BCS bytes can be hashed or signed directly.
 */
package works.strata.codec.bcs;
