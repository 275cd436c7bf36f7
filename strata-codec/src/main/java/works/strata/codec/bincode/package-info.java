/**
 * The Bincode encoding with fixed-width integers.
 */
package works.strata.codec.bincode;
