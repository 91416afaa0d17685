package io.evitadb.porcelain.diff;

/**
 * Kind of a line in a unified diff.
 */
public enum DiffLineType {

	/**
	 * Unchanged line present in both versions, prefixed by a space.
	 */
	CONTEXT,

	/**
	 * Line present only in the new version, prefixed by `+`.
	 */
	ADD,

	/**
	 * Line present only in the old version, prefixed by `-`.
	 */
	DELETE,

	/**
	 * The `@@ ... @@` header opening a hunk.
	 */
	HUNK
}
