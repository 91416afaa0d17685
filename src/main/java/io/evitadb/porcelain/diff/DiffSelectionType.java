package io.evitadb.porcelain.diff;

/**
 * Summary of a {@link DiffSelection}.
 */
public enum DiffSelectionType {
	ALL,
	PARTIAL,
	NONE
}
