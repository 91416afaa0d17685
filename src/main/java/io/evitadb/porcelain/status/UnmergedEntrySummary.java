package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;

/**
 * What each side of a merge did to a conflicted file.
 */
public enum UnmergedEntrySummary {

	ADDED_BY_US("added-by-us"),
	DELETED_BY_US("deleted-by-us"),
	ADDED_BY_THEM("added-by-them"),
	DELETED_BY_THEM("deleted-by-them"),
	BOTH_DELETED("both-deleted"),
	BOTH_ADDED("both-added"),
	BOTH_MODIFIED("both-modified");

	@Nonnull
	private final String label;

	UnmergedEntrySummary(@Nonnull String label) {
		this.label = label;
	}

	@Nonnull
	public String getLabel() {
		return this.label;
	}
}
