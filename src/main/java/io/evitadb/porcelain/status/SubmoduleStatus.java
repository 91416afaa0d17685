package io.evitadb.porcelain.status;

/**
 * Submodule flags decoded from the four character `S<c><m><u>` code of a porcelain v2 entry.
 *
 * @param commitChanged    the submodule points at a different commit
 * @param modifiedChanges  the submodule has tracked changes
 * @param untrackedChanges the submodule has untracked files
 */
public record SubmoduleStatus(
	boolean commitChanged,
	boolean modifiedChanges,
	boolean untrackedChanges
) {
}
