package io.evitadb.porcelain.status;

import javax.annotation.Nullable;

/**
 * Interpretation of a two character porcelain status code.
 * Produced by {@link GitStatusMapper#mapStatus(String, String)}.
 */
public sealed interface FileEntry
	permits OrdinaryEntry, RenamedOrCopiedEntry, UntrackedEntry, UnmergedEntry {

	/**
	 * Returns the submodule flags, or null when the entry is not a submodule.
	 *
	 * @return submodule status or null
	 */
	@Nullable
	SubmoduleStatus submoduleStatus();
}
