package io.evitadb.porcelain.status;

import javax.annotation.Nullable;

/**
 * A file not known to the index.
 *
 * @param submoduleStatus submodule flags, null for plain files
 */
public record UntrackedEntry(
	@Nullable SubmoduleStatus submoduleStatus
) implements FileEntry {
}
