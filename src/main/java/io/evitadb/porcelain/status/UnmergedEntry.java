package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A file left conflicted by a merge, rebase, cherry-pick or stash application.
 *
 * @param details         which side did what
 * @param submoduleStatus submodule flags, null for plain files
 */
public record UnmergedEntry(
	@Nonnull ConflictDetails details,
	@Nullable SubmoduleStatus submoduleStatus
) implements FileEntry {

	public UnmergedEntry {
		Objects.requireNonNull(details, "details must not be null");
	}
}
