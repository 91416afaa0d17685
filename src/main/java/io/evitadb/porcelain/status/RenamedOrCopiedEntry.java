package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A file git detected as renamed or copied from another path.
 *
 * @param kind            rename or copy
 * @param index           state in the index
 * @param workingTree     state in the working tree
 * @param submoduleStatus submodule flags, null for plain files
 */
public record RenamedOrCopiedEntry(
	@Nonnull Kind kind,
	@Nullable GitStatusEntry index,
	@Nullable GitStatusEntry workingTree,
	@Nullable SubmoduleStatus submoduleStatus
) implements FileEntry {

	public RenamedOrCopiedEntry {
		Objects.requireNonNull(kind, "kind must not be null");
	}

	public enum Kind {
		RENAMED,
		COPIED
	}
}
