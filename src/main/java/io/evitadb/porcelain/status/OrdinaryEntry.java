package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A file that was added, modified or deleted, with independent index and working tree states.
 * Both sides are null for status codes this library does not know.
 *
 * @param type            overall change type
 * @param index           state in the index, null if unknown
 * @param workingTree     state in the working tree, null if unknown
 * @param submoduleStatus submodule flags, null for plain files
 */
public record OrdinaryEntry(
	@Nonnull Type type,
	@Nullable GitStatusEntry index,
	@Nullable GitStatusEntry workingTree,
	@Nullable SubmoduleStatus submoduleStatus
) implements FileEntry {

	public OrdinaryEntry {
		Objects.requireNonNull(type, "type must not be null");
	}

	/**
	 * Overall change type of an ordinary entry.
	 */
	public enum Type {
		ADDED,
		MODIFIED,
		DELETED
	}
}
