package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Caller facing status of a single working directory file.
 */
public sealed interface AppFileStatus
	permits PlainFileStatus, CopiedOrRenamedFileStatus, UntrackedFileStatus, ConflictsWithMarkers, ManualConflict {

	/**
	 * Returns the kind of change.
	 *
	 * @return the kind
	 */
	@Nonnull
	AppFileStatusKind kind();

	/**
	 * Returns the submodule flags, or null when the file is not a submodule.
	 *
	 * @return submodule status or null
	 */
	@Nullable
	SubmoduleStatus submoduleStatus();

	/**
	 * Returns true for files that did not exist in HEAD.
	 *
	 * @return true for new and untracked files
	 */
	default boolean isNewFile() {
		return kind() == AppFileStatusKind.NEW || kind() == AppFileStatusKind.UNTRACKED;
	}
}
