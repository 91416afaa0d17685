package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A file git does not track yet.
 *
 * @param submoduleStatus submodule flags, null for plain files
 */
public record UntrackedFileStatus(
	@Nullable SubmoduleStatus submoduleStatus
) implements AppFileStatus {

	@Nonnull
	@Override
	public AppFileStatusKind kind() {
		return AppFileStatusKind.UNTRACKED;
	}
}
