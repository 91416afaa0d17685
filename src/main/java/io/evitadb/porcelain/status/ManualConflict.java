package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A conflict that has to be resolved by picking a side, such as a delete/modify conflict or a binary file.
 *
 * @param details         what both sides did
 * @param submoduleStatus submodule flags, null for plain files
 */
public record ManualConflict(
	@Nonnull ConflictDetails details,
	@Nullable SubmoduleStatus submoduleStatus
) implements AppFileStatus {

	public ManualConflict {
		Objects.requireNonNull(details, "details must not be null");
	}

	@Nonnull
	@Override
	public AppFileStatusKind kind() {
		return AppFileStatusKind.CONFLICTED;
	}
}
