package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A text conflict resolvable by editing the conflict markers in the file.
 *
 * @param details             what both sides did
 * @param conflictMarkerCount number of markers still present in the file
 * @param submoduleStatus     submodule flags, null for plain files
 */
public record ConflictsWithMarkers(
	@Nonnull ConflictDetails details,
	int conflictMarkerCount,
	@Nullable SubmoduleStatus submoduleStatus
) implements AppFileStatus {

	public ConflictsWithMarkers {
		Objects.requireNonNull(details, "details must not be null");
	}

	@Nonnull
	@Override
	public AppFileStatusKind kind() {
		return AppFileStatusKind.CONFLICTED;
	}
}
