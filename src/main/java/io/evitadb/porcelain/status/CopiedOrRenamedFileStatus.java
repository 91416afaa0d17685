package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A file copied or renamed from another path.
 *
 * @param kind            {@link AppFileStatusKind#COPIED} or {@link AppFileStatusKind#RENAMED}
 * @param oldPath         the source path
 * @param submoduleStatus submodule flags, null for plain files
 */
public record CopiedOrRenamedFileStatus(
	@Nonnull AppFileStatusKind kind,
	@Nonnull String oldPath,
	@Nullable SubmoduleStatus submoduleStatus
) implements AppFileStatus {

	public CopiedOrRenamedFileStatus {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(oldPath, "oldPath must not be null");
		if (kind != AppFileStatusKind.COPIED && kind != AppFileStatusKind.RENAMED) {
			throw new IllegalArgumentException("Copied or renamed file status cannot be " + kind);
		}
	}
}
