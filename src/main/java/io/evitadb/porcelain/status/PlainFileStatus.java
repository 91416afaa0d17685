package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A new, modified or deleted file.
 *
 * @param kind            one of {@link AppFileStatusKind#NEW}, {@link AppFileStatusKind#MODIFIED},
 *                        {@link AppFileStatusKind#DELETED}
 * @param submoduleStatus submodule flags, null for plain files
 */
public record PlainFileStatus(
	@Nonnull AppFileStatusKind kind,
	@Nullable SubmoduleStatus submoduleStatus
) implements AppFileStatus {

	public PlainFileStatus {
		Objects.requireNonNull(kind, "kind must not be null");
		if (kind != AppFileStatusKind.NEW && kind != AppFileStatusKind.MODIFIED && kind != AppFileStatusKind.DELETED) {
			throw new IllegalArgumentException("Plain file status cannot be " + kind);
		}
	}
}
