package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A changed file of the working directory.
 *
 * @param path   path relative to the repository root
 * @param status interpreted status
 */
public record WorkingDirectoryFileChange(
	@Nonnull String path,
	@Nonnull AppFileStatus status
) {

	public WorkingDirectoryFileChange {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(status, "status must not be null");
	}
}
