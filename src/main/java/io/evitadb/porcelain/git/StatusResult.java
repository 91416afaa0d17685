package io.evitadb.porcelain.git;

import io.evitadb.porcelain.status.StatusHeaders;
import io.evitadb.porcelain.status.WorkingDirectoryFileChange;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Interpreted status of a repository.
 *
 * @param headers              branch information
 * @param files                changed files in the order git reported them
 * @param conflictedFilesExist true if the index holds unmerged entries
 */
public record StatusResult(
	@Nonnull StatusHeaders headers,
	@Nonnull List<WorkingDirectoryFileChange> files,
	boolean conflictedFilesExist
) {

	public StatusResult {
		Objects.requireNonNull(headers, "headers must not be null");
		Objects.requireNonNull(files, "files must not be null");
		files = List.copyOf(files);
	}
}
