package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Extra information needed to classify conflicted files.
 *
 * @param conflictCountsByPath number of conflict markers per file path
 * @param binaryFilePaths      paths of conflicted files git treats as binary
 */
public record ConflictFilesDetails(
	@Nonnull Map<String, Integer> conflictCountsByPath,
	@Nonnull Set<String> binaryFilePaths
) {

	public ConflictFilesDetails {
		conflictCountsByPath = Map.copyOf(Objects.requireNonNull(conflictCountsByPath, "conflictCountsByPath must not be null"));
		binaryFilePaths = Set.copyOf(Objects.requireNonNull(binaryFilePaths, "binaryFilePaths must not be null"));
	}

	/**
	 * Returns details with no markers and no binary files.
	 *
	 * @return empty details
	 */
	@Nonnull
	public static ConflictFilesDetails empty() {
		return new ConflictFilesDetails(Map.of(), Set.of());
	}
}
