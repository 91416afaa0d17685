package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A file record of the status stream with its raw codes.
 *
 * @param kind                the record type the entry was decoded from
 * @param path                path of the file relative to the repository root
 * @param statusCode          two character `XY` status code, `??` for untracked files
 * @param submoduleStatusCode four character submodule code (`N...`, `SCMU`, `????` for untracked files)
 * @param oldPath             original path for renamed or copied entries, otherwise null
 */
public record StatusEntry(
	@Nonnull StatusEntryKind kind,
	@Nonnull String path,
	@Nonnull String statusCode,
	@Nonnull String submoduleStatusCode,
	@Nullable String oldPath
) implements StatusItem {

	public StatusEntry {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(statusCode, "statusCode must not be null");
		Objects.requireNonNull(submoduleStatusCode, "submoduleStatusCode must not be null");
	}

	/**
	 * Record types of the porcelain v2 format, keyed by their leading character.
	 */
	public enum StatusEntryKind {
		CHANGED,
		RENAMED_OR_COPIED,
		UNMERGED,
		UNTRACKED
	}
}
