package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns decoded status entries into the list of changed files of a working directory.
 */
public final class WorkingDirectoryStatusBuilder {

	@Nonnull
	private final GitStatusMapper mapper;

	public WorkingDirectoryStatusBuilder() {
		this(new GitStatusMapper());
	}

	public WorkingDirectoryStatusBuilder(@Nonnull GitStatusMapper mapper) {
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	/**
	 * Builds the changed files in stream order.
	 *
	 * Files added to the index and deleted from the working tree are left out because they exist
	 * nowhere. An untracked entry replaces an earlier entry for the same path.
	 *
	 * @param entries         status entries
	 * @param conflictDetails marker counts and binary paths of conflicted files
	 * @return one change per path
	 */
	@Nonnull
	public List<WorkingDirectoryFileChange> build(
		@Nonnull List<StatusEntry> entries,
		@Nonnull ConflictFilesDetails conflictDetails
	) {
		Objects.requireNonNull(entries, "entries must not be null");
		Objects.requireNonNull(conflictDetails, "conflictDetails must not be null");

		final Map<String, WorkingDirectoryFileChange> files = new LinkedHashMap<>();
		for (final StatusEntry entry : entries) {
			final FileEntry fileEntry = this.mapper.mapStatus(entry.statusCode(), entry.submoduleStatusCode());

			if (fileEntry instanceof OrdinaryEntry ordinary
				&& ordinary.index() == GitStatusEntry.ADDED
				&& ordinary.workingTree() == GitStatusEntry.DELETED) {
				continue;
			}
			if (fileEntry instanceof UntrackedEntry) {
				files.remove(entry.path());
			}

			final AppFileStatus status = toAppStatus(entry.path(), fileEntry, conflictDetails, entry.oldPath());
			files.put(entry.path(), new WorkingDirectoryFileChange(entry.path(), status));
		}
		return new ArrayList<>(files.values());
	}

	/**
	 * Returns true if any entry carries an unmerged status code.
	 *
	 * @param entries status entries
	 * @return true when the index holds conflicted files
	 */
	public static boolean hasConflicts(@Nonnull List<StatusEntry> entries) {
		for (final StatusEntry entry : entries) {
			if (GitStatusMapper.isConflictStatusCode(entry.statusCode())) {
				return true;
			}
		}
		return false;
	}

	@Nonnull
	AppFileStatus toAppStatus(
		@Nonnull String path,
		@Nonnull FileEntry fileEntry,
		@Nonnull ConflictFilesDetails conflictDetails,
		@Nullable String oldPath
	) {
		if (fileEntry instanceof OrdinaryEntry ordinary) {
			final AppFileStatusKind kind = switch (ordinary.type()) {
				case ADDED -> AppFileStatusKind.NEW;
				case MODIFIED -> AppFileStatusKind.MODIFIED;
				case DELETED -> AppFileStatusKind.DELETED;
			};
			return new PlainFileStatus(kind, ordinary.submoduleStatus());
		} else if (fileEntry instanceof RenamedOrCopiedEntry renamedOrCopied) {
			if (oldPath == null) {
				// renamed code without a source path cannot be presented as a rename
				return new PlainFileStatus(AppFileStatusKind.MODIFIED, renamedOrCopied.submoduleStatus());
			}
			final AppFileStatusKind kind = renamedOrCopied.kind() == RenamedOrCopiedEntry.Kind.COPIED
				? AppFileStatusKind.COPIED : AppFileStatusKind.RENAMED;
			return new CopiedOrRenamedFileStatus(kind, oldPath, renamedOrCopied.submoduleStatus());
		} else if (fileEntry instanceof UntrackedEntry untracked) {
			return new UntrackedFileStatus(untracked.submoduleStatus());
		} else if (fileEntry instanceof UnmergedEntry unmerged) {
			final ConflictDetails details = unmerged.details();
			if (details.isTextConflict() && !conflictDetails.binaryFilePaths().contains(path)) {
				return new ConflictsWithMarkers(
					details,
					conflictDetails.conflictCountsByPath().getOrDefault(path, 0),
					unmerged.submoduleStatus()
				);
			}
			return new ManualConflict(details, unmerged.submoduleStatus());
		}
		throw new IllegalStateException("Unknown file entry: " + fileEntry);
	}
}
