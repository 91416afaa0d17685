package io.evitadb.porcelain.status;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static io.evitadb.porcelain.status.GitStatusEntry.*;

/**
 * Maps porcelain status codes to {@link FileEntry} variants.
 *
 * The mapping is total: codes missing from the table resolve to a modified entry with unknown sides,
 * so newer git versions introducing new codes never break status decoding.
 */
public final class GitStatusMapper {

	public static final String UNTRACKED_CODE = "??";

	/**
	 * Two character codes describing a conflicted (unmerged) file.
	 */
	public static final Set<String> CONFLICT_STATUS_CODES = Set.of("DD", "AU", "UD", "UA", "DU", "AA", "UU");

	private static final Map<String, Function<SubmoduleStatus, FileEntry>> STATUS_TABLE = Map.ofEntries(
		code(UNTRACKED_CODE, UntrackedEntry::new),
		code(".M", sub -> ordinary(OrdinaryEntry.Type.MODIFIED, UNCHANGED, MODIFIED, sub)),
		code("M.", sub -> ordinary(OrdinaryEntry.Type.MODIFIED, MODIFIED, UNCHANGED, sub)),
		code("MM", sub -> ordinary(OrdinaryEntry.Type.MODIFIED, MODIFIED, MODIFIED, sub)),
		code("MD", sub -> ordinary(OrdinaryEntry.Type.MODIFIED, MODIFIED, DELETED, sub)),
		code(".A", sub -> ordinary(OrdinaryEntry.Type.ADDED, UNCHANGED, ADDED, sub)),
		code("A.", sub -> ordinary(OrdinaryEntry.Type.ADDED, ADDED, UNCHANGED, sub)),
		code("AM", sub -> ordinary(OrdinaryEntry.Type.ADDED, ADDED, MODIFIED, sub)),
		code("AD", sub -> ordinary(OrdinaryEntry.Type.ADDED, ADDED, DELETED, sub)),
		code(".D", sub -> ordinary(OrdinaryEntry.Type.DELETED, UNCHANGED, DELETED, sub)),
		code("D.", sub -> ordinary(OrdinaryEntry.Type.DELETED, DELETED, UNCHANGED, sub)),
		code(".R", sub -> renamedOrCopied(RenamedOrCopiedEntry.Kind.RENAMED, UNCHANGED, RENAMED, sub)),
		code("R.", sub -> renamedOrCopied(RenamedOrCopiedEntry.Kind.RENAMED, RENAMED, UNCHANGED, sub)),
		code("RM", sub -> renamedOrCopied(RenamedOrCopiedEntry.Kind.RENAMED, RENAMED, MODIFIED, sub)),
		code("RD", sub -> renamedOrCopied(RenamedOrCopiedEntry.Kind.RENAMED, RENAMED, DELETED, sub)),
		code(".C", sub -> renamedOrCopied(RenamedOrCopiedEntry.Kind.COPIED, UNCHANGED, COPIED, sub)),
		code("C.", sub -> renamedOrCopied(RenamedOrCopiedEntry.Kind.COPIED, COPIED, UNCHANGED, sub)),
		code("CM", sub -> renamedOrCopied(RenamedOrCopiedEntry.Kind.COPIED, COPIED, MODIFIED, sub)),
		code("CD", sub -> renamedOrCopied(RenamedOrCopiedEntry.Kind.COPIED, COPIED, DELETED, sub)),
		code("DD", sub -> unmerged(UnmergedEntrySummary.BOTH_DELETED, DELETED, DELETED, sub)),
		code("AU", sub -> unmerged(UnmergedEntrySummary.ADDED_BY_US, ADDED, UPDATED_BUT_UNMERGED, sub)),
		code("UD", sub -> unmerged(UnmergedEntrySummary.DELETED_BY_THEM, UPDATED_BUT_UNMERGED, DELETED, sub)),
		code("UA", sub -> unmerged(UnmergedEntrySummary.ADDED_BY_THEM, UPDATED_BUT_UNMERGED, ADDED, sub)),
		code("DU", sub -> unmerged(UnmergedEntrySummary.DELETED_BY_US, DELETED, UPDATED_BUT_UNMERGED, sub)),
		code("AA", sub -> unmerged(UnmergedEntrySummary.BOTH_ADDED, ADDED, ADDED, sub)),
		code("UU", sub -> unmerged(UnmergedEntrySummary.BOTH_MODIFIED, UPDATED_BUT_UNMERGED, UPDATED_BUT_UNMERGED, sub))
	);

	/**
	 * Resolves a status code and submodule code to a file entry.
	 *
	 * @param statusCode          two character status code (`??` for untracked files)
	 * @param submoduleStatusCode four character submodule code
	 * @return the matching entry, or a modified entry with unknown sides for unrecognized codes
	 */
	@Nonnull
	public FileEntry mapStatus(@Nonnull String statusCode, @Nonnull String submoduleStatusCode) {
		Objects.requireNonNull(statusCode, "statusCode must not be null");
		Objects.requireNonNull(submoduleStatusCode, "submoduleStatusCode must not be null");

		final SubmoduleStatus submoduleStatus = mapSubmoduleStatus(submoduleStatusCode).orElse(null);
		final Function<SubmoduleStatus, FileEntry> factory = STATUS_TABLE.get(statusCode);
		if (factory == null) {
			return new OrdinaryEntry(OrdinaryEntry.Type.MODIFIED, null, null, submoduleStatus);
		}
		return factory.apply(submoduleStatus);
	}

	/**
	 * Decodes the `S<c><m><u>` submodule code. Anything not starting with `S` is a plain file.
	 *
	 * @param submoduleStatusCode four character submodule code
	 * @return submodule flags, or empty for plain files
	 */
	@Nonnull
	public Optional<SubmoduleStatus> mapSubmoduleStatus(@Nonnull String submoduleStatusCode) {
		Objects.requireNonNull(submoduleStatusCode, "submoduleStatusCode must not be null");
		if (!submoduleStatusCode.startsWith("S")) {
			return Optional.empty();
		}
		return Optional.of(new SubmoduleStatus(
			charAt(submoduleStatusCode, 1) == 'C',
			charAt(submoduleStatusCode, 2) == 'M',
			charAt(submoduleStatusCode, 3) == 'U'
		));
	}

	/**
	 * Returns true if the code describes a conflicted file.
	 *
	 * @param statusCode two character status code
	 * @return true for unmerged codes
	 */
	public static boolean isConflictStatusCode(@Nonnull String statusCode) {
		return CONFLICT_STATUS_CODES.contains(statusCode);
	}

	@Nonnull
	private static Map.Entry<String, Function<SubmoduleStatus, FileEntry>> code(
		@Nonnull String statusCode,
		@Nonnull Function<SubmoduleStatus, FileEntry> factory
	) {
		return Map.entry(statusCode, factory);
	}

	private static char charAt(@Nonnull String value, int index) {
		return index < value.length() ? value.charAt(index) : '.';
	}

	@Nonnull
	private static FileEntry ordinary(
		@Nonnull OrdinaryEntry.Type type,
		@Nonnull GitStatusEntry index,
		@Nonnull GitStatusEntry workingTree,
		@Nullable SubmoduleStatus submoduleStatus
	) {
		return new OrdinaryEntry(type, index, workingTree, submoduleStatus);
	}

	@Nonnull
	private static FileEntry renamedOrCopied(
		@Nonnull RenamedOrCopiedEntry.Kind kind,
		@Nonnull GitStatusEntry index,
		@Nonnull GitStatusEntry workingTree,
		@Nullable SubmoduleStatus submoduleStatus
	) {
		return new RenamedOrCopiedEntry(kind, index, workingTree, submoduleStatus);
	}

	@Nonnull
	private static FileEntry unmerged(
		@Nonnull UnmergedEntrySummary action,
		@Nonnull GitStatusEntry us,
		@Nonnull GitStatusEntry them,
		@Nullable SubmoduleStatus submoduleStatus
	) {
		return new UnmergedEntry(new ConflictDetails(action, us, them), submoduleStatus);
	}
}
