package io.evitadb.porcelain.diff;

import io.evitadb.porcelain.status.AppFileStatus;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds unified diff patches containing only part of the changes of a file, so that a subset of
 * lines can be staged with `git apply --cached` or reverted with `git apply`.
 *
 * Hunk line counts are recomputed from the lines actually emitted. Hunks left without any change are
 * omitted, the start lines of the original hunks are kept.
 */
public final class PatchFormatter {

	private static final String DEV_NULL = "/dev/null";

	/**
	 * Formats the two header lines of a patch. A missing path means the file does not exist on that side.
	 *
	 * @param fromPath path of the original file, null for a new file
	 * @param toPath   path of the resulting file, null for a deleted file
	 * @return `--- ...` and `+++ ...` lines, each terminated by a newline
	 */
	@Nonnull
	public String formatPatchHeader(@Nullable String fromPath, @Nullable String toPath) {
		final String from = fromPath == null ? DEV_NULL : "a/" + fromPath;
		final String to = toPath == null ? DEV_NULL : "b/" + toPath;
		return "--- " + from + "\n+++ " + to + "\n";
	}

	/**
	 * Formats a hunk header. A count of 1 is omitted together with its comma, as GNU diff does.
	 *
	 * @param oldStart       first line in the original file
	 * @param oldCount       number of original lines
	 * @param newStart       first line in the resulting file
	 * @param newCount       number of resulting lines
	 * @param sectionHeading optional heading appended after the closing `@@`
	 * @return the header line terminated by a newline
	 */
	@Nonnull
	public String formatHunkHeader(int oldStart, int oldCount, int newStart, int newCount, @Nullable String sectionHeading) {
		final String before = oldCount == 1 ? String.valueOf(oldStart) : oldStart + "," + oldCount;
		final String after = newCount == 1 ? String.valueOf(newStart) : newStart + "," + newCount;
		final String heading = sectionHeading == null || sectionHeading.isEmpty() ? "" : " " + sectionHeading;
		return "@@ -" + before + " +" + after + " @@" + heading + "\n";
	}

	@Nonnull
	public String formatHunkHeader(int oldStart, int oldCount, int newStart, int newCount) {
		return formatHunkHeader(oldStart, oldCount, newStart, newCount, null);
	}

	/**
	 * Builds a patch applying only the selected changes on top of the index.
	 *
	 * @param path      path of the file
	 * @param status    status of the file; new and untracked files are patched from `/dev/null`
	 * @param diff      the diff of the file
	 * @param selection lines to include
	 * @return the patch text
	 * @throws EmptyPatchException if the selection leaves no change
	 */
	@Nonnull
	public String formatPatch(
		@Nonnull String path,
		@Nonnull AppFileStatus status,
		@Nonnull TextDiff diff,
		@Nonnull DiffSelection selection
	) throws EmptyPatchException {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(status, "status must not be null");
		Objects.requireNonNull(diff, "diff must not be null");
		Objects.requireNonNull(selection, "selection must not be null");

		final boolean newFile = status.isNewFile();
		final StringBuilder patch = new StringBuilder();

		for (final DiffHunk hunk : diff.hunks()) {
			final HunkBuffer buffer = new HunkBuffer();
			final List<DiffLine> lines = hunk.lines();

			for (int i = 0; i < lines.size(); i++) {
				final DiffLine line = lines.get(i);
				final boolean selected = selection.isSelected(hunk.unifiedDiffStart() + i);

				switch (line.type()) {
					case HUNK -> {
						continue;
					}
					case CONTEXT -> buffer.context(line.content());
					case ADD -> {
						if (selected) {
							buffer.add(line.content());
						} else if (newFile) {
							continue;
						} else {
							// stays in the working copy, so it belongs to both sides
							buffer.context(line.content());
						}
					}
					case DELETE -> {
						if (selected) {
							buffer.delete(line.content());
						} else {
							continue;
						}
					}
				}

				if (line.noTrailingNewLine()) {
					buffer.noNewLine();
				}
			}

			if (buffer.hasChanges()) {
				patch.append(formatHunkHeader(hunk.oldStart(), buffer.oldCount, hunk.newStart(), buffer.newCount, null));
				patch.append(buffer.text);
			}
		}

		if (patch.length() == 0) {
			throw new EmptyPatchException(path);
		}

		return formatPatchHeader(newFile ? null : path, path) + patch;
	}

	/**
	 * Builds a patch reverting the selected changes in the working directory.
	 *
	 * @param path      path of the file
	 * @param diff      the diff of the file against the index
	 * @param selection lines to revert
	 * @return the patch text, or empty if nothing is selected
	 */
	@Nonnull
	public Optional<String> formatPatchToDiscardChanges(
		@Nonnull String path,
		@Nonnull TextDiff diff,
		@Nonnull DiffSelection selection
	) {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(diff, "diff must not be null");
		Objects.requireNonNull(selection, "selection must not be null");

		final StringBuilder patch = new StringBuilder();

		for (final DiffHunk hunk : diff.hunks()) {
			final HunkBuffer buffer = new HunkBuffer();
			final List<DiffLine> lines = hunk.lines();

			for (int i = 0; i < lines.size(); i++) {
				final DiffLine line = lines.get(i);
				final boolean selected = selection.isSelected(hunk.unifiedDiffStart() + i);

				switch (line.type()) {
					case HUNK -> {
						continue;
					}
					case CONTEXT -> buffer.context(line.content());
					case ADD -> {
						if (selected) {
							buffer.delete(line.content());
						} else {
							buffer.context(line.content());
						}
					}
					case DELETE -> {
						if (selected) {
							buffer.add(line.content());
						} else {
							// already gone from the working copy
							continue;
						}
					}
				}

				if (line.noTrailingNewLine()) {
					buffer.noNewLine();
				}
			}

			if (buffer.hasChanges()) {
				patch.append(formatHunkHeader(hunk.oldStart(), buffer.oldCount, hunk.newStart(), buffer.newCount, null));
				patch.append(buffer.text);
			}
		}

		if (patch.length() == 0) {
			return Optional.empty();
		}
		return Optional.of(formatPatchHeader(path, path) + patch);
	}

	/**
	 * Accumulates the emitted lines of one hunk and counts them per side.
	 */
	private static final class HunkBuffer {
		private final StringBuilder text = new StringBuilder();
		private int oldCount;
		private int newCount;
		private boolean changes;

		void context(@Nonnull String content) {
			this.text.append(' ').append(content).append('\n');
			this.oldCount++;
			this.newCount++;
		}

		void add(@Nonnull String content) {
			this.text.append('+').append(content).append('\n');
			this.newCount++;
			this.changes = true;
		}

		void delete(@Nonnull String content) {
			this.text.append('-').append(content).append('\n');
			this.oldCount++;
			this.changes = true;
		}

		void noNewLine() {
			this.text.append(DiffLine.NO_NEWLINE_MARKER).append('\n');
		}

		boolean hasChanges() {
			return this.changes;
		}
	}
}
