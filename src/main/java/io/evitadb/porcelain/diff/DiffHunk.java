package io.evitadb.porcelain.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Represents a single hunk in a unified diff.
 *
 * The first line of {@link #lines()} is normally the {@link DiffLineType#HUNK} header line. The absolute
 * index of the line at position `i` is `unifiedDiffStart + i`; selections refer to lines by that index.
 *
 * @param oldStart         starting line number in the original file (1-based, 0 for an empty file)
 * @param oldCount         number of lines from the original file in this hunk
 * @param newStart         starting line number in the new file (1-based, 0 for a deleted file)
 * @param newCount         number of lines in the new file after applying changes
 * @param sectionHeading   text after the closing `@@`, null when absent
 * @param unifiedDiffStart absolute index of the first line of this hunk
 * @param lines            the lines of the hunk
 */
public record DiffHunk(
	int oldStart,
	int oldCount,
	int newStart,
	int newCount,
	@Nullable String sectionHeading,
	int unifiedDiffStart,
	@Nonnull List<DiffLine> lines
) {

	public DiffHunk {
		if (oldStart < 0) {
			throw new IllegalArgumentException("oldStart must be non-negative: " + oldStart);
		}
		if (oldCount < 0) {
			throw new IllegalArgumentException("oldCount must be non-negative: " + oldCount);
		}
		if (newStart < 0) {
			throw new IllegalArgumentException("newStart must be non-negative: " + newStart);
		}
		if (newCount < 0) {
			throw new IllegalArgumentException("newCount must be non-negative: " + newCount);
		}
		if (unifiedDiffStart < 0) {
			throw new IllegalArgumentException("unifiedDiffStart must be non-negative: " + unifiedDiffStart);
		}
		Objects.requireNonNull(lines, "lines must not be null");
		lines = List.copyOf(lines);
	}

	/**
	 * Returns the absolute index of the last line of this hunk.
	 *
	 * @return absolute index, or {@code unifiedDiffStart - 1} for a hunk without lines
	 */
	public int unifiedDiffEnd() {
		return this.unifiedDiffStart + this.lines.size() - 1;
	}

	/**
	 * Returns the number of lines added by this hunk.
	 *
	 * @return count of ADD lines
	 */
	public int linesAdded() {
		return (int) this.lines.stream()
			.filter(line -> line.type() == DiffLineType.ADD)
			.count();
	}

	/**
	 * Returns the number of lines deleted by this hunk.
	 *
	 * @return count of DELETE lines
	 */
	public int linesDeleted() {
		return (int) this.lines.stream()
			.filter(line -> line.type() == DiffLineType.DELETE)
			.count();
	}
}
