package io.evitadb.porcelain.diff;

import javax.annotation.Nonnull;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The hunks of the diff of a single text file.
 *
 * @param hunks hunks in file order
 */
public record TextDiff(
	@Nonnull List<DiffHunk> hunks
) {

	public TextDiff {
		Objects.requireNonNull(hunks, "hunks must not be null");
		hunks = List.copyOf(hunks);
	}

	/**
	 * Returns a diff without hunks.
	 *
	 * @return empty diff
	 */
	@Nonnull
	public static TextDiff empty() {
		return new TextDiff(List.of());
	}

	/**
	 * Returns true if the diff has no hunks.
	 *
	 * @return true when there are no changes
	 */
	public boolean isEmpty() {
		return this.hunks.isEmpty();
	}

	/**
	 * Returns the absolute indices of all add and delete lines.
	 *
	 * @return selectable indices in ascending order
	 */
	@Nonnull
	public Set<Integer> selectableLineIndices() {
		final Set<Integer> indices = new LinkedHashSet<>();
		for (final DiffHunk hunk : this.hunks) {
			final List<DiffLine> lines = hunk.lines();
			for (int i = 0; i < lines.size(); i++) {
				if (lines.get(i).isChange()) {
					indices.add(hunk.unifiedDiffStart() + i);
				}
			}
		}
		return indices;
	}
}
