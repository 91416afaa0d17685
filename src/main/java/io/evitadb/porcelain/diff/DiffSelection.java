package io.evitadb.porcelain.diff;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable record of which changed lines of a diff are included in an operation.
 *
 * Only selectable lines (adds and deletes) can be selected. Lines without an explicit entry are
 * excluded. All updates return a new instance.
 */
public final class DiffSelection {

	@Nonnull
	private final Set<Integer> selectableLines;
	@Nonnull
	private final Map<Integer, Boolean> selectedLines;

	private DiffSelection(@Nonnull Set<Integer> selectableLines, @Nonnull Map<Integer, Boolean> selectedLines) {
		this.selectableLines = selectableLines;
		this.selectedLines = selectedLines;
	}

	/**
	 * Creates a selection over the given selectable lines with nothing selected.
	 *
	 * @param selectableLines absolute indices of add and delete lines
	 * @return empty selection
	 */
	@Nonnull
	public static DiffSelection of(@Nonnull Set<Integer> selectableLines) {
		Objects.requireNonNull(selectableLines, "selectableLines must not be null");
		return new DiffSelection(Set.copyOf(selectableLines), Map.of());
	}

	/**
	 * Creates a selection including every change of the diff.
	 *
	 * @param diff the diff
	 * @return full selection
	 */
	@Nonnull
	public static DiffSelection all(@Nonnull TextDiff diff) {
		return of(diff.selectableLineIndices()).withSelectAll();
	}

	/**
	 * Creates a selection including no change of the diff.
	 *
	 * @param diff the diff
	 * @return empty selection
	 */
	@Nonnull
	public static DiffSelection none(@Nonnull TextDiff diff) {
		return of(diff.selectableLineIndices());
	}

	public boolean isSelectable(int lineIndex) {
		return this.selectableLines.contains(lineIndex);
	}

	public boolean isSelected(int lineIndex) {
		return Boolean.TRUE.equals(this.selectedLines.get(lineIndex));
	}

	/**
	 * Returns true if every selectable line is selected. Vacuously true without selectable lines.
	 *
	 * @return true when all changes are included
	 */
	public boolean areAllSelected() {
		for (final Integer line : this.selectableLines) {
			if (!isSelected(line)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Returns true if no selectable line is selected.
	 *
	 * @return true when no change is included
	 */
	public boolean areNoneSelected() {
		for (final Integer line : this.selectableLines) {
			if (isSelected(line)) {
				return false;
			}
		}
		return true;
	}

	@Nonnull
	public DiffSelectionType getSelectionType() {
		if (areNoneSelected()) {
			return DiffSelectionType.NONE;
		}
		return areAllSelected() ? DiffSelectionType.ALL : DiffSelectionType.PARTIAL;
	}

	/**
	 * Returns a copy with a single line included or excluded. Lines that are not selectable are ignored.
	 *
	 * @param lineIndex absolute line index
	 * @param selected  new state of the line
	 * @return updated selection
	 */
	@Nonnull
	public DiffSelection withLineSelection(int lineIndex, boolean selected) {
		return withRangeSelection(lineIndex, 1, selected);
	}

	/**
	 * Returns a copy with a range of lines included or excluded. Lines that are not selectable are ignored.
	 *
	 * @param from     first absolute line index
	 * @param length   number of lines
	 * @param selected new state of the lines
	 * @return updated selection
	 */
	@Nonnull
	public DiffSelection withRangeSelection(int from, int length, boolean selected) {
		if (length < 0) {
			throw new IllegalArgumentException("length must not be negative: " + length);
		}
		final Map<Integer, Boolean> updated = new HashMap<>(this.selectedLines);
		for (int i = from; i < from + length; i++) {
			if (this.selectableLines.contains(i)) {
				updated.put(i, selected);
			}
		}
		return new DiffSelection(this.selectableLines, Map.copyOf(updated));
	}

	@Nonnull
	public DiffSelection withSelectAll() {
		final Map<Integer, Boolean> updated = new HashMap<>();
		for (final Integer line : this.selectableLines) {
			updated.put(line, Boolean.TRUE);
		}
		return new DiffSelection(this.selectableLines, Map.copyOf(updated));
	}

	@Nonnull
	public DiffSelection withSelectNone() {
		return new DiffSelection(this.selectableLines, Map.of());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof DiffSelection that)) {
			return false;
		}
		for (final Integer line : this.selectableLines) {
			if (isSelected(line) != that.isSelected(line)) {
				return false;
			}
		}
		return this.selectableLines.equals(that.selectableLines);
	}

	@Override
	public int hashCode() {
		int hash = this.selectableLines.hashCode();
		for (final Integer line : this.selectableLines) {
			if (isSelected(line)) {
				hash = 31 * hash + line;
			}
		}
		return hash;
	}

	@Override
	public String toString() {
		return "DiffSelection{" + getSelectionType() + ", selectable=" + this.selectableLines.size() + "}";
	}
}
