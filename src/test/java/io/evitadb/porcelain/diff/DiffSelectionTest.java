package io.evitadb.porcelain.diff;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DiffSelection should track selected changes")
public class DiffSelectionTest {

	private TextDiff diff;

	@BeforeEach
	void setUp() {
		// indices 0 header, 1 context, 2 delete, 3 add, 4 context
		this.diff = new TextDiff(List.of(new DiffHunk(1, 3, 1, 3, null, 0, List.of(
			DiffLine.hunk("@@ -1,3 +1,3 @@"),
			DiffLine.context("a"),
			DiffLine.delete("b"),
			DiffLine.add("B"),
			DiffLine.context("c")
		))));
	}

	@Test
	@DisplayName("only changes are selectable")
	void shouldAllowOnlyChanges() {
		final DiffSelection selection = DiffSelection.none(this.diff);

		assertEquals(Set.of(2, 3), this.diff.selectableLineIndices());
		assertFalse(selection.isSelectable(0));
		assertFalse(selection.isSelectable(1));
		assertTrue(selection.isSelectable(2));
		assertTrue(selection.isSelectable(3));
	}

	@Test
	@DisplayName("reports none, partial and all")
	void shouldReportSelectionType() {
		final DiffSelection none = DiffSelection.none(this.diff);
		final DiffSelection partial = none.withLineSelection(2, true);
		final DiffSelection all = partial.withLineSelection(3, true);

		assertEquals(DiffSelectionType.NONE, none.getSelectionType());
		assertEquals(DiffSelectionType.PARTIAL, partial.getSelectionType());
		assertEquals(DiffSelectionType.ALL, all.getSelectionType());
		assertEquals(DiffSelection.all(this.diff), all);
		assertEquals(DiffSelection.all(this.diff).hashCode(), all.hashCode());
	}

	@Test
	@DisplayName("ignores lines that are not selectable")
	void shouldIgnoreNonSelectableLines() {
		final DiffSelection selection = DiffSelection.none(this.diff).withLineSelection(1, true);

		assertFalse(selection.isSelected(1));
		assertEquals(DiffSelectionType.NONE, selection.getSelectionType());
	}

	@Test
	@DisplayName("range selection covers only selectable lines")
	void shouldSelectRange() {
		final DiffSelection selection = DiffSelection.none(this.diff).withRangeSelection(0, 5, true);

		assertTrue(selection.areAllSelected());
		assertEquals(DiffSelection.none(this.diff), selection.withRangeSelection(0, 5, false));
		assertEquals(DiffSelection.none(this.diff), selection.withSelectNone());
		assertThrows(IllegalArgumentException.class, () -> selection.withRangeSelection(0, -1, true));
	}

	@Test
	@DisplayName("updates return new instances")
	void shouldBeImmutable() {
		final DiffSelection original = DiffSelection.none(this.diff);

		final DiffSelection updated = original.withSelectAll();

		assertTrue(original.areNoneSelected());
		assertTrue(updated.areAllSelected());
		assertNotEquals(original, updated);
	}

	@Test
	@DisplayName("selection over an empty diff selects nothing")
	void shouldHandleEmptyDiff() {
		final DiffSelection selection = DiffSelection.all(TextDiff.empty());

		assertTrue(selection.areAllSelected());
		assertTrue(selection.areNoneSelected());
		assertEquals(DiffSelectionType.NONE, selection.getSelectionType());
	}
}
