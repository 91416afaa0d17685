package io.evitadb.porcelain.diff;

import io.evitadb.porcelain.status.AppFileStatusKind;
import io.evitadb.porcelain.status.PlainFileStatus;
import io.evitadb.porcelain.status.UntrackedFileStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PatchFormatter should build partial patches")
public class PatchFormatterTest {

	private static final PlainFileStatus MODIFIED = new PlainFileStatus(AppFileStatusKind.MODIFIED, null);

	/**
	 * Indices: 0 header, 1 ` one`, 2 `-two`, 3 `+TWO`, 4 ` three`, 5 `-four`, 6 `+FOUR`.
	 */
	private static final String REPLACEMENTS = """
		@@ -1,4 +1,4 @@
		 one
		-two
		+TWO
		 three
		-four
		+FOUR
		""";

	private PatchFormatter formatter;
	private UnifiedDiffParser parser;

	@BeforeEach
	void setUp() {
		this.formatter = new PatchFormatter();
		this.parser = new UnifiedDiffParser();
	}

	@Test
	@DisplayName("omits counts of one in hunk headers")
	void shouldFormatHunkHeader() {
		assertEquals("@@ -10 +10,3 @@\n", this.formatter.formatHunkHeader(10, 1, 10, 3));
		assertEquals("@@ -0,0 +1 @@\n", this.formatter.formatHunkHeader(0, 0, 1, 1));
		assertEquals("@@ -1,2 +1,2 @@ class A\n", this.formatter.formatHunkHeader(1, 2, 1, 2, "class A"));
	}

	@Test
	@DisplayName("uses /dev/null for a missing side")
	void shouldFormatPatchHeader() {
		assertEquals("--- /dev/null\n+++ b/new.txt\n", this.formatter.formatPatchHeader(null, "new.txt"));
		assertEquals("--- a/gone.txt\n+++ /dev/null\n", this.formatter.formatPatchHeader("gone.txt", null));
		assertEquals("--- a/x.txt\n+++ b/x.txt\n", this.formatter.formatPatchHeader("x.txt", "x.txt"));
	}

	@Test
	@DisplayName("staging everything reproduces the hunk")
	void shouldReproduceHunkWhenAllSelected() throws Exception {
		final TextDiff diff = this.parser.parse(REPLACEMENTS);

		final String patch = this.formatter.formatPatch("file.txt", MODIFIED, diff, DiffSelection.all(diff));

		assertEquals("--- a/file.txt\n+++ b/file.txt\n" + REPLACEMENTS, patch);
	}

	@Test
	@DisplayName("stages a single replacement")
	void shouldStageSingleReplacement() throws Exception {
		final TextDiff diff = this.parser.parse(REPLACEMENTS);
		final DiffSelection selection = DiffSelection.none(diff).withRangeSelection(2, 2, true);

		final String patch = this.formatter.formatPatch("file.txt", MODIFIED, diff, selection);

		assertEquals("""
			--- a/file.txt
			+++ b/file.txt
			@@ -1,4 +1,4 @@
			 one
			-two
			+TWO
			 three
			 FOUR
			""", patch);
	}

	@Test
	@DisplayName("stages one of two additions")
	void shouldStageOneAddition() throws Exception {
		final TextDiff diff = this.parser.parse("@@ -1,2 +1,4 @@\n a\n+b\n c\n+d\n");
		final DiffSelection selection = DiffSelection.none(diff).withLineSelection(2, true);

		final String patch = this.formatter.formatPatch("file.txt", MODIFIED, diff, selection);

		assertEquals("--- a/file.txt\n+++ b/file.txt\n@@ -1,3 +1,4 @@\n a\n+b\n c\n d\n", patch);
	}

	@Test
	@DisplayName("stages one of two deletions")
	void shouldStageOneDeletion() throws Exception {
		final TextDiff diff = this.parser.parse("@@ -1,3 +1 @@\n a\n-b\n-c\n");
		final DiffSelection selection = DiffSelection.none(diff).withLineSelection(2, true);

		final String patch = this.formatter.formatPatch("file.txt", MODIFIED, diff, selection);

		assertEquals("--- a/file.txt\n+++ b/file.txt\n@@ -1,2 +1 @@\n a\n-b\n", patch);
	}

	@Test
	@DisplayName("patches new files from /dev/null and drops unselected lines")
	void shouldPatchNewFileFromDevNull() throws Exception {
		final TextDiff diff = this.parser.parse("@@ -0,0 +1,2 @@\n+x\n+y\n");
		final DiffSelection selection = DiffSelection.none(diff).withLineSelection(1, true);

		final String patch = this.formatter.formatPatch("new.txt", new UntrackedFileStatus(null), diff, selection);

		assertEquals("--- /dev/null\n+++ b/new.txt\n@@ -0,0 +1 @@\n+x\n", patch);
	}

	@Test
	@DisplayName("omits hunks left without changes")
	void shouldOmitHunksWithoutChanges() throws Exception {
		final TextDiff diff = this.parser.parse("""
			@@ -1,2 +1,2 @@
			-old first
			+new first
			 unchanged
			@@ -10,2 +10,2 @@
			 context
			-old second
			+new second
			""");
		final DiffSelection selection = DiffSelection.none(diff).withRangeSelection(1, 2, true);

		final String patch = this.formatter.formatPatch("f.txt", MODIFIED, diff, selection);

		assertEquals("--- a/f.txt\n+++ b/f.txt\n@@ -1,2 +1,2 @@\n-old first\n+new first\n unchanged\n", patch);
	}

	@Test
	@DisplayName("keeps no newline markers after their lines")
	void shouldKeepNoNewlineMarkers() throws Exception {
		final String hunk = "@@ -1 +1 @@\n-old\n" + DiffLine.NO_NEWLINE_MARKER + "\n+new\n" + DiffLine.NO_NEWLINE_MARKER + "\n";
		final TextDiff diff = this.parser.parse(hunk);

		final String patch = this.formatter.formatPatch("f.txt", MODIFIED, diff, DiffSelection.all(diff));

		assertEquals("--- a/f.txt\n+++ b/f.txt\n" + hunk, patch);
	}

	@Test
	@DisplayName("fails when nothing is selected")
	void shouldFailOnEmptySelection() throws Exception {
		final TextDiff diff = this.parser.parse(REPLACEMENTS);

		final EmptyPatchException exception = assertThrows(
			EmptyPatchException.class,
			() -> this.formatter.formatPatch("file.txt", MODIFIED, diff, DiffSelection.none(diff))
		);

		assertEquals("file.txt", exception.getPath());
		assertThrows(
			EmptyPatchException.class,
			() -> this.formatter.formatPatch("file.txt", MODIFIED, TextDiff.empty(), DiffSelection.of(Set.of()))
		);
	}

	@Test
	@DisplayName("discard reverses a selected addition")
	void shouldDiscardSelectedAddition() throws Exception {
		final TextDiff diff = this.parser.parse(REPLACEMENTS);
		final DiffSelection selection = DiffSelection.none(diff).withLineSelection(3, true);

		final Optional<String> patch = this.formatter.formatPatchToDiscardChanges("file.txt", diff, selection);

		assertEquals(Optional.of("""
			--- a/file.txt
			+++ b/file.txt
			@@ -1,4 +1,3 @@
			 one
			-TWO
			 three
			 FOUR
			"""), patch);
	}

	@Test
	@DisplayName("discard restores a selected deletion")
	void shouldDiscardSelectedDeletion() throws Exception {
		final TextDiff diff = this.parser.parse("@@ -1,2 +1 @@\n a\n-b\n");

		final Optional<String> patch = this.formatter.formatPatchToDiscardChanges("f.txt", diff, DiffSelection.all(diff));

		assertEquals(Optional.of("--- a/f.txt\n+++ b/f.txt\n@@ -1 +1,2 @@\n a\n+b\n"), patch);
	}

	@Test
	@DisplayName("discard with nothing selected yields no patch")
	void shouldYieldNothingWhenNothingToDiscard() throws Exception {
		final TextDiff diff = this.parser.parse(REPLACEMENTS);

		assertTrue(this.formatter.formatPatchToDiscardChanges("file.txt", diff, DiffSelection.none(diff)).isEmpty());
	}

	@Test
	@DisplayName("writes carriage returns of CRLF files back unchanged")
	void shouldKeepCarriageReturnsInPatch() throws Exception {
		final String hunk = "@@ -1,2 +1,2 @@\n keep\r\n-a\r\n+b\r\n";
		final TextDiff diff = this.parser.parse(hunk);

		final String patch = this.formatter.formatPatch("f.txt", MODIFIED, diff, DiffSelection.all(diff));

		assertEquals("--- a/f.txt\n+++ b/f.txt\n" + hunk, patch);
	}

	@Test
	@DisplayName("keeps a bare carriage return inside a staged line")
	void shouldKeepBareCarriageReturnInPatch() throws Exception {
		final String hunk = "@@ -1 +1 @@\n-a\n+x\ry\n";
		final TextDiff diff = this.parser.parse(hunk);

		final String patch = this.formatter.formatPatch("f.txt", MODIFIED, diff, DiffSelection.all(diff));

		assertEquals("--- a/f.txt\n+++ b/f.txt\n" + hunk, patch);
	}
}
