package io.evitadb.porcelain.status;

import io.evitadb.porcelain.status.StatusEntry.StatusEntryKind;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@DisplayName("PorcelainStatusParser should decode porcelain v2 status")
public class PorcelainStatusParserTest {

	private Log log;
	private PorcelainStatusParser parser;

	@BeforeEach
	void setUp() {
		this.log = mock(Log.class);
		this.parser = new PorcelainStatusParser(this.log);
	}

	@Test
	@DisplayName("decodes changed entry")
	void shouldDecodeChangedEntry() {
		final List<StatusItem> items = this.parser.parse("1 .M N... 100644 100644 100644 aaa bbb file.txt\0");

		assertEquals(1, items.size());
		final StatusEntry entry = assertInstanceOf(StatusEntry.class, items.get(0));
		assertEquals(StatusEntryKind.CHANGED, entry.kind());
		assertEquals("file.txt", entry.path());
		assertEquals(".M", entry.statusCode());
		assertEquals("N...", entry.submoduleStatusCode());
		assertNull(entry.oldPath());

		final OrdinaryEntry mapped = assertInstanceOf(
			OrdinaryEntry.class, new GitStatusMapper().mapStatus(entry.statusCode(), entry.submoduleStatusCode())
		);
		assertEquals(OrdinaryEntry.Type.MODIFIED, mapped.type());
		assertEquals(GitStatusEntry.UNCHANGED, mapped.index());
		assertEquals(GitStatusEntry.MODIFIED, mapped.workingTree());
		verifyNoInteractions(this.log);
	}

	@Test
	@DisplayName("keeps headers and spaces in paths")
	void shouldKeepHeadersAndPathsWithSpaces() {
		final String output = "# branch.oid 1a2b3c\0# branch.head main\0"
			+ "1 M. N... 100644 100644 100644 aaa bbb docs/read me.md\0";

		final List<StatusItem> items = this.parser.parse(output);

		assertEquals(
			List.of(new StatusHeader("branch.oid 1a2b3c"), new StatusHeader("branch.head main")),
			PorcelainStatusParser.headers(items)
		);
		assertEquals("docs/read me.md", PorcelainStatusParser.entries(items).get(0).path());
	}

	@Test
	@DisplayName("consumes the original path token of a rename")
	void shouldConsumeOriginalPathOfRename() {
		final String output = "2 R. N... 100644 100644 100644 aaa aaa R100 new-name.txt\0old-name.txt\0"
			+ "? untracked.txt\0";

		final List<StatusEntry> entries = PorcelainStatusParser.entries(this.parser.parse(output));

		assertEquals(2, entries.size());
		assertEquals(StatusEntryKind.RENAMED_OR_COPIED, entries.get(0).kind());
		assertEquals("new-name.txt", entries.get(0).path());
		assertEquals("old-name.txt", entries.get(0).oldPath());
		assertEquals(StatusEntryKind.UNTRACKED, entries.get(1).kind());
		assertEquals("untracked.txt", entries.get(1).path());
	}

	@Test
	@DisplayName("drops rename without original path")
	void shouldDropRenameWithoutOriginalPath() {
		final List<StatusItem> items = this.parser.parse("2 R. N... 100644 100644 100644 aaa aaa R100 new-name.txt\0");

		assertTrue(items.isEmpty());
		verify(this.log).warn(argThat((CharSequence message) -> message.toString().contains("without original path")));
	}

	@Test
	@DisplayName("decodes unmerged and untracked entries")
	void shouldDecodeUnmergedAndUntrackedEntries() {
		final String output = "u UU N... 100644 100644 100644 100644 aaa bbb ccc conflict.txt\0? new.txt\0";

		final List<StatusEntry> entries = PorcelainStatusParser.entries(this.parser.parse(output));

		assertEquals(2, entries.size());
		assertEquals(StatusEntryKind.UNMERGED, entries.get(0).kind());
		assertEquals("UU", entries.get(0).statusCode());
		assertEquals("conflict.txt", entries.get(0).path());
		assertEquals(new StatusEntry(StatusEntryKind.UNTRACKED, "new.txt", "??", "????", null), entries.get(1));
	}

	@Test
	@DisplayName("drops ignored entries silently")
	void shouldDropIgnoredEntries() {
		final List<StatusItem> items = this.parser.parse("! build/\0? kept.txt\0");

		assertEquals(1, items.size());
		verifyNoInteractions(this.log);
	}

	@Test
	@DisplayName("skips malformed token and keeps decoding")
	void shouldSkipMalformedToken() {
		final String output = "1 .M N... 100644 garbage\0" + "1 A. N... 000000 100644 100644 000 abc added.txt\0";

		final List<StatusEntry> entries = PorcelainStatusParser.entries(this.parser.parse(output));

		assertEquals(1, entries.size());
		assertEquals("added.txt", entries.get(0).path());
		verify(this.log, times(1)).warn(any(CharSequence.class));
	}

	@Test
	@DisplayName("warns about unknown record types")
	void shouldWarnAboutUnknownRecordType() {
		assertTrue(this.parser.parse("Z something\0").isEmpty());
		verify(this.log).warn(argThat((CharSequence message) -> message.toString().contains("Unknown status record type")));
	}

	@Test
	@DisplayName("returns nothing for empty output")
	void shouldReturnNothingForEmptyOutput() {
		assertTrue(this.parser.parse("").isEmpty());
		assertTrue(this.parser.parse("\0\0").isEmpty());
	}
}
