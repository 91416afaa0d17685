package io.evitadb.porcelain.diff;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the `git diff` output of a single file into a {@link TextDiff}.
 *
 * Unified diff format:
 * ```
 * diff --git a/file b/file
 * index 83db48f..bf269f4 100644
 * --- a/file
 * +++ b/file
 * @@ -startLine,count +startLine,count @@ section heading
 *  context line
 * -removed line
 * +added line
 * ```
 *
 * Absolute line indices start at 0 with the first hunk header and count every hunk header and every
 * content line. `\ No newline at end of file` markers are folded into the preceding line and take no index.
 *
 * Lines are split on `\n` only. A carriage return stays part of the line content, so diffs of files with
 * CRLF line endings or stray CR characters survive a round trip through {@link PatchFormatter}.
 */
public final class UnifiedDiffParser {

	/**
	 * Format: @@ -oldStart,oldCount +newStart,newCount @@ heading
	 * Count is optional and defaults to 1 if omitted.
	 */
	private static final Pattern HUNK_HEADER_PATTERN = Pattern.compile(
		"^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@ ?(.*)$"
	);

	private static final String[] PREAMBLE_PREFIXES = {
		"diff --git ", "index ", "--- ", "+++ ", "new file mode ", "deleted file mode ", "old mode ", "new mode ",
		"similarity index ", "dissimilarity index ", "rename from ", "rename to ", "copy from ", "copy to "
	};

	/**
	 * Parses a unified diff.
	 *
	 * @param diffText raw output of `git diff` for one file
	 * @return the parsed diff, empty for blank input
	 * @throws DiffParseException if a line has an unexpected prefix or a hunk header is malformed
	 */
	@Nonnull
	public TextDiff parse(@Nonnull String diffText) throws DiffParseException {
		Objects.requireNonNull(diffText, "diffText must not be null");

		if (diffText.isBlank()) {
			return TextDiff.empty();
		}

		final List<String> lines = splitLines(diffText);
		final List<DiffHunk> hunks = new ArrayList<>();

		int lineIndex = 0;
		while (lineIndex < lines.size() && isPreamble(lines.get(lineIndex))) {
			lineIndex++;
		}

		int absoluteIndex = 0;
		while (lineIndex < lines.size()) {
			final String line = lines.get(lineIndex);
			if (line.isEmpty()) {
				lineIndex++;
				continue;
			}

			final Matcher hunkMatcher = HUNK_HEADER_PATTERN.matcher(stripCarriageReturn(line));
			if (!hunkMatcher.matches()) {
				throw new DiffParseException(
					"Expected hunk header (@@ ... @@) but found: '" + truncate(line, 40) + "'",
					diffText,
					lineIndex + 1
				);
			}

			final ParsedHunk parsed = parseHunk(lines, lineIndex, hunkMatcher, absoluteIndex, diffText);
			hunks.add(parsed.hunk());
			absoluteIndex += parsed.hunk().lines().size();
			lineIndex = parsed.nextLineIndex();
		}

		return new TextDiff(hunks);
	}

	@Nonnull
	private ParsedHunk parseHunk(
		@Nonnull List<String> lines,
		int hunkStartIndex,
		@Nonnull Matcher hunkMatcher,
		int unifiedDiffStart,
		@Nonnull String rawDiff
	) throws DiffParseException {
		final int oldStart;
		final int oldCount;
		final int newStart;
		final int newCount;
		try {
			oldStart = Integer.parseInt(hunkMatcher.group(1));
			oldCount = hunkMatcher.group(2) != null ? Integer.parseInt(hunkMatcher.group(2)) : 1;
			newStart = Integer.parseInt(hunkMatcher.group(3));
			newCount = hunkMatcher.group(4) != null ? Integer.parseInt(hunkMatcher.group(4)) : 1;
		} catch (NumberFormatException e) {
			throw new DiffParseException("Hunk range out of bounds", rawDiff, hunkStartIndex + 1, e);
		}
		final String heading = hunkMatcher.group(5).isEmpty() ? null : hunkMatcher.group(5);

		final List<DiffLine> diffLines = new ArrayList<>();
		diffLines.add(DiffLine.hunk(stripCarriageReturn(lines.get(hunkStartIndex))));

		int lineIndex = hunkStartIndex + 1;
		int oldLinesRead = 0;
		int newLinesRead = 0;

		while (lineIndex < lines.size() && (oldLinesRead < oldCount || newLinesRead < newCount)) {
			final String line = lines.get(lineIndex);

			if (line.startsWith("\\")) {
				markNoTrailingNewLine(diffLines);
				lineIndex++;
				continue;
			}
			if (HUNK_HEADER_PATTERN.matcher(stripCarriageReturn(line)).matches()) {
				throw new DiffParseException(
					"Hunk ends early, expected " + oldCount + " old and " + newCount + " new lines",
					rawDiff,
					lineIndex + 1
				);
			}

			// some tools strip the single space of empty context lines
			if (line.isEmpty()) {
				diffLines.add(DiffLine.context(""));
				oldLinesRead++;
				newLinesRead++;
				lineIndex++;
				continue;
			}

			final char prefix = line.charAt(0);
			final String content = line.substring(1);

			switch (prefix) {
				case ' ' -> {
					diffLines.add(DiffLine.context(content));
					oldLinesRead++;
					newLinesRead++;
				}
				case '+' -> {
					diffLines.add(DiffLine.add(content));
					newLinesRead++;
				}
				case '-' -> {
					diffLines.add(DiffLine.delete(content));
					oldLinesRead++;
				}
				default -> throw new DiffParseException(
					"Invalid line prefix '" + prefix + "' - expected ' ', '+', or '-'",
					rawDiff,
					lineIndex + 1
				);
			}

			lineIndex++;
		}

		// a marker may follow the last line of the hunk
		if (lineIndex < lines.size() && lines.get(lineIndex).startsWith("\\")) {
			markNoTrailingNewLine(diffLines);
			lineIndex++;
		}

		final DiffHunk hunk = new DiffHunk(oldStart, oldCount, newStart, newCount, heading, unifiedDiffStart, diffLines);
		return new ParsedHunk(hunk, lineIndex);
	}

	private static void markNoTrailingNewLine(@Nonnull List<DiffLine> diffLines) {
		final int last = diffLines.size() - 1;
		if (diffLines.get(last).type() != DiffLineType.HUNK) {
			diffLines.set(last, diffLines.get(last).withNoTrailingNewLine());
		}
	}

	@Nonnull
	private static List<String> splitLines(@Nonnull String text) {
		final List<String> lines = new ArrayList<>(List.of(text.split("\n", -1)));
		// a terminating newline leaves one empty element behind
		if (lines.get(lines.size() - 1).isEmpty()) {
			lines.remove(lines.size() - 1);
		}
		return lines;
	}

	@Nonnull
	private static String stripCarriageReturn(@Nonnull String line) {
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}

	private static boolean isPreamble(@Nonnull String line) {
		for (final String prefix : PREAMBLE_PREFIXES) {
			if (line.startsWith(prefix)) {
				return true;
			}
		}
		return line.startsWith("Binary files ");
	}

	@Nonnull
	private static String truncate(@Nonnull String s, int maxLen) {
		if (s.length() <= maxLen) {
			return s;
		}
		return s.substring(0, maxLen - 3) + "...";
	}

	private record ParsedHunk(@Nonnull DiffHunk hunk, int nextLineIndex) {
	}
}
